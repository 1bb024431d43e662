package work.lcod.pyson.codec;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;
import work.lcod.pyson.error.PysonError;
import work.lcod.pyson.error.PysonException;
import work.lcod.pyson.model.NamedValue;
import work.lcod.pyson.model.PysonType;
import work.lcod.pyson.model.PysonValue;

/**
 * Converts a single pyson line ({@code name:type:content}) to and from a {@link NamedValue}.
 *
 * <p>Only the first two colons are structural; the content keeps any further colons.
 */
public final class EntryCodec {
    private static final Pattern INT_LITERAL = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT_LITERAL =
        Pattern.compile("[+-]?(NaN|Infinity|(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?)");
    private static final String LIST_SPLITTER = Pattern.quote(PysonValue.LIST_DELIMITER);

    private EntryCodec() {}

    public static NamedValue parse(String line) {
        Objects.requireNonNull(line, "line");
        if (line.indexOf('\n') >= 0) {
            throw new PysonException(PysonError.EMBEDDED_NEWLINE, "Pyson entries cannot contain newlines", line);
        }
        int nameEnd = line.indexOf(':');
        int typeEnd = nameEnd < 0 ? -1 : line.indexOf(':', nameEnd + 1);
        if (typeEnd < 0) {
            throw new PysonException(
                PysonError.MALFORMED_ENTRY,
                "Pyson entries must have the form name:type:value, got: " + line,
                line
            );
        }
        String name = line.substring(0, nameEnd);
        PysonType type = PysonType.fromTag(line.substring(nameEnd + 1, typeEnd));
        String raw = line.substring(typeEnd + 1);
        return NamedValue.of(name, parseValue(type, raw));
    }

    public static String encode(NamedValue namedValue) {
        Objects.requireNonNull(namedValue, "namedValue");
        return namedValue.encode();
    }

    static PysonValue parseValue(PysonType type, String raw) {
        return switch (type) {
            case INT -> PysonValue.of(parseInt(raw));
            case FLOAT -> PysonValue.of(parseFloat(raw));
            case STR -> PysonValue.of(raw);
            case LIST -> PysonValue.of(Arrays.asList(raw.split(LIST_SPLITTER, -1)));
        };
    }

    private static long parseInt(String raw) {
        if (!INT_LITERAL.matcher(raw).matches()) {
            throw new PysonException(PysonError.INVALID_NUMBER, "Invalid pyson int: " + raw, raw);
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new PysonException(PysonError.INVALID_NUMBER, "Invalid pyson int: " + raw, raw, ex);
        }
    }

    private static double parseFloat(String raw) {
        if (!FLOAT_LITERAL.matcher(raw).matches()) {
            throw new PysonException(PysonError.INVALID_NUMBER, "Invalid pyson float: " + raw, raw);
        }
        return Double.parseDouble(raw);
    }
}
