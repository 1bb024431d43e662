package work.lcod.pyson.codec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.pyson.error.PysonError;
import work.lcod.pyson.error.PysonException;
import work.lcod.pyson.model.NamedValue;
import work.lcod.pyson.model.PysonValue;

/**
 * Parses whole pyson documents into ordered lists or name-keyed maps, and encodes them back.
 *
 * <p>Lines are separated by {@code \n}; empty lines are skipped. Names must be unique across the
 * document.
 */
public final class DocumentCodec {
    static final String LINE_SEPARATOR = "\n";

    private DocumentCodec() {}

    public static List<NamedValue> parseDocument(String text) {
        Objects.requireNonNull(text, "text");
        String[] lines = text.split(LINE_SEPARATOR, -1);
        List<NamedValue> entries = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) {
                continue;
            }
            try {
                entries.add(EntryCodec.parse(line));
            } catch (PysonException ex) {
                int lineNumber = i + 1;
                throw new PysonException(
                    PysonError.INVALID_ENTRY,
                    "Line " + lineNumber + ": " + ex.getMessage(),
                    Map.of("line", lineNumber),
                    ex
                );
            }
        }
        requireUniqueNames(entries);
        return Collections.unmodifiableList(entries);
    }

    public static Map<String, PysonValue> parseDocumentAsMap(String text) {
        Map<String, PysonValue> map = new LinkedHashMap<>();
        for (NamedValue entry : parseDocument(text)) {
            map.put(entry.name(), entry.value());
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Fails with {@link PysonError#DUPLICATE_NAME} on the first name that occurs twice.
     */
    public static void requireUniqueNames(Collection<NamedValue> entries) {
        Set<String> seen = new HashSet<>();
        for (NamedValue entry : entries) {
            if (!seen.add(entry.name())) {
                throw new PysonException(
                    PysonError.DUPLICATE_NAME,
                    "Duplicate name found in pyson document: " + entry.name(),
                    entry.name()
                );
            }
        }
    }

    public static String encode(Collection<NamedValue> entries) {
        Objects.requireNonNull(entries, "entries");
        requireUniqueNames(entries);
        return entries.stream()
            .map(EntryCodec::encode)
            .collect(Collectors.joining(LINE_SEPARATOR));
    }

    public static String encode(Map<String, PysonValue> values) {
        Objects.requireNonNull(values, "values");
        List<NamedValue> entries = new ArrayList<>(values.size());
        values.forEach((name, value) -> entries.add(NamedValue.of(name, value)));
        return encode(entries);
    }
}
