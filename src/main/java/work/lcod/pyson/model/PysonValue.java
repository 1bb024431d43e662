package work.lcod.pyson.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.lcod.pyson.error.PysonError;
import work.lcod.pyson.error.PysonException;

/**
 * A typed pyson value. The variant fixes both the {@link PysonType} tag and the payload shape.
 *
 * <p>Values are immutable. Build them through the {@code of(...)} factories, which classify the
 * payload: integral numbers become {@link IntValue}, other numbers {@link FloatValue}, text
 * {@link StrValue} and string sequences {@link ListValue}.
 */
public sealed interface PysonValue permits PysonValue.IntValue, PysonValue.FloatValue, PysonValue.StrValue, PysonValue.ListValue {
    /** Separator between list elements in the wire format. An element containing it does not round-trip. */
    String LIST_DELIMITER = "(*)";

    PysonType type();

    /** Boxed payload: {@code Long}, {@code Double}, {@code String} or {@code List<String>}. */
    Object payload();

    /** Bare wire text of the payload, without the type tag. */
    String content();

    /**
     * Pyson string of the bare value: {@code type:content} for scalars, the joined elements for
     * lists (the entry encoder adds the {@code list} tag).
     */
    default String encode() {
        return type() == PysonType.LIST ? content() : type().tag() + ":" + content();
    }

    default boolean isInt() {
        return type() == PysonType.INT;
    }

    default boolean isFloat() {
        return type() == PysonType.FLOAT;
    }

    default boolean isStr() {
        return type() == PysonType.STR;
    }

    default boolean isList() {
        return type() == PysonType.LIST;
    }

    static PysonValue of(long value) {
        return new IntValue(value);
    }

    static PysonValue of(double value) {
        if (isLongIntegral(value)) {
            return new IntValue((long) value);
        }
        return new FloatValue(value);
    }

    static PysonValue of(String value) {
        if (value == null) {
            throw new PysonException(PysonError.UNSUPPORTED_VALUE_TYPE, "Invalid pyson type: null", null);
        }
        return new StrValue(value);
    }

    static PysonValue of(List<?> elements) {
        if (elements == null) {
            throw new PysonException(PysonError.UNSUPPORTED_VALUE_TYPE, "Invalid pyson type: null", null);
        }
        List<String> strings = new ArrayList<>(elements.size());
        for (Object element : elements) {
            if (!(element instanceof String str)) {
                throw new PysonException(
                    PysonError.INVALID_LIST_ELEMENT,
                    "Lists in pyson must contain only strings",
                    element == null ? "null" : element.getClass().getSimpleName()
                );
            }
            strings.add(str);
        }
        return new ListValue(strings);
    }

    /**
     * Classifies an untyped payload, e.g. one produced by a JSON reader.
     */
    static PysonValue of(Object payload) {
        if (payload instanceof PysonValue value) {
            return value;
        }
        if (payload instanceof Long || payload instanceof Integer || payload instanceof Short || payload instanceof Byte) {
            return of(((Number) payload).longValue());
        }
        if (payload instanceof Double || payload instanceof Float) {
            return of(((Number) payload).doubleValue());
        }
        if (payload instanceof CharSequence text) {
            return of(text.toString());
        }
        if (payload instanceof List<?> list) {
            return of(list);
        }
        if (payload instanceof String[] array) {
            return of(Arrays.asList(array));
        }
        String kind = payload == null ? "null" : payload.getClass().getSimpleName();
        throw new PysonException(PysonError.UNSUPPORTED_VALUE_TYPE, "Invalid pyson type: " + kind, kind);
    }

    private static boolean isLongIntegral(double value) {
        return Double.isFinite(value)
            && value == Math.rint(value)
            && value >= (double) Long.MIN_VALUE
            && value < -(double) Long.MIN_VALUE;
    }

    private static void rejectNewline(String text, String what) {
        if (text.indexOf('\n') >= 0) {
            throw new PysonException(PysonError.EMBEDDED_NEWLINE, what + " cannot contain newlines", text);
        }
    }

    record IntValue(long value) implements PysonValue {
        @Override
        public PysonType type() {
            return PysonType.INT;
        }

        @Override
        public Object payload() {
            return value;
        }

        @Override
        public String content() {
            return Long.toString(value);
        }

        @Override
        public String toString() {
            return encode();
        }
    }

    record FloatValue(double value) implements PysonValue {
        public FloatValue {
            if (isLongIntegral(value)) {
                throw new PysonException(
                    PysonError.INVALID_ARGUMENT,
                    "Integral number " + value + " must be an int value",
                    value
                );
            }
        }

        @Override
        public PysonType type() {
            return PysonType.FLOAT;
        }

        @Override
        public Object payload() {
            return value;
        }

        @Override
        public String content() {
            return Double.toString(value);
        }

        @Override
        public String toString() {
            return encode();
        }
    }

    record StrValue(String value) implements PysonValue {
        public StrValue {
            Objects.requireNonNull(value, "value");
            rejectNewline(value, "Pyson strings");
        }

        @Override
        public PysonType type() {
            return PysonType.STR;
        }

        @Override
        public Object payload() {
            return value;
        }

        @Override
        public String content() {
            return value;
        }

        @Override
        public String toString() {
            return encode();
        }
    }

    record ListValue(List<String> elements) implements PysonValue {
        public ListValue {
            Objects.requireNonNull(elements, "elements");
            for (String element : elements) {
                if (element == null) {
                    throw new PysonException(
                        PysonError.INVALID_LIST_ELEMENT,
                        "Lists in pyson must contain only strings",
                        "null"
                    );
                }
                rejectNewline(element, "Pyson list elements");
            }
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        @Override
        public PysonType type() {
            return PysonType.LIST;
        }

        @Override
        public Object payload() {
            return elements;
        }

        @Override
        public String content() {
            return String.join(LIST_DELIMITER, elements);
        }

        @Override
        public String toString() {
            return encode();
        }
    }
}
