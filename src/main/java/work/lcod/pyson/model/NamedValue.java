package work.lcod.pyson.model;

import java.util.Map;
import java.util.Objects;
import work.lcod.pyson.error.PysonError;
import work.lcod.pyson.error.PysonException;

/**
 * A named pyson value, i.e. one entry of a document.
 *
 * <p>The name and value can be replaced in place. The {@code change*} methods discard the previous
 * state, the {@code swap*} methods return it. Instances are not synchronized.
 */
public final class NamedValue {
    private String name;
    private PysonValue value;

    private NamedValue(String name, PysonValue value) {
        this.name = requireName(name);
        this.value = requireValue(value);
    }

    public static NamedValue of(String name, PysonValue value) {
        return new NamedValue(name, value);
    }

    public String name() {
        return name;
    }

    public PysonValue value() {
        return value;
    }

    public PysonType type() {
        return value.type();
    }

    public void changeName(String newName) {
        name = requireName(newName);
    }

    public String swapName(String newName) {
        var previous = name;
        name = requireName(newName);
        return previous;
    }

    public void changeValue(PysonValue newValue) {
        value = requireValue(newValue);
    }

    public PysonValue swapValue(PysonValue newValue) {
        var previous = value;
        value = requireValue(newValue);
        return previous;
    }

    /** Snapshot of the current (name, value) pair. */
    public Map.Entry<String, PysonValue> toEntry() {
        return Map.entry(name, value);
    }

    /** Document line for this entry: {@code name:type:content}. */
    public String encode() {
        return name + ":" + value.type().tag() + ":" + value.content();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof NamedValue that)) {
            return false;
        }
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return encode();
    }

    private static String requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new PysonException(PysonError.INVALID_ARGUMENT, "Pyson names must be non-empty strings", name);
        }
        if (name.indexOf('\n') >= 0) {
            throw new PysonException(PysonError.INVALID_ARGUMENT, "Pyson names cannot contain newlines", name);
        }
        return name;
    }

    private static PysonValue requireValue(PysonValue value) {
        if (value == null) {
            throw new PysonException(PysonError.INVALID_ARGUMENT, "A pyson value is required", null);
        }
        return value;
    }
}
