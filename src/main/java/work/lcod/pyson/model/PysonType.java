package work.lcod.pyson.model;

import work.lcod.pyson.error.PysonError;
import work.lcod.pyson.error.PysonException;

/**
 * The four kinds a pyson value may have, with the lowercase tag used on the wire.
 */
public enum PysonType {
    INT("int"),
    FLOAT("float"),
    STR("str"),
    LIST("list");

    private final String tag;

    PysonType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static PysonType fromTag(String tag) {
        for (PysonType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new PysonException(PysonError.INVALID_TYPE, "Invalid pyson type: " + tag, tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
