package work.lcod.pyson.error;

/**
 * Failure categories reported by the pyson model, codecs and file helpers.
 */
public enum PysonError {
    INVALID_TYPE("invalid_type"),
    UNSUPPORTED_VALUE_TYPE("unsupported_value_type"),
    INVALID_LIST_ELEMENT("invalid_list_element"),
    INVALID_ARGUMENT("invalid_argument"),
    EMBEDDED_NEWLINE("embedded_newline"),
    MALFORMED_ENTRY("malformed_entry"),
    INVALID_NUMBER("invalid_number"),
    INVALID_ENTRY("invalid_entry"),
    DUPLICATE_NAME("duplicate_name"),
    FILE_NOT_FOUND("file_not_found");

    private final String code;

    PysonError(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
