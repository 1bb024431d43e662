package work.lcod.pyson.error;

import java.util.Map;

/**
 * Exception carrying a pyson error category, a message and optional data
 * (offending tag, name, path or line number).
 */
public class PysonException extends RuntimeException {
    private final PysonError error;
    private final Object data;

    public PysonException(PysonError error, String message, Object data) {
        this(error, message, data, null);
    }

    public PysonException(PysonError error, String message, Object data, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.data = data;
    }

    public PysonError error() {
        return error;
    }

    public String code() {
        return error.code();
    }

    public Object data() {
        return data;
    }

    /**
     * 1-based line of the failing entry when raised while parsing a document, -1 otherwise.
     */
    public int lineNumber() {
        if (data instanceof Map<?, ?> map && map.get("line") instanceof Integer line) {
            return line;
        }
        return -1;
    }
}
