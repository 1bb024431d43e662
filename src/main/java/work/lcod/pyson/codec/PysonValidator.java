package work.lcod.pyson.codec;

import work.lcod.pyson.error.PysonException;

/**
 * Boolean syntax checks over the entry parser.
 *
 * <p>{@link #isValidDocument(String)} checks each line on its own and does not enforce unique
 * names; use {@link DocumentCodec#parseDocument(String)} for the full document contract.
 */
public final class PysonValidator {
    private PysonValidator() {}

    public static boolean isValidEntry(String line) {
        if (line == null) {
            return false;
        }
        try {
            EntryCodec.parse(line);
            return true;
        } catch (PysonException ex) {
            return false;
        }
    }

    public static boolean isValidDocument(String text) {
        if (text == null) {
            return false;
        }
        for (String line : text.split(DocumentCodec.LINE_SEPARATOR, -1)) {
            if (!line.isEmpty() && !isValidEntry(line)) {
                return false;
            }
        }
        return true;
    }
}
