package work.lcod.pyson.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.pyson.codec.DocumentCodec;
import work.lcod.pyson.error.PysonError;
import work.lcod.pyson.error.PysonException;
import work.lcod.pyson.model.NamedValue;
import work.lcod.pyson.model.PysonValue;

/**
 * Reads and writes pyson documents stored as UTF-8 files.
 */
public final class PysonFiles {
    private PysonFiles() {}

    public static List<NamedValue> readDocument(Path path) {
        return DocumentCodec.parseDocument(readText(path));
    }

    public static Map<String, PysonValue> readDocumentAsMap(Path path) {
        return DocumentCodec.parseDocumentAsMap(readText(path));
    }

    public static void writeDocument(Path path, Collection<NamedValue> entries) {
        Objects.requireNonNull(path, "path");
        String text = DocumentCodec.encode(entries);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, text.isEmpty() ? text : text + "\n", StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write path: " + path, ex);
        }
    }

    public static String readText(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException ex) {
            throw new PysonException(PysonError.FILE_NOT_FOUND, "File not found: " + path, path, ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read path: " + path, ex);
        }
    }
}
