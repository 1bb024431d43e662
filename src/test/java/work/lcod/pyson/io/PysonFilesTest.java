package work.lcod.pyson.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.pyson.error.PysonError;
import work.lcod.pyson.error.PysonException;
import work.lcod.pyson.model.NamedValue;
import work.lcod.pyson.model.PysonValue;

class PysonFilesTest {
    private static final Path SAMPLE = Path.of("src", "test", "resources", "documents", "sample.pyson");

    @Test
    void readsSampleDocument() {
        var entries = PysonFiles.readDocument(SAMPLE);
        assertEquals(4, entries.size());
        assertEquals(PysonValue.of("Pyson sample: with colons"), entries.get(0).value());
        assertEquals(PysonValue.of(List.of("alpha", "beta", "gamma")), entries.get(3).value());

        var map = PysonFiles.readDocumentAsMap(SAMPLE);
        assertEquals(PysonValue.of(42), map.get("count"));
        assertEquals(PysonValue.of(0.25), map.get("ratio"));
    }

    @Test
    void missingFileIsReportedAsFileNotFound(@TempDir Path dir) {
        Path missing = dir.resolve("absent.pyson");
        var ex = assertThrows(PysonException.class, () -> PysonFiles.readDocument(missing));
        assertEquals(PysonError.FILE_NOT_FOUND, ex.error());
        assertEquals(missing, ex.data());
    }

    @Test
    void directoryIsAnIoFailure(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> PysonFiles.readText(dir));
    }

    @Test
    void parseFailuresSurfaceUnchanged() {
        var ex = assertThrows(PysonException.class,
            () -> PysonFiles.readDocument(Path.of("src", "test", "resources", "documents", "duplicates.pyson")));
        assertEquals(PysonError.DUPLICATE_NAME, ex.error());
    }

    @Test
    void writesAndReadsBack(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("nested").resolve("out.pyson");
        var entries = List.of(
            NamedValue.of("name", PysonValue.of("pyson")),
            NamedValue.of("version", PysonValue.of(1)),
            NamedValue.of("tags", PysonValue.of(List.of("a", "b")))
        );
        PysonFiles.writeDocument(target, entries);
        assertEquals("name:str:pyson\nversion:int:1\ntags:list:a(*)b\n", Files.readString(target));
        assertEquals(entries, PysonFiles.readDocument(target));
    }
}
