package work.lcod.pyson.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.pyson.error.PysonError;
import work.lcod.pyson.error.PysonException;
import work.lcod.pyson.model.NamedValue;
import work.lcod.pyson.model.PysonValue;

class DocumentCodecTest {
    @Test
    void parsesEntriesInLineOrder() {
        var entries = DocumentCodec.parseDocument("b:int:2\n\na:str:x\nl:list:p(*)q\n");
        assertEquals(List.of("b", "a", "l"), entries.stream().map(NamedValue::name).toList());
        assertEquals(PysonValue.of(List.of("p", "q")), entries.get(2).value());
    }

    @Test
    void emptyDocumentsYieldEmptyCollections() {
        assertTrue(DocumentCodec.parseDocument("").isEmpty());
        assertTrue(DocumentCodec.parseDocument("\n\n").isEmpty());
        assertTrue(DocumentCodec.parseDocumentAsMap("").isEmpty());
    }

    @Test
    void acceptsUniqueNames() {
        assertEquals(2, DocumentCodec.parseDocument("a:int:1\nb:int:2").size());
    }

    @Test
    void rejectsDuplicateNames() {
        var ex = assertThrows(PysonException.class, () -> DocumentCodec.parseDocument("a:int:1\na:int:2"));
        assertEquals(PysonError.DUPLICATE_NAME, ex.error());
        assertEquals("a", ex.data());

        var asMap = assertThrows(PysonException.class, () -> DocumentCodec.parseDocumentAsMap("a:int:1\na:str:x"));
        assertEquals(PysonError.DUPLICATE_NAME, asMap.error());
    }

    @Test
    void firstBadLineAbortsWithLineNumber() {
        var ex = assertThrows(PysonException.class,
            () -> DocumentCodec.parseDocument("a:int:1\n\nb:bogus:2\nc:int:nope"));
        assertEquals(PysonError.INVALID_ENTRY, ex.error());
        assertEquals(3, ex.lineNumber());
        var cause = assertInstanceOf(PysonException.class, ex.getCause());
        assertEquals(PysonError.INVALID_TYPE, cause.error());
        assertTrue(ex.getMessage().startsWith("Line 3: "));
    }

    @Test
    void mapFormAssociatesNamesWithValues() {
        var map = DocumentCodec.parseDocumentAsMap("x:float:1.5\ny:str:why");
        assertEquals(Map.of("x", PysonValue.of(1.5), "y", PysonValue.of("why")), map);
        assertThrows(UnsupportedOperationException.class, () -> map.put("z", PysonValue.of(1)));
    }

    @Test
    void encodesDocuments() {
        var entries = List.of(NamedValue.of("a", PysonValue.of(1)), NamedValue.of("l", PysonValue.of(List.of("x", "y"))));
        var text = DocumentCodec.encode(entries);
        assertEquals("a:int:1\nl:list:x(*)y", text);
        assertEquals(entries, DocumentCodec.parseDocument(text));

        var values = new LinkedHashMap<String, PysonValue>();
        values.put("s", PysonValue.of("t"));
        values.put("f", PysonValue.of(0.5));
        assertEquals("s:str:t\nf:float:0.5", DocumentCodec.encode(values));
    }

    @Test
    void encodingRejectsDuplicateNames() {
        var entries = List.of(NamedValue.of("a", PysonValue.of(1)), NamedValue.of("a", PysonValue.of(2)));
        var ex = assertThrows(PysonException.class, () -> DocumentCodec.encode(entries));
        assertEquals(PysonError.DUPLICATE_NAME, ex.error());
    }
}
