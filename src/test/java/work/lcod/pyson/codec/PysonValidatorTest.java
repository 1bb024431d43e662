package work.lcod.pyson.codec;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.pyson.error.PysonException;

class PysonValidatorTest {
    @Test
    void checksSingleEntries() {
        assertTrue(PysonValidator.isValidEntry("a:int:1"));
        assertTrue(PysonValidator.isValidEntry("l:list:x(*)y"));
        assertFalse(PysonValidator.isValidEntry("noColonsHere"));
        assertFalse(PysonValidator.isValidEntry("a:bogus:1"));
        assertFalse(PysonValidator.isValidEntry("a:int:notanumber"));
        assertFalse(PysonValidator.isValidEntry("a:str:x\ny"));
        assertFalse(PysonValidator.isValidEntry("a:int:\u0664\u0662"));
        assertFalse(PysonValidator.isValidEntry(null));
    }

    @Test
    void checksDocumentsLineByLine() {
        assertTrue(PysonValidator.isValidDocument(""));
        assertTrue(PysonValidator.isValidDocument("a:int:1\n\nb:str:x\n"));
        assertFalse(PysonValidator.isValidDocument("a:int:1\nbroken"));
        assertFalse(PysonValidator.isValidDocument(null));
    }

    @Test
    void documentCheckIgnoresDuplicateNames() {
        String text = "a:int:1\na:int:2";
        assertTrue(PysonValidator.isValidDocument(text));
        assertThrows(PysonException.class, () -> DocumentCodec.parseDocument(text));
    }
}
