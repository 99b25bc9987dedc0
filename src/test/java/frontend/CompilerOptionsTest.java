package frontend;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CompilerOptionsTest {

    @Test
    void defaults() {
        CompilerOptions options = CompilerOptions.parse("-f", "src/year.c");
        assertEquals("src/year.c", options.getInputFile());
        assertEquals("src/year.dot", options.getOutputFile());
        assertEquals("AST", options.getGraphName());
        assertFalse(options.isShowTree());
    }

    @Test
    void allOptions() {
        CompilerOptions options = CompilerOptions.parse("-s", "-n", "year", "-g", "out.dot", "-f", "year.c");
        assertEquals("out.dot", options.getOutputFile());
        assertEquals("year", options.getGraphName());
        assertTrue(options.isShowTree());
    }

    @Test
    void defaultOutputName() {
        assertEquals("noext.dot", CompilerOptions.defaultOutput("noext"));
        assertEquals("dir.v2/file.dot", CompilerOptions.defaultOutput("dir.v2/file"));
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> CompilerOptions.parse());
        assertThrows(IllegalArgumentException.class, () -> CompilerOptions.parse("-f"));
        assertThrows(IllegalArgumentException.class, () -> CompilerOptions.parse("-f", "a.c", "-x"));
        assertThrows(IllegalArgumentException.class, () -> CompilerOptions.parse("-g", "out.dot"));
    }
}
