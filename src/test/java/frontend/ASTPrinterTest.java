package frontend;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ASTPrinterTest {

    @Test
    void indentsChildrenAndListsAttributes() {
        ASTNode root = Parser.parseSource("const int x = 1;");
        assertEquals("FileAST:\n"
                + "  Decl: name=x, type=int, quals=const\n"
                + "    Constant: type=int, value=1\n", new ASTPrinter().show(root));
    }

    @Test
    void coordinatesAreOptional() {
        ASTNode root = Parser.parseSource("int x;", "a.c");
        String shown = new ASTPrinter(true).show(root);
        assertTrue(shown.contains("Decl: name=x, type=int (at a.c:1:5)"), shown);
    }

    @Test
    void deepTreeIsPrintedLineByLine() {
        int terms = 2000;
        String shown = new ASTPrinter().show(Parser.parseSource(GraphEmitterTest.longSum(terms)));
        String[] lines = shown.split("\n");
        assertEquals(2 + terms + (terms - 1), lines.length);
        assertEquals("  Decl: name=v, type=int", lines[1]);
        assertTrue(lines[lines.length - 1].trim().equals("Constant: type=int, value=1"));
    }
}
