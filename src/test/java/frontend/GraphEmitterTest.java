package frontend;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphEmitterTest {

    @Test
    void smallTreeExactOutput() {
        String dot = new GraphEmitter().emit(Parser.parseSource("int v = 1+2;"));
        assertEquals("digraph AST {\n"
                + "node_0 [label=\"FileAST\"];\n"
                + "node_0 -> node_1;\n"
                + "node_1 [label=\"Decl: v\"];\n"
                + "node_1 -> node_2;\n"
                + "node_2 [label=\"BinaryOp: +\"];\n"
                + "node_2 -> node_3;\n"
                + "node_2 -> node_4;\n"
                + "node_3 [label=\"Constant: 1\"];\n"
                + "node_4 [label=\"Constant: 2\"];\n"
                + "}\n", dot);
    }

    @Test
    void emittingTwiceIsByteIdentical() throws IOException {
        ASTNode root = Parser.parseSource(ParserTest.readResource("/year.c"), "year.c");
        GraphEmitter emitter = new GraphEmitter("year");
        String first = emitter.emit(root);
        String second = emitter.emit(root);
        assertEquals(first, second);

        StringWriter writer = new StringWriter();
        emitter.emit(root, writer);
        assertEquals(first, writer.toString());
        assertTrue(first.startsWith("digraph year {\n"));
    }

    @Test
    void edgeCountMatchesParentChildPairs() throws IOException {
        ASTNode root = Parser.parseSource(ParserTest.readResource("/year.c"), "year.c");
        String dot = new GraphEmitter().emit(root);

        int nodes = 0;
        int edges = 0;
        Map<String, Integer> declared = new HashMap<>();
        for (String line : dot.split("\n")) {
            if (line.contains(" -> ")) {
                edges++;
            } else if (line.contains(" [label=")) {
                nodes++;
                declared.merge(line.substring(0, line.indexOf(' ')), 1, Integer::sum);
            }
        }
        assertEquals(countNodes(root), nodes);
        assertEquals(countNodes(root) - 1, edges);
        for (Map.Entry<String, Integer> entry : declared.entrySet()) {
            assertEquals(1, entry.getValue(), entry.getKey());
        }
    }

    @Test
    void idsFollowPreOrder() {
        String dot = new GraphEmitter().emit(Parser.parseSource("void f(void) { g(); }"));
        // FileAST, FuncDef, Decl, FuncDecl, ParamList, Typename, Compound, FuncCall, ID
        assertTrue(dot.contains("node_1 [label=\"FuncDef: f\"];"));
        assertTrue(dot.contains("node_5 [label=\"Typename: void\"];"));
        assertTrue(dot.contains("node_6 [label=\"Compound\"];"));
        assertTrue(dot.contains("node_8 [label=\"ID: g\"];"));
        assertTrue(dot.contains("node_1 -> node_2;\nnode_1 -> node_6;\n"));
    }

    @Test
    void labelsAreEscaped() {
        String dot = new GraphEmitter().emit(Parser.parseSource("char *s = \"a\\\"b\\\\\";"));
        assertTrue(dot.contains("[label=\"Constant: \\\"a\\\\\\\"b\\\\\\\\\\\"\"];"), dot);
        assertEquals("x\\ny\\r", GraphEmitter.escape("x\ny\r"));
    }

    @Test
    void graphNameIsQuotedWhenNeeded() {
        ASTNode root = Parser.parseSource("int x;");
        assertTrue(new GraphEmitter("my graph").emit(root).startsWith("digraph \"my graph\" {\n"));
        assertTrue(new GraphEmitter("_g1").emit(root).startsWith("digraph _g1 {\n"));
        assertTrue(new GraphEmitter("node").emit(root).startsWith("digraph \"node\" {\n"));
        assertTrue(new GraphEmitter("Subgraph").emit(root).startsWith("digraph \"Subgraph\" {\n"));
        assertTrue(new GraphEmitter("nodes").emit(root).startsWith("digraph nodes {\n"));
    }

    @Test
    void deepExpressionChain() {
        int terms = 20000;
        ASTNode root = Parser.parseSource(longSum(terms));
        String dot = new GraphEmitter().emit(root);
        int nodes = 2 + terms + (terms - 1);
        assertEquals(nodes + (nodes - 1) + 2, dot.split("\n").length);
        assertTrue(dot.endsWith("node_" + (nodes - 1) + " [label=\"Constant: 1\"];\n}\n"));
    }

    // int v = 1+1+...+1; 左结合，树的深度和项数成正比
    static String longSum(int terms) {
        StringBuilder sb = new StringBuilder("int v = 1");
        for (int i = 1; i < terms; i++) {
            sb.append("+1");
        }
        return sb.append(';').toString();
    }

    @Test
    void everyKindHasALabel() {
        for (NodeKind kind : NodeKind.values()) {
            GraphEmitter.salientAttribute(kind);
        }
        assertNull(GraphEmitter.salientAttribute(NodeKind.COMPOUND));
        assertEquals("op", GraphEmitter.salientAttribute(NodeKind.STRUCT_REF));
    }

    private static int countNodes(ASTNode node) {
        int count = 1;
        for (ASTNode child : node.getChildren()) {
            count += countNodes(child);
        }
        return count;
    }
}
