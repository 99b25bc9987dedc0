package frontend;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private static ASTNode parse(String source) {
        return Parser.parseSource(source, "t.c");
    }

    // 函数体的 Compound 节点
    private static ASTNode body(ASTNode funcDef) {
        assertEquals(NodeKind.FUNC_DEF, funcDef.getKind());
        return funcDef.getChild(funcDef.childCount() - 1);
    }

    private static List<String> enumValues(ASTNode enumNode) {
        List<String> values = new ArrayList<>();
        for (ASTNode enumerator : enumNode.getChildren()) {
            values.add(enumerator.getValue());
        }
        return values;
    }

    @Test
    void primitiveDeclarationHasNoChildren() {
        for (String type : new String[]{"int", "char", "float", "double", "_Bool"}) {
            ASTNode root = parse(type + " x;");
            assertEquals(NodeKind.TRANSLATION_UNIT, root.getKind());
            assertEquals(1, root.childCount());
            ASTNode decl = root.getChild(0);
            assertEquals(NodeKind.DECL, decl.getKind());
            assertEquals("x", decl.getName());
            assertEquals(type, decl.getType());
            assertEquals(0, decl.childCount());
        }
    }

    @Test
    void declarationSpecifiersAreRecorded() {
        ASTNode decl = parse("static const unsigned long int n = 1;").getChild(0);
        assertEquals("unsigned long int", decl.getType());
        assertEquals("static", decl.getAttribute("storage"));
        assertEquals("const", decl.getAttribute("quals"));
        assertEquals("t.c:1:33", decl.getCoord().toString());
    }

    @Test
    void multiplicationBindsTighterThanAddition() {
        ASTNode init = parse("int v = 1+2*3;").getChild(0).getChild(0);
        assertEquals(NodeKind.BINARY_OP, init.getKind());
        assertEquals("+", init.getOp());
        assertEquals(NodeKind.CONSTANT, init.getChild(0).getKind());
        assertEquals("1", init.getChild(0).getValue());
        ASTNode right = init.getChild(1);
        assertEquals("*", right.getOp());
        assertEquals("2", right.getChild(0).getValue());
        assertEquals("3", right.getChild(1).getValue());
    }

    @Test
    void binaryOperatorsAreLeftAssociative() {
        ASTNode init = parse("int v = 8 - 4 - 2;").getChild(0).getChild(0);
        assertEquals("-", init.getOp());
        assertEquals("-", init.getChild(0).getOp());
        assertEquals("2", init.getChild(1).getValue());

        ASTNode logic = parse("int w = a || b && c == d;").getChild(0).getChild(0);
        assertEquals("||", logic.getOp());
        assertEquals("&&", logic.getChild(1).getOp());
        assertEquals("==", logic.getChild(1).getChild(1).getOp());
    }

    @Test
    void typedefNameIsUsableAfterItsDeclaration() {
        ASTNode root = parse("typedef int myint; myint x;");
        ASTNode typedef = root.getChild(0);
        assertEquals(NodeKind.TYPEDEF, typedef.getKind());
        assertEquals("myint", typedef.getName());
        assertEquals("int", typedef.getType());
        ASTNode decl = root.getChild(1);
        assertEquals(NodeKind.DECL, decl.getKind());
        assertEquals("myint", decl.getType());
        assertEquals("x", decl.getName());
    }

    @Test
    void typedefNameUsedBeforeDeclarationFails() {
        assertThrows(SyntaxError.class, () -> parse("myint x; typedef int myint;"));
    }

    @Test
    void typedefNameIsVisibleToTheNextDeclaratorInTheSameDeclaration() {
        ASTNode root = parse("typedef int T, *TP; TP p;");
        assertEquals("TP", root.getChild(1).getName());
        assertEquals(NodeKind.PTR_DECL, root.getChild(1).getChild(0).getKind());
        assertEquals("TP", root.getChild(2).getType());
    }

    @Test
    void blockScopedTypedefEndsWithTheBlock() {
        ASTNode root = parse("void f(void) { typedef int T; T x; } int T;");
        ASTNode block = body(root.getChild(0));
        assertEquals(NodeKind.TYPEDEF, block.getChild(0).getKind());
        assertEquals("T", block.getChild(1).getType());
        ASTNode outer = root.getChild(1);
        assertEquals("T", outer.getName());
        assertEquals("int", outer.getType());
    }

    @Test
    void ordinaryDeclarationShadowsTypedefInInnerScope() {
        ASTNode root = parse("typedef int T; void f(void) { int T = 1; T = 2; } T y;");
        ASTNode block = body(root.getChild(1));
        assertEquals("T", block.getChild(0).getName());
        ASTNode assign = block.getChild(1);
        assertEquals(NodeKind.ASSIGNMENT, assign.getKind());
        assertEquals("T", assign.getChild(0).getName());
        assertEquals("T", root.getChild(2).getType());
    }

    @Test
    void parameterShadowsTypedefInsideTheBody() {
        ASTNode root = parse("typedef int T; int f(int T) { return T + 1; }");
        ASTNode ret = body(root.getChild(1)).getChild(0);
        assertEquals(NodeKind.RETURN, ret.getKind());
        ASTNode sum = ret.getChild(0);
        assertEquals("+", sum.getOp());
        assertEquals(NodeKind.ID, sum.getChild(0).getKind());
        assertEquals("T", sum.getChild(0).getName());
    }

    @Test
    void forDeclarationShadowingTypedefEndsWithTheLoop() {
        ASTNode block = body(parse("typedef int T; void f(void) { for (int T = 0; T < 1; T++) ; T y; }").getChild(1));
        ASTNode loop = block.getChild(0);
        assertEquals(NodeKind.FOR, loop.getKind());
        assertEquals("T", loop.getChild(0).getChild(0).getName());
        ASTNode after = block.getChild(1);
        assertEquals(NodeKind.DECL, after.getKind());
        assertEquals("T", after.getType());
        assertEquals("y", after.getName());

        ASTNode braced = body(parse("typedef int T; void g(void) { for (int T = 0; T < 1; T++) { T++; } T z; }")
                .getChild(1));
        assertEquals("T", braced.getChild(1).getType());
        assertEquals("z", braced.getChild(1).getName());
    }

    @Test
    void redeclaringTypedefAsVariableInSameScopeConflicts() {
        DeclarationConflict conflict = assertThrows(DeclarationConflict.class, () -> parse("typedef int T; int T;"));
        assertEquals("T", conflict.getName());
        assertThrows(DeclarationConflict.class, () -> parse("int v; typedef char v;"));
    }

    @Test
    void explicitEnumeratorValues() {
        ASTNode decl = parse("enum suit { club = 0, diamonds = 10, hearts = 20, spades = 3 };").getChild(0);
        assertNull(decl.getName());
        ASTNode suit = decl.getChild(0);
        assertEquals(NodeKind.ENUM, suit.getKind());
        assertEquals("suit", suit.getName());
        assertEquals(List.of("0", "10", "20", "3"), enumValues(suit));
    }

    @Test
    void implicitEnumeratorValuesCountUp() {
        ASTNode e = parse("enum e { A, B = 5, C, };").getChild(0).getChild(0);
        assertEquals(List.of("0", "5", "6"), enumValues(e));

        ASTNode flags = parse("enum { X = 1 << 3, Y = X + 1, Z = 'a' };").getChild(0).getChild(0);
        assertNull(flags.getName());
        assertEquals(List.of("8", "9", "97"), enumValues(flags));
    }

    @Test
    void enumWithoutEnumeratorsFails() {
        assertThrows(SyntaxError.class, () -> parse("enum e {};"));
    }

    @Test
    void danglingElseBindsToInnerIf() {
        ASTNode block = body(parse("void f(void) { if (a) if (b) s1; else s2; }").getChild(0));
        ASTNode outer = block.getChild(0);
        assertEquals(NodeKind.IF, outer.getKind());
        assertEquals(2, outer.childCount());
        ASTNode inner = outer.getChild(1);
        assertEquals(NodeKind.IF, inner.getKind());
        assertEquals(3, inner.childCount());
        assertEquals("s2", inner.getChild(2).getName());
    }

    @Test
    void arrayOfPointers() {
        ASTNode decl = parse("int *a[3];").getChild(0);
        ASTNode array = decl.getChild(0);
        assertEquals(NodeKind.ARRAY_DECL, array.getKind());
        assertEquals(NodeKind.PTR_DECL, array.getChild(0).getKind());
        assertEquals("3", array.getChild(1).getValue());
    }

    @Test
    void pointerToFunction() {
        ASTNode decl = parse("int (*fp)(int, char *);").getChild(0);
        assertEquals("fp", decl.getName());
        ASTNode ptr = decl.getChild(0);
        assertEquals(NodeKind.PTR_DECL, ptr.getKind());
        ASTNode func = ptr.getChild(0);
        assertEquals(NodeKind.FUNC_DECL, func.getKind());
        ASTNode params = func.getChild(0);
        assertEquals(NodeKind.PARAM_LIST, params.getKind());
        assertEquals(2, params.childCount());
        assertEquals(NodeKind.TYPE_NAME, params.getChild(0).getKind());
        assertEquals("int", params.getChild(0).getType());
        assertEquals(NodeKind.PTR_DECL, params.getChild(1).getChild(0).getKind());
    }

    @Test
    void prototypeWithEllipsis() {
        ASTNode decl = parse("int printf(const char *fmt, ...);").getChild(0);
        ASTNode params = decl.getChild(0).getChild(0);
        assertEquals(NodeKind.DECL, params.getChild(0).getKind());
        assertEquals("fmt", params.getChild(0).getName());
        assertEquals("const", params.getChild(0).getAttribute("quals"));
        assertEquals(NodeKind.ELLIPSIS_PARAM, params.getChild(1).getKind());
    }

    @Test
    void functionReturningPointer() {
        ASTNode def = parse("char *name(void) { return 0; }").getChild(0);
        assertEquals("name", def.getName());
        ASTNode func = def.getChild(0).getChild(0);
        assertEquals(NodeKind.FUNC_DECL, func.getKind());
        assertEquals(NodeKind.PTR_DECL, func.getChild(0).getKind());
    }

    @Test
    void oldStyleParameterDeclarations() {
        ASTNode def = parse("int f(a, b) int a; char b; { return a; }").getChild(0);
        assertEquals(3, def.childCount());
        ASTNode params = def.getChild(0).getChild(0).getChild(0);
        assertEquals(NodeKind.ID, params.getChild(0).getKind());
        ASTNode declList = def.getChild(1);
        assertEquals(NodeKind.DECL_LIST, declList.getKind());
        assertEquals(2, declList.childCount());
        assertEquals("char", declList.getChild(1).getType());
    }

    @Test
    void implicitIntFunction() {
        ASTNode def = parse("main() { return 0; }").getChild(0);
        assertEquals("int", def.getChild(0).getType());
    }

    @Test
    void structWithBitFieldsAndTagOnFirstDeclaratorOnly() {
        ASTNode root = parse("struct point { int x, y; unsigned flag : 1; } p, q; struct point r;");
        ASTNode p = root.getChild(0);
        assertEquals("struct point", p.getType());
        ASTNode struct = p.getChild(0);
        assertEquals(NodeKind.STRUCT, struct.getKind());
        assertEquals(3, struct.childCount());
        ASTNode flag = struct.getChild(2);
        assertEquals(NodeKind.MEMBER, flag.getKind());
        assertEquals("flag", flag.getName());
        assertEquals("1", flag.getChild(0).getValue());

        assertEquals(0, root.getChild(1).childCount());
        ASTNode r = root.getChild(2);
        assertEquals(NodeKind.STRUCT, r.getChild(0).getKind());
        assertEquals(0, r.getChild(0).childCount());
    }

    @Test
    void unionAndAnonymousMembers() {
        ASTNode u = parse("union u { int i; struct { float f; }; };").getChild(0).getChild(0);
        assertEquals(NodeKind.UNION, u.getKind());
        assertEquals(2, u.childCount());
        ASTNode anonymous = u.getChild(1);
        assertNull(anonymous.getName());
        assertEquals(NodeKind.STRUCT, anonymous.getChild(0).getKind());
    }

    @Test
    void statements() {
        String source = "void f(int n) {\n"
                + "  int i;\n"
                + "  for (i = 0; i < n; i++) { if (i == 2) continue; }\n"
                + "  while (n) n--;\n"
                + "  do n++; while (n < 3);\n"
                + "  switch (n) { case 1: break; default: ; }\n"
                + "  lbl: goto lbl;\n"
                + "  return;\n"
                + "}\n";
        ASTNode block = body(parse(source).getChild(0));
        List<NodeKind> kinds = new ArrayList<>();
        for (ASTNode child : block.getChildren()) {
            kinds.add(child.getKind());
        }
        assertEquals(List.of(NodeKind.DECL, NodeKind.FOR, NodeKind.WHILE, NodeKind.DO_WHILE, NodeKind.SWITCH,
                NodeKind.LABEL, NodeKind.RETURN), kinds);
        assertEquals(NodeKind.GOTO, block.getChild(5).getChild(0).getKind());
        assertEquals("lbl", block.getChild(5).getName());
        assertEquals(0, block.getChild(6).childCount());

        ASTNode switchBody = block.getChild(4).getChild(1);
        assertEquals(NodeKind.CASE, switchBody.getChild(0).getKind());
        assertEquals(NodeKind.BREAK, switchBody.getChild(0).getChild(1).getKind());
        assertEquals(NodeKind.EMPTY_STATEMENT, switchBody.getChild(1).getChild(0).getKind());
    }

    @Test
    void forClausesKeepTheirPositions() {
        ASTNode block = body(parse("void f(void) { for (;;) ; for (int j = 0; j < 3; j++) ; }").getChild(0));
        ASTNode empty = block.getChild(0);
        assertEquals(4, empty.childCount());
        for (ASTNode child : empty.getChildren()) {
            assertEquals(NodeKind.EMPTY_STATEMENT, child.getKind());
        }
        ASTNode withDecl = block.getChild(1);
        assertEquals(NodeKind.DECL_LIST, withDecl.getChild(0).getKind());
        assertEquals("j", withDecl.getChild(0).getChild(0).getName());
        assertEquals("p++", withDecl.getChild(2).getOp());
    }

    @Test
    void postfixChainsAndCalls() {
        ASTNode block = body(parse("void f(void) { a.b->c[2] = g(1, x); }").getChild(0));
        ASTNode assign = block.getChild(0);
        ASTNode ref = assign.getChild(0);
        assertEquals(NodeKind.ARRAY_REF, ref.getKind());
        ASTNode arrow = ref.getChild(0);
        assertEquals(NodeKind.STRUCT_REF, arrow.getKind());
        assertEquals("->", arrow.getOp());
        assertEquals(".", arrow.getChild(0).getOp());
        assertEquals("c", arrow.getChild(1).getName());

        ASTNode call = assign.getChild(1);
        assertEquals(NodeKind.FUNC_CALL, call.getKind());
        assertEquals("g", call.getChild(0).getName());
        assertEquals(2, call.getChild(1).childCount());
    }

    @Test
    void assignmentIsRightAssociative() {
        ASTNode assign = body(parse("void f(void) { a = b += c; }").getChild(0)).getChild(0);
        assertEquals("=", assign.getOp());
        assertEquals("+=", assign.getChild(1).getOp());
    }

    @Test
    void castSizeofAndCompoundLiteral() {
        String source = "typedef long T;\n"
                + "int n = sizeof(int) + sizeof x;\n"
                + "T v = (T) n;\n"
                + "int w = (n) * 2;\n"
                + "int *p = (int[]){1, 2};\n"
                + "int c = a ? b : c;\n";
        ASTNode root = parse(source);
        ASTNode sizes = root.getChild(1).getChild(0);
        assertEquals("sizeof", sizes.getChild(0).getOp());
        assertEquals(NodeKind.TYPE_NAME, sizes.getChild(0).getChild(0).getKind());
        assertEquals(NodeKind.ID, sizes.getChild(1).getChild(0).getKind());

        ASTNode cast = root.getChild(2).getChild(0);
        assertEquals(NodeKind.CAST, cast.getKind());
        assertEquals("T", cast.getChild(0).getType());

        assertEquals(NodeKind.BINARY_OP, root.getChild(3).getChild(0).getKind());

        ASTNode literal = root.getChild(4).getChild(1);
        assertEquals(NodeKind.COMPOUND_LITERAL, literal.getKind());
        assertEquals(NodeKind.ARRAY_DECL, literal.getChild(0).getChild(0).getKind());
        assertEquals(2, literal.getChild(1).childCount());

        assertEquals(NodeKind.TERNARY_OP, root.getChild(5).getChild(0).getKind());
    }

    @Test
    void adjacentStringLiteralsAreJoined() {
        ASTNode init = parse("char *s = \"ab\" \"cd\";").getChild(0).getChild(1);
        assertEquals("string", init.getType());
        assertEquals("\"abcd\"", init.getValue());
    }

    @Test
    void wideStringWinsWhenConcatenating() {
        ASTNode init = parse("int *w = \"a\" L\"b\" \"c\";").getChild(0).getChild(1);
        assertEquals("L\"abc\"", init.getValue());
    }

    @Test
    void offsetofTakesATypeNameAndAMemberDesignator() {
        ASTNode root = parse("struct s { int a[4]; struct { int c; } b; };\n"
                + "int n = offsetof(struct s, b.c);\n"
                + "int m = offsetof(struct s, a[2]);\n");
        ASTNode call = root.getChild(1).getChild(0);
        assertEquals(NodeKind.FUNC_CALL, call.getKind());
        assertEquals("offsetof", call.getChild(0).getName());
        ASTNode args = call.getChild(1);
        assertEquals(NodeKind.EXPR_LIST, args.getKind());
        assertEquals(NodeKind.TYPE_NAME, args.getChild(0).getKind());
        assertEquals("struct s", args.getChild(0).getType());
        ASTNode member = args.getChild(1);
        assertEquals(NodeKind.STRUCT_REF, member.getKind());
        assertEquals("b", member.getChild(0).getName());
        assertEquals("c", member.getChild(1).getName());

        ASTNode element = root.getChild(2).getChild(0).getChild(1).getChild(1);
        assertEquals(NodeKind.ARRAY_REF, element.getKind());
        assertEquals("a", element.getChild(0).getName());
        assertEquals("2", element.getChild(1).getValue());

        assertThrows(SyntaxError.class, () -> parse("int k = offsetof(struct s);"));
    }

    @Test
    void designatedInitializers() {
        ASTNode root = parse("int a[3] = { [1] = 5, 2 }; struct pt { int x; } p = { .x = 1 };");
        ASTNode list = root.getChild(0).getChild(1);
        assertEquals(NodeKind.INIT_LIST, list.getKind());
        ASTNode named = list.getChild(0);
        assertEquals(NodeKind.NAMED_INITIALIZER, named.getKind());
        assertEquals("[1]", named.getName());
        assertEquals("5", named.getChild(1).getValue());
        assertEquals(".x", root.getChild(1).getChild(1).getChild(0).getName());
    }

    @Test
    void pragmaAtFileAndBlockLevel() {
        ASTNode root = parse("#pragma pack(1)\nint x;\nvoid f(void) {\n#pragma inner\n}\n");
        assertEquals(NodeKind.PRAGMA, root.getChild(0).getKind());
        assertEquals("pack(1)", root.getChild(0).getValue());
        assertEquals(NodeKind.PRAGMA, body(root.getChild(2)).getChild(0).getKind());
    }

    @Test
    void syntaxErrorsPointAtTheOffendingToken() {
        SyntaxError error = assertThrows(SyntaxError.class, () -> parse("int x = ;"));
        assertEquals(";", error.getLexeme());
        assertEquals("t.c:1:9", error.getCoord().toString());

        SyntaxError atEnd = assertThrows(SyntaxError.class, () -> parse("int x"));
        assertTrue(atEnd.getMessage().endsWith("at end of input"));

        assertThrows(SyntaxError.class, () -> parse("x = 1;"));
        assertThrows(SyntaxError.class, () -> parse("typedef int T = 1;"));
        assertThrows(SyntaxError.class, () -> parse("struct s { int a; } int x;"));
        assertThrows(SyntaxError.class, () -> parse("void f(void) { a + b = c; }"));
        assertThrows(SyntaxError.class, () -> parse("void f(void) { if (a) }"));
        assertThrows(SyntaxError.class, () -> parse("void f(void) { return 0;"));
    }

    @Test
    void lexicalErrorsPropagate() {
        assertThrows(LexError.class, () -> parse("int x = 1 @ 2;"));
    }

    @Test
    void parsesYearSample() throws IOException {
        ASTNode root = parse(readResource("/year.c"));
        assertEquals(12, root.childCount());
        assertEquals(List.of("0", "10", "20", "3"), enumValues(root.getChild(4).getChild(0)));

        ASTNode structRef = root.getChild(5).getChild(0);
        assertEquals(NodeKind.STRUCT_REF, structRef.getKind());

        ASTNode convert = root.getChild(10);
        assertEquals("convert", convert.getName());
        ASTNode main = root.getChild(11);
        assertEquals("main", main.getName());
        ASTNode mainBody = body(main);
        assertEquals("_Bool", mainBody.getChild(0).getType());
        assertEquals(NodeKind.RETURN, mainBody.getChild(mainBody.childCount() - 1).getKind());
    }

    static String readResource(String name) throws IOException {
        try (InputStream in = ParserTest.class.getResourceAsStream(name)) {
            assertNotNull(in, name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
