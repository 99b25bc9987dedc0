package frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// 每种节点一个构造方法，供 Parser 在归约时调用；null 子节点和空属性会被丢弃
public final class ASTFactory {

    private ASTFactory() {
    }

    private static ASTNode node(NodeKind kind, Map<String, String> attributes, List<ASTNode> children, Coord coord) {
        return new ASTNode(kind, attributes, children, coord);
    }

    private static ASTNode node(NodeKind kind, Map<String, String> attributes, Coord coord, ASTNode... children) {
        return new ASTNode(kind, attributes, Arrays.asList(children), coord);
    }

    // 属性按 key, value 成对给出
    private static Map<String, String> attrs(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            String value = keyValues[i + 1];
            if (value != null && !value.isEmpty()) {
                map.put(keyValues[i], value);
            }
        }
        return map;
    }

    private static List<ASTNode> listOf(List<ASTNode> items) {
        return items == null ? Collections.emptyList() : items;
    }

    // ---- 声明 ----

    public static ASTNode translationUnit(List<ASTNode> externalDecls, Coord coord) {
        return node(NodeKind.TRANSLATION_UNIT, attrs(), listOf(externalDecls), coord);
    }

    public static ASTNode funcDef(String name, ASTNode decl, ASTNode paramDecls, ASTNode body, Coord coord) {
        return node(NodeKind.FUNC_DEF, attrs("name", name), coord, decl, paramDecls, body);
    }

    // 子节点顺序：派生类型链、struct/union/enum 说明符、初始化式
    public static ASTNode decl(String name, String type, String storage, String quals, String funcspec,
                               ASTNode typeChain, ASTNode tag, ASTNode init, Coord coord) {
        return node(NodeKind.DECL,
                attrs("name", name, "type", type, "storage", storage, "quals", quals, "funcspec", funcspec),
                coord, typeChain, tag, init);
    }

    public static ASTNode typedef(String name, String type, String quals, ASTNode typeChain, ASTNode tag, Coord coord) {
        return node(NodeKind.TYPEDEF, attrs("name", name, "type", type, "quals", quals), coord, typeChain, tag);
    }

    public static ASTNode member(String name, String type, String quals, ASTNode typeChain, ASTNode tag,
                                 ASTNode bitsize, Coord coord) {
        return node(NodeKind.MEMBER, attrs("name", name, "type", type, "quals", quals), coord, typeChain, tag, bitsize);
    }

    public static ASTNode declList(List<ASTNode> decls, Coord coord) {
        return node(NodeKind.DECL_LIST, attrs(), listOf(decls), coord);
    }

    public static ASTNode ptrDecl(String quals, ASTNode pointee, Coord coord) {
        return node(NodeKind.PTR_DECL, attrs("quals", quals), coord, pointee);
    }

    public static ASTNode arrayDecl(String quals, ASTNode element, ASTNode dim, Coord coord) {
        return node(NodeKind.ARRAY_DECL, attrs("quals", quals), coord, element, dim);
    }

    public static ASTNode funcDecl(ASTNode returnChain, ASTNode params, Coord coord) {
        return node(NodeKind.FUNC_DECL, attrs(), coord, returnChain, params);
    }

    public static ASTNode paramList(List<ASTNode> params, Coord coord) {
        return node(NodeKind.PARAM_LIST, attrs(), listOf(params), coord);
    }

    public static ASTNode ellipsisParam(Coord coord) {
        return node(NodeKind.ELLIPSIS_PARAM, attrs(), coord);
    }

    public static ASTNode typeName(String type, String quals, ASTNode typeChain, ASTNode tag, Coord coord) {
        return node(NodeKind.TYPE_NAME, attrs("type", type, "quals", quals), coord, typeChain, tag);
    }

    // ---- struct / union / enum ----

    // members 为 null 表示只引用标签，没有成员表
    public static ASTNode struct(String name, List<ASTNode> members, Coord coord) {
        return node(NodeKind.STRUCT, attrs("name", name), listOf(members), coord);
    }

    public static ASTNode union(String name, List<ASTNode> members, Coord coord) {
        return node(NodeKind.UNION, attrs("name", name), listOf(members), coord);
    }

    public static ASTNode enumSpec(String name, List<ASTNode> enumerators, Coord coord) {
        return node(NodeKind.ENUM, attrs("name", name), listOf(enumerators), coord);
    }

    public static ASTNode enumerator(String name, Long value, ASTNode explicitValue, Coord coord) {
        return node(NodeKind.ENUMERATOR, attrs("name", name, "value", value == null ? null : value.toString()),
                coord, explicitValue);
    }

    // ---- 语句 ----

    public static ASTNode compound(List<ASTNode> blockItems, Coord coord) {
        return node(NodeKind.COMPOUND, attrs(), listOf(blockItems), coord);
    }

    public static ASTNode ifStmt(ASTNode cond, ASTNode then, ASTNode otherwise, Coord coord) {
        return node(NodeKind.IF, attrs(), coord, cond, then, otherwise);
    }

    public static ASTNode whileStmt(ASTNode cond, ASTNode body, Coord coord) {
        return node(NodeKind.WHILE, attrs(), coord, cond, body);
    }

    public static ASTNode doWhile(ASTNode body, ASTNode cond, Coord coord) {
        return node(NodeKind.DO_WHILE, attrs(), coord, body, cond);
    }

    // for 的三个子句缺省时用 EmptyStatement 占位，保证子节点位置固定
    public static ASTNode forStmt(ASTNode init, ASTNode cond, ASTNode next, ASTNode body, Coord coord) {
        return node(NodeKind.FOR, attrs(), coord,
                init != null ? init : emptyStatement(coord),
                cond != null ? cond : emptyStatement(coord),
                next != null ? next : emptyStatement(coord),
                body);
    }

    public static ASTNode switchStmt(ASTNode cond, ASTNode body, Coord coord) {
        return node(NodeKind.SWITCH, attrs(), coord, cond, body);
    }

    public static ASTNode caseStmt(ASTNode expr, ASTNode stmt, Coord coord) {
        return node(NodeKind.CASE, attrs(), coord, expr, stmt);
    }

    public static ASTNode defaultStmt(ASTNode stmt, Coord coord) {
        return node(NodeKind.DEFAULT, attrs(), coord, stmt);
    }

    public static ASTNode label(String name, ASTNode stmt, Coord coord) {
        return node(NodeKind.LABEL, attrs("name", name), coord, stmt);
    }

    public static ASTNode gotoStmt(String name, Coord coord) {
        return node(NodeKind.GOTO, attrs("name", name), coord);
    }

    public static ASTNode breakStmt(Coord coord) {
        return node(NodeKind.BREAK, attrs(), coord);
    }

    public static ASTNode continueStmt(Coord coord) {
        return node(NodeKind.CONTINUE, attrs(), coord);
    }

    public static ASTNode returnStmt(ASTNode expr, Coord coord) {
        return node(NodeKind.RETURN, attrs(), coord, expr);
    }

    public static ASTNode emptyStatement(Coord coord) {
        return node(NodeKind.EMPTY_STATEMENT, attrs(), coord);
    }

    public static ASTNode pragma(String text, Coord coord) {
        return node(NodeKind.PRAGMA, attrs("value", text), coord);
    }

    // ---- 表达式 ----

    public static ASTNode binaryOp(String op, ASTNode left, ASTNode right, Coord coord) {
        return node(NodeKind.BINARY_OP, attrs("op", op), coord, left, right);
    }

    public static ASTNode unaryOp(String op, ASTNode operand, Coord coord) {
        return node(NodeKind.UNARY_OP, attrs("op", op), coord, operand);
    }

    public static ASTNode assignment(String op, ASTNode lvalue, ASTNode rvalue, Coord coord) {
        return node(NodeKind.ASSIGNMENT, attrs("op", op), coord, lvalue, rvalue);
    }

    public static ASTNode ternaryOp(ASTNode cond, ASTNode ifTrue, ASTNode ifFalse, Coord coord) {
        return node(NodeKind.TERNARY_OP, attrs(), coord, cond, ifTrue, ifFalse);
    }

    public static ASTNode cast(ASTNode typeName, ASTNode expr, Coord coord) {
        return node(NodeKind.CAST, attrs(), coord, typeName, expr);
    }

    public static ASTNode funcCall(ASTNode callee, ASTNode args, Coord coord) {
        return node(NodeKind.FUNC_CALL, attrs(), coord, callee, args);
    }

    public static ASTNode arrayRef(ASTNode base, ASTNode subscript, Coord coord) {
        return node(NodeKind.ARRAY_REF, attrs(), coord, base, subscript);
    }

    public static ASTNode structRef(ASTNode base, String op, ASTNode field, Coord coord) {
        return node(NodeKind.STRUCT_REF, attrs("op", op), coord, base, field);
    }

    public static ASTNode constant(String type, String value, Coord coord) {
        return node(NodeKind.CONSTANT, attrs("type", type, "value", value), coord);
    }

    public static ASTNode id(String name, Coord coord) {
        return node(NodeKind.ID, attrs("name", name), coord);
    }

    public static ASTNode exprList(List<ASTNode> exprs, Coord coord) {
        return node(NodeKind.EXPR_LIST, attrs(), listOf(exprs), coord);
    }

    public static ASTNode initList(List<ASTNode> inits, Coord coord) {
        return node(NodeKind.INIT_LIST, attrs(), listOf(inits), coord);
    }

    public static ASTNode namedInitializer(String designation, List<ASTNode> designators, ASTNode value, Coord coord) {
        List<ASTNode> children = new ArrayList<>(listOf(designators));
        children.add(value);
        return node(NodeKind.NAMED_INITIALIZER, attrs("name", designation), children, coord);
    }

    public static ASTNode compoundLiteral(ASTNode typeName, ASTNode init, Coord coord) {
        return node(NodeKind.COMPOUND_LITERAL, attrs(), coord, typeName, init);
    }
}
