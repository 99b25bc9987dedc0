package frontend;

// 语法树节点种类，tag 是图和文本输出中的名字
public enum NodeKind {
    TRANSLATION_UNIT("FileAST"),

    // 声明
    FUNC_DEF("FuncDef"),
    DECL("Decl"),
    TYPEDEF("Typedef"),
    MEMBER("Member"),
    DECL_LIST("DeclList"),
    PTR_DECL("PtrDecl"),
    ARRAY_DECL("ArrayDecl"),
    FUNC_DECL("FuncDecl"),
    PARAM_LIST("ParamList"),
    ELLIPSIS_PARAM("EllipsisParam"),
    TYPE_NAME("Typename"),

    // 类型说明符
    STRUCT("Struct"),
    UNION("Union"),
    ENUM("Enum"),
    ENUMERATOR("Enumerator"),

    // 语句
    COMPOUND("Compound"),
    IF("If"),
    WHILE("While"),
    DO_WHILE("DoWhile"),
    FOR("For"),
    SWITCH("Switch"),
    CASE("Case"),
    DEFAULT("Default"),
    LABEL("Label"),
    GOTO("Goto"),
    BREAK("Break"),
    CONTINUE("Continue"),
    RETURN("Return"),
    EMPTY_STATEMENT("EmptyStatement"),
    PRAGMA("Pragma"),

    // 表达式
    BINARY_OP("BinaryOp"),
    UNARY_OP("UnaryOp"),
    ASSIGNMENT("Assignment"),
    TERNARY_OP("TernaryOp"),
    CAST("Cast"),
    FUNC_CALL("FuncCall"),
    ARRAY_REF("ArrayRef"),
    STRUCT_REF("StructRef"),
    CONSTANT("Constant"),
    ID("ID"),
    EXPR_LIST("ExprList"),
    INIT_LIST("InitList"),
    NAMED_INITIALIZER("NamedInitializer"),
    COMPOUND_LITERAL("CompoundLiteral");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
