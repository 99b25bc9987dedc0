package frontend;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public enum TokenType {
    // 标识符与类型名
    IDENFR(Category.IDENTIFIER, null),
    TYPEID(Category.TYPE_NAME, null),

    // 字面量
    INTCON(Category.LITERAL, null),
    FLOATCON(Category.LITERAL, null),
    CHRCON(Category.LITERAL, null),
    STRCON(Category.LITERAL, null),

    // 关键字
    AUTOTK(Category.KEYWORD, "auto"),
    BREAKTK(Category.KEYWORD, "break"),
    CASETK(Category.KEYWORD, "case"),
    CHARTK(Category.KEYWORD, "char"),
    CONSTTK(Category.KEYWORD, "const"),
    CONTINUETK(Category.KEYWORD, "continue"),
    DEFAULTTK(Category.KEYWORD, "default"),
    DOTK(Category.KEYWORD, "do"),
    DOUBLETK(Category.KEYWORD, "double"),
    ELSETK(Category.KEYWORD, "else"),
    ENUMTK(Category.KEYWORD, "enum"),
    EXTERNTK(Category.KEYWORD, "extern"),
    FLOATTK(Category.KEYWORD, "float"),
    FORTK(Category.KEYWORD, "for"),
    GOTOTK(Category.KEYWORD, "goto"),
    IFTK(Category.KEYWORD, "if"),
    INLINETK(Category.KEYWORD, "inline"),
    INTTK(Category.KEYWORD, "int"),
    LONGTK(Category.KEYWORD, "long"),
    REGISTERTK(Category.KEYWORD, "register"),
    RESTRICTTK(Category.KEYWORD, "restrict"),
    RETURNTK(Category.KEYWORD, "return"),
    SHORTTK(Category.KEYWORD, "short"),
    SIGNEDTK(Category.KEYWORD, "signed"),
    SIZEOFTK(Category.KEYWORD, "sizeof"),
    STATICTK(Category.KEYWORD, "static"),
    STRUCTTK(Category.KEYWORD, "struct"),
    SWITCHTK(Category.KEYWORD, "switch"),
    TYPEDEFTK(Category.KEYWORD, "typedef"),
    UNIONTK(Category.KEYWORD, "union"),
    UNSIGNEDTK(Category.KEYWORD, "unsigned"),
    VOIDTK(Category.KEYWORD, "void"),
    VOLATILETK(Category.KEYWORD, "volatile"),
    WHILETK(Category.KEYWORD, "while"),
    BOOLTK(Category.KEYWORD, "_Bool"),
    COMPLEXTK(Category.KEYWORD, "_Complex"),
    OFFSETOFTK(Category.KEYWORD, "offsetof"),

    // 运算符
    PLUS(Category.OPERATOR, "+"),
    MINU(Category.OPERATOR, "-"),
    MULT(Category.OPERATOR, "*"),
    DIV(Category.OPERATOR, "/"),
    MOD(Category.OPERATOR, "%"),
    BITAND(Category.OPERATOR, "&"),
    BITOR(Category.OPERATOR, "|"),
    XOR(Category.OPERATOR, "^"),
    BITNOT(Category.OPERATOR, "~"),
    NOT(Category.OPERATOR, "!"),
    SHL(Category.OPERATOR, "<<"),
    SHR(Category.OPERATOR, ">>"),
    AND(Category.OPERATOR, "&&"),
    OR(Category.OPERATOR, "||"),
    LSS(Category.OPERATOR, "<"),
    LEQ(Category.OPERATOR, "<="),
    GRE(Category.OPERATOR, ">"),
    GEQ(Category.OPERATOR, ">="),
    EQL(Category.OPERATOR, "=="),
    NEQ(Category.OPERATOR, "!="),
    ASSIGN(Category.OPERATOR, "="),
    MULTEQ(Category.OPERATOR, "*="),
    DIVEQ(Category.OPERATOR, "/="),
    MODEQ(Category.OPERATOR, "%="),
    PLUSEQ(Category.OPERATOR, "+="),
    MINUEQ(Category.OPERATOR, "-="),
    SHLEQ(Category.OPERATOR, "<<="),
    SHREQ(Category.OPERATOR, ">>="),
    ANDEQ(Category.OPERATOR, "&="),
    XOREQ(Category.OPERATOR, "^="),
    OREQ(Category.OPERATOR, "|="),
    INC(Category.OPERATOR, "++"),
    DEC(Category.OPERATOR, "--"),
    ARROW(Category.OPERATOR, "->"),
    PERIOD(Category.OPERATOR, "."),
    QUESTION(Category.OPERATOR, "?"),

    // 界符
    COLON(Category.PUNCTUATION, ":"),
    SEMICN(Category.PUNCTUATION, ";"),
    COMMA(Category.PUNCTUATION, ","),
    ELLIPSIS(Category.PUNCTUATION, "..."),
    LPARENT(Category.PUNCTUATION, "("),
    RPARENT(Category.PUNCTUATION, ")"),
    LBRACK(Category.PUNCTUATION, "["),
    RBRACK(Category.PUNCTUATION, "]"),
    LBRACE(Category.PUNCTUATION, "{"),
    RBRACE(Category.PUNCTUATION, "}"),

    // #pragma 行
    PRAGMA(Category.DIRECTIVE, null),

    EOF(Category.END, null);

    public enum Category {
        KEYWORD,
        IDENTIFIER,
        TYPE_NAME,
        LITERAL,
        OPERATOR,
        PUNCTUATION,
        DIRECTIVE,
        END
    }

    private static final Map<String, TokenType> RESERVED_WORDS;
    private static final Map<String, TokenType> SYMBOLS;

    static {
        Map<String, TokenType> words = new HashMap<>();
        Map<String, TokenType> symbols = new HashMap<>();
        for (TokenType type : values()) {
            if (type.spelling == null) {
                continue;
            }
            if (type.category == Category.KEYWORD) {
                words.put(type.spelling, type);
            } else {
                symbols.put(type.spelling, type);
            }
        }
        RESERVED_WORDS = Collections.unmodifiableMap(words);
        SYMBOLS = Collections.unmodifiableMap(symbols);
    }

    private final Category category;
    private final String spelling;

    TokenType(Category category, String spelling) {
        this.category = category;
        this.spelling = spelling;
    }

    public Category getCategory() {
        return category;
    }

    // 固定拼写的 token 返回其拼写，标识符和字面量返回 null
    public String getSpelling() {
        return spelling;
    }

    public static TokenType keyword(String word) {
        return RESERVED_WORDS.get(word);
    }

    // 运算符和界符，按拼写查找
    public static TokenType symbol(String text) {
        return SYMBOLS.get(text);
    }
}
