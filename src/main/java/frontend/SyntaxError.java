package frontend;

// 语法错误：当前 token 不符合任何可用的产生式
public class SyntaxError extends CompileError {
    private final String lexeme;

    public SyntaxError(String detail, Token offending) {
        super(detail + " before '" + offending.value + "'", offending.getCoord());
        this.lexeme = offending.value;
    }

    public SyntaxError(String detail, String lexeme, Coord coord) {
        super(detail, coord);
        this.lexeme = lexeme;
    }

    public String getLexeme() {
        return lexeme;
    }
}
