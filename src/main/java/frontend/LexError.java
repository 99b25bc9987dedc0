package frontend;

// 词法错误：无法识别的字符、未闭合的字面量或注释
public class LexError extends CompileError {

    public LexError(String detail, Coord coord) {
        super(detail, coord);
    }
}
