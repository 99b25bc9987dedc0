package frontend;

// Token 是词法分析生成的词（关键字、标识符、类型名、字面量、运算符、界符），生成后不再改变
public final class Token {
    public final TokenType type;
    public final String value;
    public final int lineNumber;
    public final int column;
    public final String file;

    public Token(TokenType type, String value, int lineNumber, int column, String file) {
        this.type = type;
        this.value = value;
        this.lineNumber = lineNumber;
        this.column = column;
        this.file = file;
    }

    public TokenType getType() {
        return type;
    }

    public TokenType.Category getCategory() {
        return type.getCategory();
    }

    public String getValue() {
        return value;
    }

    public Coord getCoord() {
        return new Coord(file, lineNumber, column);
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type.name() + " " + value;
    }
}
