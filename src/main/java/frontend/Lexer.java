package frontend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// 词法分析器：每次调用 nextToken 读一个 token，typedef 过的名字识别为 TYPEID
public class Lexer {
    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    // # 12 "file.c" 1 3  或  #line 12 "file.c"
    private static final Pattern LINE_MARKER = Pattern.compile("^(?:line\\s+)?(\\d+)(?:\\s+\"((?:[^\"\\\\]|\\\\.)*)\")?.*$");

    private final String input;
    private final int length;
    private final ScopeStack scopes;
    private String fileName;
    private int pos = 0;
    private int lineNumber = 1;
    private int lineStart = 0; // 当前行首字符的下标，用于计算列号
    private boolean atLineStart = true; // 当前行在 pos 之前只有空白

    public Lexer(String source, String fileName, ScopeStack scopes) {
        this.input = source;
        this.length = source.length();
        this.fileName = fileName == null ? "" : fileName;
        this.scopes = scopes;
    }

    public Lexer(String source, ScopeStack scopes) {
        this(source, "", scopes);
    }

    // 一次性取完所有 token（含末尾的 EOF），只用于调试和测试
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type != TokenType.EOF);
        return tokens;
    }

    // 作用域变化后重新判断一个已经读出的名字是 TYPEID 还是 IDENFR
    public Token reclassify(Token token) {
        if (token.type != TokenType.IDENFR && token.type != TokenType.TYPEID) {
            return token;
        }
        TokenType type = scopes.isTypedef(token.value) ? TokenType.TYPEID : TokenType.IDENFR;
        if (type == token.type) {
            return token;
        }
        log.trace("reclassify '{}' as {} at {}", token.value, type, token.getCoord());
        return new Token(type, token.value, token.lineNumber, token.column, token.file);
    }

    public Token nextToken() {
        Token token = scan();
        log.trace("token {} '{}' at {}", token.type, token.value, token.getCoord());
        return token;
    }

    private Token scan() {
        while (pos < length) {
            char current = input.charAt(pos);
            if (isWhitespace(current)) {
                advance();
                continue;
            }

            // 处理 '/',注释或除法运算符
            if (current == '/' && pos + 1 < length) {
                char next = input.charAt(pos + 1);
                // 单行注释
                if (next == '/') {
                    while (pos < length && input.charAt(pos) != '\n') {
                        pos++;
                    }
                    continue;
                }
                // 多行注释
                if (next == '*') {
                    Coord start = here();
                    advance();
                    advance();
                    boolean foundEnd = false;
                    while (pos < length) {
                        if (input.charAt(pos) == '*' && pos + 1 < length && input.charAt(pos + 1) == '/') {
                            advance();
                            advance();
                            foundEnd = true;
                            break;
                        }
                        advance();
                    }
                    if (!foundEnd) {
                        throw new LexError("unterminated comment", start);
                    }
                    continue;
                }
            }

            // 行首的 '#': 行标记或 #pragma
            if (current == '#' && atLineStart) {
                Token pragma = directive();
                if (pragma != null) {
                    return pragma;
                }
                continue;
            }

            atLineStart = false;
            int tokenLine = lineNumber;
            int tokenColumn = pos - lineStart + 1;

            // 宽字符/宽字符串前缀 L
            if (current == 'L' && pos + 1 < length
                    && (input.charAt(pos + 1) == '\'' || input.charAt(pos + 1) == '"')) {
                pos++;
                return input.charAt(pos) == '\''
                        ? charConstant(pos - 1, tokenLine, tokenColumn)
                        : stringLiteral(pos - 1, tokenLine, tokenColumn);
            }
            // 处理标识符或保留字
            if (isLetter(current) || current == '_') {
                int start = pos;
                while (pos < length && (isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
                    pos++;
                }
                String lexeme = input.substring(start, pos);
                TokenType type = TokenType.keyword(lexeme);
                if (type == null) {
                    // 词法分析和作用域的耦合：typedef 过的名字是类型名
                    type = scopes.isTypedef(lexeme) ? TokenType.TYPEID : TokenType.IDENFR;
                }
                return new Token(type, lexeme, tokenLine, tokenColumn, fileName);
            }
            // 处理数字常量
            if (isDigit(current) || (current == '.' && pos + 1 < length && isDigit(input.charAt(pos + 1)))) {
                return number(tokenLine, tokenColumn);
            }
            if (current == '"') {
                return stringLiteral(pos, tokenLine, tokenColumn);
            }
            if (current == '\'') {
                return charConstant(pos, tokenLine, tokenColumn);
            }
            // 处理其他运算符和符号，最长匹配
            for (int len = 3; len >= 1; len--) {
                if (pos + len <= length) {
                    String text = input.substring(pos, pos + len);
                    TokenType type = TokenType.symbol(text);
                    if (type != null) {
                        pos += len;
                        return new Token(type, text, tokenLine, tokenColumn, fileName);
                    }
                }
            }
            throw new LexError("illegal character '" + printable(current) + "'", new Coord(fileName, tokenLine, tokenColumn));
        }
        return new Token(TokenType.EOF, "", lineNumber, pos - lineStart + 1, fileName);
    }

    // 整数、浮点数常量（十进制、八进制、十六进制、二进制，十六进制浮点数）
    private Token number(int tokenLine, int tokenColumn) {
        int start = pos;
        Coord coord = new Coord(fileName, tokenLine, tokenColumn);
        TokenType type = TokenType.INTCON;
        char prefix = pos + 1 < length && input.charAt(pos) == '0' ? input.charAt(pos + 1) : 0;
        if (prefix == 'x' || prefix == 'X') {
            pos += 2;
            int digitsStart = pos;
            while (pos < length && isHexDigit(input.charAt(pos))) {
                pos++;
            }
            boolean hasDigits = pos > digitsStart;
            if (pos < length && input.charAt(pos) == '.') {
                type = TokenType.FLOATCON;
                pos++;
                int fractionStart = pos;
                while (pos < length && isHexDigit(input.charAt(pos))) {
                    pos++;
                }
                hasDigits |= pos > fractionStart;
            }
            if (!hasDigits) {
                throw new LexError("invalid hex constant", coord);
            }
            if (pos < length && (input.charAt(pos) == 'p' || input.charAt(pos) == 'P')) {
                type = TokenType.FLOATCON;
                exponent(coord);
            } else if (type == TokenType.FLOATCON) {
                // 十六进制浮点数必须有 p 指数
                throw new LexError("hexadecimal floating constant requires an exponent", coord);
            }
            if (type == TokenType.FLOATCON) {
                skipFloatSuffix();
            } else {
                skipIntegerSuffix();
            }
        } else if (prefix == 'b' || prefix == 'B') {
            pos += 2;
            int digitsStart = pos;
            while (pos < length && (input.charAt(pos) == '0' || input.charAt(pos) == '1')) {
                pos++;
            }
            if (pos == digitsStart) {
                throw new LexError("invalid binary constant", coord);
            }
            skipIntegerSuffix();
        } else {
            while (pos < length && isDigit(input.charAt(pos))) {
                pos++;
            }
            if (pos < length && input.charAt(pos) == '.') {
                type = TokenType.FLOATCON;
                pos++;
                while (pos < length && isDigit(input.charAt(pos))) {
                    pos++;
                }
            }
            if (pos < length && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
                type = TokenType.FLOATCON;
                exponent(coord);
            }
            if (type == TokenType.FLOATCON) {
                skipFloatSuffix();
            } else {
                String digits = input.substring(start, pos);
                if (digits.length() > 1 && digits.charAt(0) == '0'
                        && (digits.indexOf('8') >= 0 || digits.indexOf('9') >= 0)) {
                    throw new LexError("invalid octal constant '" + digits + "'", coord);
                }
                skipIntegerSuffix();
            }
        }
        if (pos < length && (isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
            throw new LexError("invalid suffix on constant '" + input.substring(start, pos + 1) + "'", coord);
        }
        return new Token(type, input.substring(start, pos), tokenLine, tokenColumn, fileName);
    }

    // 指数部分：e/E 或 p/P，可选符号，至少一位十进制数字
    private void exponent(Coord coord) {
        pos++;
        if (pos < length && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
            pos++;
        }
        int expStart = pos;
        while (pos < length && isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos == expStart) {
            throw new LexError("malformed exponent in floating constant", coord);
        }
    }

    private void skipFloatSuffix() {
        if (pos < length && "fFlL".indexOf(input.charAt(pos)) >= 0) {
            pos++;
        }
    }

    private void skipIntegerSuffix() {
        while (pos < length && "uUlL".indexOf(input.charAt(pos)) >= 0) {
            pos++;
        }
    }

    // 字符串常量，保留两边的引号和转义，start 指向 L 前缀或起始双引号
    private Token stringLiteral(int start, int tokenLine, int tokenColumn) {
        pos++; // 跳过起始双引号
        while (pos < length) {
            char ch = input.charAt(pos);
            if (ch == '\\' && pos + 1 < length && input.charAt(pos + 1) != '\n') {
                pos += 2;
            } else if (ch == '"') {
                pos++;
                return new Token(TokenType.STRCON, input.substring(start, pos), tokenLine, tokenColumn, fileName);
            } else if (ch == '\n') {
                break;
            } else {
                pos++;
            }
        }
        throw new LexError("unterminated string literal", new Coord(fileName, tokenLine, tokenColumn));
    }

    // 字符常量，如 'b'、'\n'、L'x'
    private Token charConstant(int start, int tokenLine, int tokenColumn) {
        Coord coord = new Coord(fileName, tokenLine, tokenColumn);
        pos++; // 跳过起始单引号
        int contentStart = pos;
        while (pos < length) {
            char ch = input.charAt(pos);
            if (ch == '\\' && pos + 1 < length && input.charAt(pos + 1) != '\n') {
                pos += 2;
            } else if (ch == '\'') {
                if (pos == contentStart) {
                    throw new LexError("empty character constant", coord);
                }
                pos++;
                return new Token(TokenType.CHRCON, input.substring(start, pos), tokenLine, tokenColumn, fileName);
            } else if (ch == '\n') {
                break;
            } else {
                pos++;
            }
        }
        throw new LexError("unterminated character constant", coord);
    }

    // 行标记重置坐标并返回 null，#pragma 变成 token，其他指令报错
    private Token directive() {
        int tokenLine = lineNumber;
        int tokenColumn = pos - lineStart + 1;
        Coord coord = new Coord(fileName, tokenLine, tokenColumn);
        int start = pos + 1;
        int end = input.indexOf('\n', start);
        if (end < 0) {
            end = length;
        }
        String text = input.substring(start, end).trim();
        // 跳到换行符（由 advance 计数）
        pos = end;

        if (text.isEmpty()) {
            return null;
        }
        if (text.startsWith("pragma") && (text.length() == 6 || Character.isWhitespace(text.charAt(6)))) {
            return new Token(TokenType.PRAGMA, text.substring(6).trim(), tokenLine, tokenColumn, fileName);
        }
        Matcher m = LINE_MARKER.matcher(text);
        if (m.matches()) {
            if (pos < length) {
                advance(); // 换行
            }
            // 行标记给出的是下一行的行号
            lineNumber = Integer.parseInt(m.group(1));
            if (m.group(2) != null) {
                fileName = m.group(2);
            }
            log.debug("line marker: now at {}:{}", fileName, lineNumber);
            return null;
        }
        throw new LexError("directives not supported yet: #" + text, coord);
    }

    private Coord here() {
        return new Coord(fileName, lineNumber, pos - lineStart + 1);
    }

    private void advance() {
        if (input.charAt(pos) == '\n') {
            lineNumber++;
            lineStart = pos + 1;
            atLineStart = true;
        }
        pos++;
    }

    private static String printable(char c) {
        return c < ' ' ? String.format("\\x%02x", (int) c) : String.valueOf(c);
    }

    // 判断空白字符
    private boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f' || c == '\u000B';
    }

    // 判断字母
    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    // 判断数字
    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    // 判断字母或数字
    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
