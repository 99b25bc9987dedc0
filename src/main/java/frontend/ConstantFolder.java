package frontend;

import java.util.function.Function;

// 整型常量表达式求值，用于枚举值和数组下标指示符，求不出值时返回 null
public class ConstantFolder {
    private final Function<String, Long> constants;

    public ConstantFolder(Function<String, Long> constants) {
        this.constants = constants;
    }

    public Long evaluate(ASTNode node) {
        switch (node.getKind()) {
            case CONSTANT:
                return constant(node);
            case ID:
                return constants.apply(node.getName());
            case CAST:
                return evaluate(node.getChild(1));
            case UNARY_OP:
                return unary(node.getOp(), evaluate(node.getChild(0)));
            case BINARY_OP: {
                Long left = evaluate(node.getChild(0));
                Long right = evaluate(node.getChild(1));
                return left == null || right == null ? null : binary(node.getOp(), left, right);
            }
            case TERNARY_OP: {
                Long cond = evaluate(node.getChild(0));
                if (cond == null) {
                    return null;
                }
                return evaluate(node.getChild(cond != 0 ? 1 : 2));
            }
            default:
                return null;
        }
    }

    private Long constant(ASTNode node) {
        String type = node.getType();
        String text = node.getValue();
        if ("int".equals(type)) {
            return parseInteger(text);
        }
        if ("char".equals(type)) {
            return parseChar(text);
        }
        return null;
    }

    static Long parseInteger(String text) {
        int end = text.length();
        while (end > 0 && "uUlL".indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        String digits = text.substring(0, end);
        try {
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                return Long.parseUnsignedLong(digits.substring(2), 16);
            }
            if (digits.startsWith("0b") || digits.startsWith("0B")) {
                return Long.parseUnsignedLong(digits.substring(2), 2);
            }
            if (digits.length() > 1 && digits.startsWith("0")) {
                return Long.parseUnsignedLong(digits.substring(1), 8);
            }
            return Long.parseUnsignedLong(digits);
        } catch (NumberFormatException e) {
            // 超出 64 位
            return null;
        }
    }

    // 'a'、'\n'、'\x41'、'\101'，多字符常量不求值
    static Long parseChar(String text) {
        int open = text.indexOf('\'');
        String body = text.substring(open + 1, text.length() - 1);
        if (body.length() == 1) {
            return (long) body.charAt(0);
        }
        if (body.charAt(0) != '\\') {
            return null;
        }
        char esc = body.charAt(1);
        if (body.length() == 2) {
            switch (esc) {
                case 'n': return 10L;
                case 't': return 9L;
                case 'r': return 13L;
                case '0': return 0L;
                case 'a': return 7L;
                case 'b': return 8L;
                case 'f': return 12L;
                case 'v': return 11L;
                case '\\': return 92L;
                case '\'': return 39L;
                case '"': return 34L;
                case '?': return 63L;
                default: break;
            }
        }
        try {
            if (esc == 'x') {
                return Long.parseLong(body.substring(2), 16);
            }
            if (esc >= '0' && esc <= '7') {
                return Long.parseLong(body.substring(1), 8);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }

    private static Long unary(String op, Long value) {
        if (value == null) {
            return null;
        }
        switch (op) {
            case "-": return -value;
            case "+": return value;
            case "~": return ~value;
            case "!": return value == 0 ? 1L : 0L;
            default: return null;
        }
    }

    private static Long binary(String op, long l, long r) {
        switch (op) {
            case "+": return l + r;
            case "-": return l - r;
            case "*": return l * r;
            case "/": return r == 0 ? null : l / r;
            case "%": return r == 0 ? null : l % r;
            case "<<": return l << r;
            case ">>": return l >> r;
            case "&": return l & r;
            case "|": return l | r;
            case "^": return l ^ r;
            case "&&": return (l != 0 && r != 0) ? 1L : 0L;
            case "||": return (l != 0 || r != 0) ? 1L : 0L;
            case "==": return l == r ? 1L : 0L;
            case "!=": return l != r ? 1L : 0L;
            case "<": return l < r ? 1L : 0L;
            case "<=": return l <= r ? 1L : 0L;
            case ">": return l > r ? 1L : 0L;
            case ">=": return l >= r ? 1L : 0L;
            default: return null;
        }
    }
}
