package frontend;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

// 把语法树输出为 Graphviz digraph，节点按先序编号 node_0, node_1, ...
public class GraphEmitter {
    public static final String DEFAULT_GRAPH_NAME = "AST";

    private static final Pattern DOT_ID = Pattern.compile("[A-Za-z_][A-Za-z_0-9]*");
    // DOT 关键字不区分大小写，不能直接作为名字
    private static final Set<String> DOT_KEYWORDS = new HashSet<>(Arrays.asList(
            "node", "edge", "graph", "digraph", "subgraph", "strict"));

    private final String graphName;

    public GraphEmitter() {
        this(DEFAULT_GRAPH_NAME);
    }

    public GraphEmitter(String graphName) {
        this.graphName = graphName;
    }

    public String emit(ASTNode root) {
        StringBuilder out = new StringBuilder();
        try {
            emit(root, out);
        } catch (IOException e) {
            // StringBuilder 不会抛出 IOException
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public void emit(ASTNode root, Appendable out) throws IOException {
        // 第一遍：先序编号
        List<ASTNode> order = new ArrayList<>();
        Map<ASTNode, Integer> ids = new IdentityHashMap<>();
        number(root, order, ids);

        // 第二遍：节点语句和边语句
        out.append("digraph ").append(graphId(graphName)).append(" {\n");
        for (ASTNode node : order) {
            String id = "node_" + ids.get(node);
            out.append(id).append(" [label=\"").append(escape(label(node))).append("\"];\n");
            for (ASTNode child : node.getChildren()) {
                out.append(id).append(" -> node_").append(String.valueOf(ids.get(child))).append(";\n");
            }
        }
        out.append("}\n");
    }

    // 显式栈做先序遍历，子节点逆序压栈
    private static void number(ASTNode root, List<ASTNode> order, Map<ASTNode, Integer> ids) {
        Deque<ASTNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ASTNode node = stack.pop();
            if (ids.containsKey(node)) {
                throw new IllegalStateException("node reachable twice: " + node);
            }
            ids.put(node, order.size());
            order.add(node);
            List<ASTNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    static String label(ASTNode node) {
        String salient = salientAttribute(node.getKind());
        String value = salient == null ? null : node.getAttribute(salient);
        if (value == null || value.isEmpty()) {
            return node.getKind().getTag();
        }
        return node.getKind().getTag() + ": " + value;
    }

    // 每种节点在图中显示的属性
    static String salientAttribute(NodeKind kind) {
        switch (kind) {
            case FUNC_DEF:
            case DECL:
            case TYPEDEF:
            case MEMBER:
            case STRUCT:
            case UNION:
            case ENUM:
            case ENUMERATOR:
            case LABEL:
            case GOTO:
            case ID:
            case NAMED_INITIALIZER:
                return "name";
            case PTR_DECL:
            case ARRAY_DECL:
                return "quals";
            case TYPE_NAME:
                return "type";
            case BINARY_OP:
            case UNARY_OP:
            case ASSIGNMENT:
            case STRUCT_REF:
                return "op";
            case CONSTANT:
            case PRAGMA:
                return "value";
            case TRANSLATION_UNIT:
            case DECL_LIST:
            case FUNC_DECL:
            case PARAM_LIST:
            case ELLIPSIS_PARAM:
            case COMPOUND:
            case IF:
            case WHILE:
            case DO_WHILE:
            case FOR:
            case SWITCH:
            case CASE:
            case DEFAULT:
            case BREAK:
            case CONTINUE:
            case RETURN:
            case EMPTY_STATEMENT:
            case TERNARY_OP:
            case CAST:
            case FUNC_CALL:
            case ARRAY_REF:
            case EXPR_LIST:
            case INIT_LIST:
            case COMPOUND_LITERAL:
                return null;
            default:
                throw new IllegalStateException("unknown node kind: " + kind);
        }
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String graphId(String name) {
        if (DOT_ID.matcher(name).matches() && !DOT_KEYWORDS.contains(name.toLowerCase(Locale.ROOT))) {
            return name;
        }
        return "\"" + escape(name) + "\"";
    }
}
