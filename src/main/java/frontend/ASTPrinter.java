package frontend;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

// 缩进的树形文本输出，每个节点一行：标签、属性，可选坐标
public class ASTPrinter {
    private static final String INDENT = "  ";

    private final boolean showCoord;

    public ASTPrinter() {
        this(false);
    }

    public ASTPrinter(boolean showCoord) {
        this.showCoord = showCoord;
    }

    public String show(ASTNode root) {
        StringBuilder sb = new StringBuilder();
        show(root, sb);
        return sb.toString();
    }

    // 先序遍历，子节点逆序压栈
    private void show(ASTNode root, StringBuilder sb) {
        Deque<ASTNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);
        while (!nodes.isEmpty()) {
            ASTNode node = nodes.pop();
            int depth = depths.pop();
            line(node, depth, sb);
            List<ASTNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                nodes.push(children.get(i));
                depths.push(depth + 1);
            }
        }
    }

    private void line(ASTNode node, int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        sb.append(node.getKind().getTag()).append(':');
        boolean first = true;
        for (Map.Entry<String, String> entry : node.getAttributes().entrySet()) {
            sb.append(first ? " " : ", ").append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        if (showCoord && node.getCoord() != null) {
            sb.append(" (at ").append(node.getCoord()).append(')');
        }
        sb.append('\n');
    }
}
