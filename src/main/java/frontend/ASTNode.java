package frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// 语法树节点，构造后不可变
public final class ASTNode {
    private final NodeKind kind;
    private final List<ASTNode> children;
    private final Map<String, String> attributes;
    private final Coord coord;

    ASTNode(NodeKind kind, Map<String, String> attributes, List<ASTNode> children, Coord coord) {
        this.kind = kind;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        List<ASTNode> copy = new ArrayList<>(children.size());
        for (ASTNode child : children) {
            if (child != null) {
                copy.add(child);
            }
        }
        this.children = Collections.unmodifiableList(copy);
        this.coord = coord;
    }

    public NodeKind getKind() {
        return kind;
    }

    public List<ASTNode> getChildren() {
        return children;
    }

    public ASTNode getChild(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public Coord getCoord() {
        return coord;
    }

    // 常用属性的快捷方式

    public String getName() {
        return attributes.get("name");
    }

    public String getType() {
        return attributes.get("type");
    }

    public String getValue() {
        return attributes.get("value");
    }

    public String getOp() {
        return attributes.get("op");
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return attributes.isEmpty() ? kind.getTag() : kind.getTag() + attributes;
    }
}
