package frontend;

public class Symbol {
    public final String name; // 标识符名称
    public final NameKind kind; // 普通标识符或 typedef 名
    public final int scopeLevel; // 作用域序号，文件作用域为 1
    public final Coord coord; // 声明位置
    public final Long constantValue; // 枚举常量的值，其他符号为 null

    public Symbol(String name, NameKind kind, int scopeLevel, Coord coord) {
        this(name, kind, scopeLevel, coord, null);
    }

    public Symbol(String name, NameKind kind, int scopeLevel, Coord coord, Long constantValue) {
        this.name = name;
        this.kind = kind;
        this.scopeLevel = scopeLevel;
        this.coord = coord;
        this.constantValue = constantValue;
    }

    public boolean isTypedef() {
        return kind == NameKind.TYPEDEF;
    }

    @Override
    public String toString() {
        return scopeLevel + " " + name + " " + kind;
    }
}
