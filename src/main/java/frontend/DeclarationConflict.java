package frontend;

// 同一作用域内把 typedef 名重新声明为普通名字（或者反过来）
public class DeclarationConflict extends CompileError {
    private final String name;

    public DeclarationConflict(String name, NameKind previous, Coord coord) {
        super((previous == NameKind.TYPEDEF ? "Non-typedef '" : "Typedef '") + name
                + "' previously declared as " + (previous == NameKind.TYPEDEF ? "typedef" : "non-typedef")
                + " in this scope", coord);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
