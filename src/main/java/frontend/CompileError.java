package frontend;

// 所有前端错误的基类，消息以坐标开头，例如 year.c:12:5: ...
public abstract class CompileError extends RuntimeException {
    private final Coord coord;
    private final String detail;

    protected CompileError(String detail, Coord coord) {
        super(coord + ": " + detail);
        this.coord = coord;
        this.detail = detail;
    }

    public Coord getCoord() {
        return coord;
    }

    // 不带坐标前缀的错误描述
    public String getDetail() {
        return detail;
    }

    public int getLineNumber() {
        return coord.line;
    }
}
