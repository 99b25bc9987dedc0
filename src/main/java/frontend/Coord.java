package frontend;

// 源码坐标：文件名 + 行号 + 列号（列号从 1 开始，0 表示未知）
public final class Coord {
    public final String file;
    public final int line;
    public final int column;

    public Coord(String file, int line, int column) {
        this.file = file == null ? "" : file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!file.isEmpty()) {
            sb.append(file).append(':');
        }
        sb.append(line);
        if (column > 0) {
            sb.append(':').append(column);
        }
        return sb.toString();
    }
}
