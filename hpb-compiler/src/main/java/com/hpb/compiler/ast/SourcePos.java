package com.hpb.compiler.ast;

import java.util.Objects;

/**
 * 源码位置信息
 *
 * <p>仅用于诊断，不参与打印。</p>
 */
public final class SourcePos {
    private final String file;
    private final int line;
    private final int column;

    public static final SourcePos UNKNOWN = new SourcePos("<unknown>", 0, 0);

    public SourcePos(String file, int line, int column) {
        this.file = file != null ? file.intern() : null;
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

    /**
     * 同一行的下一列
     */
    public SourcePos nextColumn() {
        return new SourcePos(file, line, column + 1);
    }

    /**
     * 下一行行首（列归零）
     */
    public SourcePos nextLine() {
        return new SourcePos(file, line + 1, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePos)) return false;
        SourcePos other = (SourcePos) o;
        return line == other.line && column == other.column && Objects.equals(file, other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
