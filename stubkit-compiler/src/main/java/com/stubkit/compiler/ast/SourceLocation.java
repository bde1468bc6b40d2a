package com.stubkit.compiler.ast;

/**
 * 源码位置信息（行列号从 1 开始）
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;

    public SourceLocation(String file, int line, int column) {
        this.file = file;
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
        return file + ":" + line + ":" + column;
    }
}
