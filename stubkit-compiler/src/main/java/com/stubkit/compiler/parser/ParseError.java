package com.stubkit.compiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 结构化解析错误：消息 + 可选的文件名、行号、源码片段和列号
 *
 * <p>{@link #toString()} 的输出格式：</p>
 * <pre>
 *   File: "foo.pyi", line 2
 *     this is not valid
 *          ^
 * ParseError: syntax error
 * </pre>
 */
public final class ParseError {
    private final String message;
    private final Integer line;
    private final String filename;
    private final String text;
    private final Integer column;

    public ParseError(String message) {
        this(message, null, null, null, null);
    }

    public ParseError(String message, Integer line, String filename, String text, Integer column) {
        this.message = Objects.requireNonNull(message, "message");
        this.line = line;
        this.filename = filename;
        this.text = text;
        this.column = column;
    }

    public String getMessage() {
        return message;
    }

    public Integer getLine() {
        return line;
    }

    public String getFilename() {
        return filename;
    }

    public String getText() {
        return text;
    }

    /** 列号从 1 开始，相对于未去缩进的 {@link #getText()} */
    public Integer getColumn() {
        return column;
    }

    /**
     * 按显示规则渲染的各行
     */
    public List<String> toLines() {
        List<String> lines = new ArrayList<String>();
        if (filename != null || line != null) {
            lines.add("  File: \"" + (filename != null ? filename : "None")
                    + "\", line " + (line != null ? line.toString() : "None"));
        }
        if (text != null && column != null) {
            String stripped = stripLeading(text);
            int indent = text.length() - stripped.length();
            lines.add("    " + stripped.trim());
            lines.add("    " + spaces(column - indent - 1) + "^");
        }
        lines.add("ParseError: " + message);
        return lines;
    }

    @Override
    public String toString() {
        return String.join("\n", toLines());
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return s.substring(i);
    }

    private static String spaces(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
