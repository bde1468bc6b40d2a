package com.stubkit.compiler.parser;

import com.stubkit.compiler.lexer.Token;

/**
 * 解析异常：流水线内任意阶段失败时抛出，由 {@code StubParser} 转换为 {@link ParseError}
 */
public class ParseException extends RuntimeException {
    private final Integer line;
    private final Integer column;

    public ParseException(String message) {
        this(message, null, null);
    }

    public ParseException(String message, int line) {
        this(message, Integer.valueOf(line), null);
    }

    public ParseException(String message, Token token) {
        this(message, token != null ? Integer.valueOf(token.getLine()) : null,
                token != null ? Integer.valueOf(token.getColumn()) : null);
    }

    public ParseException(String message, Integer line, Integer column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    /** 出错行号，未知时为 null */
    public Integer getLine() {
        return line;
    }

    /** 出错列号（从 1 开始），未知时为 null */
    public Integer getColumn() {
        return column;
    }

    /**
     * 附加文件名与源码行，生成结构化错误
     */
    public ParseError toParseError(String filename, String text) {
        return new ParseError(getMessage(), line, filename, text, column);
    }
}
