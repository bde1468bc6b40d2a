package com.stubkit.compiler.lexer;

/**
 * 词法单元（行列号均从 1 开始）
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** 数字为 Long/Double，字符串为去引号后的内容，其余为 null */
    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    /** NAME 且文本等于 text */
    public boolean isName(String text) {
        return type == TokenType.NAME && lexeme.equals(text);
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d", type, lexeme, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d", type, lexeme, line, column);
    }
}
