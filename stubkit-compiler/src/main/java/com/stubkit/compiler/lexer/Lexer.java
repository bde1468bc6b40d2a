package com.stubkit.compiler.lexer;

import com.stubkit.compiler.parser.ParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 存根语言词法分析器
 *
 * <p>按行计算缩进并生成 INDENT/DEDENT；空行、纯注释行不产生任何 token；
 * 括号内的换行被忽略。普通注释被丢弃，{@code # type:} 注释生成 TYPECOMMENT，
 * {@code # type: ignore} 同样丢弃。</p>
 */
public class Lexer {
    private static final int TAB_SIZE = 8;

    // 关键词映射表（只读，所有解析调用共享）
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();
        map.put("def", TokenType.KW_DEF);
        map.put("class", TokenType.KW_CLASS);
        map.put("import", TokenType.KW_IMPORT);
        map.put("from", TokenType.KW_FROM);
        map.put("as", TokenType.KW_AS);
        map.put("if", TokenType.KW_IF);
        map.put("elif", TokenType.KW_ELIF);
        map.put("else", TokenType.KW_ELSE);
        map.put("or", TokenType.KW_OR);
        map.put("and", TokenType.KW_AND);
        map.put("pass", TokenType.KW_PASS);
        map.put("raise", TokenType.KW_RAISE);
        map.put("PYTHONCODE", TokenType.KW_PYTHONCODE);
        // TypeVar / NamedTuple / True / None 等是普通 NAME，由解析器按上下文识别
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<Token>();
    private final Deque<Integer> indentStack = new ArrayDeque<Integer>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int bracketDepth = 0;
    private boolean atLineStart = true;

    // 当前 token 的起始位置
    private int tokenLine = 1;
    private int tokenColumn = 1;

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     *
     * @throws com.stubkit.compiler.parser.ParseException 非法字符或缩进不一致
     */
    public List<Token> scanTokens() {
        indentStack.push(0);
        while (!isAtEnd()) {
            if (atLineStart && bracketDepth == 0 && !beginLine()) {
                continue;
            }
            if (isAtEnd()) break;
            start = current;
            tokenLine = line;
            tokenColumn = current - lineStart + 1;
            scanToken();
        }

        tokenLine = line;
        tokenColumn = current - lineStart + 1;
        if (!tokens.isEmpty() && !lastIs(TokenType.NEWLINE) && !lastIs(TokenType.DEDENT)) {
            addSynthetic(TokenType.NEWLINE);
        }
        while (indentStack.peek() > 0) {
            indentStack.pop();
            addSynthetic(TokenType.DEDENT);
        }
        addSynthetic(TokenType.EOF);
        return tokens;
    }

    /**
     * 处理行首：计算缩进宽度，跳过空行和注释行。
     *
     * @return 本行有需要扫描的内容时返回 true
     */
    private boolean beginLine() {
        int width = 0;
        int p = current;
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            p++;
        }
        current = p;
        if (isAtEnd()) {
            return false;
        }

        char c = source.charAt(p);
        if (c == '\r' || c == '\n') {
            // 空行
            advance();
            if (c == '\r' && peek() == '\n') advance();
            newLine();
            return false;
        }
        if (c == '#') {
            if (typeCommentLength(p + 1) > 0) {
                // 独占一行的类型注释附着到上一条语句，不参与缩进计算
                atLineStart = false;
                return true;
            }
            skipToLineEnd();
            return false;
        }

        atLineStart = false;
        tokenLine = line;
        tokenColumn = width + 1;
        applyIndentation(width);
        return true;
    }

    private void applyIndentation(int width) {
        int top = indentStack.peek();
        if (width > top) {
            indentStack.push(width);
            addSynthetic(TokenType.INDENT);
        } else if (width < top) {
            while (width < indentStack.peek()) {
                indentStack.pop();
                addSynthetic(TokenType.DEDENT);
            }
            if (width != indentStack.peek()) {
                throw new ParseException("Invalid indentation", tokenLine, tokenColumn);
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ':
            case '\t':
            case '\f':
            case '\r':
                break;

            case '\n':
                if (bracketDepth == 0) {
                    if (!tokens.isEmpty() && !lastIs(TokenType.NEWLINE)) {
                        addToken(TokenType.NEWLINE);
                    }
                    atLineStart = true;
                }
                newLine();
                break;

            case '\\':
                // 显式续行
                if (peek() == '\r') advance();
                if (peek() == '\n') {
                    advance();
                    newLine();
                } else {
                    illegalCharacter(c);
                }
                break;

            case '#':
                comment();
                break;

            case '(': bracketDepth++; addToken(TokenType.LPAREN); break;
            case ')': closeBracket(); addToken(TokenType.RPAREN); break;
            case '[': bracketDepth++; addToken(TokenType.LBRACKET); break;
            case ']': closeBracket(); addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '@': addToken(TokenType.AT); break;
            case '?': addToken(TokenType.QUESTION); break;

            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case ':':
                addToken(match('=') ? TokenType.COLONEQUALS : TokenType.COLON);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    illegalCharacter(c);
                }
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '*':
                addToken(match('*') ? TokenType.DOUBLE_STAR : TokenType.STAR);
                break;

            case '-':
                if (match('>')) {
                    addToken(TokenType.ARROW);
                } else if (isDigit(peek())) {
                    number();
                } else {
                    illegalCharacter(c);
                }
                break;

            case '"':
            case '\'':
                string(c);
                break;

            case '`':
                backquotedName();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    illegalCharacter(c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        int index = current + distance;
        if (index >= source.length()) return '\0';
        return source.charAt(index);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private void closeBracket() {
        if (bracketDepth > 0) bracketDepth--;
    }

    private void skipToLineEnd() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private boolean lastIs(TokenType type) {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).getType() == type;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, tokenLine, tokenColumn));
    }

    private void addSynthetic(TokenType type) {
        tokens.add(new Token(type, "", null, tokenLine, tokenColumn));
    }

    // === 复杂 Token 扫描 ===

    /**
     * 从 '#' 之后的位置判断是否为有效的类型注释。
     *
     * @return "type:" 之后的偏移量（相对 from），不是类型注释或为 ignore 时返回 0
     */
    private int typeCommentLength(int from) {
        int p = from;
        while (p < source.length() && (source.charAt(p) == ' ' || source.charAt(p) == '\t')) p++;
        if (!source.startsWith("type:", p)) {
            return 0;
        }
        int end = p + "type:".length();
        int q = end;
        while (q < source.length() && (source.charAt(q) == ' ' || source.charAt(q) == '\t')) q++;
        if (source.startsWith("ignore", q)) {
            int after = q + "ignore".length();
            if (after >= source.length() || !isAlphaNumeric(source.charAt(after))) {
                return 0;
            }
        }
        return end - from;
    }

    private void comment() {
        int length = typeCommentLength(current);
        if (length > 0) {
            current += length;
            addToken(TokenType.TYPECOMMENT);
            return;
        }
        skipToLineEnd();
    }

    private void string(char quote) {
        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
        }
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw new ParseException("Unterminated string literal", tokenLine, tokenColumn);
            }
            char c = peek();
            if (c == quote) {
                if (!triple) {
                    advance();
                    break;
                }
                if (peekNext() == quote && peekAt(2) == quote) {
                    advance();
                    advance();
                    advance();
                    break;
                }
            }
            if (c == '\n' && !triple) {
                throw new ParseException("Unterminated string literal", tokenLine, tokenColumn);
            }
            advance();
            if (c == '\\' && !isAtEnd()) {
                c = advance();
            }
            if (c == '\n') {
                newLine();
            }
            value.append(c);
        }
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private void backquotedName() {
        while (!isAtEnd() && peek() != '`' && peek() != '\n') advance();
        if (peek() != '`') {
            throw new ParseException("Unterminated backquoted name", tokenLine, tokenColumn);
        }
        advance();
        addToken(TokenType.NAME);
    }

    private void number() {
        while (isDigit(peek())) advance();

        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek())) advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }

        String text = source.substring(start, current);
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT_LITERAL, Double.valueOf(text));
            } else {
                addToken(TokenType.INT_LITERAL, Long.valueOf(text));
            }
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid number literal: " + text, tokenLine, tokenColumn);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.NAME;
        addToken(type);
    }

    private void illegalCharacter(char c) {
        throw new ParseException("Illegal character '" + c + "'", tokenLine, tokenColumn);
    }
}
