package com.stubkit.compiler.parser;

import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.cond.Condition;
import com.stubkit.compiler.ast.decl.Declaration;
import com.stubkit.compiler.ast.decl.QualifiedName;
import com.stubkit.compiler.ast.decl.StubFile;
import com.stubkit.compiler.ast.type.TypeExpr;
import com.stubkit.compiler.lexer.Lexer;
import com.stubkit.compiler.lexer.Token;
import com.stubkit.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.stubkit.compiler.lexer.TokenType.*;

/**
 * 存根语言语法分析器（递归下降）
 *
 * <p>只负责构建未解析的原始声明树；名称解析、条件求值和签名合并由
 * {@code analysis} 包完成。任何语法错误立即抛出 {@link ParseException}。</p>
 */
public class Parser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 100;

    final String fileName;
    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int position;
    private int nestingDepth;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final ConditionParser conditionParser = new ConditionParser(this);

    public Parser(Lexer lexer, String fileName) {
        this(lexer, fileName, DEFAULT_MAX_NESTING_DEPTH);
    }

    public Parser(Lexer lexer, String fileName, int maxNestingDepth) {
        this.fileName = fileName;
        this.tokens = lexer.scanTokens();
        this.maxNestingDepth = maxNestingDepth;
        this.position = 0;
        this.current = tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        int next = Math.min(position + 1, tokens.size() - 1);
        return tokens.get(next);
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 向前看一个 token
     */
    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 当前 token 是否为指定文本的 NAME
     */
    boolean checkName(String text) {
        return current.isName(text);
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报语法错误
     */
    Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw syntaxError(current, type);
    }

    /**
     * 语句结束：NEWLINE 或文件结束
     */
    void expectNewline() {
        if (match(NEWLINE) || check(EOF)) {
            return;
        }
        throw syntaxError(current, NEWLINE);
    }

    /**
     * 构造 "syntax error, unexpected X, expecting A or B" 形式的错误
     */
    ParseException syntaxError(Token unexpected, TokenType... expected) {
        StringBuilder sb = new StringBuilder("syntax error, unexpected ");
        sb.append(unexpected.getType().getDisplayName());
        if (expected.length > 0) {
            sb.append(", expecting ");
            for (int i = 0; i < expected.length; i++) {
                if (i > 0) sb.append(" or ");
                sb.append(expected[i].getDisplayName());
            }
        }
        return new ParseException(sb.toString(), unexpected);
    }

    /**
     * 进入一层嵌套（括号、类型参数、条件块），超过上限时报错
     */
    void enterNesting() {
        if (++nestingDepth > maxNestingDepth) {
            throw new ParseException("Nesting too deep", current);
        }
    }

    void exitNesting() {
        nestingDepth--;
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return location(current);
    }

    SourceLocation location(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 文件解析 ============

    /**
     * 解析整个文件
     */
    public StubFile parse() {
        SourceLocation loc = location();
        List<Declaration> declarations = new ArrayList<Declaration>();
        while (!isAtEnd()) {
            if (match(NEWLINE)) continue;
            Declaration decl = declParser.parseDeclaration(Scope.MODULE);
            if (decl != null) {
                declarations.add(decl);
            }
        }
        return new StubFile(loc, declarations);
    }

    QualifiedName parseDottedName() {
        SourceLocation loc = location();
        List<String> parts = new ArrayList<String>();
        parts.add(expect(NAME).getLexeme());
        while (check(DOT) && checkAhead(NAME)) {
            advance();  // consume '.'
            parts.add(advance().getLexeme());
        }
        return new QualifiedName(loc, parts);
    }

    // ============ 类型解析委托 ============

    TypeExpr parseType() { return typeParser.parseType(); }

    // ============ 条件解析委托 ============

    Condition parseCondition() { return conditionParser.parseCondition(); }

    /**
     * 声明所在的作用域：决定哪些语句合法
     */
    enum Scope {
        MODULE,
        CLASS
    }
}
