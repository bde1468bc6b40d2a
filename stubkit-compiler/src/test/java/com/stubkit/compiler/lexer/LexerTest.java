package com.stubkit.compiler.lexer;

import com.stubkit.compiler.parser.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回 token 类型序列（含 NEWLINE/INDENT/DEDENT/EOF） */
    private List<TokenType> types(String source) {
        return scan(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    /** 扫描源码，返回第一个 token */
    private Token first(String source) {
        return scan(source).get(0);
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与负整数")
        void testIntegers() {
            Token zero = first("0");
            assertEquals(TokenType.INT_LITERAL, zero.getType());
            assertEquals(0L, zero.getLiteral());

            Token negative = first("-12");
            assertEquals(TokenType.INT_LITERAL, negative.getType());
            assertEquals(-12L, negative.getLiteral());
        }

        @Test
        @DisplayName("浮点数")
        void testFloat() {
            Token token = first("3.25");
            assertEquals(TokenType.FLOAT_LITERAL, token.getType());
            assertEquals(3.25, token.getLiteral());
        }

        @Test
        @DisplayName("单引号与双引号字符串")
        void testStrings() {
            assertEquals("T", first("'T'").getLiteral());
            assertEquals("linux", first("\"linux\"").getLiteral());
        }

        @Test
        @DisplayName("三引号字符串可跨行")
        void testTripleQuoted() {
            Token token = first("\"\"\"doc\nstring\"\"\"");
            assertEquals(TokenType.STRING_LITERAL, token.getType());
            assertEquals("doc\nstring", token.getLiteral());
        }

        @Test
        @DisplayName("未结束的字符串报错")
        void testUnterminatedString() {
            ParseException e = assertThrows(ParseException.class, () -> scan("x = 'abc\n"));
            assertEquals("Unterminated string literal", e.getMessage());
            assertEquals(Integer.valueOf(1), e.getLine());
        }

        @Test
        @DisplayName("toString 带出字面量值")
        void testToString() {
            assertEquals("INT_LITERAL(42, 42) at 1:1", first("42").toString());
            assertEquals("NAME(foo) at 1:1", first("foo").toString());
        }
    }

    @Nested
    @DisplayName("名称与关键词")
    class NameTests {

        @Test
        @DisplayName("关键词")
        void testKeywords() {
            assertEquals(TokenType.KW_DEF, first("def").getType());
            assertEquals(TokenType.KW_CLASS, first("class").getType());
            assertEquals(TokenType.KW_PYTHONCODE, first("PYTHONCODE").getType());
            assertEquals(TokenType.KW_OR, first("or").getType());
        }

        @Test
        @DisplayName("普通名称")
        void testName() {
            Token token = first("_foo1");
            assertEquals(TokenType.NAME, token.getType());
            assertEquals("_foo1", token.getLexeme());
        }

        @Test
        @DisplayName("反引号名称保留反引号")
        void testBackquotedName() {
            Token token = first("`foo~1`");
            assertEquals(TokenType.NAME, token.getType());
            assertEquals("`foo~1`", token.getLexeme());
        }
    }

    @Nested
    @DisplayName("操作符")
    class OperatorTests {

        @Test
        @DisplayName("多字符操作符")
        void testMultiCharOperators() {
            assertEquals(TokenType.ELLIPSIS, first("...").getType());
            assertEquals(TokenType.ARROW, first("->").getType());
            assertEquals(TokenType.COLONEQUALS, first(":=").getType());
            assertEquals(TokenType.DOUBLE_STAR, first("**").getType());
            assertEquals(TokenType.GE, first(">=").getType());
            assertEquals(TokenType.NE, first("!=").getType());
        }

        @Test
        @DisplayName("非法字符报告行列")
        void testIllegalCharacter() {
            ParseException e = assertThrows(ParseException.class, () -> scan("x = ...\ny = ^"));
            assertEquals("Illegal character '^'", e.getMessage());
            assertEquals(Integer.valueOf(2), e.getLine());
            assertEquals(Integer.valueOf(5), e.getColumn());
        }
    }

    @Nested
    @DisplayName("注释")
    class CommentTests {

        @Test
        @DisplayName("类型注释产生 TYPECOMMENT")
        void testTypeComment() {
            List<TokenType> actual = types("x = ...  # type: int");
            assertEquals(List.of(TokenType.NAME, TokenType.ASSIGN, TokenType.ELLIPSIS,
                    TokenType.TYPECOMMENT, TokenType.NAME, TokenType.NEWLINE, TokenType.EOF), actual);
        }

        @Test
        @DisplayName("普通注释与 type: ignore 被丢弃")
        void testIgnoredComments() {
            assertEquals(List.of(TokenType.NAME, TokenType.NEWLINE, TokenType.EOF),
                    types("x  # just a comment"));
            assertEquals(List.of(TokenType.NAME, TokenType.NEWLINE, TokenType.EOF),
                    types("x  # type: ignore"));
        }

        @Test
        @DisplayName("独占一行的类型注释不参与缩进")
        void testStandaloneTypeComment() {
            List<TokenType> actual = types("x = ...\n    # type: int\n");
            assertEquals(List.of(TokenType.NAME, TokenType.ASSIGN, TokenType.ELLIPSIS, TokenType.NEWLINE,
                    TokenType.TYPECOMMENT, TokenType.NAME, TokenType.NEWLINE, TokenType.EOF), actual);
        }
    }

    @Nested
    @DisplayName("缩进")
    class IndentationTests {

        @Test
        @DisplayName("缩进块产生 INDENT 与 DEDENT")
        void testIndentDedent() {
            List<TokenType> actual = types("class A:\n    pass\nx = ...\n");
            assertEquals(List.of(TokenType.KW_CLASS, TokenType.NAME, TokenType.COLON, TokenType.NEWLINE,
                    TokenType.INDENT, TokenType.KW_PASS, TokenType.NEWLINE, TokenType.DEDENT,
                    TokenType.NAME, TokenType.ASSIGN, TokenType.ELLIPSIS, TokenType.NEWLINE,
                    TokenType.EOF), actual);
        }

        @Test
        @DisplayName("文件结束时补齐 DEDENT")
        void testDedentAtEof() {
            List<TokenType> actual = types("class A:\n    pass");
            assertEquals(TokenType.EOF, actual.get(actual.size() - 1));
            assertEquals(TokenType.DEDENT, actual.get(actual.size() - 2));
            assertEquals(TokenType.NEWLINE, actual.get(actual.size() - 3));
        }

        @Test
        @DisplayName("空行与注释行不影响缩进")
        void testBlankLines() {
            List<TokenType> actual = types("class A:\n\n    # comment\n    pass\n");
            assertEquals(1, actual.stream().filter(t -> t == TokenType.INDENT).count());
            assertEquals(1, actual.stream().filter(t -> t == TokenType.DEDENT).count());
        }

        @Test
        @DisplayName("括号内换行不产生 NEWLINE")
        void testNewlineInsideBrackets() {
            List<TokenType> actual = types("def f(x,\n      y) -> int: ...");
            assertEquals(1, actual.stream().filter(t -> t == TokenType.NEWLINE).count());
            assertFalse(actual.contains(TokenType.INDENT));
        }

        @Test
        @DisplayName("回退到不存在的缩进层级报错")
        void testInvalidIndentation() {
            ParseException e = assertThrows(ParseException.class,
                    () -> scan("class A:\n    x = ...\n  y = ...\n"));
            assertEquals("Invalid indentation", e.getMessage());
            assertEquals(Integer.valueOf(3), e.getLine());
        }

        @Test
        @DisplayName("token 记录从 1 开始的行列")
        void testPositions() {
            List<Token> tokens = scan("class A:\n    this is");
            Token is = tokens.stream().filter(t -> t.isName("is")).findFirst().orElseThrow();
            assertEquals(2, is.getLine());
            assertEquals(10, is.getColumn());
        }
    }
}
