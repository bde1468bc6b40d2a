package com.stubkit.compiler.parser;

import com.stubkit.compiler.ast.Literal;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.cond.Condition;
import com.stubkit.compiler.ast.cond.IfBranch;
import com.stubkit.compiler.ast.cond.IfStmt;
import com.stubkit.compiler.ast.decl.*;
import com.stubkit.compiler.ast.stmt.MutatorStmt;
import com.stubkit.compiler.ast.stmt.RaiseStmt;
import com.stubkit.compiler.ast.stmt.Statement;
import com.stubkit.compiler.ast.type.AnyTypeExpr;
import com.stubkit.compiler.ast.type.NamedTypeExpr;
import com.stubkit.compiler.ast.type.TypeExpr;
import com.stubkit.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.stubkit.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一条声明；pass、...、文档字符串等空语句返回 null
     */
    Declaration parseDeclaration(Parser.Scope scope) {
        Token token = parser.current;
        switch (token.getType()) {
            case KW_IMPORT:
                if (scope == Parser.Scope.CLASS) throw parser.syntaxError(token);
                return parseImport();
            case KW_FROM:
                if (scope == Parser.Scope.CLASS) throw parser.syntaxError(token);
                return parseFromImport();
            case KW_CLASS:
                if (scope == Parser.Scope.CLASS) throw parser.syntaxError(token);
                return parseClass();
            case KW_IF:
                return parseIf(scope);
            case AT:
            case KW_DEF:
                return parseFunction();
            case NAME:
                return parseAssignment(scope);
            case KW_PASS:
            case ELLIPSIS:
            case STRING_LITERAL:
                if (scope == Parser.Scope.MODULE) throw parser.syntaxError(token);
                parser.advance();
                parser.expectNewline();
                return null;
            default:
                throw parser.syntaxError(token);
        }
    }

    // ============ 导入 ============

    private Declaration parseImport() {
        Token importToken = parser.advance();
        SourceLocation loc = parser.location(importToken);
        List<QualifiedName> modules = new ArrayList<QualifiedName>();
        do {
            modules.add(parser.parseDottedName());
            if (parser.check(KW_AS)) {
                throw new ParseException("Renaming of modules not supported", importToken.getLine());
            }
        } while (parser.match(COMMA));
        parser.expectNewline();
        return new ImportDecl(loc, modules);
    }

    private Declaration parseFromImport() {
        SourceLocation loc = parser.location();
        parser.advance();  // from
        QualifiedName module = parser.parseDottedName();
        parser.expect(KW_IMPORT);

        if (parser.match(STAR)) {
            parser.expectNewline();
            return new FromImportDecl(loc, module);
        }

        List<FromImportDecl.ImportedName> names;
        if (parser.match(LPAREN)) {
            names = parseImportedNames(true);
            parser.expect(RPAREN);
        } else {
            names = parseImportedNames(false);
        }
        parser.expectNewline();
        return new FromImportDecl(loc, module, names);
    }

    private List<FromImportDecl.ImportedName> parseImportedNames(boolean parenthesized) {
        List<FromImportDecl.ImportedName> names = new ArrayList<FromImportDecl.ImportedName>();
        do {
            if (parenthesized && parser.check(RPAREN) && !names.isEmpty()) {
                break;  // 尾随逗号
            }
            String name = parser.expect(NAME).getLexeme();
            String alias = null;
            if (parser.match(KW_AS)) {
                alias = parser.expect(NAME).getLexeme();
            }
            names.add(new FromImportDecl.ImportedName(name, alias));
        } while (parser.match(COMMA));
        return names;
    }

    // ============ 赋值类声明 ============

    /**
     * NAME 开头的语句：常量、别名或 TypeVar
     */
    private Declaration parseAssignment(Parser.Scope scope) {
        Token nameToken = parser.advance();
        SourceLocation loc = parser.location(nameToken);
        String name = nameToken.getLexeme();

        // x: T [= ...]
        if (parser.match(COLON)) {
            TypeExpr type = parser.parseType();
            if (parser.match(ASSIGN)) {
                parser.expect(ELLIPSIS);
            }
            parser.expectNewline();
            return new ConstantDecl(loc, name, type);
        }

        if (!parser.check(ASSIGN)) {
            throw parser.syntaxError(parser.current, COLON, ASSIGN);
        }
        parser.advance();  // =

        Token value = parser.current;
        Declaration result;
        if (parser.match(ELLIPSIS)) {
            result = new ConstantDecl(loc, name, parseTypeComment(value));
        } else if (value.is(INT_LITERAL)) {
            if (((Long) value.getLiteral()).longValue() != 0L) {
                throw new ParseException("Only '0' allowed as int literal", value.getLine());
            }
            parser.advance();
            result = new ConstantDecl(loc, name, new NamedTypeExpr(parser.location(value), "int"));
        } else if ((value.isName("True") || value.isName("False"))
                && (parser.checkAhead(NEWLINE) || parser.checkAhead(EOF))) {
            parser.advance();
            result = new ConstantDecl(loc, name, new NamedTypeExpr(parser.location(value), "bool"));
        } else if (value.isName("TypeVar") && parser.checkAhead(LPAREN)) {
            if (scope == Parser.Scope.CLASS) throw parser.syntaxError(value);
            result = parseTypeVar(loc, name);
        } else {
            result = new AliasDecl(loc, name, parser.parseType());
        }
        parser.expectNewline();
        return result;
    }

    /**
     * x = ... 之后的类型注释；注释可以位于同一行，也可以独占下一行
     */
    private TypeExpr parseTypeComment(Token ellipsis) {
        if (parser.check(NEWLINE) && parser.checkAhead(TYPECOMMENT)) {
            parser.advance();
        }
        if (parser.match(TYPECOMMENT)) {
            return parser.parseType();
        }
        return new AnyTypeExpr(parser.location(ellipsis));
    }

    /**
     * TypeVar('T', A, B, key=value)
     */
    private Declaration parseTypeVar(SourceLocation loc, String name) {
        parser.advance();  // TypeVar
        parser.expect(LPAREN);
        if (!parser.check(STRING_LITERAL)) {
            throw parser.syntaxError(parser.current, STRING_LITERAL);
        }
        String declaredName = (String) parser.advance().getLiteral();

        List<TypeExpr> constraints = new ArrayList<TypeExpr>();
        boolean sawKeyword = false;
        while (parser.match(COMMA)) {
            if (parser.check(RPAREN)) {
                break;
            }
            if (parser.check(NAME) && parser.checkAhead(ASSIGN)) {
                // 关键字参数（bound、covariant 等）被丢弃
                parser.advance();
                parser.advance();
                parser.parseType();
                sawKeyword = true;
            } else if (sawKeyword) {
                throw parser.syntaxError(parser.current, NAME);
            } else {
                constraints.add(parser.parseType());
            }
        }
        parser.expect(RPAREN);
        return new TypeVarDecl(loc, name, declaredName, constraints);
    }

    // ============ 类 ============

    private Declaration parseClass() {
        Token classToken = parser.advance();
        SourceLocation loc = parser.location(classToken);
        String name = parser.expect(NAME).getLexeme();

        List<TypeExpr> parents = new ArrayList<TypeExpr>();
        TypeExpr metaclass = null;
        if (parser.match(LPAREN)) {
            while (!parser.check(RPAREN)) {
                if (parser.check(NAME) && parser.checkAhead(ASSIGN)) {
                    String keyword = parser.advance().getLexeme();
                    parser.advance();  // =
                    TypeExpr value = parser.parseType();
                    if (!"metaclass".equals(keyword)) {
                        throw new ParseException("Only 'metaclass' allowed as classdef kwarg",
                                classToken.getLine());
                    }
                    metaclass = value;
                } else {
                    if (metaclass != null) {
                        throw new ParseException("metaclass must be last argument", classToken.getLine());
                    }
                    parents.add(parser.parseType());
                }
                if (!parser.match(COMMA)) {
                    break;
                }
            }
            parser.expect(RPAREN);
        }
        parser.expect(COLON);

        List<Declaration> members = parseBody(Parser.Scope.CLASS);
        return new ClassDecl(loc, name, parents, metaclass, members);
    }

    /**
     * 缩进块，或冒号后同一行的单条声明
     */
    private List<Declaration> parseBody(Parser.Scope scope) {
        List<Declaration> body = new ArrayList<Declaration>();
        if (!parser.match(NEWLINE)) {
            // 同行体（如 if c: if c: x = ...）同样计入嵌套深度
            parser.enterNesting();
            try {
                Declaration single = parseDeclaration(scope);
                if (single != null) body.add(single);
            } finally {
                parser.exitNesting();
            }
            return body;
        }
        parser.expect(INDENT);
        parser.enterNesting();
        try {
            while (!parser.check(DEDENT) && !parser.isAtEnd()) {
                Declaration decl = parseDeclaration(scope);
                if (decl != null) body.add(decl);
            }
        } finally {
            parser.exitNesting();
        }
        parser.expect(DEDENT);
        return body;
    }

    // ============ 条件块 ============

    private Declaration parseIf(Parser.Scope scope) {
        SourceLocation loc = parser.location();
        List<IfBranch> branches = new ArrayList<IfBranch>();

        parser.advance();  // if
        Condition condition = parser.parseCondition();
        parser.expect(COLON);
        branches.add(new IfBranch(condition, parseBody(scope)));

        while (parser.match(KW_ELIF)) {
            Condition elifCondition = parser.parseCondition();
            parser.expect(COLON);
            branches.add(new IfBranch(elifCondition, parseBody(scope)));
        }
        if (parser.match(KW_ELSE)) {
            parser.expect(COLON);
            branches.add(new IfBranch(null, parseBody(scope)));
        }
        return new IfStmt(loc, branches);
    }

    // ============ 函数 ============

    private Declaration parseFunction() {
        List<Annotation> decorators = new ArrayList<Annotation>();
        while (parser.check(AT)) {
            SourceLocation decoratorLoc = parser.location();
            parser.advance();
            decorators.add(new Annotation(decoratorLoc, parser.parseDottedName()));
            parser.expect(NEWLINE);
        }

        Token defToken = parser.expect(KW_DEF);
        SourceLocation loc = parser.location(defToken);
        String name = parser.expect(NAME).getLexeme();

        if (parser.match(KW_PYTHONCODE)) {
            parser.expectNewline();
            return new FunDecl(loc, name, decorators);
        }

        parser.expect(LPAREN);
        List<Parameter> params = parseParameters();
        parser.expect(RPAREN);

        TypeExpr returnType = null;
        if (parser.match(ARROW)) {
            returnType = parser.parseType();
        }

        List<Statement> body;
        if (parser.match(COLON)) {
            body = parseFunctionBody();
        } else {
            parser.expectNewline();
            body = Collections.emptyList();
        }
        return new FunDecl(loc, name, decorators, params, returnType, body);
    }

    private List<Parameter> parseParameters() {
        List<Parameter> params = new ArrayList<Parameter>();
        while (!parser.check(RPAREN)) {
            params.add(parseParameter());
            if (!parser.match(COMMA)) {
                break;
            }
        }
        return params;
    }

    private Parameter parseParameter() {
        SourceLocation loc = parser.location();

        if (parser.match(ELLIPSIS)) {
            return new Parameter(loc, Parameter.Kind.ELLIPSIS, null, null, null);
        }
        if (parser.match(DOUBLE_STAR)) {
            String name = parser.expect(NAME).getLexeme();
            return new Parameter(loc, Parameter.Kind.DOUBLE_STAR, name, parseOptionalAnnotation(), null);
        }
        if (parser.match(STAR)) {
            if (!parser.check(NAME)) {
                return new Parameter(loc, Parameter.Kind.BARE_STAR, null, null, null);
            }
            String name = parser.advance().getLexeme();
            return new Parameter(loc, Parameter.Kind.STAR, name, parseOptionalAnnotation(), null);
        }

        String name = parser.expect(NAME).getLexeme();
        TypeExpr type = parseOptionalAnnotation();
        Literal defaultValue = null;
        if (parser.match(ASSIGN)) {
            defaultValue = parseDefaultValue();
        }
        return new Parameter(loc, Parameter.Kind.NORMAL, name, type, defaultValue);
    }

    private TypeExpr parseOptionalAnnotation() {
        return parser.match(COLON) ? parser.parseType() : null;
    }

    private Literal parseDefaultValue() {
        SourceLocation loc = parser.location();
        if (parser.match(ELLIPSIS)) {
            return Literal.ofEllipsis(loc);
        }
        return parser.conditionParser.parseLiteral();
    }

    /**
     * 函数体：只保留 raise 和 mutator，空语句被丢弃
     */
    private List<Statement> parseFunctionBody() {
        List<Statement> body = new ArrayList<Statement>();
        if (!parser.match(NEWLINE)) {
            Statement single = parseBodyStatement();
            if (single != null) body.add(single);
            return body;
        }
        parser.expect(INDENT);
        while (!parser.check(DEDENT) && !parser.isAtEnd()) {
            Statement stmt = parseBodyStatement();
            if (stmt != null) body.add(stmt);
        }
        parser.expect(DEDENT);
        return body;
    }

    private Statement parseBodyStatement() {
        SourceLocation loc = parser.location();
        Token token = parser.current;
        Statement result = null;
        switch (token.getType()) {
            case ELLIPSIS:
            case KW_PASS:
            case STRING_LITERAL:
                parser.advance();
                break;
            case KW_RAISE:
                parser.advance();
                TypeExpr exception = parser.parseType();
                if (parser.match(LPAREN)) {
                    parser.expect(RPAREN);
                }
                result = new RaiseStmt(loc, exception);
                break;
            case NAME:
                String name = parser.advance().getLexeme();
                parser.expect(COLONEQUALS);
                result = new MutatorStmt(loc, name, parser.parseType());
                break;
            default:
                throw parser.syntaxError(token);
        }
        parser.expectNewline();
        return result;
    }
}
