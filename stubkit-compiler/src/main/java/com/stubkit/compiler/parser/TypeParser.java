package com.stubkit.compiler.parser;

import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.decl.QualifiedName;
import com.stubkit.compiler.ast.type.*;
import com.stubkit.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.stubkit.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * type := primary ('or' primary)*
     */
    TypeExpr parseType() {
        parser.enterNesting();
        try {
            SourceLocation loc = parser.location();
            TypeExpr first = parsePrimary();
            if (!parser.check(KW_OR)) {
                return first;
            }
            List<TypeExpr> options = new ArrayList<TypeExpr>();
            options.add(first);
            while (parser.match(KW_OR)) {
                options.add(parsePrimary());
            }
            return new UnionTypeExpr(loc, options);
        } finally {
            parser.exitNesting();
        }
    }

    private TypeExpr parsePrimary() {
        SourceLocation loc = parser.location();

        // ?
        if (parser.match(QUESTION)) {
            return new AnyTypeExpr(loc);
        }

        // (T)
        if (parser.match(LPAREN)) {
            TypeExpr inner = parseType();
            parser.expect(RPAREN);
            return inner;
        }

        // [A, B]：元组简写或 Callable 参数列表
        if (parser.match(LBRACKET)) {
            List<TypeExpr> elements = parseTypeArgs();
            return new ListTypeExpr(loc, elements);
        }

        if (parser.checkName("NamedTuple") && parser.checkAhead(LPAREN)) {
            return parseNamedTuple();
        }

        if (parser.check(NAME)) {
            QualifiedName name = parser.parseDottedName();
            NamedTypeExpr base = new NamedTypeExpr(loc, name.getFullName());
            if (parser.match(LBRACKET)) {
                return new GenericTypeExpr(loc, base, parseTypeArgs());
            }
            return base;
        }

        throw parser.syntaxError(parser.current);
    }

    /**
     * 解析 '[' 之后的参数列表直到 ']'（允许 ... 和尾随逗号）
     */
    private List<TypeExpr> parseTypeArgs() {
        List<TypeExpr> args = new ArrayList<TypeExpr>();
        while (!parser.check(RBRACKET)) {
            if (parser.check(ELLIPSIS)) {
                args.add(new EllipsisTypeExpr(parser.location()));
                parser.advance();
            } else {
                args.add(parseType());
            }
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACKET);
        return args;
    }

    /**
     * NamedTuple(name, [(field, type), ...])
     */
    private TypeExpr parseNamedTuple() {
        SourceLocation loc = parser.location();
        parser.advance();  // NamedTuple
        parser.expect(LPAREN);
        String name = parseFieldName();
        parser.expect(COMMA);
        parser.expect(LBRACKET);

        List<NamedTupleTypeExpr.Field> fields = new ArrayList<NamedTupleTypeExpr.Field>();
        while (!parser.check(RBRACKET)) {
            parser.expect(LPAREN);
            String fieldName = parseFieldName();
            parser.expect(COMMA);
            TypeExpr fieldType = parseType();
            parser.match(COMMA);
            parser.expect(RPAREN);
            fields.add(new NamedTupleTypeExpr.Field(fieldName, fieldType));
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACKET);
        parser.match(COMMA);
        parser.expect(RPAREN);
        return new NamedTupleTypeExpr(loc, name, fields);
    }

    private String parseFieldName() {
        if (parser.check(STRING_LITERAL)) {
            Token token = parser.advance();
            return (String) token.getLiteral();
        }
        return parser.expect(NAME).getLexeme();
    }
}
