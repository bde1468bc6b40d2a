package com.stubkit.compiler.parser;

import com.stubkit.compiler.ast.Literal;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.cond.ComparisonCondition;
import com.stubkit.compiler.ast.cond.Condition;
import com.stubkit.compiler.ast.cond.OrCondition;
import com.stubkit.compiler.ast.cond.Subscript;
import com.stubkit.compiler.ast.decl.QualifiedName;
import com.stubkit.compiler.lexer.Token;
import com.stubkit.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.stubkit.compiler.lexer.TokenType.*;

/**
 * 条件表达式解析辅助类
 *
 * <pre>
 * condition := atom ('or' atom)*
 * atom      := '(' condition ')' | dotted subscript? op literal
 * subscript := '[' INT ']' | '[' INT? ':' INT? (':' INT?)? ']'
 * </pre>
 */
class ConditionParser {

    final Parser parser;

    ConditionParser(Parser parser) {
        this.parser = parser;
    }

    Condition parseCondition() {
        parser.enterNesting();
        try {
            SourceLocation loc = parser.location();
            List<Condition> operands = new ArrayList<Condition>();
            operands.add(parseAtom());
            while (true) {
                if (parser.match(KW_OR)) {
                    operands.add(parseAtom());
                } else if (parser.check(KW_AND)) {
                    throw new ParseException("Unsupported condition operator: and", parser.current);
                } else {
                    return operands.size() == 1 ? operands.get(0) : new OrCondition(loc, operands);
                }
            }
        } finally {
            parser.exitNesting();
        }
    }

    private Condition parseAtom() {
        if (parser.match(LPAREN)) {
            Condition inner = parseCondition();
            parser.expect(RPAREN);
            return inner;
        }

        SourceLocation loc = parser.location();
        QualifiedName target = parser.parseDottedName();
        Subscript subscript = null;
        if (parser.match(LBRACKET)) {
            subscript = parseSubscript();
        }
        ComparisonCondition.Operator op = parseOperator();
        Literal value = parseLiteral();
        return new ComparisonCondition(loc, target, subscript, op, value);
    }

    private Subscript parseSubscript() {
        Integer start = parseOptionalInt();
        if (!parser.match(COLON)) {
            if (start == null) {
                throw parser.syntaxError(parser.current, INT_LITERAL);
            }
            parser.expect(RBRACKET);
            return Subscript.index(start.intValue());
        }
        Integer stop = parseOptionalInt();
        Integer step = null;
        if (parser.match(COLON)) {
            step = parseOptionalInt();
        }
        parser.expect(RBRACKET);
        return Subscript.slice(start, stop, step);
    }

    private Integer parseOptionalInt() {
        if (parser.check(INT_LITERAL)) {
            Token token = parser.advance();
            return Integer.valueOf(saturate(((Long) token.getLiteral()).longValue()));
        }
        return null;
    }

    /**
     * 超出 int 范围的值收敛到 int 边界，越界判断与切片端点不变
     */
    static int saturate(long value) {
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }

    private ComparisonCondition.Operator parseOperator() {
        TokenType type = parser.current.getType();
        if (!type.isComparisonOp()) {
            throw parser.syntaxError(parser.current);
        }
        parser.advance();
        switch (type) {
            case EQ: return ComparisonCondition.Operator.EQ;
            case NE: return ComparisonCondition.Operator.NE;
            case LT: return ComparisonCondition.Operator.LT;
            case LE: return ComparisonCondition.Operator.LE;
            case GT: return ComparisonCondition.Operator.GT;
            default: return ComparisonCondition.Operator.GE;
        }
    }

    /**
     * 比较右侧：数字、字符串、名称或元组
     */
    Literal parseLiteral() {
        SourceLocation loc = parser.location();
        Token token = parser.current;
        switch (token.getType()) {
            case INT_LITERAL:
                parser.advance();
                return Literal.ofInt(loc, ((Long) token.getLiteral()).longValue());
            case FLOAT_LITERAL:
                parser.advance();
                return Literal.ofFloat(loc, ((Double) token.getLiteral()).doubleValue());
            case STRING_LITERAL:
                parser.advance();
                return Literal.ofString(loc, (String) token.getLiteral());
            case NAME:
                return Literal.ofName(loc, parser.parseDottedName().getFullName());
            case LPAREN:
                return parseTuple(loc);
            default:
                throw parser.syntaxError(token);
        }
    }

    private Literal parseTuple(SourceLocation loc) {
        parser.enterNesting();
        try {
            parser.expect(LPAREN);
            List<Literal> elements = new ArrayList<Literal>();
            while (!parser.check(RPAREN)) {
                elements.add(parseLiteral());
                if (!parser.match(COMMA)) {
                    break;
                }
            }
            parser.expect(RPAREN);
            return Literal.ofTuple(loc, elements);
        } finally {
            parser.exitNesting();
        }
    }
}
