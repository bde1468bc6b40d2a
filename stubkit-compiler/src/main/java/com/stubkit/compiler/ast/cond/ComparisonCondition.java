package com.stubkit.compiler.ast.cond;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.Literal;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.decl.QualifiedName;

/**
 * 比较条件：target[subscript] op literal
 */
public class ComparisonCondition extends Condition {

    public enum Operator {
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public boolean isEquality() {
            return this == EQ || this == NE;
        }
    }

    private final QualifiedName target;
    private final Subscript subscript;  // 可选
    private final Operator operator;
    private final Literal value;

    public ComparisonCondition(SourceLocation location, QualifiedName target, Subscript subscript,
                               Operator operator, Literal value) {
        super(location);
        this.target = target;
        this.subscript = subscript;
        this.operator = operator;
        this.value = value;
    }

    public QualifiedName getTarget() {
        return target;
    }

    public Subscript getSubscript() {
        return subscript;
    }

    public Operator getOperator() {
        return operator;
    }

    public Literal getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComparison(this, context);
    }
}
