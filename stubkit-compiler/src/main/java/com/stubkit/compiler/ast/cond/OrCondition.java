package com.stubkit.compiler.ast.cond;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * a or b or c（按顺序短路求值）
 *
 * <p>连续的 or 展平为一个操作数列表，求值时不随项数递归。</p>
 */
public class OrCondition extends Condition {
    private final List<Condition> operands;

    public OrCondition(SourceLocation location, List<Condition> operands) {
        super(location);
        this.operands = Collections.unmodifiableList(new ArrayList<Condition>(operands));
    }

    public List<Condition> getOperands() {
        return operands;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOrCondition(this, context);
    }
}
