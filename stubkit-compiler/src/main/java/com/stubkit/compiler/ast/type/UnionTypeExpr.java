package com.stubkit.compiler.ast.type;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

import java.util.List;

/**
 * A or B or C
 */
public class UnionTypeExpr extends TypeExpr {
    private final List<TypeExpr> options;

    public UnionTypeExpr(SourceLocation location, List<TypeExpr> options) {
        super(location);
        this.options = options;
    }

    public List<TypeExpr> getOptions() {
        return options;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnionTypeExpr(this, context);
    }
}
