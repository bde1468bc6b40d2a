package com.stubkit.compiler.ast.type;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

/**
 * ?
 */
public class AnyTypeExpr extends TypeExpr {

    public AnyTypeExpr(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAnyTypeExpr(this, context);
    }
}
