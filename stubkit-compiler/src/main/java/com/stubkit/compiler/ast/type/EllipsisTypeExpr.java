package com.stubkit.compiler.ast.type;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

/**
 * 类型参数位置上的 ...
 */
public class EllipsisTypeExpr extends TypeExpr {

    public EllipsisTypeExpr(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEllipsisTypeExpr(this, context);
    }
}
