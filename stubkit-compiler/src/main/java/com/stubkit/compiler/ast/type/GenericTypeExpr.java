package com.stubkit.compiler.ast.type;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 参数化类型：Base[A, B, ...]
 */
public class GenericTypeExpr extends TypeExpr {
    private final NamedTypeExpr base;
    private final List<TypeExpr> parameters;

    public GenericTypeExpr(SourceLocation location, NamedTypeExpr base, List<TypeExpr> parameters) {
        super(location);
        this.base = base;
        this.parameters = parameters;
    }

    public NamedTypeExpr getBase() {
        return base;
    }

    public List<TypeExpr> getParameters() {
        return parameters;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGenericTypeExpr(this, context);
    }
}
