package com.stubkit.compiler.ast.type;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

/**
 * 名称类型：int、foo.bar.Baz
 */
public class NamedTypeExpr extends TypeExpr {
    private final String name;

    public NamedTypeExpr(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isDotted() {
        return name.indexOf('.') >= 0;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamedTypeExpr(this, context);
    }
}
