package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.type.TypeExpr;

/**
 * 常量声明：x = ...  # type: T、x: T、x = 0、x = True
 */
public class ConstantDecl extends Declaration {
    private final String name;
    private final TypeExpr type;

    public ConstantDecl(SourceLocation location, String name, TypeExpr type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeExpr getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstantDecl(this, context);
    }
}
