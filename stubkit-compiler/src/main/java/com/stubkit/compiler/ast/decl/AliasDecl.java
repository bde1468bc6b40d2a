package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.type.TypeExpr;

/**
 * 别名声明：x = Foo（类体内为 y = x）
 */
public class AliasDecl extends Declaration {
    private final String name;
    private final TypeExpr value;

    public AliasDecl(SourceLocation location, String name, TypeExpr value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public TypeExpr getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAliasDecl(this, context);
    }
}
