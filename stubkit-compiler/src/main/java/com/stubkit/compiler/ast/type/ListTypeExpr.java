package com.stubkit.compiler.ast.type;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 方括号列表：[]、[A, B]（元组简写或 Callable 的参数列表）
 */
public class ListTypeExpr extends TypeExpr {
    private final List<TypeExpr> elements;

    public ListTypeExpr(SourceLocation location, List<TypeExpr> elements) {
        super(location);
        this.elements = elements;
    }

    public List<TypeExpr> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListTypeExpr(this, context);
    }
}
