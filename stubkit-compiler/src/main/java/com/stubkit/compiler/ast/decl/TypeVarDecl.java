package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.type.TypeExpr;

import java.util.List;

/**
 * T = TypeVar('T', A, B, bound=...)，关键字参数在解析时丢弃
 */
public class TypeVarDecl extends Declaration {
    private final String name;
    private final String declaredName;
    private final List<TypeExpr> constraints;

    public TypeVarDecl(SourceLocation location, String name, String declaredName, List<TypeExpr> constraints) {
        super(location);
        this.name = name;
        this.declaredName = declaredName;
        this.constraints = constraints;
    }

    /** 赋值目标名 */
    public String getName() {
        return name;
    }

    /** TypeVar(...) 第一个字符串参数 */
    public String getDeclaredName() {
        return declaredName;
    }

    public List<TypeExpr> getConstraints() {
        return constraints;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeVarDecl(this, context);
    }
}
