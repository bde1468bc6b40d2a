package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.type.TypeExpr;

import java.util.List;

/**
 * 类声明
 */
public class ClassDecl extends Declaration {
    private final String name;
    private final List<TypeExpr> parents;
    private final TypeExpr metaclass;  // 可选
    private final List<Declaration> members;

    public ClassDecl(SourceLocation location, String name, List<TypeExpr> parents,
                     TypeExpr metaclass, List<Declaration> members) {
        super(location);
        this.name = name;
        this.parents = parents;
        this.metaclass = metaclass;
        this.members = members;
    }

    public String getName() {
        return name;
    }

    public List<TypeExpr> getParents() {
        return parents;
    }

    public TypeExpr getMetaclass() {
        return metaclass;
    }

    /** 类体成员：常量、别名、方法和条件块 */
    public List<Declaration> getMembers() {
        return members;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }
}
