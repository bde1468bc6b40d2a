package com.stubkit.compiler.ast.stmt;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.type.TypeExpr;

/**
 * 参数类型变更：x := T
 */
public class MutatorStmt extends Statement {
    private final String name;
    private final TypeExpr type;

    public MutatorStmt(SourceLocation location, String name, TypeExpr type) {
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
        return visitor.visitMutatorStmt(this, context);
    }
}
