package com.stubkit.compiler.ast.stmt;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.type.TypeExpr;

/**
 * raise E 或 raise E()
 */
public class RaiseStmt extends Statement {
    private final TypeExpr exception;

    public RaiseStmt(SourceLocation location, TypeExpr exception) {
        super(location);
        this.exception = exception;
    }

    public TypeExpr getException() {
        return exception;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRaiseStmt(this, context);
    }
}
