package com.stubkit.compiler.ast.cond;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.decl.Declaration;

import java.util.List;

/**
 * 条件编译块：if ... elif ... else ...
 */
public class IfStmt extends Declaration {
    private final List<IfBranch> branches;

    public IfStmt(SourceLocation location, List<IfBranch> branches) {
        super(location);
        this.branches = branches;
    }

    public List<IfBranch> getBranches() {
        return branches;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
