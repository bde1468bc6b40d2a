package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

import java.util.List;

/**
 * import a.b.c[, d.e]
 */
public class ImportDecl extends Declaration {
    private final List<QualifiedName> modules;

    public ImportDecl(SourceLocation location, List<QualifiedName> modules) {
        super(location);
        this.modules = modules;
    }

    public List<QualifiedName> getModules() {
        return modules;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }
}
