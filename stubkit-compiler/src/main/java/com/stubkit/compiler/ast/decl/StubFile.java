package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 存根文件（原始声明树的根节点）
 */
public class StubFile extends Declaration {
    private final List<Declaration> declarations;

    public StubFile(SourceLocation location, List<Declaration> declarations) {
        super(location);
        this.declarations = declarations;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStubFile(this, context);
    }
}
