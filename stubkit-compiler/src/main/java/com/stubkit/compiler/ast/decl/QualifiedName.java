package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstNode;
import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 限定名称（如 foo.bar.baz）
 */
public class QualifiedName extends AstNode {
    private final List<String> parts;

    public QualifiedName(SourceLocation location, List<String> parts) {
        super(location);
        this.parts = parts;
    }

    public List<String> getParts() {
        return parts;
    }

    public String getFullName() {
        return String.join(".", parts);
    }

    public String getSimpleName() {
        return parts.isEmpty() ? "" : parts.get(parts.size() - 1);
    }

    @Override
    public String toString() {
        return getFullName();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitQualifiedName(this, context);
    }
}
