package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstNode;
import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

/**
 * 装饰器（@name 或 @name.attr），保留原文供分析阶段识别
 */
public class Annotation extends AstNode {
    private final QualifiedName name;

    public Annotation(SourceLocation location, QualifiedName name) {
        super(location);
        this.name = name;
    }

    public QualifiedName getName() {
        return name;
    }

    public String getText() {
        return name.getFullName();
    }

    @Override
    public String toString() {
        return "@" + getText();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        // 装饰器作为函数声明的一部分处理
        return null;
    }
}
