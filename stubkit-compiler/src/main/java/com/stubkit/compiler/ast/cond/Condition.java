package com.stubkit.compiler.ast.cond;

import com.stubkit.compiler.ast.AstNode;
import com.stubkit.compiler.ast.SourceLocation;

/**
 * 条件表达式基类
 */
public abstract class Condition extends AstNode {

    protected Condition(SourceLocation location) {
        super(location);
    }
}
