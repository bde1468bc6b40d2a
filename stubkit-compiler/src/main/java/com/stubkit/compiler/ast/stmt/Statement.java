package com.stubkit.compiler.ast.stmt;

import com.stubkit.compiler.ast.AstNode;
import com.stubkit.compiler.ast.SourceLocation;

/**
 * 函数体语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
