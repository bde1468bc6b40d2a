package com.stubkit.compiler.ast.type;

import com.stubkit.compiler.ast.AstNode;
import com.stubkit.compiler.ast.SourceLocation;

/**
 * 未解析的类型表达式基类
 */
public abstract class TypeExpr extends AstNode {

    protected TypeExpr(SourceLocation location) {
        super(location);
    }
}
