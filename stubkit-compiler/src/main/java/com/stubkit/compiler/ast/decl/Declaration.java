package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstNode;
import com.stubkit.compiler.ast.SourceLocation;

/**
 * 声明基类：文件顶层和类体内可出现的条目（包括条件块）
 */
public abstract class Declaration extends AstNode {

    protected Declaration(SourceLocation location) {
        super(location);
    }
}
