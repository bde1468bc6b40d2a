package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.stmt.Statement;
import com.stubkit.compiler.ast.type.TypeExpr;

import java.util.Collections;
import java.util.List;

/**
 * 函数声明（位置为 def 关键词所在位置）
 */
public class FunDecl extends Declaration {
    private final String name;
    private final List<Annotation> decorators;
    private final List<Parameter> params;
    private final TypeExpr returnType;  // 可选
    private final List<Statement> body;
    private final boolean external;

    public FunDecl(SourceLocation location, String name, List<Annotation> decorators,
                   List<Parameter> params, TypeExpr returnType, List<Statement> body) {
        super(location);
        this.name = name;
        this.decorators = decorators;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
        this.external = false;
    }

    /** def f PYTHONCODE */
    public FunDecl(SourceLocation location, String name, List<Annotation> decorators) {
        super(location);
        this.name = name;
        this.decorators = decorators;
        this.params = Collections.emptyList();
        this.returnType = null;
        this.body = Collections.emptyList();
        this.external = true;
    }

    public String getName() {
        return name;
    }

    public List<Annotation> getDecorators() {
        return decorators;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeExpr getReturnType() {
        return returnType;
    }

    /** 仅包含 raise 和 mutator 语句；空函数体的各种写法都被归一为空列表 */
    public List<Statement> getBody() {
        return body;
    }

    public boolean isExternal() {
        return external;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
