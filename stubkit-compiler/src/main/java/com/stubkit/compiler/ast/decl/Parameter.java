package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstNode;
import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.Literal;
import com.stubkit.compiler.ast.SourceLocation;
import com.stubkit.compiler.ast.type.TypeExpr;

/**
 * 原始函数参数
 */
public class Parameter extends AstNode {

    public enum Kind {
        /** x、x: T、x = v */
        NORMAL,
        /** *args */
        STAR,
        /** **kwargs */
        DOUBLE_STAR,
        /** 单独的 * */
        BARE_STAR,
        /** ... */
        ELLIPSIS
    }

    private final Kind kind;
    private final String name;
    private final TypeExpr type;          // 可选
    private final Literal defaultValue;   // 可选

    public Parameter(SourceLocation location, Kind kind, String name, TypeExpr type, Literal defaultValue) {
        super(location);
        this.kind = kind;
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public TypeExpr getType() {
        return type;
    }

    public Literal getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
