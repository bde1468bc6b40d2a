package com.stubkit.compiler.ast.type;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

import java.util.List;

/**
 * NamedTuple(name, [(field, type), ...])
 */
public class NamedTupleTypeExpr extends TypeExpr {
    private final String name;
    private final List<Field> fields;

    public NamedTupleTypeExpr(SourceLocation location, String name, List<Field> fields) {
        super(location);
        this.name = name;
        this.fields = fields;
    }

    public String getName() {
        return name;
    }

    public List<Field> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamedTupleTypeExpr(this, context);
    }

    /**
     * 字段
     */
    public static final class Field {
        private final String name;
        private final TypeExpr type;

        public Field(String name, TypeExpr type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public TypeExpr getType() {
            return type;
        }
    }
}
