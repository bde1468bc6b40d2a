package com.stubkit.compiler.ast;

import java.util.Collections;
import java.util.List;

/**
 * 字面量：参数默认值和条件比较的右侧操作数
 */
public class Literal extends AstNode {

    public enum Kind {
        INT, FLOAT, STRING, NAME, ELLIPSIS, TUPLE
    }

    private final Kind kind;
    private final Object value;
    private final List<Literal> elements;

    private Literal(SourceLocation location, Kind kind, Object value, List<Literal> elements) {
        super(location);
        this.kind = kind;
        this.value = value;
        this.elements = elements;
    }

    public static Literal ofInt(SourceLocation location, long value) {
        return new Literal(location, Kind.INT, Long.valueOf(value), Collections.<Literal>emptyList());
    }

    public static Literal ofFloat(SourceLocation location, double value) {
        return new Literal(location, Kind.FLOAT, Double.valueOf(value), Collections.<Literal>emptyList());
    }

    public static Literal ofString(SourceLocation location, String value) {
        return new Literal(location, Kind.STRING, value, Collections.<Literal>emptyList());
    }

    /** 名称（可带点号），如 None、True、xyz */
    public static Literal ofName(SourceLocation location, String name) {
        return new Literal(location, Kind.NAME, name, Collections.<Literal>emptyList());
    }

    public static Literal ofEllipsis(SourceLocation location) {
        return new Literal(location, Kind.ELLIPSIS, null, Collections.<Literal>emptyList());
    }

    public static Literal ofTuple(SourceLocation location, List<Literal> elements) {
        return new Literal(location, Kind.TUPLE, null, Collections.unmodifiableList(elements));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean is(Kind kind) {
        return this.kind == kind;
    }

    public Object getValue() {
        return value;
    }

    public long getIntValue() {
        return ((Long) value).longValue();
    }

    public String getText() {
        return (String) value;
    }

    public List<Literal> getElements() {
        return elements;
    }

    /** 是否为 None / True / False 之类的名称 */
    public boolean isName(String name) {
        return kind == Kind.NAME && name.equals(value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case ELLIPSIS:
                return "...";
            case STRING:
                return "'" + value + "'";
            case TUPLE:
                StringBuilder sb = new StringBuilder("(");
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(elements.get(i));
                }
                if (elements.size() == 1) sb.append(',');
                return sb.append(')').toString();
            default:
                return String.valueOf(value);
        }
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
