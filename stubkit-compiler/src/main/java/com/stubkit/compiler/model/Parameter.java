package com.stubkit.compiler.model;

import com.stubkit.compiler.model.type.StubType;

import java.util.Objects;

/**
 * 签名中的一个参数
 */
public final class Parameter {
    private final String name;
    private final StubType type;         // 可选，未声明类型时为 null
    private final boolean kwonly;
    private final boolean optional;
    private final StubType mutatedType;  // 可选

    public Parameter(String name, StubType type, boolean kwonly, boolean optional, StubType mutatedType) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
        this.kwonly = kwonly;
        this.optional = optional;
        this.mutatedType = mutatedType;
    }

    public Parameter(String name, StubType type) {
        this(name, type, false, false, null);
    }

    public String getName() {
        return name;
    }

    public StubType getType() {
        return type;
    }

    public boolean isKwonly() {
        return kwonly;
    }

    /** 是否有默认值 */
    public boolean isOptional() {
        return optional;
    }

    public StubType getMutatedType() {
        return mutatedType;
    }

    public Parameter withMutatedType(StubType newType) {
        return new Parameter(name, type, kwonly, optional, newType);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Parameter)) return false;
        Parameter other = (Parameter) o;
        return name.equals(other.name) && kwonly == other.kwonly && optional == other.optional
                && Objects.equals(type, other.type) && Objects.equals(mutatedType, other.mutatedType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, kwonly, optional, mutatedType);
    }

    @Override
    public String toString() {
        return type != null ? name + ": " + type : name;
    }
}
