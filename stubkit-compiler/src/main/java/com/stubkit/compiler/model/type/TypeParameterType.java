package com.stubkit.compiler.model.type;

import java.util.Objects;

/**
 * 对模块内 TypeVar 的引用
 */
public final class TypeParameterType extends StubType {
    private final String name;

    public TypeParameterType(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitTypeParameter(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TypeParameterType && name.equals(((TypeParameterType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + 7;
    }

    @Override
    public String toString() {
        return name;
    }
}
