package com.stubkit.compiler.model;

import com.stubkit.compiler.model.type.StubType;

import java.util.Objects;

/**
 * 带类型的名称：name = ...  # type: T
 */
public final class Constant {
    private final String name;
    private final StubType type;

    public Constant(String name, StubType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public StubType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Constant)) return false;
        Constant other = (Constant) o;
        return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
