package com.stubkit.compiler.model;

import com.stubkit.compiler.model.type.StubType;

import java.util.Objects;

/**
 * 名称到类型的绑定（from M import n，或 x = Foo）
 */
public final class Alias {
    private final String name;
    private final StubType type;

    public Alias(String name, StubType type) {
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
        if (!(o instanceof Alias)) return false;
        Alias other = (Alias) o;
        return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + " = " + type;
    }
}
