package com.stubkit.compiler.model;

import com.stubkit.compiler.model.type.StubType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * T = TypeVar('T', A, B)
 */
public final class TypeParameter {
    private final String name;
    private final List<StubType> constraints;

    public TypeParameter(String name, List<StubType> constraints) {
        this.name = Objects.requireNonNull(name, "name");
        this.constraints = Collections.unmodifiableList(new ArrayList<StubType>(constraints));
    }

    public String getName() {
        return name;
    }

    public List<StubType> getConstraints() {
        return constraints;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof TypeParameter)) return false;
        TypeParameter other = (TypeParameter) o;
        return name.equals(other.name) && constraints.equals(other.constraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, constraints);
    }
}
