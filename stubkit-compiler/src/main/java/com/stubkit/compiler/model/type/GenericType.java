package com.stubkit.compiler.model.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 参数化类型：Base[P1, P2]
 */
public class GenericType extends StubType {
    private final NamedType base;
    private final List<StubType> parameters;

    public GenericType(NamedType base, List<StubType> parameters) {
        this.base = Objects.requireNonNull(base, "base");
        this.parameters = Collections.unmodifiableList(new ArrayList<StubType>(parameters));
    }

    public NamedType getBase() {
        return base;
    }

    public List<StubType> getParameters() {
        return parameters;
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitGeneric(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenericType other = (GenericType) o;
        return base.equals(other.base) && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getSimpleName(), base, parameters);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(base.getName()).append('[');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameters.get(i));
        }
        return sb.append(']').toString();
    }
}
