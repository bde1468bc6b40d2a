package com.stubkit.compiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 命名函数：有序重载签名 + 种类；external 表示 def f PYTHONCODE
 */
public final class Function {
    private final String name;
    private final List<Signature> signatures;
    private final FunctionKind kind;
    private final boolean external;

    public Function(String name, List<Signature> signatures, FunctionKind kind, boolean external) {
        this.name = Objects.requireNonNull(name, "name");
        this.signatures = Collections.unmodifiableList(new ArrayList<Signature>(signatures));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.external = external;
    }

    public String getName() {
        return name;
    }

    public List<Signature> getSignatures() {
        return signatures;
    }

    public FunctionKind getKind() {
        return kind;
    }

    public boolean isExternal() {
        return external;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Function)) return false;
        Function other = (Function) o;
        return name.equals(other.name) && signatures.equals(other.signatures)
                && kind == other.kind && external == other.external;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, signatures, kind, external);
    }

    @Override
    public String toString() {
        return "def " + name + " " + signatures;
    }
}
