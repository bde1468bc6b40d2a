package com.stubkit.compiler.model;

import com.stubkit.compiler.model.type.StubType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数的一个重载签名
 */
public final class Signature {
    private final List<Parameter> params;
    private final Parameter starargs;      // 可选
    private final Parameter starstarargs;  // 可选
    private final StubType returnType;
    private final List<StubType> exceptions;

    public Signature(List<Parameter> params, Parameter starargs, Parameter starstarargs,
                     StubType returnType, List<StubType> exceptions) {
        this.params = Collections.unmodifiableList(new ArrayList<Parameter>(params));
        this.starargs = starargs;
        this.starstarargs = starstarargs;
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.exceptions = Collections.unmodifiableList(new ArrayList<StubType>(exceptions));
    }

    /** 普通参数（含仅关键字参数），按声明顺序 */
    public List<Parameter> getParams() {
        return params;
    }

    public Parameter getStarargs() {
        return starargs;
    }

    public Parameter getStarstarargs() {
        return starstarargs;
    }

    public StubType getReturnType() {
        return returnType;
    }

    public List<StubType> getExceptions() {
        return exceptions;
    }

    /** 是否有需要打印成函数体的 raise 或 mutator */
    public boolean hasBody() {
        if (!exceptions.isEmpty()) return true;
        for (Parameter p : params) {
            if (p.getMutatedType() != null) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Signature)) return false;
        Signature other = (Signature) o;
        return params.equals(other.params)
                && Objects.equals(starargs, other.starargs)
                && Objects.equals(starstarargs, other.starstarargs)
                && returnType.equals(other.returnType)
                && exceptions.equals(other.exceptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, starargs, starstarargs, returnType, exceptions);
    }

    @Override
    public String toString() {
        return params + " -> " + returnType;
    }
}
