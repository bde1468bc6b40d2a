package com.stubkit.compiler.model;

import com.stubkit.compiler.model.type.StubType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 类声明
 */
public final class StubClass {
    private final String name;
    private final List<StubType> parents;
    private final StubType metaclass;  // 可选
    private final List<Constant> constants;
    private final List<Function> methods;

    public StubClass(String name, List<StubType> parents, StubType metaclass,
                     List<Constant> constants, List<Function> methods) {
        this.name = Objects.requireNonNull(name, "name");
        this.parents = Collections.unmodifiableList(new ArrayList<StubType>(parents));
        this.metaclass = metaclass;
        this.constants = Collections.unmodifiableList(new ArrayList<Constant>(constants));
        this.methods = Collections.unmodifiableList(new ArrayList<Function>(methods));
    }

    public String getName() {
        return name;
    }

    public List<StubType> getParents() {
        return parents;
    }

    public StubType getMetaclass() {
        return metaclass;
    }

    public List<Constant> getConstants() {
        return constants;
    }

    public List<Function> getMethods() {
        return methods;
    }

    public Function findMethod(String methodName) {
        for (Function method : methods) {
            if (method.getName().equals(methodName)) {
                return method;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof StubClass)) return false;
        StubClass other = (StubClass) o;
        return name.equals(other.name) && parents.equals(other.parents)
                && Objects.equals(metaclass, other.metaclass)
                && constants.equals(other.constants) && methods.equals(other.methods);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parents, metaclass, constants, methods);
    }

    @Override
    public String toString() {
        return "class " + name;
    }
}
