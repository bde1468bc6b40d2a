package com.stubkit.compiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一个存根文件解析后的规范声明集合（不可变）
 */
public final class StubModule {
    private final String name;
    private final List<Constant> constants;
    private final List<TypeParameter> typeParameters;
    private final List<StubClass> classes;
    private final List<Function> functions;
    private final List<Alias> aliases;

    public StubModule(String name, List<Constant> constants, List<TypeParameter> typeParameters,
                      List<StubClass> classes, List<Function> functions, List<Alias> aliases) {
        this.name = Objects.requireNonNull(name, "name");
        this.constants = Collections.unmodifiableList(new ArrayList<Constant>(constants));
        this.typeParameters = Collections.unmodifiableList(new ArrayList<TypeParameter>(typeParameters));
        this.classes = Collections.unmodifiableList(new ArrayList<StubClass>(classes));
        this.functions = Collections.unmodifiableList(new ArrayList<Function>(functions));
        this.aliases = Collections.unmodifiableList(new ArrayList<Alias>(aliases));
    }

    public String getName() {
        return name;
    }

    public List<Constant> getConstants() {
        return constants;
    }

    public List<TypeParameter> getTypeParameters() {
        return typeParameters;
    }

    public List<StubClass> getClasses() {
        return classes;
    }

    public List<Function> getFunctions() {
        return functions;
    }

    public List<Alias> getAliases() {
        return aliases;
    }

    public StubClass findClass(String className) {
        for (StubClass cls : classes) {
            if (cls.getName().equals(className)) {
                return cls;
            }
        }
        return null;
    }

    public Function findFunction(String functionName) {
        for (Function function : functions) {
            if (function.getName().equals(functionName)) {
                return function;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return constants.isEmpty() && typeParameters.isEmpty() && classes.isEmpty()
                && functions.isEmpty() && aliases.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof StubModule)) return false;
        StubModule other = (StubModule) o;
        return name.equals(other.name) && constants.equals(other.constants)
                && typeParameters.equals(other.typeParameters) && classes.equals(other.classes)
                && functions.equals(other.functions) && aliases.equals(other.aliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, constants, typeParameters, classes, functions, aliases);
    }

    @Override
    public String toString() {
        return "module " + name;
    }
}
