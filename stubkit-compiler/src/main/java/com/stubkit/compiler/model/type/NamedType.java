package com.stubkit.compiler.model.type;

import java.util.Objects;

/**
 * 名称引用：int、foo.bar.Baz、typing.Hashable、NoneType
 */
public final class NamedType extends StubType {
    public static final NamedType NONE = new NamedType("NoneType");

    private final String name;

    public NamedType(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public boolean isDotted() {
        return name.indexOf('.') >= 0 && !name.startsWith("`");
    }

    /** foo.bar.Baz → foo.bar；无点号时返回 null */
    public String getModulePrefix() {
        int dot = name.lastIndexOf('.');
        return dot > 0 && isDotted() ? name.substring(0, dot) : null;
    }

    /** foo.bar.Baz → Baz */
    public String getSimpleName() {
        int dot = name.lastIndexOf('.');
        return dot >= 0 && isDotted() ? name.substring(dot + 1) : name;
    }

    public boolean isNone() {
        return "NoneType".equals(name);
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitNamed(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NamedType && name.equals(((NamedType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
