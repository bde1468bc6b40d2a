package com.stubkit.compiler.model.type;

/**
 * 任意类型（? / Any）
 */
public final class AnythingType extends StubType {
    public static final AnythingType INSTANCE = new AnythingType();

    private AnythingType() {
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitAnything(this);
    }

    @Override
    public String toString() {
        return "Any";
    }
}
