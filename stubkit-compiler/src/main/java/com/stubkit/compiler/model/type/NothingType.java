package com.stubkit.compiler.model.type;

/**
 * 底类型 nothing
 */
public final class NothingType extends StubType {
    public static final NothingType INSTANCE = new NothingType();

    private NothingType() {
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitNothing(this);
    }

    @Override
    public String toString() {
        return "nothing";
    }
}
