package com.stubkit.compiler.model.type;

import java.util.Collections;

/**
 * 同构容器：List[T]、Tuple[T, ...]
 */
public final class HomogeneousContainerType extends GenericType {

    public HomogeneousContainerType(NamedType base, StubType elementType) {
        super(base, Collections.singletonList(elementType));
    }

    public StubType getElementType() {
        return getParameters().get(0);
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitHomogeneous(this);
    }
}
