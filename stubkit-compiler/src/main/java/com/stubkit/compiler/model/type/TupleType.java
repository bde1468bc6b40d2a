package com.stubkit.compiler.model.type;

import java.util.List;

/**
 * 定长异构元组：Tuple[A, B]
 */
public final class TupleType extends GenericType {

    public TupleType(NamedType base, List<StubType> elements) {
        super(base, elements);
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }
}
