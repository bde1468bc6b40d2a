package com.stubkit.compiler.model.type;

/**
 * 类型访问者
 */
public interface TypeVisitor<R> {

    R visitNamed(NamedType type);

    R visitTypeParameter(TypeParameterType type);

    R visitAnything(AnythingType type);

    R visitNothing(NothingType type);

    R visitGeneric(GenericType type);

    R visitHomogeneous(HomogeneousContainerType type);

    R visitTuple(TupleType type);

    R visitCallable(CallableType type);

    R visitUnion(UnionType type);
}
