package com.stubkit.compiler.model.type;

import java.util.ArrayList;
import java.util.List;

/**
 * 显式参数列表的可调用类型：Callable[[A, B], R]
 *
 * <p>参数列表中最后一个元素为返回类型。</p>
 */
public final class CallableType extends GenericType {

    public CallableType(NamedType base, List<StubType> argTypes, StubType returnType) {
        super(base, concat(argTypes, returnType));
    }

    public List<StubType> getArgTypes() {
        List<StubType> params = getParameters();
        return params.subList(0, params.size() - 1);
    }

    public StubType getReturnType() {
        List<StubType> params = getParameters();
        return params.get(params.size() - 1);
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitCallable(this);
    }

    private static List<StubType> concat(List<StubType> argTypes, StubType returnType) {
        List<StubType> all = new ArrayList<StubType>(argTypes);
        all.add(returnType);
        return all;
    }
}
