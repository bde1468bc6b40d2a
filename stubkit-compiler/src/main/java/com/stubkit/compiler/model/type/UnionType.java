package com.stubkit.compiler.model.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 联合类型，成员去重且保持首次出现顺序
 */
public final class UnionType extends StubType {
    private final List<StubType> options;

    private UnionType(List<StubType> options) {
        this.options = Collections.unmodifiableList(options);
    }

    /**
     * 构造联合类型：展开嵌套联合、去重、丢弃 nothing；
     * 只剩一个成员时返回该成员，没有成员时返回 nothing。
     */
    public static StubType of(List<StubType> options) {
        Set<StubType> flat = new LinkedHashSet<StubType>();
        flatten(options, flat);
        flat.remove(NothingType.INSTANCE);
        if (flat.isEmpty()) {
            return NothingType.INSTANCE;
        }
        if (flat.size() == 1) {
            return flat.iterator().next();
        }
        return new UnionType(new ArrayList<StubType>(flat));
    }

    private static void flatten(List<StubType> options, Set<StubType> out) {
        for (StubType option : options) {
            if (option instanceof UnionType) {
                flatten(((UnionType) option).options, out);
            } else {
                out.add(option);
            }
        }
    }

    public List<StubType> getOptions() {
        return options;
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnionType && options.equals(((UnionType) o).options);
    }

    @Override
    public int hashCode() {
        return options.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Union[");
        for (int i = 0; i < options.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(options.get(i));
        }
        return sb.append(']').toString();
    }
}
