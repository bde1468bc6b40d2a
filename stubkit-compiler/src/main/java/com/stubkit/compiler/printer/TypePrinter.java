package com.stubkit.compiler.printer;

import com.stubkit.compiler.analysis.NameRegistry;
import com.stubkit.compiler.model.type.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 把模型类型渲染为规范文本，同时向上下文登记需要的导入
 *
 * <p>context 为 null 时只渲染、不登记（mutator 类型）。</p>
 */
class TypePrinter implements TypeVisitor<String> {
    private static final String TYPING_PREFIX = NameRegistry.TYPING + ".";

    private final PrinterContext context;

    TypePrinter(PrinterContext context) {
        this.context = context;
    }

    String print(StubType type) {
        return type.accept(this);
    }

    @Override
    public String visitNamed(NamedType type) {
        if (type.isNone()) {
            return "None";
        }
        String name = type.getName();
        if (name.startsWith(TYPING_PREFIX)) {
            String member = name.substring(TYPING_PREFIX.length());
            requireTyping(member);
            return member;
        }
        if (type.isDotted() && context != null) {
            context.requireModule(type.getModulePrefix());
        }
        return name;
    }

    @Override
    public String visitTypeParameter(TypeParameterType type) {
        return type.getName();
    }

    @Override
    public String visitAnything(AnythingType type) {
        requireTyping("Any");
        return "Any";
    }

    @Override
    public String visitNothing(NothingType type) {
        return "nothing";
    }

    @Override
    public String visitGeneric(GenericType type) {
        return printBase(type.getBase()) + "[" + join(type.getParameters()) + "]";
    }

    @Override
    public String visitHomogeneous(HomogeneousContainerType type) {
        String element = print(type.getElementType());
        if (isTuple(type.getBase())) {
            return printBase(type.getBase()) + "[" + element + ", ...]";
        }
        return printBase(type.getBase()) + "[" + element + "]";
    }

    @Override
    public String visitTuple(TupleType type) {
        return printBase(type.getBase()) + "[" + join(type.getParameters()) + "]";
    }

    @Override
    public String visitCallable(CallableType type) {
        return printBase(type.getBase()) + "[[" + join(type.getArgTypes()) + "], "
                + print(type.getReturnType()) + "]";
    }

    @Override
    public String visitUnion(UnionType type) {
        List<StubType> others = new ArrayList<StubType>();
        boolean optional = false;
        for (StubType option : type.getOptions()) {
            if (option instanceof NamedType && ((NamedType) option).isNone()) {
                optional = true;
            } else {
                others.add(option);
            }
        }
        if (!optional) {
            requireTyping("Union");
            return "Union[" + join(others) + "]";
        }
        requireTyping("Optional");
        if (others.size() == 1) {
            return "Optional[" + print(others.get(0)) + "]";
        }
        requireTyping("Union");
        return "Optional[Union[" + join(others) + "]]";
    }

    /**
     * 参数化类型的基类型：内置容器用 typing 中的大写名
     */
    private String printBase(NamedType base) {
        String capitalized = NameRegistry.capitalizedName(base.getName());
        if (capitalized != null) {
            requireTyping(capitalized);
            return capitalized;
        }
        return print(base);
    }

    private String join(List<StubType> types) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(print(types.get(i)));
        }
        return sb.toString();
    }

    private void requireTyping(String name) {
        if (context != null) {
            context.requireTyping(name);
        }
    }

    private static boolean isTuple(NamedType base) {
        String name = base.getName();
        return "tuple".equals(name) || "Tuple".equals(name) || (TYPING_PREFIX + "Tuple").equals(name);
    }
}
