package com.stubkit.compiler.analysis;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.type.*;
import com.stubkit.compiler.model.Constant;
import com.stubkit.compiler.model.Function;
import com.stubkit.compiler.model.StubClass;
import com.stubkit.compiler.model.type.*;
import com.stubkit.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 把原始类型表达式解析并规范化为模型类型
 *
 * <ul>
 *   <li>Callable[[A], R] / Callable[..., R] / 省略返回类型</li>
 *   <li>Tuple[T, ...] 与 Tuple[A, B] 的区分，B[T, ...] → B[T]</li>
 *   <li>[] / [A, B] 元组简写</li>
 *   <li>Union / Optional / or 联合</li>
 *   <li>NamedTuple(...) 合成类</li>
 * </ul>
 */
public final class TypeNormalizer implements AstVisitor<StubType, Void> {
    private static final NamedType TUPLE = new NamedType("tuple");

    private final NameRegistry registry;
    private final SynthesizedClassNamer namer;
    private final List<StubClass> synthesizedClasses = new ArrayList<StubClass>();

    public TypeNormalizer(NameRegistry registry, SynthesizedClassNamer namer) {
        this.registry = registry;
        this.namer = namer;
    }

    public StubType normalize(TypeExpr expr) {
        return expr.accept(this, null);
    }

    public List<StubType> normalizeAll(List<TypeExpr> exprs) {
        List<StubType> result = new ArrayList<StubType>(exprs.size());
        for (TypeExpr expr : exprs) {
            result.add(normalize(expr));
        }
        return result;
    }

    /** 按创建顺序排列的 NamedTuple 合成类 */
    public List<StubClass> getSynthesizedClasses() {
        return Collections.unmodifiableList(synthesizedClasses);
    }

    @Override
    public StubType visitNamedTypeExpr(NamedTypeExpr node, Void ctx) {
        StubType type = registry.resolve(node.getName());
        if (type instanceof NamedType) {
            String name = ((NamedType) type).getName();
            if ("typing.Union".equals(name) || "typing.Optional".equals(name)) {
                throw new ParseException("Missing options to " + name, node.getLine());
            }
        }
        return type;
    }

    @Override
    public StubType visitAnyTypeExpr(AnyTypeExpr node, Void ctx) {
        return AnythingType.INSTANCE;
    }

    @Override
    public StubType visitUnionTypeExpr(UnionTypeExpr node, Void ctx) {
        return UnionType.of(normalizeAll(node.getOptions()));
    }

    @Override
    public StubType visitEllipsisTypeExpr(EllipsisTypeExpr node, Void ctx) {
        throw new ParseException("ellipsis (...) not supported here", node.getLine());
    }

    @Override
    public StubType visitListTypeExpr(ListTypeExpr node, Void ctx) {
        return tupleOf(TUPLE, node.getElements(), node.getLine());
    }

    @Override
    public StubType visitGenericTypeExpr(GenericTypeExpr node, Void ctx) {
        String written = node.getBase().getName();
        StubType resolvedBase = registry.resolve(written);
        if (!(resolvedBase instanceof NamedType)) {
            throw new ParseException("Illegal base type: " + written, node.getLine());
        }
        NamedType base = (NamedType) resolvedBase;
        List<TypeExpr> params = node.getParameters();
        int line = node.getLine();

        if (isTyping(base, "Union")) {
            if (params.isEmpty()) {
                throw new ParseException("Missing options to typing.Union", line);
            }
            checkNoEllipsis(params, line);
            return UnionType.of(normalizeAll(params));
        }
        if (isTyping(base, "Optional")) {
            if (params.size() != 1) {
                throw new ParseException("Expected 1 parameter to typing.Optional, got " + params.size(), line);
            }
            checkNoEllipsis(params, line);
            List<StubType> options = new ArrayList<StubType>();
            options.add(normalize(params.get(0)));
            options.add(NamedType.NONE);
            return UnionType.of(options);
        }
        if (isTyping(base, "Callable")) {
            return callable(base, params, line);
        }
        if (isTuple(base)) {
            return tupleOf(base, params, line);
        }
        return generic(base, params, line);
    }

    @Override
    public StubType visitNamedTupleTypeExpr(NamedTupleTypeExpr node, Void ctx) {
        String className = namer.next(node.getName());
        List<Constant> fields = new ArrayList<Constant>();
        List<StubType> fieldTypes = new ArrayList<StubType>();
        for (NamedTupleTypeExpr.Field field : node.getFields()) {
            StubType type = normalize(field.getType());
            fields.add(new Constant(field.getName(), type));
            fieldTypes.add(type);
        }
        StubType parent = fieldTypes.isEmpty()
                ? new HomogeneousContainerType(TUPLE, NothingType.INSTANCE)
                : new TupleType(TUPLE, fieldTypes);
        synthesizedClasses.add(new StubClass(className, Collections.singletonList(parent), null,
                fields, Collections.<Function>emptyList()));
        return new NamedType(className);
    }

    // ============ 规范化规则 ============

    /**
     * Tuple[...] 与 [...] 简写
     */
    private StubType tupleOf(NamedType base, List<TypeExpr> params, int line) {
        if (params.isEmpty()) {
            return new HomogeneousContainerType(base, NothingType.INSTANCE);
        }
        if (endsWithEllipsis(params, line)) {
            List<StubType> leading = normalizeAll(params.subList(0, params.size() - 1));
            if (leading.size() == 1) {
                return new HomogeneousContainerType(base, leading.get(0));
            }
            // Tuple[A, B, ...] → Tuple[A, B, Any]
            leading.add(AnythingType.INSTANCE);
            return new TupleType(base, leading);
        }
        return new TupleType(base, normalizeAll(params));
    }

    /**
     * 其他参数化类型：B[T, ...] → B[T]
     */
    private StubType generic(NamedType base, List<TypeExpr> params, int line) {
        if (endsWithEllipsis(params, line)) {
            List<StubType> leading = normalizeAll(params.subList(0, params.size() - 1));
            if (leading.isEmpty()) {
                return new HomogeneousContainerType(base, AnythingType.INSTANCE);
            }
            if (leading.size() == 1) {
                return new HomogeneousContainerType(base, leading.get(0));
            }
            return new GenericType(base, leading);
        }
        return new GenericType(base, normalizeAll(params));
    }

    private StubType callable(NamedType base, List<TypeExpr> params, int line) {
        if (params.isEmpty() || params.size() > 2) {
            throw new ParseException("Expected 2 parameters to Callable, got " + params.size(), line);
        }
        StubType returnType = params.size() == 2 ? normalizeOrAnything(params.get(1)) : AnythingType.INSTANCE;
        TypeExpr first = params.get(0);

        if (first instanceof ListTypeExpr) {
            List<StubType> argTypes = new ArrayList<StubType>();
            for (TypeExpr arg : ((ListTypeExpr) first).getElements()) {
                StubType argType = normalize(arg);
                // [nothing] 表示空参数列表
                if (!(argType instanceof NothingType)) {
                    argTypes.add(argType);
                }
            }
            return new CallableType(base, argTypes, returnType);
        }

        StubType firstType = normalizeOrAnything(first);
        if (firstType instanceof AnythingType) {
            List<StubType> generic = new ArrayList<StubType>();
            generic.add(AnythingType.INSTANCE);
            generic.add(returnType);
            return new GenericType(base, generic);
        }
        throw new ParseException("First argument to Callable must be a list of argument types", line);
    }

    private StubType normalizeOrAnything(TypeExpr expr) {
        if (expr instanceof EllipsisTypeExpr) {
            return AnythingType.INSTANCE;
        }
        return normalize(expr);
    }

    /**
     * 检查省略号位置：只允许出现在最后
     */
    private static boolean endsWithEllipsis(List<TypeExpr> params, int line) {
        int count = 0;
        for (TypeExpr p : params) {
            if (p instanceof EllipsisTypeExpr) count++;
        }
        if (count == 0) {
            return false;
        }
        if (count > 1) {
            throw new ParseException("[..., ...] not supported", line);
        }
        if (!(params.get(params.size() - 1) instanceof EllipsisTypeExpr)) {
            throw new ParseException("ellipsis (...) not supported before the last type parameter", line);
        }
        return true;
    }

    private static void checkNoEllipsis(List<TypeExpr> params, int line) {
        for (TypeExpr p : params) {
            if (p instanceof EllipsisTypeExpr) {
                throw new ParseException("ellipsis (...) not supported here", line);
            }
        }
    }

    private static boolean isTyping(NamedType type, String member) {
        String name = type.getName();
        return name.equals(member) || name.equals(NameRegistry.TYPING + "." + member);
    }

    private static boolean isTuple(NamedType type) {
        return "tuple".equals(type.getName()) || isTyping(type, "Tuple");
    }
}
