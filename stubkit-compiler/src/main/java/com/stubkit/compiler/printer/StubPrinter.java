package com.stubkit.compiler.printer;

import com.stubkit.compiler.model.*;
import com.stubkit.compiler.model.type.GenericType;
import com.stubkit.compiler.model.type.HomogeneousContainerType;
import com.stubkit.compiler.model.type.NamedType;
import com.stubkit.compiler.model.type.StubType;

import java.util.ArrayList;
import java.util.List;

/**
 * 存根模块的规范打印器
 *
 * <p>段落顺序：导入、别名、常量、类型变量、类、函数；段落之间空一行。
 * 导入段由其他段引用到的类型推导出来，所以最后生成。</p>
 */
public class StubPrinter {
    private final PrintConfig config;

    public StubPrinter(PrintConfig config) {
        this.config = config;
    }

    public StubPrinter() {
        this(new PrintConfig());
    }

    /**
     * 打印模块；空模块输出空字符串
     */
    public String print(StubModule module) {
        PrinterContext ctx = new PrinterContext(config, module.getName());
        TypePrinter types = new TypePrinter(ctx);

        List<String> aliases = new ArrayList<String>();
        for (Alias alias : module.getAliases()) {
            aliases.add(printAlias(alias, module.getName(), types));
        }
        List<String> constants = new ArrayList<String>();
        for (Constant constant : module.getConstants()) {
            constants.add(printConstant(constant, types));
        }
        List<String> typeParameters = new ArrayList<String>();
        for (TypeParameter typeParameter : module.getTypeParameters()) {
            typeParameters.add(printTypeParameter(typeParameter, ctx, types));
        }
        List<String> classes = new ArrayList<String>();
        for (StubClass cls : module.getClasses()) {
            printClass(cls, ctx, types);
            classes.add(ctx.drain());
        }
        List<String> functions = new ArrayList<String>();
        for (Function function : module.getFunctions()) {
            printFunction(function, ctx, types);
            functions.add(trimTrailingNewline(ctx.drain()));
        }

        List<String> sections = new ArrayList<String>();
        addSection(sections, printImports(ctx));
        addSection(sections, aliases);
        addSection(sections, constants);
        addSection(sections, typeParameters);
        addSection(sections, classes);
        addSection(sections, functions);
        return String.join("\n\n", sections);
    }

    /**
     * 单独渲染一个类型（不登记导入）
     */
    public String printType(StubType type) {
        return new TypePrinter(null).print(type);
    }

    // ============ 各段 ============

    private static List<String> printImports(PrinterContext ctx) {
        List<String> lines = new ArrayList<String>();
        for (String module : ctx.getModuleImports()) {
            lines.add("import " + module);
        }
        if (!ctx.getTypingImports().isEmpty()) {
            lines.add("from typing import " + String.join(", ", ctx.getTypingImports()));
        }
        return lines;
    }

    /**
     * 目标为带点号的名称时打印为 from 导入，否则为赋值形式
     */
    private static String printAlias(Alias alias, String moduleName, TypePrinter types) {
        String name = alias.getName();
        String ownPrefix = moduleName + ".";
        if (name.startsWith(ownPrefix)) {
            name = name.substring(ownPrefix.length());
        }
        StubType target = alias.getType();
        if (target instanceof NamedType && ((NamedType) target).isDotted()) {
            NamedType named = (NamedType) target;
            String line = "from " + named.getModulePrefix() + " import " + named.getSimpleName();
            if (!named.getSimpleName().equals(name)) {
                line += " as " + name;
            }
            return line;
        }
        return name + " = " + types.print(target);
    }

    private static String printConstant(Constant constant, TypePrinter types) {
        return constant.getName() + " = ...  # type: " + types.print(constant.getType());
    }

    private static String printTypeParameter(TypeParameter typeParameter, PrinterContext ctx, TypePrinter types) {
        ctx.requireTyping("TypeVar");
        StringBuilder sb = new StringBuilder();
        sb.append(typeParameter.getName()).append(" = TypeVar('").append(typeParameter.getName()).append('\'');
        for (StubType constraint : typeParameter.getConstraints()) {
            sb.append(", ").append(types.print(constraint));
        }
        return sb.append(')').toString();
    }

    private void printClass(StubClass cls, PrinterContext ctx, TypePrinter types) {
        List<String> args = new ArrayList<String>();
        for (StubType parent : cls.getParents()) {
            args.add(types.print(parent));
        }
        if (cls.getMetaclass() != null) {
            args.add("metaclass=" + types.print(cls.getMetaclass()));
        }
        ctx.append("class " + cls.getName());
        if (!args.isEmpty()) {
            ctx.append("(" + String.join(", ", args) + ")");
        }
        ctx.append(":");
        ctx.newLine();

        ctx.indent();
        if (cls.getConstants().isEmpty() && cls.getMethods().isEmpty()) {
            ctx.append("pass");
            ctx.newLine();
        }
        for (Constant constant : cls.getConstants()) {
            ctx.append(printConstant(constant, types));
            ctx.newLine();
        }
        for (Function method : cls.getMethods()) {
            printFunction(method, ctx, types);
        }
        ctx.dedent();
    }

    /**
     * 每个重载签名一行（或一个带函数体的块），每行以换行结束
     */
    private void printFunction(Function function, PrinterContext ctx, TypePrinter types) {
        if (function.isExternal()) {
            ctx.append("def " + function.getName() + " PYTHONCODE");
            ctx.newLine();
            return;
        }
        String decorator = function.getKind().getDecoratorName();
        boolean constructor = "__new__".equals(function.getName());
        for (Signature signature : function.getSignatures()) {
            if (decorator != null && !constructor) {
                ctx.append("@" + decorator);
                ctx.newLine();
            }
            ctx.append("def " + function.getName() + "(" + printParameters(signature, types) + ") -> "
                    + types.print(signature.getReturnType()) + ":");
            if (!signature.hasBody()) {
                ctx.append(" ...");
                ctx.newLine();
                continue;
            }
            ctx.newLine();
            ctx.indent();
            for (StubType exception : signature.getExceptions()) {
                ctx.append("raise " + types.print(exception) + "()");
                ctx.newLine();
            }
            // mutator 类型不参与导入推导
            TypePrinter plain = new TypePrinter(null);
            for (Parameter param : signature.getParams()) {
                if (param.getMutatedType() != null) {
                    ctx.append(param.getName() + " := " + plain.print(param.getMutatedType()));
                    ctx.newLine();
                }
            }
            ctx.dedent();
        }
    }

    private static String printParameters(Signature signature, TypePrinter types) {
        List<String> parts = new ArrayList<String>();
        List<Parameter> kwonly = new ArrayList<Parameter>();
        for (Parameter param : signature.getParams()) {
            if (param.isKwonly()) {
                kwonly.add(param);
            } else {
                parts.add(printParameter(param, types));
            }
        }
        if (signature.getStarargs() != null) {
            parts.add("*" + printStarParameter(signature.getStarargs(), types));
        } else if (!kwonly.isEmpty()) {
            parts.add("*");
        }
        for (Parameter param : kwonly) {
            parts.add(printParameter(param, types));
        }
        if (signature.getStarstarargs() != null) {
            parts.add("**" + printStarParameter(signature.getStarstarargs(), types));
        }
        return String.join(", ", parts);
    }

    private static String printParameter(Parameter param, TypePrinter types) {
        String text = param.getName();
        if (param.getType() != null) {
            text += ": " + types.print(param.getType());
        }
        if (param.isOptional()) {
            text += " = ...";
        }
        return text;
    }

    /**
     * *args: Tuple[T, ...] 打印为 *args: T，**kwargs: Dict[str, T] 打印为 **kwargs: T
     */
    private static String printStarParameter(Parameter param, TypePrinter types) {
        StubType type = param.getType();
        if (type == null) {
            return param.getName();
        }
        // 完整类型仍然参与导入推导
        String full = types.print(type);
        if (type instanceof HomogeneousContainerType) {
            return param.getName() + ": " + types.print(((HomogeneousContainerType) type).getElementType());
        }
        if (type instanceof GenericType) {
            List<StubType> params = ((GenericType) type).getParameters();
            return param.getName() + ": " + types.print(params.get(params.size() - 1));
        }
        return param.getName() + ": " + full;
    }

    private static void addSection(List<String> sections, List<String> items) {
        if (!items.isEmpty()) {
            sections.add(String.join("\n", items));
        }
    }

    private static String trimTrailingNewline(String text) {
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }
}
