package com.stubkit.compiler.analysis;

import com.stubkit.compiler.analysis.SignatureBuilder.Definition;
import com.stubkit.compiler.model.Constant;
import com.stubkit.compiler.model.Function;
import com.stubkit.compiler.model.FunctionKind;
import com.stubkit.compiler.model.Signature;
import com.stubkit.compiler.model.type.AnythingType;
import com.stubkit.compiler.model.type.StubType;
import com.stubkit.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 按名称合并同一作用域内的 def：重载列表、属性三件套、外部函数体
 *
 * <p>分组保持名称首次出现的顺序。</p>
 */
public final class SignatureMerger {

    /**
     * 合并结果：普通函数与由属性合成的常量
     */
    public static final class Merged {
        private final List<Function> functions;
        private final List<Constant> properties;

        Merged(List<Function> functions, List<Constant> properties) {
            this.functions = Collections.unmodifiableList(functions);
            this.properties = Collections.unmodifiableList(properties);
        }

        public List<Function> getFunctions() {
            return functions;
        }

        public List<Constant> getProperties() {
            return properties;
        }
    }

    /**
     * 合并模块顶层函数（不允许属性装饰器）
     */
    public Merged mergeModule(List<Definition> definitions) {
        TreeSet<String> propertyNames = new TreeSet<String>();
        for (Definition def : definitions) {
            if (def.getDecorator() != null && def.getDecorator().isPropertyFamily()) {
                propertyNames.add(def.getName());
            }
        }
        if (!propertyNames.isEmpty()) {
            throw new ParseException("Module-level functions with property decorators: "
                    + String.join(", ", propertyNames));
        }
        for (Definition def : definitions) {
            if (def.getDecorator() != null && def.getDecorator().getKind() == Decorator.Kind.UNRECOGNIZED) {
                throw new ParseException("Unhandled decorator: " + def.getDecorator().getText());
            }
        }

        List<Function> functions = new ArrayList<Function>();
        for (Map.Entry<String, List<Definition>> group : groupByName(definitions).entrySet()) {
            functions.add(mergeFunction(group.getKey(), group.getValue(), null));
        }
        return new Merged(functions, new ArrayList<Constant>());
    }

    /**
     * 合并类体方法，错误报告在类声明行
     */
    public Merged mergeClass(List<Definition> definitions, int classLine) {
        Integer line = Integer.valueOf(classLine);
        List<Function> functions = new ArrayList<Function>();
        List<Constant> properties = new ArrayList<Constant>();

        for (Map.Entry<String, List<Definition>> group : groupByName(definitions).entrySet()) {
            String name = group.getKey();
            List<Definition> defs = group.getValue();
            for (Definition def : defs) {
                checkDecoratorShape(def, line);
            }
            if (countPropertyFamily(defs) > 0) {
                if (countPropertyFamily(defs) != defs.size()) {
                    throw new ParseException("Incompatible signatures for " + name, line);
                }
                properties.add(mergeProperty(name, defs));
            } else {
                functions.add(mergeFunction(name, defs, line));
            }
        }
        return new Merged(functions, properties);
    }

    private static Map<String, List<Definition>> groupByName(List<Definition> definitions) {
        Map<String, List<Definition>> groups = new LinkedHashMap<String, List<Definition>>();
        for (Definition def : definitions) {
            List<Definition> group = groups.get(def.getName());
            if (group == null) {
                group = new ArrayList<Definition>();
                groups.put(def.getName(), group);
            }
            group.add(def);
        }
        return groups;
    }

    private static int countPropertyFamily(List<Definition> defs) {
        int count = 0;
        for (Definition def : defs) {
            if (def.getDecorator() != null && def.getDecorator().isPropertyFamily()) {
                count++;
            }
        }
        return count;
    }

    /**
     * 未识别的装饰器，或属性装饰器参数个数、目标名不符
     */
    private static void checkDecoratorShape(Definition def, Integer line) {
        Decorator decorator = def.getDecorator();
        if (decorator == null) {
            return;
        }
        boolean valid;
        switch (decorator.getKind()) {
            case UNRECOGNIZED:
                valid = false;
                break;
            case PROPERTY:
                valid = paramCount(def) == 1;
                break;
            case SETTER:
                valid = paramCount(def) == 2 && def.getName().equals(decorator.getTarget());
                break;
            case DELETER:
                valid = paramCount(def) == 1 && def.getName().equals(decorator.getTarget());
                break;
            default:
                valid = true;
                break;
        }
        if (!valid) {
            throw new ParseException("Unhandled decorator: " + decorator.getText(), line);
        }
    }

    private static int paramCount(Definition def) {
        return def.getSignature() != null ? def.getSignature().getParams().size() : -1;
    }

    private static Constant mergeProperty(String name, List<Definition> defs) {
        StubType type = AnythingType.INSTANCE;
        for (Definition def : defs) {
            Signature sig = def.getSignature();
            StubType candidate = null;
            if (def.getDecorator().getKind() == Decorator.Kind.PROPERTY) {
                candidate = sig.getReturnType();
            } else if (def.getDecorator().getKind() == Decorator.Kind.SETTER) {
                candidate = sig.getParams().get(1).getType();
            }
            if (candidate != null && !(candidate instanceof AnythingType)) {
                type = candidate;
            }
        }
        return new Constant(name, type);
    }

    private static Function mergeFunction(String name, List<Definition> defs, Integer line) {
        int externals = 0;
        for (Definition def : defs) {
            if (def.isExternal()) externals++;
        }
        if (externals > 1) {
            throw new ParseException("Multiple PYTHONCODEs for " + name);
        }
        if (externals == 1) {
            if (defs.size() > 1) {
                throw new ParseException("Mixed pytd and PYTHONCODEs for " + name);
            }
            return new Function(name, Collections.<Signature>emptyList(), FunctionKind.METHOD, true);
        }

        FunctionKind kind = defs.get(0).getKind();
        List<Signature> signatures = new ArrayList<Signature>();
        for (Definition def : defs) {
            if (def.getKind() != kind) {
                throw new ParseException("Overloaded signatures for " + name + " disagree on decorators",
                        line, null);
            }
            signatures.add(def.getSignature());
        }
        return new Function(name, signatures, kind, false);
    }
}
