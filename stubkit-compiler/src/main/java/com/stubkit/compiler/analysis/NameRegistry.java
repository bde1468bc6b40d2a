package com.stubkit.compiler.analysis;

import com.stubkit.compiler.model.type.AnythingType;
import com.stubkit.compiler.model.type.NamedType;
import com.stubkit.compiler.model.type.NothingType;
import com.stubkit.compiler.model.type.StubType;
import com.stubkit.compiler.model.type.TypeParameterType;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 名称解析表（每次解析独立一份）
 *
 * <p>裸名称的优先级：本地类 → 模块内 TypeVar → 内置大小写别名（List → list 等）
 * → from 导入的名称 → 原样保留。</p>
 */
public final class NameRegistry {
    public static final String TYPING = "typing";

    // 只读：typing 中的大写容器名 → 运行时小写名
    private static final Map<String, String> CAPITALIZED_ALIASES;

    static {
        Map<String, String> map = new HashMap<String, String>();
        map.put("List", "list");
        map.put("Dict", "dict");
        map.put("Tuple", "tuple");
        map.put("Set", "set");
        map.put("FrozenSet", "frozenset");
        map.put("Type", "type");
        CAPITALIZED_ALIASES = Collections.unmodifiableMap(map);
    }

    private final String modulePrefix;       // 显式模块名时为 "name."，否则为 null
    private final boolean typingModule;
    private final Set<String> localClasses = new HashSet<String>();
    private final Set<String> typeParameters = new HashSet<String>();
    private final Map<String, String> imports = new HashMap<String, String>();

    /**
     * @param explicitModuleName 调用方给出的模块名，未给出时为 null
     */
    public NameRegistry(String explicitModuleName) {
        this.modulePrefix = explicitModuleName != null ? explicitModuleName + "." : null;
        this.typingModule = TYPING.equals(explicitModuleName);
    }

    /**
     * 运行时小写名 → typing 大写名；不是内置容器时返回 null
     */
    public static String capitalizedName(String runtimeName) {
        for (Map.Entry<String, String> e : CAPITALIZED_ALIASES.entrySet()) {
            if (e.getValue().equals(runtimeName)) {
                return e.getKey();
            }
        }
        return null;
    }

    public void registerClass(String name) {
        localClasses.add(name);
    }

    public void registerTypeParameter(String name) {
        typeParameters.add(name);
    }

    /**
     * 记录 from module import name [as boundName]
     */
    public void registerImport(String boundName, String module, String name) {
        imports.put(boundName, module + "." + name);
    }

    public boolean isLocalClass(String name) {
        return localClasses.contains(name);
    }

    public boolean isTypeParameter(String name) {
        return typeParameters.contains(name);
    }

    /**
     * 顶层声明名加上模块前缀（反引号包围的合成名不加）
     */
    public String qualify(String name) {
        if (modulePrefix == null || name.startsWith("`")) {
            return name;
        }
        return modulePrefix + name;
    }

    /**
     * 去掉本模块前缀
     */
    public String unqualify(String name) {
        if (modulePrefix != null && name.startsWith(modulePrefix)) {
            return name.substring(modulePrefix.length());
        }
        return name;
    }

    /**
     * 解析类型位置上的名称（可带点号）
     */
    public StubType resolve(String name) {
        if ("None".equals(name)) {
            return NamedType.NONE;
        }
        if ("nothing".equals(name)) {
            return NothingType.INSTANCE;
        }
        if (name.indexOf('.') >= 0) {
            return resolveDotted(name);
        }
        if (localClasses.contains(name)) {
            return new NamedType(qualify(name));
        }
        if (typeParameters.contains(name)) {
            return new TypeParameterType(name);
        }
        if (!typingModule && CAPITALIZED_ALIASES.containsKey(name)) {
            return new NamedType(CAPITALIZED_ALIASES.get(name));
        }
        String imported = imports.get(name);
        if (imported != null) {
            return resolveDotted(imported);
        }
        if ("Any".equals(name)) {
            return AnythingType.INSTANCE;
        }
        return new NamedType(name);
    }

    private StubType resolveDotted(String name) {
        if (name.startsWith(TYPING + ".")) {
            String member = name.substring(TYPING.length() + 1);
            if ("Any".equals(member)) {
                return AnythingType.INSTANCE;
            }
            if (!typingModule && CAPITALIZED_ALIASES.containsKey(member)) {
                return new NamedType(CAPITALIZED_ALIASES.get(member));
            }
        }
        return new NamedType(name);
    }
}
