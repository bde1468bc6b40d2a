package com.stubkit.compiler.analysis;

import com.stubkit.compiler.model.Alias;
import com.stubkit.compiler.model.Constant;
import com.stubkit.compiler.model.Function;
import com.stubkit.compiler.model.StubClass;
import com.stubkit.compiler.model.StubModule;
import com.stubkit.compiler.model.TypeParameter;
import com.stubkit.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 作用域关闭后检查标识符唯一性，一次报告所有重复名称
 */
public final class DuplicateValidator {
    private final NameRegistry registry;

    public DuplicateValidator(NameRegistry registry) {
        this.registry = registry;
    }

    /**
     * 顶层：常量、函数、类、别名、TypeVar 共用一个命名空间
     */
    public void validateModule(StubModule module) {
        List<String> names = new ArrayList<String>();
        for (Constant c : module.getConstants()) names.add(registry.unqualify(c.getName()));
        for (Function f : module.getFunctions()) names.add(registry.unqualify(f.getName()));
        for (StubClass c : module.getClasses()) names.add(registry.unqualify(c.getName()));
        for (Alias a : module.getAliases()) names.add(registry.unqualify(a.getName()));
        for (TypeParameter t : module.getTypeParameters()) names.add(t.getName());

        Set<String> duplicates = findDuplicates(names);
        if (!duplicates.isEmpty()) {
            throw new ParseException("Duplicate top-level identifier(s): " + String.join(", ", duplicates));
        }
    }

    /**
     * 类体：属性与方法共用一个命名空间，错误报告在类声明行
     */
    public void validateClass(StubClass cls, int line) {
        List<String> names = new ArrayList<String>();
        for (Constant c : cls.getConstants()) names.add(c.getName());
        for (Function f : cls.getMethods()) names.add(f.getName());

        Set<String> duplicates = findDuplicates(names);
        if (!duplicates.isEmpty()) {
            throw new ParseException("Duplicate identifier(s): " + String.join(", ", duplicates), line);
        }
    }

    static Set<String> findDuplicates(List<String> names) {
        Set<String> seen = new HashSet<String>();
        Set<String> duplicates = new TreeSet<String>();
        for (String name : names) {
            if (!seen.add(name)) {
                duplicates.add(name);
            }
        }
        return duplicates;
    }
}
