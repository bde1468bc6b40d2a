package com.stubkit.compiler.analysis;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.cond.IfStmt;
import com.stubkit.compiler.ast.decl.*;
import com.stubkit.compiler.ast.type.NamedTypeExpr;
import com.stubkit.compiler.ast.type.TypeExpr;
import com.stubkit.compiler.model.Alias;
import com.stubkit.compiler.model.Constant;
import com.stubkit.compiler.model.Function;
import com.stubkit.compiler.model.StubClass;
import com.stubkit.compiler.model.StubModule;
import com.stubkit.compiler.model.TypeParameter;
import com.stubkit.compiler.model.type.NamedType;
import com.stubkit.compiler.model.type.NothingType;
import com.stubkit.compiler.model.type.StubType;
import com.stubkit.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * 第二遍：只遍历存活分支，把原始声明提交为 {@link StubModule}
 *
 * <p>在 {@link ClassNameCollector} 之后运行。每个作用域关闭时合并重载并检查重名。</p>
 */
public final class ModuleBuilder implements AstVisitor<Void, ModuleBuilder.Members> {

    /**
     * 一个作用域（模块或类体）中累积的成员
     */
    static final class Members {
        final List<Constant> constants = new ArrayList<Constant>();
        final List<Alias> aliases = new ArrayList<Alias>();
        final List<TypeParameter> typeParameters = new ArrayList<TypeParameter>();
        final List<StubClass> classes = new ArrayList<StubClass>();
        final List<SignatureBuilder.Definition> definitions = new ArrayList<SignatureBuilder.Definition>();
        final boolean topLevel;
        final int line;  // 类声明行，顶层为 0

        Members(boolean topLevel, int line) {
            this.topLevel = topLevel;
            this.line = line;
        }

        Constant findConstant(String name) {
            for (Constant c : constants) {
                if (c.getName().equals(name)) {
                    return c;
                }
            }
            return null;
        }
    }

    private final ParseContext ctx;
    private final NameRegistry registry;
    private final TypeNormalizer normalizer;

    public ModuleBuilder(ParseContext ctx) {
        this.ctx = ctx;
        this.registry = ctx.getRegistry();
        this.normalizer = ctx.getNormalizer();
    }

    public StubModule build(StubFile file) {
        Members top = new Members(true, 0);
        visitAll(file.getDeclarations(), top);

        SignatureMerger.Merged merged = ctx.getMerger().mergeModule(top.definitions);
        List<Function> functions = new ArrayList<Function>();
        for (Function f : merged.getFunctions()) {
            functions.add(new Function(registry.qualify(f.getName()), f.getSignatures(), f.getKind(), f.isExternal()));
        }

        List<StubClass> classes = new ArrayList<StubClass>(top.classes);
        classes.addAll(normalizer.getSynthesizedClasses());

        StubModule module = new StubModule(ctx.getModuleName(), top.constants, top.typeParameters,
                classes, functions, top.aliases);
        ctx.getValidator().validateModule(module);
        return module;
    }

    private void visitAll(List<Declaration> declarations, Members scope) {
        for (Declaration decl : declarations) {
            decl.accept(this, scope);
        }
    }

    @Override
    public Void visitIfStmt(IfStmt node, Members scope) {
        visitAll(ctx.getEvaluator().liveBranch(node), scope);
        return null;
    }

    @Override
    public Void visitImportDecl(ImportDecl node, Members scope) {
        // import a.b.c 不产生任何可打印的绑定
        return null;
    }

    @Override
    public Void visitFromImportDecl(FromImportDecl node, Members scope) {
        if (node.isWildcard()) {
            return null;
        }
        String module = node.getModule().getFullName();
        for (FromImportDecl.ImportedName imported : node.getNames()) {
            registry.registerImport(imported.getBoundName(), module, imported.getName());
            if (!NameRegistry.TYPING.equals(module)) {
                scope.aliases.add(new Alias(registry.qualify(imported.getBoundName()),
                        new NamedType(module + "." + imported.getName())));
            }
        }
        return null;
    }

    @Override
    public Void visitConstantDecl(ConstantDecl node, Members scope) {
        StubType type = normalizer.normalize(node.getType());
        String name = scope.topLevel ? registry.qualify(node.getName()) : node.getName();
        scope.constants.add(new Constant(name, type));
        return null;
    }

    @Override
    public Void visitAliasDecl(AliasDecl node, Members scope) {
        if (scope.topLevel) {
            scope.aliases.add(new Alias(registry.qualify(node.getName()), normalizer.normalize(node.getValue())));
            return null;
        }
        // 类体中 y = x 复制同类常量 x 的类型
        TypeExpr value = node.getValue();
        if (value instanceof NamedTypeExpr) {
            Constant source = scope.findConstant(((NamedTypeExpr) value).getName());
            if (source != null) {
                scope.constants.add(new Constant(node.getName(), source.getType()));
                return null;
            }
        }
        throw new ParseException("Illegal value for alias '" + node.getName() + "'", scope.line);
    }

    @Override
    public Void visitTypeVarDecl(TypeVarDecl node, Members scope) {
        if (!node.getName().equals(node.getDeclaredName())) {
            throw new ParseException("TypeVar name needs to be '" + node.getDeclaredName()
                    + "' (not '" + node.getName() + "')", node.getLine());
        }
        scope.typeParameters.add(new TypeParameter(node.getName(), normalizer.normalizeAll(node.getConstraints())));
        return null;
    }

    @Override
    public Void visitFunDecl(FunDecl node, Members scope) {
        scope.definitions.add(ctx.getSignatureBuilder().build(node));
        return null;
    }

    @Override
    public Void visitClassDecl(ClassDecl node, Members scope) {
        List<StubType> parents = new ArrayList<StubType>();
        for (TypeExpr parent : node.getParents()) {
            StubType type = normalizer.normalize(parent);
            if (!(type instanceof NothingType)) {
                parents.add(type);
            }
        }
        StubType metaclass = node.getMetaclass() != null ? normalizer.normalize(node.getMetaclass()) : null;

        Members body = new Members(false, node.getLine());
        visitAll(node.getMembers(), body);

        SignatureMerger.Merged merged = ctx.getMerger().mergeClass(body.definitions, node.getLine());
        List<Constant> constants = new ArrayList<Constant>(body.constants);
        constants.addAll(merged.getProperties());

        StubClass cls = new StubClass(registry.qualify(node.getName()), parents, metaclass,
                constants, merged.getFunctions());
        ctx.getValidator().validateClass(cls, node.getLine());
        scope.classes.add(cls);
        return null;
    }
}
