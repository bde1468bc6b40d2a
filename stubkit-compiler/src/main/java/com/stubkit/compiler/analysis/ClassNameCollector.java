package com.stubkit.compiler.analysis;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.cond.IfStmt;
import com.stubkit.compiler.ast.decl.ClassDecl;
import com.stubkit.compiler.ast.decl.Declaration;
import com.stubkit.compiler.ast.decl.StubFile;
import com.stubkit.compiler.ast.decl.TypeVarDecl;

import java.util.List;

/**
 * 第一遍：登记存活分支中的类名和 TypeVar 名，使前向引用在第二遍中可解析
 */
public final class ClassNameCollector implements AstVisitor<Void, Void> {
    private final NameRegistry registry;
    private final ConditionEvaluator evaluator;

    public ClassNameCollector(NameRegistry registry, ConditionEvaluator evaluator) {
        this.registry = registry;
        this.evaluator = evaluator;
    }

    public void collect(StubFile file) {
        file.accept(this, null);
    }

    @Override
    public Void visitStubFile(StubFile node, Void ctx) {
        visitAll(node.getDeclarations());
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        visitAll(evaluator.liveBranch(node));
        return null;
    }

    @Override
    public Void visitClassDecl(ClassDecl node, Void ctx) {
        registry.registerClass(node.getName());
        return null;
    }

    @Override
    public Void visitTypeVarDecl(TypeVarDecl node, Void ctx) {
        registry.registerTypeParameter(node.getName());
        return null;
    }

    private void visitAll(List<Declaration> declarations) {
        for (Declaration decl : declarations) {
            decl.accept(this, null);
        }
    }
}
