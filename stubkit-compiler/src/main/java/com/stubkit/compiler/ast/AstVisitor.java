package com.stubkit.compiler.ast;

import com.stubkit.compiler.ast.cond.*;
import com.stubkit.compiler.ast.decl.*;
import com.stubkit.compiler.ast.stmt.*;
import com.stubkit.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitStubFile(StubFile node, C ctx) { return null; }

    default R visitImportDecl(ImportDecl node, C ctx) { return null; }

    default R visitFromImportDecl(FromImportDecl node, C ctx) { return null; }

    default R visitConstantDecl(ConstantDecl node, C ctx) { return null; }

    default R visitAliasDecl(AliasDecl node, C ctx) { return null; }

    default R visitTypeVarDecl(TypeVarDecl node, C ctx) { return null; }

    default R visitClassDecl(ClassDecl node, C ctx) { return null; }

    default R visitFunDecl(FunDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    default R visitQualifiedName(QualifiedName node, C ctx) { return null; }

    // ============ 条件块 ============

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitComparison(ComparisonCondition node, C ctx) { return null; }

    default R visitOrCondition(OrCondition node, C ctx) { return null; }

    // ============ 函数体语句 ============

    default R visitMutatorStmt(MutatorStmt node, C ctx) { return null; }

    default R visitRaiseStmt(RaiseStmt node, C ctx) { return null; }

    // ============ 类型表达式 ============

    default R visitNamedTypeExpr(NamedTypeExpr node, C ctx) { return null; }

    default R visitGenericTypeExpr(GenericTypeExpr node, C ctx) { return null; }

    default R visitListTypeExpr(ListTypeExpr node, C ctx) { return null; }

    default R visitUnionTypeExpr(UnionTypeExpr node, C ctx) { return null; }

    default R visitAnyTypeExpr(AnyTypeExpr node, C ctx) { return null; }

    default R visitEllipsisTypeExpr(EllipsisTypeExpr node, C ctx) { return null; }

    default R visitNamedTupleTypeExpr(NamedTupleTypeExpr node, C ctx) { return null; }

    // ============ 其他 ============

    default R visitLiteral(Literal node, C ctx) { return null; }
}
