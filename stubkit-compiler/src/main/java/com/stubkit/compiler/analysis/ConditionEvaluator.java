package com.stubkit.compiler.analysis;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.Literal;
import com.stubkit.compiler.ast.cond.ComparisonCondition;
import com.stubkit.compiler.ast.cond.Condition;
import com.stubkit.compiler.ast.cond.IfBranch;
import com.stubkit.compiler.ast.cond.IfStmt;
import com.stubkit.compiler.ast.cond.OrCondition;
import com.stubkit.compiler.ast.cond.Subscript;
import com.stubkit.compiler.ast.decl.Declaration;
import com.stubkit.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 针对目标环境求值 sys.version_info / sys.platform 条件
 */
public final class ConditionEvaluator implements AstVisitor<Boolean, Void> {
    private static final String VERSION_INFO = "sys.version_info";
    private static final String PLATFORM = "sys.platform";

    private final TargetEnvironment environment;

    public ConditionEvaluator(TargetEnvironment environment) {
        this.environment = environment;
    }

    public boolean evaluate(Condition condition) {
        return condition.accept(this, null).booleanValue();
    }

    /**
     * 返回第一个为真的分支体；都不成立且没有 else 时返回空列表
     */
    public List<Declaration> liveBranch(IfStmt stmt) {
        for (IfBranch branch : stmt.getBranches()) {
            if (branch.isElse() || evaluate(branch.getCondition())) {
                return branch.getBody();
            }
        }
        return Collections.emptyList();
    }

    @Override
    public Boolean visitOrCondition(OrCondition node, Void ctx) {
        // 短路：遇到第一个为真的操作数即停止
        for (Condition operand : node.getOperands()) {
            if (evaluate(operand)) {
                return Boolean.TRUE;
            }
        }
        return Boolean.FALSE;
    }

    @Override
    public Boolean visitComparison(ComparisonCondition node, Void ctx) {
        String target = node.getTarget().getFullName();
        if (VERSION_INFO.equals(target)) {
            return Boolean.valueOf(evaluateVersion(node));
        }
        if (PLATFORM.equals(target) && node.getSubscript() == null) {
            return Boolean.valueOf(evaluatePlatform(node));
        }
        throw new ParseException("Unsupported condition: '" + target + "'", node.getLine());
    }

    private boolean evaluateVersion(ComparisonCondition node) {
        List<Integer> actual = environment.getVersion();
        Subscript subscript = node.getSubscript();
        Literal value = node.getValue();

        if (subscript != null && !subscript.isSlice()) {
            if (!value.is(Literal.Kind.INT)) {
                throw new ParseException("an element of sys.version_info must be compared to an integer",
                        node.getLine());
            }
            int index = subscript.getIndex().intValue();
            if (index < 0) {
                index += actual.size();
            }
            if (index < 0 || index >= actual.size()) {
                throw new ParseException("tuple index out of range", node.getLine());
            }
            long element = actual.get(index).longValue();
            return apply(node.getOperator(), Long.compare(element, value.getIntValue()));
        }

        if (subscript != null) {
            actual = slice(actual, subscript, node.getLine());
        }
        List<Long> expected = intTuple(value);
        if (expected == null) {
            throw new ParseException("sys.version_info must be compared to a tuple of integers", node.getLine());
        }
        return apply(node.getOperator(), compareTuples(actual, expected));
    }

    private boolean evaluatePlatform(ComparisonCondition node) {
        if (!node.getValue().is(Literal.Kind.STRING)) {
            throw new ParseException("sys.platform must be compared to a string", node.getLine());
        }
        if (!node.getOperator().isEquality()) {
            throw new ParseException("sys.platform must be compared using == or !=", node.getLine());
        }
        boolean equal = environment.getPlatform().equals(node.getValue().getText());
        return node.getOperator() == ComparisonCondition.Operator.EQ ? equal : !equal;
    }

    private static List<Long> intTuple(Literal value) {
        if (!value.is(Literal.Kind.TUPLE)) {
            return null;
        }
        List<Long> result = new ArrayList<Long>();
        for (Literal element : value.getElements()) {
            if (!element.is(Literal.Kind.INT)) {
                return null;
            }
            result.add(Long.valueOf(element.getIntValue()));
        }
        return result;
    }

    /**
     * 元组比较：较短的一方在末尾补 0 后逐项比较
     */
    static int compareTuples(List<Integer> actual, List<Long> expected) {
        int length = Math.max(actual.size(), expected.size());
        for (int i = 0; i < length; i++) {
            long a = i < actual.size() ? actual.get(i).longValue() : 0L;
            long b = i < expected.size() ? expected.get(i).longValue() : 0L;
            if (a != b) {
                return a < b ? -1 : 1;
            }
        }
        return 0;
    }

    /**
     * 与序列切片相同的语义，支持负数下标和负步长
     */
    static List<Integer> slice(List<Integer> values, Subscript subscript, int line) {
        int n = values.size();
        int step = subscript.getStep() != null ? subscript.getStep().intValue() : 1;
        if (step == 0) {
            throw new ParseException("slice step cannot be zero", line);
        }
        List<Integer> result = new ArrayList<Integer>();
        if (step > 0) {
            int start = clamp(subscript.getStart(), 0, n, 0, n);
            int stop = clamp(subscript.getStop(), n, n, 0, n);
            for (long i = start; i < stop; i += step) {
                result.add(values.get((int) i));
            }
        } else {
            int start = clamp(subscript.getStart(), n - 1, n, -1, n - 1);
            int stop = clamp(subscript.getStop(), -1, n, -1, n - 1);
            for (long i = start; i > stop; i += step) {
                result.add(values.get((int) i));
            }
        }
        return result;
    }

    private static int clamp(Integer bound, int defaultValue, int length, int lower, int upper) {
        if (bound == null) {
            return defaultValue;
        }
        int value = bound.intValue();
        if (value < 0) {
            value += length;
        }
        return Math.max(lower, Math.min(upper, value));
    }

    private static boolean apply(ComparisonCondition.Operator op, int cmp) {
        switch (op) {
            case EQ: return cmp == 0;
            case NE: return cmp != 0;
            case LT: return cmp < 0;
            case LE: return cmp <= 0;
            case GT: return cmp > 0;
            default: return cmp >= 0;
        }
    }
}
