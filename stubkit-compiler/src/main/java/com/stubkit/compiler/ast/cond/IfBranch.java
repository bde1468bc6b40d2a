package com.stubkit.compiler.ast.cond;

import com.stubkit.compiler.ast.decl.Declaration;

import java.util.List;

/**
 * if/elif/else 分支（else 分支的条件为 null）
 */
public final class IfBranch {
    private final Condition condition;
    private final List<Declaration> body;

    public IfBranch(Condition condition, List<Declaration> body) {
        this.condition = condition;
        this.body = body;
    }

    public Condition getCondition() {
        return condition;
    }

    public List<Declaration> getBody() {
        return body;
    }

    public boolean isElse() {
        return condition == null;
    }
}
