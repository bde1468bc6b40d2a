package com.stubkit.compiler.model.type;

/**
 * 规范化后的类型基类（不可变，值相等）
 */
public abstract class StubType {

    public abstract <R> R accept(TypeVisitor<R> visitor);
}
