package com.stubkit.compiler.model;

/**
 * 函数种类
 */
public enum FunctionKind {
    METHOD(null),
    CLASSMETHOD("classmethod"),
    STATICMETHOD("staticmethod");

    private final String decoratorName;

    FunctionKind(String decoratorName) {
        this.decoratorName = decoratorName;
    }

    /** 打印时使用的装饰器名，普通方法为 null */
    public String getDecoratorName() {
        return decoratorName;
    }
}
