package com.stubkit.compiler.analysis;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 识别后的装饰器（封闭变体）
 */
public final class Decorator {

    public enum Kind {
        PROPERTY,
        SETTER,
        DELETER,
        CLASSMETHOD,
        STATICMETHOD,
        OVERLOAD,
        ABSTRACTMETHOD,
        UNRECOGNIZED
    }

    private static final Map<String, Kind> SIMPLE_KINDS;

    static {
        Map<String, Kind> map = new HashMap<String, Kind>();
        map.put("property", Kind.PROPERTY);
        map.put("classmethod", Kind.CLASSMETHOD);
        map.put("staticmethod", Kind.STATICMETHOD);
        map.put("overload", Kind.OVERLOAD);
        map.put("abstractmethod", Kind.ABSTRACTMETHOD);
        SIMPLE_KINDS = Collections.unmodifiableMap(map);
    }

    private final Kind kind;
    private final String text;
    private final String target;  // SETTER/DELETER 的属性名

    private Decorator(Kind kind, String text, String target) {
        this.kind = kind;
        this.text = text;
        this.target = target;
    }

    /**
     * 按装饰器原文识别
     */
    public static Decorator recognize(String text) {
        Kind simple = SIMPLE_KINDS.get(text);
        if (simple != null) {
            return new Decorator(simple, text, null);
        }
        int dot = text.lastIndexOf('.');
        if (dot > 0) {
            String owner = text.substring(0, dot);
            String attribute = text.substring(dot + 1);
            if (owner.indexOf('.') < 0) {
                if ("setter".equals(attribute)) {
                    return new Decorator(Kind.SETTER, text, owner);
                }
                if ("deleter".equals(attribute)) {
                    return new Decorator(Kind.DELETER, text, owner);
                }
            }
        }
        return new Decorator(Kind.UNRECOGNIZED, text, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public String getTarget() {
        return target;
    }

    /** property / x.setter / x.deleter */
    public boolean isPropertyFamily() {
        return kind == Kind.PROPERTY || kind == Kind.SETTER || kind == Kind.DELETER;
    }

    /** overload 和 abstractmethod 不影响合并结果 */
    public boolean isNoOp() {
        return kind == Kind.OVERLOAD || kind == Kind.ABSTRACTMETHOD;
    }

    @Override
    public String toString() {
        return "@" + text;
    }
}
