package com.stubkit.compiler.ast.cond;

/**
 * 条件左侧的下标或切片：[i] 或 [start:stop:step]
 */
public final class Subscript {
    private final boolean slice;
    private final Integer index;
    private final Integer start;
    private final Integer stop;
    private final Integer step;

    private Subscript(boolean slice, Integer index, Integer start, Integer stop, Integer step) {
        this.slice = slice;
        this.index = index;
        this.start = start;
        this.stop = stop;
        this.step = step;
    }

    public static Subscript index(int index) {
        return new Subscript(false, Integer.valueOf(index), null, null, null);
    }

    /** 省略的边界传 null */
    public static Subscript slice(Integer start, Integer stop, Integer step) {
        return new Subscript(true, null, start, stop, step);
    }

    public boolean isSlice() {
        return slice;
    }

    public Integer getIndex() {
        return index;
    }

    public Integer getStart() {
        return start;
    }

    public Integer getStop() {
        return stop;
    }

    public Integer getStep() {
        return step;
    }
}
