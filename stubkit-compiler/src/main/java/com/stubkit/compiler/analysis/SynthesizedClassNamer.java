package com.stubkit.compiler.analysis;

import java.util.HashMap;
import java.util.Map;

/**
 * 为 NamedTuple 合成类命名：首次出现用 `name`，之后依次为 `name~1`、`name~2`
 */
public final class SynthesizedClassNamer {
    private final Map<String, Integer> counters = new HashMap<String, Integer>();

    public String next(String baseName) {
        Integer seen = counters.get(baseName);
        int index = seen != null ? seen.intValue() : 0;
        counters.put(baseName, Integer.valueOf(index + 1));
        return index == 0 ? "`" + baseName + "`" : "`" + baseName + "~" + index + "`";
    }
}
