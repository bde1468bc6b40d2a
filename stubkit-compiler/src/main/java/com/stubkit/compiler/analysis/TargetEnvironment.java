package com.stubkit.compiler.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 条件编译的目标环境：运行时版本元组 + 平台字符串
 */
public final class TargetEnvironment {
    public static final List<Integer> DEFAULT_VERSION =
            Collections.unmodifiableList(Arrays.asList(2, 7, 6));
    public static final String DEFAULT_PLATFORM = "linux";

    private final List<Integer> version;
    private final String platform;

    public TargetEnvironment(List<Integer> version, String platform) {
        if (version == null || version.isEmpty()) {
            throw new IllegalArgumentException("target version must not be empty");
        }
        this.version = Collections.unmodifiableList(new ArrayList<Integer>(version));
        this.platform = Objects.requireNonNull(platform, "platform");
    }

    public static TargetEnvironment defaults() {
        return new TargetEnvironment(DEFAULT_VERSION, DEFAULT_PLATFORM);
    }

    public List<Integer> getVersion() {
        return version;
    }

    public String getPlatform() {
        return platform;
    }

    @Override
    public String toString() {
        return "version=" + version + ", platform=" + platform;
    }
}
