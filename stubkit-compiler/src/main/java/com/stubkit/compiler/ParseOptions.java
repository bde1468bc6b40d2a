package com.stubkit.compiler;

import com.stubkit.compiler.analysis.TargetEnvironment;
import com.stubkit.compiler.parser.Parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 解析选项（不可变，通过 {@link Builder} 构建）
 */
public final class ParseOptions {
    private final String name;
    private final List<Integer> targetVersion;
    private final String targetPlatform;
    private final String filename;
    private final int maxNestingDepth;

    private ParseOptions(Builder builder) {
        this.name = builder.name;
        this.targetVersion = Collections.unmodifiableList(new ArrayList<Integer>(builder.targetVersion));
        this.targetPlatform = builder.targetPlatform;
        this.filename = builder.filename;
        this.maxNestingDepth = builder.maxNestingDepth;
    }

    public static ParseOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 显式模块名；为 null 时使用源码的 MD5 摘要 */
    public String getName() {
        return name;
    }

    public List<Integer> getTargetVersion() {
        return targetVersion;
    }

    public String getTargetPlatform() {
        return targetPlatform;
    }

    /** 仅用于错误显示 */
    public String getFilename() {
        return filename;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public TargetEnvironment toTargetEnvironment() {
        return new TargetEnvironment(targetVersion, targetPlatform);
    }

    public static final class Builder {
        private String name;
        private List<Integer> targetVersion = TargetEnvironment.DEFAULT_VERSION;
        private String targetPlatform = TargetEnvironment.DEFAULT_PLATFORM;
        private String filename;
        private int maxNestingDepth = Parser.DEFAULT_MAX_NESTING_DEPTH;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder targetVersion(Integer... version) {
            return targetVersion(Arrays.asList(version));
        }

        public Builder targetVersion(List<Integer> version) {
            if (version == null || version.isEmpty()) {
                throw new IllegalArgumentException("target version must not be empty");
            }
            this.targetVersion = version;
            return this;
        }

        public Builder targetPlatform(String platform) {
            if (platform == null) {
                throw new IllegalArgumentException("target platform must not be null");
            }
            this.targetPlatform = platform;
            return this;
        }

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            if (depth < 1) {
                throw new IllegalArgumentException("max nesting depth must be positive: " + depth);
            }
            this.maxNestingDepth = depth;
            return this;
        }

        public ParseOptions build() {
            return new ParseOptions(this);
        }
    }
}
