package com.stubkit.cli;

import com.stubkit.compiler.ParseOptions;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.List;

/**
 * 各子命令共享的解析选项
 */
public class ParseOptionsMixin {

    @Spec(Spec.Target.MIXEE)
    CommandSpec spec;

    @Option(names = "--name", description = "模块名（默认为源码的 MD5 摘要）")
    String name;

    @Option(names = "--python-version", paramLabel = "X.Y[.Z]",
            description = "条件求值的目标版本（默认 2.7.6）")
    String pythonVersion;

    @Option(names = "--platform", description = "条件求值的目标平台（默认 linux）")
    String platform;

    @Option(names = "--filename", description = "错误信息中显示的文件名（默认为输入路径）")
    String filename;

    /**
     * @param inputPath 输入文件路径，未给出 --filename 时用于错误显示
     */
    ParseOptions toParseOptions(String inputPath) {
        ParseOptions.Builder builder = ParseOptions.builder()
                .name(name)
                .filename(filename != null ? filename : inputPath);
        if (pythonVersion != null) {
            builder.targetVersion(parseVersion(pythonVersion));
        }
        if (platform != null) {
            builder.targetPlatform(platform);
        }
        return builder.build();
    }

    /**
     * "3.6" → [3, 6]
     */
    List<Integer> parseVersion(String text) {
        List<Integer> version = new ArrayList<Integer>();
        for (String part : text.split("\\.", -1)) {
            try {
                version.add(Integer.valueOf(part));
            } catch (NumberFormatException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "无效的 --python-version: '" + text + "'", e);
            }
        }
        return version;
    }
}
