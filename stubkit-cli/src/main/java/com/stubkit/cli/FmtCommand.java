package com.stubkit.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli fmt 子命令：以规范格式输出存根文件
 */
@Command(name = "fmt", description = "以规范格式输出存根文件")
public class FmtCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    ParseOptionsMixin parseOptions;

    @Parameters(index = "0", description = "存根文件路径")
    String file;

    @Option(names = {"-w", "--write"}, description = "写回原文件而不是输出到标准输出")
    boolean write;

    @Override
    public Integer call() {
        StubRunner runner = new StubRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        return runner.format(file, parseOptions.toParseOptions(file), write);
    }
}
