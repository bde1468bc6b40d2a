package com.stubkit.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli dump 子命令：以 JSON 输出解析后的模块
 */
@Command(name = "dump", description = "以 JSON 输出解析后的模块")
public class DumpCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    ParseOptionsMixin parseOptions;

    @Parameters(index = "0", description = "存根文件路径")
    String file;

    @Option(names = "--pretty", description = "缩进输出")
    boolean pretty;

    @Override
    public Integer call() {
        StubRunner runner = new StubRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        return runner.dump(file, parseOptions.toParseOptions(file), pretty);
    }
}
