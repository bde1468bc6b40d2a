package com.stubkit.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli check 子命令：检查一个或多个存根文件能否解析
 */
@Command(name = "check", description = "检查存根文件能否解析")
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    ParseOptionsMixin parseOptions;

    @Parameters(arity = "1..*", description = "存根文件路径")
    List<String> files;

    @Override
    public Integer call() {
        StubRunner runner = new StubRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        int exitCode = StubRunner.EXIT_OK;
        // 全部检查完再返回，一次报告所有失败的文件
        for (String file : files) {
            if (runner.check(file, parseOptions.toParseOptions(file)) != StubRunner.EXIT_OK) {
                exitCode = StubRunner.EXIT_FAILURE;
            }
        }
        return exitCode;
    }
}
