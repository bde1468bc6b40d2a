package com.stubkit.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;

/**
 * stubkit CLI 入口点（picocli）
 */
@Command(name = "stubkit", version = "stubkit v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {FmtCommand.class, CheckCommand.class, DumpCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, scope = CommandLine.ScopeType.INHERIT,
            description = "输出解析细节日志")
    boolean verbose;

    @Override
    public void run() {
        // 未指定子命令时打印用法
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * 创建配置好的命令行：执行子命令前按 --verbose 安装日志
     */
    static CommandLine newCommandLine() {
        final Main main = new Main();
        CommandLine cmd = new CommandLine(main);
        cmd.setExecutionStrategy(parseResult -> {
            LogSetup.install(main.verbose || isVerbose(parseResult));
            return new CommandLine.RunLast().execute(parseResult);
        });
        return cmd;
    }

    private static boolean isVerbose(CommandLine.ParseResult parseResult) {
        CommandLine.ParseResult sub = parseResult;
        while (sub != null) {
            if (sub.hasMatchedOption("--verbose")) {
                return true;
            }
            sub = sub.subcommand();
        }
        return false;
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = newCommandLine();
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            // 回退到默认编码
            System.exit(newCommandLine().execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名（native.encoding 反映操作系统原生编码）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
