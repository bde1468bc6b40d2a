package com.stubkit.cli;

import com.stubkit.compiler.ParseOptions;
import com.stubkit.compiler.StubParser;
import com.stubkit.compiler.parser.ParseResult;
import com.stubkit.compiler.printer.StubPrinter;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 子命令共用的执行逻辑：读取文件、解析、输出
 *
 * <p>返回值即进程退出码：0 成功，1 解析失败或文件无法读写。</p>
 */
class StubRunner {
    private static final Logger LOG = Logger.getLogger(StubRunner.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final PrintWriter out;
    private final PrintWriter err;

    StubRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 打印规范格式；write 为 true 时写回原文件
     */
    int format(String filePath, ParseOptions options, boolean write) {
        ParseResult result = parseFile(filePath, options);
        if (result == null) {
            return EXIT_FAILURE;
        }
        String formatted = withTrailingNewline(new StubPrinter().print(result.getModule()));
        if (!write) {
            out.print(formatted);
            out.flush();
            return EXIT_OK;
        }
        try {
            Files.write(Paths.get(filePath), formatted.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.log(Level.WARNING, "写入失败: " + filePath, e);
            err.println("错误: 无法写入文件 - " + filePath);
            return EXIT_FAILURE;
        }
        out.println("已格式化: " + filePath);
        return EXIT_OK;
    }

    /**
     * 只检查能否解析
     */
    int check(String filePath, ParseOptions options) {
        ParseResult result = parseFile(filePath, options);
        if (result == null) {
            return EXIT_FAILURE;
        }
        out.println("OK: " + filePath);
        return EXIT_OK;
    }

    /**
     * 以 JSON 输出解析后的模块
     */
    int dump(String filePath, ParseOptions options, boolean pretty) {
        ParseResult result = parseFile(filePath, options);
        if (result == null) {
            return EXIT_FAILURE;
        }
        out.println(new ModuleJson(pretty).toJson(result.getModule()));
        return EXIT_OK;
    }

    /**
     * 读取并解析；失败时已向 err 报告，返回 null
     */
    private ParseResult parseFile(String filePath, ParseOptions options) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return null;
        }
        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取失败: " + filePath, e);
            err.println("错误: 无法读取文件 - " + filePath);
            return null;
        }
        LOG.fine("解析 " + filePath + " (" + options.getTargetVersion() + ", " + options.getTargetPlatform() + ")");
        ParseResult result = StubParser.parse(source, options);
        if (!result.isSuccess()) {
            err.println(result.getError());
            return null;
        }
        return result;
    }

    private static String withTrailingNewline(String text) {
        return text.isEmpty() || text.endsWith("\n") ? text : text + "\n";
    }
}
