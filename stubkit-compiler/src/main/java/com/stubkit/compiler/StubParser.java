package com.stubkit.compiler;

import com.stubkit.compiler.analysis.ClassNameCollector;
import com.stubkit.compiler.analysis.ModuleBuilder;
import com.stubkit.compiler.analysis.ParseContext;
import com.stubkit.compiler.ast.decl.StubFile;
import com.stubkit.compiler.lexer.Lexer;
import com.stubkit.compiler.model.StubModule;
import com.stubkit.compiler.parser.ParseException;
import com.stubkit.compiler.parser.ParseResult;
import com.stubkit.compiler.parser.Parser;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.logging.Logger;

/**
 * 存根解析入口：源码 → 词法 → 语法 → 类名登记 → 模块构建
 *
 * <p>无状态，可在多线程间共享；每次调用都分配独立的 {@link ParseContext}。</p>
 */
public final class StubParser {
    private static final Logger LOG = Logger.getLogger(StubParser.class.getName());

    private StubParser() {
    }

    /**
     * 解析源码，失败时返回带错误的结果而不抛出异常
     */
    public static ParseResult parse(String source, ParseOptions options) {
        try {
            return ParseResult.success(parseOrThrow(source, options));
        } catch (ParseException e) {
            LOG.fine("解析失败: " + e.getMessage());
            return ParseResult.failure(e.toParseError(options.getFilename(), sourceLine(source, e.getLine())));
        }
    }

    public static ParseResult parse(String source) {
        return parse(source, ParseOptions.defaults());
    }

    /**
     * 解析源码
     *
     * @throws ParseException 第一个语法或语义错误
     */
    public static StubModule parseOrThrow(String source, ParseOptions options) {
        String moduleName = options.getName() != null ? options.getName() : digest(source);
        ParseContext ctx = new ParseContext(moduleName, options.getName(), options.toTargetEnvironment());

        Lexer lexer = new Lexer(source, options.getFilename());
        Parser parser = new Parser(lexer, options.getFilename(), options.getMaxNestingDepth());
        StubFile file = parser.parse();

        new ClassNameCollector(ctx.getRegistry(), ctx.getEvaluator()).collect(file);
        StubModule module = new ModuleBuilder(ctx).build(file);
        LOG.fine("模块 " + moduleName + ": " + module.getClasses().size() + " 个类, "
                + module.getFunctions().size() + " 个函数, " + module.getConstants().size() + " 个常量");
        return module;
    }

    /**
     * 源码 UTF-8 字节的 MD5 十六进制摘要
     */
    static String digest(String source) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] hash = md5.digest(source.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b & 0xff));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * 取出第 line 行（从 1 开始）的原文；没有行号或越界时返回 null
     */
    private static String sourceLine(String source, Integer line) {
        if (line == null || line.intValue() < 1) {
            return null;
        }
        String[] lines = source.split("\r?\n", -1);
        return line.intValue() <= lines.length ? lines[line.intValue() - 1] : null;
    }
}
