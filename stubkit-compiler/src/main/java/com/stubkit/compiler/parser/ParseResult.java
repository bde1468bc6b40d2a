package com.stubkit.compiler.parser;

import com.stubkit.compiler.model.StubModule;

import java.util.Objects;

/**
 * 解析结果：成功时持有模块，失败时持有结构化错误（二者恰有其一）
 */
public final class ParseResult {
    private final StubModule module;
    private final ParseError error;

    private ParseResult(StubModule module, ParseError error) {
        this.module = module;
        this.error = error;
    }

    public static ParseResult success(StubModule module) {
        return new ParseResult(Objects.requireNonNull(module, "module"), null);
    }

    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return module != null;
    }

    /**
     * @throws IllegalStateException 解析失败时调用
     */
    public StubModule getModule() {
        if (module == null) {
            throw new IllegalStateException("Parse failed: " + error.getMessage());
        }
        return module;
    }

    /**
     * @throws IllegalStateException 解析成功时调用
     */
    public ParseError getError() {
        if (error == null) {
            throw new IllegalStateException("Parse succeeded, no error available");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[module=" + module.getName() + "]" : "ParseResult[error=" + error.getMessage() + "]";
    }
}
