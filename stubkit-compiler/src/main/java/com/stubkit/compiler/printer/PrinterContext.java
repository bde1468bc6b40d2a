package com.stubkit.compiler.printer;

import java.util.Set;
import java.util.TreeSet;

/**
 * 打印上下文：当前条目的输出缓冲、缩进层级，以及整个模块需要的导入
 */
public class PrinterContext {
    private final StringBuilder output = new StringBuilder();
    private final PrintConfig config;
    private final String moduleName;
    private final Set<String> moduleImports = new TreeSet<String>();
    private final Set<String> typingImports = new TreeSet<String>();
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public PrinterContext(PrintConfig config, String moduleName) {
        this.config = config;
        this.moduleName = moduleName;
    }

    public PrintConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        }
        output.append(text);
    }

    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 取出当前条目的文本并清空缓冲
     */
    public String drain() {
        String text = output.toString();
        output.setLength(0);
        atLineStart = true;
        return text;
    }

    /**
     * 记录 import 模块（本模块自身除外）
     */
    public void requireModule(String module) {
        if (!module.equals(moduleName)) {
            moduleImports.add(module);
        }
    }

    /**
     * 记录 from typing import 的名称
     */
    public void requireTyping(String name) {
        typingImports.add(name);
    }

    public Set<String> getModuleImports() {
        return moduleImports;
    }

    public Set<String> getTypingImports() {
        return typingImports;
    }

    private String indentString() {
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }
}
