package com.stubkit.cli;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * 为 com.stubkit 日志树安装唯一的 stderr 处理器
 */
final class LogSetup {
    static final String ROOT_LOGGER = "com.stubkit";

    // 持有强引用，避免 LogManager 回收已配置的 logger
    private static final Logger ROOT = Logger.getLogger(ROOT_LOGGER);

    private LogSetup() {
    }

    static void install(boolean verbose) {
        Level level = verbose ? Level.FINE : Level.INFO;
        for (Handler handler : ROOT.getHandlers()) {
            ROOT.removeHandler(handler);
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(level);
        ROOT.addHandler(handler);
        ROOT.setLevel(level);
        ROOT.setUseParentHandlers(false);
    }

    static Level currentLevel() {
        return ROOT.getLevel();
    }
}
