package com.security.logle.util;

import lombok.extern.slf4j.Slf4j;

/**
 * 内部不变量检查
 *
 * 检查失败时调用当前 {@link FatalHandler}。默认处理器记录 ERROR 日志后以 134 退出进程；
 * 测试可替换为只记录的处理器。处理器返回后抛出 IllegalStateException，
 * 保证不会越过被破坏的不变量继续执行。
 */
@Slf4j
public final class Check {

    public static final int FATAL_EXIT_CODE = 134;

    private static final FatalHandler DEFAULT_HANDLER = (location, message) -> {
        log.error("【致命错误】{}: {}", location, message);
        System.exit(FATAL_EXIT_CODE);
    };

    private static volatile FatalHandler handler = DEFAULT_HANDLER;

    private Check() {
    }

    public static void check(boolean condition, String message) {
        if (!condition) {
            fail(message);
        }
    }

    public static void fail(String message) {
        String location = callerLocation();
        handler.onFatal(location, message);
        throw new IllegalStateException(location + ": " + message);
    }

    /**
     * 替换处理器，传 null 恢复默认
     */
    public static void setFatalHandler(FatalHandler fatalHandler) {
        handler = fatalHandler != null ? fatalHandler : DEFAULT_HANDLER;
    }

    public static FatalHandler getFatalHandler() {
        return handler;
    }

    private static String callerLocation() {
        StackTraceElement[] stack = Thread.currentThread().getStackTrace();
        for (int i = 1; i < stack.length; i++) {
            if (!stack[i].getClassName().equals(Check.class.getName())
                    && !stack[i].getClassName().equals(Thread.class.getName())) {
                return stack[i].getClassName() + ":" + stack[i].getLineNumber();
            }
        }
        return "unknown";
    }
}
