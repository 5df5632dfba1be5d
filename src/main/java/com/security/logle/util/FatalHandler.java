package com.security.logle.util;

/**
 * 致命错误处理钩子
 *
 * 只在内部不变量被破坏（程序错误）时调用，用户输入永远不应触发
 */
public interface FatalHandler {

    /**
     * @param location 出错位置
     * @param message  说明
     */
    void onFatal(String location, String message);
}
