package com.security.logle.exception;

/**
 * 错误码
 */
public enum ErrorCode {
    OK,                    // 成功
    INVALID_ARGUMENT,      // 参数非法（缺少输入文件、未知分析器等）
    EXTERNAL,              // 外部文件打开/关闭失败
    INTERNAL,              // 写出结果时的意外失败
    UNKNOWN_TAG,           // 标签不在 schema 中
    TYPE_MISMATCH,         // 值与标签登记的类型不符
    NODE_NOT_FOUND,        // 节点不存在
    EDGE_NOT_FOUND,        // 边不存在
    ALREADY_INITIALIZED    // 图已初始化
}
