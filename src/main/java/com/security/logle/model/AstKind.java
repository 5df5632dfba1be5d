package com.security.logle.model;

/**
 * 表达式种类枚举
 *
 * 类型表达式与值表达式共用同一组种类，声明顺序即规范排序中的种类顺序
 */
public enum AstKind {
    INT,      // 整数
    BOOL,     // 布尔
    STRING,   // 字符串
    POINTER,  // 指向某个节点标签的引用
    TUPLE,    // 有序元组
    SET       // 无序集合
}
