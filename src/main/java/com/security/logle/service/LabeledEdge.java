package com.security.logle.service;

import com.security.logle.model.TaggedAst;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 图的边（不可变）
 *
 * 表示一次日志事件，两个节点之间允许存在多条平行边
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class LabeledEdge {
    private final long id;
    private final long source;
    private final long target;
    private final TaggedAst label;
    private final boolean directed;
}
