package com.security.logle.service;

import com.security.logle.model.TaggedAst;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 图节点（不可变）：id + 标签
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class LabeledNode {
    private final long id;
    private final TaggedAst label;
}
