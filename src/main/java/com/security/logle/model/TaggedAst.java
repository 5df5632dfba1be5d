package com.security.logle.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 带标签的值：节点/边的标签
 *
 * tag 指向所属图 schema 中的一个条目。由于 Set 值在构造时已规范化，
 * (tag, value) 的 equals/hashCode 即是去重索引所需的规范化键。
 */
@Getter
@EqualsAndHashCode
public final class TaggedAst {
    private final String tag;
    private final Value value;

    public TaggedAst(String tag, Value value) {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        this.tag = tag;
        this.value = value;
    }

    public static TaggedAst of(String tag, Value value) {
        return new TaggedAst(tag, value);
    }

    @Override
    public String toString() {
        return tag + ": " + value;
    }
}
