package com.security.logle.service;

import com.security.logle.model.Type;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 图的 schema（不可变）
 *
 * 节点标签 -> 类型、边标签 -> 类型，以及可选的图级节点/边/整图标签类型。
 * 图级类型为 null 表示未声明。
 *
 * 只有 graphLabelType 会被强制检查（见 {@link LabeledGraph#setGraphLabel}）。
 * nodeLabelType / edgeLabelType 仅作说明用：随 schema 保存、参与判等、随图变换复制，
 * 但不约束任何插入操作，节点/边标签的类型由 nodeTypes / edgeTypes 按标签决定。
 */
@Getter
@EqualsAndHashCode
public final class GraphSchema {

    public static final GraphSchema EMPTY = new GraphSchema(
            Collections.emptyMap(), Collections.emptyMap(), null, null, null);

    private final Map<String, Type> nodeTypes;
    private final Map<String, Type> edgeTypes;
    /** 说明性，不参与类型检查 */
    private final Type nodeLabelType;
    /** 说明性，不参与类型检查 */
    private final Type edgeLabelType;
    private final Type graphLabelType;

    public GraphSchema(Map<String, Type> nodeTypes,
                       Map<String, Type> edgeTypes,
                       Type nodeLabelType,
                       Type edgeLabelType,
                       Type graphLabelType) {
        this.nodeTypes = copyOf(nodeTypes, "nodeTypes");
        this.edgeTypes = copyOf(edgeTypes, "edgeTypes");
        this.nodeLabelType = nodeLabelType;
        this.edgeLabelType = edgeLabelType;
        this.graphLabelType = graphLabelType;
    }

    public Type getNodeType(String tag) {
        return nodeTypes.get(tag);
    }

    public Type getEdgeType(String tag) {
        return edgeTypes.get(tag);
    }

    private static Map<String, Type> copyOf(Map<String, Type> types, String what) {
        if (types == null) {
            return Collections.emptyMap();
        }
        Map<String, Type> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Type> entry : types.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException(what + " cannot contain null tags or types");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }
}
