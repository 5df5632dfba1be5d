package com.security.logle.service;

import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import com.security.logle.model.TaggedAst;
import com.security.logle.model.Type;
import com.security.logle.model.Value;
import com.security.logle.util.TypeChecker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 带类型标签的有向图
 *
 * 采用邻接表表示，节点/边按创建顺序保存
 *
 * 核心规则：
 * 1. schema 只能初始化一次，之后不可变
 * 2. 节点/边插入前先做类型检查（标签必须登记，值必须符合类型）
 * 3. 节点按 (tag, 规范化值) 去重：结构相等的标签永远对应同一个节点
 * 4. 边不去重，重复调用产生平行边（对应重复的日志事件）
 * 5. id 严格递增、不复用；删除只能通过 {@link GraphTransformer} 生成新图完成
 *
 * 插入失败时不消耗 id，图状态不变。
 */
@Slf4j
public class LabeledGraph {

    // ========== 核心数据结构 ==========

    private GraphSchema schema = GraphSchema.EMPTY;
    private boolean initialized;

    /** 节点存储：nodeId -> node（创建顺序） */
    private final Map<Long, LabeledNode> nodes = new LinkedHashMap<>();

    /** 边存储：edgeId -> edge（创建顺序） */
    private final Map<Long, LabeledEdge> edges = new LinkedHashMap<>();

    /** 出边：nodeId -> [edgeId, ...] */
    private final Map<Long, List<Long>> outEdges = new HashMap<>();

    /** 入边：nodeId -> [edgeId, ...] */
    private final Map<Long, List<Long>> inEdges = new HashMap<>();

    /** 去重索引：(tag, 规范化值) -> nodeId */
    private final Map<TaggedAst, Long> nodeIndex = new HashMap<>();

    private Value graphLabel;
    private long nextNodeId;
    private long nextEdgeId;

    // ========== 初始化 ==========

    /**
     * 设置 schema，只能调用一次
     */
    public void initialize(Map<String, Type> nodeTypes,
                           Map<String, Type> edgeTypes,
                           Type nodeLabelType,
                           Type edgeLabelType,
                           Type graphLabelType) {
        initialize(new GraphSchema(nodeTypes, edgeTypes, nodeLabelType, edgeLabelType, graphLabelType));
    }

    public void initialize(GraphSchema graphSchema) {
        if (initialized) {
            throw new LogleException(ErrorCode.ALREADY_INITIALIZED, "Graph is already initialized.");
        }
        if (graphSchema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        this.schema = graphSchema;
        this.initialized = true;
        log.debug("【建图】schema 初始化完成: 节点标签={}, 边标签={}",
                graphSchema.getNodeTypes().keySet(), graphSchema.getEdgeTypes().keySet());
    }

    // ========== 插入 ==========

    /**
     * 查找或添加节点
     *
     * @return 已存在时返回原节点 id，否则返回新分配的 id
     */
    public long findOrAddNode(TaggedAst label) {
        checkLabel(label, schema.getNodeTypes(), "node");

        Long existing = nodeIndex.get(label);
        if (existing != null) {
            return existing;
        }

        long nodeId = nextNodeId++;
        putNode(new LabeledNode(nodeId, label));
        log.debug("【建图】新增节点: id={}, label={}", nodeId, label);
        return nodeId;
    }

    /**
     * 只读的去重查找
     *
     * @return 节点 id，不存在时返回 null
     */
    public Long findNode(TaggedAst label) {
        return label == null ? null : nodeIndex.get(label);
    }

    /**
     * 添加有向边
     */
    public long addEdge(TaggedAst label, long source, long target) {
        return addEdge(label, source, target, true);
    }

    /**
     * 添加边（不去重）
     */
    public long addEdge(TaggedAst label, long source, long target, boolean directed) {
        requireNode(source);
        requireNode(target);
        checkLabel(label, schema.getEdgeTypes(), "edge");

        long edgeId = nextEdgeId++;
        putEdge(new LabeledEdge(edgeId, source, target, label, directed));
        log.debug("【建图】新增边: id={}, {} -> {}, label={}", edgeId, source, target, label);
        return edgeId;
    }

    /**
     * 设置整图标签
     */
    public void setGraphLabel(Value label) {
        Type graphLabelType = schema.getGraphLabelType();
        if (graphLabelType == null) {
            throw new LogleException(ErrorCode.TYPE_MISMATCH, "No graph label type is declared.");
        }
        if (!TypeChecker.typeCheck(graphLabelType, label, schema.getNodeTypes()::get)) {
            throw new LogleException(ErrorCode.TYPE_MISMATCH,
                    "Graph label does not match the graph label type: " + label);
        }
        this.graphLabel = label;
    }

    // ========== 查询 ==========

    /**
     * 所有节点（创建顺序，只读视图，可重复遍历）
     */
    public Collection<LabeledNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * 所有边（创建顺序，只读视图，可重复遍历）
     */
    public Collection<LabeledEdge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public LabeledNode getNode(long nodeId) {
        return requireNode(nodeId);
    }

    public LabeledEdge getEdge(long edgeId) {
        LabeledEdge edge = edges.get(edgeId);
        if (edge == null) {
            throw new LogleException(ErrorCode.EDGE_NOT_FOUND, "Edge not found: " + edgeId);
        }
        return edge;
    }

    public boolean hasNode(long nodeId) {
        return nodes.containsKey(nodeId);
    }

    /**
     * 出边 id 列表（创建顺序）
     */
    public List<Long> outEdges(long nodeId) {
        requireNode(nodeId);
        return Collections.unmodifiableList(outEdges.get(nodeId));
    }

    /**
     * 入边 id 列表（创建顺序）
     */
    public List<Long> inEdges(long nodeId) {
        requireNode(nodeId);
        return Collections.unmodifiableList(inEdges.get(nodeId));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isInitialized() {
        return initialized;
    }

    public GraphSchema getSchema() {
        return schema;
    }

    public Value getGraphLabel() {
        return graphLabel;
    }

    /**
     * 结构相等：schema、整图标签、节点（id+标签）、边均相同且顺序一致
     */
    public boolean hasSameStructure(LabeledGraph other) {
        if (other == null) {
            return false;
        }
        if (this == other) {
            return true;
        }
        return schema.equals(other.schema)
                && Objects.equals(graphLabel, other.graphLabel)
                && new ArrayList<>(nodes.values()).equals(new ArrayList<>(other.nodes.values()))
                && new ArrayList<>(edges.values()).equals(new ArrayList<>(other.edges.values()));
    }

    // ========== 图变换使用的复制操作（保留原 id） ==========

    /**
     * 创建与 source 同 schema、同整图标签、同 id 计数器的空图
     */
    static LabeledGraph emptyCopyOf(LabeledGraph source) {
        LabeledGraph copy = new LabeledGraph();
        copy.schema = source.schema;
        copy.initialized = source.initialized;
        copy.graphLabel = source.graphLabel;
        copy.nextNodeId = source.nextNodeId;
        copy.nextEdgeId = source.nextEdgeId;
        return copy;
    }

    /**
     * 复制节点，节点已通过源图的类型检查
     */
    void copyNode(LabeledNode node) {
        putNode(node);
    }

    /**
     * 复制边，两个端点必须已复制
     */
    void copyEdge(LabeledEdge edge) {
        requireNode(edge.getSource());
        requireNode(edge.getTarget());
        putEdge(edge);
    }

    // ========== 内部方法 ==========

    private void putNode(LabeledNode node) {
        nodes.put(node.getId(), node);
        nodeIndex.put(node.getLabel(), node.getId());
        outEdges.put(node.getId(), new ArrayList<>());
        inEdges.put(node.getId(), new ArrayList<>());
    }

    private void putEdge(LabeledEdge edge) {
        edges.put(edge.getId(), edge);
        outEdges.get(edge.getSource()).add(edge.getId());
        inEdges.get(edge.getTarget()).add(edge.getId());
    }

    private LabeledNode requireNode(long nodeId) {
        LabeledNode node = nodes.get(nodeId);
        if (node == null) {
            throw new LogleException(ErrorCode.NODE_NOT_FOUND, "Node not found: " + nodeId);
        }
        return node;
    }

    private void checkLabel(TaggedAst label, Map<String, Type> types, String what) {
        if (label == null) {
            throw new IllegalArgumentException(what + " label cannot be null");
        }
        Type type = types.get(label.getTag());
        if (type == null) {
            throw new LogleException(ErrorCode.UNKNOWN_TAG,
                    "Unknown " + what + " tag: " + label.getTag());
        }
        if (!TypeChecker.typeCheck(type, label.getValue(), schema.getNodeTypes()::get)) {
            throw new LogleException(ErrorCode.TYPE_MISMATCH,
                    "Value of " + what + " tag '" + label.getTag() + "' does not match type "
                            + type + ": " + label.getValue());
        }
    }
}
