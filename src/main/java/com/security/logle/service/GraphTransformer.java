package com.security.logle.service;

import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import com.security.logle.model.TaggedAst;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 图变换工具类
 *
 * 所有变换都是纯函数：读取输入图，生成一个新图，从不修改输入。
 * 输出图与输入图 schema 相同，保留节点/边的原 id（不重新编号），
 * 调用方可以用 id 交叉引用变换前后的两张图。
 *
 * 节点/边对象本身不可变，新图直接复用；节点表、边表、邻接表、去重索引均为新建。
 *
 * @author Security Team
 */
@Slf4j
public final class GraphTransformer {

    private GraphTransformer() {
    }

    /**
     * 删除节点
     *
     * 规则：
     * 1. targets 中每个 id 都必须存在，否则抛 NODE_NOT_FOUND，不生成任何结果
     * 2. 保留所有不在 targets 中的节点（原 id）
     * 3. 只保留两端都被保留的边，不做边收缩、不重连到祖先/后代
     *
     * deleteNodes(g, {}) 与 g 结构相等。
     *
     * @param graph   输入图（只读）
     * @param targets 要删除的节点 id
     * @return 新图
     */
    public static LabeledGraph deleteNodes(LabeledGraph graph, Set<Long> targets) {
        Objects.requireNonNull(graph, "graph");
        Set<Long> toDelete = requireExisting(graph, targets);

        LabeledGraph result = filter(graph, toDelete);
        log.info("【图变换】删除节点完成: 原节点数={}, 删除={}, 原边数={}, 保留边数={}",
                graph.nodeCount(), toDelete.size(), graph.edgeCount(), result.edgeCount());
        return result;
    }

    /**
     * 提取子图：只保留 kept 中的节点以及两端都在 kept 中的边
     *
     * 与 deleteNodes 互补，同样要求 kept 中每个 id 都存在
     */
    public static LabeledGraph keepNodes(LabeledGraph graph, Set<Long> kept) {
        Objects.requireNonNull(graph, "graph");
        Set<Long> toKeep = requireExisting(graph, kept);

        Set<Long> toDelete = new HashSet<>();
        for (LabeledNode node : graph.nodes()) {
            if (!toKeep.contains(node.getId())) {
                toDelete.add(node.getId());
            }
        }
        LabeledGraph result = filter(graph, toDelete);
        log.info("【图变换】提取子图完成: 原节点数={}, 保留={}, 保留边数={}",
                graph.nodeCount(), result.nodeCount(), result.edgeCount());
        return result;
    }

    /**
     * 合并平行边
     *
     * (source, target, label, directed) 相同的一组边只保留最早创建的一条，节点全部保留
     */
    public static LabeledGraph mergeParallelEdges(LabeledGraph graph) {
        Objects.requireNonNull(graph, "graph");

        LabeledGraph result = LabeledGraph.emptyCopyOf(graph);
        for (LabeledNode node : graph.nodes()) {
            result.copyNode(node);
        }

        Set<EdgeKey> seen = new HashSet<>();
        int merged = 0;
        for (LabeledEdge edge : graph.edges()) {
            if (seen.add(new EdgeKey(edge))) {
                result.copyEdge(edge);
            } else {
                merged++;
                log.debug("【图变换】合并平行边: id={}, {} -> {}", edge.getId(), edge.getSource(), edge.getTarget());
            }
        }
        log.info("【图变换】合并平行边完成: 原边数={}, 合并={}, 保留边数={}",
                graph.edgeCount(), merged, result.edgeCount());
        return result;
    }

    // ========== 内部方法 ==========

    private static Set<Long> requireExisting(LabeledGraph graph, Collection<Long> ids) {
        Set<Long> checked = new HashSet<>();
        if (ids == null) {
            return checked;
        }
        for (Long id : ids) {
            if (id == null || !graph.hasNode(id)) {
                throw new LogleException(ErrorCode.NODE_NOT_FOUND, "Node not found: " + id);
            }
            checked.add(id);
        }
        return checked;
    }

    /**
     * 复制节点/边，跳过 toDelete 中的节点以及与之相连的边
     */
    private static LabeledGraph filter(LabeledGraph graph, Set<Long> toDelete) {
        LabeledGraph result = LabeledGraph.emptyCopyOf(graph);
        for (LabeledNode node : graph.nodes()) {
            if (!toDelete.contains(node.getId())) {
                result.copyNode(node);
            }
        }
        for (LabeledEdge edge : graph.edges()) {
            if (!toDelete.contains(edge.getSource()) && !toDelete.contains(edge.getTarget())) {
                result.copyEdge(edge);
            }
        }
        return result;
    }

    /**
     * 平行边判等键
     */
    private static final class EdgeKey {
        private final long source;
        private final long target;
        private final TaggedAst label;
        private final boolean directed;

        EdgeKey(LabeledEdge edge) {
            this.source = edge.getSource();
            this.target = edge.getTarget();
            this.label = edge.getLabel();
            this.directed = edge.isDirected();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof EdgeKey)) {
                return false;
            }
            EdgeKey other = (EdgeKey) o;
            return source == other.source && target == other.target
                    && directed == other.directed && label.equals(other.label);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, target, label, directed);
        }
    }
}
