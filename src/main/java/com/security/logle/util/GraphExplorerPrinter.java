package com.security.logle.util;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import com.security.logle.service.LabeledEdge;
import com.security.logle.service.LabeledGraph;
import com.security.logle.service.LabeledNode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * GraphExplorer 导出
 *
 * GraphExplorer 用邻接表表示图：每个节点列出指向自己的入边（input 为源节点）。
 * 节点属性：op = 标签名，label = 扁平化标签；边属性：label，有向边附加 isDirected。
 * 输出为缩进的 JSON，节点按创建顺序，入边按边的创建顺序。
 */
public final class GraphExplorerPrinter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private GraphExplorerPrinter() {
    }

    public static GraphDef graphDef(LabeledGraph graph) {
        GraphDef graphDef = new GraphDef();
        for (LabeledNode node : graph.nodes()) {
            Node explorerNode = new Node(Long.toString(node.getId()));
            explorerNode.getNodeAttr().put("op", node.getLabel().getTag());
            explorerNode.getNodeAttr().put("label", node.getLabel().toString());

            for (Long edgeId : graph.inEdges(node.getId())) {
                LabeledEdge edge = graph.getEdge(edgeId);
                Edge explorerEdge = new Edge(Long.toString(edge.getSource()));
                explorerEdge.getEdgeAttr().put("label", edge.getLabel().toString());
                if (edge.isDirected()) {
                    explorerEdge.getEdgeAttr().put("isDirected", "true");
                }
                explorerNode.getEdge().add(explorerEdge);
            }
            graphDef.getNode().add(explorerNode);
        }
        return graphDef;
    }

    public static String toJson(LabeledGraph graph) {
        try {
            return MAPPER.writeValueAsString(graphDef(graph));
        } catch (JsonProcessingException e) {
            throw new LogleException(ErrorCode.INTERNAL,
                    "Error serializing graph: " + e.getOriginalMessage(), e);
        }
    }

    @Getter
    public static class GraphDef {
        private final List<Node> node = new ArrayList<>();
    }

    @Getter
    public static class Node {
        private final String name;

        @JsonProperty("node_attr")
        private final Map<String, String> nodeAttr = new TreeMap<>();

        private final List<Edge> edge = new ArrayList<>();

        Node(String name) {
            this.name = name;
        }
    }

    @Getter
    public static class Edge {
        private final String input;

        @JsonProperty("edge_attr")
        private final Map<String, String> edgeAttr = new TreeMap<>();

        Edge(String input) {
            this.input = input;
        }
    }
}
