package com.security.logle.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.security.logle.model.TaggedAst;
import com.security.logle.model.Type;
import com.security.logle.model.Value;
import com.security.logle.service.LabeledGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GraphExplorer 导出测试
 */
public class GraphExplorerPrinterTest {

    private static LabeledGraph sampleGraph() {
        LabeledGraph graph = new LabeledGraph();
        graph.initialize(Collections.<String, Type>singletonMap("actor", Type.makeString("user")),
                Collections.<String, Type>singletonMap("knows", Type.makeBool("knows")),
                null, null, null);
        long alice = graph.findOrAddNode(TaggedAst.of("actor", Value.makeString("alice")));
        long bob = graph.findOrAddNode(TaggedAst.of("actor", Value.makeString("bob")));
        graph.addEdge(TaggedAst.of("knows", Value.makeBool(true)), alice, bob);
        graph.addEdge(TaggedAst.of("knows", Value.makeBool(false)), alice, bob, false);
        return graph;
    }

    @Test
    @DisplayName("节点带 op/label 属性，入边以源节点为 input")
    public void testGraphDef() {
        GraphExplorerPrinter.GraphDef def = GraphExplorerPrinter.graphDef(sampleGraph());

        assertEquals(2, def.getNode().size());
        GraphExplorerPrinter.Node alice = def.getNode().get(0);
        assertEquals("0", alice.getName());
        assertEquals("actor", alice.getNodeAttr().get("op"));
        assertEquals("actor: alice", alice.getNodeAttr().get("label"));
        assertTrue(alice.getEdge().isEmpty());

        GraphExplorerPrinter.Node bob = def.getNode().get(1);
        assertEquals(2, bob.getEdge().size());
        assertEquals("0", bob.getEdge().get(0).getInput());
        assertEquals("true", bob.getEdge().get(0).getEdgeAttr().get("isDirected"));
        assertFalse(bob.getEdge().get(1).getEdgeAttr().containsKey("isDirected"));
        assertEquals("knows: false", bob.getEdge().get(1).getEdgeAttr().get("label"));
    }

    @Test
    @DisplayName("JSON 字段名为 node_attr / edge_attr")
    public void testJson() throws Exception {
        JsonNode json = new ObjectMapper().readTree(GraphExplorerPrinter.toJson(sampleGraph()));

        JsonNode nodes = json.get("node");
        assertEquals(2, nodes.size());
        assertEquals("actor", nodes.get(1).get("node_attr").get("op").asText());
        assertEquals("0", nodes.get(1).get("edge").get(0).get("input").asText());
        assertTrue(nodes.get(1).get("edge").get(0).has("edge_attr"));
    }

    @Test
    @DisplayName("空图输出空节点列表")
    public void testEmpty() throws Exception {
        JsonNode json = new ObjectMapper().readTree(GraphExplorerPrinter.toJson(new LabeledGraph()));

        assertEquals(0, json.get("node").size());
    }
}
