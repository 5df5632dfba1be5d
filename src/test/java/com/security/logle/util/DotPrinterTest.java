package com.security.logle.util;

import com.security.logle.model.TaggedAst;
import com.security.logle.model.Type;
import com.security.logle.model.Value;
import com.security.logle.service.GraphTransformer;
import com.security.logle.service.LabeledGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DOT 导出测试
 */
public class DotPrinterTest {

    private static LabeledGraph numGraph() {
        Map<String, Type> nodeTypes = new LinkedHashMap<>();
        nodeTypes.put("num", Type.makeInt("num", true));
        nodeTypes.put("name", Type.makeString("name"));
        LabeledGraph graph = new LabeledGraph();
        graph.initialize(nodeTypes, Collections.<String, Type>singletonMap("next", Type.makeBool("next")),
                null, null, Type.makeString("title"));
        return graph;
    }

    @Test
    @DisplayName("空图输出没有任何语句")
    public void testEmptyGraph() {
        assertEquals("digraph {\n}\n", DotPrinter.dotGraph(numGraph()));
        assertEquals("digraph {\n}\n", DotPrinter.dotGraph(new LabeledGraph()));
    }

    @Test
    @DisplayName("节点、边按创建顺序输出，无向边带 dir=none")
    public void testNodesAndEdges() {
        LabeledGraph graph = numGraph();
        long a = graph.findOrAddNode(TaggedAst.of("num", Value.makeInt(0)));
        long b = graph.findOrAddNode(TaggedAst.of("num", Value.makeInt(1)));
        graph.addEdge(TaggedAst.of("next", Value.makeBool(true)), a, b);
        graph.addEdge(TaggedAst.of("next", Value.makeBool(false)), b, a, false);

        String expected = "digraph {\n"
                + "  0 [label=\"num: 0\"];\n"
                + "  1 [label=\"num: 1\"];\n"
                + "  0 -> 1 [label=\"next: true\"];\n"
                + "  1 -> 0 [label=\"next: false\", dir=none];\n"
                + "}\n";
        assertEquals(expected, DotPrinter.dotGraph(graph));
    }

    @Test
    @DisplayName("删除第一个节点后只剩 num: 1")
    public void testAfterDelete() {
        LabeledGraph graph = numGraph();
        long first = graph.findOrAddNode(TaggedAst.of("num", Value.makeInt(0)));
        graph.findOrAddNode(TaggedAst.of("num", Value.makeInt(1)));

        LabeledGraph result = GraphTransformer.deleteNodes(graph, Collections.singleton(first));

        assertEquals("digraph {\n  1 [label=\"num: 1\"];\n}\n", DotPrinter.dotGraph(result));
    }

    @Test
    @DisplayName("整图标签与转义")
    public void testGraphLabelAndEscaping() {
        LabeledGraph graph = numGraph();
        graph.setGraphLabel(Value.makeString("access log"));
        graph.findOrAddNode(TaggedAst.of("name", Value.makeString("say \"hi\" \\ bye")));

        String dot = DotPrinter.dotGraph(graph);

        assertTrue(dot.startsWith("digraph {\n  label=\"access log\";\n"));
        assertTrue(dot.contains("  0 [label=\"name: say \\\"hi\\\" \\\\ bye\"];\n"));
        assertEquals("a\\nb", DotPrinter.escape("a\nb"));
    }

    @Test
    @DisplayName("输出确定：重复导出结果一致")
    public void testDeterministic() {
        LabeledGraph graph = numGraph();
        graph.findOrAddNode(TaggedAst.of("num", Value.makeInt(3)));

        assertEquals(DotPrinter.dotGraph(graph), DotPrinter.dotGraph(graph));
    }
}
