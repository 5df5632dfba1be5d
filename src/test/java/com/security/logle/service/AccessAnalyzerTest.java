package com.security.logle.service;

import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import com.security.logle.model.TaggedAst;
import com.security.logle.model.Value;
import com.security.logle.util.CsvRecordReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 邮箱访问分析测试
 */
public class AccessAnalyzerTest {

    private static AccessAnalyzer analyze(String csv) {
        AccessAnalyzer analyzer = new AccessAnalyzer();
        analyzer.initialize(new CsvRecordReader(new StringReader(csv), ','));
        return analyzer;
    }

    @Test
    @DisplayName("同一用户、账户、IP 去重为同一节点，访问边不去重")
    public void testBuildAccessGraph() {
        String csv = "user,account,access_type,timestamp,ip\n"
                + "alice,payroll,read,2016-01-01T10:00:00,10.0.0.1\n"
                + "alice,payroll,read,2016-01-01T11:00:00,10.0.0.1\n"
                + "bob,payroll,write,2016-01-02T09:00:00,\n";

        LabeledGraph graph = analyze(csv).getAccessGraph().getGraph();

        // alice, payroll, 10.0.0.1, bob
        assertEquals(4, graph.nodeCount());
        // 3 条 access + 2 条 location
        assertEquals(5, graph.edgeCount());

        Long alice = graph.findNode(TaggedAst.of("actor", Value.makeString("alice")));
        Long address = graph.findNode(TaggedAst.of("address", Value.makeString("10.0.0.1")));
        assertNotNull(alice);
        assertNotNull(address);
        assertEquals(2, graph.inEdges(address).size());
        assertFalse(graph.getEdge(graph.inEdges(address).get(0)).isDirected());
    }

    @Test
    @DisplayName("ip 列可以缺省")
    public void testWithoutIpColumn() {
        String csv = "user,account,access_type,timestamp\n"
                + "alice,payroll,read,t1\n";

        AccessAnalyzer analyzer = analyze(csv);

        String dot = analyzer.accessGraphAsDot();
        assertTrue(dot.contains("0 -> 1 [label=\"access: (read, t1)\"]"));
        assertEquals(2, analyzer.getAccessGraph().getGraph().nodeCount());
    }

    @Test
    @DisplayName("缺少必填字段时抛 INVALID_ARGUMENT 并带行号")
    public void testMissingField() {
        String csv = "user,account,access_type,timestamp\n"
                + "alice,payroll,read,t1\n"
                + "bob,,read,t2\n";

        LogleException e = assertThrows(LogleException.class, () -> analyze(csv));

        assertEquals(ErrorCode.INVALID_ARGUMENT, e.getCode());
        assertTrue(e.getMessage().contains("account"));
        assertTrue(e.getMessage().contains("2"));
    }

    @Test
    @DisplayName("未初始化时不能取图")
    public void testNotInitialized() {
        assertThrows(IllegalStateException.class, () -> new AccessAnalyzer().accessGraphAsDot());
    }
}
