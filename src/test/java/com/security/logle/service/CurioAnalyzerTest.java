package com.security.logle.service;

import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import com.security.logle.model.TaggedAst;
import com.security.logle.model.Value;
import com.security.logle.util.FullJsonReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 进程依赖分析测试
 */
public class CurioAnalyzerTest {

    private static CurioAnalyzer analyze(String json) {
        CurioAnalyzer analyzer = new CurioAnalyzer();
        analyzer.initialize(new FullJsonReader(new StringReader(json), false));
        return analyzer;
    }

    @Test
    @DisplayName("按 (进程名, pid) 去重建依赖图")
    public void testBuildDependencyGraph() {
        String json = "{\"dependencies\": ["
                + "{\"source\": {\"name\": \"bash\", \"pid\": 10}, \"target\": {\"name\": \"curl\", \"pid\": 11}, \"type\": \"fork\"},"
                + "{\"source\": {\"name\": \"bash\", \"pid\": 10}, \"target\": {\"name\": \"ls\", \"pid\": 12}, \"type\": \"fork\"},"
                + "{\"source\": {\"name\": \"curl\", \"pid\": 11}, \"target\": {\"name\": \"bash\", \"pid\": 10}, \"type\": \"pipe\"}"
                + "]}";

        CurioAnalyzer analyzer = analyze(json);
        LabeledGraph graph = analyzer.getDependencyGraph().getGraph();

        assertEquals(3, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        Long bash = graph.findNode(TaggedAst.of("process",
                Value.makeTuple(Value.makeString("bash"), Value.makeInt(10))));
        assertEquals(Long.valueOf(0), bash);
        assertEquals(2, graph.outEdges(bash).size());
        assertTrue(analyzer.dependencyGraphAsDot().contains("  1 -> 0 [label=\"dependency: pipe\"];"));
    }

    @Test
    @DisplayName("没有 dependencies 数组时抛 INVALID_ARGUMENT")
    public void testMissingDependencies() {
        LogleException e = assertThrows(LogleException.class, () -> analyze("{\"events\": []}"));

        assertEquals(ErrorCode.INVALID_ARGUMENT, e.getCode());
    }

    @Test
    @DisplayName("pid 不是整数时抛 INVALID_ARGUMENT")
    public void testMalformedEntry() {
        String json = "{\"dependencies\": [{\"source\": {\"name\": \"a\", \"pid\": \"x\"},"
                + " \"target\": {\"name\": \"b\", \"pid\": 2}, \"type\": \"fork\"}]}";

        LogleException e = assertThrows(LogleException.class, () -> analyze(json));

        assertEquals(ErrorCode.INVALID_ARGUMENT, e.getCode());
        assertTrue(e.getMessage().contains("source.pid"));
    }

    @Test
    @DisplayName("pid 超出 64 位整数范围时抛 INVALID_ARGUMENT，不截断")
    public void testPidOutOfRange() {
        String json = "{\"dependencies\": [{\"source\": {\"name\": \"a\", \"pid\": 1},"
                + " \"target\": {\"name\": \"b\", \"pid\": 99999999999999999999}, \"type\": \"fork\"}]}";

        LogleException e = assertThrows(LogleException.class, () -> analyze(json));

        assertEquals(ErrorCode.INVALID_ARGUMENT, e.getCode());
        assertTrue(e.getMessage().contains("target.pid"));
    }

    @Test
    @DisplayName("空依赖列表得到空图")
    public void testEmptyDependencies() {
        assertEquals("digraph {\n}\n", analyze("{\"dependencies\": []}").dependencyGraphAsDot());
    }
}
