package com.security.logle.service;

import com.security.logle.constants.LogleConstants.Curio;
import com.security.logle.model.TaggedAst;
import com.security.logle.model.Type;
import com.security.logle.model.Value;
import com.security.logle.util.DotPrinter;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 进程依赖图
 *
 * 节点：process，标签为 (进程名, pid)
 * 边：source -> target 的 dependency 边，标签为依赖类型
 */
public class DependencyGraph {

    private final LabeledGraph graph = new LabeledGraph();

    public void initialize() {
        Map<String, Type> nodeTypes = new LinkedHashMap<>();
        nodeTypes.put(Curio.TAG_PROCESS, Type.makeTuple("process", Arrays.<Type>asList(
                Type.makeString("name"),
                Type.makeInt("pid", true))));

        Map<String, Type> edgeTypes = new LinkedHashMap<>();
        edgeTypes.put(Curio.TAG_DEPENDENCY, Type.makeString("type"));

        graph.initialize(nodeTypes, edgeTypes, null, null, null);
    }

    public long addProcess(String name, long pid) {
        return graph.findOrAddNode(TaggedAst.of(Curio.TAG_PROCESS,
                Value.makeTuple(Value.makeString(name), Value.makeInt(pid))));
    }

    public long addDependency(long source, long target, String type) {
        return graph.addEdge(TaggedAst.of(Curio.TAG_DEPENDENCY, Value.makeString(type)), source, target);
    }

    public LabeledGraph getGraph() {
        return graph;
    }

    public String toDot() {
        return DotPrinter.dotGraph(graph);
    }
}
