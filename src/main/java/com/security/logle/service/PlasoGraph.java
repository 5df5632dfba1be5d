package com.security.logle.service;

import com.security.logle.constants.LogleConstants.Plaso;
import com.security.logle.model.TaggedAst;
import com.security.logle.model.Type;
import com.security.logle.model.Value;
import com.security.logle.util.DotPrinter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plaso 事件图
 *
 * 节点：event (时间戳, 数据类型)、file（文件路径）、source（解析器集合）
 * 边：event -> file 的 event_file 边，标签为文件角色；event -> source 的 event_source 边
 */
public class PlasoGraph {

    private final LabeledGraph graph = new LabeledGraph();

    public void initialize() {
        Map<String, Type> nodeTypes = new LinkedHashMap<>();
        nodeTypes.put(Plaso.TAG_EVENT, Type.makeTuple("event", Arrays.<Type>asList(
                Type.makeInt("timestamp", true),
                Type.makeString("data_type"))));
        nodeTypes.put(Plaso.TAG_FILE, Type.makeString("path"));
        nodeTypes.put(Plaso.TAG_SOURCE, Type.makeSet("parsers", Type.makeString("parser")));

        Map<String, Type> edgeTypes = new LinkedHashMap<>();
        edgeTypes.put(Plaso.TAG_EVENT_FILE, Type.makeString("role"));
        edgeTypes.put(Plaso.TAG_EVENT_SOURCE, Type.makeBool("source"));

        graph.initialize(nodeTypes, edgeTypes, null, null, null);
    }

    public long addEvent(long timestamp, String dataType) {
        return graph.findOrAddNode(TaggedAst.of(Plaso.TAG_EVENT,
                Value.makeTuple(Value.makeInt(timestamp), Value.makeString(dataType))));
    }

    /**
     * 关联事件与文件
     *
     * @param role 文件在事件中的角色（display_name / filename）
     */
    public long linkFile(long eventId, String path, String role) {
        long fileId = graph.findOrAddNode(TaggedAst.of(Plaso.TAG_FILE, Value.makeString(path)));
        return graph.addEdge(TaggedAst.of(Plaso.TAG_EVENT_FILE, Value.makeString(role)), eventId, fileId);
    }

    /**
     * 关联事件与解析器集合，集合顺序无关
     */
    public long linkSources(long eventId, Collection<String> parsers) {
        List<Value> elements = new ArrayList<>();
        for (String parser : parsers) {
            elements.add(Value.makeString(parser));
        }
        long sourceId = graph.findOrAddNode(TaggedAst.of(Plaso.TAG_SOURCE, Value.makeSet(elements)));
        return graph.addEdge(TaggedAst.of(Plaso.TAG_EVENT_SOURCE, Value.makeBool(true)), eventId, sourceId);
    }

    public LabeledGraph getGraph() {
        return graph;
    }

    public String toDot() {
        return DotPrinter.dotGraph(graph);
    }
}
