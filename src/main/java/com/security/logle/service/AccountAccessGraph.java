package com.security.logle.service;

import com.security.logle.constants.LogleConstants.Mail;
import com.security.logle.model.TaggedAst;
import com.security.logle.model.Type;
import com.security.logle.model.Value;
import com.security.logle.util.DotPrinter;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 账户访问图
 *
 * 节点：actor（访问者）、account（被访问账户）、address（访问来源 IP）
 * 边：actor -> account 的 access 边，标签为 (访问类型, 时间戳)；
 *     actor 与 address 之间的 location 无向边
 */
public class AccountAccessGraph {

    private final LabeledGraph graph = new LabeledGraph();

    public void initialize() {
        Map<String, Type> nodeTypes = new LinkedHashMap<>();
        nodeTypes.put(Mail.TAG_ACTOR, Type.makeString("user"));
        nodeTypes.put(Mail.TAG_ACCOUNT, Type.makeString("account"));
        nodeTypes.put(Mail.TAG_ADDRESS, Type.makeString("ip"));

        Map<String, Type> edgeTypes = new LinkedHashMap<>();
        edgeTypes.put(Mail.TAG_ACCESS, Type.makeTuple("access", Arrays.<Type>asList(
                Type.makeString("access_type"),
                Type.makeString("timestamp"))));
        edgeTypes.put(Mail.TAG_LOCATION, Type.makeBool("location"));

        graph.initialize(nodeTypes, edgeTypes, null, null, null);
    }

    /**
     * 记录一次访问
     *
     * @param ip 可为空，为空时不建立 location 边
     */
    public void addAccess(String user, String account, String accessType, String timestamp, String ip) {
        long actorId = graph.findOrAddNode(TaggedAst.of(Mail.TAG_ACTOR, Value.makeString(user)));
        long accountId = graph.findOrAddNode(TaggedAst.of(Mail.TAG_ACCOUNT, Value.makeString(account)));
        graph.addEdge(TaggedAst.of(Mail.TAG_ACCESS, Value.makeTuple(
                Value.makeString(accessType), Value.makeString(timestamp))), actorId, accountId);

        if (ip != null && !ip.isEmpty()) {
            long addressId = graph.findOrAddNode(TaggedAst.of(Mail.TAG_ADDRESS, Value.makeString(ip)));
            graph.addEdge(TaggedAst.of(Mail.TAG_LOCATION, Value.makeBool(true)), actorId, addressId, false);
        }
    }

    public LabeledGraph getGraph() {
        return graph;
    }

    public String toDot() {
        return DotPrinter.dotGraph(graph);
    }
}
