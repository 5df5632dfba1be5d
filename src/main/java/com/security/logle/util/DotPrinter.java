package com.security.logle.util;

import com.security.logle.model.TaggedAst;
import com.security.logle.service.LabeledEdge;
import com.security.logle.service.LabeledGraph;
import com.security.logle.service.LabeledNode;

/**
 * GraphViz DOT 导出
 *
 * 输出格式：
 * <pre>
 * digraph {
 *   label="整图标签";          // 可选
 *   0 [label="tag: value"];
 *   0 -> 1 [label="tag: value"];
 * }
 * </pre>
 * 节点、边均按创建顺序输出，结果确定；只用于展示，不支持反向解析。
 */
public final class DotPrinter {

    private DotPrinter() {
    }

    public static String dotGraph(LabeledGraph graph) {
        StringBuilder sb = new StringBuilder("digraph {\n");
        if (graph.getGraphLabel() != null) {
            sb.append("  label=\"").append(escape(graph.getGraphLabel().toString())).append("\";\n");
        }
        for (LabeledNode node : graph.nodes()) {
            sb.append("  ").append(node.getId())
              .append(" [label=\"").append(labelText(node.getLabel())).append("\"];\n");
        }
        for (LabeledEdge edge : graph.edges()) {
            sb.append("  ").append(edge.getSource()).append(" -> ").append(edge.getTarget())
              .append(" [label=\"").append(labelText(edge.getLabel())).append('"');
            if (!edge.isDirected()) {
                sb.append(", dir=none");
            }
            sb.append("];\n");
        }
        return sb.append("}\n").toString();
    }

    /**
     * 标签的扁平化文本（已转义）
     */
    static String labelText(TaggedAst label) {
        return escape(label.getTag() + ": " + label.getValue());
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
