package com.security.logle.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.security.logle.constants.LogleConstants.Curio;
import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import com.security.logle.util.FullJsonReader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Curio 进程依赖分析器
 *
 * 输入为 JSON 对象，dependencies 数组中每项形如
 * {"source": {"name": ..., "pid": ...}, "target": {...}, "type": ...}
 */
@Slf4j
public class CurioAnalyzer {

    private DependencyGraph dependencyGraph;

    public void initialize(FullJsonReader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        try (FullJsonReader input = reader) {
            initialize(input.document());
        } catch (IOException e) {
            throw new LogleException(ErrorCode.EXTERNAL, "Error closing JSON input: " + e.getMessage(), e);
        }
    }

    public void initialize(JsonNode document) {
        JsonNode dependencies = document == null ? null : document.get(Curio.FIELD_DEPENDENCIES);
        if (dependencies == null || !dependencies.isArray()) {
            throw new LogleException(ErrorCode.INVALID_ARGUMENT,
                    "Curio input has no '" + Curio.FIELD_DEPENDENCIES + "' array.");
        }

        DependencyGraph graph = new DependencyGraph();
        graph.initialize();
        int index = 0;
        for (JsonNode entry : dependencies) {
            long source = addProcess(graph, entry.get(Curio.FIELD_SOURCE), index, Curio.FIELD_SOURCE);
            long target = addProcess(graph, entry.get(Curio.FIELD_TARGET), index, Curio.FIELD_TARGET);
            graph.addDependency(source, target, requireText(entry, Curio.FIELD_TYPE, index));
            index++;
        }

        this.dependencyGraph = graph;
        log.info("【依赖分析】建图完成: 依赖数={}, 进程数={}",
                index, graph.getGraph().nodeCount());
    }

    public DependencyGraph getDependencyGraph() {
        requireInitialized();
        return dependencyGraph;
    }

    public String dependencyGraphAsDot() {
        requireInitialized();
        return dependencyGraph.toDot();
    }

    private void requireInitialized() {
        if (dependencyGraph == null) {
            throw new IllegalStateException("CurioAnalyzer is not initialized");
        }
    }

    private static long addProcess(DependencyGraph graph, JsonNode process, int index, String role) {
        if (process == null || !process.isObject()) {
            throw malformed(index, "'" + role + "' is not an object");
        }
        JsonNode pid = process.get(Curio.FIELD_PID);
        if (pid == null || !pid.isIntegralNumber() || !pid.canConvertToLong()) {
            throw malformed(index, "'" + role + "." + Curio.FIELD_PID + "' is not a 64-bit integer");
        }
        return graph.addProcess(requireText(process, Curio.FIELD_NAME, index), pid.asLong());
    }

    private static String requireText(JsonNode node, String field, int index) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isTextual()) {
            throw malformed(index, "'" + field + "' is not a string");
        }
        return value.asText();
    }

    private static LogleException malformed(int index, String reason) {
        return new LogleException(ErrorCode.INVALID_ARGUMENT,
                "Malformed dependency entry " + index + ": " + reason);
    }
}
