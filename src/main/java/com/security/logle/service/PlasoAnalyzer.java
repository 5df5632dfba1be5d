package com.security.logle.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.security.logle.constants.LogleConstants.Plaso;
import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import com.security.logle.util.JsonEventReader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Plaso 事件分析器
 *
 * 每个事件至少包含 timestamp、data_type、display_name。
 * showAllSources=false 时只关联 display_name 指向的文件；
 * 为 true 时额外关联 filename，并把 parser 链（按 / 拆分）作为来源集合挂到事件上。
 */
@Slf4j
public class PlasoAnalyzer {

    private final boolean showAllSources;
    private PlasoGraph plasoGraph;

    public PlasoAnalyzer(boolean showAllSources) {
        this.showAllSources = showAllSources;
    }

    public void initialize(JsonEventReader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        PlasoGraph graph = new PlasoGraph();
        graph.initialize();

        int eventCount = 0;
        try (JsonEventReader events = reader) {
            JsonNode event;
            while ((event = events.next()) != null) {
                addEvent(graph, event, eventCount);
                eventCount++;
            }
        } catch (IOException e) {
            throw new LogleException(ErrorCode.EXTERNAL, "Error closing JSON input: " + e.getMessage(), e);
        }

        this.plasoGraph = graph;
        log.info("【事件分析】建图完成: 事件数={}, 节点数={}, 边数={}, 展示全部来源={}",
                eventCount, graph.getGraph().nodeCount(), graph.getGraph().edgeCount(), showAllSources);
    }

    public PlasoGraph getPlasoGraph() {
        requireInitialized();
        return plasoGraph;
    }

    public String plasoGraphAsDot() {
        requireInitialized();
        return plasoGraph.toDot();
    }

    private void requireInitialized() {
        if (plasoGraph == null) {
            throw new IllegalStateException("PlasoAnalyzer is not initialized");
        }
    }

    private void addEvent(PlasoGraph graph, JsonNode event, int index) {
        if (!event.isObject()) {
            throw malformed(index, "event is not an object");
        }
        JsonNode timestamp = event.get(Plaso.FIELD_TIMESTAMP);
        if (timestamp == null || !timestamp.isIntegralNumber() || !timestamp.canConvertToLong()) {
            throw malformed(index, "'" + Plaso.FIELD_TIMESTAMP + "' is not a 64-bit integer");
        }
        long eventId = graph.addEvent(timestamp.asLong(), requireText(event, Plaso.FIELD_DATA_TYPE, index));
        graph.linkFile(eventId, requireText(event, Plaso.FIELD_DISPLAY_NAME, index), Plaso.ROLE_DISPLAY_NAME);

        if (!showAllSources) {
            return;
        }
        String filename = optionalText(event, Plaso.FIELD_FILENAME);
        if (filename != null) {
            graph.linkFile(eventId, filename, Plaso.ROLE_FILENAME);
        }
        String parser = optionalText(event, Plaso.FIELD_PARSER);
        if (parser != null) {
            Set<String> parsers = new LinkedHashSet<>();
            for (String name : parser.split("/")) {
                if (!name.isEmpty()) {
                    parsers.add(name);
                }
            }
            graph.linkSources(eventId, parsers);
        }
    }

    private static String requireText(JsonNode event, String field, int index) {
        JsonNode value = event.get(field);
        if (value == null || !value.isTextual()) {
            throw malformed(index, "'" + field + "' is not a string");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode event, String field) {
        JsonNode value = event.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            return null;
        }
        return value.asText();
    }

    private static LogleException malformed(int index, String reason) {
        return new LogleException(ErrorCode.INVALID_ARGUMENT, "Malformed Plaso event " + index + ": " + reason);
    }
}
