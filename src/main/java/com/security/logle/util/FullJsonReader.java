package com.security.logle.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 读取单个 JSON 文档
 *
 * 文档在构造时整体解析。作为事件源时：对象按字段顺序返回各字段值，数组按顺序返回元素。
 */
public class FullJsonReader implements JsonEventReader {

    private final Reader reader;
    private final JsonNode document;
    private final Iterator<JsonNode> events;

    public FullJsonReader(Reader reader, boolean allowComments) {
        this.reader = reader;
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(JsonParser.Feature.ALLOW_COMMENTS, allowComments);
        try {
            JsonNode parsed = mapper.readTree(reader);
            this.document = parsed != null ? parsed : mapper.createObjectNode();
        } catch (IOException e) {
            LogleException failure = new LogleException(ErrorCode.INVALID_ARGUMENT,
                    "Malformed JSON document: " + e.getMessage(), e);
            try {
                reader.close();
            } catch (IOException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
        List<JsonNode> values = new ArrayList<>();
        document.elements().forEachRemaining(values::add);
        this.events = values.iterator();
    }

    public JsonNode document() {
        return document;
    }

    @Override
    public JsonNode next() {
        return events.hasNext() ? events.next() : null;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
