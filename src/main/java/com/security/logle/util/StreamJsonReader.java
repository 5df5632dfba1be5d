package com.security.logle.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;

import java.io.IOException;
import java.io.Reader;

/**
 * 读取 JSON 流：若干个首尾相接（可用空白分隔）的 JSON 对象
 *
 * 逐个解析，不会把整个流读入内存
 */
public class StreamJsonReader implements JsonEventReader {

    private final Reader reader;
    private final MappingIterator<JsonNode> values;
    private int count;

    public StreamJsonReader(Reader reader, boolean allowComments) {
        this.reader = reader;
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(JsonParser.Feature.ALLOW_COMMENTS, allowComments);
        try {
            this.values = mapper.readerFor(JsonNode.class).readValues(reader);
        } catch (IOException e) {
            LogleException failure = new LogleException(ErrorCode.INVALID_ARGUMENT,
                    "Malformed JSON stream: " + e.getMessage(), e);
            try {
                reader.close();
            } catch (IOException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
    }

    @Override
    public JsonNode next() {
        try {
            if (!values.hasNextValue()) {
                return null;
            }
            JsonNode value = values.nextValue();
            count++;
            return value;
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new LogleException(ErrorCode.INVALID_ARGUMENT,
                    "Malformed JSON stream object " + (count + 1) + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            values.close();
        } finally {
            reader.close();
        }
    }
}
