package com.security.logle.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Closeable;

/**
 * JSON 事件读取器
 *
 * 实现类接管底层 Reader 的所有权，close() 时释放
 */
public interface JsonEventReader extends Closeable {

    /**
     * @return 下一个事件对象，读完返回 null
     */
    JsonNode next();
}
