package com.security.logle.service;

import com.security.logle.constants.LogleConstants.Mail;
import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import com.security.logle.util.CsvRecordReader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;

/**
 * 邮箱账户访问分析器
 *
 * 输入为带表头的 CSV，每行一次访问记录：
 * user, account, access_type, timestamp 必填，ip 可选
 */
@Slf4j
public class AccessAnalyzer {

    private AccountAccessGraph accessGraph;

    /**
     * 读取全部记录并建图，读取器在返回前关闭
     */
    public void initialize(CsvRecordReader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        AccountAccessGraph graph = new AccountAccessGraph();
        graph.initialize();

        int accessCount = 0;
        try (CsvRecordReader records = reader) {
            Map<String, String> record;
            while ((record = records.next()) != null) {
                int line = records.getLineNumber();
                graph.addAccess(
                        requireField(record, Mail.COLUMN_USER, line),
                        requireField(record, Mail.COLUMN_ACCOUNT, line),
                        requireField(record, Mail.COLUMN_ACCESS_TYPE, line),
                        requireField(record, Mail.COLUMN_TIMESTAMP, line),
                        record.get(Mail.COLUMN_IP));
                accessCount++;
            }
        } catch (IOException e) {
            throw new LogleException(ErrorCode.EXTERNAL, "Error closing CSV input: " + e.getMessage(), e);
        }

        this.accessGraph = graph;
        log.info("【访问分析】建图完成: 访问记录数={}, 节点数={}, 边数={}",
                accessCount, graph.getGraph().nodeCount(), graph.getGraph().edgeCount());
    }

    public AccountAccessGraph getAccessGraph() {
        requireInitialized();
        return accessGraph;
    }

    public String accessGraphAsDot() {
        requireInitialized();
        return accessGraph.toDot();
    }

    private void requireInitialized() {
        if (accessGraph == null) {
            throw new IllegalStateException("AccessAnalyzer is not initialized");
        }
    }

    private static String requireField(Map<String, String> record, String column, int line) {
        String value = record.get(column);
        if (value == null || value.isEmpty()) {
            throw new LogleException(ErrorCode.INVALID_ARGUMENT,
                    "Missing field '" + column + "' in CSV record " + line);
        }
        return value;
    }
}
