package com.security.logle.util;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.Map;

/**
 * 带表头的 CSV 记录读取器
 *
 * 接管传入 Reader 的所有权，close() 时关闭底层流。
 * 每条记录为 列名 -> 值；lineNumber 为最近一条记录所在的数据行号（从 1 开始，不含表头）。
 */
public class CsvRecordReader implements Closeable {

    private final Reader reader;
    private final MappingIterator<Map<String, String>> records;
    private int lineNumber;

    public CsvRecordReader(Reader reader, char separator) {
        this.reader = reader;
        CsvSchema schema = CsvSchema.emptySchema()
                .withHeader()
                .withColumnSeparator(separator);
        try {
            this.records = new CsvMapper()
                    .readerFor(Map.class)
                    .with(schema)
                    .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                    .with(CsvParser.Feature.TRIM_SPACES)
                    .readValues(reader);
        } catch (IOException e) {
            LogleException failure = new LogleException(ErrorCode.INVALID_ARGUMENT,
                    "Error reading CSV header: " + e.getMessage(), e);
            try {
                reader.close();
            } catch (IOException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
    }

    /**
     * @return 下一条记录，读完返回 null
     */
    public Map<String, String> next() {
        try {
            if (!records.hasNextValue()) {
                return null;
            }
            Map<String, String> record = records.nextValue();
            lineNumber++;
            return record;
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new LogleException(ErrorCode.INVALID_ARGUMENT,
                    "Malformed CSV record " + (lineNumber + 1) + ": " + e.getMessage(), e);
        }
    }

    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        try {
            records.close();
        } finally {
            reader.close();
        }
    }
}
