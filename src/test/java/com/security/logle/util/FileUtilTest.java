package com.security.logle.util;

import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 文件读写测试
 */
public class FileUtilTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("打开不存在的文件抛 EXTERNAL，消息包含路径")
    public void testOpenMissing() {
        String missing = tempDir.resolve("missing.csv").toString();

        LogleException e = assertThrows(LogleException.class, () -> FileUtil.openReader(missing));

        assertEquals(ErrorCode.EXTERNAL, e.getCode());
        assertEquals("Error opening file: " + missing, e.getMessage());
    }

    @Test
    @DisplayName("读取已有文件")
    public void testOpenExisting() throws Exception {
        Path file = tempDir.resolve("in.txt");
        Files.write(file, "hello\n".getBytes(StandardCharsets.UTF_8));

        try (BufferedReader reader = FileUtil.openReader(file.toString())) {
            assertEquals("hello", reader.readLine());
        }
    }

    @Test
    @DisplayName("覆盖写入")
    public void testWriteOverwrites() throws Exception {
        Path file = tempDir.resolve("out.dot");
        Files.write(file, "old content that is longer".getBytes(StandardCharsets.UTF_8));

        FileUtil.writeToFile(file.toString(), "digraph {\n}\n");

        assertEquals("digraph {\n}\n", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("输出目录不存在时抛 EXTERNAL")
    public void testWriteToMissingDirectory() {
        String target = tempDir.resolve("no/such/dir/out.dot").toString();

        LogleException e = assertThrows(LogleException.class, () -> FileUtil.writeToFile(target, "x"));

        assertEquals(ErrorCode.EXTERNAL, e.getCode());
        assertTrue(e.getMessage().contains(target));
    }
}
