package com.security.logle.util;

import com.security.logle.constants.LogleConstants;
import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * 文件读写工具类
 */
@Slf4j
public final class FileUtil {

    private FileUtil() {
    }

    /**
     * 打开输入文件，所有权交给调用方
     *
     * @throws LogleException EXTERNAL，消息包含文件路径
     */
    public static BufferedReader openReader(String filename) {
        try {
            return Files.newBufferedReader(toPath(filename), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            log.warn("【文件】打开失败: {}, 原因: {}", filename, e.getMessage());
            throw new LogleException(ErrorCode.EXTERNAL, LogleConstants.ErrorMessage.OPEN_FILE + filename, e);
        }
    }

    /**
     * 覆盖写入文件
     *
     * 打开/关闭失败为 EXTERNAL，写入失败为 INTERNAL
     */
    public static void writeToFile(String filename, String contents) {
        BufferedWriter writer;
        try {
            writer = Files.newBufferedWriter(toPath(filename), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException | InvalidPathException e) {
            throw new LogleException(ErrorCode.EXTERNAL, LogleConstants.ErrorMessage.OPEN_FILE + filename, e);
        }

        try {
            writer.write(contents);
        } catch (IOException e) {
            closeAfterFailure(writer, filename);
            throw new LogleException(ErrorCode.INTERNAL, LogleConstants.ErrorMessage.WRITE_FILE + filename, e);
        }

        try {
            writer.close();
        } catch (IOException e) {
            throw new LogleException(ErrorCode.EXTERNAL, LogleConstants.ErrorMessage.CLOSE_FILE + filename, e);
        }
        log.info("【文件】已写入: {} ({} 字符)", filename, contents.length());
    }

    private static void closeAfterFailure(BufferedWriter writer, String filename) {
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("【文件】写入失败后关闭文件出错: {}, 原因: {}", filename, e.getMessage());
        }
    }

    private static Path toPath(String filename) {
        return Paths.get(filename);
    }
}
