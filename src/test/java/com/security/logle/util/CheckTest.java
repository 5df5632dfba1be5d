package com.security.logle.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 致命检查测试（使用只记录的处理器，不退出进程）
 */
public class CheckTest {

    private final List<String> recorded = new ArrayList<>();

    @BeforeEach
    public void setUp() {
        Check.setFatalHandler((location, message) -> recorded.add(location + "|" + message));
    }

    @AfterEach
    public void tearDown() {
        Check.setFatalHandler(null);
    }

    @Test
    @DisplayName("条件成立时不调用处理器")
    public void testPassingCheck() {
        Check.check(true, "never");

        assertTrue(recorded.isEmpty());
    }

    @Test
    @DisplayName("条件不成立时调用处理器，处理器返回后抛 IllegalStateException")
    public void testFailingCheck() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> Check.check(false, "bad state"));

        assertEquals(1, recorded.size());
        assertTrue(recorded.get(0).endsWith("|bad state"));
        assertTrue(recorded.get(0).startsWith(CheckTest.class.getName()), "位置应指向调用方");
        assertTrue(e.getMessage().contains("bad state"));
    }

    @Test
    @DisplayName("传 null 恢复默认处理器")
    public void testResetHandler() {
        FatalHandler custom = Check.getFatalHandler();
        Check.setFatalHandler(null);

        assertNotSame(custom, Check.getFatalHandler());
        assertEquals(134, Check.FATAL_EXIT_CODE);
    }
}
