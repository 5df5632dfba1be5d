package com.security.logle.controller;

import com.security.logle.config.LogleConfig;
import com.security.logle.exception.ErrorCode;
import com.security.logle.model.AnalysisOptions;
import com.security.logle.model.Status;
import com.security.logle.service.AnalysisResult;
import com.security.logle.service.AnalysisService;
import com.security.logle.util.Check;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * 命令行入口测试
 */
public class AnalysisControllerTest {

    @Mock
    private AnalysisService analysisService;

    @Spy
    private LogleConfig logleConfig = new LogleConfig();

    @InjectMocks
    private AnalysisController controller;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    @BeforeEach
    public void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        controller.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8.name()));
    }

    @AfterEach
    public void tearDown() {
        Check.setFatalHandler(null);
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }

    @Test
    @DisplayName("参数映射为分析请求")
    public void testToOptions() {
        AnalysisOptions options = AnalysisController.toOptions(args(
                "--analyzer=plaso", "--json_stream_file=in.jsonl",
                "--output_graph_explorer_file=out.json", "--show_all_sources"));

        assertEquals("plaso", options.getAnalyzer());
        assertEquals("in.jsonl", options.getJsonStreamFile());
        assertEquals("out.json", options.getOutputGraphExplorerFile());
        assertEquals(Boolean.TRUE, options.getShowAllSources());
    }

    @Test
    @DisplayName("未给出 show_all_sources 时保持未设置")
    public void testShowAllSourcesUnset() {
        AnalysisOptions options = AnalysisController.toOptions(args("--analyzer=mail", "--csv_file=a.csv"));

        assertNull(options.getShowAllSources());
        assertEquals("a.csv", options.getCsvFile());
        assertFalse(AnalysisController.toOptions(args("--show_all_sources=false")).getShowAllSources());
    }

    @Test
    @DisplayName("成功且未指定输出文件时打印到标准输出，退出码 0")
    public void testPrintsToStdout() throws Exception {
        when(analysisService.run(any(AnalysisOptions.class)))
                .thenReturn(new AnalysisResult(Status.OK, "digraph {\n}\n"));

        controller.run(args("--analyzer=mail", "--csv_file=a.csv"));

        assertEquals(0, controller.getExitCode());
        assertEquals("digraph {\n}\n", stdout.toString(StandardCharsets.UTF_8.name()));
    }

    @Test
    @DisplayName("指定输出文件时不打印")
    public void testNoPrintWithOutputFile() throws Exception {
        when(analysisService.run(any(AnalysisOptions.class)))
                .thenReturn(new AnalysisResult(Status.OK, "digraph {\n}\n"));

        controller.run(args("--analyzer=mail", "--csv_file=a.csv", "--output_dot_file=o.dot"));

        ArgumentCaptor<AnalysisOptions> captor = ArgumentCaptor.forClass(AnalysisOptions.class);
        verify(analysisService).run(captor.capture());
        assertEquals("o.dot", captor.getValue().getOutputDotFile());
        assertEquals(0, stdout.size());
        assertEquals(0, controller.getExitCode());
    }

    @Test
    @DisplayName("分析失败时退出码 1")
    public void testFailureExitCode() {
        when(analysisService.run(any(AnalysisOptions.class)))
                .thenReturn(AnalysisResult.failure(new Status(ErrorCode.EXTERNAL, "Error opening file: a.csv")));

        controller.run(args("--analyzer=mail", "--csv_file=a.csv"));

        assertEquals(1, controller.getExitCode());
        assertEquals(0, stdout.size());
    }

    @Test
    @DisplayName("exit-on-fatal=false 时内部检查失败不退出进程，退出码 134")
    public void testFatalWithoutExit() {
        logleConfig.setExitOnFatal(false);
        when(analysisService.run(any(AnalysisOptions.class))).thenAnswer(invocation -> {
            Check.fail("unreachable input combination");
            return null;
        });

        controller.run(args("--analyzer=plaso"));

        assertEquals(Check.FATAL_EXIT_CODE, controller.getExitCode());
    }
}
