package com.security.logle.controller;

import com.security.logle.config.LogleConfig;
import com.security.logle.model.AnalysisOptions;
import com.security.logle.service.AnalysisResult;
import com.security.logle.service.AnalysisService;
import com.security.logle.util.Check;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * 命令行入口
 *
 * 用法：
 * <pre>
 * java -jar logle.jar --analyzer=mail --csv_file=in.csv --output_dot_file=out.dot
 * </pre>
 * 未指定输出文件时把结果打印到标准输出。成功退出码 0，失败 1。
 */
@Slf4j
@Component
public class AnalysisController implements ApplicationRunner, ExitCodeGenerator {

    static final String ARG_ANALYZER = "analyzer";
    static final String ARG_CSV_FILE = "csv_file";
    static final String ARG_JSON_FILE = "json_file";
    static final String ARG_JSON_STREAM_FILE = "json_stream_file";
    static final String ARG_OUTPUT_DOT_FILE = "output_dot_file";
    static final String ARG_OUTPUT_GRAPH_EXPLORER_FILE = "output_graph_explorer_file";
    static final String ARG_SHOW_ALL_SOURCES = "show_all_sources";

    @Autowired
    private AnalysisService analysisService;

    @Autowired
    private LogleConfig logleConfig;

    private PrintStream out = System.out;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        if (!logleConfig.isExitOnFatal()) {
            Check.setFatalHandler((location, message) ->
                    log.error("【致命错误】{}: {}（exit-on-fatal=false，不退出进程）", location, message));
        }

        AnalysisOptions options = toOptions(args);
        AnalysisResult result;
        try {
            result = analysisService.run(options);
        } catch (IllegalStateException e) {
            log.error("【命令行】内部检查失败: {}", e.getMessage());
            exitCode = Check.FATAL_EXIT_CODE;
            return;
        }

        if (!result.isOk()) {
            log.error("【命令行】分析失败: {}", result.getStatus());
            exitCode = 1;
            return;
        }
        if (options.getOutputFile() == null) {
            out.print(result.getGraphText());
            out.flush();
        }
        exitCode = 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    /**
     * 参数 -> 分析请求；同组参数同时出现时，按声明顺序后者覆盖前者
     */
    static AnalysisOptions toOptions(ApplicationArguments args) {
        AnalysisOptions options = new AnalysisOptions();
        options.setAnalyzer(lastValue(args, ARG_ANALYZER));

        String csvFile = lastValue(args, ARG_CSV_FILE);
        String jsonFile = lastValue(args, ARG_JSON_FILE);
        String jsonStreamFile = lastValue(args, ARG_JSON_STREAM_FILE);
        if (csvFile != null) {
            options.setCsvFile(csvFile);
        }
        if (jsonFile != null) {
            options.setJsonFile(jsonFile);
        }
        if (jsonStreamFile != null) {
            options.setJsonStreamFile(jsonStreamFile);
        }

        String dotFile = lastValue(args, ARG_OUTPUT_DOT_FILE);
        String explorerFile = lastValue(args, ARG_OUTPUT_GRAPH_EXPLORER_FILE);
        if (dotFile != null) {
            options.setOutputDotFile(dotFile);
        }
        if (explorerFile != null) {
            options.setOutputGraphExplorerFile(explorerFile);
        }

        if (args.containsOption(ARG_SHOW_ALL_SOURCES)) {
            String flag = lastValue(args, ARG_SHOW_ALL_SOURCES);
            options.setShowAllSources(flag == null || Boolean.parseBoolean(flag));
        }
        return options;
    }

    private static String lastValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }
}
