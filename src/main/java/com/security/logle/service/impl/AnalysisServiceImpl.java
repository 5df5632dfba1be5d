package com.security.logle.service.impl;

import com.security.logle.config.LogleConfig;
import com.security.logle.constants.LogleConstants.AnalyzerName;
import com.security.logle.constants.LogleConstants.ErrorMessage;
import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import com.security.logle.model.AnalysisOptions;
import com.security.logle.model.AnalysisOptions.InputFileCase;
import com.security.logle.model.Status;
import com.security.logle.service.AccessAnalyzer;
import com.security.logle.service.AnalysisResult;
import com.security.logle.service.AnalysisService;
import com.security.logle.service.CurioAnalyzer;
import com.security.logle.service.LabeledGraph;
import com.security.logle.service.PlasoAnalyzer;
import com.security.logle.util.Check;
import com.security.logle.util.CsvRecordReader;
import com.security.logle.util.DotPrinter;
import com.security.logle.util.FileUtil;
import com.security.logle.util.FullJsonReader;
import com.security.logle.util.GraphExplorerPrinter;
import com.security.logle.util.JsonEventReader;
import com.security.logle.util.StreamJsonReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * 日志分析服务实现类
 *
 * 流程：
 * 1. 校验分析器名称和输入文件类型
 * 2. 打开输入文件，交给分析器建图（分析器负责关闭）
 * 3. 按输出文件类型渲染为 DOT 或 GraphExplorer JSON
 * 4. 文本非空且指定了输出文件时覆盖写入
 */
@Slf4j
@Service
public class AnalysisServiceImpl implements AnalysisService {

    @Autowired
    private LogleConfig logleConfig;

    @Override
    public AnalysisResult run(AnalysisOptions options) {
        if (options == null) {
            return AnalysisResult.failure(new Status(ErrorCode.INVALID_ARGUMENT, ErrorMessage.INVALID_ANALYZER));
        }
        log.info("【分析】收到分析请求: {}", options);

        try {
            LabeledGraph graph = buildGraph(options);
            String text = render(graph, options);

            if (!text.isEmpty() && options.getOutputFile() != null) {
                FileUtil.writeToFile(options.getOutputFile(), text);
            }
            log.info("【分析】完成: analyzer={}, 节点数={}, 边数={}",
                    options.getAnalyzer(), graph.nodeCount(), graph.edgeCount());
            return new AnalysisResult(Status.OK, text);
        } catch (LogleException e) {
            log.error("【分析】失败: analyzer={}, code={}, 原因: {}",
                    options.getAnalyzer(), e.getCode(), e.getMessage());
            return AnalysisResult.failure(Status.of(e));
        }
    }

    // ========== 分析器选择 ==========

    private LabeledGraph buildGraph(AnalysisOptions options) {
        String analyzer = options.getAnalyzer();
        if (analyzer == null || !AnalyzerName.ALL.contains(analyzer)) {
            throw new LogleException(ErrorCode.INVALID_ARGUMENT, ErrorMessage.INVALID_ANALYZER);
        }

        InputFileCase input = options.getInputFileCase();
        if (AnalyzerName.MAIL.equals(analyzer)) {
            if (input != InputFileCase.CSV_FILE) {
                throw new LogleException(ErrorCode.INVALID_ARGUMENT, ErrorMessage.MAIL_REQUIRES_CSV);
            }
            return runAccessAnalyzer(options.getCsvFile());
        }
        if (AnalyzerName.CURIO.equals(analyzer)) {
            if (input != InputFileCase.JSON_FILE) {
                throw new LogleException(ErrorCode.INVALID_ARGUMENT, ErrorMessage.CURIO_REQUIRES_JSON);
            }
            return runCurioAnalyzer(options.getJsonFile());
        }
        if (input != InputFileCase.JSON_FILE && input != InputFileCase.JSON_STREAM_FILE) {
            throw new LogleException(ErrorCode.INVALID_ARGUMENT, ErrorMessage.PLASO_REQUIRES_JSON);
        }
        return runPlasoAnalyzer(options);
    }

    private LabeledGraph runAccessAnalyzer(String csvFile) {
        CsvRecordReader reader = new CsvRecordReader(FileUtil.openReader(csvFile), logleConfig.getCsvSeparator());
        AccessAnalyzer analyzer = new AccessAnalyzer();
        analyzer.initialize(reader);
        return analyzer.getAccessGraph().getGraph();
    }

    private LabeledGraph runCurioAnalyzer(String jsonFile) {
        FullJsonReader reader = new FullJsonReader(FileUtil.openReader(jsonFile), logleConfig.isJsonAllowComments());
        CurioAnalyzer analyzer = new CurioAnalyzer();
        analyzer.initialize(reader);
        return analyzer.getDependencyGraph().getGraph();
    }

    private LabeledGraph runPlasoAnalyzer(AnalysisOptions options) {
        boolean showAllSources = options.getShowAllSources() != null
                ? options.getShowAllSources()
                : logleConfig.isShowAllSources();
        boolean allowComments = logleConfig.isJsonAllowComments();

        JsonEventReader reader = null;
        switch (options.getInputFileCase()) {
            case JSON_FILE:
                reader = new FullJsonReader(FileUtil.openReader(options.getJsonFile()), allowComments);
                break;
            case JSON_STREAM_FILE:
                reader = new StreamJsonReader(FileUtil.openReader(options.getJsonStreamFile()), allowComments);
                break;
            default:
                Check.fail("Plaso input must be a JSON file or JSON stream file, got "
                        + options.getInputFileCase());
        }

        PlasoAnalyzer analyzer = new PlasoAnalyzer(showAllSources);
        analyzer.initialize(reader);
        return analyzer.getPlasoGraph().getGraph();
    }

    // ========== 渲染 ==========

    private String render(LabeledGraph graph, AnalysisOptions options) {
        if (options.getOutputFileCase() == AnalysisOptions.OutputFileCase.OUTPUT_GRAPH_EXPLORER_FILE) {
            return GraphExplorerPrinter.toJson(graph);
        }
        return DotPrinter.dotGraph(graph);
    }
}
