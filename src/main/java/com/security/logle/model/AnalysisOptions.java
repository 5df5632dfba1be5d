package com.security.logle.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 分析请求
 *
 * 输入文件三选一（csv_file / json_file / json_stream_file），
 * 输出文件二选一（output_dot_file / output_graph_explorer_file）；
 * 设置组内某一项会清空同组其他项。
 */
@ToString
public class AnalysisOptions {

    public enum InputFileCase {
        CSV_FILE,
        JSON_FILE,
        JSON_STREAM_FILE,
        NOT_SET
    }

    public enum OutputFileCase {
        OUTPUT_DOT_FILE,
        OUTPUT_GRAPH_EXPLORER_FILE,
        NOT_SET
    }

    @Getter
    @Setter
    private String analyzer;

    /** Plaso 是否展示全部来源，null 表示使用配置默认值 */
    @Getter
    @Setter
    private Boolean showAllSources;

    private InputFileCase inputFileCase = InputFileCase.NOT_SET;
    private String inputFile;

    private OutputFileCase outputFileCase = OutputFileCase.NOT_SET;
    private String outputFile;

    // ========== 输入文件 ==========

    public void setCsvFile(String csvFile) {
        setInput(InputFileCase.CSV_FILE, csvFile);
    }

    public void setJsonFile(String jsonFile) {
        setInput(InputFileCase.JSON_FILE, jsonFile);
    }

    public void setJsonStreamFile(String jsonStreamFile) {
        setInput(InputFileCase.JSON_STREAM_FILE, jsonStreamFile);
    }

    public String getCsvFile() {
        return inputFileCase == InputFileCase.CSV_FILE ? inputFile : null;
    }

    public String getJsonFile() {
        return inputFileCase == InputFileCase.JSON_FILE ? inputFile : null;
    }

    public String getJsonStreamFile() {
        return inputFileCase == InputFileCase.JSON_STREAM_FILE ? inputFile : null;
    }

    public InputFileCase getInputFileCase() {
        return inputFileCase;
    }

    public String getInputFile() {
        return inputFile;
    }

    public void clearInputFile() {
        inputFileCase = InputFileCase.NOT_SET;
        inputFile = null;
    }

    // ========== 输出文件 ==========

    public void setOutputDotFile(String outputDotFile) {
        setOutput(OutputFileCase.OUTPUT_DOT_FILE, outputDotFile);
    }

    public void setOutputGraphExplorerFile(String outputGraphExplorerFile) {
        setOutput(OutputFileCase.OUTPUT_GRAPH_EXPLORER_FILE, outputGraphExplorerFile);
    }

    public String getOutputDotFile() {
        return outputFileCase == OutputFileCase.OUTPUT_DOT_FILE ? outputFile : null;
    }

    public String getOutputGraphExplorerFile() {
        return outputFileCase == OutputFileCase.OUTPUT_GRAPH_EXPLORER_FILE ? outputFile : null;
    }

    public OutputFileCase getOutputFileCase() {
        return outputFileCase;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void clearOutputFile() {
        outputFileCase = OutputFileCase.NOT_SET;
        outputFile = null;
    }

    private void setInput(InputFileCase which, String path) {
        if (path == null) {
            clearInputFile();
            return;
        }
        inputFileCase = which;
        inputFile = path;
    }

    private void setOutput(OutputFileCase which, String path) {
        if (path == null) {
            clearOutputFile();
            return;
        }
        outputFileCase = which;
        outputFile = path;
    }
}
