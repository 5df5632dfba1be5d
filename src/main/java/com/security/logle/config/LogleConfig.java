package com.security.logle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 日志分析配置类
 */
@Configuration
@ConfigurationProperties(prefix = "logle")
public class LogleConfig {

    /**
     * CSV 列分隔符
     */
    private char csvSeparator = ',';

    /**
     * JSON 输入是否允许注释
     */
    private boolean jsonAllowComments = false;

    /**
     * Plaso 请求未指定时是否展示全部来源
     */
    private boolean showAllSources = false;

    /**
     * 致命错误时是否退出进程
     */
    private boolean exitOnFatal = true;

    // Getters and Setters
    public char getCsvSeparator() {
        return csvSeparator;
    }

    public void setCsvSeparator(char csvSeparator) {
        this.csvSeparator = csvSeparator;
    }

    public boolean isJsonAllowComments() {
        return jsonAllowComments;
    }

    public void setJsonAllowComments(boolean jsonAllowComments) {
        this.jsonAllowComments = jsonAllowComments;
    }

    public boolean isShowAllSources() {
        return showAllSources;
    }

    public void setShowAllSources(boolean showAllSources) {
        this.showAllSources = showAllSources;
    }

    public boolean isExitOnFatal() {
        return exitOnFatal;
    }

    public void setExitOnFatal(boolean exitOnFatal) {
        this.exitOnFatal = exitOnFatal;
    }
}
