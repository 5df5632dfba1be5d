package com.security.logle.service;

import com.security.logle.model.Status;
import lombok.Getter;

/**
 * 分析结果：状态 + 渲染后的图文本（失败时为空串）
 */
@Getter
public class AnalysisResult {

    private final Status status;
    private final String graphText;

    public AnalysisResult(Status status, String graphText) {
        this.status = status;
        this.graphText = graphText != null ? graphText : "";
    }

    public static AnalysisResult failure(Status status) {
        return new AnalysisResult(status, "");
    }

    public boolean isOk() {
        return status.isOk();
    }
}
