package com.security.logle.service;

import com.security.logle.model.AnalysisOptions;

/**
 * 日志分析服务
 */
public interface AnalysisService {

    /**
     * 校验请求，运行对应分析器，渲染并按需写出结果
     *
     * 所有失败都以 Status 形式返回，不抛 LogleException
     */
    AnalysisResult run(AnalysisOptions options);
}
