package com.security.logle.exception;

import lombok.Getter;

/**
 * 可恢复的业务异常，携带错误码
 *
 * 图核心与分析器抛出该异常，由前端统一转换为 {@link com.security.logle.model.Status}
 */
@Getter
public class LogleException extends RuntimeException {

    private final ErrorCode code;

    public LogleException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public LogleException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
