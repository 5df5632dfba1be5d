package com.security.logle.model;

import com.security.logle.exception.ErrorCode;
import com.security.logle.exception.LogleException;
import lombok.Getter;

/**
 * 操作状态：成功，或带错误码和说明的失败
 */
@Getter
public final class Status {

    public static final Status OK = new Status(ErrorCode.OK, "");

    private final ErrorCode code;
    private final String message;

    public Status(ErrorCode code, String message) {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        this.code = code;
        this.message = message != null ? message : "";
    }

    public static Status of(LogleException e) {
        return new Status(e.getCode(), e.getMessage());
    }

    public boolean isOk() {
        return code == ErrorCode.OK;
    }

    @Override
    public String toString() {
        return isOk() ? "OK" : code + ": " + message;
    }
}
