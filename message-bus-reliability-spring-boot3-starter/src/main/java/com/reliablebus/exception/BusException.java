package com.reliablebus.exception;

import com.reliablebus.model.enums.ErrorKind;
import lombok.Getter;

/**
 * 总线异常基类, 携带规范化的错误类型
 * broker 原始异常只作为 cause 保留
 */
@Getter
public class BusException extends RuntimeException {

    private final ErrorKind kind;

    public BusException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind == null ? ErrorKind.UNKNOWN : kind;
    }

    public BusException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.UNKNOWN : kind;
    }

    public boolean isRetryableByDefault() {
        return kind.isRetryableByDefault();
    }
}
