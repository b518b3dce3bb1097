package com.reliablebus.exception;

import com.reliablebus.model.enums.ErrorKind;

/**
 * 参数/消息校验失败, 默认不重试
 */
public class MessageValidationException extends BusException {

    public MessageValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
