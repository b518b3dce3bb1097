package com.reliablebus.core.failure.handler;

import com.reliablebus.core.spi.failure.ErrorCaseHandler;
import com.reliablebus.model.enums.ErrorKind;

/**
 * broker 拒绝非法参数（超长 key、非法 topic 名等）
 */
public class ValidationCaseHandler implements ErrorCaseHandler<IllegalArgumentException> {
    @Override
    public Class<IllegalArgumentException> exceptionType() {
        return IllegalArgumentException.class;
    }

    @Override
    public ErrorKind translate(IllegalArgumentException ex) {
        return ErrorKind.VALIDATION_ERROR;
    }
}
