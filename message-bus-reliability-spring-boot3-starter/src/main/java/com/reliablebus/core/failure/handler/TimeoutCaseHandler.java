package com.reliablebus.core.failure.handler;

import com.reliablebus.core.spi.failure.ErrorCaseHandler;
import com.reliablebus.model.enums.ErrorKind;

import java.util.concurrent.TimeoutException;

/**
 * 超时
 */
public class TimeoutCaseHandler implements ErrorCaseHandler<TimeoutException> {
    @Override
    public Class<TimeoutException> exceptionType() {
        return TimeoutException.class;
    }

    @Override
    public ErrorKind translate(TimeoutException ex) {
        return ErrorKind.TIMEOUT;
    }
}
