package com.reliablebus.core.failure.handler;

import com.reliablebus.core.spi.failure.ErrorCaseHandler;
import com.reliablebus.model.enums.ErrorKind;

import java.net.SocketTimeoutException;

/**
 * socket 读写超时, 比 IOException 更具体
 */
public class SocketTimeoutCaseHandler implements ErrorCaseHandler<SocketTimeoutException> {
    @Override
    public Class<SocketTimeoutException> exceptionType() {
        return SocketTimeoutException.class;
    }

    @Override
    public ErrorKind translate(SocketTimeoutException ex) {
        return ErrorKind.TIMEOUT;
    }
}
