package com.reliablebus.core.failure.handler;

import com.reliablebus.core.spi.failure.ErrorCaseHandler;
import com.reliablebus.model.enums.ErrorKind;

import java.io.IOException;

/**
 * 连接拒绝/断开等网络故障
 */
public class BrokerIoCaseHandler implements ErrorCaseHandler<IOException> {
    @Override
    public Class<IOException> exceptionType() {
        return IOException.class;
    }

    @Override
    public ErrorKind translate(IOException ex) {
        return ErrorKind.BROKER_UNAVAILABLE;
    }
}
