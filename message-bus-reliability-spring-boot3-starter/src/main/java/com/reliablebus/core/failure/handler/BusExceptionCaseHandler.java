package com.reliablebus.core.failure.handler;

import com.reliablebus.core.spi.failure.ErrorCaseHandler;
import com.reliablebus.exception.BusException;
import com.reliablebus.model.enums.ErrorKind;

/**
 * 已规范化的异常, 直接取其类型
 */
public class BusExceptionCaseHandler implements ErrorCaseHandler<BusException> {
    @Override
    public Class<BusException> exceptionType() {
        return BusException.class;
    }

    @Override
    public ErrorKind translate(BusException ex) {
        return ex.getKind();
    }
}
