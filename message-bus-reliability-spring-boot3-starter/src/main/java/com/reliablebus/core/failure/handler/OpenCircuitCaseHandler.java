package com.reliablebus.core.failure.handler;

import com.reliablebus.core.spi.failure.ErrorCaseHandler;
import com.reliablebus.model.enums.ErrorKind;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;

/**
 * resilience4j 拒绝调用
 */
public class OpenCircuitCaseHandler implements ErrorCaseHandler<CallNotPermittedException> {
    @Override
    public Class<CallNotPermittedException> exceptionType() {
        return CallNotPermittedException.class;
    }

    @Override
    public ErrorKind translate(CallNotPermittedException ex) {
        return ErrorKind.CIRCUIT_OPEN;
    }
}
