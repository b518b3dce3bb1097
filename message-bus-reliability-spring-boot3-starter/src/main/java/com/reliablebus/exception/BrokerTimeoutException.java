package com.reliablebus.exception;

import com.reliablebus.model.enums.ErrorKind;

public class BrokerTimeoutException extends BusException {

    public BrokerTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
