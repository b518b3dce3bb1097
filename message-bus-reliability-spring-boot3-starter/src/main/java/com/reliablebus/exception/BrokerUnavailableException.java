package com.reliablebus.exception;

import com.reliablebus.model.enums.ErrorKind;

public class BrokerUnavailableException extends BusException {

    public BrokerUnavailableException(String message, Throwable cause) {
        super(ErrorKind.BROKER_UNAVAILABLE, message, cause);
    }
}
