package com.reliablebus.exception.guard;

import com.reliablebus.exception.BusException;
import com.reliablebus.model.enums.ErrorKind;
import lombok.Getter;

/**
 * 熔断打开, 调用未触达 broker
 */
@Getter
public class CircuitOpenException extends BusException {

    private final String breakerName;

    public CircuitOpenException(String breakerName) {
        super(ErrorKind.CIRCUIT_OPEN, "circuit open: " + breakerName);
        this.breakerName = breakerName;
    }
}
