package com.reliablebus.core.failure.handler;

import com.reliablebus.core.spi.broker.UnknownTopicException;
import com.reliablebus.core.spi.failure.ErrorCaseHandler;
import com.reliablebus.model.enums.ErrorKind;

public class UnknownTopicCaseHandler implements ErrorCaseHandler<UnknownTopicException> {
    @Override
    public Class<UnknownTopicException> exceptionType() {
        return UnknownTopicException.class;
    }

    @Override
    public ErrorKind translate(UnknownTopicException ex) {
        return ErrorKind.TOPIC_NOT_FOUND;
    }
}
