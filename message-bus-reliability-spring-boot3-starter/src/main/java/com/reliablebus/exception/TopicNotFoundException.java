package com.reliablebus.exception;

import com.reliablebus.model.enums.ErrorKind;
import lombok.Getter;

@Getter
public class TopicNotFoundException extends BusException {

    private final String topic;

    public TopicNotFoundException(String topic, Throwable cause) {
        super(ErrorKind.TOPIC_NOT_FOUND, "topic not found: " + topic, cause);
        this.topic = topic;
    }
}
