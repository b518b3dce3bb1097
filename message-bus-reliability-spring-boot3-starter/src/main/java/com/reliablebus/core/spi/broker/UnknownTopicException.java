package com.reliablebus.core.spi.broker;

import lombok.Getter;

/**
 * broker 客户端在 topic 不存在时抛出
 */
@Getter
public class UnknownTopicException extends Exception {

    private final String topic;

    public UnknownTopicException(String topic) {
        super("unknown topic: " + topic);
        this.topic = topic;
    }
}
