package com.reliablebus.core.spi.broker;

import lombok.Getter;

/**
 * broker 客户端创建已存在的 topic 时可抛出, 仓储视为创建成功
 */
@Getter
public class TopicExistsException extends Exception {

    private final String topic;

    public TopicExistsException(String topic) {
        super("topic already exists: " + topic);
        this.topic = topic;
    }
}
