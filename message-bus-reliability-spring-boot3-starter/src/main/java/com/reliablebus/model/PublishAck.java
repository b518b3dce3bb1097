package com.reliablebus.model;

import lombok.Value;

@Value
public class PublishAck {
    String messageId;
    String topic;
    int partition;
    long offset;
}
