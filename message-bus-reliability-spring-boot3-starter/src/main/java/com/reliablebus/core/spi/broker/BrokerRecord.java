package com.reliablebus.core.spi.broker;

import lombok.Value;

@Value
public class BrokerRecord {
    byte[] value;
    String topic;
    int partition;
    long offset;
}
