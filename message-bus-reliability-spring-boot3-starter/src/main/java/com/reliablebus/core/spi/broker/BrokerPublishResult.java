package com.reliablebus.core.spi.broker;

import lombok.Value;

@Value
public class BrokerPublishResult {
    int partition;
    long offset;
}
