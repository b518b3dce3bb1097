package com.reliablebus.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * 熔断器状态快照
 */
@Value
@Builder
public class CircuitBreakerState {

    String name;

    /** CLOSED / OPEN / HALF_OPEN */
    String state;

    boolean open;

    /** 连续失败次数, 任意一次成功清零 */
    int failureCount;

    Instant lastFailureTime;

    int failureThreshold;

    Duration resetTimeout;
}
