package com.reliablebus.core.backoff;

import com.reliablebus.core.spi.BackoffPolicy;
import com.reliablebus.model.RetryConfig;

/**
 * 线性增长：initialDelay * attempt
 */
public class LinearBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "linear";
    }

    @Override
    public double baseDelay(int attemptNumber, RetryConfig config) {
        return config.getInitialDelay() * Math.max(1, attemptNumber);
    }
}
