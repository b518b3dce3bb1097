package com.reliablebus.core.backoff;

import com.reliablebus.core.spi.BackoffPolicy;
import com.reliablebus.model.RetryConfig;

/**
 * 固定间隔
 */
public class FixedBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public double baseDelay(int attemptNumber, RetryConfig config) {
        return config.getInitialDelay();
    }
}
