package com.reliablebus.core.backoff;

import com.reliablebus.core.spi.BackoffPolicy;
import com.reliablebus.model.RetryConfig;

/**
 * 指数退避：initialDelay * multiplier^(attempt-1)
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public double baseDelay(int attemptNumber, RetryConfig config) {
        // attempt从1开始：1 -> initial, 2 -> initial * m, 3 -> initial * m^2 ...
        double pow = Math.pow(config.getBackoffMultiplier(), Math.max(0, attemptNumber - 1));
        return config.getInitialDelay() * pow;
    }
}
