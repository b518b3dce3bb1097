package com.reliablebus.model;

import com.reliablebus.core.spi.BackoffPolicy;
import com.reliablebus.model.enums.BackoffStrategy;
import com.reliablebus.model.enums.ErrorKind;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 重试配置, 不可变, 可被多条消息共享
 * 时间单位均为秒
 */
@Getter
@ToString
public final class RetryConfig {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final double DEFAULT_INITIAL_DELAY = 1.0;
    public static final double DEFAULT_MAX_DELAY = 60.0;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    private final int maxAttempts;

    private final double initialDelay;

    private final double maxDelay;

    private final double backoffMultiplier;

    private final BackoffStrategy strategy;

    private final boolean jitter;

    /** 为 null 表示除 VALIDATION_ERROR 外全部可重试 */
    private final Set<ErrorKind> retryableErrors;

    /** CUSTOM 策略使用, 为空时按 EXPONENTIAL 计算 */
    @ToString.Exclude
    private final BackoffPolicy customPolicy;

    @Builder(toBuilder = true)
    private RetryConfig(Integer maxAttempts,
                        Double initialDelay,
                        Double maxDelay,
                        Double backoffMultiplier,
                        BackoffStrategy strategy,
                        Boolean jitter,
                        Set<ErrorKind> retryableErrors,
                        BackoffPolicy customPolicy) {
        this.maxAttempts = maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        this.initialDelay = initialDelay == null ? DEFAULT_INITIAL_DELAY : initialDelay;
        this.maxDelay = maxDelay == null ? Math.max(DEFAULT_MAX_DELAY, this.initialDelay) : maxDelay;
        this.backoffMultiplier = backoffMultiplier == null ? DEFAULT_BACKOFF_MULTIPLIER : backoffMultiplier;
        this.strategy = strategy == null ? BackoffStrategy.EXPONENTIAL : strategy;
        this.jitter = jitter == null || jitter;
        this.retryableErrors = retryableErrors == null ? null
                : Collections.unmodifiableSet(retryableErrors.isEmpty()
                    ? EnumSet.noneOf(ErrorKind.class) : EnumSet.copyOf(retryableErrors));
        this.customPolicy = customPolicy;

        // 参数校验
        if (this.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + this.maxAttempts);
        }
        if (!(this.initialDelay > 0)) {
            throw new IllegalArgumentException("initialDelay must be > 0, got " + this.initialDelay);
        }
        if (this.maxDelay < this.initialDelay) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (this.backoffMultiplier < 1) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1, got " + this.backoffMultiplier);
        }
    }

    public static RetryConfig defaults() {
        return RetryConfig.builder().build();
    }

    /**
     * 该错误类型在此配置下是否可重试
     */
    public boolean isRetryable(ErrorKind kind) {
        if (kind == null) {
            return false;
        }
        if (retryableErrors == null) {
            return kind.isRetryableByDefault();
        }
        return retryableErrors.contains(kind);
    }
}
