package com.reliablebus.core.backoff;

import com.reliablebus.core.spi.BackoffPolicy;
import com.reliablebus.model.RetryConfig;
import com.reliablebus.model.enums.BackoffStrategy;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 重试延迟计算 + 策略注册中心
 * - 内置 fixed / linear / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy
 * - 线程安全
 */
public class RetryPolicy {

    /** 延迟下限（秒） */
    public static final double MIN_DELAY = 0.1;

    /** 抖动幅度 ±10% */
    public static final double JITTER_RATIO = 0.1;

    private static final String PREFIX_SPI = "spi:";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    public RetryPolicy() {
        this(null);
    }

    public RetryPolicy(@Nullable List<BackoffPolicy> discovered) {
        if (discovered != null) {
            discovered.forEach(p -> register(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent("linear", new LinearBackoffPolicy());
        policies.putIfAbsent("exponential", new ExponentialBackoffPolicy());
    }

    /**
     * 注册或覆盖策略
     */
    public RetryPolicy register(String name, BackoffPolicy policy) {
        if (name == null || name.isBlank() || policy == null) {
            throw new IllegalArgumentException("policy name and instance are required");
        }
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略, 支持 spi:{name} 前缀; 不存在时返回 exponential
     */
    public BackoffPolicy resolve(@Nullable String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get("exponential");
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get("exponential"));
    }

    /**
     * 计算第 attemptNumber 次重试前的等待秒数
     * 先按 maxDelay 截断, 再叠加 ±10% 抖动, 最后应用 0.1s 下限
     */
    public double computeDelay(int attemptNumber, RetryConfig config) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, got " + attemptNumber);
        }
        if (config == null) {
            throw new IllegalArgumentException("config is required");
        }
        double base = policyFor(config).baseDelay(attemptNumber, config);
        if (Double.isNaN(base)) {
            base = config.getMaxDelay();
        }
        double delay = Math.min(base, config.getMaxDelay());
        if (config.isJitter()) {
            delay += delay * ThreadLocalRandom.current().nextDouble(-JITTER_RATIO, JITTER_RATIO);
        }
        return Math.max(MIN_DELAY, delay);
    }

    /** 列出已注册策略 */
    public Set<String> names() {
        return Collections.unmodifiableSet(policies.keySet());
    }

    private BackoffPolicy policyFor(RetryConfig config) {
        BackoffStrategy strategy = config.getStrategy();
        switch (strategy) {
            case FIXED:
                return policies.get("fixed");
            case LINEAR:
                return policies.get("linear");
            case EXPONENTIAL:
                return policies.get("exponential");
            case CUSTOM:
                return config.getCustomPolicy() != null ? config.getCustomPolicy() : policies.get("exponential");
            default:
                throw new IllegalStateException("unhandled strategy " + strategy);
        }
    }

    private static String normalize(String n) {
        return n.toLowerCase(Locale.ROOT).trim();
    }
}
