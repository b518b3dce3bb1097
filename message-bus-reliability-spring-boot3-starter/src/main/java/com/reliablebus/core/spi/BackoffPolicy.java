package com.reliablebus.core.spi;

import com.reliablebus.model.RetryConfig;

/**
 * 回退策略（计算基础延迟, 单位秒）
 * 上限截断、抖动与下限由 RetryPolicy 统一处理
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * @param attemptNumber 第几次重试, 从1开始
     * @param config        当前消息的重试配置
     * @return 未截断的基础延迟（秒）
     */
    double baseDelay(int attemptNumber, RetryConfig config);
}
