package com.reliablebus.model.enums;

import java.util.Locale;

/**
 * 退避策略
 */
public enum BackoffStrategy {
    FIXED, LINEAR, EXPONENTIAL, CUSTOM;

    /** 配置中大小写均可 */
    public static BackoffStrategy from(String v) {
        return BackoffStrategy.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
