package com.reliablebus.model;

import com.reliablebus.model.enums.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 单次重试记录, 只追加
 */
@Value
@Builder
public class RetryAttempt {

    /** 从1开始 */
    int attemptNumber;

    Instant timestamp;

    ErrorKind errorKind;

    String errorMessage;

    /** 本次重试前的等待（秒） */
    double delayBeforeRetry;
}
