package com.reliablebus.core.scheduler;

import com.reliablebus.core.spi.RetryCallback;
import com.reliablebus.model.Message;
import com.reliablebus.model.RetryAttempt;
import com.reliablebus.model.RetryConfig;
import com.reliablebus.model.RetryableMessage;
import com.reliablebus.model.DeadLetterEntry;
import com.reliablebus.model.enums.ErrorKind;
import com.reliablebus.model.enums.RetryState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 调度器持有的可变待重试条目, 只在调度器锁内修改
 */
final class PendingRetry {

    final Message message;

    final RetryConfig config;

    final Instant createdAt;

    final List<RetryAttempt> attempts = new ArrayList<>();

    RetryCallback callback;

    Instant nextRetryTime;

    String lastError;

    ErrorKind lastErrorKind;

    RetryState state = RetryState.SCHEDULED;

    /** 每次入队递增, 队列中代数不一致的条目视为过期 */
    long generation;

    /** 本代回调已被派发线程领取 */
    boolean started;

    PendingRetry(Message message, RetryConfig config, RetryCallback callback, Instant createdAt) {
        this.message = message;
        this.config = config;
        this.callback = callback;
        this.createdAt = createdAt;
        this.nextRetryTime = createdAt;
    }

    String id() {
        return message.getMessageId();
    }

    int attemptCount() {
        return attempts.size();
    }

    boolean isExhausted() {
        return attemptCount() >= config.getMaxAttempts();
    }

    RetryableMessage snapshot() {
        return RetryableMessage.builder()
                .message(message)
                .config(config)
                .attempts(List.copyOf(attempts))
                .nextRetryTime(nextRetryTime)
                .createdAt(createdAt)
                .lastError(lastError)
                .lastErrorKind(lastErrorKind)
                .state(state)
                .build();
    }

    DeadLetterEntry toDeadLetter(Instant now) {
        return DeadLetterEntry.builder()
                .message(message)
                .config(config)
                .attempts(List.copyOf(attempts))
                .createdAt(createdAt)
                .lastError(lastError)
                .lastErrorKind(lastErrorKind)
                .deadLetteredAt(now)
                .build();
    }
}
