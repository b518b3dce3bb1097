package com.reliablebus.model;

import com.reliablebus.model.enums.ErrorKind;
import com.reliablebus.model.enums.RetryState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 待重试消息快照（调度器内部状态的只读副本）
 */
@Value
@Builder
public class RetryableMessage {

    Message message;

    RetryConfig config;

    List<RetryAttempt> attempts;

    Instant nextRetryTime;

    Instant createdAt;

    String lastError;

    ErrorKind lastErrorKind;

    RetryState state;

    public String getMessageId() {
        return message.getMessageId();
    }

    public int getAttemptCount() {
        return attempts.size();
    }

    public boolean isExhausted() {
        return getAttemptCount() >= config.getMaxAttempts();
    }
}
