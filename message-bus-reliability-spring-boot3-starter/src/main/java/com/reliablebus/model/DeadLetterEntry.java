package com.reliablebus.model;

import com.reliablebus.model.enums.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 死信条目, 重试耗尽后由调度器移交
 */
@Value
@Builder
public class DeadLetterEntry {

    Message message;

    RetryConfig config;

    /** 完整失败历史 */
    List<RetryAttempt> attempts;

    /** 首次进入重试的时间, 淘汰按此排序 */
    Instant createdAt;

    String lastError;

    ErrorKind lastErrorKind;

    Instant deadLetteredAt;

    public String getMessageId() {
        return message.getMessageId();
    }

    public int getAttemptCount() {
        return attempts.size();
    }
}
