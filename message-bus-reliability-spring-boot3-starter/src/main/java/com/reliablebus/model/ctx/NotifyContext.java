package com.reliablebus.model.ctx;

import com.reliablebus.model.enums.NotifyEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 告警事件上下文
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotifyContext {

    private NotifyEventType type;

    /** 产生事件的节点 */
    private String instanceId;

    /** 产生事件的组件, 如 retry-scheduler / dlq / breaker:message-repository */
    private String component;

    private String messageId;

    private String topic;

    private Integer attemptCount;

    private Integer maxAttempts;

    // 错误类型, 如 TIMEOUT / BROKER_UNAVAILABLE
    private String reasonCode;

    // 可被截断
    private String lastError;

    private Instant when;

    // 额外字段: nextRetryTime、failureCount 等
    private Map<String, Object> attributes;
}
