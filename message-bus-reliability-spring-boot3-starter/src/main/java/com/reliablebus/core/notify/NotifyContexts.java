package com.reliablebus.core.notify;

import com.reliablebus.model.DeadLetterEntry;
import com.reliablebus.model.Message;
import com.reliablebus.model.ctx.NotifyContext;
import com.reliablebus.model.enums.ErrorKind;
import com.reliablebus.model.enums.NotifyEventType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 告警上下文构造
 */
public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    public static NotifyContext ctxForDeadLetter(String instanceId, DeadLetterEntry e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("createdAt", String.valueOf(e.getCreatedAt()));
        attrs.put("deadLetteredAt", String.valueOf(e.getDeadLetteredAt()));
        return NotifyContext.builder()
                .type(NotifyEventType.DEAD_LETTER)
                .instanceId(instanceId)
                .component("retry-scheduler")
                .messageId(e.getMessageId())
                .topic(e.getMessage().getTopic())
                .attemptCount(e.getAttemptCount())
                .maxAttempts(e.getConfig().getMaxAttempts())
                .reasonCode(kindName(e.getLastErrorKind()))
                .lastError(truncate(e.getLastError()))
                .when(Instant.now(clock))
                .attributes(attrs)
                .build();
    }

    public static NotifyContext ctxForEvicted(String instanceId, DeadLetterEntry e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("createdAt", String.valueOf(e.getCreatedAt()));
        return NotifyContext.builder()
                .type(NotifyEventType.DEAD_LETTER_EVICTED)
                .instanceId(instanceId)
                .component("dlq")
                .messageId(e.getMessageId())
                .topic(e.getMessage().getTopic())
                .attemptCount(e.getAttemptCount())
                .reasonCode("EVICTED")
                .lastError(truncate(e.getLastError()))
                .when(Instant.now(clock))
                .attributes(attrs)
                .build();
    }

    public static NotifyContext ctxForNonRetryable(String instanceId, Message m, ErrorKind kind,
                                                   Throwable error, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("nonRetryable", true);
        return NotifyContext.builder()
                .type(NotifyEventType.NON_RETRYABLE_FAILED)
                .instanceId(instanceId)
                .component("retry-scheduler")
                .messageId(m.getMessageId())
                .topic(m.getTopic())
                .reasonCode(kindName(kind))
                .lastError(truncate(toError(error)))
                .when(Instant.now(clock))
                .attributes(attrs)
                .build();
    }

    public static NotifyContext ctxForCircuitOpened(String instanceId, String breakerName, int failureCount,
                                                    int threshold, Duration resetTimeout, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("failureCount", failureCount);
        attrs.put("failureThreshold", threshold);
        attrs.put("resetTimeout", String.valueOf(resetTimeout));
        return NotifyContext.builder()
                .type(NotifyEventType.CIRCUIT_OPENED)
                .instanceId(instanceId)
                .component("breaker:" + breakerName)
                .reasonCode("CIRCUIT_OPEN")
                .when(Instant.now(clock))
                .attributes(attrs)
                .build();
    }

    public static NotifyContext ctxForEngineError(String instanceId, String component, String op,
                                                  Throwable error, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("op", op);
        return NotifyContext.builder()
                .type(NotifyEventType.ENGINE_ERROR)
                .instanceId(instanceId)
                .component(component)
                .reasonCode("ENGINE_ERROR")
                .lastError(truncate(toError(error)))
                .when(Instant.now(clock))
                .attributes(attrs)
                .build();
    }

    private static String kindName(ErrorKind kind) {
        return kind == null ? ErrorKind.UNKNOWN.name() : kind.name();
    }

    private static String toError(Throwable e) {
        if (e == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(e.getClass().getName())
                .append(": ").append(e.getMessage() == null ? "" : e.getMessage());
        // 只取前10行堆栈
        StackTraceElement[] stack = e.getStackTrace();
        int n = Math.min(stack.length, 10);
        for (int i = 0; i < n; i++) {
            sb.append("\n  at ").append(stack[i]);
        }
        return sb.toString();
    }

    private static String truncate(String s) {
        if (s == null) {
            return null;
        }
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}
