package com.reliablebus.core.metric;

import com.reliablebus.model.enums.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 可靠投递指标
 * 所有上报失败只记录日志, 不向调用方传播
 */
public final class ReliabilityMetrics {

    private static final Logger log = LoggerFactory.getLogger(ReliabilityMetrics.class);

    private final MeterRegistry reg;

    private final Counter retryScheduled;
    private final Counter retrySucceeded;
    private final Counter retryFailed;
    private final Counter retryRejected;
    private final Counter dlqAdded;
    private final Counter dlqRemoved;
    private final Counter dlqEvicted;
    private final Counter loopError;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary attempts;

    private ReliabilityMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.retryScheduled = Counter.builder("bus.retry.scheduled").description("retries scheduled").register(reg);
        this.retrySucceeded = Counter.builder("bus.retry.succeeded").description("retries succeeded").register(reg);
        this.retryFailed = Counter.builder("bus.retry.failed").description("retry firings failed").register(reg);
        this.retryRejected = Counter.builder("bus.retry.rejected").description("non-retryable failures").register(reg);
        this.dlqAdded = Counter.builder("bus.dlq.added").description("messages dead-lettered").register(reg);
        this.dlqRemoved = Counter.builder("bus.dlq.removed").description("dead letters removed").register(reg);
        this.dlqEvicted = Counter.builder("bus.dlq.evicted").description("dead letters evicted").register(reg);
        this.loopError = Counter.builder("bus.retry.loop.error").description("retry loop errors").register(reg);
        this.notifySuppressed = Counter.builder("bus.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent = Counter.builder("bus.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("bus.notify.failed").description("notify failed").register(reg);
        this.attempts = DistributionSummary.builder("bus.retry.attempts")
                .description("attempt count per dead-lettered message").baseUnit("times").register(reg);
    }

    public static ReliabilityMetrics create(MeterRegistry reg) {
        return new ReliabilityMetrics(reg);
    }

    /** 未接入注册表时使用 */
    public static ReliabilityMetrics noop() {
        return new ReliabilityMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return reg;
    }

    public void incRetryScheduled() { safe(retryScheduled::increment); }
    public void incRetrySucceeded() { safe(retrySucceeded::increment); }
    public void incRetryFailed() { safe(retryFailed::increment); }
    public void incRetryRejected() { safe(retryRejected::increment); }
    public void incDlqAdded() { safe(dlqAdded::increment); }
    public void incDlqRemoved(long n) { safe(() -> dlqRemoved.increment(n)); }
    public void incDlqEvicted() { safe(dlqEvicted::increment); }
    public void incLoopError() { safe(loopError::increment); }
    public void incNotifySuppressed() { safe(notifySuppressed::increment); }
    public void incNotifySent() { safe(notifySent::increment); }
    public void incNotifyFailed() { safe(notifyFailed::increment); }
    public void recordAttempts(int n) { safe(() -> attempts.record(n)); }

    public void incPublishSuccess(String topic) {
        safe(() -> Counter.builder("bus.publish.success").tag("topic", tag(topic)).register(reg).increment());
    }

    public void incPublishFailure(String topic, ErrorKind kind) {
        safe(() -> Counter.builder("bus.publish.failure")
                .tag("topic", tag(topic))
                .tag("kind", kind == null ? ErrorKind.UNKNOWN.name() : kind.name())
                .register(reg).increment());
    }

    public void recordPublishNanos(String topic, long nanos) {
        safe(() -> Timer.builder("bus.publish.latency").tag("topic", tag(topic)).register(reg)
                .record(nanos, TimeUnit.NANOSECONDS));
    }

    public void recordConsumeNanos(String topic, long nanos) {
        safe(() -> Timer.builder("bus.consume.latency").tag("topic", tag(topic)).register(reg)
                .record(nanos, TimeUnit.NANOSECONDS));
    }

    private static String tag(String v) {
        return v == null ? "unknown" : v;
    }

    private static void safe(Runnable r) {
        try {
            r.run();
        } catch (Exception e) {
            log.warn("[Metrics] emit failed: {}", e.toString());
        }
    }
}
