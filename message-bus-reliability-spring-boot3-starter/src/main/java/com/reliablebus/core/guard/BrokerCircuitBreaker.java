package com.reliablebus.core.guard;

import com.reliablebus.core.notify.NotifyContexts;
import com.reliablebus.core.notify.NotifyingFacade;
import com.reliablebus.model.CircuitBreakerState;
import com.reliablebus.model.enums.Severity;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * 单个仓储的熔断器
 * 基于 resilience4j: 计数窗口 = 阈值, 失败率 100%, 半开只放行一次调用
 * 即连续 failureThreshold 次失败后打开, resetTimeout 之后下一次调用被放行试探
 */
public class BrokerCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(BrokerCircuitBreaker.class);

    private final String name;

    private final int failureThreshold;

    private final Duration resetTimeout;

    private final CircuitBreaker delegate;

    private final Clock clock;

    /** 连续失败次数, 任意一次成功清零 */
    private int failureCount;

    private Instant lastFailureTime;

    public BrokerCircuitBreaker(String name, int failureThreshold, Duration resetTimeout) {
        this(name, failureThreshold, resetTimeout, NotifyingFacade.noop(), "local", Clock.systemUTC());
    }

    public BrokerCircuitBreaker(String name, int failureThreshold, Duration resetTimeout,
                                NotifyingFacade notifier, String instanceId, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (resetTimeout == null || resetTimeout.toMillis() < 1) {
            throw new IllegalArgumentException("resetTimeout must be >= 1ms");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;

        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100f)
                .waitDurationInOpenState(resetTimeout)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordExceptions(Throwable.class)
                .build();
        this.delegate = CircuitBreaker.of("cb:" + name, cfg);

        this.delegate.getEventPublisher().onStateTransition(e -> {
            log.info("[Breaker] {} {}", name, e.getStateTransition());
            if (e.getStateTransition().getToState() == CircuitBreaker.State.OPEN) {
                log.warn("[Breaker] {} opened after {} consecutive failures, resetTimeout={}",
                        name, currentFailureCount(), resetTimeout);
                notifier.fire(NotifyContexts.ctxForCircuitOpened(instanceId, name, currentFailureCount(),
                        failureThreshold, resetTimeout, clock), Severity.ERROR);
            }
        });
    }

    public String getName() {
        return name;
    }

    /**
     * 是否拒绝调用
     * 打开且已超过 resetTimeout 时转为半开并放行恰好下一次调用
     */
    public boolean isOpen() {
        return !delegate.tryAcquirePermission();
    }

    public synchronized void recordSuccess() {
        failureCount = 0;
        delegate.onSuccess(0, TimeUnit.NANOSECONDS);
        if (delegate.getState() != CircuitBreaker.State.CLOSED) {
            delegate.transitionToClosedState();
        }
    }

    public void recordFailure() {
        recordFailure(new IllegalStateException("broker call failed"));
    }

    public synchronized void recordFailure(Throwable error) {
        failureCount++;
        lastFailureTime = clock.instant();
        delegate.onError(0, TimeUnit.NANOSECONDS, error);
    }

    /**
     * 已获取许可但结果不计入统计（如 broker 判定的参数错误）
     */
    public void releasePermission() {
        delegate.releasePermission();
    }

    public synchronized CircuitBreakerState state() {
        CircuitBreaker.State s = delegate.getState();
        return CircuitBreakerState.builder()
                .name(name)
                .state(s.name())
                .open(s == CircuitBreaker.State.OPEN)
                .failureCount(failureCount)
                .lastFailureTime(lastFailureTime)
                .failureThreshold(failureThreshold)
                .resetTimeout(resetTimeout)
                .build();
    }

    private synchronized int currentFailureCount() {
        return failureCount;
    }
}
