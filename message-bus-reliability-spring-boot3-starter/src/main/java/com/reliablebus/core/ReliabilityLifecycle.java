package com.reliablebus.core;

import com.reliablebus.config.BrokerGuardProperties;
import com.reliablebus.config.ReliabilityNotifierProperties;
import com.reliablebus.config.ReliabilityProperties;
import com.reliablebus.core.scheduler.RetryScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 随容器启动/停止重试调度器
 */
public class ReliabilityLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ReliabilityLifecycle.class);

    private final RetryScheduler scheduler;

    private final ReliabilityProperties props;

    private final BrokerGuardProperties guardProps;

    private final ReliabilityNotifierProperties notifyProps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReliabilityLifecycle(RetryScheduler scheduler, ReliabilityProperties props,
                                BrokerGuardProperties guardProps, ReliabilityNotifierProperties notifyProps) {
        this.scheduler = scheduler;
        this.props = props;
        this.guardProps = guardProps;
        this.notifyProps = notifyProps;
    }

    @Override
    public void start() {
        if (!props.getScheduler().isEnabled()) {
            log.info("[Reliability] start skipped, scheduler disabled (instance={})", scheduler.getInstanceId());
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        // 启动信息（一次性）
        try {
            log.info("┌──────────────────────────────────────────────");
            log.info("│ Reliable delivery starting...");
            log.info("├──────────────────────────────────────────────");
            log.info("│ instanceId            : {}", scheduler.getInstanceId());
            log.info("│ retry.maxAttempts     : {}", props.getRetry().getMaxAttempts());
            log.info("│ retry.strategy        : {}", props.getRetry().getStrategy());
            log.info("│ retry.initialDelay    : {} s", props.getRetry().getInitialDelay());
            log.info("│ retry.maxDelay        : {} s", props.getRetry().getMaxDelay());
            log.info("│ retry.jitter          : {}", props.getRetry().isJitter());
            log.info("│ scheduler.pollInterval: {} ms", props.getScheduler().getPollInterval().toMillis());
            log.info("│ scheduler.cbTimeout   : {} ms", props.getScheduler().getCallbackTimeout().toMillis());
            log.info("│ dlq.maxSize           : {}", props.getDlq().getMaxSize());
            log.info("│ cb.failureThreshold   : {}", guardProps.getCircuitBreaker().getFailureThreshold());
            log.info("│ cb.resetTimeout       : {} ms", guardProps.getCircuitBreaker().getResetTimeout().toMillis());
            log.info("│ notifier.enabled      : {}", notifyProps.isEnabled());
            log.info("└──────────────────────────────────────────────");
        } catch (RuntimeException t) {
            // 启动日志打印本身不应阻断启动
            log.warn("[Reliability] failed to render startup banner: {}", t.toString());
        }
        scheduler.start();
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Reliability] stop skipped: not running (instance={})", scheduler.getInstanceId());
            return;
        }
        log.info("[Reliability] stopping... (instance={})", scheduler.getInstanceId());
        try {
            scheduler.shutdown(props.getShutdown().getAwait().toSeconds());
        } finally {
            log.info("[Reliability] stopped (instance={})", scheduler.getInstanceId());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
