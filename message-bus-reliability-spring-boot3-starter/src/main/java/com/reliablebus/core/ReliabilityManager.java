package com.reliablebus.core;

import com.reliablebus.core.scheduler.RetryScheduler;
import com.reliablebus.core.spi.DeadLetterStore;
import com.reliablebus.core.spi.RetryCallback;
import com.reliablebus.model.DeadLetterEntry;
import com.reliablebus.model.Message;
import com.reliablebus.model.RetryConfig;
import com.reliablebus.model.RetryableMessage;
import com.reliablebus.model.stats.ReliabilityStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 可靠投递门面: 组合重试调度器与死信存储
 * 发送失败时交给 {@link #handleFailure}, 运维通过死信相关方法查看与重投
 */
public class ReliabilityManager {

    private static final Logger log = LoggerFactory.getLogger(ReliabilityManager.class);

    private final RetryScheduler scheduler;

    private final DeadLetterStore deadLetterStore;

    /** 调用方未指定时使用 */
    private final RetryConfig defaultConfig;

    public ReliabilityManager(RetryScheduler scheduler, DeadLetterStore deadLetterStore, RetryConfig defaultConfig) {
        this.scheduler = scheduler;
        this.deadLetterStore = deadLetterStore;
        this.defaultConfig = defaultConfig == null ? RetryConfig.defaults() : defaultConfig;
    }

    public void start() {
        scheduler.start();
    }

    public void shutdown(long awaitSecond) {
        scheduler.shutdown(awaitSecond);
    }

    public RetryConfig getDefaultConfig() {
        return defaultConfig;
    }

    public boolean handleFailure(Message message, Throwable error, RetryCallback callback) {
        return handleFailure(message, error, callback, null);
    }

    /**
     * @return true 已安排重试; false 不可重试或已进入死信
     */
    public boolean handleFailure(Message message, Throwable error, RetryCallback callback, RetryConfig config) {
        return scheduler.scheduleRetry(message, error, config == null ? defaultConfig : config, callback);
    }

    /**
     * 按 createdAt 倒序
     */
    public List<DeadLetterEntry> listDeadLetters(int limit, int offset) {
        return deadLetterStore.list(limit, offset);
    }

    public Optional<DeadLetterEntry> getDeadLetter(String messageId) {
        return deadLetterStore.get(messageId);
    }

    /**
     * 从死信中取出并以原配置、全新的重试预算立即重投
     *
     * @return false 不在死信中, 或调度器已停机（条目保留在死信中）
     */
    public boolean reprocess(String messageId, RetryCallback callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback is required");
        }
        Optional<DeadLetterEntry> entry = deadLetterStore.get(messageId);
        if (entry.isEmpty()) {
            return false;
        }
        if (!scheduler.isAccepting()) {
            log.warn("[Reliability] reprocess of message={} refused, scheduler is shut down", messageId);
            return false;
        }
        if (!deadLetterStore.remove(messageId)) {
            // 并发重投已取走
            return false;
        }
        if (!scheduler.resubmit(entry.get(), callback)) {
            deadLetterStore.add(entry.get());
            log.warn("[Reliability] reprocess of message={} failed, entry returned to DLQ", messageId);
            return false;
        }
        log.info("[Reliability] message={} reprocessed, previous attempts={}", messageId, entry.get().getAttemptCount());
        return true;
    }

    public boolean cancelRetry(String messageId) {
        return scheduler.cancelRetry(messageId);
    }

    public List<RetryableMessage> listPendingRetries() {
        return scheduler.listPending();
    }

    public Optional<RetryableMessage> getPendingRetry(String messageId) {
        return scheduler.getPending(messageId);
    }

    /**
     * @return 清除的死信数
     */
    public int purgeDeadLetters() {
        int n = deadLetterStore.clear();
        log.info("[Reliability] purged {} dead letters", n);
        return n;
    }

    public ReliabilityStats stats() {
        return new ReliabilityStats(scheduler.stats(), deadLetterStore.stats());
    }
}
