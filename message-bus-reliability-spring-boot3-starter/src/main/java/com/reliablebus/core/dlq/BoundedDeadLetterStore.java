package com.reliablebus.core.dlq;

import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.notify.NotifyContexts;
import com.reliablebus.core.notify.NotifyingFacade;
import com.reliablebus.core.spi.DeadLetterStore;
import com.reliablebus.model.DeadLetterEntry;
import com.reliablebus.model.enums.Severity;
import com.reliablebus.model.stats.DeadLetterStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 有界内存死信存储, 读写锁保护
 */
public class BoundedDeadLetterStore implements DeadLetterStore {

    private static final Logger log = LoggerFactory.getLogger(BoundedDeadLetterStore.class);

    private static final Comparator<DeadLetterEntry> BY_CREATED =
            Comparator.comparing(DeadLetterEntry::getCreatedAt).thenComparing(DeadLetterEntry::getMessageId);

    private final int maxSize;

    private final Map<String, DeadLetterEntry> entries = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ReliabilityMetrics metrics;

    private final NotifyingFacade notifier;

    private final String instanceId;

    private final Clock clock;

    // 生命周期计数, 单调递增; 写锁内修改
    private long addedCount;
    private long evictedCount;
    private long removedCount;
    private long clearedCount;

    public BoundedDeadLetterStore(int maxSize) {
        this(maxSize, ReliabilityMetrics.noop(), NotifyingFacade.noop(), "local", Clock.systemUTC());
    }

    public BoundedDeadLetterStore(int maxSize, ReliabilityMetrics metrics, NotifyingFacade notifier,
                                  String instanceId, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("dlq.max-size must be >= 1, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.metrics = metrics;
        this.notifier = notifier;
        this.instanceId = instanceId;
        this.clock = clock;
    }

    @Override
    public void add(DeadLetterEntry entry) {
        if (entry == null || entry.getMessage() == null) {
            throw new IllegalArgumentException("entry is required");
        }
        DeadLetterEntry evicted = null;
        lock.writeLock().lock();
        try {
            // 同 id 覆盖, 不触发淘汰
            if (!entries.containsKey(entry.getMessageId()) && entries.size() >= maxSize) {
                evicted = entries.values().stream().min(BY_CREATED).orElse(null);
                if (evicted != null) {
                    entries.remove(evicted.getMessageId());
                    evictedCount++;
                }
            }
            entries.put(entry.getMessageId(), entry);
            addedCount++;
        } finally {
            lock.writeLock().unlock();
        }

        metrics.incDlqAdded();
        if (evicted != null) {
            metrics.incDlqEvicted();
            log.warn("[DLQ] full (maxSize={}), evicted oldest message={}, topic={}",
                    maxSize, evicted.getMessageId(), evicted.getMessage().getTopic());
            notifier.fire(NotifyContexts.ctxForEvicted(instanceId, evicted, clock), Severity.WARNING);
        }
    }

    @Override
    public Optional<DeadLetterEntry> get(String messageId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(messageId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean remove(String messageId) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = entries.remove(messageId) != null;
            if (removed) {
                removedCount++;
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            metrics.incDlqRemoved(1);
        }
        return removed;
    }

    @Override
    public List<DeadLetterEntry> list(int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must be >= 0");
        }
        lock.readLock().lock();
        try {
            return entries.values().stream()
                    .sorted(BY_CREATED.reversed())
                    .skip(offset)
                    .limit(limit)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int clear() {
        int n;
        lock.writeLock().lock();
        try {
            n = entries.size();
            entries.clear();
            clearedCount += n;
        } finally {
            lock.writeLock().unlock();
        }
        if (n > 0) {
            metrics.incDlqRemoved(n);
            log.info("[DLQ] cleared {} entries", n);
        }
        return n;
    }

    @Override
    public DeadLetterStats stats() {
        lock.readLock().lock();
        try {
            return DeadLetterStats.builder()
                    .total(entries.size())
                    .maxSize(maxSize)
                    .addedCount(addedCount)
                    .evictedCount(evictedCount)
                    .removedCount(removedCount)
                    .clearedCount(clearedCount)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }
}
