package com.reliablebus.core.scheduler;

import com.reliablebus.core.backoff.RetryPolicy;
import com.reliablebus.core.failure.BrokerErrorTranslator;
import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.notify.NotifyContexts;
import com.reliablebus.core.notify.NotifyingFacade;
import com.reliablebus.core.spi.DeadLetterStore;
import com.reliablebus.core.spi.RetryCallback;
import com.reliablebus.exception.BusException;
import com.reliablebus.model.DeadLetterEntry;
import com.reliablebus.model.Message;
import com.reliablebus.model.RetryAttempt;
import com.reliablebus.model.RetryConfig;
import com.reliablebus.model.RetryableMessage;
import com.reliablebus.model.enums.ErrorKind;
import com.reliablebus.model.enums.RetryState;
import com.reliablebus.model.enums.Severity;
import com.reliablebus.model.stats.SchedulerStats;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 重试调度器
 * - 待重试条目按消息id存放, 工作队列按 (到期时间, id, 代数) 排序, 出队时按id回查并丢弃过期条目
 * - 时间轮单线程按 pollInterval 驱动到期循环
 * - 回调在 handler 线程池中执行, 不持有调度器锁, 受 callbackTimeout 约束
 * - 是否耗尽只在 {@link #scheduleRetry} 中判定
 */
public class RetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    private static final long ANY_GENERATION = -1L;

    /** 时间轮 */
    private final HashedWheelTimer timer;

    /** 到期条目派发线程池 */
    private final ExecutorService dispatchExecutor;

    /** 回调执行线程池 */
    private final ExecutorService handlerExecutor;

    private final RetryPolicy policy;

    private final DeadLetterStore deadLetterStore;

    private final BrokerErrorTranslator translator;

    private final ReliabilityMetrics metrics;

    private final NotifyingFacade notifier;

    private final Clock clock;

    /** 节点id */
    private final String instanceId;

    private final Duration pollInterval;

    private final Duration callbackTimeout;

    /** 保护 pending 的增删改 */
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, PendingRetry> pending = new HashMap<>();

    private final PriorityBlockingQueue<DueEntry> queue = new PriorityBlockingQueue<>();

    private final AtomicLong seq = new AtomicLong();

    /** 到期循环是否运行 */
    private final AtomicBoolean running = new AtomicBoolean(false);

    /** 已停机, 不再接受调度 */
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private volatile Timeout tickTimeout;

    private final AtomicLong scheduledCount = new AtomicLong();
    private final AtomicLong succeededCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final AtomicLong deadLetteredCount = new AtomicLong();
    private final AtomicLong cancelledCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();

    public RetryScheduler(HashedWheelTimer timer,
                          ExecutorService dispatchExecutor,
                          ExecutorService handlerExecutor,
                          RetryPolicy policy,
                          DeadLetterStore deadLetterStore,
                          BrokerErrorTranslator translator,
                          ReliabilityMetrics metrics,
                          NotifyingFacade notifier,
                          Clock clock,
                          String instanceId,
                          Duration pollInterval,
                          Duration callbackTimeout) {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("scheduler.poll-interval must be > 0");
        }
        if (callbackTimeout == null || callbackTimeout.isNegative() || callbackTimeout.isZero()) {
            throw new IllegalArgumentException("scheduler.callback-timeout must be > 0");
        }
        this.timer = timer;
        this.dispatchExecutor = dispatchExecutor;
        this.handlerExecutor = handlerExecutor;
        this.policy = policy;
        this.deadLetterStore = deadLetterStore;
        this.translator = translator;
        this.metrics = metrics;
        this.notifier = notifier;
        this.clock = clock;
        this.instanceId = instanceId;
        this.pollInterval = pollInterval;
        this.callbackTimeout = callbackTimeout;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public boolean isRunning() {
        return running.get();
    }

    /** 是否仍接受调度 */
    public boolean isAccepting() {
        return !terminated.get();
    }

    /**
     * 记录一次失败并安排下一次重试
     *
     * @return true 已安排; false 不可重试或已耗尽（已移入死信）
     */
    public boolean scheduleRetry(Message message, Throwable error, RetryConfig config, RetryCallback callback) {
        if (message == null || message.getMessageId() == null) {
            throw new IllegalArgumentException("message with id is required");
        }
        if (config == null || callback == null) {
            throw new IllegalArgumentException("config and callback are required");
        }
        return record(message, error, config, callback, ANY_GENERATION);
    }

    /**
     * @param expectedGeneration 回调失败路径传入派发时的代数, 条目已被取消或取代时不再调度
     */
    private boolean record(Message message, Throwable error, RetryConfig config, RetryCallback callback,
                           long expectedGeneration) {
        ensureAccepting();

        ErrorKind kind = translator.kindOf(error);
        String errMsg = describe(error);
        String id = message.getMessageId();
        Instant now = clock.instant();

        DeadLetterEntry dead = null;
        double delay = 0;
        int attemptNumber = 0;
        boolean rejected = false;

        lock.lock();
        try {
            PendingRetry entry = pending.get(id);
            if (expectedGeneration != ANY_GENERATION
                    && (entry == null || entry.generation != expectedGeneration)) {
                log.debug("[Retry-Scheduler] failure for message={} ignored, entry cancelled or superseded", id);
                return false;
            }
            RetryConfig effective = entry != null ? entry.config : config;
            if (!effective.isRetryable(kind)) {
                rejected = true;
                // 重试途中出现不可重试错误, 已有历史转入死信
                if (entry != null) {
                    pending.remove(id);
                    entry.lastError = errMsg;
                    entry.lastErrorKind = kind;
                    dead = entry.toDeadLetter(now);
                }
            } else {
                if (entry == null) {
                    entry = new PendingRetry(message, config, callback, now);
                    pending.put(id, entry);
                } else {
                    entry.callback = callback;
                }
                entry.lastError = errMsg;
                entry.lastErrorKind = kind;

                if (entry.isExhausted()) {
                    pending.remove(id);
                    dead = entry.toDeadLetter(now);
                } else {
                    attemptNumber = entry.attemptCount() + 1;
                    delay = policy.computeDelay(attemptNumber, entry.config);
                    entry.attempts.add(RetryAttempt.builder()
                            .attemptNumber(attemptNumber)
                            .timestamp(now)
                            .errorKind(kind)
                            .errorMessage(errMsg)
                            .delayBeforeRetry(delay)
                            .build());
                    entry.nextRetryTime = now.plusMillis(Math.round(delay * 1000));
                    entry.state = RetryState.SCHEDULED;
                    entry.started = false;
                    entry.generation++;
                    queue.offer(new DueEntry(entry.nextRetryTime.toEpochMilli(), seq.incrementAndGet(),
                            id, entry.generation));
                }
            }
        } finally {
            lock.unlock();
        }

        if (rejected) {
            rejectedCount.incrementAndGet();
            metrics.incRetryRejected();
            log.warn("[Retry-Scheduler] non-retryable failure, message={}, topic={}, kind={}, err={}",
                    id, message.getTopic(), kind, errMsg);
            notifier.fire(NotifyContexts.ctxForNonRetryable(instanceId, message, kind, error, clock), Severity.WARNING);
            if (dead != null) {
                moveToDeadLetter(dead);
            }
            return false;
        }
        if (dead != null) {
            moveToDeadLetter(dead);
            return false;
        }
        scheduledCount.incrementAndGet();
        metrics.incRetryScheduled();
        log.debug("[Retry-Scheduler] scheduled message={} attempt={} delay={}s kind={}",
                id, attemptNumber, delay, kind);
        return true;
    }

    /**
     * 死信重新投递: 新建无历史的条目, 立即到期
     *
     * @return false 已停机
     */
    public boolean resubmit(DeadLetterEntry deadLetter, RetryCallback callback) {
        if (deadLetter == null || callback == null) {
            throw new IllegalArgumentException("dead letter entry and callback are required");
        }
        if (terminated.get()) {
            return false;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            PendingRetry entry = new PendingRetry(deadLetter.getMessage(), deadLetter.getConfig(), callback, now);
            PendingRetry previous = pending.put(entry.id(), entry);
            // 旧条目的队列项因代数不同而失效
            entry.generation = previous == null ? 1 : previous.generation + 1;
            queue.offer(new DueEntry(now.toEpochMilli(), seq.incrementAndGet(), entry.id(), entry.generation));
        } finally {
            lock.unlock();
        }
        log.info("[Retry-Scheduler] resubmitted dead letter message={}, topic={}",
                deadLetter.getMessageId(), deadLetter.getMessage().getTopic());
        return true;
    }

    /**
     * 取消待重试; 队列中残留的条目出队时被忽略
     */
    public boolean cancelRetry(String messageId) {
        PendingRetry removed;
        lock.lock();
        try {
            removed = pending.remove(messageId);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            cancelledCount.incrementAndGet();
            log.info("[Retry-Scheduler] cancelled message={} after {} attempts", messageId, removed.attemptCount());
            return true;
        }
        return false;
    }

    public Optional<RetryableMessage> getPending(String messageId) {
        lock.lock();
        try {
            PendingRetry p = pending.get(messageId);
            return p == null ? Optional.empty() : Optional.of(p.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按下次重试时间升序
     */
    public List<RetryableMessage> listPending() {
        List<RetryableMessage> out;
        lock.lock();
        try {
            out = new ArrayList<>(pending.size());
            for (PendingRetry p : pending.values()) {
                out.add(p.snapshot());
            }
        } finally {
            lock.unlock();
        }
        out.sort(Comparator.comparing(RetryableMessage::getNextRetryTime));
        return out;
    }

    public SchedulerStats stats() {
        int size;
        lock.lock();
        try {
            size = pending.size();
        } finally {
            lock.unlock();
        }
        return SchedulerStats.builder()
                .pending(size)
                .queued(queue.size())
                .running(running.get())
                .scheduledCount(scheduledCount.get())
                .succeededCount(succeededCount.get())
                .failedCount(failedCount.get())
                .deadLetteredCount(deadLetteredCount.get())
                .cancelledCount(cancelledCount.get())
                .rejectedCount(rejectedCount.get())
                .build();
    }

    /**
     * 启动到期循环
     */
    public void start() {
        ensureAccepting();
        if (!running.compareAndSet(false, true)) {
            return;
        }
        arm();
        log.info("[Retry-Scheduler] started, pollInterval={}ms, callbackTimeout={}ms, instance={}",
                pollInterval.toMillis(), callbackTimeout.toMillis(), instanceId);
    }

    /**
     * 停止循环, 关闭线程池并等待在途回调; 未到期条目保留在内存中
     */
    public void shutdown(long awaitSecond) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        Timeout t = tickTimeout;
        if (t != null) {
            t.cancel();
        }
        Set<Timeout> unprocessed = timer.stop();
        long ticks = unprocessed.stream().filter(u -> u.task() instanceof SchedulerTask).count();

        dispatchExecutor.shutdown();
        handlerExecutor.shutdown();
        long awaitMs = Math.max(1, awaitSecond) * 1000L;
        try {
            if (!dispatchExecutor.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                dispatchExecutor.shutdownNow();
                log.warn("[Retry-Scheduler] dispatchExecutor forced shutdown after {}s", awaitSecond);
            }
            if (!handlerExecutor.awaitTermination(Math.min(2000, awaitMs), TimeUnit.MILLISECONDS)) {
                handlerExecutor.shutdownNow();
                log.warn("[Retry-Scheduler] handlerExecutor forced shutdown");
            }
        } catch (InterruptedException ie) {
            dispatchExecutor.shutdownNow();
            handlerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Retry-Scheduler] graceful shutdown done, pendingRetries={}, cancelledTicks={}",
                stats().getPending(), ticks);
    }

    /**
     * 到期循环的单次执行: 弹出所有到期条目并派发
     * 派发后挂一个看门条目, 到期时回调仍未被领取则重新派发
     */
    void tick() {
        long now = clock.millis();
        while (true) {
            DueEntry head = queue.peek();
            if (head == null || head.dueMillis > now) {
                return;
            }
            DueEntry e = queue.poll();
            if (e == null) {
                return;
            }
            if (e.dueMillis > now) {
                // 提前弹出, 放回
                queue.offer(e);
                return;
            }
            PendingRetry p;
            Message message;
            RetryCallback callback;
            boolean redispatch;
            lock.lock();
            try {
                p = pending.get(e.messageId);
                if (p == null || p.generation != e.generation) {
                    // 已取消/已被新调度取代
                    continue;
                }
                if (p.state == RetryState.IN_FLIGHT && p.started) {
                    continue;
                }
                redispatch = p.state == RetryState.IN_FLIGHT;
                p.state = RetryState.IN_FLIGHT;
                p.started = false;
                message = p.message;
                callback = p.callback;
            } finally {
                lock.unlock();
            }
            if (redispatch) {
                metrics.incLoopError();
                log.warn("[Retry-Scheduler] dispatch of message={} never started, redispatching", e.messageId);
            }
            dispatch(message, callback, e.generation);
        }
    }

    private void loop() {
        try {
            tick();
        } catch (Throwable t) {
            metrics.incLoopError();
            log.error("[Retry-Scheduler] due loop error", t);
            notifier.fire(NotifyContexts.ctxForEngineError(instanceId, "retry-scheduler", "tick", t, clock),
                    Severity.ERROR);
        } finally {
            if (running.get()) {
                arm();
            }
        }
    }

    private void arm() {
        try {
            tickTimeout = timer.newTimeout(new SchedulerTask(instanceId, this::loop),
                    pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (IllegalStateException e) {
            // 时间轮已停止
            running.set(false);
            log.warn("[Retry-Scheduler] timer stopped, due loop halted: {}", e.getMessage());
        }
    }

    /**
     * 线程池调度执行回调
     */
    private void dispatch(Message message, RetryCallback callback, long generation) {
        String id = message.getMessageId();
        try {
            dispatchExecutor.execute(() -> fire(message, callback, generation));
        } catch (RejectedExecutionException ree) {
            // 放回队列, 下一轮再试
            Instant retryAt = clock.instant().plus(pollInterval);
            lock.lock();
            try {
                PendingRetry p = pending.get(id);
                if (p != null && p.generation == generation && !p.started) {
                    p.state = RetryState.SCHEDULED;
                    p.nextRetryTime = retryAt;
                    queue.offer(new DueEntry(retryAt.toEpochMilli(), seq.incrementAndGet(), id, generation));
                }
            } finally {
                lock.unlock();
            }
            metrics.incLoopError();
            log.error("[Retry-Scheduler] dispatch rejected, message={} requeued", id);
            notifier.fire(NotifyContexts.ctxForEngineError(instanceId, "retry-scheduler", "dispatch", ree, clock),
                    Severity.ERROR);
            return;
        }
        // 拒绝策略可能静默丢弃任务
        long watchAt = clock.millis() + callbackTimeout.toMillis() + pollInterval.toMillis();
        lock.lock();
        try {
            PendingRetry p = pending.get(id);
            if (p != null && p.generation == generation && !p.started) {
                queue.offer(new DueEntry(watchAt, seq.incrementAndGet(), id, generation));
            }
        } finally {
            lock.unlock();
        }
    }

    private void fire(Message message, RetryCallback callback, long generation) {
        String id = message.getMessageId();
        lock.lock();
        try {
            PendingRetry p = pending.get(id);
            if (p == null || p.generation != generation || p.started) {
                // 已取消/已被取代/重复派发
                return;
            }
            p.started = true;
        } finally {
            lock.unlock();
        }
        Throwable failure;
        Future<Boolean> f = null;
        try {
            f = handlerExecutor.submit(() -> callback.attempt(message));
            boolean ok = f.get(callbackTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (ok) {
                onSuccess(id, generation);
                return;
            }
            failure = new BusException(ErrorKind.UNKNOWN, "retry callback returned false");
        } catch (TimeoutException te) {
            f.cancel(true);
            failure = new TimeoutException("retry callback timed out after " + callbackTimeout.toMillis() + "ms");
        } catch (ExecutionException ee) {
            failure = ee.getCause() == null ? ee : ee.getCause();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            failure = ie;
        } catch (RejectedExecutionException ree) {
            failure = ree;
        }
        onFailure(id, generation, failure);
    }

    private void onSuccess(String id, long generation) {
        PendingRetry removed = null;
        lock.lock();
        try {
            PendingRetry p = pending.get(id);
            if (p != null && p.generation == generation) {
                removed = pending.remove(id);
            }
        } finally {
            lock.unlock();
        }
        succeededCount.incrementAndGet();
        metrics.incRetrySucceeded();
        if (removed == null) {
            log.info("[Retry-Scheduler] retry succeeded, message={}, entry already cancelled or superseded", id);
            return;
        }
        log.info("[Retry-Scheduler] retry succeeded, message={}, attempts={}", id, removed.attemptCount());
    }

    private void onFailure(String id, long generation, Throwable failure) {
        failedCount.incrementAndGet();
        metrics.incRetryFailed();
        PendingRetry p;
        lock.lock();
        try {
            p = pending.get(id);
        } finally {
            lock.unlock();
        }
        if (p == null || p.generation != generation) {
            log.debug("[Retry-Scheduler] failure for message={} ignored, entry cancelled or superseded", id);
            return;
        }
        log.info("[Retry-Scheduler] retry failed, message={}, err={}", id, describe(failure));
        try {
            record(p.message, failure, p.config, p.callback, generation);
        } catch (IllegalStateException stopped) {
            log.warn("[Retry-Scheduler] scheduler stopped, message={} left pending", id);
        }
    }

    private void moveToDeadLetter(DeadLetterEntry dead) {
        deadLetteredCount.incrementAndGet();
        metrics.recordAttempts(dead.getAttemptCount());
        try {
            deadLetterStore.add(dead);
        } catch (RuntimeException e) {
            metrics.incLoopError();
            log.error("[Retry-Scheduler] failed to store dead letter message={}", dead.getMessageId(), e);
            notifier.fire(NotifyContexts.ctxForEngineError(instanceId, "dlq", "add", e, clock), Severity.CRITICAL);
            return;
        }
        log.warn("[Retry-Scheduler] message={} moved to DLQ after {} attempts, topic={}, lastError={}",
                dead.getMessageId(), dead.getAttemptCount(), dead.getMessage().getTopic(), dead.getLastError());
        notifier.fire(NotifyContexts.ctxForDeadLetter(instanceId, dead, clock), Severity.ERROR);
    }

    private void ensureAccepting() {
        if (terminated.get()) {
            throw new IllegalStateException("retry scheduler is shut down");
        }
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "null";
        }
        String m = t.getMessage();
        String s = t.getClass().getSimpleName() + (m == null || m.isBlank() ? "" : ": " + m);
        // 截断 4000 字符
        return s.length() > 4000 ? s.substring(0, 4000) : s;
    }
}
