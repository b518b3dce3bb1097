package com.reliablebus.core.scheduler;

import com.reliablebus.core.backoff.RetryPolicy;
import com.reliablebus.core.dlq.BoundedDeadLetterStore;
import com.reliablebus.core.failure.BrokerErrorTranslator;
import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.notify.NotifyingFacade;
import com.reliablebus.core.spi.RetryCallback;
import com.reliablebus.exception.MessageValidationException;
import com.reliablebus.model.DeadLetterEntry;
import com.reliablebus.model.Message;
import com.reliablebus.model.RetryAttempt;
import com.reliablebus.model.RetryConfig;
import com.reliablebus.model.RetryableMessage;
import com.reliablebus.model.enums.ErrorKind;
import com.reliablebus.model.enums.RetryState;
import com.reliablebus.support.MutableClock;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class RetrySchedulerTest {

    private MutableClock clock;
    private BoundedDeadLetterStore dlq;
    private RetryScheduler scheduler;

    private static final RetryConfig NO_JITTER = RetryConfig.builder()
            .maxAttempts(3)
            .initialDelay(1.0)
            .backoffMultiplier(2.0)
            .jitter(false)
            .build();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        dlq = new BoundedDeadLetterStore(100);
        scheduler = newScheduler(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown(1);
    }

    private RetryScheduler newScheduler(Duration callbackTimeout) {
        return newScheduler(callbackTimeout, Executors.newFixedThreadPool(2), new BrokerErrorTranslator());
    }

    private RetryScheduler newScheduler(Duration callbackTimeout, ExecutorService dispatchPool,
                                        BrokerErrorTranslator translator) {
        return new RetryScheduler(
                new HashedWheelTimer(5, TimeUnit.MILLISECONDS),
                dispatchPool,
                Executors.newFixedThreadPool(2),
                new RetryPolicy(),
                dlq,
                translator,
                ReliabilityMetrics.noop(),
                NotifyingFacade.noop(),
                clock,
                "test-node",
                Duration.ofMillis(20),
                callbackTimeout);
    }

    private static Message message(String id) {
        return Message.builder().messageId(id).topic("orders").payload("p").publishTime(1L).build();
    }

    private int attempts(String id) {
        return scheduler.getPending(id).map(RetryableMessage::getAttemptCount).orElse(-1);
    }

    @Test
    void exhaustsAfterMaxAttemptsWithDoublingDelays() {
        AtomicInteger calls = new AtomicInteger();
        RetryCallback alwaysFails = m -> {
            calls.incrementAndGet();
            throw new IOException("broker down");
        };
        Instant start = clock.instant();

        assertTrue(scheduler.scheduleRetry(message("m1"), new IOException("broker down"), NO_JITTER, alwaysFails));
        assertEquals(start.plusSeconds(1), scheduler.getPending("m1").orElseThrow().getNextRetryTime());

        clock.advanceSeconds(1);
        scheduler.tick();
        await().atMost(Duration.ofSeconds(2)).until(() -> attempts("m1") == 2);

        clock.advanceSeconds(2);
        scheduler.tick();
        await().atMost(Duration.ofSeconds(2)).until(() -> attempts("m1") == 3);

        clock.advanceSeconds(4);
        scheduler.tick();
        await().atMost(Duration.ofSeconds(2)).until(() -> dlq.get("m1").isPresent());

        DeadLetterEntry dead = dlq.get("m1").orElseThrow();
        assertEquals(3, dead.getAttemptCount());
        assertEquals(List.of(1.0, 2.0, 4.0),
                dead.getAttempts().stream().map(RetryAttempt::getDelayBeforeRetry).collect(Collectors.toList()));
        assertEquals(List.of(1, 2, 3),
                dead.getAttempts().stream().map(RetryAttempt::getAttemptNumber).collect(Collectors.toList()));
        assertEquals(ErrorKind.BROKER_UNAVAILABLE, dead.getLastErrorKind());
        assertEquals(3, calls.get());
        assertTrue(scheduler.getPending("m1").isEmpty());
        assertEquals(1, scheduler.stats().getDeadLetteredCount());
    }

    @Test
    void singleAttemptBudgetDeadLettersAfterFirstRetry() {
        RetryConfig once = NO_JITTER.toBuilder().maxAttempts(1).build();

        assertTrue(scheduler.scheduleRetry(message("m1"), new IOException("x"), once, m -> false));
        clock.advanceSeconds(1);
        scheduler.tick();

        await().atMost(Duration.ofSeconds(2)).until(() -> dlq.get("m1").isPresent());
        DeadLetterEntry dead = dlq.get("m1").orElseThrow();
        assertEquals(1, dead.getAttemptCount());
        assertEquals(ErrorKind.UNKNOWN, dead.getLastErrorKind());
    }

    @Test
    void nonRetryableFailureIsRejectedWithoutStoring() {
        assertFalse(scheduler.scheduleRetry(message("m1"), new MessageValidationException("bad"), NO_JITTER, m -> true));

        assertTrue(scheduler.getPending("m1").isEmpty());
        assertTrue(dlq.get("m1").isEmpty());
        assertEquals(1, scheduler.stats().getRejectedCount());
    }

    @Test
    void retryableErrorsSetIsHonoured() {
        RetryConfig timeoutsOnly = NO_JITTER.toBuilder().retryableErrors(EnumSet.of(ErrorKind.TIMEOUT)).build();

        assertFalse(scheduler.scheduleRetry(message("m1"), new IOException("down"), timeoutsOnly, m -> true));
        assertTrue(scheduler.scheduleRetry(message("m2"),
                new java.util.concurrent.TimeoutException("slow"), timeoutsOnly, m -> true));
    }

    @Test
    void nonRetryableFailureOnPendingEntryMovesItToDeadLetters() {
        scheduler.scheduleRetry(message("m1"), new IOException("down"), NO_JITTER, m -> true);

        assertFalse(scheduler.scheduleRetry(message("m1"), new MessageValidationException("bad"), NO_JITTER, m -> true));

        assertTrue(scheduler.getPending("m1").isEmpty());
        DeadLetterEntry dead = dlq.get("m1").orElseThrow();
        assertEquals(1, dead.getAttemptCount());
        assertEquals(ErrorKind.VALIDATION_ERROR, dead.getLastErrorKind());
    }

    @Test
    void pendingEntryKeepsItsOriginalConfig() {
        RetryConfig twice = NO_JITTER.toBuilder().maxAttempts(2).build();
        RetryConfig many = NO_JITTER.toBuilder().maxAttempts(10).build();

        assertTrue(scheduler.scheduleRetry(message("m1"), new IOException("x"), twice, m -> false));
        assertTrue(scheduler.scheduleRetry(message("m1"), new IOException("x"), many, m -> false));
        assertFalse(scheduler.scheduleRetry(message("m1"), new IOException("x"), many, m -> false));

        assertEquals(2, dlq.get("m1").orElseThrow().getAttemptCount());
    }

    @Test
    void successfulRetryRemovesEntry() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, m -> {
            calls.incrementAndGet();
            return true;
        });

        clock.advanceSeconds(1);
        scheduler.tick();

        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.getPending("m1").isEmpty());
        assertEquals(1, calls.get());
        assertEquals(1, scheduler.stats().getSucceededCount());
        assertTrue(dlq.get("m1").isEmpty());
    }

    @Test
    void entriesAreNotFiredBeforeTheyAreDue() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, m -> calls.incrementAndGet() > 0);

        clock.advance(Duration.ofMillis(999));
        scheduler.tick();

        assertEquals(RetryState.SCHEDULED, scheduler.getPending("m1").orElseThrow().getState());
        assertEquals(1, scheduler.stats().getQueued());
        assertEquals(0, calls.get());
    }

    @Test
    void cancelledEntryIsSkippedWhenDue() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, m -> calls.incrementAndGet() > 0);

        assertTrue(scheduler.cancelRetry("m1"));
        assertFalse(scheduler.cancelRetry("m1"));
        clock.advanceSeconds(1);
        scheduler.tick();

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> calls.get() == 0);
        assertEquals(0, scheduler.stats().getQueued());
        assertEquals(1, scheduler.stats().getCancelledCount());
    }

    @Test
    void rescheduledEntryFiresOnlyOnce() {
        AtomicInteger calls = new AtomicInteger();
        RetryCallback cb = m -> calls.incrementAndGet() > 0;
        RetryConfig many = NO_JITTER.toBuilder().maxAttempts(5).build();
        scheduler.scheduleRetry(message("m1"), new IOException("x"), many, cb);
        scheduler.scheduleRetry(message("m1"), new IOException("x"), many, cb);

        clock.advanceSeconds(10);
        scheduler.tick();

        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.getPending("m1").isEmpty());
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> calls.get() == 1);
    }

    @Test
    void callbackTimeoutCountsAsTimeoutFailure() {
        scheduler.shutdown(1);
        scheduler = newScheduler(Duration.ofMillis(100));
        scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, m -> {
            Thread.sleep(2_000);
            return true;
        });

        clock.advanceSeconds(1);
        scheduler.tick();

        await().atMost(Duration.ofSeconds(2)).until(() -> attempts("m1") == 2);
        RetryableMessage p = scheduler.getPending("m1").orElseThrow();
        assertEquals(ErrorKind.TIMEOUT, p.getLastErrorKind());
        assertEquals(RetryState.SCHEDULED, p.getState());
    }

    @Test
    void listsPendingByNextRetryTime() {
        RetryConfig fixed = NO_JITTER.toBuilder().maxAttempts(5).build();
        scheduler.scheduleRetry(message("late"), new IOException("x"), fixed, m -> true);
        scheduler.scheduleRetry(message("late"), new IOException("x"), fixed, m -> true);
        scheduler.scheduleRetry(message("early"), new IOException("x"), fixed, m -> true);

        List<String> ids = scheduler.listPending().stream()
                .map(RetryableMessage::getMessageId).collect(Collectors.toList());

        assertEquals(List.of("early", "late"), ids);
    }

    @Test
    void resubmitStartsAFreshBudgetDueNow() {
        DeadLetterEntry dead = DeadLetterEntry.builder()
                .message(message("m1"))
                .config(NO_JITTER)
                .attempts(List.of(RetryAttempt.builder().attemptNumber(1).build()))
                .createdAt(clock.instant().minusSeconds(60))
                .deadLetteredAt(clock.instant())
                .build();
        AtomicInteger calls = new AtomicInteger();

        assertTrue(scheduler.resubmit(dead, m -> calls.incrementAndGet() > 0));
        RetryableMessage p = scheduler.getPending("m1").orElseThrow();
        assertEquals(0, p.getAttemptCount());
        assertEquals(clock.instant(), p.getNextRetryTime());

        scheduler.tick();
        await().atMost(Duration.ofSeconds(2)).until(() -> calls.get() == 1);
    }

    @Test
    void dueLoopFiresWhenStarted() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, m -> calls.incrementAndGet() > 0);
        scheduler.start();
        assertTrue(scheduler.stats().isRunning());

        clock.advanceSeconds(1);

        await().atMost(Duration.ofSeconds(3)).until(() -> calls.get() == 1);
        await().atMost(Duration.ofSeconds(1)).until(() -> scheduler.getPending("m1").isEmpty());
    }

    @Test
    void rejectsSchedulingAfterShutdown() {
        scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, m -> true);
        scheduler.shutdown(1);

        assertFalse(scheduler.isAccepting());
        assertThrows(IllegalStateException.class,
                () -> scheduler.scheduleRetry(message("m2"), new IOException("x"), NO_JITTER, m -> true));
        assertThrows(IllegalStateException.class, () -> scheduler.start());
        // 未到期条目保留
        assertTrue(scheduler.getPending("m1").isPresent());
    }

    @Test
    void silentlyDiscardedDispatchIsRedispatched() {
        scheduler.shutdown(1);
        ThreadPoolExecutor dispatchPool = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS,
                new SynchronousQueue<>(), new ThreadPoolExecutor.DiscardPolicy());
        CountDownLatch release = new CountDownLatch(1);
        dispatchPool.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        scheduler = newScheduler(Duration.ofSeconds(5), dispatchPool, new BrokerErrorTranslator());
        AtomicInteger calls = new AtomicInteger();
        scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, m -> calls.incrementAndGet() > 0);

        clock.advanceSeconds(1);
        scheduler.tick();
        assertEquals(RetryState.IN_FLIGHT, scheduler.getPending("m1").orElseThrow().getState());
        assertEquals(1, scheduler.stats().getQueued());

        release.countDown();
        // 每轮推进超过 callbackTimeout + pollInterval, 直到派发线程空闲后被领取
        await().atMost(Duration.ofSeconds(3)).until(() -> {
            clock.advanceSeconds(6);
            scheduler.tick();
            return calls.get() == 1;
        });

        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.getPending("m1").isEmpty());
        assertEquals(1, calls.get());
        assertEquals(1, scheduler.stats().getSucceededCount());
    }

    @Test
    void dispatchStillRunningIsNotRedispatched() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, m -> {
            calls.incrementAndGet();
            release.await();
            return true;
        });

        clock.advanceSeconds(1);
        scheduler.tick();
        await().atMost(Duration.ofSeconds(1)).until(() -> calls.get() == 1);
        clock.advanceSeconds(6);
        scheduler.tick();
        release.countDown();

        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.getPending("m1").isEmpty());
        assertEquals(1, calls.get());
    }

    @Test
    void cancelDuringFailureHandlingIsNotUndone() {
        scheduler.shutdown(1);
        // 回调失败后、重新入队前取消
        BrokerErrorTranslator cancelling = new BrokerErrorTranslator() {
            @Override
            public ErrorKind kindOf(Throwable t) {
                if (t instanceof IllegalStateException) {
                    scheduler.cancelRetry("m1");
                }
                return super.kindOf(t);
            }
        };
        scheduler = newScheduler(Duration.ofSeconds(5), Executors.newFixedThreadPool(2), cancelling);
        AtomicInteger calls = new AtomicInteger();
        scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, m -> {
            calls.incrementAndGet();
            throw new IllegalStateException("still failing");
        });

        clock.advanceSeconds(1);
        scheduler.tick();

        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.stats().getFailedCount() == 1);
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
                .until(() -> scheduler.getPending("m1").isEmpty());
        assertEquals(1, calls.get());
        assertEquals(1, scheduler.stats().getCancelledCount());
        assertEquals(1, scheduler.stats().getScheduledCount());
    }

    @Test
    void lateSuccessKeepsEntryRearmedWhileInFlight() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RetryConfig many = NO_JITTER.toBuilder().maxAttempts(5).build();
        RetryCallback slowSuccess = m -> {
            entered.countDown();
            release.await();
            return true;
        };
        scheduler.scheduleRetry(message("m1"), new IOException("x"), many, slowSuccess);

        clock.advanceSeconds(1);
        scheduler.tick();
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        // 回调执行期间外部再次记录失败
        assertTrue(scheduler.scheduleRetry(message("m1"), new IOException("again"), many, slowSuccess));
        release.countDown();

        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.stats().getSucceededCount() == 1);
        RetryableMessage p = scheduler.getPending("m1").orElseThrow();
        assertEquals(2, p.getAttemptCount());
        assertEquals(RetryState.SCHEDULED, p.getState());
    }

    @Test
    void rejectsMissingArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleRetry(null, new IOException("x"), NO_JITTER, m -> true));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleRetry(message("m1"), new IOException("x"), null, m -> true));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleRetry(message("m1"), new IOException("x"), NO_JITTER, null));
    }
}
