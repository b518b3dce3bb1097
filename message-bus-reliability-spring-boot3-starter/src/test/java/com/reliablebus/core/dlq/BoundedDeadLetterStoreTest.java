package com.reliablebus.core.dlq;

import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.notify.AsyncNotifyingService;
import com.reliablebus.core.notify.NotifyingFacade;
import com.reliablebus.model.DeadLetterEntry;
import com.reliablebus.model.Message;
import com.reliablebus.model.RetryConfig;
import com.reliablebus.model.ctx.NotifyContext;
import com.reliablebus.model.enums.ErrorKind;
import com.reliablebus.model.enums.NotifyEventType;
import com.reliablebus.model.enums.Severity;
import com.reliablebus.model.stats.DeadLetterStats;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class BoundedDeadLetterStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static DeadLetterEntry entry(String id, long createdOffsetSeconds) {
        Message m = Message.builder()
                .messageId(id)
                .topic("orders")
                .payload(Map.of("n", 1))
                .publishTime(T0.toEpochMilli())
                .build();
        return DeadLetterEntry.builder()
                .message(m)
                .config(RetryConfig.defaults())
                .attempts(List.of())
                .createdAt(T0.plusSeconds(createdOffsetSeconds))
                .lastError("IOException: down")
                .lastErrorKind(ErrorKind.BROKER_UNAVAILABLE)
                .deadLetteredAt(T0.plusSeconds(createdOffsetSeconds + 100))
                .build();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedDeadLetterStore(0));
    }

    @Test
    void evictsOldestCreatedWhenFull() {
        BoundedDeadLetterStore store = new BoundedDeadLetterStore(3);
        store.add(entry("b", 20));
        store.add(entry("a", 10));
        store.add(entry("c", 30));

        store.add(entry("d", 40));

        assertEquals(3, store.stats().getTotal());
        assertTrue(store.get("a").isEmpty());
        assertTrue(store.get("d").isPresent());
        assertEquals(1, store.stats().getEvictedCount());
    }

    @Test
    void evictionTieBreaksOnMessageId() {
        BoundedDeadLetterStore store = new BoundedDeadLetterStore(2);
        store.add(entry("y", 10));
        store.add(entry("x", 10));

        store.add(entry("z", 20));

        assertTrue(store.get("x").isEmpty());
        assertTrue(store.get("y").isPresent());
    }

    @Test
    void sameIdReplacesWithoutEviction() {
        BoundedDeadLetterStore store = new BoundedDeadLetterStore(2);
        store.add(entry("a", 10));
        store.add(entry("b", 20));

        store.add(entry("a", 30));

        assertEquals(2, store.stats().getTotal());
        assertEquals(0, store.stats().getEvictedCount());
        assertEquals(T0.plusSeconds(30), store.get("a").orElseThrow().getCreatedAt());
    }

    @Test
    void sizeNeverExceedsCapacity() {
        BoundedDeadLetterStore store = new BoundedDeadLetterStore(5);
        for (int i = 0; i < 50; i++) {
            store.add(entry("m" + i, i));
            assertTrue(store.stats().getTotal() <= 5);
        }
        assertEquals(45, store.stats().getEvictedCount());
        assertEquals(50, store.stats().getAddedCount());
    }

    @Test
    void listsNewestFirstWithPaging() {
        BoundedDeadLetterStore store = new BoundedDeadLetterStore(10);
        for (int i = 0; i < 5; i++) {
            store.add(entry("m" + i, i));
        }

        List<String> firstPage = ids(store.list(2, 0));
        List<String> secondPage = ids(store.list(2, 2));

        assertEquals(List.of("m4", "m3"), firstPage);
        assertEquals(List.of("m2", "m1"), secondPage);
        assertTrue(store.list(10, 10).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.list(-1, 0));
    }

    @Test
    void removeAndClearUpdateCounters() {
        BoundedDeadLetterStore store = new BoundedDeadLetterStore(10);
        store.add(entry("a", 1));
        store.add(entry("b", 2));
        store.add(entry("c", 3));

        assertTrue(store.remove("a"));
        assertFalse(store.remove("a"));
        assertEquals(2, store.clear());
        assertEquals(0, store.clear());

        DeadLetterStats s = store.stats();
        assertEquals(0, s.getTotal());
        assertEquals(3, s.getAddedCount());
        assertEquals(1, s.getRemovedCount());
        assertEquals(2, s.getClearedCount());
    }

    @Test
    void evictionRaisesAlertAndMetric() {
        AsyncNotifyingService svc = mock(AsyncNotifyingService.class);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        BoundedDeadLetterStore store = new BoundedDeadLetterStore(1, ReliabilityMetrics.create(registry),
                new NotifyingFacade((Supplier<AsyncNotifyingService>) () -> svc), "node-1", Clock.systemUTC());
        store.add(entry("a", 1));
        verify(svc, never()).fire(any(), any());

        store.add(entry("b", 2));

        ArgumentCaptor<NotifyContext> ctx = ArgumentCaptor.forClass(NotifyContext.class);
        verify(svc).fire(ctx.capture(), eq(Severity.WARNING));
        assertEquals(NotifyEventType.DEAD_LETTER_EVICTED, ctx.getValue().getType());
        assertEquals("a", ctx.getValue().getMessageId());
        assertEquals(1.0, registry.get("bus.dlq.evicted").counter().count());
        assertEquals(2.0, registry.get("bus.dlq.added").counter().count());
    }

    private static List<String> ids(List<DeadLetterEntry> entries) {
        return entries.stream().map(DeadLetterEntry::getMessageId).collect(Collectors.toList());
    }
}
