package com.reliablebus.core.repository;

import com.reliablebus.config.BrokerGuardProperties;
import com.reliablebus.config.ReliabilityProperties;
import com.reliablebus.core.failure.BrokerErrorTranslator;
import com.reliablebus.core.guard.BrokerGuard;
import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.serializer.JacksonMessageCodec;
import com.reliablebus.core.store.InMemoryTopicStore;
import com.reliablebus.exception.BrokerUnavailableException;
import com.reliablebus.exception.MessageValidationException;
import com.reliablebus.exception.TopicNotFoundException;
import com.reliablebus.exception.guard.CircuitOpenException;
import com.reliablebus.model.Message;
import com.reliablebus.model.PublishAck;
import com.reliablebus.model.enums.ErrorKind;
import com.reliablebus.support.FakeBrokerClient;
import com.reliablebus.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class MessageRepositoryTest {

    private FakeBrokerClient broker;
    private ReliabilityProperties.Repository cfg;
    private SimpleMeterRegistry registry;
    private TopicRepository topics;
    private MessageRepository repo;

    @BeforeEach
    void setUp() {
        broker = new FakeBrokerClient();
        cfg = new ReliabilityProperties().getRepository();
        registry = new SimpleMeterRegistry();
        BrokerGuardProperties guardProps = new BrokerGuardProperties();
        guardProps.getCircuitBreaker().setFailureThreshold(3);
        guardProps.getCircuitBreaker().setResetTimeout(Duration.ofMillis(200));
        repo = build(guardProps);
    }

    private MessageRepository build(BrokerGuardProperties guardProps) {
        BrokerGuard guard = new BrokerGuard(guardProps, new BrokerErrorTranslator());
        topics = new TopicRepository(broker, new InMemoryTopicStore(), guard, cfg,
                MutableClock.startingAt("2024-01-01T00:00:00Z"));
        return new MessageRepository(broker, topics, new JacksonMessageCodec(), guard,
                ReliabilityMetrics.create(registry), cfg);
    }

    private static Message msg(String id, long publishTime, Map<String, String> attrs) {
        return Message.builder()
                .messageId(id)
                .topic("orders")
                .payload(Map.of("id", id))
                .attributes(attrs)
                .publishTime(publishTime)
                .build();
    }

    @Test
    void publishesAndReadsBack() {
        broker.withTopic("orders");
        Message m = msg("m1", 1000, Map.of("type", "created"));

        PublishAck ack = repo.publish(m);

        assertEquals("m1", ack.getMessageId());
        assertEquals(0, ack.getOffset());
        Message read = repo.getMessage("orders", "m1").orElseThrow();
        assertEquals("created", read.getAttributes().get("type"));
        assertEquals(1000, read.getPublishTime());
        assertTrue(repo.getMessage("orders", "nope").isEmpty());
        assertEquals(1.0, registry.get("bus.publish.success").tag("topic", "orders").counter().count());
    }

    @Test
    void autoCreatesMissingTopicAndRetriesOnce() {
        PublishAck ack = repo.publish(msg("m1", 1, Map.of()));

        assertEquals("m1", ack.getMessageId());
        assertTrue(broker.hasTopic("orders"));
        assertEquals(1, broker.size("orders"));
        assertEquals(2, broker.publishCalls.get());
    }

    @Test
    void autoCreateRedeclaresTopicDroppedFromBroker() throws Exception {
        topics.createTopic("orders");
        broker.deleteTopic("orders");

        PublishAck ack = repo.publish(msg("m1", 1, Map.of()));

        assertEquals("m1", ack.getMessageId());
        assertEquals(2, broker.createCalls.get());
        assertEquals(2, broker.publishCalls.get());
        assertEquals(1, broker.size("orders"));
    }

    @Test
    void missingTopicFailsWhenAutoCreateDisabled() {
        cfg.setAutoCreateTopics(false);

        TopicNotFoundException e = assertThrows(TopicNotFoundException.class, () -> repo.publish(msg("m1", 1, Map.of())));

        assertEquals("orders", e.getTopic());
        assertFalse(broker.hasTopic("orders"));
    }

    @Test
    void rejectsInvalidMessagesWithoutTouchingBroker() {
        assertThrows(MessageValidationException.class, () -> repo.publish(null));
        assertThrows(MessageValidationException.class,
                () -> repo.publish(Message.builder().messageId("m1").topic("").build()));
        assertThrows(MessageValidationException.class,
                () -> repo.publish(Message.builder().topic("orders").build()));
        assertThrows(IllegalArgumentException.class, () -> repo.listMessages("orders", 0));

        assertEquals(0, broker.publishCalls.get());
    }

    @Test
    void unserializablePayloadIsAValidationError() {
        broker.withTopic("orders");
        Message m = Message.builder().messageId("m1").topic("orders").payload(new Object()).build();

        MessageValidationException e = assertThrows(MessageValidationException.class, () -> repo.publish(m));

        assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
        assertEquals(0, broker.publishCalls.get());
    }

    @Test
    void filtersByAttributesAndTimeRange() {
        broker.withTopic("orders");
        repo.publish(msg("a", 3000, Map.of("region", "eu")));
        repo.publish(msg("b", 1000, Map.of("region", "us")));
        repo.publish(msg("c", 2000, Map.of("region", "eu")));
        repo.publish(msg("d", 4000, Map.of()));

        List<String> eu = ids(repo.listMessages("orders", 10, Map.of("region", "eu"), null, null));
        List<String> window = ids(repo.listMessages("orders", 10, null,
                Instant.ofEpochMilli(2000), Instant.ofEpochMilli(3000)));
        List<String> all = ids(repo.listMessages("orders", 10));

        assertEquals(List.of("c", "a"), eu);
        assertEquals(List.of("c", "a"), window);
        assertEquals(List.of("b", "c", "a", "d"), all);
    }

    @Test
    void maxCountLimitsResults() {
        broker.withTopic("orders");
        for (int i = 0; i < 5; i++) {
            repo.publish(msg("m" + i, i, Map.of()));
        }

        assertEquals(2, repo.listMessages("orders", 2).size());
        assertEquals(0, broker.openStreams.get());
    }

    @Test
    void fetchWindowBoundsTheScan() {
        broker.withTopic("orders");
        for (int i = 0; i < 5; i++) {
            repo.publish(msg("m" + i, i, Map.of()));
        }
        cfg.setFetchWindow(3);

        assertEquals(List.of("m0", "m1", "m2"), ids(repo.listMessages("orders", 10)));
    }

    @Test
    void skipsUndecodableRecords() {
        broker.withTopic("orders");
        repo.publish(msg("m1", 1, Map.of()));
        broker.appendRaw("orders", "not json");
        repo.publish(msg("m2", 2, Map.of()));

        assertEquals(List.of("m1", "m2"), ids(repo.listMessages("orders", 10)));
    }

    @Test
    void returnsPartialResultsWhenFetchTimesOut() {
        broker.withTopic("orders");
        for (int i = 0; i < 10; i++) {
            repo.publish(msg("m" + i, i, Map.of()));
        }
        broker.setPollDelay(Duration.ofMillis(100));
        cfg.setFetchTimeout(Duration.ofMillis(250));

        List<Message> partial = repo.listMessages("orders", 10);

        assertFalse(partial.isEmpty());
        assertTrue(partial.size() < 10, "expected partial results, got " + partial.size());
        assertEquals(0, broker.openStreams.get());
    }

    @Test
    void breakerOpensAfterConsecutiveFailuresThenRecovers() {
        broker.withTopic("orders");
        broker.failAlways(new IOException("down"));

        for (int i = 0; i < 3; i++) {
            assertThrows(BrokerUnavailableException.class, () -> repo.publish(msg("x", 1, Map.of())));
        }
        int callsWhenOpened = broker.publishCalls.get();

        CircuitOpenException open = assertThrows(CircuitOpenException.class, () -> repo.publish(msg("x", 1, Map.of())));
        assertEquals(ErrorKind.CIRCUIT_OPEN, open.getKind());
        assertEquals(callsWhenOpened, broker.publishCalls.get());
        assertTrue(repo.breakerState().isOpen());

        broker.recover();
        await().atMost(Duration.ofSeconds(2)).pollInterval(Duration.ofMillis(50))
                .ignoreExceptionsInstanceOf(CircuitOpenException.class)
                .until(() -> repo.publish(msg("y", 2, Map.of())) != null);

        assertFalse(repo.breakerState().isOpen());
        assertEquals("CLOSED", repo.breakerState().getState());
    }

    @Test
    void fiveConsecutiveBrokerFailuresOpenTheBreakerByDefault() {
        repo = build(new BrokerGuardProperties());
        broker.withTopic("orders");
        broker.failAlways(new IOException("down"));

        for (int i = 0; i < 5; i++) {
            assertThrows(BrokerUnavailableException.class, () -> repo.publish(msg("x", 1, Map.of())));
        }
        assertEquals(5, broker.publishCalls.get());

        assertThrows(CircuitOpenException.class, () -> repo.publish(msg("x", 1, Map.of())));
        assertEquals(5, broker.publishCalls.get());
    }

    @Test
    void attributeFilterPicksMatchingRecordsOutOfMany() {
        broker.withTopic("orders");
        for (int i = 0; i < 20; i++) {
            Map<String, String> attrs = i % 5 == 0 ? Map.of("type", "alert") : Map.of("type", "info");
            repo.publish(msg("m" + i, i, attrs));
        }

        List<String> alerts = ids(repo.listMessages("orders", 100, Map.of("type", "alert"), null, null));

        assertEquals(List.of("m0", "m5", "m10", "m15"), alerts);
    }

    @Test
    void readsAreGuardedToo() {
        assertThrows(TopicNotFoundException.class, () -> repo.listMessages("missing", 5));
    }

    private static List<String> ids(List<Message> messages) {
        return messages.stream().map(Message::getMessageId).collect(Collectors.toList());
    }
}
