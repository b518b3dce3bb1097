package com.reliablebus.core.repository;

import com.reliablebus.config.ReliabilityProperties;
import com.reliablebus.core.guard.BrokerGuard;
import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.spi.MessageCodec;
import com.reliablebus.core.spi.broker.BrokerClient;
import com.reliablebus.core.spi.broker.BrokerPublishResult;
import com.reliablebus.core.spi.broker.BrokerRecord;
import com.reliablebus.core.spi.broker.RecordStream;
import com.reliablebus.exception.BusException;
import com.reliablebus.exception.MessageValidationException;
import com.reliablebus.exception.TopicNotFoundException;
import com.reliablebus.model.CircuitBreakerState;
import com.reliablebus.model.Message;
import com.reliablebus.model.PublishAck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 消息仓储
 * - 发布: 熔断检查 → JSON 信封 → broker; topic 不存在且允许自动创建时创建后重试一次
 * - 查询: 从头扫描, 受 fetchWindow / fetchTimeout 约束, 超时返回部分结果
 */
public class MessageRepository {

    public static final String NAME = "message-repository";

    private static final Logger log = LoggerFactory.getLogger(MessageRepository.class);

    private final BrokerClient broker;

    private final TopicRepository topics;

    private final MessageCodec codec;

    private final BrokerGuard guard;

    private final ReliabilityMetrics metrics;

    private final ReliabilityProperties.Repository cfg;

    public MessageRepository(BrokerClient broker, TopicRepository topics, MessageCodec codec,
                             BrokerGuard guard, ReliabilityMetrics metrics,
                             ReliabilityProperties.Repository cfg) {
        this.broker = broker;
        this.topics = topics;
        this.codec = codec;
        this.guard = guard;
        this.metrics = metrics;
        this.cfg = cfg;
    }

    public PublishAck publish(Message message) {
        validate(message);
        byte[] payload;
        try {
            payload = codec.encode(message);
        } catch (IllegalArgumentException e) {
            throw new MessageValidationException("payload is not serializable: " + e.getMessage());
        }

        long start = System.nanoTime();
        try {
            PublishAck ack;
            try {
                ack = doPublish(message, payload);
            } catch (TopicNotFoundException e) {
                if (!cfg.isAutoCreateTopics()) {
                    throw e;
                }
                log.info("[Message-Repo] topic {} not found, auto-creating", message.getTopic());
                topics.ensureOnBroker(message.getTopic());
                ack = doPublish(message, payload);
            }
            metrics.incPublishSuccess(message.getTopic());
            return ack;
        } catch (BusException e) {
            metrics.incPublishFailure(message.getTopic(), e.getKind());
            log.warn("[Message-Repo] publish failed, message={}, topic={}, kind={}",
                    message.getMessageId(), message.getTopic(), e.getKind());
            throw e;
        } finally {
            metrics.recordPublishNanos(message.getTopic(), System.nanoTime() - start);
        }
    }

    public Optional<Message> getMessage(String topic, String messageId) {
        requireTopic(topic);
        if (messageId == null || messageId.isBlank()) {
            throw new MessageValidationException("messageId must not be blank");
        }
        List<Message> found = scan(topic, m -> messageId.equals(m.getMessageId()), 1);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public List<Message> listMessages(String topic, int maxCount) {
        return listMessages(topic, maxCount, null, null, null);
    }

    /**
     * 属性等值过滤 + 发布时间闭区间过滤
     * 结果按发布时间排序, 相同时间保持读取顺序
     */
    public List<Message> listMessages(String topic, int maxCount, Map<String, String> filterAttributes,
                                      Instant startTime, Instant endTime) {
        requireTopic(topic);
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be >= 1, got " + maxCount);
        }
        Predicate<Message> filter = m -> matches(m, filterAttributes, startTime, endTime);
        return scan(topic, filter, maxCount);
    }

    public CircuitBreakerState breakerState() {
        return guard.state(NAME);
    }

    private PublishAck doPublish(Message message, byte[] payload) {
        BrokerPublishResult r = guard.call(NAME, "publish",
                () -> broker.publish(message.getTopic(), payload, message.recordKey()));
        return new PublishAck(message.getMessageId(), message.getTopic(), r.getPartition(), r.getOffset());
    }

    private List<Message> scan(String topic, Predicate<Message> filter, int maxCount) {
        long start = System.nanoTime();
        try {
            List<Message> out = guard.call(NAME, "consume", () -> collect(topic, filter, maxCount));
            out.sort(Comparator.comparingLong(Message::getPublishTime));
            return out;
        } finally {
            metrics.recordConsumeNanos(topic, System.nanoTime() - start);
        }
    }

    private List<Message> collect(String topic, Predicate<Message> filter, int maxCount) throws Exception {
        List<Message> out = new ArrayList<>();
        long deadline = System.nanoTime() + cfg.getFetchTimeout().toNanos();
        int scanned = 0;
        try (RecordStream stream = broker.consume(topic)) {
            while (out.size() < maxCount && scanned < cfg.getFetchWindow()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("[Message-Repo] fetch timeout on topic={}, returning {} partial results after {} records",
                            topic, out.size(), scanned);
                    break;
                }
                Duration wait = Duration.ofNanos(Math.min(remaining, cfg.getPollTimeout().toNanos()));
                BrokerRecord record = stream.poll(wait);
                if (record == null) {
                    // 已读完
                    break;
                }
                scanned++;
                Message m;
                try {
                    m = codec.decode(record.getValue());
                } catch (RuntimeException e) {
                    log.warn("[Message-Repo] skip undecodable record topic={}, partition={}, offset={}: {}",
                            topic, record.getPartition(), record.getOffset(), e.getMessage());
                    continue;
                }
                if (filter.test(m)) {
                    out.add(m);
                }
            }
        }
        return out;
    }

    private static boolean matches(Message m, Map<String, String> attrs, Instant startTime, Instant endTime) {
        if (attrs != null && !attrs.isEmpty()) {
            Map<String, String> actual = m.getAttributes() == null ? Map.of() : m.getAttributes();
            for (Map.Entry<String, String> e : attrs.entrySet()) {
                if (!Objects.equals(e.getValue(), actual.get(e.getKey()))) {
                    return false;
                }
            }
        }
        if (startTime != null && m.getPublishTime() < startTime.toEpochMilli()) {
            return false;
        }
        return endTime == null || m.getPublishTime() <= endTime.toEpochMilli();
    }

    private static void validate(Message message) {
        if (message == null) {
            throw new MessageValidationException("message must not be null");
        }
        if (message.getMessageId() == null || message.getMessageId().isBlank()) {
            throw new MessageValidationException("messageId must not be blank");
        }
        requireTopic(message.getTopic());
    }

    private static void requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new MessageValidationException("topic must not be blank");
        }
    }
}
