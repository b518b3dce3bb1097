package com.reliablebus.core.repository;

import com.reliablebus.config.ReliabilityProperties;
import com.reliablebus.core.guard.BrokerGuard;
import com.reliablebus.core.spi.TopicStore;
import com.reliablebus.core.spi.broker.BrokerClient;
import com.reliablebus.core.spi.broker.TopicExistsException;
import com.reliablebus.exception.MessageValidationException;
import com.reliablebus.model.CircuitBreakerState;
import com.reliablebus.model.Topic;
import com.reliablebus.model.TopicPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * topic 声明/查询/删除, broker 调用受独立熔断器保护
 */
public class TopicRepository {

    public static final String NAME = "topic-repository";

    private static final Logger log = LoggerFactory.getLogger(TopicRepository.class);

    private final BrokerClient broker;

    private final TopicStore store;

    private final BrokerGuard guard;

    private final ReliabilityProperties.Repository defaults;

    private final Clock clock;

    public TopicRepository(BrokerClient broker, TopicStore store, BrokerGuard guard,
                           ReliabilityProperties.Repository defaults, Clock clock) {
        this.broker = broker;
        this.store = store;
        this.guard = guard;
        this.defaults = defaults;
        this.clock = clock;
    }

    /**
     * 声明 topic; 已存在时返回已有描述
     * 参数为 null 时使用配置默认值
     */
    public Topic createTopic(String name, Integer partitionCount, Short replicationFactor,
                             String retentionPolicy, Map<String, String> labels) {
        requireName(name);
        int partitions = partitionCount == null ? defaults.getPartitionCount() : partitionCount;
        short replication = replicationFactor == null ? defaults.getReplicationFactor() : replicationFactor;
        if (partitions < 1) {
            throw new MessageValidationException("partitionCount must be > 0, got " + partitions);
        }
        if (replication < 1) {
            throw new MessageValidationException("replicationFactor must be > 0, got " + replication);
        }
        Optional<Topic> existing = store.get(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        createOnBroker(name, partitions, replication);
        Topic topic = Topic.builder()
                .name(name)
                .partitionCount(partitions)
                .replicationFactor(replication)
                .retentionPolicy(retentionPolicy == null ? defaults.getRetentionPolicy() : retentionPolicy)
                .createdAt(clock.instant())
                .labels(labels == null ? Map.of() : Map.copyOf(labels))
                .build();
        store.save(topic);
        log.info("[Topic-Repo] topic created, name={}, partitions={}, replication={}",
                name, partitions, replication);
        return topic;
    }

    public Topic createTopic(String name) {
        return createTopic(name, null, null, null, null);
    }

    /**
     * 发布发现 topic 缺失时使用: 不信任元数据, 总是向 broker 声明
     * 元数据已有记录时沿用其分区/副本数, 否则按默认值创建并写入元数据
     */
    public Topic ensureOnBroker(String name) {
        requireName(name);
        Optional<Topic> known = store.get(name);
        int partitions = known.map(Topic::getPartitionCount).orElse(defaults.getPartitionCount());
        short replication = known.map(Topic::getReplicationFactor).orElse(defaults.getReplicationFactor());
        createOnBroker(name, partitions, replication);
        if (known.isPresent()) {
            log.warn("[Topic-Repo] topic {} known to metadata but missing on broker, re-declared", name);
            return known.get();
        }
        Topic topic = Topic.builder()
                .name(name)
                .partitionCount(partitions)
                .replicationFactor(replication)
                .retentionPolicy(defaults.getRetentionPolicy())
                .createdAt(clock.instant())
                .build();
        store.save(topic);
        log.info("[Topic-Repo] topic created on publish, name={}, partitions={}, replication={}",
                name, partitions, replication);
        return topic;
    }

    public Optional<Topic> getTopic(String name) {
        requireName(name);
        return store.get(name);
    }

    public boolean exists(String name) {
        requireName(name);
        return store.exists(name);
    }

    /**
     * @return broker 或元数据中任一处存在并被删除
     */
    public boolean deleteTopic(String name) {
        requireName(name);
        Boolean onBroker = guard.call(NAME, "deleteTopic", () -> broker.deleteTopic(name));
        boolean inStore = store.delete(name);
        if (Boolean.TRUE.equals(onBroker) || inStore) {
            log.info("[Topic-Repo] topic deleted, name={}", name);
            return true;
        }
        return false;
    }

    public TopicPage listTopics(int pageSize, String pageToken) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1, got " + pageSize);
        }
        return store.list(pageSize, pageToken);
    }

    public CircuitBreakerState breakerState() {
        return guard.state(NAME);
    }

    private void createOnBroker(String name, int partitions, short replication) {
        guard.call(NAME, "createTopic", () -> {
            try {
                broker.createTopic(name, partitions, replication);
            } catch (TopicExistsException e) {
                log.debug("[Topic-Repo] topic {} already exists on broker", name);
            }
            return null;
        });
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new MessageValidationException("topic name must not be blank");
        }
    }
}
