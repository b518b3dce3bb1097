package com.reliablebus.core.spi.broker;

/**
 * 下游 broker 客户端
 * 不存在的 topic 需抛出 {@link UnknownTopicException}
 */
public interface BrokerClient {

    BrokerPublishResult publish(String topic, byte[] payload, String key) throws Exception;

    /**
     * 从头读取 topic 的记录流, 调用方负责关闭
     */
    RecordStream consume(String topic) throws Exception;

    /**
     * topic 已存在时可静默返回或抛出 {@link TopicExistsException}
     */
    void createTopic(String name, int partitionCount, short replicationFactor) throws Exception;

    /**
     * @return false 表示 topic 不存在
     */
    boolean deleteTopic(String name) throws Exception;
}
