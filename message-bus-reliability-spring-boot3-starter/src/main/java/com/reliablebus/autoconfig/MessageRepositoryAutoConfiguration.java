package com.reliablebus.autoconfig;

import com.reliablebus.config.ReliabilityProperties;
import com.reliablebus.core.guard.BrokerGuard;
import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.repository.MessageRepository;
import com.reliablebus.core.repository.TopicRepository;
import com.reliablebus.core.serializer.JacksonMessageCodec;
import com.reliablebus.core.spi.MessageCodec;
import com.reliablebus.core.spi.TopicStore;
import com.reliablebus.core.spi.broker.BrokerClient;
import com.reliablebus.core.store.InMemoryTopicStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * 仓储, 仅在业务方提供 BrokerClient 时启用
 */
@AutoConfiguration(after = BrokerGuardAutoConfiguration.class)
@ConditionalOnBean(BrokerClient.class)
public class MessageRepositoryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(TopicStore.class)
    public TopicStore topicStore() {
        return new InMemoryTopicStore();
    }

    /**
     * 默认 JSON 信封
     */
    @Bean
    @ConditionalOnMissingBean(MessageCodec.class)
    public MessageCodec messageCodec() {
        return new JacksonMessageCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public TopicRepository topicRepository(BrokerClient broker, TopicStore store, BrokerGuard guard,
                                           ReliabilityProperties props, Clock clock) {
        return new TopicRepository(broker, store, guard, props.getRepository(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageRepository messageRepository(BrokerClient broker, TopicRepository topics, MessageCodec codec,
                                               BrokerGuard guard, ReliabilityMetrics metrics,
                                               ReliabilityProperties props) {
        return new MessageRepository(broker, topics, codec, guard, metrics, props.getRepository());
    }
}
