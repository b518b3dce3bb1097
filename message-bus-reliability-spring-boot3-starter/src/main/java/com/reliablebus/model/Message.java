package com.reliablebus.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.UUID;

/**
 * 业务消息
 * 首次发布前由调用方创建, 之后不再修改; 重试包装只持有引用
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    /** 全局唯一消息id */
    String messageId;

    String topic;

    /** 负载, 需可被 JSON 序列化 */
    Object payload;

    /** 过滤用属性 */
    @Builder.Default
    Map<String, String> attributes = Map.of();

    /** 发布时间（epoch 毫秒） */
    long publishTime;

    /** 可选的排序键, 作为 broker record key */
    String orderingKey;

    public static Message of(String topic, Object payload) {
        return of(topic, payload, Map.of());
    }

    public static Message of(String topic, Object payload, Map<String, String> attributes) {
        return Message.builder()
                .messageId(UUID.randomUUID().toString())
                .topic(topic)
                .payload(payload)
                .attributes(attributes == null ? Map.of() : Map.copyOf(attributes))
                .publishTime(System.currentTimeMillis())
                .build();
    }

    /** broker record key: 排序键优先, 否则消息id */
    public String recordKey() {
        return orderingKey != null && !orderingKey.isBlank() ? orderingKey : messageId;
    }
}
