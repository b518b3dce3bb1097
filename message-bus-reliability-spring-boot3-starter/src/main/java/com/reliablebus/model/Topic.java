package com.reliablebus.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * topic 描述
 */
@Value
@Builder(toBuilder = true)
public class Topic {

    String name;

    int partitionCount;

    short replicationFactor;

    /** 保留策略, 例如 7d / compact */
    String retentionPolicy;

    Instant createdAt;

    @Builder.Default
    Map<String, String> labels = Map.of();
}
