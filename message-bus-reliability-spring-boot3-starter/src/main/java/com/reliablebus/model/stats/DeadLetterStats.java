package com.reliablebus.model.stats;

import lombok.Builder;
import lombok.Value;

/**
 * 死信统计, 计数器整个生命周期单调递增
 */
@Value
@Builder
public class DeadLetterStats {
    int total;
    int maxSize;
    long addedCount;
    long evictedCount;
    long removedCount;
    long clearedCount;
}
