package com.reliablebus.model.stats;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SchedulerStats {
    int pending;
    int queued;
    boolean running;
    long scheduledCount;
    long succeededCount;
    long failedCount;
    long deadLetteredCount;
    long cancelledCount;
    /** 不可重试直接拒绝的次数 */
    long rejectedCount;
}
