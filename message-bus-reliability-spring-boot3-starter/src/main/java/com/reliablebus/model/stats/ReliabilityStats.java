package com.reliablebus.model.stats;

import lombok.Value;

@Value
public class ReliabilityStats {
    SchedulerStats retryScheduler;
    DeadLetterStats deadLetterStore;
}
