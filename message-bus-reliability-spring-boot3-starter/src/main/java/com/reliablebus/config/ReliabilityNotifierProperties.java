package com.reliablebus.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * bus:
 *   reliability:
 *     notify:
 *       enabled: true
 *       async: { core-pool-size: 1, max-pool-size: 2, queue-capacity: 2000 }
 *       rate-limit: { window: 30s, threshold: 50 }
 */
@Data
@ConfigurationProperties(prefix = "bus.reliability.notify")
public class ReliabilityNotifierProperties {

    /** 关闭后告警静默丢弃 */
    private boolean enabled = true;

    private Async async = new Async();

    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Async {
        private int corePoolSize = 1;

        private int maxPoolSize = 2;

        private int queueCapacity = 2000;

        private Duration keepAlive = Duration.ofSeconds(60);
    }

    @Data
    public static class RateLimit {
        private Duration window = Duration.ofSeconds(30);

        /** 窗口内同类告警上限 */
        private int threshold = 50;
    }
}
