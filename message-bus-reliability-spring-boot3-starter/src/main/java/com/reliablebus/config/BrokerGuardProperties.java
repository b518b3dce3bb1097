package com.reliablebus.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * bus:
 *   reliability:
 *     guard:
 *       circuit-breaker:
 *         failure-threshold: 5
 *         reset-timeout: 30s
 *       cb-per-repository:
 *         message-repository: { failure-threshold: 3, reset-timeout: 10s }
 */
@Data
@ConfigurationProperties(prefix = "bus.reliability.guard")
public class BrokerGuardProperties {

    /** 默认配置（可被仓储名覆盖） */
    private CbConfig circuitBreaker = new CbConfig();

    /** 按仓储名覆盖 */
    private Map<String, CbConfig> cbPerRepository;

    @Data
    public static class CbConfig {
        /** 连续失败次数阈值 */
        private int failureThreshold = 5;
        /** 打开后多久放行一次试探调用 */
        private Duration resetTimeout = Duration.ofSeconds(30);
    }
}
