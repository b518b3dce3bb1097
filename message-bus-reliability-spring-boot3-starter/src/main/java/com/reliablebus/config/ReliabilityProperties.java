package com.reliablebus.config;

import com.reliablebus.core.backoff.RetryPolicy;
import com.reliablebus.model.RetryConfig;
import com.reliablebus.model.enums.BackoffStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 可靠投递配置（绑定前缀：bus.reliability）
 *
 * YAML 示例：
 * bus:
 *   reliability:
 *     instance-id: bus-node-1
 *     retry:
 *       max-attempts: 3
 *       initial-delay: 1.0
 *       max-delay: 60
 *       backoff-multiplier: 2.0
 *       strategy: exponential     # fixed | linear | exponential | spi:{name}
 *       jitter: true
 *     scheduler:
 *       enabled: true
 *       poll-interval: 100ms
 *       callback-timeout: 30s
 *       wheel:
 *         tick-duration: 10ms
 *         ticks-per-wheel: 512
 *       executor:
 *         core-pool-size: 4
 *         max-pool-size: 16
 *         queue-capacity: 1000
 *         keep-alive: 60s
 *         rejected-handler: ABORT
 *     dlq:
 *       max-size: 10000
 *     repository:
 *       auto-create-topics: true
 *       partition-count: 3
 *       replication-factor: 1
 *       retention-policy: 7d
 *       fetch-window: 1000
 *       fetch-timeout: 30s
 *       poll-timeout: 1s
 *     shutdown:
 *       await: 30s
 */
@ConfigurationProperties(prefix = "bus.reliability")
public class ReliabilityProperties {

    /** 节点标识, 为空时由 spring.application.name + 随机串生成 */
    private String instanceId;

    private Retry retry = new Retry();

    private Scheduler scheduler = new Scheduler();

    private Dlq dlq = new Dlq();

    private Repository repository = new Repository();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class Retry {
        /** 最大重试次数 */
        private int maxAttempts = RetryConfig.DEFAULT_MAX_ATTEMPTS;

        /** 首次延迟（秒） */
        private double initialDelay = RetryConfig.DEFAULT_INITIAL_DELAY;

        /** 延迟上限（秒） */
        private double maxDelay = RetryConfig.DEFAULT_MAX_DELAY;

        private double backoffMultiplier = RetryConfig.DEFAULT_BACKOFF_MULTIPLIER;

        /** 策略：fixed | linear | exponential | spi:{name} */
        private String strategy = "exponential";

        /** ±10% 抖动 */
        private boolean jitter = true;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public double getInitialDelay() { return initialDelay; }
        public void setInitialDelay(double initialDelay) { this.initialDelay = initialDelay; }
        public double getMaxDelay() { return maxDelay; }
        public void setMaxDelay(double maxDelay) { this.maxDelay = maxDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
    }

    public static class Scheduler {
        /** 是否启动到期循环, 可被 @EnableReliableBus(false) 关闭 */
        private boolean enabled = true;

        /** 到期循环间隔 */
        private Duration pollInterval = Duration.ofMillis(100);

        /** 单次回调超时 */
        private Duration callbackTimeout = Duration.ofSeconds(30);

        private Wheel wheel = new Wheel();

        private Exec executor = new Exec();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getCallbackTimeout() { return callbackTimeout; }
        public void setCallbackTimeout(Duration callbackTimeout) { this.callbackTimeout = callbackTimeout; }
        public Wheel getWheel() { return wheel; }
        public void setWheel(Wheel wheel) { this.wheel = wheel; }
        public Exec getExecutor() { return executor; }
        public void setExecutor(Exec executor) { this.executor = executor; }
    }

    public static class Wheel {
        /** 时间轮刻度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
    }

    public static class Exec {
        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 回调线程池拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST; 派发线程池固定 ABORT */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.ABORT;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Dlq {
        /** 容量上限, 满时淘汰最旧条目 */
        private int maxSize = 10_000;

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
    }

    public static class Repository {
        /** 发布时 topic 不存在则自动创建 */
        private boolean autoCreateTopics = true;

        private int partitionCount = 3;

        private short replicationFactor = 1;

        private String retentionPolicy = "7d";

        /** 单次查询最多扫描的记录数 */
        private int fetchWindow = 1000;

        /** 单次查询总耗时上限, 超时返回已收集的部分结果 */
        private Duration fetchTimeout = Duration.ofSeconds(30);

        /** 单次 poll 等待 */
        private Duration pollTimeout = Duration.ofSeconds(1);

        public boolean isAutoCreateTopics() { return autoCreateTopics; }
        public void setAutoCreateTopics(boolean autoCreateTopics) { this.autoCreateTopics = autoCreateTopics; }
        public int getPartitionCount() { return partitionCount; }
        public void setPartitionCount(int partitionCount) { this.partitionCount = partitionCount; }
        public short getReplicationFactor() { return replicationFactor; }
        public void setReplicationFactor(short replicationFactor) { this.replicationFactor = replicationFactor; }
        public String getRetentionPolicy() { return retentionPolicy; }
        public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }
        public int getFetchWindow() { return fetchWindow; }
        public void setFetchWindow(int fetchWindow) { this.fetchWindow = fetchWindow; }
        public Duration getFetchTimeout() { return fetchTimeout; }
        public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }
        public Duration getPollTimeout() { return pollTimeout; }
        public void setPollTimeout(Duration pollTimeout) { this.pollTimeout = pollTimeout; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- 公共枚举/工具 -----------------

    /** 线程池拒绝策略枚举（YAML 中大小写均可） */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public static RejectedHandlerPolicy from(String v) {
            return RejectedHandlerPolicy.valueOf(v.trim().toUpperCase(Locale.ROOT));
        }

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public String getInstanceId() { return instanceId; }
    public void setInstanceId(String instanceId) { this.instanceId = instanceId; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public Dlq getDlq() { return dlq; }
    public void setDlq(Dlq dlq) { this.dlq = dlq; }

    public Repository getRepository() { return repository; }
    public void setRepository(Repository repository) { this.repository = repository; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    // ----------------- 便捷换算 -----------------

    /**
     * 节点标识, 未配置时生成一次并固定
     */
    public synchronized String resolveInstanceId(String applicationName) {
        if (instanceId == null || instanceId.isBlank()) {
            String app = applicationName == null || applicationName.isBlank() ? "message-bus" : applicationName;
            instanceId = app + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
        return instanceId;
    }

    /**
     * 默认重试配置; 非内置策略名（如 spi:{name}）解析为 CUSTOM
     * 参数非法时抛出 IllegalArgumentException
     */
    public RetryConfig defaultRetryConfig(RetryPolicy policy) {
        RetryConfig.RetryConfigBuilder b = RetryConfig.builder()
                .maxAttempts(retry.getMaxAttempts())
                .initialDelay(retry.getInitialDelay())
                .maxDelay(retry.getMaxDelay())
                .backoffMultiplier(retry.getBackoffMultiplier())
                .jitter(retry.isJitter());
        String s = retry.getStrategy() == null ? "" : retry.getStrategy().trim();
        BackoffStrategy builtIn = builtIn(s);
        if (builtIn != null) {
            b.strategy(builtIn);
        } else {
            b.strategy(BackoffStrategy.CUSTOM).customPolicy(policy.resolve(s));
        }
        return b.build();
    }

    private static BackoffStrategy builtIn(String s) {
        if (s.isEmpty()) {
            return BackoffStrategy.EXPONENTIAL;
        }
        try {
            BackoffStrategy b = BackoffStrategy.from(s);
            return b == BackoffStrategy.CUSTOM ? null : b;
        } catch (IllegalArgumentException notBuiltIn) {
            return null;
        }
    }
}
