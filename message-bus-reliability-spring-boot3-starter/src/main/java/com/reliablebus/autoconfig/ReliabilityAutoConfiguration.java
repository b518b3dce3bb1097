package com.reliablebus.autoconfig;

import com.reliablebus.annotation.EnableReliableBus;
import com.reliablebus.config.BrokerGuardProperties;
import com.reliablebus.config.ReliabilityNotifierProperties;
import com.reliablebus.config.ReliabilityProperties;
import com.reliablebus.core.ReliabilityLifecycle;
import com.reliablebus.core.ReliabilityManager;
import com.reliablebus.core.backoff.RetryPolicy;
import com.reliablebus.core.dlq.BoundedDeadLetterStore;
import com.reliablebus.core.failure.BrokerErrorTranslator;
import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.notify.NotifyingFacade;
import com.reliablebus.core.scheduler.RetryScheduler;
import com.reliablebus.core.spi.BackoffPolicy;
import com.reliablebus.core.spi.DeadLetterStore;
import com.reliablebus.core.spi.failure.ErrorCaseHandler;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 重试调度器、死信存储及门面
 */
@AutoConfiguration(after = ReliabilityNotifierAutoConfiguration.class)
@EnableConfigurationProperties({
        ReliabilityProperties.class,
        BrokerGuardProperties.class,
        ReliabilityNotifierProperties.class
})
public class ReliabilityAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock reliabilityClock() {
        return Clock.systemUTC();
    }

    /**
     * 时间轮, 由调度器停机时停止
     */
    @Bean(destroyMethod = "")
    public HashedWheelTimer reliabilityWheelTimer(ReliabilityProperties props) {
        ReliabilityProperties.Wheel wheel = props.getScheduler().getWheel();
        return new HashedWheelTimer(
                new NamedThreadFactory("bus-retry-wheel"),
                wheel.getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                wheel.getTicksPerWheel());
    }

    /**
     * 到期条目派发线程池
     * 固定 AbortPolicy, 拒绝时由调度器放回队列; 配置的拒绝策略只作用于回调线程池
     */
    @Bean(name = "retryDispatchExecutor", destroyMethod = "")
    public ExecutorService retryDispatchExecutor(ReliabilityProperties props) {
        return newPool(props.getScheduler().getExecutor(), "bus-retry-dispatch", new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * 回调执行线程池
     */
    @Bean(name = "retryHandlerExecutor", destroyMethod = "")
    public ExecutorService retryHandlerExecutor(ReliabilityProperties props) {
        ReliabilityProperties.Exec exec = props.getScheduler().getExecutor();
        return newPool(exec, "bus-retry-handler", exec.getRejectedHandler().toHandler());
    }

    /**
     * 策略注册中心, 收集容器中的 BackoffPolicy
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(ObjectProvider<BackoffPolicy> discovered) {
        return new RetryPolicy(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerErrorTranslator brokerErrorTranslator(ObjectProvider<ErrorCaseHandler<?>> extra) {
        return new BrokerErrorTranslator(extra.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterStore.class)
    public DeadLetterStore deadLetterStore(ReliabilityProperties props,
                                           ReliabilityMetrics metrics,
                                           NotifyingFacade notifier,
                                           Clock clock,
                                           ApplicationContext applicationContext) {
        return new BoundedDeadLetterStore(props.getDlq().getMaxSize(), metrics, notifier,
                instanceId(props, applicationContext), clock);
    }

    @Bean
    public RetryScheduler retryScheduler(HashedWheelTimer timer,
                                         @Qualifier("retryDispatchExecutor") ExecutorService dispatchExecutor,
                                         @Qualifier("retryHandlerExecutor") ExecutorService handlerExecutor,
                                         RetryPolicy policy,
                                         DeadLetterStore deadLetterStore,
                                         BrokerErrorTranslator translator,
                                         ReliabilityMetrics metrics,
                                         NotifyingFacade notifier,
                                         Clock clock,
                                         ReliabilityProperties props,
                                         ApplicationContext applicationContext) {
        return new RetryScheduler(timer, dispatchExecutor, handlerExecutor, policy, deadLetterStore,
                translator, metrics, notifier, clock, instanceId(props, applicationContext),
                props.getScheduler().getPollInterval(), props.getScheduler().getCallbackTimeout());
    }

    /**
     * 默认重试配置在此校验, 非法配置启动失败
     */
    @Bean
    @ConditionalOnMissingBean
    public ReliabilityManager reliabilityManager(RetryScheduler scheduler,
                                                 DeadLetterStore deadLetterStore,
                                                 RetryPolicy policy,
                                                 ReliabilityProperties props) {
        return new ReliabilityManager(scheduler, deadLetterStore, props.defaultRetryConfig(policy));
    }

    @Bean
    public ReliabilityLifecycle reliabilityLifecycle(RetryScheduler scheduler,
                                                     ReliabilityProperties props,
                                                     BrokerGuardProperties guardProps,
                                                     ReliabilityNotifierProperties notifyProps,
                                                     ApplicationContext applicationContext) {
        EnableReliableBus enable = findEnableReliableBus(applicationContext);
        if (enable != null) {
            props.getScheduler().setEnabled(enable.value());
        }
        return new ReliabilityLifecycle(scheduler, props, guardProps, notifyProps);
    }

    static String instanceId(ReliabilityProperties props, ApplicationContext applicationContext) {
        return props.resolveInstanceId(applicationContext.getEnvironment().getProperty("spring.application.name"));
    }

    private static ExecutorService newPool(ReliabilityProperties.Exec exec, String name,
                                           RejectedExecutionHandler rejectedHandler) {
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(exec.getQueueCapacity()),
                new NamedThreadFactory(name),
                rejectedHandler);
    }

    private static EnableReliableBus findEnableReliableBus(ListableBeanFactory factory) {
        for (String n : factory.getBeanNamesForAnnotation(EnableReliableBus.class)) {
            EnableReliableBus an = factory.findAnnotationOnBean(n, EnableReliableBus.class);
            if (an != null) {
                return an;
            }
        }
        return null;
    }
}
