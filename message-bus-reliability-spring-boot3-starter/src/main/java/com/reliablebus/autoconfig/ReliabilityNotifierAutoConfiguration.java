package com.reliablebus.autoconfig;

import com.reliablebus.config.ReliabilityNotifierProperties;
import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.notify.AsyncNotifyingService;
import com.reliablebus.core.notify.NotifyingFacade;
import com.reliablebus.core.notify.notifier.LoggingNotifier;
import com.reliablebus.core.notify.ratelimit.RateLimitFilter;
import com.reliablebus.core.spi.notify.Notifier;
import com.reliablebus.core.spi.notify.NotifierFilter;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@AutoConfiguration(after = ReliabilityMetricsAutoConfiguration.class)
@EnableConfigurationProperties(ReliabilityNotifierProperties.class)
public class ReliabilityNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(NotifierFilter.class)
    public NotifierFilter notifierRateLimitFilter(ReliabilityNotifierProperties props) {
        return new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "bus.reliability.notify", name = "enabled", matchIfMissing = true)
    public AsyncNotifyingService asyncNotifyingService(ObjectProvider<Notifier> notifiers,
                                                       NotifierFilter filter,
                                                       ReliabilityMetrics metrics,
                                                       ReliabilityNotifierProperties props) {
        ReliabilityNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                new NamedThreadFactory("bus-notify"),
                new ThreadPoolExecutor.DiscardPolicy());
        List<Notifier> channels = notifiers.orderedStream().collect(Collectors.toList());
        return new AsyncNotifyingService(exec, channels, filter, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
