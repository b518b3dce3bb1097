package com.reliablebus.autoconfig;

import com.reliablebus.config.BrokerGuardProperties;
import com.reliablebus.config.ReliabilityProperties;
import com.reliablebus.core.failure.BrokerErrorTranslator;
import com.reliablebus.core.guard.BrokerGuard;
import com.reliablebus.core.notify.NotifyingFacade;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@AutoConfiguration(after = ReliabilityAutoConfiguration.class)
@EnableConfigurationProperties({
        BrokerGuardProperties.class,
        ReliabilityProperties.class
})
public class BrokerGuardAutoConfiguration {

    /**
     * broker 调用统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public BrokerGuard brokerGuard(BrokerGuardProperties props,
                                   BrokerErrorTranslator translator,
                                   NotifyingFacade notifier,
                                   Clock clock,
                                   ReliabilityProperties reliabilityProps,
                                   ApplicationContext applicationContext) {
        return new BrokerGuard(props, translator, notifier,
                ReliabilityAutoConfiguration.instanceId(reliabilityProps, applicationContext), clock);
    }
}
