package com.reliablebus.autoconfig;

import com.reliablebus.core.metric.ReliabilityMeterRegistryProvider;
import com.reliablebus.core.metric.ReliabilityMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration
public class ReliabilityMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ReliabilityMeterRegistryProvider reliabilityMeterRegistryProvider(
            ObjectProvider<MeterRegistry> discovered) {
        return new ReliabilityMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ReliabilityMetrics reliabilityMetrics(ReliabilityMeterRegistryProvider provider) {
        return ReliabilityMetrics.create(provider.getRegistry());
    }
}
