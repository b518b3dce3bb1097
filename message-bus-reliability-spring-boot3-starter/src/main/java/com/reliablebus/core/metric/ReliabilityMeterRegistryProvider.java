package com.reliablebus.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 指标注册表: Simple 保底 + 业务方已有的注册表
 */
public class ReliabilityMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public ReliabilityMeterRegistryProvider(List<MeterRegistry> discovered) {
        this.composite = new CompositeMeterRegistry();
        this.composite.add(new SimpleMeterRegistry());

        if (discovered != null) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry) {
                    ((CompositeMeterRegistry) mr).getRegistries().forEach(this.composite::add);
                } else {
                    this.composite.add(mr);
                }
            }
        }
    }

    public MeterRegistry getRegistry() {
        return composite;
    }
}
