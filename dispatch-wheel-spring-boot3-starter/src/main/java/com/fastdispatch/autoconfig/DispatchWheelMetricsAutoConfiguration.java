package com.fastdispatch.autoconfig;

import com.fastdispatch.core.metric.DispatchMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * 调度指标：内置 Simple 注册表，应用中已有的 MeterRegistry 一并接入
 */
@AutoConfiguration
public class DispatchWheelMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DispatchMetrics dispatchMetrics(ObjectProvider<MeterRegistry> discovered) {
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        // 没有外部注册表时计数仍可读
        composite.add(new SimpleMeterRegistry());
        discovered.orderedStream().forEach(composite::add);
        return DispatchMetrics.create(composite);
    }
}
