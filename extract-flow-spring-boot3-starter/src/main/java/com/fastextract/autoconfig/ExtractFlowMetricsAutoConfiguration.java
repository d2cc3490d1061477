package com.fastextract.autoconfig;

import com.fastextract.core.metric.ExtractMeterRegistryProvider;
import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.metric.PerformanceMetricsRecorder;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration
public class ExtractFlowMetricsAutoConfiguration {

    @Bean
    public ExtractMeterRegistryProvider extractMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new ExtractMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ExtractMetrics extractMetrics(ExtractMeterRegistryProvider provider) {
        return ExtractMetrics.create(provider.getRegistry());
    }

    /**
     * 各阶段耗时统计
     */
    @Bean
    @ConditionalOnMissingBean
    public PerformanceMetricsRecorder performanceMetricsRecorder(ExtractMetrics metrics) {
        return new PerformanceMetricsRecorder(metrics);
    }
}
