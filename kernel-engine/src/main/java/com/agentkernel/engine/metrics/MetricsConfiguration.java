package com.agentkernel.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the kernel.
 *
 * Configures:
 * - Common tags for all metrics
 * - The kernel meter binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "agent-kernel");
    }

    @Bean
    public KernelMetrics kernelMetrics() {
        return new KernelMetrics();
    }
}
