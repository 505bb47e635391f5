package com.phillippitts.imageoptimizer.config;

import com.phillippitts.imageoptimizer.service.metrics.BatchMetricsSink;
import com.phillippitts.imageoptimizer.service.metrics.MicrometerBatchMetricsSink;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link BatchMetricsSink} implementation from {@code optimizer.metrics.enabled}.
 */
@Configuration
public class MetricsConfig {

    private static final Logger LOG = LogManager.getLogger(MetricsConfig.class);

    @Bean
    public BatchMetricsSink batchMetricsSink(
            @Value("${optimizer.metrics.enabled:true}") boolean enabled,
            ObjectProvider<MeterRegistry> registryProvider) {
        MeterRegistry registry = registryProvider.getIfAvailable();
        if (!enabled || registry == null) {
            LOG.info("Batch metrics disabled (enabled={}, registryAvailable={})", enabled, registry != null);
            return BatchMetricsSink.NOOP;
        }
        return new MicrometerBatchMetricsSink(registry);
    }
}
