package com.makerhedge.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer metrics configuration.
 *
 * <p>Without an exporter on the classpath nothing provides a registry, so an in-memory
 * {@link SimpleMeterRegistry} is registered, tagged with the application name. The meter
 * definitions live in {@link com.makerhedge.observability.HedgeMetrics}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry(@Value("${spring.application.name:maker-hedge}") String applicationName) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", applicationName);
        return registry;
    }
}
