package com.repairline.api.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags(
            @Value("${spring.application.name:repairline-worker}") String application,
            WorkerProperties workerProperties) {
        return registry -> registry.config().commonTags(
            "application", application,
            "environment", workerProperties.getEnvironment());
    }
}
