package com.purchasingpower.codegraph.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes of the service.
 */
@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class ConfigurationPropertiesEnablerConfig {
}
