package com.hypothesis.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes.
 *
 * <ul>
 *   <li>{@link ResearchProperties} - planner, executor and session tunables
 *   <li>{@link GafProperties} - annotation dataset location
 *   <li>{@link GeminiProperties} - Google Gemini API configuration
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    ResearchProperties.class,
    GafProperties.class,
    GeminiProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
