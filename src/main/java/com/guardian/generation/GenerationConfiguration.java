package com.guardian.generation;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GeneratorProperties.class)
public class GenerationConfiguration {

    @Bean
    public TextGenerator textGenerator(RestTemplateBuilder builder, GeneratorProperties properties) {
        return new OllamaTextGenerator(
            builder.setConnectTimeout(properties.getTimeout())
                .setReadTimeout(properties.getTimeout())
                .build(),
            properties.getBaseUrl(),
            properties.getModel(),
            properties.getMaxTokens());
    }

    @Bean
    public GuardedGenerator guardedGenerator(TextGenerator textGenerator, GeneratorProperties properties) {
        return new GuardedGenerator(textGenerator, properties.getTimeout(), properties.getMaxAttempts(),
            properties.getBackoff(), properties.getPoolSize());
    }
}
