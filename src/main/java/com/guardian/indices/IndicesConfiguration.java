package com.guardian.indices;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IndicesProperties.class)
public class IndicesConfiguration {

    @Bean
    public IndicesCalculator indicesCalculator(IndicesProperties properties) {
        return new IndicesCalculator(properties.getProtectionBaseline(), properties.getProtectionFloor());
    }
}
