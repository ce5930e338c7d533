package com.guardian.bundle;

import com.guardian.ledger.DecisionLedger;
import com.guardian.ledger.RecordCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(BundleProperties.class)
public class BundleConfiguration {

    @Bean
    public BundleExporter bundleExporter(DecisionLedger ledger, RecordCodec codec, BundleProperties properties) {
        return new BundleExporter(ledger, codec, Path.of(properties.getDirectory()), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnProperty(prefix = "guardian.bundle", name = "enabled", havingValue = "true", matchIfMissing = true)
    public BundleScheduler bundleScheduler(BundleExporter exporter) {
        return new BundleScheduler(exporter);
    }
}
