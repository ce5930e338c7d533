package com.guardian.ledger;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfiguration {

    @Bean
    public RecordCodec recordCodec() {
        return new RecordCodec();
    }

    /**
     * The one ledger owned by this process. Opening it re-verifies every
     * stored record; a broken chain stops the application from starting.
     */
    @Bean
    public FileDecisionLedger decisionLedger(LedgerProperties properties, RecordCodec codec) {
        return new FileDecisionLedger(Path.of(properties.getDirectory()), codec);
    }
}
