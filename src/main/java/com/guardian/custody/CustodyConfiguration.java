package com.guardian.custody;

import com.guardian.ledger.RecordCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CustodyConfiguration {

    @Bean
    public CustodyVerifier custodyVerifier(RecordCodec codec) {
        return new CustodyVerifier(codec);
    }
}
