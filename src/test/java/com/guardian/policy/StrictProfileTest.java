package com.guardian.policy;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "guardian.ledger.directory=target/test-evidence/${random.uuid}/ledger",
    "guardian.bundle.enabled=false"
})
@ActiveProfiles("strict")
class StrictProfileTest {

    @Autowired PolicyEngine engine;

    @Test
    void strictProfileLowersThresholdsAndKeepsRules() {
        assertEquals(new Thresholds(0.30, 0.60), engine.thresholds());
        assertEquals(10, engine.ruleSet().size());
    }
}
