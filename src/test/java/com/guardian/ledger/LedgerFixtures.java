package com.guardian.ledger;

import com.guardian.contract.Phase;
import com.guardian.contract.VerdictStatus;

import java.time.Instant;
import java.util.List;

final class LedgerFixtures {

    static final Instant T0 = Instant.parse("2026-03-01T10:15:30.123Z");

    private LedgerFixtures() {
    }

    static DecisionEntry entry(int n) {
        return new DecisionEntry(Operation.CHECK, Phase.PRE, RecordCodec.sha256Hex(("req-" + n).getBytes()),
            VerdictStatus.PASS, 0.0, List.of(), "UK", true, 0.99, null,
            "Request cleared by Guardian precheck.", T0.plusSeconds(n));
    }

    static DecisionEntry haltEntry(int n) {
        return new DecisionEntry(Operation.VERIFY, Phase.POST, RecordCodec.sha256Hex(("out-" + n).getBytes()),
            VerdictStatus.HALT, 1.0, List.of("post-weapons"), "EU", false, null, 0.0,
            "Guardian halt: hard-block rule 'post-weapons' (weapons) matched.", T0.plusSeconds(n));
    }
}
