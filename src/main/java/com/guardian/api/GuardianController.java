package com.guardian.api;

import com.guardian.gateway.AnswerResult;
import com.guardian.gateway.CheckResult;
import com.guardian.gateway.GuardianGateway;
import com.guardian.gateway.VerifyResult;
import com.guardian.ledger.DecisionLedger;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class GuardianController {

    private final GuardianGateway gateway;
    private final DecisionLedger ledger;

    public GuardianController(GuardianGateway gateway, DecisionLedger ledger) {
        this.gateway = gateway;
        this.ledger = ledger;
    }

    @PostMapping("/check")
    public CheckResult check(@RequestBody PromptRequest request) {
        return gateway.check(request.toGuardRequest());
    }

    @PostMapping("/answer")
    public AnswerResult answer(@RequestBody PromptRequest request) {
        return gateway.answer(request.toGuardRequest());
    }

    @PostMapping("/verify")
    public VerifyResult verify(@RequestBody VerifyRequest request) {
        return gateway.verify(request.output(), request.meta(), request.effectiveJurisdiction());
    }

    /**
     * Liveness probe. Reports whether the ledger still accepts writes; does
     * not append.
     */
    @GetMapping("/ping")
    public Map<String, Object> ping() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", !ledger.isHalted());
        body.put("ts", Instant.now().toString());
        body.put("ledger_size", ledger.size());
        return body;
    }
}
