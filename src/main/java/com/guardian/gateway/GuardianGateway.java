package com.guardian.gateway;

import com.guardian.contract.GuardRequest;
import com.guardian.contract.Phase;
import com.guardian.contract.ValidationException;
import com.guardian.generation.GenerationTimeoutException;
import com.guardian.generation.GuardedGenerator;
import com.guardian.indices.Indices;
import com.guardian.indices.IndicesCalculator;
import com.guardian.ledger.DecisionEntry;
import com.guardian.ledger.DecisionLedger;
import com.guardian.ledger.LedgerAppendResult;
import com.guardian.ledger.Operation;
import com.guardian.ledger.RecordCodec;
import com.guardian.policy.PolicyEngine;
import com.guardian.policy.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

/**
 * Orchestrates the gate: evaluate, compute indices, append to the ledger.
 *
 * Holds no state of its own. Every call appends at least one record, and a
 * verdict is only returned once its record is durable. If the ledger refuses
 * the write, the caller gets the integrity failure instead of a verdict.
 */
@Service
public class GuardianGateway {

    private static final Logger log = LoggerFactory.getLogger(GuardianGateway.class);

    private final PolicyEngine engine;
    private final IndicesCalculator indices;
    private final DecisionLedger ledger;
    private final RecordCodec codec;
    private final GuardedGenerator generator;
    private final Clock clock;

    @Autowired
    public GuardianGateway(PolicyEngine engine,
                           IndicesCalculator indices,
                           DecisionLedger ledger,
                           RecordCodec codec,
                           GuardedGenerator generator) {
        this(engine, indices, ledger, codec, generator, Clock.systemUTC());
    }

    GuardianGateway(PolicyEngine engine,
                    IndicesCalculator indices,
                    DecisionLedger ledger,
                    RecordCodec codec,
                    GuardedGenerator generator,
                    Clock clock) {
        this.engine = engine;
        this.indices = indices;
        this.ledger = ledger;
        this.codec = codec;
        this.generator = generator;
        this.clock = clock;
    }

    /**
     * Pre-check only. No generation.
     */
    public CheckResult check(GuardRequest request) {
        Verdict verdict = engine.evaluate(request, Phase.PRE);
        Indices pre = indices.indicesFor(verdict);
        LedgerAppendResult appended = append(Operation.CHECK, request, Phase.PRE, verdict, pre);

        return new CheckResult(verdict.status(), verdict.risk(), verdict.rationale(),
            pre.protectionIndex(), verdict.firedRules(), appended.sequence());
    }

    /**
     * Full guarded answer: pre-check, generate, post-check.
     *
     * <p>A generation timeout is recorded as a defer and reported as blocked.
     * Any other generation failure propagates after the pre record has been
     * written. Output that fails validation is recorded as a post-phase halt.</p>
     */
    public AnswerResult answer(GuardRequest request) {
        Verdict pre = engine.evaluate(request, Phase.PRE);
        LedgerAppendResult preRecord = append(Operation.ANSWER, request, Phase.PRE, pre, indices.indicesFor(pre));
        if (!pre.passed()) {
            return AnswerResult.blocked(pre.status(), pre.rationale(), null, preRecord.sequence());
        }

        String output;
        try {
            output = generator.generate(request.text());
        } catch (GenerationTimeoutException ex) {
            Verdict deferred = Verdict.generationTimeout(pre.jurisdiction(), ex.getMessage());
            LedgerAppendResult deferRecord = append(Operation.ANSWER, request, Phase.PRE, deferred, null);
            return AnswerResult.blocked(deferred.status(), deferred.rationale(), null, deferRecord.sequence());
        }

        GuardRequest produced = new GuardRequest(output, request.context(), request.jurisdiction(), request.timestamp());
        Verdict post;
        try {
            post = engine.evaluate(produced, Phase.POST);
        } catch (ValidationException ex) {
            post = Verdict.unacceptableOutput(pre.jurisdiction(), ex.getMessage());
        }
        double mhi = indices.moralHealthIndex(post);
        LedgerAppendResult postRecord = append(Operation.ANSWER, produced, Phase.POST, post, Indices.moralHealth(mhi));

        if (!post.deliverable()) {
            return AnswerResult.blocked(post.status(), post.rationale(), mhi, postRecord.sequence());
        }
        return new AnswerResult(false, output, post.rationale(), mhi, post.status(), postRecord.sequence());
    }

    /**
     * Post-check of externally produced text.
     */
    public VerifyResult verify(String output, Map<String, Object> meta, String jurisdiction) {
        GuardRequest request = new GuardRequest(output, meta, jurisdiction, clock.instant());
        Verdict verdict = engine.evaluate(request, Phase.POST);
        double mhi = indices.moralHealthIndex(verdict);
        LedgerAppendResult appended = append(Operation.VERIFY, request, Phase.POST, verdict, Indices.moralHealth(mhi));

        return new VerifyResult(verdict.reversible(), !verdict.deliverable(), verdict.rationale(), mhi,
            RecordCodec.sha256Hex(output.getBytes(StandardCharsets.UTF_8)),
            verdict.status(), verdict.firedRules(), appended.sequence());
    }

    private LedgerAppendResult append(Operation operation,
                                      GuardRequest request,
                                      Phase hashPhase,
                                      Verdict verdict,
                                      Indices recorded) {
        String requestHash = codec.requestHash(request, hashPhase);
        LedgerAppendResult appended = ledger.record(
            DecisionEntry.of(operation, requestHash, verdict, recorded, clock.instant()));
        log.info("{} {} seq={} status={} risk={} jurisdiction={} fired={}",
            operation.getValue(), verdict.phase().getValue(), appended.sequence(),
            verdict.status().getValue(), verdict.risk(), verdict.jurisdiction(), verdict.firedRules());
        return appended;
    }
}
