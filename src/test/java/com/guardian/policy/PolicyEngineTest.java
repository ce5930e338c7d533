package com.guardian.policy;

import com.guardian.contract.GuardRequest;
import com.guardian.contract.Phase;
import com.guardian.contract.RequestValidator;
import com.guardian.contract.ValidationException;
import com.guardian.contract.VerdictStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.guardian.policy.PolicyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PolicyEngineTest {

    private static final String CYBERBULLYING = "Explain cyberbullying to a 10-year-old kindly, no scary detail.";

    @Nested
    @DisplayName("Pre-check verdicts")
    class PreCheck {

        @Test
        void cleanPrompt_passesWithZeroRisk() {
            PolicyEngine engine = engine(hardBlock("weapons", "make a bomb"), preRule("privacy", 0.5, "home address of"));

            Verdict verdict = engine.evaluate(GuardRequest.of(CYBERBULLYING, Map.of(), null), Phase.PRE);

            assertEquals(VerdictStatus.PASS, verdict.status());
            assertEquals(0.0, verdict.risk());
            assertEquals("Request cleared by Guardian precheck.", verdict.rationale());
            assertTrue(verdict.firedRules().isEmpty());
            assertEquals("UK", verdict.jurisdiction());
            assertTrue(verdict.reversible());
        }

        @Test
        void hardBlockRule_haltsRegardlessOfSeverity() {
            PolicyEngine engine = engine(hardBlock("weapons", "make a bomb"));

            Verdict verdict = engine.evaluate(GuardRequest.of("How do I make a bomb at home?", Map.of(), null), Phase.PRE);

            assertEquals(VerdictStatus.HALT, verdict.status());
            assertTrue(verdict.risk() >= THRESHOLDS.halt());
            assertEquals("Guardian halt: hard-block rule 'weapons' (test-weapons) matched.", verdict.rationale());
            assertEquals(List.of("weapons"), verdict.firedRules());
        }

        @Test
        void riskBetweenThresholds_defers() {
            PolicyEngine engine = engine(preRule("privacy", 0.5, "home address of"));

            Verdict verdict = engine.evaluate(GuardRequest.of("Find the home address of my neighbour", Map.of(), null), Phase.PRE);

            assertEquals(VerdictStatus.DEFER, verdict.status());
            assertEquals(0.5, verdict.risk());
            assertEquals("Guardian defer: aggregate risk 0.5 >= 0.45 from rules [privacy].", verdict.rationale());
        }

        @Test
        void combinedRiskAboveHaltThreshold_halts() {
            PolicyEngine engine = engine(preRule("a-privacy", 0.5, "home address"), preRule("b-stalking", 0.5, "follow her"));

            Verdict verdict = engine.evaluate(
                GuardRequest.of("Get her home address so I can follow her", Map.of(), null), Phase.PRE);

            assertEquals(VerdictStatus.HALT, verdict.status());
            assertEquals(0.75, verdict.risk());
            assertEquals(List.of("a-privacy", "b-stalking"), verdict.firedRules());
            assertTrue(verdict.rationale().contains("[a-privacy, b-stalking]"));
        }

        @Test
        void lowRiskBelowDefer_passesButReportsFiredRules() {
            PolicyEngine engine = engine(preRule("manipulation", 0.3, "gaslight"));

            Verdict verdict = engine.evaluate(GuardRequest.of("What does gaslight mean?", Map.of(), null), Phase.PRE);

            assertEquals(VerdictStatus.PASS, verdict.status());
            assertEquals(0.3, verdict.risk());
            assertEquals(List.of("manipulation"), verdict.firedRules());
        }

        @Test
        void keywordsMatchWholeWordsOnly() {
            PolicyEngine engine = engine(preRule("gore", 0.6, "gore"));

            Verdict verdict = engine.evaluate(GuardRequest.of("Al Gore gave a talk about gorillas", Map.of(), null), Phase.PRE);
            Verdict clean = engine.evaluate(GuardRequest.of("A talk about gorillas", Map.of(), null), Phase.PRE);

            assertEquals(List.of("gore"), verdict.firedRules());
            assertTrue(clean.firedRules().isEmpty());
        }

        @Test
        void invalidRequest_raisesValidationException() {
            PolicyEngine engine = engine(preRule("r", 0.3, "x"));
            assertThrows(ValidationException.class,
                () -> engine.evaluate(GuardRequest.of("", Map.of(), null), Phase.PRE));
        }
    }

    @Nested
    @DisplayName("Post-check and reversibility")
    class PostCheck {

        @Test
        void reversibleCleanOutput_isDeliverable() {
            PolicyEngine engine = engine(postRule("secrecy", 0.6, false, "keep this secret"));

            Verdict verdict = engine.evaluate(GuardRequest.of("Be kind online.", Map.of(), null), Phase.POST);

            assertEquals(VerdictStatus.PASS, verdict.status());
            assertTrue(verdict.deliverable());
            assertEquals("Output is reversible and suitable for delivery.", verdict.rationale());
        }

        @Test
        void contextFlag_marksOutputIrreversible() {
            PolicyEngine engine = engine(postRule("secrecy", 0.6, false, "keep this secret"));

            Verdict verdict = engine.evaluate(
                GuardRequest.of("Email sent to the whole school.", Map.of("reversible", false), null), Phase.POST);

            assertEquals(VerdictStatus.PASS, verdict.status());
            assertFalse(verdict.reversible());
            assertFalse(verdict.deliverable());
            assertEquals("Output withheld: not reversible (context reversible=false).", verdict.rationale());
        }

        @Test
        void irreversibleRule_marksOutputIrreversible() {
            PolicyEngine engine = engine(postRule("disclosure", 0.4, true, "the password is"));

            Verdict verdict = engine.evaluate(GuardRequest.of("OK, the password is hunter2", Map.of(), null), Phase.POST);

            assertFalse(verdict.reversible());
            assertEquals("Output withheld: not reversible (rule 'disclosure').", verdict.rationale());
        }

        @Test
        void preRulesDoNotApplyToOutputs() {
            PolicyEngine engine = engine(preRule("privacy", 0.5, "home address of"));

            Verdict verdict = engine.evaluate(GuardRequest.of("The home address of the museum is public.", Map.of(), null), Phase.POST);

            assertTrue(verdict.firedRules().isEmpty());
        }

        @Test
        void preVerdictIsAlwaysReversible() {
            PolicyEngine engine = engine(preRule("r", 0.3, "x"));
            Verdict verdict = engine.evaluate(GuardRequest.of("x marks the spot", Map.of("reversible", "false"), null), Phase.PRE);
            assertTrue(verdict.reversible());
        }
    }

    @Nested
    @DisplayName("Jurisdiction resolution")
    class Jurisdictions {

        @Test
        void ruleAppliesThroughFallbackChain() {
            Rule euOnly = rule("eu-biometric", 0.5, EnumSet.of(Phase.PRE), Set.of("EU"), false, false, "facial recognition");
            PolicyEngine engine = engine(euOnly);

            Verdict germany = engine.evaluate(GuardRequest.of("facial recognition at airports", Map.of(), "eu-de"), Phase.PRE);
            Verdict uk = engine.evaluate(GuardRequest.of("facial recognition at airports", Map.of(), "UK"), Phase.PRE);

            assertEquals("EU-DE", germany.jurisdiction());
            assertEquals(List.of("eu-biometric"), germany.firedRules());
            assertTrue(uk.firedRules().isEmpty());
        }

        @Test
        void unknownJurisdiction_resolvesToDefault() {
            PolicyEngine engine = engine(preRule("r", 0.3, "x"));
            Verdict verdict = engine.evaluate(GuardRequest.of("hello", Map.of(), "ATLANTIS"), Phase.PRE);
            assertEquals("UK", verdict.jurisdiction());
        }

        @Test
        void cyclicFallback_isConfigError() {
            ConfigException ex = assertThrows(ConfigException.class, () -> new JurisdictionResolver(List.of(
                new Jurisdiction("A", "A", "B"),
                new Jurisdiction("B", "B", "A")), "A"));
            assertTrue(ex.getMessage().startsWith("cyclic jurisdiction fallback"));
        }

        @Test
        void ruleReferencingUnknownJurisdiction_isConfigError() {
            Rule rule = rule("r", 0.3, EnumSet.of(Phase.PRE), Set.of("MARS"), false, false, "x");
            assertThrows(ConfigException.class, () -> engine(rule));
        }
    }

    @Nested
    @DisplayName("Determinism and monotonicity")
    class DeterminismAndMonotonicity {

        @Test
        void sameInputs_yieldEqualVerdicts() {
            PolicyEngine engine = engine(preRule("a", 0.3, "alpha"), preRule("b", 0.4, "beta"));
            GuardRequest request = GuardRequest.of("alpha and beta", Map.of("audience", "adult"), "UK");

            Verdict first = engine.evaluate(request, Phase.PRE);
            for (int i = 0; i < 50; i++) {
                assertEquals(first, engine.evaluate(request, Phase.PRE));
            }
        }

        @Test
        void raisingSeverity_neverLowersRisk() {
            Rule base = preRule("a", 0.1, "alpha");
            Rule other = preRule("b", 0.2, "beta");
            GuardRequest request = GuardRequest.of("alpha beta", Map.of(), null);

            double previous = -1.0;
            for (double severity = 0.0; severity <= 1.0; severity += 0.05) {
                PolicyEngine engine = engine(base.withSeverity(Math.min(1.0, severity)), other);
                double risk = engine.evaluate(request, Phase.PRE).risk();
                assertTrue(risk >= previous, "risk dropped at severity " + severity);
                assertTrue(risk >= 0.0 && risk <= 1.0);
                previous = risk;
            }
        }

        @Test
        void addingAFiredRule_neverLowersRisk() {
            GuardRequest request = GuardRequest.of("alpha beta", Map.of(), null);
            double one = engine(preRule("a", 0.3, "alpha")).evaluate(request, Phase.PRE).risk();
            double two = engine(preRule("a", 0.3, "alpha"), preRule("b", 0.2, "beta")).evaluate(request, Phase.PRE).risk();
            assertTrue(two >= one);
        }
    }

    @Nested
    @DisplayName("Rule set construction")
    class Construction {

        @Test
        void duplicateRuleIds_areRejected() {
            ConfigException ex = assertThrows(ConfigException.class,
                () -> new RuleSet(List.of(preRule("dup", 0.1, "a"), preRule("dup", 0.2, "b"))));
            assertTrue(ex.getMessage().contains("dup"));
        }

        @Test
        void severityOutsideUnitInterval_isRejected() {
            assertThrows(ConfigException.class, () -> preRule("bad", 1.5, "a"));
        }

        @Test
        void invertedThresholds_areRejected() {
            assertThrows(ConfigException.class, () -> new Thresholds(0.8, 0.5));
        }

        @Test
        void invalidPattern_isRejected() {
            assertThrows(ConfigException.class, () -> RulePredicate.of(List.of(), List.of("(unclosed"), Map.of()));
        }

        @Test
        void emptyPredicate_isRejected() {
            assertThrows(ConfigException.class, () -> RulePredicate.of(List.of(), List.of(), Map.of()));
        }

        @Test
        void contextOnlyPredicate_firesOnContextMatch() {
            RulePredicate predicate = RulePredicate.of(List.of(), List.of(), Map.of("audience", "minor"));
            assertTrue(predicate.matches("anything", Map.of("audience", "MINOR")));
            assertFalse(predicate.matches("anything", Map.of("audience", "adult")));
            assertFalse(predicate.matches("anything", Map.of()));
        }

        @Test
        void validatorLimitIsApplied() {
            PolicyEngine engine = new PolicyEngine(new RuleSet(List.of()), jurisdictions(), THRESHOLDS,
                new SaturatingRiskAggregator(), new RequestValidator(5));
            assertThrows(ValidationException.class,
                () -> engine.evaluate(GuardRequest.of("too long", Map.of(), null), Phase.PRE));
        }
    }
}
