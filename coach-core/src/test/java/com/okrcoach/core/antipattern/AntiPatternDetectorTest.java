package com.okrcoach.core.antipattern;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.okrcoach.core.model.UserContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verification of {@link AntiPatternDetector} against the bundled rule table.
 */
class AntiPatternDetectorTest {

    private static final AntiPatternCatalog CATALOG = AntiPatternCatalog.bundled();
    private final AntiPatternDetector detector = new AntiPatternDetector(CATALOG);

    private static final UserContext TECH = UserContext.of("Technology", "Engineering Manager");

    private static AntiPatternRule rule(String id) {
        return CATALOG.rule(id).orElseThrow(() -> new AssertionError("missing rule " + id));
    }

    // ── Catalogue ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("AntiPatternCatalog — rule table loading")
    class CatalogTests {

        @Test
        @DisplayName("bundled table → 13 rules in document order")
        void bundledRules() {
            List<AntiPatternRule> rules = CATALOG.rules();
            assertEquals(13, rules.size());
            assertEquals("activity_focused", rules.get(0).id());
            assertEquals(Severity.CRITICAL, rule("sphere_of_influence_violation").severity());
            assertEquals("Five Whys Technique", rule("activity_focused").strategy().name());
        }

        @Test
        @DisplayName("missing resource → empty catalogue, detection finds nothing")
        void missingResource_degrades() {
            AntiPatternCatalog missing = new AntiPatternCatalog("does-not-exist.json", new ObjectMapper(),
                ContextualRuleRegistry.defaults());
            assertTrue(missing.rules().isEmpty());
            assertFalse(new AntiPatternDetector(missing).detectPatterns("Launch new mobile app", TECH).detected());
        }

        @Test
        @DisplayName("unknown contextual predicates → rules skipped")
        void unknownPredicates_skipRules() {
            ContextualRuleRegistry onlyAlways = new ContextualRuleRegistry(
                Map.<String, ContextualRule>of("always", (text, ctx) -> true));
            AntiPatternCatalog catalog = new AntiPatternCatalog(AntiPatternCatalog.DEFAULT_LOCATION,
                new ObjectMapper(), onlyAlways);
            assertTrue(catalog.rules().isEmpty());
        }
    }

    // ── detectPatterns ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("detectPatterns() — scoring and ranking")
    class DetectPatternsTests {

        @Test
        @DisplayName("\"Launch new mobile app\" → activity_focused on top")
        void activityObjective() {
            DetectionResult result = detector.detectPatterns("Launch new mobile app", TECH);

            assertTrue(result.detected());
            assertEquals("activity_focused", result.patterns().get(0).id());
            assertEquals(0.93, result.patterns().get(0).confidence(), 1e-9);
            assertEquals(Severity.HIGH, result.severity());
            assertEquals("Five Whys Technique", result.strategy().name());
            assertTrue(result.suggestedInterventions().contains(InterventionType.ACTIVITY_TO_OUTCOME));
        }

        @Test
        @DisplayName("severity ranks before confidence; interventions are distinct")
        void severityFirstOrdering() {
            DetectionResult result = detector.detectPatterns(
                "Grow revenue if the customer will adopt our new product", TECH);

            List<DetectedPattern> patterns = result.patterns();
            assertEquals("sphere_of_influence_violation", patterns.get(0).id());
            assertEquals(Severity.CRITICAL, result.severity());
            for (int i = 1; i < patterns.size(); i++) {
                assertTrue(patterns.get(i - 1).severity().rank() >= patterns.get(i).severity().rank(),
                    "out of order at " + i + ": " + patterns);
            }
            assertEquals(result.suggestedInterventions().stream().distinct().count(),
                result.suggestedInterventions().size());

            double mean = patterns.stream().mapToDouble(DetectedPattern::confidence).average().orElseThrow();
            assertEquals(mean, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("vanity metric without business value → vanity_metrics")
        void vanityMetric() {
            DetectionResult result = detector.detectPatterns("Get 10,000 Instagram followers", null);
            assertEquals("vanity_metrics", result.patterns().get(0).id());
            assertEquals(1.0, result.patterns().get(0).confidence(), 1e-9);
        }

        @Test
        @DisplayName("text without evidence → not detected")
        void noEvidence() {
            DetectionResult result = detector.detectPatterns("Hello there", TECH);
            assertFalse(result.detected());
            assertTrue(result.patterns().isEmpty());
            assertNull(result.strategy());
        }

        @Test
        @DisplayName("null or blank text → none")
        void blankText() {
            assertFalse(detector.detectPatterns(null, TECH).detected());
            assertFalse(detector.detectPatterns("  ", TECH).detected());
        }

        @Test
        @DisplayName("every detected confidence is in (0.3, 1]")
        void confidenceBounds() {
            DetectionResult result = detector.detectPatterns(
                "Launch, build, implement, deploy, develop and create the project platform system tool", TECH);
            assertTrue(result.detected());
            for (DetectedPattern p : result.patterns()) {
                assertTrue(p.confidence() > AntiPatternDetector.DETECTION_THRESHOLD && p.confidence() <= 1.0,
                    p.id() + " confidence " + p.confidence());
            }
        }
    }

    // ── patternConfidence ───────────────────────────────────────────────────

    @Nested
    @DisplayName("patternConfidence() — per-rule score")
    class PatternConfidenceTests {

        @Test
        @DisplayName("more evidence never lowers confidence")
        void monotonic() {
            AntiPatternRule activity = rule("activity_focused");
            double less = AntiPatternDetector.patternConfidence("Launch the app", activity, UserContext.empty());
            double more = AntiPatternDetector.patternConfidence("Launch and deploy the platform", activity,
                UserContext.empty());
            assertTrue(more >= less, "less=" + less + " more=" + more);
        }

        @Test
        @DisplayName("saturated evidence → clamped to 1.0")
        void clamped() {
            double c = AntiPatternDetector.patternConfidence(
                "Launch, build, implement, deploy the project platform system tool", rule("activity_focused"),
                UserContext.empty());
            assertEquals(1.0, c, 1e-9);
        }

        @Test
        @DisplayName("no evidence → severity bonus only, not boosted by the predicate")
        void noEvidence_noBoost() {
            double c = AntiPatternDetector.patternConfidence("Hello there", rule("activity_focused"),
                UserContext.empty());
            assertEquals(Severity.HIGH.confidenceBonus(), c, 1e-9);
        }
    }

    // ── generateReframingResponse ───────────────────────────────────────────

    @Nested
    @DisplayName("generateReframingResponse() — strategy questions")
    class ReframingTests {

        @Test
        @DisplayName("first attempt → personalised first question with industry example")
        void firstAttempt() {
            String text = "Launch new mobile app";
            DetectionResult detection = detector.detectPatterns(text, TECH);

            ReframingResult result = detector.generateReframingResponse(detection, text, TECH, 0).orElseThrow();

            assertEquals("That sounds like a project milestone! Let's explore what change Launch new mobile app "
                + "will create for your users or customers.", result.question());
            assertEquals(1, result.examples().size());
            assertEquals("Technology", result.examples().get(0).context());
            assertTrue(result.suggestion().contains("Delight customers"), result.suggestion());
            assertEquals(AntiPatternDetector.REFRAMING_CONFIDENCE, result.confidence(), 1e-9);
            assertFalse(result.followUpQuestions().isEmpty());
        }

        @Test
        @DisplayName("no industry → at most two examples")
        void noIndustry_twoExamples() {
            String text = "Launch new mobile app";
            DetectionResult detection = detector.detectPatterns(text, null);
            ReframingResult result = detector.generateReframingResponse(detection, text, null, 0).orElseThrow();
            assertEquals(2, result.examples().size());
        }

        @Test
        @DisplayName("attempts beyond the strategy's questions → fallback question")
        void exhaustedAttempts_fallback() {
            String text = "Launch new mobile app";
            DetectionResult detection = detector.detectPatterns(text, TECH);
            int asked = detection.strategy().questions().size();

            ReframingResult result = detector.generateReframingResponse(detection, text, TECH, asked).orElseThrow();

            assertEquals(AntiPatternDetector.FALLBACK_QUESTION, result.question());
        }

        @Test
        @DisplayName("nothing detected → empty")
        void nothingDetected_empty() {
            assertTrue(detector.generateReframingResponse(DetectionResult.none(), "Hello", TECH, 0).isEmpty());
        }
    }

    // ── evaluateReframingSuccess ────────────────────────────────────────────

    @Nested
    @DisplayName("evaluateReframingSuccess() — rewrite quality")
    class EvaluationTests {

        @Test
        @DisplayName("activity rewritten as measured outcome → success")
        void outcomeRewrite_succeeds() {
            ReframingEvaluation eval = detector.evaluateReframingSuccess("Launch new mobile app",
                "Increase mobile customer retention from 20% to 35% this quarter", null, TECH);

            assertTrue(eval.success());
            assertEquals(InterventionType.ACTIVITY_TO_OUTCOME, eval.type());
            assertEquals(42, eval.beforeScore());
            assertEquals(75, eval.afterScore());
            assertEquals("positive", eval.userResponse());
        }

        @Test
        @DisplayName("cosmetic rewrite → no success")
        void cosmeticRewrite_fails() {
            ReframingEvaluation eval = detector.evaluateReframingSuccess("Launch new mobile app",
                "Launch the new mobile app soon", null, TECH);
            assertFalse(eval.success());
            assertEquals("neutral", eval.userResponse());
        }

        @Test
        @DisplayName("text score is clamped to [0, 100]")
        void textScoreClamped() {
            assertEquals(100, AntiPatternDetector.textScore(
                "increase decrease improve reduce achieve result outcome impact value benefit 10"));
            assertEquals(25, AntiPatternDetector.textScore("better good more some many"));
        }
    }

    // ── extractDependencies ─────────────────────────────────────────────────

    @Nested
    @DisplayName("extractDependencies() — outside-control factors")
    class DependencyTests {

        @Test
        @DisplayName("customer choice, named team and condition → three dependencies")
        void mixedDependencies() {
            List<Dependency> deps = detector.extractDependencies(
                "Revenue grows if the customer will buy and the design team finishes on time.");

            assertEquals(List.of(DependencyType.CUSTOMER_BEHAVIOR, DependencyType.OTHER_TEAM,
                DependencyType.EXTERNAL_FACTOR), deps.stream().map(Dependency::type).toList());
            assertTrue(deps.get(2).description().startsWith("Conditional dependency: if the customer"),
                deps.get(2).description());
        }

        @Test
        @DisplayName("self-contained objective → none")
        void noDependencies() {
            assertTrue(detector.extractDependencies("Cut our build time from 20 to 5 minutes").isEmpty());
            assertTrue(detector.extractDependencies(null).isEmpty());
        }
    }
}
