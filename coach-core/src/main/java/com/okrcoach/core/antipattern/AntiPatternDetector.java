package com.okrcoach.core.antipattern;

import com.okrcoach.core.model.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.okrcoach.core.text.TextSignals.ci;
import static com.okrcoach.core.text.TextSignals.countMatches;
import static com.okrcoach.core.text.TextSignals.matches;

/**
 * Rule-based OKR anti-pattern classifier and reframer.
 *
 * <h3>Confidence per rule</h3>
 * <ol>
 *   <li>regex evidence: {@code min(matches × 0.25, 0.7)}</li>
 *   <li>keyword evidence: {@code min(keywordHits × 0.18, 0.45)}</li>
 *   <li>when there is any evidence and the contextual predicate holds: {@code +0.4},
 *       then floored at {@value #CONTEXT_FLOOR}</li>
 *   <li>severity bonus (critical .15, high .10, medium .05, low 0)</li>
 *   <li>clamped to [0, 1]; detected when strictly above {@value #DETECTION_THRESHOLD}</li>
 * </ol>
 * Adding evidence never lowers a rule's confidence.
 *
 * <p>Stateless apart from the memoized catalogue; thread-safe.
 */
public class AntiPatternDetector {

    private static final Logger log = LoggerFactory.getLogger(AntiPatternDetector.class);

    public static final double REGEX_WEIGHT        = 0.25;
    public static final double REGEX_CAP           = 0.70;
    public static final double KEYWORD_WEIGHT      = 0.18;
    public static final double KEYWORD_CAP         = 0.45;
    public static final double CONTEXT_BOOST       = 0.40;
    public static final double CONTEXT_FLOOR       = 0.60;
    public static final double DETECTION_THRESHOLD = 0.30;

    /** Confidence reported on every generated reframing. */
    public static final double REFRAMING_CONFIDENCE = 0.8;

    /** Success when the rewrite's detection confidence drops below this share of the original. */
    public static final double CONFIDENCE_REDUCTION_RATIO = 0.7;

    /** Success when the rewrite's text score beats the original by more than this. */
    public static final int SCORE_IMPROVEMENT_MARGIN = 10;

    static final String FALLBACK_QUESTION =
        "Let's step back. What change or improvement will people see when this succeeds?";

    private static final int MAX_EXAMPLES = 2;

    private static final Pattern ACTIVITY_PHRASE = ci(
        "\\b(implement|launch|complete|deliver|build|create|develop|deploy)\\s+([^.!?]+)");

    private static final List<Pattern> OUTCOME_WORDS = words(
        "increase", "decrease", "improve", "reduce", "achieve", "result", "outcome", "impact", "value", "benefit");
    private static final List<Pattern> ACTIVITY_WORDS = words(
        "implement", "launch", "complete", "deliver", "build", "create", "develop");
    private static final List<Pattern> VAGUE_WORDS = words("better", "good", "more", "some", "many");
    private static final Pattern ANY_DIGIT = Pattern.compile("\\d+");

    // ── Dependency vocabularies ─────────────────────────────────────────────

    private static final Pattern CUSTOMER_BEHAVIOR = ci(
        "\\b(customer|user|client)\\s+(will|must|should|needs to|has to|chooses|decides|adopts|accepts|buys|uses)\\b");
    private static final Pattern OTHER_TEAM_RELIANCE = ci(
        "\\b(requires|depends on|needs|relies on)\\b.*\\b(team|department|group|function|org)\\b");
    private static final Pattern NAMED_OTHER_TEAM = ci(
        "\\b(other team|another team|delivery team|design team|sales team|support team|operations team)\\b");
    private static final Pattern MARKET = ci("\\b(market|industry|competition|competitor|economic|economy|trends)\\b");
    private static final Pattern MARKET_CONDITION = ci("\\b(if|when|assuming|provided|grows|changes|shifts|evolves)\\b");
    private static final Pattern EXTERNAL_PARTY = ci(
        "\\b(partner|vendor|third party|external|supplier|contractor)\\b.*\\b(delivers|provides|completes|supports)\\b");
    private static final Pattern CONDITIONAL_CLAUSE = ci(
        "\\b(if|when|once|assuming|provided that|contingent on)\\b[^.!?]*");

    private final AntiPatternCatalog catalog;

    public AntiPatternDetector(AntiPatternCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Scores {@code text} against every catalogue rule.
     *
     * @param context optional user context; null is treated as empty
     * @return detection summary; never null
     */
    public DetectionResult detectPatterns(String text, UserContext context) {
        if (text == null || text.isBlank()) {
            return DetectionResult.none();
        }
        UserContext ctx = context != null ? context : UserContext.empty();

        List<DetectedPattern> detected = new ArrayList<>();
        Severity maxSeverity = Severity.LOW;
        double total = 0.0;
        for (AntiPatternRule rule : catalog.rules()) {
            double confidence = patternConfidence(text, rule, ctx);
            if (confidence > DETECTION_THRESHOLD) {
                detected.add(new DetectedPattern(rule.id(), rule.name(), rule.description(), confidence,
                    rule.severity(), rule.interventionType(), rule.strategy()));
                total += confidence;
                maxSeverity = Severity.max(maxSeverity, rule.severity());
            }
        }
        if (detected.isEmpty()) {
            log.debug("[AntiPatternDetector] No patterns. length={}", text.length());
            return DetectionResult.none();
        }

        LinkedHashSet<InterventionType> interventions = new LinkedHashSet<>();
        detected.forEach(p -> interventions.add(p.interventionType()));

        List<DetectedPattern> ranked = detected.stream()
            .sorted(Comparator.comparingInt((DetectedPattern p) -> p.severity().rank()).reversed()
                .thenComparing(Comparator.comparingDouble(DetectedPattern::confidence).reversed()))
            .toList();

        double mean = total / detected.size();
        log.debug("[AntiPatternDetector] Detected. patterns={} severity={} confidence={} top={}",
            ranked.size(), maxSeverity, String.format("%.2f", mean), ranked.get(0).id());
        return new DetectionResult(true, ranked, maxSeverity, mean, List.copyOf(interventions),
            ranked.get(0).strategy());
    }

    /**
     * Builds the next reframing question for the active strategy.
     *
     * @param previousAttempts questions of this strategy already asked; selects the template
     * @return empty when nothing was detected
     */
    public Optional<ReframingResult> generateReframingResponse(DetectionResult detection, String text,
                                                               UserContext context, int previousAttempts) {
        if (detection == null || !detection.detected() || detection.strategy() == null) {
            return Optional.empty();
        }
        UserContext ctx = context != null ? context : UserContext.empty();
        ReframingStrategy strategy = detection.strategy();
        InterventionType intervention = detection.patterns().get(0).interventionType();

        int attempt = Math.max(0, previousAttempts);
        String template = attempt < strategy.questions().size()
            ? strategy.questions().get(attempt)
            : FALLBACK_QUESTION;
        String question = personalize(template, text, ctx);

        List<ReframingExample> examples = selectExamples(strategy, ctx);
        String suggestion = examples.isEmpty()
            ? question
            : question + "\n\nFor example, instead of:\n\"" + examples.get(0).before()
                + "\"\n\nConsider:\n\"" + examples.get(0).after() + "\"\n\n" + examples.get(0).explanation();

        return Optional.of(new ReframingResult(question, suggestion, examples, intervention.followUpQuestions(),
            intervention.expectedOutcome(), strategy.technique(), REFRAMING_CONFIDENCE));
    }

    /**
     * Judges whether {@code reframedText} improves on {@code originalText}: either detection
     * confidence fell below 70% of the original, or the text score rose by more than 10.
     */
    public ReframingEvaluation evaluateReframingSuccess(String originalText, String reframedText,
                                                       ReframingStrategy strategy, UserContext context) {
        DetectionResult before = detectPatterns(originalText, context);
        DetectionResult after = detectPatterns(reframedText, context);
        int beforeScore = textScore(originalText);
        int afterScore = textScore(reframedText);

        boolean success = after.confidence() < before.confidence() * CONFIDENCE_REDUCTION_RATIO
            || afterScore > beforeScore + SCORE_IMPROVEMENT_MARGIN;

        InterventionType type = before.patterns().isEmpty()
            ? InterventionType.ACTIVITY_TO_OUTCOME
            : before.patterns().get(0).interventionType();
        return new ReframingEvaluation(type, true, success, beforeScore, afterScore,
            strategy != null ? strategy.name() : null, success ? "positive" : "neutral");
    }

    /**
     * Lists what the objective relies on outside the team's control.
     */
    public List<Dependency> extractDependencies(String text) {
        List<Dependency> deps = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return deps;
        }
        if (matches(CUSTOMER_BEHAVIOR, text)) {
            deps.add(new Dependency(DependencyType.CUSTOMER_BEHAVIOR,
                "Depends on customer or user choices", Controllability.LOW));
        }
        if (matches(OTHER_TEAM_RELIANCE, text) || matches(NAMED_OTHER_TEAM, text)) {
            deps.add(new Dependency(DependencyType.OTHER_TEAM,
                "Depends on another team's delivery", Controllability.MEDIUM));
        }
        if (matches(MARKET, text) && matches(MARKET_CONDITION, text)) {
            deps.add(new Dependency(DependencyType.MARKET_DYNAMICS,
                "Depends on market conditions", Controllability.NONE));
        }
        if (matches(EXTERNAL_PARTY, text)) {
            deps.add(new Dependency(DependencyType.EXTERNAL_FACTOR,
                "Depends on an external partner or vendor", Controllability.LOW));
        }
        Matcher conditional = CONDITIONAL_CLAUSE.matcher(text);
        while (conditional.find()) {
            String clause = conditional.group().trim();
            String excerpt = clause.length() > 80 ? clause.substring(0, 80) : clause;
            deps.add(new Dependency(DependencyType.EXTERNAL_FACTOR,
                "Conditional dependency: " + excerpt, Controllability.LOW));
        }
        return deps;
    }

    // ── Scoring ─────────────────────────────────────────────────────────────

    static double patternConfidence(String text, AntiPatternRule rule, UserContext ctx) {
        int regexMatches = 0;
        for (Pattern p : rule.detectionPatterns()) {
            regexMatches += countMatches(p, text);
        }
        int keywordHits = 0;
        for (Pattern p : rule.keywordPatterns()) {
            if (p.matcher(text).find()) keywordHits++;
        }

        double confidence = Math.min(regexMatches * REGEX_WEIGHT, REGEX_CAP)
                          + Math.min(keywordHits * KEYWORD_WEIGHT, KEYWORD_CAP);

        boolean evidence = regexMatches > 0 || keywordHits > 0;
        if (evidence && rule.contextRule().test(text, ctx)) {
            confidence = Math.max(confidence + CONTEXT_BOOST, CONTEXT_FLOOR);
        }
        confidence += rule.severity().confidenceBonus();
        return Math.max(0.0, Math.min(confidence, 1.0));
    }

    /** Lexical quality score in [0, 100], starting at 50. */
    static int textScore(String text) {
        if (text == null) return 0;
        int score = 50;
        score += 10 * countWords(OUTCOME_WORDS, text);
        score -= 8 * countWords(ACTIVITY_WORDS, text);
        if (ANY_DIGIT.matcher(text).find()) score += 15;
        score -= 5 * countWords(VAGUE_WORDS, text);
        return Math.max(0, Math.min(100, score));
    }

    private static int countWords(List<Pattern> words, String text) {
        return (int) words.stream().filter(w -> w.matcher(text).find()).count();
    }

    private static List<Pattern> words(String... words) {
        return Arrays.stream(words).map(w -> ci("\\b" + w + "\\b")).toList();
    }

    // ── Personalisation ─────────────────────────────────────────────────────

    private static String personalize(String template, String text, UserContext ctx) {
        Matcher activity = ACTIVITY_PHRASE.matcher(text != null ? text : "");
        String activityText = activity.find() ? activity.group().trim() : "this initiative";
        String function = blankToNull(ctx.function());
        String industry = blankToNull(ctx.industry());
        return template
            .replace("{activity}", activityText)
            .replace("{user_name}", function != null ? function : "you")
            .replace("{industry}", industry != null ? industry : "your industry")
            .replace("{function}", function != null ? function : "your role");
    }

    private static List<ReframingExample> selectExamples(ReframingStrategy strategy, UserContext ctx) {
        List<ReframingExample> pool = strategy.examples();
        String industry = blankToNull(ctx.industry());
        if (industry != null) {
            String needle = industry.toLowerCase(Locale.ROOT);
            List<ReframingExample> relevant = pool.stream()
                .filter(ex -> ex.context() != null && ex.context().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
            if (!relevant.isEmpty()) {
                pool = relevant;
            }
        }
        return pool.stream().limit(MAX_EXAMPLES).toList();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
