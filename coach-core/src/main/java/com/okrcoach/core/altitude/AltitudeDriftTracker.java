package com.okrcoach.core.altitude;

import com.okrcoach.core.altitude.ScarfIntervention.AutonomyChoice;
import com.okrcoach.core.altitude.ScarfIntervention.CertaintyBuilding;
import com.okrcoach.core.altitude.ScarfIntervention.Fairness;
import com.okrcoach.core.altitude.ScarfIntervention.Relatedness;
import com.okrcoach.core.altitude.ScarfIntervention.StatusPreservation;
import com.okrcoach.core.model.EmotionalState;
import com.okrcoach.core.model.NeuralReadinessState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.okrcoach.core.text.TextSignals.ci;
import static com.okrcoach.core.text.TextSignals.matches;

/**
 * Tracks the organizational altitude of a session's objective and reacts to drift.
 *
 * <h3>Drift magnitude</h3>
 * <p>For a rank distance {@code d} between scopes: {@code min(1, d² × 0.2)}. One level is a
 * nudge (0.2), two levels a clear mismatch (0.8), three or more saturate at 1.0. Drifts of
 * {@value #INTERVENTION_MAGNITUDE} or more trigger an intervention.
 *
 * <h3>Intervention timing</h3>
 * <ul>
 *   <li>threat state → {@link InterventionTiming#IMMEDIATE}</li>
 *   <li>magnitude ≥ 0.6 and readiness below 0.3 → {@link InterventionTiming#IMMEDIATE}</li>
 *   <li>magnitude ≥ 0.6 with readiness → {@link InterventionTiming#AFTER_REFLECTION}</li>
 *   <li>0.4 ≤ magnitude &lt; 0.6 with any reflection signal → {@link InterventionTiming#AFTER_REFLECTION}</li>
 *   <li>otherwise → {@link InterventionTiming#NEXT_TURN}</li>
 * </ul>
 */
public class AltitudeDriftTracker {

    private static final Logger log = LoggerFactory.getLogger(AltitudeDriftTracker.class);

    public static final double MAGNITUDE_PER_LEVEL_SQUARED = 0.2;
    public static final double INTERVENTION_MAGNITUDE      = 0.5;
    public static final double STABILITY_PENALTY_FACTOR    = 0.2;
    public static final double MIN_STABILITY               = 0.3;

    public static final double HIGH_DRIFT          = 0.6;
    public static final double MODERATE_DRIFT      = 0.4;
    public static final double LOW_READINESS       = 0.3;
    public static final double SUCCESSFUL_INTERVENTION = 0.7;

    private static final Pattern OPEN_QUESTIONING   = ci("\\b(how|what if|should i|would it|could we|is it better)\\b");
    private static final Pattern TENTATIVE          = ci("\\b(maybe|perhaps|i think|i'm wondering|not sure|trying to)\\b");
    private static final Pattern REFRAMING          = ci("\\b(or|instead|rather than|different|another way|alternatively)\\b");
    private static final Pattern PAUSING            = ci("\\b(hmm|let me think|give me a moment|pause|hold on)\\b");
    private static final Pattern QUESTIONING        = ci("\\b(wait|is that|assumption|actually|really|correct|sure about)\\b");
    private static final Pattern CONNECTING         = ci("(\\baha\\b|\\boh!|\\bso that means\\b|\\bif\\b.*\\bthen\\b|\\bthat means\\b|\\bi see\\b|\\bmakes sense now\\b)");
    private static final Pattern VERBALIZING        = ci("\\b(so basically|what you're saying|in other words|let me see if|my understanding)\\b");
    private static final int     THINKING_LENGTH    = 150;

    private final Clock clock;

    public AltitudeDriftTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts altitude tracking. A null {@code scope} is inferred from {@code roleLabel}.
     */
    public AltitudeTracker initialize(ObjectiveScope scope, String roleLabel) {
        ObjectiveScope initial = scope != null ? scope : ScopeClassifier.fromRole(roleLabel);
        return new AltitudeTracker(initial, initial, roleLabel, 1.0, List.of(), 1.0, List.of());
    }

    /**
     * Classifies {@code text}; detection is positive only when the matched scope differs
     * from the tracker's current scope.
     */
    public DriftDetection detectDrift(String text, AltitudeTracker tracker) {
        Optional<ObjectiveScope> matched = ScopeClassifier.classify(text);
        if (matched.isEmpty()) {
            return new DriftDetection(false, tracker.currentScope(), 0.0);
        }
        ObjectiveScope scope = matched.get();
        return new DriftDetection(scope != tracker.currentScope(), scope, ScopeClassifier.confidence(text, scope));
    }

    public AltitudeTracker recordDriftEvent(AltitudeTracker tracker, ObjectiveScope newScope,
                                           String triggerText, DetectionMethod method) {
        ObjectiveScope from = tracker.currentScope();
        double magnitude = driftMagnitude(from, newScope);
        ScopeDriftEvent event = new ScopeDriftEvent(clock.instant(), from, newScope, magnitude,
            method != null ? method : DetectionMethod.KEYWORD, triggerText, magnitude >= INTERVENTION_MAGNITUDE);

        List<ScopeDriftEvent> history = new ArrayList<>(tracker.scopeDriftHistory());
        history.add(event);
        double stability = Math.max(MIN_STABILITY, tracker.stabilityScore() - magnitude * STABILITY_PENALTY_FACTOR);

        log.info("[AltitudeDriftTracker] Drift recorded. from={} to={} magnitude={} intervention={}",
            from, newScope, magnitude, event.triggeredIntervention());
        return new AltitudeTracker(tracker.initialScope(), newScope, tracker.roleLabel(), tracker.confidenceLevel(),
            history, stability, tracker.interventionHistory());
    }

    public static double driftMagnitude(ObjectiveScope from, ObjectiveScope to) {
        int distance = Math.abs(from.rank() - to.rank());
        return Math.min(1.0, distance * distance * MAGNITUDE_PER_LEVEL_SQUARED);
    }

    public InsightReadinessSignals detectInsightReadiness(String message) {
        if (message == null || message.isBlank()) {
            return InsightReadinessSignals.none();
        }
        boolean open        = matches(OPEN_QUESTIONING, message);
        boolean pauses      = message.length() > THINKING_LENGTH;
        boolean tentative   = matches(TENTATIVE, message);
        boolean reframing   = matches(REFRAMING, message);
        boolean pausing     = matches(PAUSING, message);
        boolean questioning = matches(QUESTIONING, message);
        boolean connecting  = matches(CONNECTING, message);
        boolean verbalizing = matches(VERBALIZING, message);

        double overall = (open ? 0.15 : 0) + (pauses ? 0.10 : 0) + (tentative ? 0.15 : 0)
            + (reframing ? 0.15 : 0) + (pausing ? 0.15 : 0) + (questioning ? 0.10 : 0)
            + (connecting ? 0.10 : 0) + (verbalizing ? 0.10 : 0);

        return new InsightReadinessSignals(open, pauses, tentative, reframing, pausing, questioning,
            connecting, verbalizing, Math.min(1.0, overall));
    }

    public InterventionTiming determineInterventionTiming(double driftMagnitude, InsightReadinessSignals signals,
                                                          NeuralReadinessState neuralState) {
        InsightReadinessSignals s = signals != null ? signals : InsightReadinessSignals.none();
        if (neuralState != null && neuralState.currentState() == EmotionalState.THREAT) {
            return InterventionTiming.IMMEDIATE;
        }
        if (driftMagnitude >= HIGH_DRIFT) {
            return s.overallReadiness() < LOW_READINESS
                ? InterventionTiming.IMMEDIATE
                : InterventionTiming.AFTER_REFLECTION;
        }
        if (driftMagnitude >= MODERATE_DRIFT && s.anyReflectionSignal()) {
            return InterventionTiming.AFTER_REFLECTION;
        }
        return InterventionTiming.NEXT_TURN;
    }

    /**
     * Builds the five-part intervention for a drift, phrased for its direction and target altitude.
     */
    public ScarfIntervention generateScarfIntervention(ScopeDriftEvent event, NeuralReadinessState neuralState) {
        boolean up = event.driftingUp();
        ObjectiveScope from = event.fromScope();
        ObjectiveScope to = event.toScope();
        boolean threatened = neuralState != null && neuralState.currentState() == EmotionalState.THREAT;

        StatusPreservation status = new StatusPreservation(
            up ? "I appreciate you thinking big with this objective!"
               : "You're being thoughtful about scope and practicality.",
            up ? "Let's channel that ambition into an objective you can directly influence and measure."
               : "We can make this more impactful at your organizational level.");

        List<String> steps = up
            ? List.of("Identify what your " + from.displayName() + " can directly control",
                      "Define measurable outcomes within your authority",
                      "Ensure you can track progress independently")
            : List.of("Clarify your span of control and authority",
                      "Identify stakeholders you need to influence",
                      "Define success criteria you can measure");
        CertaintyBuilding certainty = new CertaintyBuilding(steps,
            up ? "An objective that creates measurable impact at the " + from.displayName() + " level."
               : "An objective that maximizes your influence and authority at the " + to.displayName() + " level.");

        AutonomyChoice autonomy = new AutonomyChoice(
            up ? "Would you like to explore how your team can contribute to this broader goal?"
               : "Should we focus on what you can directly control and measure?",
            up ? "Or shall we identify the outcome you want to create within your team's scope?"
               : "Or would you prefer to expand this to show broader impact?");

        Relatedness relatedness = new Relatedness(
            threatened
                ? "We're on the same side here. Let's work together to find the sweet spot between ambition and achievability."
                : "Let's work together to find the sweet spot between ambition and achievability.",
            "Our shared goal is creating an OKR that drives real impact you can own and measure.");

        Fairness fairness = new Fairness(
            up ? "This objective feels like it requires " + to.displayName()
                    + " authority and resources. We want to ensure you can realistically achieve and measure it."
               : "We're adjusting the scope to match your organizational level and span of control.",
            "These same principles apply to everyone creating OKRs - matching objectives to authority and measurability.");

        return new ScarfIntervention(status, certainty, autonomy, relatedness, fairness);
    }

    public DiscoveryQuestions generateDiscoveryQuestions(ScopeDriftEvent event, AriaStage stage) {
        ObjectiveScope from = event.fromScope();
        ObjectiveScope to = event.toScope();
        return switch (stage) {
            case AWARENESS -> new DiscoveryQuestions(stage,
                event.driftingUp()
                    ? "I notice this objective has " + to.displayName() + " scope."
                    : "This objective seems focused at the " + to.displayName() + " level.",
                List.of("What organizational resources do you directly control to achieve this?",
                        "Who else would need to be involved to make this happen?",
                        "If you weren't involved, could this still happen?"),
                "Help me understand: What's within your team's direct influence versus what requires broader organizational action?",
                "Let's discover the outcome you want to create that's within your span of control.");
            case REFLECTION -> new DiscoveryQuestions(stage,
                "Let's think about the scope of impact here.",
                List.of("If we achieved this objective, would it be because of your team's work, or company-wide efforts?",
                        "What would change specifically in your area of responsibility?",
                        "How would you measure your team's contribution to this outcome?"),
                "We want to ensure this is something you can realistically own and measure.",
                "What would a " + from.displayName() + " version of this impact look like?");
            case ILLUMINATION -> new DiscoveryQuestions(stage,
                "Great insights! You're seeing the distinction between " + to.displayName() + " and "
                    + from.displayName() + " objectives.",
                List.of("How does this reframed objective feel in terms of your authority and measurability?",
                        "Does this capture the impact you want to create at your level?"),
                "We're finding the sweet spot between ambition and achievability.",
                "This objective now reflects meaningful impact you can directly drive and measure.");
        };
    }

    public AltitudeTracker recordIntervention(AltitudeTracker tracker, ScopeDriftEvent event,
                                             ScarfIntervention intervention, InterventionTiming timing,
                                             InsightReadinessSignals readiness) {
        double overall = readiness != null ? readiness.overallReadiness() : 0.0;
        List<AltitudeIntervention> history = new ArrayList<>(tracker.interventionHistory());
        history.add(new AltitudeIntervention(clock.instant(), event.driftMagnitude(), intervention, timing,
            overall, null, null));
        log.info("[AltitudeDriftTracker] Intervention recorded. magnitude={} timing={} readiness={}",
            event.driftMagnitude(), timing, overall);
        return new AltitudeTracker(tracker.initialScope(), tracker.currentScope(), tracker.roleLabel(),
            tracker.confidenceLevel(), tracker.scopeDriftHistory(), tracker.stabilityScore(), history);
    }

    /**
     * Scores the last intervention: 1.0 when the rewritten objective is back at the initial
     * altitude, 0.7 for a positive reaction, 0.3 otherwise. No-op without interventions.
     */
    public AltitudeTracker updateInterventionEffectiveness(AltitudeTracker tracker, InterventionResponse response,
                                                          String newObjective) {
        List<AltitudeIntervention> history = tracker.interventionHistory();
        if (history.isEmpty()) {
            return tracker;
        }
        ObjectiveScope newScope = ScopeClassifier.classify(newObjective).orElse(tracker.currentScope());
        boolean aligned = newScope == tracker.initialScope();
        double score = aligned ? 1.0 : response == InterventionResponse.POSITIVE ? 0.7 : 0.3;

        List<AltitudeIntervention> updated = new ArrayList<>(history);
        int last = updated.size() - 1;
        updated.set(last, updated.get(last).withOutcome(response, score));
        log.info("[AltitudeDriftTracker] Effectiveness updated. response={} aligned={} score={}",
            response, aligned, score);
        return new AltitudeTracker(tracker.initialScope(), tracker.currentScope(), tracker.roleLabel(),
            tracker.confidenceLevel(), tracker.scopeDriftHistory(), tracker.stabilityScore(), updated);
    }

    public StabilityMetrics stabilityMetrics(AltitudeTracker tracker) {
        int drifts = tracker.scopeDriftHistory().size();
        long corrected = tracker.scopeDriftHistory().stream().filter(ScopeDriftEvent::triggeredIntervention).count();
        int interventions = tracker.interventionHistory().size();
        long successful = tracker.interventionHistory().stream()
            .filter(i -> i.effectivenessScore() != null && i.effectivenessScore() >= SUCCESSFUL_INTERVENTION)
            .count();
        return new StabilityMetrics(
            drifts > 0 ? (double) corrected / drifts : 1.0,
            interventions > 0 ? (double) successful / interventions : 0.0,
            tracker.stabilityScore());
    }
}
