package com.okrcoach.orchestrator.pipeline;

import com.okrcoach.core.altitude.AltitudeDriftTracker;
import com.okrcoach.core.altitude.AltitudeIntervention;
import com.okrcoach.core.altitude.AltitudeTracker;
import com.okrcoach.core.altitude.DetectionMethod;
import com.okrcoach.core.altitude.DriftDetection;
import com.okrcoach.core.altitude.InsightReadinessSignals;
import com.okrcoach.core.altitude.InterventionResponse;
import com.okrcoach.core.altitude.InterventionTiming;
import com.okrcoach.core.altitude.ObjectiveScope;
import com.okrcoach.core.altitude.ScarfIntervention;
import com.okrcoach.core.altitude.ScopeClassifier;
import com.okrcoach.core.altitude.ScopeDriftEvent;
import com.okrcoach.core.antipattern.AntiPatternDetector;
import com.okrcoach.core.antipattern.DetectedPattern;
import com.okrcoach.core.antipattern.DetectionResult;
import com.okrcoach.core.antipattern.ReframingResult;
import com.okrcoach.core.checkpoint.BacktrackReason;
import com.okrcoach.core.checkpoint.BacktrackResult;
import com.okrcoach.core.checkpoint.CheckpointProgressEngine;
import com.okrcoach.core.checkpoint.CheckpointProgressTracker;
import com.okrcoach.core.checkpoint.CompletionResult;
import com.okrcoach.core.habit.HabitReinforcementEngine;
import com.okrcoach.core.habit.HabitTracker;
import com.okrcoach.core.model.ConversationPhase;
import com.okrcoach.core.model.NeuralReadinessState;
import com.okrcoach.core.model.UserContext;
import com.okrcoach.core.question.NextQuestion;
import com.okrcoach.core.question.QuestionFlowManager;
import com.okrcoach.core.question.QuestionFlowResult;
import com.okrcoach.core.question.QuestionState;
import com.okrcoach.orchestrator.exception.CoachingException;
import com.okrcoach.orchestrator.generation.CoachingPrompt;
import com.okrcoach.orchestrator.generation.ResponseGenerator;
import com.okrcoach.orchestrator.generation.ResponseStrategy;
import com.okrcoach.orchestrator.session.SessionContext;
import com.okrcoach.orchestrator.session.SessionContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs one coaching turn end to end over a session's stored context.
 *
 * <h3>Turn order</h3>
 * <ol>
 *   <li>record the message as the answer to the open question, if any</li>
 *   <li>anti-pattern detection</li>
 *   <li>altitude: score the last intervention, detect and record drift, raise an intervention
 *       unless the drift returns to the starting altitude</li>
 *   <li>checkpoint completion, phase advance when every checkpoint is done</li>
 *   <li>habit performance, at most one celebration per turn</li>
 *   <li>response strategy ({@link ResponseStrategySelector}) and reframing</li>
 *   <li>response generation, then one-question-per-turn post-processing; a lone question is
 *       recorded as asked, and a repeated one gives way to a queued question</li>
 *   <li>save the final snapshot</li>
 * </ol>
 *
 * <p>Turns of one session are serialized by a lock from a fixed pool of {@value #LOCK_STRIPES},
 * chosen by session id; other sessions run in parallel.
 * Only the final snapshot is saved, so a failed generation or save leaves the previous
 * snapshot in place. Store and generator failures surface as {@link CoachingException}.
 */
@Component
public class CoachingTurnPipeline {

    private static final Logger log = LoggerFactory.getLogger(CoachingTurnPipeline.class);
    private static final String COMPONENT = "CoachingTurnPipeline";

    static final int LOCK_STRIPES = 64;

    private final SessionContextStore store;
    private final ResponseGenerator generator;
    private final AntiPatternDetector detector;
    private final CheckpointProgressEngine checkpoints;
    private final AltitudeDriftTracker altitude;
    private final QuestionFlowManager questions;
    private final HabitReinforcementEngine habits;
    private final Clock clock;
    private final ObjectiveScope defaultScope;

    private final ReentrantLock[] sessionLocks = new ReentrantLock[LOCK_STRIPES];

    public CoachingTurnPipeline(SessionContextStore store, ResponseGenerator generator,
                                AntiPatternDetector detector, CheckpointProgressEngine checkpoints,
                                AltitudeDriftTracker altitude, QuestionFlowManager questions,
                                HabitReinforcementEngine habits, Clock clock,
                                @Value("${coaching.defaults.initial-scope:TEAM}") ObjectiveScope defaultScope) {
        this.store = store;
        this.generator = generator;
        this.detector = detector;
        this.checkpoints = checkpoints;
        this.altitude = altitude;
        this.questions = questions;
        this.habits = habits;
        this.clock = clock;
        this.defaultScope = defaultScope != null ? defaultScope : ObjectiveScope.TEAM;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            sessionLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Starts (or restarts) a session in the discovery phase. The initial altitude is inferred
     * from {@code roleLabel}, or taken from configuration when no role is given.
     */
    public SessionContext startSession(String sessionId, String roleLabel, UserContext userContext) {
        Objects.requireNonNull(sessionId, "sessionId");
        return withLock(sessionId, () -> {
            ObjectiveScope scope = roleLabel == null || roleLabel.isBlank() ? defaultScope : null;
            SessionContext ctx = new SessionContext(sessionId, ConversationPhase.DISCOVERY,
                checkpoints.initialize(sessionId, ConversationPhase.DISCOVERY),
                altitude.initialize(scope, roleLabel), QuestionState.empty(), habits.initializeCoreHabits(),
                userContext, Map.of(), 0, clock.instant());
            persist(ctx);
            log.info("[CoachingTurnPipeline] Session started. sessionId={} role={} scope={}",
                sessionId, roleLabel, ctx.altitudeTracker().initialScope());
            return ctx;
        });
    }

    /**
     * Processes one user message.
     *
     * @param neuralState the user's readiness this turn; null is treated as neutral
     * @throws CoachingException when the session is unknown or a collaborator fails
     */
    public TurnResult handleTurn(String sessionId, String message, NeuralReadinessState neuralState) {
        Objects.requireNonNull(sessionId, "sessionId");
        return withLock(sessionId, () -> runTurn(sessionId, message, neuralState));
    }

    /**
     * Completes a checkpoint on the assistant's judgement and saves the session.
     *
     * @return the celebration text; empty for unknown or already-complete checkpoints
     */
    public Optional<String> completeCheckpoint(String sessionId, String checkpointId, double confidence,
                                               List<String> evidence) {
        Objects.requireNonNull(sessionId, "sessionId");
        return withLock(sessionId, () -> {
            SessionContext ctx = require(sessionId);
            Optional<CompletionResult> result =
                checkpoints.completeCheckpoint(ctx.checkpointTracker(), checkpointId, confidence, evidence);
            if (result.isEmpty()) {
                return Optional.<String>empty();
            }
            String celebration = checkpoints.generateCelebration(result.get().newlyCompleted(), result.get().tracker());
            PhaseAdvance advance = advancePhaseIfComplete(result.get().tracker(), ctx.phase());
            persist(withProgress(ctx, advance.tracker(), advance.phase()));
            return Optional.of(celebration);
        });
    }

    /**
     * Returns to an earlier checkpoint of the current phase and saves the session.
     *
     * @return the backtrack framing; empty when the checkpoints do not allow it
     */
    public Optional<BacktrackResult> backtrack(String sessionId, String fromCheckpointId, String toCheckpointId,
                                               BacktrackReason reason, NeuralReadinessState neuralState) {
        Objects.requireNonNull(sessionId, "sessionId");
        return withLock(sessionId, () -> {
            SessionContext ctx = require(sessionId);
            Optional<BacktrackResult> result = checkpoints.handleBacktracking(ctx.checkpointTracker(),
                fromCheckpointId, toCheckpointId, reason, neuralState);
            result.ifPresent(r -> persist(withProgress(ctx, r.tracker(), ctx.phase())));
            return result;
        });
    }

    // ── Turn ────────────────────────────────────────────────────────────────

    private TurnResult runTurn(String sessionId, String message, NeuralReadinessState neuralState) {
        SessionContext ctx = require(sessionId);
        NeuralReadinessState state = neuralState != null ? neuralState : NeuralReadinessState.neutral();
        String text = message != null ? message : "";
        int turnNumber = ctx.turnCount() + 1;

        QuestionState questionState = questions.recordAnswer(text, ctx.questionState());

        DetectionResult detection = detector.detectPatterns(text, ctx.userContext());
        List<String> patternIds = detection.patterns().stream().map(DetectedPattern::id).toList();

        AltitudeTracker altitudeTracker = scoreLastIntervention(ctx.altitudeTracker(), text);
        DriftDetection drift = altitude.detectDrift(text, altitudeTracker);
        ScarfIntervention scarf = null;
        InterventionTiming timing = null;
        if (drift.detected()) {
            altitudeTracker = altitude.recordDriftEvent(altitudeTracker, drift.newScope(), text, DetectionMethod.KEYWORD);
            List<ScopeDriftEvent> history = altitudeTracker.scopeDriftHistory();
            ScopeDriftEvent event = history.get(history.size() - 1);
            if (event.triggeredIntervention() && event.toScope() != altitudeTracker.initialScope()) {
                InsightReadinessSignals readiness = altitude.detectInsightReadiness(text);
                timing = altitude.determineInterventionTiming(event.driftMagnitude(), readiness, state);
                scarf = altitude.generateScarfIntervention(event, state);
                altitudeTracker = altitude.recordIntervention(altitudeTracker, event, scarf, timing, readiness);
            }
        }

        CompletionResult completion = checkpoints.detectCompletion(text, ctx.checkpointTracker(), state);
        String celebration = completion.completed()
            .map(cp -> checkpoints.generateCelebration(cp, completion.tracker()))
            .orElse(null);
        PhaseAdvance advance = advancePhaseIfComplete(completion.tracker(), ctx.phase());

        List<String> habitCelebrations = new ArrayList<>();
        List<HabitTracker> habitTrackers = new ArrayList<>();
        for (HabitTracker habit : ctx.habitTrackers()) {
            if (!habits.detectPerformance(text, habit)) {
                habitTrackers.add(habit);
                continue;
            }
            HabitTracker updated = habits.recordPerformance(habit, true);
            habitTrackers.add(updated);
            if (habitCelebrations.isEmpty() && habits.shouldCelebrate(updated)) {
                habitCelebrations.add(habits.generateCelebration(updated));
            }
        }

        ResponseStrategy strategy = ResponseStrategySelector.select(advance.phase(), detection, ctx.turnCount(), timing);
        Map<String, Integer> attempts = new LinkedHashMap<>(ctx.reframingAttempts());
        ReframingResult reframing = null;
        if (detection.detected()
                && (strategy == ResponseStrategy.REFRAMING_INTENSIVE || strategy == ResponseStrategy.GENTLE_GUIDANCE)) {
            String key = detection.strategy().name();
            int previous = attempts.getOrDefault(key, 0);
            reframing = detector.generateReframingResponse(detection, text, ctx.userContext(), previous).orElse(null);
            if (reframing != null) {
                attempts.put(key, previous + 1);
            }
        }

        CoachingPrompt prompt = new CoachingPrompt(sessionId, advance.phase(), turnNumber, text, strategy, patternIds,
            reframing, scarf, timing, celebration, advance.advanced() ? advance.phase() : null,
            checkpoints.progressSummary(advance.tracker()), habitCelebrations, questions.contextSummary(questionState));

        String raw = generate(prompt);
        QuestionFlowResult split = questions.processResponse(raw, questionState);
        QuestionFlowResult flow = questions.trackAskedQuestion(split.responseToUser(), split.updatedState());
        String response = flow.responseToUser();
        QuestionState finalQuestions = flow.updatedState();
        if (questions.extractQuestions(response).questions().isEmpty()
                && questions.shouldAskNextQuestion(text, finalQuestions)) {
            NextQuestion next = questions.getNextQuestion(finalQuestions);
            response = response.isBlank() ? next.question() : response + "\n\n" + next.question();
            finalQuestions = next.updatedState();
        }

        SessionContext updated = new SessionContext(sessionId, advance.phase(), advance.tracker(), altitudeTracker,
            finalQuestions, habitTrackers, ctx.userContext(), attempts, turnNumber, clock.instant());
        persist(updated);

        log.info("[CoachingTurnPipeline] Turn complete. sessionId={} turn={} phase={} strategy={} patterns={} "
                + "checkpoint={} drift={} timing={} queued={}",
            sessionId, turnNumber, advance.phase(), strategy, patternIds,
            completion.completed().map(c -> c.id()).orElse(null), drift.detected(), timing,
            finalQuestions.pendingQuestions().size());

        return new TurnResult(sessionId, turnNumber, response, strategy, advance.phase(),
            completion.completed().map(c -> c.id()).orElse(null), advance.advanced(), patternIds,
            drift.detected(), timing, finalQuestions.pendingQuestions().size());
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    /**
     * Scores a pending intervention from the altitude of the user's next message: back at the
     * initial altitude is positive, still at the drifted altitude is resistant. Messages without
     * altitude language leave it pending.
     */
    private AltitudeTracker scoreLastIntervention(AltitudeTracker tracker, String text) {
        List<AltitudeIntervention> interventions = tracker.interventionHistory();
        if (interventions.isEmpty() || interventions.get(interventions.size() - 1).userResponse() != null) {
            return tracker;
        }
        Optional<ObjectiveScope> scope = ScopeClassifier.classify(text);
        if (scope.isEmpty()) {
            return tracker;
        }
        InterventionResponse response = scope.get() == tracker.initialScope() ? InterventionResponse.POSITIVE
            : scope.get() == tracker.currentScope() ? InterventionResponse.RESISTANT
            : InterventionResponse.NEUTRAL;
        return altitude.updateInterventionEffectiveness(tracker, response, text);
    }

    private PhaseAdvance advancePhaseIfComplete(CheckpointProgressTracker tracker, ConversationPhase phase) {
        if (!checkpoints.isPhaseComplete(tracker)) {
            return new PhaseAdvance(tracker, phase, false);
        }
        Optional<ConversationPhase> next = phase.next();
        if (next.isEmpty()) {
            return new PhaseAdvance(tracker, phase, false);
        }
        return new PhaseAdvance(checkpoints.transitionToPhase(tracker, next.get()), next.get(), true);
    }

    private SessionContext withProgress(SessionContext ctx, CheckpointProgressTracker tracker, ConversationPhase phase) {
        return new SessionContext(ctx.sessionId(), phase, tracker, ctx.altitudeTracker(), ctx.questionState(),
            ctx.habitTrackers(), ctx.userContext(), ctx.reframingAttempts(), ctx.turnCount(), clock.instant());
    }

    private String generate(CoachingPrompt prompt) {
        String raw;
        try {
            raw = generator.generate(prompt);
        } catch (CoachingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CoachingException(COMPONENT, "Response generation failed. sessionId=" + prompt.sessionId(), e);
        }
        if (raw == null) {
            throw new CoachingException(COMPONENT, "Response generator returned no text. sessionId=" + prompt.sessionId());
        }
        return raw;
    }

    private SessionContext require(String sessionId) {
        Optional<SessionContext> ctx;
        try {
            ctx = store.load(sessionId);
        } catch (CoachingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CoachingException(COMPONENT, "Session load failed. sessionId=" + sessionId, e);
        }
        return ctx.orElseThrow(() -> new CoachingException(COMPONENT, "Unknown session. sessionId=" + sessionId));
    }

    private void persist(SessionContext ctx) {
        try {
            store.save(ctx);
        } catch (CoachingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CoachingException(COMPONENT, "Session save failed. sessionId=" + ctx.sessionId(), e);
        }
    }

    private <T> T withLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String sessionId) {
        return sessionLocks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)];
    }

    private record PhaseAdvance(CheckpointProgressTracker tracker, ConversationPhase phase, boolean advanced) {}
}
