package com.okrcoach.orchestrator.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.okrcoach.core.altitude.AltitudeDriftTracker;
import com.okrcoach.core.altitude.AltitudeTracker;
import com.okrcoach.core.altitude.DetectionMethod;
import com.okrcoach.core.altitude.ObjectiveScope;
import com.okrcoach.core.checkpoint.CheckpointProgressEngine;
import com.okrcoach.core.checkpoint.CheckpointProgressTracker;
import com.okrcoach.core.habit.HabitReinforcementEngine;
import com.okrcoach.core.model.ConversationPhase;
import com.okrcoach.core.model.UserContext;
import com.okrcoach.core.question.QuestionState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link InMemorySessionContextStore}.
 */
class InMemorySessionContextStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final InMemorySessionContextStore store =
        new InMemorySessionContextStore(new ObjectMapper().registerModule(new JavaTimeModule()));

    private SessionContext session() {
        CheckpointProgressEngine checkpoints = new CheckpointProgressEngine(clock);
        AltitudeDriftTracker altitude = new AltitudeDriftTracker(clock);
        CheckpointProgressTracker tracker = checkpoints.completeCheckpoint(checkpoints.initialize("s-1", ConversationPhase.DISCOVERY),
            "discovery_context", 0.9, List.of("Role mentioned")).orElseThrow().tracker();
        AltitudeTracker altitudeTracker = altitude.recordDriftEvent(altitude.initialize(ObjectiveScope.TEAM, "Engineering Manager"),
            ObjectiveScope.STRATEGIC, "Become the market leader", DetectionMethod.KEYWORD);
        QuestionState questions = new QuestionState(List.of("What challenge are you facing?"),
            List.of("What is your role?"), "What is your role?", Map.of(), "Context");
        return new SessionContext("s-1", ConversationPhase.DISCOVERY, tracker, altitudeTracker, questions,
            new HabitReinforcementEngine(clock).initializeCoreHabits(), UserContext.of("Technology", "Engineering"),
            Map.of("Five Whys Technique", 2), 3, NOW);
    }

    @Test
    @DisplayName("save then load → equal snapshot")
    void roundTrip() {
        SessionContext ctx = session();
        store.save(ctx);

        assertEquals(Optional.of(ctx), store.load("s-1"));
    }

    @Test
    @DisplayName("unknown id → empty")
    void missing() {
        assertTrue(store.load("nope").isEmpty());
    }

    @Test
    @DisplayName("save replaces the previous snapshot")
    void overwrite() {
        SessionContext ctx = session();
        store.save(ctx);
        SessionContext later = new SessionContext(ctx.sessionId(), ConversationPhase.REFINEMENT, ctx.checkpointTracker(),
            ctx.altitudeTracker(), ctx.questionState(), ctx.habitTrackers(), ctx.userContext(),
            ctx.reframingAttempts(), 4, NOW.plusSeconds(60));
        store.save(later);

        SessionContext loaded = store.load("s-1").orElseThrow();
        assertEquals(4, loaded.turnCount());
        assertEquals(ConversationPhase.REFINEMENT, loaded.phase());
    }
}
