package com.okrcoach.orchestrator.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.okrcoach.core.altitude.AltitudeTracker;
import com.okrcoach.core.checkpoint.CheckpointProgressTracker;
import com.okrcoach.core.habit.HabitTracker;
import com.okrcoach.core.model.ConversationPhase;
import com.okrcoach.core.model.UserContext;
import com.okrcoach.core.question.QuestionState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the coaching pipeline knows about one session, persisted as a single snapshot
 * after each turn.
 *
 * <ul>
 *   <li>{@code reframingAttempts} – reframing questions already asked, per strategy name.</li>
 *   <li>{@code turnCount}         – user turns processed so far.</li>
 * </ul>
 */
public record SessionContext(
    @JsonProperty("sessionId")         String sessionId,
    @JsonProperty("phase")             ConversationPhase phase,
    @JsonProperty("checkpointTracker") CheckpointProgressTracker checkpointTracker,
    @JsonProperty("altitudeTracker")   AltitudeTracker altitudeTracker,
    @JsonProperty("questionState")     QuestionState questionState,
    @JsonProperty("habitTrackers")     List<HabitTracker> habitTrackers,
    @JsonProperty("userContext")       UserContext userContext,
    @JsonProperty("reframingAttempts") Map<String, Integer> reframingAttempts,
    @JsonProperty("turnCount")         int turnCount,
    @JsonProperty("updatedAt")         Instant updatedAt
) {

    public SessionContext {
        habitTrackers = habitTrackers != null ? List.copyOf(habitTrackers) : List.of();
        userContext = userContext != null ? userContext : UserContext.empty();
        reframingAttempts = reframingAttempts != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(reframingAttempts))
            : Map.of();
    }
}
