package com.okrcoach.orchestrator.generation;

import com.okrcoach.core.altitude.AltitudeDriftTracker;
import com.okrcoach.core.altitude.DetectionMethod;
import com.okrcoach.core.altitude.InterventionTiming;
import com.okrcoach.core.altitude.ObjectiveScope;
import com.okrcoach.core.altitude.ScarfIntervention;
import com.okrcoach.core.altitude.ScopeDriftEvent;
import com.okrcoach.core.antipattern.ReframingResult;
import com.okrcoach.core.model.ConversationPhase;
import com.okrcoach.core.model.NeuralReadinessState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link RuleBasedResponseGenerator}.
 */
class RuleBasedResponseGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

    private final RuleBasedResponseGenerator generator = new RuleBasedResponseGenerator();

    private static CoachingPrompt prompt(ConversationPhase phase, ResponseStrategy strategy, ReframingResult reframing,
                                         ScarfIntervention scarf, String celebration, ConversationPhase transition,
                                         List<String> habitCelebrations) {
        return new CoachingPrompt("s-1", phase, 4, "message", strategy, List.of(), reframing, scarf,
            scarf != null ? InterventionTiming.IMMEDIATE : null, celebration, transition, "", habitCelebrations, "");
    }

    private static CoachingPrompt plain(ConversationPhase phase, ResponseStrategy strategy) {
        return prompt(phase, strategy, null, null, null, null, List.of());
    }

    @Test
    @DisplayName("discovery exploration → fixed opening")
    void discoveryOpening() {
        assertEquals(RuleBasedResponseGenerator.DISCOVERY_OPENING,
            generator.generate(plain(ConversationPhase.DISCOVERY, ResponseStrategy.DISCOVERY_EXPLORATION)));
    }

    @Test
    @DisplayName("question based in discovery → phase label and phase question")
    void questionBased() {
        assertEquals("Let's keep going with discovery. What outcome would make this quarter a success for you?",
            generator.generate(plain(ConversationPhase.DISCOVERY, ResponseStrategy.QUESTION_BASED)));
    }

    @Test
    @DisplayName("intensive reframing → reframing suggestion verbatim")
    void reframingSuggestion() {
        ReframingResult reframing = new ReframingResult("Why does this matter?", "Why does this matter?\n\nFor example...",
            List.of(), List.of(), "Outcome focus", null, 0.8);

        String text = generator.generate(prompt(ConversationPhase.REFINEMENT, ResponseStrategy.REFRAMING_INTENSIVE,
            reframing, null, null, null, List.of()));

        assertEquals("Why does this matter?\n\nFor example...", text);
    }

    @Test
    @DisplayName("gentle guidance with reframing → encouragement plus reframing question")
    void gentleGuidance() {
        ReframingResult reframing = new ReframingResult("Why does this matter?", "unused", List.of(), List.of(),
            "Outcome focus", null, 0.8);

        assertEquals("You're making progress. Why does this matter?", generator.generate(prompt(
            ConversationPhase.REFINEMENT, ResponseStrategy.GENTLE_GUIDANCE, reframing, null, null, null, List.of())));
    }

    @Test
    @DisplayName("altitude intervention → composed SCARF intervention")
    void altitudeIntervention() {
        AltitudeDriftTracker tracker = new AltitudeDriftTracker(Clock.fixed(NOW, ZoneOffset.UTC));
        ScopeDriftEvent event = new ScopeDriftEvent(NOW, ObjectiveScope.TEAM, ObjectiveScope.STRATEGIC, 0.8,
            DetectionMethod.KEYWORD, "Become the market leader", true);
        ScarfIntervention scarf = tracker.generateScarfIntervention(event, NeuralReadinessState.neutral());

        assertEquals(scarf.compose(), generator.generate(prompt(ConversationPhase.DISCOVERY,
            ResponseStrategy.ALTITUDE_INTERVENTION, null, scarf, null, null, List.of())));
    }

    @Test
    @DisplayName("celebration, transition and habit celebration → framed around the body in order")
    void partsInOrder() {
        String text = generator.generate(prompt(ConversationPhase.REFINEMENT, ResponseStrategy.VALIDATION_FOCUSED,
            null, null, "✅ Done!", ConversationPhase.REFINEMENT, List.of("Habit noted.")));

        String[] parts = text.split("\n\n");
        assertEquals(4, parts.length);
        assertEquals("✅ Done!", parts[0]);
        assertEquals("We're moving into Refinement.", parts[1]);
        assertTrue(parts[2].startsWith("Let's review the full OKR together. "));
        assertEquals("Habit noted.", parts[3]);
    }

    @Test
    @DisplayName("example driven → reference key result and KR question")
    void exampleDriven() {
        String text = generator.generate(plain(ConversationPhase.KR_DISCOVERY, ResponseStrategy.EXAMPLE_DRIVEN));

        assertTrue(text.startsWith(RuleBasedResponseGenerator.REFERENCE_KEY_RESULT));
        assertTrue(text.endsWith("Which two or three metrics would tell you the objective has been achieved?"));
    }
}
