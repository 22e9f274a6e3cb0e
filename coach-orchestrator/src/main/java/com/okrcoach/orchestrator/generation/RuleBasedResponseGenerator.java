package com.okrcoach.orchestrator.generation;

import com.okrcoach.core.model.ConversationPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scripted response generator used when no language-model generator is configured.
 *
 * <p>Assembles the turn from the prompt's structured parts: checkpoint celebration, phase
 * transition note, a strategy-specific body, then habit celebrations. Bodies may carry more
 * than one question; the pipeline keeps only the first.
 */
public class RuleBasedResponseGenerator implements ResponseGenerator {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedResponseGenerator.class);

    private static final Map<ConversationPhase, String> PHASE_QUESTIONS = Map.of(
        ConversationPhase.DISCOVERY, "What outcome would make this quarter a success for you?",
        ConversationPhase.REFINEMENT, "How would you phrase this as an inspiring, outcome-focused objective?",
        ConversationPhase.KR_DISCOVERY, "Which two or three metrics would tell you the objective has been achieved?",
        ConversationPhase.VALIDATION, "Does this OKR feel ambitious yet achievable for your team?");

    static final String DISCOVERY_OPENING = "Let's start with some context. What is your role, and how big is your team? "
        + "What challenge or opportunity would you like this OKR to address?";

    static final String REFERENCE_KEY_RESULT =
        "Here's a strong key result for reference: \"Increase trial-to-paid conversion from 8% to 12% by end of Q2.\" "
            + "It names a baseline, a target and a deadline.";

    @Override
    public String generate(CoachingPrompt prompt) {
        List<String> parts = new ArrayList<>();
        if (prompt.checkpointCelebration() != null && !prompt.checkpointCelebration().isBlank()) {
            parts.add(prompt.checkpointCelebration());
        }
        if (prompt.phaseTransition() != null) {
            parts.add("We're moving into " + prompt.phaseTransition().label() + ".");
        }
        parts.add(body(prompt));
        parts.addAll(prompt.habitCelebrations());

        log.debug("[RuleBasedResponseGenerator] Generated. sessionId={} strategy={} parts={}",
            prompt.sessionId(), prompt.strategy(), parts.size());
        return String.join("\n\n", parts);
    }

    private String body(CoachingPrompt prompt) {
        String phaseQuestion = PHASE_QUESTIONS.getOrDefault(prompt.phase(), PHASE_QUESTIONS.get(ConversationPhase.DISCOVERY));
        return switch (prompt.strategy()) {
            case ALTITUDE_INTERVENTION -> prompt.altitudeIntervention() != null
                ? prompt.altitudeIntervention().compose()
                : "Let's check the scope of this objective. What part of it can your team directly influence?";
            case REFRAMING_INTENSIVE -> prompt.reframing() != null
                ? prompt.reframing().suggestion()
                : phaseQuestion;
            case GENTLE_GUIDANCE -> prompt.reframing() != null
                ? "You're making progress. " + prompt.reframing().question()
                : "You're making progress. " + phaseQuestion;
            case DISCOVERY_EXPLORATION -> DISCOVERY_OPENING;
            case EXAMPLE_DRIVEN -> REFERENCE_KEY_RESULT + " " + phaseQuestion;
            case VALIDATION_FOCUSED -> "Let's review the full OKR together. " + phaseQuestion;
            case QUESTION_BASED -> prompt.phase() != null
                ? "Let's keep going with " + prompt.phase().label().toLowerCase(Locale.ROOT) + ". " + phaseQuestion
                : phaseQuestion;
        };
    }
}
