package com.okrcoach.core.question;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verification of {@link QuestionFlowManager}: one question per turn, queued follow-ups,
 * duplicate suppression.
 */
class QuestionFlowManagerTest {

    private final QuestionFlowManager manager = new QuestionFlowManager();

    private static final String TWO_QUESTIONS =
        "Great context. What outcome do you want to achieve this quarter? Who are the key stakeholders involved?";

    // ── extractQuestions ────────────────────────────────────────────────────

    @Nested
    @DisplayName("extractQuestions() — finding questions in generated text")
    class ExtractTests {

        @Test
        @DisplayName("numbered and dashed questions → extracted, list markers stripped")
        void listQuestions() {
            QuestionExtraction e = manager.extractQuestions(
                "Here are some questions:\n1. What is the main outcome you want?\n2. Who are your key stakeholders?\n"
                    + "- How will you measure success?");

            assertEquals(List.of("What is the main outcome you want?", "Who are your key stakeholders?",
                "How will you measure success?"), e.questions());
            assertTrue(e.hasMultiple());
            assertEquals("Here are some questions:", e.cleanedContent());
        }

        @Test
        @DisplayName("short and rhetorical questions → ignored")
        void invalidQuestions() {
            QuestionExtraction e = manager.extractQuestions("Why? That makes sense, right? Tell me more.");
            assertTrue(e.questions().isEmpty());
            assertFalse(e.hasMultiple());
        }

        @Test
        @DisplayName("short question beside real ones → dropped from questions and cleaned content")
        void shortQuestionRemovedFromContent() {
            QuestionExtraction e = manager.extractQuestions(
                "Why? What is your main objective here? How would you measure success?");

            assertEquals(List.of("What is your main objective here?", "How would you measure success?"), e.questions());
            assertEquals("", e.cleanedContent());
        }

        @Test
        @DisplayName("abbreviation and decimal inside a question → one whole question")
        void abbreviationsKeepQuestionWhole() {
            QuestionExtraction e = manager.extractQuestions("What is e.g. your top metric for Q3? Is 2.5% enough?");

            assertEquals(List.of("What is e.g. your top metric for Q3?", "Is 2.5% enough?"), e.questions());
            assertEquals("", e.cleanedContent());
        }

        @Test
        @DisplayName("null → empty extraction")
        void nullText() {
            QuestionExtraction e = manager.extractQuestions(null);
            assertTrue(e.questions().isEmpty());
            assertEquals("", e.cleanedContent());
        }
    }

    // ── processResponse ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("processResponse() — one question per turn")
    class ProcessResponseTests {

        @Test
        @DisplayName("two questions → first shown, second queued and announced")
        void twoQuestions() {
            QuestionFlowResult r = manager.processResponse(TWO_QUESTIONS, QuestionState.empty());

            assertEquals("Great context.\n\nWhat outcome do you want to achieve this quarter?\n\n"
                + "(I have 1 more question to help refine this further, but let's take it one step at a time.)",
                r.responseToUser());
            assertTrue(r.hasQueued());
            assertEquals(List.of("Who are the key stakeholders involved?"), r.updatedState().pendingQuestions());
            assertEquals("What outcome do you want to achieve this quarter?", r.updatedState().currentQuestion());
            assertEquals(List.of("What outcome do you want to achieve this quarter?"), r.updatedState().askedQuestions());
        }

        @Test
        @DisplayName("announcement disabled → no queued note")
        void quietManager() {
            QuestionFlowResult r = new QuestionFlowManager(false).processResponse(TWO_QUESTIONS, QuestionState.empty());
            assertFalse(r.responseToUser().contains("more question"), r.responseToUser());
            assertTrue(r.hasQueued());
        }

        @Test
        @DisplayName("single question → text passes through unchanged")
        void singleQuestion() {
            String text = "Nice work. What does success look like for your team?";
            QuestionFlowResult r = manager.processResponse(text, QuestionState.empty());
            assertEquals(text, r.responseToUser());
            assertFalse(r.hasQueued());
            assertEquals(QuestionState.empty(), r.updatedState());
        }

        @Test
        @DisplayName("short question beside two real ones → response carries a single question mark")
        void shortQuestionNotShown() {
            QuestionFlowResult r = manager.processResponse(
                "Why? What is your main objective here? How would you measure success?", QuestionState.empty());

            assertEquals(1, r.responseToUser().chars().filter(c -> c == '?').count(), r.responseToUser());
            assertTrue(r.responseToUser().startsWith("What is your main objective here?"));
        }

        @Test
        @DisplayName("repeated first question, nothing queued → move-forward nudge")
        void duplicate_nudge() {
            QuestionState state = new QuestionState(List.of(), List.of("What outcome do you want to achieve?"),
                null, Map.of(), "");
            QuestionFlowResult r = manager.processResponse(
                "Let's revisit. What outcome do you want to achieve? Who benefits most from it?", state);

            assertEquals("Let's revisit.\n\n" + QuestionFlowManager.MOVE_FORWARD_NUDGE, r.responseToUser());
            assertSame(state, r.updatedState());
            assertFalse(r.hasQueued());
        }

        @Test
        @DisplayName("repeated first question, queue non-empty → next queued question instead")
        void duplicate_popsPending() {
            QuestionState state = new QuestionState(List.of("How will you measure progress weekly?"),
                List.of("What outcome do you want to achieve?"), null, Map.of(), "");
            QuestionFlowResult r = manager.processResponse(
                "What outcome do you want to achieve? Who benefits most from it?", state);

            assertEquals("How will you measure progress weekly?", r.responseToUser());
            assertEquals("How will you measure progress weekly?", r.updatedState().currentQuestion());
            assertTrue(r.updatedState().pendingQuestions().isEmpty());
        }

        @Test
        @DisplayName("follow-ups already asked or queued are not queued again")
        void followUpsDeduplicated() {
            QuestionState state = new QuestionState(List.of("Who are the key stakeholders involved?"),
                List.of(), null, Map.of(), "");
            QuestionFlowResult r = manager.processResponse(TWO_QUESTIONS, state);
            assertEquals(1, r.updatedState().pendingQuestions().size());
            assertFalse(r.responseToUser().contains("more question"), r.responseToUser());
        }
    }

    // ── trackAskedQuestion ──────────────────────────────────────────────────

    @Nested
    @DisplayName("trackAskedQuestion() — lone questions join the history")
    class TrackAskedQuestionTests {

        private static final String LONE = "Got it. What result do you want?";

        @Test
        @DisplayName("new lone question → current and asked, text unchanged")
        void recordsLoneQuestion() {
            QuestionFlowResult r = manager.trackAskedQuestion(LONE, QuestionState.empty());

            assertEquals(LONE, r.responseToUser());
            assertEquals("What result do you want?", r.updatedState().currentQuestion());
            assertEquals(List.of("What result do you want?"), r.updatedState().askedQuestions());
        }

        @Test
        @DisplayName("same lone question on the next turn → not asked again")
        void repeatedLoneQuestion() {
            QuestionState afterFirst = manager.trackAskedQuestion(LONE, QuestionState.empty()).updatedState();
            QuestionState answered = manager.recordAnswer("More retained customers", afterFirst);

            QuestionFlowResult second = manager.trackAskedQuestion(LONE, answered);

            assertEquals("Got it.\n\n" + QuestionFlowManager.MOVE_FORWARD_NUDGE, second.responseToUser());
            assertEquals(Map.of("What result do you want?", "More retained customers"),
                second.updatedState().answeredQuestions());
            assertNull(second.updatedState().currentQuestion());
        }

        @Test
        @DisplayName("repeat with a queued question → queued question asked instead")
        void repeatDrawsPending() {
            QuestionState state = new QuestionState(List.of("Who are the key stakeholders involved?"),
                List.of("What result do you want?"), null, Map.of(), "");

            QuestionFlowResult r = manager.trackAskedQuestion(LONE, state);

            assertEquals("Got it.\n\nWho are the key stakeholders involved?", r.responseToUser());
            assertEquals("Who are the key stakeholders involved?", r.updatedState().currentQuestion());
        }

        @Test
        @DisplayName("question already current after a split → unchanged")
        void alreadyCurrent() {
            QuestionFlowResult split = manager.processResponse(TWO_QUESTIONS, QuestionState.empty());

            QuestionFlowResult r = manager.trackAskedQuestion(split.responseToUser(), split.updatedState());

            assertSame(split.updatedState(), r.updatedState());
            assertEquals(split.responseToUser(), r.responseToUser());
        }

        @Test
        @DisplayName("no question → unchanged")
        void noQuestion() {
            QuestionState state = QuestionState.empty();
            assertSame(state, manager.trackAskedQuestion("Thanks for sharing.", state).updatedState());
        }
    }

    // ── Queue handling ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("shouldAskNextQuestion() / getNextQuestion() / recordAnswer()")
    class QueueTests {

        private QuestionState queued() {
            return manager.processResponse(TWO_QUESTIONS, QuestionState.empty()).updatedState();
        }

        @Test
        @DisplayName("substantive answer with a queue → ask next")
        void substantiveAnswer() {
            assertTrue(manager.shouldAskNextQuestion("We want to cut onboarding time from 10 days to 3", queued()));
        }

        @Test
        @DisplayName("bare acknowledgement, own question or empty queue → wait")
        void notYet() {
            assertFalse(manager.shouldAskNextQuestion("ok", queued()));
            assertFalse(manager.shouldAskNextQuestion("What do you mean by outcome?", queued()));
            assertFalse(manager.shouldAskNextQuestion("We want to cut onboarding time", QuestionState.empty()));
        }

        @Test
        @DisplayName("answer then next question → answer stored, queue drained")
        void roundTrip() {
            QuestionState state = manager.recordAnswer("Cut onboarding time to 3 days", queued());
            assertNull(state.currentQuestion());
            assertEquals("Cut onboarding time to 3 days",
                state.answeredQuestions().get("What outcome do you want to achieve this quarter?"));

            NextQuestion next = manager.getNextQuestion(state);
            assertEquals("Who are the key stakeholders involved?", next.question());
            assertFalse(next.hasMore());
            assertEquals(2, next.updatedState().askedQuestions().size());

            NextQuestion none = manager.getNextQuestion(next.updatedState());
            assertNull(none.question());
        }

        @Test
        @DisplayName("context summary lists answered, current and pending")
        void contextSummary() {
            String summary = manager.contextSummary(queued());
            assertTrue(summary.contains("CURRENT QUESTION: What outcome do you want to achieve this quarter?"), summary);
            assertTrue(summary.contains("PENDING QUESTIONS (1 remaining):\n1. Who are the key stakeholders involved?"),
                summary);
            assertEquals("", manager.contextSummary(QuestionState.empty()));
        }
    }

    // ── Similarity ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("isDuplicate() — near-duplicate detection")
    class SimilarityTests {

        @Test
        @DisplayName("one word changed in nine → duplicate")
        void nearDuplicate() {
            assertTrue(QuestionFlowManager.isDuplicate("What outcome do you want to achieve next quarter?",
                List.of("What outcome do you want to achieve this quarter?")));
        }

        @Test
        @DisplayName("different question → not duplicate")
        void different() {
            assertFalse(QuestionFlowManager.isDuplicate("Who are the key stakeholders involved?",
                List.of("What outcome do you want to achieve this quarter?")));
        }

        @Test
        @DisplayName("similarity is Dice over token sets")
        void dice() {
            assertEquals(0.5, QuestionFlowManager.similarity(Set.of("a", "b"), Set.of("b", "c")), 1e-9);
            assertEquals(1.0, QuestionFlowManager.similarity(Set.of(), Set.of()), 1e-9);
        }
    }
}
