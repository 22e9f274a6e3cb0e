package com.okrcoach.core.question;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps the assistant to one question per turn.
 *
 * <p>Generated text with several questions is cut down to its first question; the rest are
 * queued and drawn one at a time as the user answers. Questions that repeat an earlier one
 * (normalised exact match, or token-set similarity ≥ {@value #DUPLICATE_SIMILARITY}) are dropped.
 *
 * <p>Stateless; all state lives in {@link QuestionState}.
 */
public class QuestionFlowManager {

    private static final Logger log = LoggerFactory.getLogger(QuestionFlowManager.class);

    /** Dice similarity over normalised token sets at which two questions count as duplicates. */
    public static final double DUPLICATE_SIMILARITY = 0.8;

    /** Extracted spans at or below this length are not treated as questions. */
    public static final int MIN_QUESTION_LENGTH = 10;

    static final String MOVE_FORWARD_NUDGE =
        "I notice I may be repeating myself. Let's move forward - please share any additional details "
            + "you think are important for your OKR.";

    private static final List<Pattern> QUESTION_PATTERNS = List.of(
        Pattern.compile("((?:\\b(?:e\\.g|i\\.e|vs|approx|incl)\\.|[^.!?\\n]|\\.(?=\\S))*+\\?)",
            Pattern.CASE_INSENSITIVE),
        Pattern.compile("^\\s*(\\d+\\.\\s*[^?\\n]*\\?)", Pattern.MULTILINE),
        Pattern.compile("^\\s*(-\\s*[^?\\n]*\\?)", Pattern.MULTILINE));

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+\\.\\s*");
    private static final Pattern LEADING_DASH   = Pattern.compile("^-\\s*");
    private static final Pattern LEADING_STAR   = Pattern.compile("^\\*\\s*");
    private static final Pattern BULLET_LINE    = Pattern.compile("^\\s*[-•*]\\s*", Pattern.MULTILINE);
    private static final Pattern NUMBERED_LINE  = Pattern.compile("^\\s*\\d+\\.\\s*", Pattern.MULTILINE);
    private static final Pattern BLANK_RUNS     = Pattern.compile("\\n{3,}");
    private static final Pattern PUNCTUATION    = Pattern.compile("[?!.,;:]");
    private static final Pattern WHITESPACE     = Pattern.compile("\\s+");
    private static final Pattern SHORT_REPLY    = Pattern.compile("^(yes|no|ok|sure|thanks)\\.?$", Pattern.CASE_INSENSITIVE);

    private final boolean announceQueued;

    public QuestionFlowManager() {
        this(true);
    }

    /**
     * @param announceQueued whether responses mention how many questions are still queued
     */
    public QuestionFlowManager(boolean announceQueued) {
        this.announceQueued = announceQueued;
    }

    /**
     * Sentence, numbered and dashed questions, in order. Dots inside abbreviations and numbers
     * do not end a sentence. Rejected spans (too short, filler confirmations) are removed from
     * the cleaned content as well.
     */
    public QuestionExtraction extractQuestions(String text) {
        if (text == null || text.isBlank()) {
            return new QuestionExtraction(List.of(), false, text == null ? "" : text.trim());
        }
        LinkedHashSet<String> questions = new LinkedHashSet<>();
        String remaining = text;
        for (Pattern pattern : QUESTION_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String raw = m.group(1);
                String cleaned = clean(raw);
                if (isValidQuestion(cleaned)) {
                    questions.add(cleaned);
                }
                int idx = remaining.indexOf(raw);
                if (idx >= 0) {
                    remaining = remaining.substring(0, idx) + remaining.substring(idx + raw.length());
                }
            }
        }
        List<String> list = new ArrayList<>(questions);
        return new QuestionExtraction(list, list.size() > 1, cleanRemaining(remaining));
    }

    /**
     * Reduces generated text to at most one question and updates the queue.
     */
    public QuestionFlowResult processResponse(String generatedText, QuestionState state) {
        QuestionState current = state != null ? state : QuestionState.empty();
        QuestionExtraction extraction = extractQuestions(generatedText);

        if (extraction.questions().size() <= 1) {
            return new QuestionFlowResult(current, generatedText, current.hasPending());
        }

        List<String> questions = extraction.questions();
        String first = questions.get(0);
        String cleaned = extraction.cleanedContent();

        if (isDuplicate(first, current.askedQuestions())) {
            return redirectDuplicate(cleaned, current);
        }

        List<String> history = new ArrayList<>(current.askedQuestions());
        history.add(first);
        List<String> pending = new ArrayList<>(current.pendingQuestions());
        int queued = 0;
        for (String q : questions.subList(1, questions.size())) {
            if (isDuplicate(q, history) || isDuplicate(q, pending)) continue;
            pending.add(q);
            queued++;
        }

        List<String> asked = new ArrayList<>(current.askedQuestions());
        asked.add(first);
        String context = cleaned.isEmpty() ? current.questionContext() : cleaned;
        QuestionState updated = new QuestionState(pending, asked, first, current.answeredQuestions(), context);

        StringBuilder response = new StringBuilder();
        if (!cleaned.isEmpty()) {
            response.append(cleaned).append("\n\n");
        }
        response.append(first);
        if (announceQueued && queued > 0) {
            response.append("\n\n(I have ").append(queued).append(" more question").append(queued > 1 ? "s" : "")
                .append(" to help refine this further, but let's take it one step at a time.)");
        }
        log.debug("[QuestionFlowManager] Questions split. shown=1 queued={} pendingTotal={}", queued, pending.size());
        return new QuestionFlowResult(updated, response.toString(), !pending.isEmpty());
    }

    /**
     * Registers the lone question of a final response as current and asked. A question that
     * repeats an earlier one is replaced by the next queued question, or by the move-forward
     * nudge. Responses with no question, several questions, or whose question is already
     * current pass through unchanged.
     */
    public QuestionFlowResult trackAskedQuestion(String responseText, QuestionState state) {
        QuestionState current = state != null ? state : QuestionState.empty();
        QuestionExtraction extraction = extractQuestions(responseText);
        if (extraction.questions().size() != 1) {
            return new QuestionFlowResult(current, responseText, current.hasPending());
        }
        String question = extraction.questions().get(0);
        if (question.equals(current.currentQuestion())) {
            return new QuestionFlowResult(current, responseText, current.hasPending());
        }
        if (isDuplicate(question, current.askedQuestions())) {
            return redirectDuplicate(extraction.cleanedContent(), current);
        }
        List<String> asked = new ArrayList<>(current.askedQuestions());
        asked.add(question);
        QuestionState updated = new QuestionState(current.pendingQuestions(), asked, question,
            current.answeredQuestions(), current.questionContext());
        return new QuestionFlowResult(updated, responseText, updated.hasPending());
    }

    /** Pops the next queued question and makes it current. */
    public NextQuestion getNextQuestion(QuestionState state) {
        if (!state.hasPending()) {
            return new NextQuestion(state, null, false);
        }
        List<String> pending = new ArrayList<>(state.pendingQuestions());
        String next = pending.remove(0);
        List<String> asked = new ArrayList<>(state.askedQuestions());
        asked.add(next);
        QuestionState updated = new QuestionState(pending, asked, next, state.answeredQuestions(), state.questionContext());
        return new NextQuestion(updated, next, !pending.isEmpty());
    }

    /** Stores the user's answer against the current question and clears it. No-op without a current question. */
    public QuestionState recordAnswer(String userText, QuestionState state) {
        if (state.currentQuestion() == null) {
            return state;
        }
        Map<String, String> answered = new LinkedHashMap<>(state.answeredQuestions());
        answered.put(state.currentQuestion(), userText != null ? userText : "");
        return new QuestionState(state.pendingQuestions(), state.askedQuestions(), null, answered,
            state.questionContext());
    }

    /**
     * True when a queued question should be asked now: something is queued and the user gave a
     * substantive answer (more than ten characters, no question of their own, not a bare yes/no/ok).
     */
    public boolean shouldAskNextQuestion(String userMessage, QuestionState state) {
        if (state == null || !state.hasPending() || userMessage == null) {
            return false;
        }
        String trimmed = userMessage.trim();
        return trimmed.length() > MIN_QUESTION_LENGTH
            && !trimmed.contains("?")
            && !SHORT_REPLY.matcher(trimmed).matches();
    }

    /** Answered, current and pending questions, formatted for a generation prompt. */
    public String contextSummary(QuestionState state) {
        if (state.answeredQuestions().isEmpty() && state.currentQuestion() == null && !state.hasPending()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n\nQUESTION CONTEXT:\n");
        if (!state.answeredQuestions().isEmpty()) {
            sb.append("ANSWERED QUESTIONS:\n");
            state.answeredQuestions().forEach((q, a) -> sb.append("Q: ").append(q).append("\nA: ").append(a).append("\n\n"));
        }
        if (state.currentQuestion() != null) {
            sb.append("CURRENT QUESTION: ").append(state.currentQuestion()).append('\n');
        }
        if (state.hasPending()) {
            sb.append("PENDING QUESTIONS (").append(state.pendingQuestions().size()).append(" remaining):\n");
            for (int i = 0; i < state.pendingQuestions().size(); i++) {
                sb.append(i + 1).append(". ").append(state.pendingQuestions().get(i)).append('\n');
            }
        }
        return sb.toString();
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private QuestionFlowResult redirectDuplicate(String cleaned, QuestionState current) {
        log.debug("[QuestionFlowManager] Duplicate question suppressed. pending={}", current.pendingQuestions().size());
        if (current.hasPending()) {
            NextQuestion next = getNextQuestion(current);
            String response = cleaned.isEmpty() ? next.question() : cleaned + "\n\n" + next.question();
            return new QuestionFlowResult(next.updatedState(), response, next.hasMore());
        }
        String response = cleaned.isEmpty() ? MOVE_FORWARD_NUDGE : cleaned + "\n\n" + MOVE_FORWARD_NUDGE;
        return new QuestionFlowResult(current, response, false);
    }

    static String clean(String raw) {
        String s = raw.trim();
        s = LEADING_NUMBER.matcher(s).replaceFirst("");
        s = LEADING_DASH.matcher(s).replaceFirst("");
        s = LEADING_STAR.matcher(s).replaceFirst("");
        return s.trim();
    }

    static boolean isValidQuestion(String q) {
        String lower = q.toLowerCase(Locale.ROOT);
        return q.length() > MIN_QUESTION_LENGTH
            && q.endsWith("?")
            && !lower.contains("right?")
            && !lower.contains("okay?");
    }

    static String cleanRemaining(String text) {
        String s = BULLET_LINE.matcher(text).replaceAll("");
        s = NUMBERED_LINE.matcher(s).replaceAll("");
        s = BLANK_RUNS.matcher(s).replaceAll("\n\n");
        return s.trim();
    }

    static String normalize(String q) {
        String s = PUNCTUATION.matcher(q.toLowerCase(Locale.ROOT)).replaceAll("");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    static boolean isDuplicate(String question, List<String> history) {
        String normalized = normalize(question);
        Set<String> tokens = tokens(normalized);
        for (String previous : history) {
            String other = normalize(previous);
            if (other.equals(normalized)) return true;
            if (similarity(tokens, tokens(other)) >= DUPLICATE_SIMILARITY) return true;
        }
        return false;
    }

    static double similarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 1.0;
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return 2.0 * intersection.size() / (a.size() + b.size());
    }

    private static Set<String> tokens(String normalized) {
        if (normalized.isEmpty()) return Set.of();
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }
}
