package com.okrcoach.core.question;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One-question-at-a-time bookkeeping for a session.
 *
 * <ul>
 *   <li>{@code pendingQuestions}  – queued questions, asked in order.</li>
 *   <li>{@code askedQuestions}    – every question shown to the user.</li>
 *   <li>{@code currentQuestion}   – the open question, null when none.</li>
 *   <li>{@code answeredQuestions} – question → answer, in answer order.</li>
 *   <li>{@code questionContext}   – non-question text that framed the current question.</li>
 * </ul>
 */
public record QuestionState(
    @JsonProperty("pendingQuestions")  List<String> pendingQuestions,
    @JsonProperty("askedQuestions")    List<String> askedQuestions,
    @JsonProperty("currentQuestion")   String currentQuestion,
    @JsonProperty("answeredQuestions") Map<String, String> answeredQuestions,
    @JsonProperty("questionContext")   String questionContext
) {

    public QuestionState {
        pendingQuestions = pendingQuestions != null ? List.copyOf(pendingQuestions) : List.of();
        askedQuestions   = askedQuestions   != null ? List.copyOf(askedQuestions)   : List.of();
        answeredQuestions = answeredQuestions != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(answeredQuestions))
            : Map.of();
        questionContext  = questionContext  != null ? questionContext : "";
    }

    public static QuestionState empty() {
        return new QuestionState(List.of(), List.of(), null, Map.of(), "");
    }

    public boolean hasPending() {
        return !pendingQuestions.isEmpty();
    }
}
