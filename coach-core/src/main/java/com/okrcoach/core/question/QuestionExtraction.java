package com.okrcoach.core.question;

import java.util.List;

/**
 * Questions found in generated text, in order of appearance, and the text with them removed.
 */
public record QuestionExtraction(
    List<String> questions,
    boolean hasMultiple,
    String cleanedContent
) {

    public QuestionExtraction {
        questions = List.copyOf(questions);
    }
}
