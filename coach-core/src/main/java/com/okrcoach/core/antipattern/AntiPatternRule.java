package com.okrcoach.core.antipattern;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiled catalogue entry. Built by {@link AntiPatternCatalog} from the JSON rule table;
 * {@code keywordPatterns} are word-bounded, case-insensitive forms of {@code keywords}.
 */
public record AntiPatternRule(
    String id,
    String name,
    String description,
    List<Pattern> detectionPatterns,
    List<String> keywords,
    List<Pattern> keywordPatterns,
    String contextRuleName,
    ContextualRule contextRule,
    ReframingStrategy strategy,
    Severity severity,
    InterventionType interventionType
) {

    public AntiPatternRule {
        detectionPatterns = List.copyOf(detectionPatterns);
        keywords = List.copyOf(keywords);
        keywordPatterns = List.copyOf(keywordPatterns);
    }
}
