package com.okrcoach.core.altitude;

import com.okrcoach.core.text.TextSignals;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.okrcoach.core.text.TextSignals.ci;
import static com.okrcoach.core.text.TextSignals.containsAny;
import static com.okrcoach.core.text.TextSignals.matches;

/**
 * Keyword families that place a message at an organizational altitude.
 *
 * <p>Families are checked in fixed priority order (strategic, departmental, team, initiative,
 * project); the first family with a hit wins. Pure and stateless.
 */
public final class ScopeClassifier {

    private static final Map<ObjectiveScope, List<String>> FAMILIES = new LinkedHashMap<>();

    static {
        FAMILIES.put(ObjectiveScope.STRATEGIC, List.of(
            "market leader", "market position", "competitive advantage", "transform the business",
            "transform our business", "company-wide", "organizational", "enterprise", "industry leader",
            "redefine", "disrupt", "market share", "revenue growth", "company revenue", "brand value",
            "competitive moat", "strategic position"));
        FAMILIES.put(ObjectiveScope.DEPARTMENTAL, List.of(
            "department", "cross-functional", "division", "multi-team", "org-wide capability",
            "departmental", "function-wide", "enable teams", "department performance", "director"));
        FAMILIES.put(ObjectiveScope.TEAM, List.of(
            "our team", "my team", "team performance", "team delivery", "team capability", "team metrics",
            "team members", "improve our", "team excellence", "manager"));
        FAMILIES.put(ObjectiveScope.INITIATIVE, List.of(
            "this initiative", "this project", "the initiative", "project success", "initiative outcome",
            "stakeholder", "adoption", "rollout", "implementation", "successfully", "platform",
            "successfully launch"));
        FAMILIES.put(ObjectiveScope.PROJECT, List.of(
            "build", "create", "develop", "implement", "launch", "ship", "deliver", "complete",
            "my work", "my contribution"));
    }

    private static final Pattern EXECUTIVE_ROLE  = ci("\\b(ceo|cto|cfo|coo|chief)\\b");
    private static final Pattern DEPARTMENT_ROLE = ci("\\b(director|vp|head of)\\b");

    /** Texts longer than this earn a small confidence bonus. */
    public static final int DETAILED_TEXT_LENGTH = 150;

    private ScopeClassifier() {}

    /** First matching scope family, or empty when the text carries no altitude language. */
    public static Optional<ObjectiveScope> classify(String text) {
        String lower = TextSignals.normalize(text);
        if (lower.isBlank()) return Optional.empty();
        for (Map.Entry<ObjectiveScope, List<String>> family : FAMILIES.entrySet()) {
            if (containsAny(lower, family.getValue().toArray(String[]::new))) {
                return Optional.of(family.getKey());
            }
        }
        return Optional.empty();
    }

    /** Confidence in a classification: higher when the scope's anchor words appear. */
    public static double confidence(String text, ObjectiveScope scope) {
        String lower = TextSignals.normalize(text);
        double base = switch (scope) {
            case STRATEGIC    -> containsAny(lower, "market", "enterprise") ? 0.9 : 0.7;
            case DEPARTMENTAL -> containsAny(lower, "department", "division") ? 0.85 : 0.7;
            case TEAM         -> containsAny(lower, "team", "our") ? 0.9 : 0.6;
            case INITIATIVE   -> containsAny(lower, "initiative", "project") ? 0.85 : 0.6;
            case PROJECT      -> containsAny(lower, "build", "deliver") ? 0.8 : 0.5;
        };
        if (lower.length() > DETAILED_TEXT_LENGTH) base += 0.1;
        return Math.min(1.0, base);
    }

    /** Altitude implied by a job title; team when the title says nothing. */
    public static ObjectiveScope fromRole(String roleLabel) {
        if (roleLabel == null) return ObjectiveScope.TEAM;
        if (matches(EXECUTIVE_ROLE, roleLabel)) return ObjectiveScope.STRATEGIC;
        if (matches(DEPARTMENT_ROLE, roleLabel)) return ObjectiveScope.DEPARTMENTAL;
        return ObjectiveScope.TEAM;
    }
}
