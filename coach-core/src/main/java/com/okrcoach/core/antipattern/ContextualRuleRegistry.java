package com.okrcoach.core.antipattern;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static com.okrcoach.core.text.TextSignals.ci;
import static com.okrcoach.core.text.TextSignals.countMatches;
import static com.okrcoach.core.text.TextSignals.matches;

/**
 * Named contextual predicates referenced by the anti-pattern rule table.
 *
 * <p>A rule only gains the contextual boost when its predicate holds. Predicates are
 * looked up by name so the rule table stays pure data.
 */
public final class ContextualRuleRegistry {

    // ── Shared vocabularies ─────────────────────────────────────────────────

    private static final Pattern OUTCOME_LANGUAGE = ci(
        "\\b(increase|decrease|improve|reduce|enhance|achieve|reach|result|outcome|impact|benefit|value|change)\\b");
    private static final Pattern ASPIRATION = ci(
        "\\b(achieve|attain|accomplish|reach|improve|enhance|optimize)\\s+"
            + "(excellence|success|leadership|satisfaction|quality|performance)\\b");
    private static final Pattern NUMBERS = ci("\\b(\\d+|by\\s+\\d|from\\s+\\d|to\\s+\\d|%|percent|points?)\\b");
    private static final Pattern COMPLETION = ci(
        "\\b(done|completed?|complete|finished?|finish|launched?|launch|shipped?|ship|delivered?|deliver"
            + "|implemented?|implement)\\b");
    private static final Pattern BUSINESS_VALUE = ci(
        "\\b(revenue|conversion|retention|satisfaction|value|business|customer|sales|profit|growth)\\b");
    private static final Pattern IMPROVEMENT = ci(
        "\\b(improve|increase|enhance|optimize|accelerate|transform|exceed|breakthrough|stretch|ambitious)\\b");
    private static final Pattern KEY_RESULT = ci("\\b(key\\s*result|kr)\\b");
    private static final Pattern METRIC = ci("\\b(metric|measure|track|monitor)\\b");
    private static final Pattern ACTION_WORD = ci(
        "\\b(increas(?:e|ing)|improv(?:e|ing)|reduc(?:e|ing)|enhanc(?:e|ing)|optimiz(?:e|ing)|achiev(?:e|ing)"
            + "|grow(?:ing)?|expand(?:ing)?|boost(?:ing)?|mak(?:e|ing)|keep(?:ing)?|be(?:ing|come|coming)?"
            + "|establish(?:ing)?|creat(?:e|ing)|build(?:ing)?|develop(?:ing)?|launch(?:ing)?)\\b");
    private static final Pattern QUANTIFIED = ci("\\b\\d+(\\.\\d+)?[%$]?\\b|\\bfrom\\s+\\d+|\\bto\\s+\\d+|\\bby\\s+\\d+");
    private static final Pattern RESISTANCE = ci(
        "\\b(no|not|can't|cannot|won't|shouldn't|don't|disagree|resist|oppose|against)\\b");
    private static final Pattern ELEVATED_SCOPE = ci(
        "\\b(company|corporate|organization|enterprise|strategic|executive|board|c-level|ceo|cto|cfo)\\b");
    private static final Pattern BOUNDARY = ci(
        "\\b(my|our|just|only|within|limited|scope|authority|control|team|department|area)\\b");
    private static final Pattern DEPENDENCY = ci(
        "\\b(if|when|assuming|provided|contingent|dependent|relies on|requires|needs|depends)\\b");
    private static final Pattern EXTERNAL_ACTOR = ci(
        "\\b(customer|user|market|client|partner|vendor|third party|external|other team|other department)\\b");
    private static final Pattern CONTROL_LIMIT = ci(
        "\\b(will|must|should|chooses|decides|adopts|accepts|agrees|buys)\\b");
    private static final Pattern COMMITMENT = ci(
        "\\b(guarantee|promise|commit to|ensure that|make sure)\\b");
    private static final Pattern EXTERNAL_PARTY = ci(
        "\\b(customers?|users?|market|competitors?|regulators?|partners?|vendors?|investors?)\\b");
    private static final Pattern OWNED_ACTION = ci(
        "\\b(we will|our team will|i will|by (improving|reducing|building|shipping|running)|through)\\b");
    private static final Pattern SMALL_PERCENT = ci(
        "\\bby\\s+([0-5](?:\\.\\d+)?)\\s*(%|percent)");
    private static final Pattern SAFE_LANGUAGE = ci(
        "\\b(easy|easily|safe|conservative|guaranteed|low bar|at least)\\b");

    private final Map<String, ContextualRule> rules;

    public ContextualRuleRegistry(Map<String, ContextualRule> rules) {
        this.rules = Collections.unmodifiableMap(new HashMap<>(rules));
    }

    public Optional<ContextualRule> find(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public Set<String> names() {
        return rules.keySet();
    }

    /** The predicates used by the bundled rule table. */
    public static ContextualRuleRegistry defaults() {
        Map<String, ContextualRule> m = new HashMap<>();
        m.put("always", (text, ctx) -> true);
        m.put("no_outcome_language", (text, ctx) -> !matches(OUTCOME_LANGUAGE, text));
        m.put("binary_without_numbers", (text, ctx) -> {
            boolean hasNumbers = matches(NUMBERS, text);
            return !hasNumbers && (matches(ASPIRATION, text) || matches(COMPLETION, text));
        });
        m.put("no_business_value", (text, ctx) -> !matches(BUSINESS_VALUE, text));
        m.put("no_improvement_language", (text, ctx) -> !matches(IMPROVEMENT, text));
        m.put("too_many_metrics", (text, ctx) -> {
            int actionWords = countMatches(ACTION_WORD, text);
            int commas = text.length() - text.replace(",", "").length();
            return countMatches(KEY_RESULT, text) > 5
                || countMatches(METRIC, text) > 7
                || (actionWords >= 4 && commas >= 2)
                || actionWords >= 5;
        });
        m.put("no_quantification", (text, ctx) -> !matches(QUANTIFIED, text));
        m.put("scope_resistance", (text, ctx) -> {
            boolean resisting = matches(RESISTANCE, text)
                && (matches(ELEVATED_SCOPE, text) || matches(BOUNDARY, text));
            return resisting || (ctx != null && ctx.hasResisted("scope_elevation_resistance"));
        });
        m.put("external_control_dependency", (text, ctx) ->
            matches(DEPENDENCY, text) && matches(EXTERNAL_ACTOR, text) && matches(CONTROL_LIMIT, text));
        m.put("commitment_outside_control", (text, ctx) ->
            matches(COMMITMENT, text) && matches(EXTERNAL_PARTY, text));
        m.put("no_owned_action", (text, ctx) -> !matches(OWNED_ACTION, text));
        m.put("low_stretch", (text, ctx) -> matches(SAFE_LANGUAGE, text) || matches(SMALL_PERCENT, text));
        return new ContextualRuleRegistry(m);
    }
}
