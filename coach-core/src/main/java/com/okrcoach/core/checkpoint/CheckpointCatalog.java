package com.okrcoach.core.checkpoint;

import com.okrcoach.core.model.ConversationPhase;
import com.okrcoach.core.model.EmotionalState;
import com.okrcoach.core.text.TextSignals;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.okrcoach.core.checkpoint.CompletionCriterion.assistantOnly;
import static com.okrcoach.core.checkpoint.CompletionCriterion.of;
import static com.okrcoach.core.text.TextSignals.containsAny;

/**
 * Fixed checkpoint lists per phase: discovery 5, refinement 4, KR discovery 5, validation 3.
 *
 * <p>Criterion matchers receive the lower-cased user message. Quality, anti-pattern clearance
 * and review checkpoints are judged by the assistant and completed through
 * {@link CheckpointProgressEngine#completeCheckpoint}.
 */
public final class CheckpointCatalog {

    private static final Pattern TEAM_SIZE   = Pattern.compile("\\d+\\s+(people|engineers|members)");
    private static final Pattern METRIC_WORD = Pattern.compile("measure|metric|track|count");
    private static final List<Pattern> KR_COUNT = List.of(
        Pattern.compile("(\\d)\\s*key results?"),
        Pattern.compile("kr\\s*(\\d)"),
        Pattern.compile("(\\d)\\s*krs?"));

    private static final String[] OUTCOME_VERBS =
        {"achieve", "reach", "become", "improve", "increase", "decrease", "transform"};
    private static final String[] ACTIVITY_VERBS =
        {"build", "create", "develop", "implement", "launch", "ship", "deploy"};
    private static final String[] CONFIRMATIONS =
        {"looks good", "that works", "yes", "correct", "perfect", "ready", "approve"};

    private static final Map<ConversationPhase, List<CheckpointDefinition>> CATALOG = build();

    private CheckpointCatalog() {}

    public static List<CheckpointDefinition> forPhase(ConversationPhase phase) {
        return CATALOG.getOrDefault(phase, List.of());
    }

    public static Optional<CheckpointDefinition> definition(String checkpointId) {
        return CATALOG.values().stream()
            .flatMap(List::stream)
            .filter(d -> d.id().equals(checkpointId))
            .findFirst();
    }

    // ── Phase lists ─────────────────────────────────────────────────────────

    private static Map<ConversationPhase, List<CheckpointDefinition>> build() {
        Map<ConversationPhase, List<CheckpointDefinition>> map = new EnumMap<>(ConversationPhase.class);
        map.put(ConversationPhase.DISCOVERY, discovery());
        map.put(ConversationPhase.REFINEMENT, refinement());
        map.put(ConversationPhase.KR_DISCOVERY, krDiscovery());
        map.put(ConversationPhase.VALIDATION, validation());
        return map;
    }

    private static List<CheckpointDefinition> discovery() {
        ConversationPhase p = ConversationPhase.DISCOVERY;
        return List.of(
            new CheckpointDefinition("discovery_context", "Context Gathered",
                "Understand user role, team, and organizational context", p, 1,
                List.of(
                    of("User role/function identified", "Role mentioned", m -> containsAny(m,
                        "manager", "director", "lead", "vp", "engineer", "designer", "product", "marketing", "sales")),
                    of("Team size or scope mentioned", "Team size mentioned", m -> containsAny(m,
                        "team", "people", "engineers", "members", "reports") || TEAM_SIZE.matcher(m).find()),
                    of("Organizational context understood", "Organizational context mentioned", m -> containsAny(m,
                        "company", "organization", "startup", "enterprise", "department"))),
                EmotionalState.NEUTRAL,
                "✅ Great! I understand your context.",
                "Discovery: ▓▒▒▒▒ (1/5)",
                "Next: Let's explore what challenge you're facing.",
                "0/3 context elements"),
            new CheckpointDefinition("discovery_challenge", "Challenge Identified",
                "Articulate the core problem or opportunity to address", p, 2,
                List.of(
                    of("Problem or opportunity stated", "Challenge/opportunity stated", m -> containsAny(m,
                        "problem", "challenge", "issue", "struggling", "difficult", "pain point", "bottleneck",
                        "opportunity", "potential", "could improve", "want to", "aim to", "goal")),
                    of("Why it matters explained", "Importance explained", m -> containsAny(m,
                        "because", "important", "matters", "impact", "affects", "result in")),
                    of("Current state described", "Current state described", m -> containsAny(m,
                        "currently", "right now", "today", "at the moment", "existing"))),
                EmotionalState.REWARD,
                "✅ Excellent! You've clearly articulated the challenge.",
                "Discovery: ▓▓▒▒▒ (2/5)",
                "Next: What outcome do you want to achieve?",
                "0/3 challenge elements"),
            new CheckpointDefinition("discovery_outcome", "Desired Outcome Articulated",
                "Express the target result or change sought", p, 3,
                List.of(
                    of("Outcome stated (not activity)", "Outcome-focused language used",
                        m -> containsAny(m, "achieve", "reach", "become", "improve", "increase", "decrease",
                            "transform", "enable") && !containsAny(m, ACTIVITY_VERBS)),
                    of("Success criteria mentioned", "Success criteria mentioned", m -> containsAny(m,
                        "success", "measure", "metric", "indicator", "know we succeeded", "looks like")),
                    of("Timeframe indicated", "Timeframe indicated", m -> containsAny(m,
                        "quarter", "q1", "q2", "q3", "q4", "month", "year", "90 days", "by end of"))),
                EmotionalState.REWARD,
                "🎉 Nice! You're thinking in outcomes, not activities.",
                "Discovery: ▓▓▓▒▒ (3/5)",
                "Next: Let's confirm the right altitude for this objective.",
                "0/3 outcome elements"),
            new CheckpointDefinition("discovery_altitude", "Altitude Confirmed",
                "Validate the organizational scope (team/initiative/project)", p, 4,
                List.of(
                    of("Scope level identified", "Scope level mentioned", m -> containsAny(m,
                        "team", "initiative", "project", "department", "company", "organization")),
                    of("Stakeholders clarified", "Stakeholders identified", m -> containsAny(m,
                        "stakeholder", "partner", "customer", "user", "executive", "leadership")),
                    of("Authority/influence confirmed", "Authority/influence confirmed", m -> containsAny(m,
                        "control", "influence", "responsible for", "authority", "decision"))),
                EmotionalState.NEUTRAL,
                "✅ Perfect! We've anchored at the right altitude.",
                "Discovery: ▓▓▓▓▒ (4/5)",
                "Next: Final scope validation before crafting your objective.",
                "0/3 altitude elements"),
            new CheckpointDefinition("discovery_scope", "Scope Validated",
                "Confirm feasibility and boundaries", p, 5,
                List.of(
                    of("What's in scope clarified", "In-scope boundaries clarified", m -> containsAny(m,
                        "include", "cover", "focus on", "scope includes", "within scope")),
                    of("What's out of scope clarified", "Out-of-scope boundaries clarified", m -> containsAny(m,
                        "exclude", "not include", "out of scope", "beyond scope", "won't cover")),
                    of("Feasibility confirmed", "Feasibility confirmed", m -> containsAny(m,
                        "achievable", "realistic", "feasible", "can accomplish", "doable"))),
                EmotionalState.REWARD,
                "🎉 Fantastic! Discovery complete - ready to craft your objective!",
                "Discovery: ▓▓▓▓▓ (5/5) ✅",
                "Next Phase: Refinement - we'll craft your objective.",
                "0/3 scope elements"));
    }

    private static List<CheckpointDefinition> refinement() {
        ConversationPhase p = ConversationPhase.REFINEMENT;
        return List.of(
            new CheckpointDefinition("refinement_draft", "Initial Draft Created",
                "First version of objective written", p, 1,
                List.of(
                    of("Objective statement drafted", "Objective statement drafted", m -> containsAny(m,
                        "objective:", "objective is", "goal:", "goal is", "want to", "aim to")),
                    of("Outcome-focused language used", "Outcome language present",
                        m -> containsAny(m, OUTCOME_VERBS)),
                    of("Timeframe included", "Timeframe included", m -> containsAny(m,
                        "quarter", "q1", "q2", "q3", "q4", "month", "year", "by end"))),
                EmotionalState.REWARD,
                "✅ Great start! You've got the foundation.",
                "Refinement: ▓▒▒▒ (1/4)",
                "Next: Let's check for outcome focus and measurability.",
                "0/3 draft elements"),
            new CheckpointDefinition("refinement_quality", "Quality Standards Met",
                "Objective passes core quality checks", p, 2,
                List.of(
                    assistantOnly("Outcome-focused (not activity)"),
                    assistantOnly("Inspiring and motivating"),
                    assistantOnly("Clear success visualization")),
                EmotionalState.REWARD,
                "✅ Excellent! Your objective is outcome-focused and inspiring.",
                "Refinement: ▓▓▒▒ (2/4)",
                "Next: Anti-pattern check to catch common pitfalls.",
                "0/3 quality checks"),
            new CheckpointDefinition("refinement_antipatterns", "Anti-Patterns Cleared",
                "Common OKR mistakes addressed", p, 3,
                List.of(
                    assistantOnly("Not a project or activity"),
                    assistantOnly("Not too vague or too prescriptive"),
                    assistantOnly("Not outside sphere of influence")),
                EmotionalState.NEUTRAL,
                "✅ Nice! You've avoided common OKR pitfalls.",
                "Refinement: ▓▓▓▒ (3/4)",
                "Next: Final polish and you're done with refinement!",
                "0/3 anti-pattern checks"),
            new CheckpointDefinition("refinement_finalized", "Objective Finalized",
                "Objective is polished and approved", p, 4,
                List.of(
                    of("User confirms satisfaction", "User confirmation provided",
                        m -> containsAny(m, CONFIRMATIONS) || m.contains("finalize")),
                    of("Objective scores 7.5+ quality", "Quality evaluated by previous checkpoints", m -> true),
                    of("Ready for key results", "Ready for next phase", m -> containsAny(m,
                        "key results", "kr", "next step", "move on", "ready"))),
                EmotionalState.REWARD,
                "🎉 Outstanding! Your objective is refined and ready!",
                "Refinement: ▓▓▓▓ (4/4) ✅",
                "Next Phase: Key Result Discovery - defining how to measure success.",
                "0/3 finalization checks"));
    }

    private static List<CheckpointDefinition> krDiscovery() {
        ConversationPhase p = ConversationPhase.KR_DISCOVERY;
        return List.of(
            new CheckpointDefinition("kr_brainstorm", "Metrics Brainstormed",
                "Generate potential ways to measure the objective", p, 1,
                List.of(
                    of("4+ potential metrics identified", "Multiple metrics mentioned",
                        m -> TextSignals.countMatches(METRIC_WORD, m) >= 4),
                    of("Mix of leading and lagging indicators", "Metric types discussed", m -> containsAny(m,
                        "leading", "input", "activity", "behavior", "lagging", "output", "outcome", "result")),
                    of("Quantitative focus", "Quantitative focus present", m -> containsAny(m,
                        "%", "percent", "number of", "count", "total", "from", "to"))),
                EmotionalState.REWARD,
                "✅ Great brainstorming! Lots of measurement options.",
                "KR Discovery: ▓▒▒▒▒ (1/5)",
                "Next: Let's narrow down to the 3-5 best key results.",
                "0/4 potential metrics"),
            new CheckpointDefinition("kr_selection", "Key Results Selected",
                "Choose 3-5 most important metrics", p, 2,
                List.of(
                    of("3-5 key results identified", "KR selection indicated",
                        m -> selectsThreeToFive(m) || containsAny(m,
                            "choose", "select", "pick", "go with", "focus on", "these")),
                    assistantOnly("Collectively comprehensive"),
                    assistantOnly("Each independent")),
                EmotionalState.NEUTRAL,
                "✅ Excellent selection! These KRs comprehensively measure your objective.",
                "KR Discovery: ▓▓▒▒▒ (2/5)",
                "Next: Let's make each KR specific and measurable.",
                "0/3 KRs selected"),
            new CheckpointDefinition("kr_specificity", "Specificity Achieved",
                "Each KR has baseline, target, and metric definition", p, 3,
                List.of(
                    of("Baseline values established", "Baseline mentioned", m -> containsAny(m,
                        "currently", "baseline", "starting", "from", "today")),
                    of("Target values defined", "Target mentioned", m -> containsAny(m,
                        "target", "goal", "to", "reach", "achieve")),
                    of("Measurement method clear", "Measurement method discussed", m -> containsAny(m,
                        "measure", "track", "calculate", "count", "monitor"))),
                EmotionalState.NEUTRAL,
                "✅ Perfect! Your KRs are specific and measurable.",
                "KR Discovery: ▓▓▓▒▒ (3/5)",
                "Next: Quality check to ensure KRs are strong.",
                "0/3 specificity elements per KR"),
            new CheckpointDefinition("kr_quality", "Quality Validated",
                "All KRs pass quality standards", p, 4,
                List.of(
                    assistantOnly("Each KR is quantitative"),
                    assistantOnly("KRs are independent"),
                    assistantOnly("Collectively comprehensive")),
                EmotionalState.REWARD,
                "✅ Excellent! Your key results meet quality standards.",
                "KR Discovery: ▓▓▓▓▒ (4/5)",
                "Next: Final anti-pattern check before completion.",
                "0/3 quality checks per KR"),
            new CheckpointDefinition("kr_finalized", "Key Results Finalized",
                "All KRs approved and ready", p, 5,
                List.of(
                    of("User confirms satisfaction", "User confirmation provided",
                        m -> containsAny(m, CONFIRMATIONS) || m.contains("done")),
                    assistantOnly("All KRs score 7.5+ quality"),
                    assistantOnly("Ready for validation phase")),
                EmotionalState.REWARD,
                "🎉 Amazing! Your complete OKR is crafted and ready!",
                "KR Discovery: ▓▓▓▓▓ (5/5) ✅",
                "Next Phase: Validation - final review and export.",
                "0/3 finalization checks"));
    }

    private static List<CheckpointDefinition> validation() {
        ConversationPhase p = ConversationPhase.VALIDATION;
        return List.of(
            new CheckpointDefinition("validation_review", "Final Review Complete",
                "Comprehensive quality assessment performed", p, 1,
                List.of(
                    assistantOnly("Objective quality confirmed"),
                    assistantOnly("All KRs quality confirmed"),
                    assistantOnly("No anti-patterns present")),
                EmotionalState.NEUTRAL,
                "✅ Great! Your OKR passes all quality checks.",
                "Validation: ▓▒▒ (1/3)",
                "Next: Stakeholder alignment check.",
                "0/3 review elements"),
            new CheckpointDefinition("validation_alignment", "Alignment Confirmed",
                "Stakeholder and organizational alignment verified", p, 2,
                List.of(
                    of("Stakeholders identified", "Stakeholders identified", m -> containsAny(m,
                        "stakeholder", "partner", "team", "leadership", "manager", "executive")),
                    of("Alignment strategy discussed", "Alignment strategy discussed", m -> containsAny(m,
                        "align", "buy-in", "support", "agreement", "share with")),
                    of("Potential objections addressed", "Objections considered", m -> containsAny(m,
                        "concern", "objection", "pushback", "resistance", "question"))),
                EmotionalState.NEUTRAL,
                "✅ Excellent! You've thought through stakeholder alignment.",
                "Validation: ▓▓▒ (2/3)",
                "Next: Export your OKR and you're done!",
                "0/3 alignment elements"),
            new CheckpointDefinition("validation_export", "OKR Exported",
                "Final OKR exported and session completed", p, 3,
                List.of(
                    of("Export format chosen", "Export format chosen", m -> containsAny(m,
                        "export", "download", "save", "format", "share", "pdf", "json", "csv", "markdown", "text")),
                    assistantOnly("OKR exported successfully"),
                    of("User satisfaction confirmed", "User satisfaction confirmed", m -> containsAny(m,
                        "satisfied", "happy", "good", "done", "complete", "finished"))),
                EmotionalState.REWARD,
                "🎉 Congratulations! You've created a high-quality OKR! 🎯",
                "Validation: ▓▓▓ (3/3) ✅ SESSION COMPLETE! 🌟",
                "You're ready to share and track your OKR. Great work!",
                "0/3 export elements"));
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private static boolean selectsThreeToFive(String lower) {
        for (Pattern p : KR_COUNT) {
            Matcher m = p.matcher(lower);
            while (m.find()) {
                int n = Integer.parseInt(m.group(1));
                if (n >= 3 && n <= 5) return true;
            }
        }
        return false;
    }
}
