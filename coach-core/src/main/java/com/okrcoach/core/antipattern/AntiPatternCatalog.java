package com.okrcoach.core.antipattern;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Data-driven anti-pattern rule table.
 *
 * <p>Rules are read from a classpath JSON document on first use and memoized. Each rule
 * references its reframing strategy by id and its contextual predicate by name
 * ({@link ContextualRuleRegistry}).
 *
 * <h3>Failure handling</h3>
 * <ul>
 *   <li>missing or unparseable document → ERROR log, empty catalogue</li>
 *   <li>unknown strategy, predicate, or invalid regex → WARN log, that rule is skipped</li>
 * </ul>
 * Detection therefore degrades to fewer rules; it never throws.
 */
public class AntiPatternCatalog {

    private static final Logger log = LoggerFactory.getLogger(AntiPatternCatalog.class);

    public static final String DEFAULT_LOCATION = "okr-anti-patterns.json";

    private final String location;
    private final ObjectMapper objectMapper;
    private final ContextualRuleRegistry registry;

    private volatile List<AntiPatternRule> rules;

    public AntiPatternCatalog(String location, ObjectMapper objectMapper, ContextualRuleRegistry registry) {
        this.location = location;
        this.objectMapper = objectMapper;
        this.registry = registry;
    }

    /** Catalogue backed by the bundled rule table and the default predicates. */
    public static AntiPatternCatalog bundled() {
        return new AntiPatternCatalog(DEFAULT_LOCATION, new ObjectMapper(), ContextualRuleRegistry.defaults());
    }

    /** Compiled rules in document order; loaded once. */
    public List<AntiPatternRule> rules() {
        List<AntiPatternRule> loaded = rules;
        if (loaded == null) {
            synchronized (this) {
                loaded = rules;
                if (loaded == null) {
                    loaded = load();
                    rules = loaded;
                }
            }
        }
        return loaded;
    }

    public Optional<AntiPatternRule> rule(String id) {
        return rules().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    // ── Loading ─────────────────────────────────────────────────────────────

    private List<AntiPatternRule> load() {
        CatalogDocument doc;
        try (InputStream in = resourceStream()) {
            if (in == null) {
                log.error("[AntiPatternCatalog] Rule table not found on classpath. location={}", location);
                return List.of();
            }
            doc = objectMapper.readValue(in, CatalogDocument.class);
        } catch (IOException e) {
            log.error("[AntiPatternCatalog] Rule table unreadable. location={} reason={}", location, e.getMessage());
            return List.of();
        }

        List<AntiPatternRule> compiled = new ArrayList<>();
        Map<String, ReframingStrategy> strategies = doc.strategies() != null ? doc.strategies() : Map.of();
        for (RuleDocument rd : doc.patterns() != null ? doc.patterns() : List.<RuleDocument>of()) {
            compile(rd, strategies).ifPresent(compiled::add);
        }
        log.info("[AntiPatternCatalog] Loaded. location={} version={} rules={}",
            location, doc.version(), compiled.size());
        return List.copyOf(compiled);
    }

    private InputStream resourceStream() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        InputStream in = cl != null ? cl.getResourceAsStream(location) : null;
        return in != null ? in : AntiPatternCatalog.class.getClassLoader().getResourceAsStream(location);
    }

    private Optional<AntiPatternRule> compile(RuleDocument rd, Map<String, ReframingStrategy> strategies) {
        ReframingStrategy strategy = strategies.get(rd.strategy());
        if (strategy == null) {
            log.warn("[AntiPatternCatalog] Unknown strategy, rule skipped. rule={} strategy={}", rd.id(), rd.strategy());
            return Optional.empty();
        }
        String ruleName = rd.contextRule() != null ? rd.contextRule() : "always";
        Optional<ContextualRule> predicate = registry.find(ruleName);
        if (predicate.isEmpty()) {
            log.warn("[AntiPatternCatalog] Unknown contextual rule, rule skipped. rule={} contextRule={}", rd.id(), ruleName);
            return Optional.empty();
        }
        if (rd.severity() == null || rd.interventionType() == null) {
            log.warn("[AntiPatternCatalog] Missing severity or intervention type, rule skipped. rule={}", rd.id());
            return Optional.empty();
        }
        try {
            List<Pattern> detection = new ArrayList<>();
            for (String regex : rd.patterns() != null ? rd.patterns() : List.<String>of()) {
                detection.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            }
            List<String> keywords = rd.keywords() != null ? rd.keywords() : List.of();
            List<Pattern> keywordPatterns = keywords.stream()
                .map(kw -> Pattern.compile("\\b" + Pattern.quote(kw) + "\\b", Pattern.CASE_INSENSITIVE))
                .toList();
            return Optional.of(new AntiPatternRule(rd.id(), rd.name(), rd.description(), detection, keywords,
                keywordPatterns, ruleName, predicate.get(), strategy, rd.severity(), rd.interventionType()));
        } catch (PatternSyntaxException e) {
            log.warn("[AntiPatternCatalog] Invalid regex, rule skipped. rule={} reason={}", rd.id(), e.getDescription());
            return Optional.empty();
        }
    }

    // ── Document shape ──────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(
        @JsonProperty("version")    int version,
        @JsonProperty("strategies") Map<String, ReframingStrategy> strategies,
        @JsonProperty("patterns")   List<RuleDocument> patterns
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleDocument(
        @JsonProperty("id")               String id,
        @JsonProperty("name")             String name,
        @JsonProperty("description")      String description,
        @JsonProperty("patterns")         List<String> patterns,
        @JsonProperty("keywords")         List<String> keywords,
        @JsonProperty("contextRule")      String contextRule,
        @JsonProperty("strategy")         String strategy,
        @JsonProperty("severity")         Severity severity,
        @JsonProperty("interventionType") InterventionType interventionType
    ) {}
}
