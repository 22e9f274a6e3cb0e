package com.okrcoach.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.okrcoach.core.altitude.AltitudeDriftTracker;
import com.okrcoach.core.antipattern.AntiPatternCatalog;
import com.okrcoach.core.antipattern.AntiPatternDetector;
import com.okrcoach.core.antipattern.ContextualRuleRegistry;
import com.okrcoach.core.checkpoint.CheckpointProgressEngine;
import com.okrcoach.core.habit.HabitReinforcementEngine;
import com.okrcoach.core.question.QuestionFlowManager;
import com.okrcoach.orchestrator.generation.ResponseGenerator;
import com.okrcoach.orchestrator.generation.RuleBasedResponseGenerator;
import com.okrcoach.orchestrator.session.InMemorySessionContextStore;
import com.okrcoach.orchestrator.session.SessionContextStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoachingConfig {

    @Value("${coaching.catalogue.location:okr-anti-patterns.json}")
    private String catalogueLocation;

    @Value("${coaching.questions.announce-queued:true}")
    private boolean announceQueued;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public ContextualRuleRegistry contextualRuleRegistry() {
        return ContextualRuleRegistry.defaults();
    }

    @Bean
    public AntiPatternCatalog antiPatternCatalog(ObjectMapper objectMapper, ContextualRuleRegistry registry) {
        return new AntiPatternCatalog(catalogueLocation, objectMapper, registry);
    }

    @Bean
    public AntiPatternDetector antiPatternDetector(AntiPatternCatalog catalog) {
        return new AntiPatternDetector(catalog);
    }

    @Bean
    public CheckpointProgressEngine checkpointProgressEngine(Clock clock) {
        return new CheckpointProgressEngine(clock);
    }

    @Bean
    public AltitudeDriftTracker altitudeDriftTracker(Clock clock) {
        return new AltitudeDriftTracker(clock);
    }

    @Bean
    public QuestionFlowManager questionFlowManager() {
        return new QuestionFlowManager(announceQueued);
    }

    @Bean
    public HabitReinforcementEngine habitReinforcementEngine(Clock clock) {
        return new HabitReinforcementEngine(clock);
    }

    @Bean
    public SessionContextStore sessionContextStore(ObjectMapper objectMapper) {
        return new InMemorySessionContextStore(objectMapper);
    }

    /** Scripted generator; swap this bean to plug in a language model. */
    @Bean
    public ResponseGenerator responseGenerator() {
        return new RuleBasedResponseGenerator();
    }
}
