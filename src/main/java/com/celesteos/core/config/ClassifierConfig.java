package com.celesteos.core.config;

import com.celesteos.core.canonical.Canonicalizer;
import com.celesteos.core.engine.QueryClassifier;
import com.celesteos.core.engine.ResponseAssembler;
import com.celesteos.core.extract.EntityExtractor;
import com.celesteos.core.guard.GuardStack;
import com.celesteos.core.lane.LaneClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free classifier pipeline into the Spring context.
 */
@Configuration
public class ClassifierConfig {

    @Bean
    public GuardStack guardStack(RouterProperties properties) {
        var pasteDump = properties.getPasteDump();
        return GuardStack.standard(pasteDump.getMinLength(), pasteDump.getMinAlphaRatio());
    }

    @Bean
    public LaneClassifier laneClassifier() {
        return new LaneClassifier();
    }

    @Bean
    public EntityExtractor entityExtractor() {
        return EntityExtractor.standard();
    }

    @Bean
    public Canonicalizer canonicalizer() {
        return new Canonicalizer();
    }

    @Bean
    public QueryClassifier queryClassifier(GuardStack guardStack, LaneClassifier laneClassifier,
                                           EntityExtractor entityExtractor, Canonicalizer canonicalizer,
                                           RouterProperties properties) {
        return new QueryClassifier(guardStack, laneClassifier, entityExtractor, canonicalizer,
                new ResponseAssembler(canonicalizer), properties.getMaxQueryLength());
    }
}
