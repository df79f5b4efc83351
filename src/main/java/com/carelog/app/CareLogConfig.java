package com.carelog.app;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.carelog.core.match.FuzzyMatcher;
import com.carelog.core.messaging.TopicClassifier;

import reactor.core.publisher.Mono;

/**
 * Beans that belong to no single package: time source, name matcher, and
 * the no-op topic classifier used when no language-model adapter is wired.
 */
@Configuration
public class CareLogConfig {

    private static final Logger log = LoggerFactory.getLogger(CareLogConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FuzzyMatcher fuzzyMatcher(@Value("${carelog.matching.threshold:0.5}") double threshold) {
        log.info("Concern name matching threshold={}", threshold);
        return new FuzzyMatcher(threshold);
    }

    /**
     * Without a classifier, titles come from the candidate title, the note's
     * concern line, or the default title.
     */
    @Bean
    @ConditionalOnMissingBean
    public TopicClassifier topicClassifier() {
        log.info("No TopicClassifier configured; using note-derived titles only");
        return (excerpt, existingTitles) -> Mono.just(List.of());
    }
}
