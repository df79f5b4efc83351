package com.carelog.concern;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.carelog.core.match.FuzzyMatcher;
import com.carelog.core.messaging.TopicClassifier;
import com.carelog.core.model.SummaryEvent;

import reactor.core.publisher.Mono;

/**
 * Picks the candidate title for a delivered summary, in order:
 * <ol>
 *   <li>the title supplied with the event,</li>
 *   <li>the note's own "Main concern:" line (or its es/pt/fr equivalent),</li>
 *   <li>the topic classifier, preferring a candidate that is not already tracked,</li>
 *   <li>{@value #DEFAULT_TITLE}.</li>
 * </ol>
 * The result is only a candidate: the lifecycle service still fuzzy-matches it.
 */
@Component
public class ConcernTitleResolver {

    private static final Logger log = LoggerFactory.getLogger(ConcernTitleResolver.class);

    public static final String DEFAULT_TITLE = "Health concern";

    private static final int MAX_TITLE_LENGTH = 80;

    private static final Pattern CONCERN_LINE = Pattern.compile(
            "^\\s*(?:Main concern|Concern|Motivo|Queixa|Motif)\\s*:\\s*(.+)$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private final TopicClassifier classifier;
    private final FuzzyMatcher matcher;

    public ConcernTitleResolver(TopicClassifier classifier, FuzzyMatcher matcher) {
        this.classifier = classifier;
        this.matcher = matcher;
    }

    public Mono<String> resolve(SummaryEvent event, List<String> existingTitles) {
        if (event.candidateTitle() != null && !event.candidateTitle().isBlank()) {
            return Mono.just(clean(event.candidateTitle()));
        }

        Optional<String> fromNote = titleFromNote(event.summaryContent());
        if (fromNote.isPresent()) {
            return Mono.just(fromNote.get());
        }

        String excerpt = event.conversationExcerpt() == null ? event.summaryContent() : event.conversationExcerpt();
        return classifier.detectTopic(excerpt, existingTitles)
                .map(candidates -> pickCandidate(candidates, existingTitles))
                .onErrorResume(err -> {
                    log.warn("Topic classifier failed userId={} err={}", event.userId(), err.toString());
                    return Mono.just(DEFAULT_TITLE);
                })
                .defaultIfEmpty(DEFAULT_TITLE);
    }

    static Optional<String> titleFromNote(String summary) {
        if (summary == null) {
            return Optional.empty();
        }
        Matcher m = CONCERN_LINE.matcher(summary);
        if (!m.find()) {
            return Optional.empty();
        }
        String title = clean(m.group(1));
        return title.isEmpty() ? Optional.empty() : Optional.of(title);
    }

    String pickCandidate(List<String> candidates, List<String> existingTitles) {
        List<String> usable = candidates == null ? List.of()
                : candidates.stream().filter(c -> c != null && !c.isBlank()).map(ConcernTitleResolver::clean).toList();
        if (usable.isEmpty()) {
            return DEFAULT_TITLE;
        }
        return usable.stream()
                .filter(c -> matcher.match(c, existingTitles).isEmpty())
                .findFirst()
                .orElse(usable.get(0));
    }

    private static String clean(String raw) {
        String t = raw.strip();
        while (t.endsWith(".") || t.endsWith(",") || t.endsWith(";")) {
            t = t.substring(0, t.length() - 1).stripTrailing();
        }
        return t.length() > MAX_TITLE_LENGTH ? t.substring(0, MAX_TITLE_LENGTH).stripTrailing() : t;
    }
}
