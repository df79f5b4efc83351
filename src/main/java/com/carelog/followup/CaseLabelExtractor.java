package com.carelog.followup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

/**
 * Derives a short personalization label such as "your back" or "tu espalda"
 * from a concern's title and summary.
 *
 * Body-part terms and the possessive prefix come from the message catalog;
 * the first term group with a hit wins.
 */
@Component
public class CaseLabelExtractor {

    private final MessageTemplates templates;
    private final Map<String, List<Pattern>> compiled = new ConcurrentHashMap<>();

    public CaseLabelExtractor(MessageTemplates templates) {
        this.templates = templates;
    }

    public Optional<String> extractCaseLabel(String text, String language) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        MessageTemplates.CaseLabels data = templates.caseLabels(language);
        if (data == null || data.terms() == null) {
            return Optional.empty();
        }

        String lang = MessageTemplates.primarySubtag(language);
        for (Pattern p : compiled.computeIfAbsent(lang, k -> compile(data))) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                String term = m.group(1).toLowerCase(Locale.ROOT);
                Map<String, String> overrides = data.labels() == null ? Map.of() : data.labels();
                String prefix = data.prefix() == null ? "" : data.prefix();
                return Optional.of(overrides.getOrDefault(term, prefix + term));
            }
        }
        return Optional.empty();
    }

    private static List<Pattern> compile(MessageTemplates.CaseLabels data) {
        List<Pattern> out = new ArrayList<>();
        for (List<String> group : data.terms()) {
            String alternatives = group.stream()
                    .sorted(Comparator.comparingInt(String::length).reversed())
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|"));
            out.add(Pattern.compile("(?<![\\p{L}\\p{N}])(" + alternatives + ")(?![\\p{L}\\p{N}])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        return out;
    }
}
