package com.carelog.followup;

import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.carelog.core.model.CheckinReplyKind;

/**
 * Keyword classification of a check-in reply. Checked in order: same, better,
 * worse; anything else is {@link CheckinReplyKind#OTHER}.
 */
@Component
public class CheckinReplyClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern SAME = Pattern.compile(
            "(?<![\\p{L}])(same|igual|mesmo|mesma|pareil|sin cambios?|no change|sem mudan[çc]a)(?![\\p{L}])", FLAGS);

    private static final Pattern BETTER = Pattern.compile(
            "(?<![\\p{L}])(better|mejor|melhor|mieux|less pain|menos dolor|menos dor|improv\\p{L}*|mejor\\p{L}*)(?![\\p{L}])", FLAGS);

    private static final Pattern WORSE = Pattern.compile(
            "(?<![\\p{L}])(worse|peor|pior|pire|more pain|más dolor|mais dor|swelling|swollen|hincha\\p{L}*|empeor\\p{L}*|incha\\p{L}*)(?![\\p{L}])", FLAGS);

    public CheckinReplyKind classify(String reply) {
        if (reply == null || reply.isBlank()) {
            return CheckinReplyKind.OTHER;
        }
        if (SAME.matcher(reply).find()) {
            return CheckinReplyKind.SAME;
        }
        if (BETTER.matcher(reply).find()) {
            return CheckinReplyKind.BETTER;
        }
        if (WORSE.matcher(reply).find()) {
            return CheckinReplyKind.WORSE;
        }
        return CheckinReplyKind.OTHER;
    }
}
