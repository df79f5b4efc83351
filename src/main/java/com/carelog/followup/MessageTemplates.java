package com.carelog.followup;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import com.carelog.core.model.CheckinReply;
import com.carelog.core.model.CheckinReplyKind;
import com.carelog.core.model.ConcernCommand;
import com.carelog.core.model.UserProfile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * =====================================================================
 * MessageTemplates
 * =====================================================================
 *
 * PURPOSE
 * -------
 * User-facing wording per language, loaded from
 * {@code classpath:templates/messages.json}. Control flow never branches on
 * language; only this catalog does.
 *
 * Placeholders: {name} {label} {reply} {names} {old} {new}.
 *
 * Language codes are matched on their primary subtag ("pt-BR" → "pt").
 * Unknown languages use English.
 */
@Component
public class MessageTemplates {

    static final String RESOURCE = "templates/messages.json";

    private final Map<String, LanguagePack> packs;

    public MessageTemplates(ObjectMapper mapper) {
        this.packs = load(mapper);
        if (!packs.containsKey(UserProfile.DEFAULT_LANGUAGE)) {
            throw new IllegalStateException(RESOURCE + " has no '" + UserProfile.DEFAULT_LANGUAGE + "' entry");
        }
    }

    public boolean supports(String language) {
        return packs.containsKey(primarySubtag(language));
    }

    public String checkinPrompt(String language, String name, String caseLabel) {
        Checkin t = pack(language).checkin();
        String label = (caseLabel == null || caseLabel.isBlank()) ? t.defaultLabel() : caseLabel;
        if (name == null || name.isBlank()) {
            return t.withoutName().replace("{label}", label);
        }
        return t.withName().replace("{label}", label).replace("{name}", name.strip());
    }

    public CheckinReply checkinReply(String language, CheckinReplyKind kind, String replyText) {
        Reply r = pack(language).reply().get(kind.templateKey());
        if (r == null) {
            r = pack(UserProfile.DEFAULT_LANGUAGE).reply().get(kind.templateKey());
        }
        String quoted = replyText == null ? "" : replyText.strip();
        return new CheckinReply(kind, r.acknowledgment(), r.noteEntry().replace("{reply}", quoted));
    }

    /**
     * Confirmation for a successful command. {@code matchedNames} is the
     * executor's result; for rename it is {@code [oldTitle, newTitle]}.
     */
    public String commandConfirmation(String language, ConcernCommand.Type type, List<String> matchedNames) {
        Commands c = pack(language).command();
        if (matchedNames == null || matchedNames.isEmpty()) {
            return c.noMatch();
        }
        return switch (type) {
            case MERGE -> c.merge().replace("{names}", String.join(c.nameJoiner(), matchedNames));
            case DELETE -> c.delete().replace("{name}", matchedNames.get(0));
            case RENAME -> c.rename()
                    .replace("{old}", matchedNames.get(0))
                    .replace("{new}", matchedNames.get(matchedNames.size() - 1));
        };
    }

    public String commandNoMatch(String language) {
        return pack(language).command().noMatch();
    }

    CaseLabels caseLabels(String language) {
        return pack(language).caseLabels();
    }

    private LanguagePack pack(String language) {
        LanguagePack p = packs.get(primarySubtag(language));
        return p != null ? p : packs.get(UserProfile.DEFAULT_LANGUAGE);
    }

    static String primarySubtag(String language) {
        if (language == null || language.isBlank()) {
            return UserProfile.DEFAULT_LANGUAGE;
        }
        String lang = language.strip().toLowerCase(Locale.ROOT);
        int cut = indexOfSeparator(lang);
        return cut > 0 ? lang.substring(0, cut) : lang;
    }

    private static int indexOfSeparator(String lang) {
        int dash = lang.indexOf('-');
        int underscore = lang.indexOf('_');
        if (dash < 0) return underscore;
        if (underscore < 0) return dash;
        return Math.min(dash, underscore);
    }

    private static Map<String, LanguagePack> load(ObjectMapper mapper) {
        try (InputStream in = new ClassPathResource(RESOURCE).getInputStream()) {
            return mapper.readValue(in, new TypeReference<Map<String, LanguagePack>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RESOURCE, e);
        }
    }

    // --- catalog shape ---

    public record LanguagePack(Checkin checkin, Map<String, Reply> reply, Commands command, CaseLabels caseLabels) {
    }

    public record Checkin(String withName, String withoutName, String defaultLabel) {
    }

    public record Reply(String acknowledgment, String noteEntry) {
    }

    public record Commands(String merge, String nameJoiner, String delete, String rename, String noMatch) {
    }

    /**
     * {@code terms} are groups tried in order; within a group the longest
     * alternative wins. {@code labels} overrides {@code prefix + term}.
     */
    public record CaseLabels(String prefix, List<List<String>> terms, Map<String, String> labels) {
    }
}
