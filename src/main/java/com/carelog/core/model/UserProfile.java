package com.carelog.core.model;

/**
 * The few user attributes needed for message personalization.
 * {@code name} may be null; {@code language} defaults to "en".
 */
public record UserProfile(String userId, String name, String language) {

    public static final String DEFAULT_LANGUAGE = "en";

    public UserProfile {
        if (language == null || language.isBlank()) {
            language = DEFAULT_LANGUAGE;
        }
    }
}
