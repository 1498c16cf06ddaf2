package com.isweep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A user's content-filtering preferences: one enable flag and one
 * sensitivity per {@link Category}.
 */
public record Preferences(
    @JsonProperty("language_filter") boolean languageFilter,
    @JsonProperty("sexual_content_filter") boolean sexualContentFilter,
    @JsonProperty("violence_filter") boolean violenceFilter,
    @JsonProperty("language_sensitivity") Sensitivity languageSensitivity,
    @JsonProperty("sexual_content_sensitivity") Sensitivity sexualContentSensitivity,
    @JsonProperty("violence_sensitivity") Sensitivity violenceSensitivity
) {

    public Preferences {
        Objects.requireNonNull(languageSensitivity, "languageSensitivity");
        Objects.requireNonNull(sexualContentSensitivity, "sexualContentSensitivity");
        Objects.requireNonNull(violenceSensitivity, "violenceSensitivity");
    }

    /** Preferences assigned to a newly created user: every filter on, every sensitivity medium. */
    public static Preferences defaults() {
        return new Preferences(true, true, true,
                Sensitivity.MEDIUM, Sensitivity.MEDIUM, Sensitivity.MEDIUM);
    }

    @JsonIgnore
    public boolean isEnabled(Category category) {
        return switch (category) {
            case LANGUAGE -> languageFilter;
            case SEXUAL -> sexualContentFilter;
            case VIOLENCE -> violenceFilter;
        };
    }

    @JsonIgnore
    public Sensitivity sensitivity(Category category) {
        return switch (category) {
            case LANGUAGE -> languageSensitivity;
            case SEXUAL -> sexualContentSensitivity;
            case VIOLENCE -> violenceSensitivity;
        };
    }

    public Preferences withFilter(Category category, boolean enabled) {
        return new Preferences(
                category == Category.LANGUAGE ? enabled : languageFilter,
                category == Category.SEXUAL ? enabled : sexualContentFilter,
                category == Category.VIOLENCE ? enabled : violenceFilter,
                languageSensitivity, sexualContentSensitivity, violenceSensitivity);
    }

    public Preferences withSensitivity(Category category, Sensitivity sensitivity) {
        return new Preferences(languageFilter, sexualContentFilter, violenceFilter,
                category == Category.LANGUAGE ? sensitivity : languageSensitivity,
                category == Category.SEXUAL ? sensitivity : sexualContentSensitivity,
                category == Category.VIOLENCE ? sensitivity : violenceSensitivity);
    }
}
