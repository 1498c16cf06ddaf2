package com.isweep.core.model;

/**
 * Partial preferences change. {@code null} fields keep their current value.
 */
public record PreferencesUpdate(
    Boolean languageFilter,
    Boolean sexualContentFilter,
    Boolean violenceFilter,
    Sensitivity languageSensitivity,
    Sensitivity sexualContentSensitivity,
    Sensitivity violenceSensitivity
) {

    public boolean isEmpty() {
        return languageFilter == null && sexualContentFilter == null && violenceFilter == null
                && languageSensitivity == null && sexualContentSensitivity == null
                && violenceSensitivity == null;
    }

    public Preferences applyTo(Preferences current) {
        return new Preferences(
                languageFilter != null ? languageFilter : current.languageFilter(),
                sexualContentFilter != null ? sexualContentFilter : current.sexualContentFilter(),
                violenceFilter != null ? violenceFilter : current.violenceFilter(),
                languageSensitivity != null ? languageSensitivity : current.languageSensitivity(),
                sexualContentSensitivity != null ? sexualContentSensitivity : current.sexualContentSensitivity(),
                violenceSensitivity != null ? violenceSensitivity : current.violenceSensitivity());
    }
}
