package com.isweep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final playback advice for one text. {@code matchedCategory} is null exactly
 * when the action is {@link Action#NONE}, which is exactly when the duration is 0.
 */
public record Decision(
    Action action,
    @JsonProperty("duration_seconds") int durationSeconds,
    @JsonProperty("matched_category") Category matchedCategory,
    String reason
) {

    public static final String NO_MATCH = "No match";
    public static final String UNKNOWN_USER = "Unknown user";
    public static final String PREFERENCES_UNAVAILABLE = "Preferences unavailable";
    public static final String INVALID_PAYLOAD = "Invalid payload";
    public static final String INVALID_CONFIGURATION = "Invalid configuration";

    public static Decision none(String reason) {
        return new Decision(Action.NONE, 0, null, reason);
    }

    public static Decision noMatch() {
        return none(NO_MATCH);
    }

    @JsonIgnore
    public boolean isMatch() {
        return matchedCategory != null;
    }
}
