package com.isweep.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.isweep.core.model.Preferences;

/**
 * Flat preferences view: {@code user_id} followed by the six preference fields.
 */
public record PreferencesResponse(
    @JsonProperty("user_id") long userId,
    @JsonUnwrapped Preferences preferences
) {}
