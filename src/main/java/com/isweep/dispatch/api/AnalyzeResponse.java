package com.isweep.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.isweep.core.model.Action;

/**
 * Simple-mode answer. {@code userId} echoes the request value as sent.
 */
public record AnalyzeResponse(
    Action action,
    String text,
    @JsonProperty("user_id") JsonNode userId
) {}
