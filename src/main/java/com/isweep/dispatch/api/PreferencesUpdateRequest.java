package com.isweep.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.isweep.core.engine.InvalidPayloadException;
import com.isweep.core.model.PreferencesUpdate;
import com.isweep.core.model.Sensitivity;

/**
 * Reads the body of {@code PUT /api/users/{id}/preferences} into a
 * {@link PreferencesUpdate}. Fields are optional; unknown fields are ignored.
 */
final class PreferencesUpdateRequest {

    static final String BODY_REQUIRED = "Request body is required";
    static final String NO_FIELDS = "No preference fields to update";

    private PreferencesUpdateRequest() {}

    /**
     * @throws InvalidPayloadException with the message to return to the client
     */
    static PreferencesUpdate parse(JsonNode body) {
        if (body == null || !body.isObject() || body.isEmpty()) {
            throw new InvalidPayloadException(BODY_REQUIRED);
        }
        var update = new PreferencesUpdate(
                flag(body, "language_filter"),
                flag(body, "sexual_content_filter"),
                flag(body, "violence_filter"),
                sensitivity(body, "language_sensitivity"),
                sensitivity(body, "sexual_content_sensitivity"),
                sensitivity(body, "violence_sensitivity"));
        if (update.isEmpty()) {
            throw new InvalidPayloadException(NO_FIELDS);
        }
        return update;
    }

    private static Boolean flag(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null) {
            return null;
        }
        if (!node.isBoolean()) {
            throw new InvalidPayloadException("Invalid " + field + ". Must be true or false");
        }
        return node.booleanValue();
    }

    private static Sensitivity sensitivity(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null) {
            return null;
        }
        if (!node.isTextual() || !Sensitivity.isValid(node.textValue())) {
            throw new InvalidPayloadException(
                    "Invalid " + field + ". Must be one of: " + Sensitivity.ALLOWED_VALUES);
        }
        return Sensitivity.fromWire(node.textValue());
    }
}
