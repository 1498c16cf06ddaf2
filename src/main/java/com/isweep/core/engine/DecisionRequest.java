package com.isweep.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validated decision request.
 *
 * @param userId     user whose preferences apply
 * @param text       caption or transcript text; may be empty
 * @param confidence optional caller confidence in [0.0, 1.0]; accepted but
 *                   not used for matching yet. A malformed value is dropped.
 */
public record DecisionRequest(
    long userId,
    String text,
    Double confidence
) {

    private static final Logger log = LoggerFactory.getLogger(DecisionRequest.class);

    /**
     * Validates a raw JSON body of the shape {@code {user_id, text, confidence?}}.
     * {@code user_id} may be a JSON integer or a string of digits. Only
     * {@code user_id} and {@code text} can make a payload invalid.
     *
     * @throws InvalidPayloadException naming the first offending field
     */
    public static DecisionRequest parse(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new InvalidPayloadException("body must be a JSON object");
        }
        long userId = parseUserId(body.get("user_id"));

        JsonNode text = body.get("text");
        if (text == null || text.isNull()) {
            throw new InvalidPayloadException("text is required");
        }
        if (!text.isTextual()) {
            throw new InvalidPayloadException("text must be a string");
        }

        return new DecisionRequest(userId, text.asText(), parseConfidence(body.get("confidence")));
    }

    static Double parseConfidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            log.debug("Ignoring non-numeric confidence {}", node);
            return null;
        }
        double value = node.doubleValue();
        if (value < 0.0 || value > 1.0) {
            log.debug("Ignoring confidence {} outside [0.0, 1.0]", value);
            return null;
        }
        return value;
    }

    static long parseUserId(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new InvalidPayloadException("user_id is required");
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (!raw.isEmpty() && raw.chars().allMatch(Character::isDigit)) {
                try {
                    return Long.parseLong(raw);
                } catch (NumberFormatException e) {
                    throw new InvalidPayloadException("user_id is out of range");
                }
            }
        }
        throw new InvalidPayloadException("user_id must be an integer");
    }
}
