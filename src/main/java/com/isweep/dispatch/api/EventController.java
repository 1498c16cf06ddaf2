package com.isweep.dispatch.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.isweep.core.engine.DecisionEngine;
import com.isweep.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for structured decisions posted by client players.
 * <p>
 * Always answers 200: malformed input comes back as a {@code none} decision
 * whose reason names the problem.
 */
@RestController
public class EventController {

    private static final Logger log = LoggerFactory.getLogger(EventController.class);

    private final DecisionEngine decisionEngine;
    private final ObjectMapper objectMapper;

    public EventController(DecisionEngine decisionEngine, ObjectMapper objectMapper) {
        this.decisionEngine = decisionEngine;
        this.objectMapper = objectMapper;
    }

    /**
     * POST /event: {@code {user_id, text, confidence?}} to
     * {@code {action, duration_seconds, matched_category, reason}}.
     */
    @PostMapping("/event")
    public ResponseEntity<Decision> event(@RequestBody(required = false) String body) {
        return ResponseEntity.ok(decisionEngine.decide(readBody(body)));
    }

    private JsonNode readBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Event body is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}
