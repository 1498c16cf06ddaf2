package com.isweep.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.isweep.core.engine.DecisionEngine;
import com.isweep.core.engine.DecisionRequest;
import com.isweep.core.engine.InvalidPayloadException;
import com.isweep.core.model.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for simple-mode decisions: text in, one action out.
 */
@RestController
@RequestMapping("/api/analyze")
public class AnalyzeController {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeController.class);

    private final DecisionEngine decisionEngine;

    public AnalyzeController(DecisionEngine decisionEngine) {
        this.decisionEngine = decisionEngine;
    }

    /**
     * POST /api/analyze: {@code {user_id, text}} to {@code {action, text, user_id}}.
     * Unknown users get {@code none}; a malformed body is a 400.
     */
    @PostMapping
    public ResponseEntity<?> analyze(@RequestBody JsonNode body) {
        DecisionRequest request;
        try {
            request = DecisionRequest.parse(body);
        } catch (InvalidPayloadException e) {
            return badRequest(e.getMessage());
        }

        Action action = decisionEngine.analyze(request.userId(), request.text());
        return ResponseEntity.ok(new AnalyzeResponse(action, request.text(), body.get("user_id")));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable analyze request: {}", e.getMessage());
        return badRequest("user_id and text are required");
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error", error);
        result.put("action", Action.NONE.wireName());
        return ResponseEntity.badRequest().body(result);
    }
}
