package com.isweep.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.isweep.core.engine.InvalidPayloadException;
import com.isweep.core.logging.MdcContext;
import com.isweep.core.model.Preferences;
import com.isweep.core.model.PreferencesUpdate;
import com.isweep.core.model.UserAccount;
import com.isweep.core.preferences.DuplicateUsernameException;
import com.isweep.core.preferences.PreferencesStore;
import com.isweep.core.preferences.PreferencesStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for user accounts and their filtering preferences.
 */
@RestController
@RequestMapping("/api/users")
public class UserController {

    private static final Logger log = LoggerFactory.getLogger(UserController.class);

    static final String USER_NOT_FOUND = "User not found";

    private final PreferencesStore preferencesStore;

    public UserController(PreferencesStore preferencesStore) {
        this.preferencesStore = preferencesStore;
    }

    /**
     * POST /api/users: Create a user with default preferences.
     */
    @PostMapping
    public ResponseEntity<?> createUser(@RequestBody(required = false) JsonNode body) {
        JsonNode username = body != null ? body.get("username") : null;
        if (username == null || !username.isTextual() || username.textValue().isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "Username is required");
        }

        try {
            UserAccount account = preferencesStore.createUser(username.textValue().trim());
            log.info("Created user {} ({})", account.userId(), account.username());
            return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(account));
        } catch (DuplicateUsernameException e) {
            return error(HttpStatus.CONFLICT, "Username already exists");
        }
    }

    /**
     * GET /api/users/{id}/preferences: Current preferences of one user.
     */
    @GetMapping("/{id}/preferences")
    public ResponseEntity<?> getPreferences(@PathVariable long id) {
        Optional<Preferences> preferences = preferencesStore.getPreferences(id);
        if (preferences.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, USER_NOT_FOUND);
        }
        return ResponseEntity.ok(new PreferencesResponse(id, preferences.get()));
    }

    /**
     * PUT /api/users/{id}/preferences: Partial update; absent fields keep
     * their current value.
     */
    @PutMapping("/{id}/preferences")
    public ResponseEntity<?> updatePreferences(@PathVariable long id,
                                               @RequestBody(required = false) JsonNode body) {
        MdcContext.setUser(id);
        try {
            if (preferencesStore.findUser(id).isEmpty()) {
                return error(HttpStatus.NOT_FOUND, USER_NOT_FOUND);
            }

            PreferencesUpdate update;
            try {
                update = PreferencesUpdateRequest.parse(body);
            } catch (InvalidPayloadException e) {
                return error(HttpStatus.BAD_REQUEST, e.getMessage());
            }

            Optional<Preferences> updated = preferencesStore.updatePreferences(id, update);
            if (updated.isEmpty()) {
                return error(HttpStatus.NOT_FOUND, USER_NOT_FOUND);
            }
            log.info("Updated preferences for user {}", id);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("message", "Preferences updated successfully");
            result.put("preferences", new PreferencesResponse(id, updated.get()));
            return ResponseEntity.ok(result);
        } finally {
            MdcContext.clear();
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Request body must be valid JSON");
    }

    @ExceptionHandler(PreferencesStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStoreFailure(PreferencesStoreException e) {
        log.error("Preferences store failure: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Preferences store unavailable");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error", message);
        return ResponseEntity.status(status).body(result);
    }
}
