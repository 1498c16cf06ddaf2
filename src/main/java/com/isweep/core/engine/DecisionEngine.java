package com.isweep.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.isweep.core.logging.MdcContext;
import com.isweep.core.metrics.IsweepMetrics;
import com.isweep.core.model.Action;
import com.isweep.core.model.Category;
import com.isweep.core.model.CategoryOutcome;
import com.isweep.core.model.Decision;
import com.isweep.core.model.Preferences;
import com.isweep.core.preferences.PreferencesStore;
import com.isweep.core.rules.FilterRules;
import com.isweep.core.rules.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for playback decisions.
 * <p>
 * Looks up the caller's preferences, runs the text through
 * {@link CategoryMatcher}, {@link SensitivityEvaluator} and
 * {@link DecisionResolver}, and assembles the response. Every failure
 * (malformed request, unknown user, slow or broken store, bad configuration)
 * collapses to {@link Action#NONE} so a client player always gets a usable
 * answer; nothing is thrown to the caller.
 * <p>
 * The engine holds only immutable state and is safe for concurrent use.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final String MODE_SIMPLE = "simple";
    static final String MODE_STRUCTURED = "structured";

    private final CategoryMatcher matcher;
    private final SensitivityEvaluator evaluator;
    private final DecisionResolver resolver;
    private final PreferencesStore preferencesStore;
    private final Executor lookupExecutor;
    private final Duration lookupTimeout;
    private final IsweepMetrics metrics;

    @Autowired
    public DecisionEngine(FilterRules rules,
                          PreferencesStore preferencesStore,
                          @Qualifier(EngineConfig.LOOKUP_EXECUTOR) Executor lookupExecutor,
                          EngineProperties properties,
                          IsweepMetrics metrics) {
        this(rules, preferencesStore, lookupExecutor, properties.getPreferencesTimeout(), metrics);
    }

    public DecisionEngine(FilterRules rules,
                          PreferencesStore preferencesStore,
                          Executor lookupExecutor,
                          Duration lookupTimeout,
                          IsweepMetrics metrics) {
        this.matcher = new CategoryMatcher(rules);
        this.evaluator = new SensitivityEvaluator(rules);
        this.resolver = new DecisionResolver();
        this.preferencesStore = preferencesStore;
        this.lookupExecutor = lookupExecutor;
        this.lookupTimeout = lookupTimeout;
        this.metrics = metrics;
    }

    /**
     * Simple mode: returns only the action. Unknown users and lookup
     * failures yield {@link Action#NONE}.
     */
    public Action analyze(long userId, String text) {
        MdcContext.setRequest(userId, MODE_SIMPLE);
        try {
            Decision decision = decideFor(userId, text);
            metrics.recordDecision(MODE_SIMPLE, decision);
            return decision.action();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Structured mode over a raw request body {@code {user_id, text, confidence?}}.
     * A malformed body yields a {@code none} decision whose reason starts with
     * {@value Decision#INVALID_PAYLOAD}.
     */
    public Decision decide(JsonNode payload) {
        DecisionRequest request;
        try {
            request = DecisionRequest.parse(payload);
        } catch (InvalidPayloadException e) {
            log.debug("Rejected decision payload: {}", e.getMessage());
            metrics.recordPayloadRejection();
            Decision decision = Decision.none(Decision.INVALID_PAYLOAD + ": " + e.getMessage());
            metrics.recordDecision(MODE_STRUCTURED, decision);
            return decision;
        }
        return decide(request.userId(), request.text(), request.confidence());
    }

    /**
     * Structured mode for an already validated request.
     *
     * @param confidence caller confidence; logged and passed through, does not affect matching
     */
    public Decision decide(long userId, String text, Double confidence) {
        MdcContext.setRequest(userId, MODE_STRUCTURED);
        try {
            if (confidence != null) {
                log.debug("Caller confidence {} (not used for matching)", confidence);
            }
            Decision decision = decideFor(userId, text);
            metrics.recordDecision(MODE_STRUCTURED, decision);
            return decision;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs the matching pipeline for known preferences without any store lookup.
     *
     * @throws InvalidConfigurationException if the preferences or rules cannot be evaluated
     */
    public Decision evaluate(Preferences preferences, String text) {
        Map<Category, Integer> severities = matcher.match(text);
        List<CategoryOutcome> outcomes = new ArrayList<>(severities.size());
        for (Category category : Category.BY_PRIORITY) {
            outcomes.add(evaluator.evaluate(category, severities.get(category),
                    preferences.isEnabled(category), preferences.sensitivity(category)));
        }
        return resolver.resolve(outcomes);
    }

    private Decision decideFor(long userId, String text) {
        long start = System.nanoTime();
        try {
            Preferences preferences;
            CompletableFuture<Optional<Preferences>> lookup =
                    CompletableFuture.supplyAsync(() -> preferencesStore.getPreferences(userId), lookupExecutor);
            try {
                Optional<Preferences> found = lookup.get(lookupTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (found.isEmpty()) {
                    log.debug("No preferences for unknown user {}", userId);
                    metrics.recordLookupFailure("not_found");
                    return Decision.none(Decision.UNKNOWN_USER);
                }
                preferences = found.get();
            } catch (TimeoutException e) {
                lookup.cancel(true);
                log.warn("Preferences lookup for user {} exceeded {} ms", userId, lookupTimeout.toMillis());
                metrics.recordLookupFailure("timeout");
                return Decision.none(Decision.PREFERENCES_UNAVAILABLE);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof InvalidConfigurationException) {
                    log.error("Stored preferences for user {} are invalid: {}", userId, cause.getMessage());
                    return Decision.none(Decision.INVALID_CONFIGURATION);
                }
                log.warn("Preferences lookup for user {} failed: {}", userId, cause.getMessage());
                metrics.recordLookupFailure("error");
                return Decision.none(Decision.PREFERENCES_UNAVAILABLE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                metrics.recordLookupFailure("interrupted");
                return Decision.none(Decision.PREFERENCES_UNAVAILABLE);
            }

            try {
                Decision decision = evaluate(preferences, text);
                log.debug("Decision for user {}: {} ({})", userId, decision.action(), decision.reason());
                return decision;
            } catch (InvalidConfigurationException e) {
                log.error("Cannot evaluate text for user {}: {}", userId, e.getMessage(), e);
                return Decision.none(Decision.INVALID_CONFIGURATION);
            }
        } finally {
            metrics.recordDecisionDuration(System.nanoTime() - start);
        }
    }
}
