package com.isweep.core.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.isweep.core.model.Action;
import com.isweep.core.model.Category;
import com.isweep.core.model.Sensitivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a JSON rules document into a validated {@link FilterRules}.
 * <p>
 * Expected shape:
 * <pre>
 * {
 *   "thresholds": { "low": 2, "medium": 1, "high": 1 },
 *   "categories": {
 *     "language": {
 *       "signals": ["damn", ...],
 *       "actions": { "low": { "action": "mute", "duration_seconds": 3 }, ... }
 *     },
 *     ...
 *   }
 * }
 * </pre>
 * Any unknown key, missing entry or inconsistent value is reported as an
 * {@link InvalidConfigurationException}.
 */
public final class FilterRulesLoader {

    private static final Logger log = LoggerFactory.getLogger(FilterRulesLoader.class);

    /** Classpath location of the rules shipped with the application. */
    public static final String DEFAULT_RESOURCE = "isweep-rules.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FilterRulesLoader() {}

    /**
     * Loads the rules bundled on the classpath.
     */
    public static FilterRules loadDefault() {
        InputStream in = FilterRulesLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new InvalidConfigurationException("Rules resource not found on classpath: " + DEFAULT_RESOURCE);
        }
        try (in) {
            return load(in, "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Failed to read rules resource " + DEFAULT_RESOURCE, e);
        }
    }

    public static FilterRules load(InputStream in, String source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Rules document " + source + " is not valid JSON", e);
        }
        return fromJson(root, source);
    }

    public static FilterRules fromJson(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new InvalidConfigurationException("Rules document " + source + " must be a JSON object");
        }

        Map<Sensitivity, Integer> thresholds = readThresholds(requireObject(root, "thresholds", source), source);

        JsonNode categoriesNode = requireObject(root, "categories", source);
        Map<Category, CategoryRules> categories = new EnumMap<>(Category.class);
        Iterator<Map.Entry<String, JsonNode>> fields = categoriesNode.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            Category category = Category.fromWire(entry.getKey());
            categories.put(category, readCategory(category, entry.getValue(), source));
        }

        FilterRules rules = new FilterRules(categories, thresholds, source);
        rules.validate();
        log.info("Loaded filter rules from {}: {} signals across {} categories",
                source, rules.signalCount(), categories.size());
        return rules;
    }

    private static Map<Sensitivity, Integer> readThresholds(JsonNode node, String source) {
        Map<Sensitivity, Integer> thresholds = new EnumMap<>(Sensitivity.class);
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            Sensitivity sensitivity = Sensitivity.fromWire(entry.getKey());
            if (!entry.getValue().canConvertToInt() || !entry.getValue().isIntegralNumber()) {
                throw new InvalidConfigurationException(
                        "Threshold for '" + entry.getKey() + "' in " + source + " must be an integer");
            }
            thresholds.put(sensitivity, entry.getValue().intValue());
        }
        return thresholds;
    }

    private static CategoryRules readCategory(Category category, JsonNode node, String source) {
        if (!node.isObject()) {
            throw new InvalidConfigurationException(
                    "Rules for category '" + category + "' in " + source + " must be an object");
        }

        JsonNode signalsNode = node.get("signals");
        if (signalsNode == null || !signalsNode.isArray()) {
            throw new InvalidConfigurationException(
                    "Category '" + category + "' in " + source + " must list its signals as an array");
        }
        Set<String> signals = new LinkedHashSet<>();
        for (JsonNode signal : signalsNode) {
            if (!signal.isTextual() || signal.asText().isBlank()) {
                throw new InvalidConfigurationException(
                        "Category '" + category + "' in " + source + " has a blank or non-text signal");
            }
            signals.add(normalizeSignal(signal.asText()));
        }

        JsonNode actionsNode = node.get("actions");
        if (actionsNode == null || !actionsNode.isObject()) {
            throw new InvalidConfigurationException(
                    "Category '" + category + "' in " + source + " must define an actions table");
        }
        Map<Sensitivity, ActionRule> actions = new EnumMap<>(Sensitivity.class);
        Iterator<Map.Entry<String, JsonNode>> fields = actionsNode.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            Sensitivity sensitivity = Sensitivity.fromWire(entry.getKey());
            JsonNode ruleNode = entry.getValue();
            JsonNode action = ruleNode.get("action");
            JsonNode duration = ruleNode.get("duration_seconds");
            if (action == null || !action.isTextual() || duration == null || !duration.isIntegralNumber()) {
                throw new InvalidConfigurationException("Action entry '" + category + "/" + sensitivity
                        + "' in " + source + " needs a text 'action' and an integer 'duration_seconds'");
            }
            actions.put(sensitivity, new ActionRule(Action.fromWire(action.asText()), duration.intValue()));
        }

        return new CategoryRules(category, new ArrayList<>(signals), actions);
    }

    private static JsonNode requireObject(JsonNode parent, String field, String source) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isObject()) {
            throw new InvalidConfigurationException("Rules document " + source + " is missing the '" + field + "' object");
        }
        return node;
    }

    /** Lower-cases and collapses inner whitespace so phrases compare consistently. */
    static String normalizeSignal(String raw) {
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
