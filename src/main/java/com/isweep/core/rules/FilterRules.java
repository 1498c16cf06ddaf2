package com.isweep.core.rules;

import com.isweep.core.model.Action;
import com.isweep.core.model.Category;
import com.isweep.core.model.Sensitivity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Complete, validated rule set the engine runs on: the signal set and action
 * table for every category plus the firing threshold for every sensitivity.
 * <p>
 * Instances are immutable and only obtained through {@link FilterRulesLoader},
 * which calls {@link #validate()} before handing them out.
 */
public final class FilterRules {

    private final Map<Category, CategoryRules> categories;
    private final Map<Sensitivity, Integer> thresholds;
    private final String source;

    FilterRules(Map<Category, CategoryRules> categories, Map<Sensitivity, Integer> thresholds, String source) {
        var categoryTable = new EnumMap<Category, CategoryRules>(Category.class);
        categoryTable.putAll(categories);
        var thresholdTable = new EnumMap<Sensitivity, Integer>(Sensitivity.class);
        thresholdTable.putAll(thresholds);
        this.categories = Collections.unmodifiableMap(categoryTable);
        this.thresholds = Collections.unmodifiableMap(thresholdTable);
        this.source = source;
    }

    public CategoryRules rulesFor(Category category) {
        if (category == null) {
            throw new InvalidConfigurationException("Category must not be null");
        }
        CategoryRules rules = categories.get(category);
        if (rules == null) {
            throw new InvalidConfigurationException("No rules configured for category '" + category + "'");
        }
        return rules;
    }

    /**
     * Minimum severity at which an enabled category fires.
     */
    public int threshold(Sensitivity sensitivity) {
        if (sensitivity == null) {
            throw new InvalidConfigurationException("Sensitivity must not be null");
        }
        Integer threshold = thresholds.get(sensitivity);
        if (threshold == null) {
            throw new InvalidConfigurationException("No threshold configured for sensitivity '" + sensitivity + "'");
        }
        return threshold;
    }

    public Map<Sensitivity, Integer> thresholds() {
        return thresholds;
    }

    /** Where the rules were loaded from, for logs and health output. */
    public String source() {
        return source;
    }

    public int signalCount() {
        return categories.values().stream().mapToInt(r -> r.signals().size()).sum();
    }

    void validate() {
        Integer previous = null;
        for (Sensitivity sensitivity : Sensitivity.values()) {
            Integer threshold = thresholds.get(sensitivity);
            if (threshold == null) {
                throw new InvalidConfigurationException("Missing threshold for sensitivity '" + sensitivity + "'");
            }
            if (threshold < 1) {
                throw new InvalidConfigurationException(
                        "Threshold for sensitivity '" + sensitivity + "' must be at least 1, was " + threshold);
            }
            // stricter sensitivity must never need more matches
            if (previous != null && threshold > previous) {
                throw new InvalidConfigurationException(
                        "Threshold for sensitivity '" + sensitivity + "' (" + threshold
                                + ") exceeds the threshold of a less strict level (" + previous + ")");
            }
            previous = threshold;
        }

        for (Category category : Category.values()) {
            CategoryRules rules = categories.get(category);
            if (rules == null) {
                throw new InvalidConfigurationException("Missing rules for category '" + category + "'");
            }
            if (rules.signals().isEmpty()) {
                throw new InvalidConfigurationException("Category '" + category + "' has no signals");
            }
            Action previousAction = null;
            for (Sensitivity sensitivity : Sensitivity.values()) {
                ActionRule rule = rules.actionFor(sensitivity);
                if (rule.action() == null || rule.action() == Action.NONE) {
                    throw new InvalidConfigurationException("Category '" + category + "' at sensitivity '"
                            + sensitivity + "' must demand an action other than none");
                }
                if (rule.durationSeconds() <= 0) {
                    throw new InvalidConfigurationException("Category '" + category + "' at sensitivity '"
                            + sensitivity + "' must have a positive duration, was " + rule.durationSeconds());
                }
                if (previousAction != null && previousAction.isMoreRestrictiveThan(rule.action())) {
                    throw new InvalidConfigurationException("Category '" + category + "' at sensitivity '"
                            + sensitivity + "' demands '" + rule.action()
                            + "', less restrictive than '" + previousAction + "' at a lower sensitivity");
                }
                previousAction = rule.action();
            }
        }
    }
}
