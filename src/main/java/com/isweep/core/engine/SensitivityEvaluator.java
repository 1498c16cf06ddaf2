package com.isweep.core.engine;

import com.isweep.core.model.Category;
import com.isweep.core.model.CategoryOutcome;
import com.isweep.core.model.Sensitivity;
import com.isweep.core.rules.ActionRule;
import com.isweep.core.rules.FilterRules;
import com.isweep.core.rules.InvalidConfigurationException;

/**
 * Decides whether a category fires for a given severity and, if it does,
 * which action and duration it demands.
 * <p>
 * A disabled category never fires. An enabled one fires once its severity
 * reaches the threshold of its sensitivity; the action then comes from the
 * category's table in {@link FilterRules}.
 */
public class SensitivityEvaluator {

    private final FilterRules rules;

    public SensitivityEvaluator(FilterRules rules) {
        this.rules = rules;
    }

    /**
     * @throws InvalidConfigurationException if the category or sensitivity is
     *         missing or has no configured action
     */
    public CategoryOutcome evaluate(Category category, int severity, boolean enabled, Sensitivity sensitivity) {
        if (category == null) {
            throw new InvalidConfigurationException("Category must not be null");
        }
        if (sensitivity == null) {
            throw new InvalidConfigurationException("Sensitivity for category '" + category + "' is not set");
        }
        if (severity < 0) {
            throw new IllegalArgumentException("Severity must not be negative: " + severity);
        }
        if (!enabled) {
            return CategoryOutcome.quiet(category, sensitivity, severity);
        }

        int threshold = rules.threshold(sensitivity);
        // resolve the table entry even below threshold so a gap surfaces on the first call
        ActionRule rule = rules.rulesFor(category).actionFor(sensitivity);
        if (severity < threshold) {
            return CategoryOutcome.quiet(category, sensitivity, severity);
        }
        return CategoryOutcome.firing(category, rule.action(), rule.durationSeconds(), sensitivity, severity);
    }
}
