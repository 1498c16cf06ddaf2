package com.isweep.core.rules;

import com.isweep.core.model.Category;
import com.isweep.core.model.Sensitivity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Signals and per-sensitivity action table for one category.
 *
 * @param category the category these rules belong to
 * @param signals  lower-cased words or phrases that count towards the category's severity
 * @param actions  action and duration demanded at each sensitivity
 */
public record CategoryRules(
    Category category,
    List<String> signals,
    Map<Sensitivity, ActionRule> actions
) {

    public CategoryRules {
        signals = List.copyOf(signals);
        var table = new EnumMap<Sensitivity, ActionRule>(Sensitivity.class);
        table.putAll(actions);
        actions = Collections.unmodifiableMap(table);
    }

    public ActionRule actionFor(Sensitivity sensitivity) {
        ActionRule rule = actions.get(sensitivity);
        if (rule == null) {
            throw new InvalidConfigurationException(
                    "No action configured for category '" + category + "' at sensitivity '" + sensitivity + "'");
        }
        return rule;
    }
}
