package com.isweep.core.engine;

import com.isweep.core.model.Action;
import com.isweep.core.model.Category;
import com.isweep.core.model.CategoryOutcome;
import com.isweep.core.model.Decision;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Combines per-category outcomes into one {@link Decision}.
 * <p>
 * When several categories fire, two different rules apply:
 * <ul>
 *   <li>the reported category follows the fixed priority sexual &gt; violence &gt; language;</li>
 *   <li>the applied action is the most restrictive action among all firing
 *       categories, with the longest duration among those carrying it.</li>
 * </ul>
 * The reported category's own action may therefore be weaker than the
 * action returned.
 */
public class DecisionResolver {

    public Decision resolve(Collection<CategoryOutcome> outcomes) {
        List<CategoryOutcome> firing = new ArrayList<>();
        for (CategoryOutcome outcome : outcomes) {
            if (outcome != null && outcome.fires()) {
                firing.add(outcome);
            }
        }
        if (firing.isEmpty()) {
            return Decision.noMatch();
        }

        firing.sort(Comparator.comparingInt((CategoryOutcome o) -> o.category().priority()).reversed());
        CategoryOutcome reported = firing.get(0);

        Action action = Action.NONE;
        int duration = 0;
        for (CategoryOutcome outcome : firing) {
            if (outcome.action().isMoreRestrictiveThan(action)) {
                action = outcome.action();
                duration = outcome.durationSeconds();
            } else if (outcome.action() == action) {
                duration = Math.max(duration, outcome.durationSeconds());
            }
        }

        String reason = describe(reported);
        if (firing.size() > 1) {
            reason += "; also detected=" + firing.subList(1, firing.size()).stream()
                    .map(CategoryOutcome::category)
                    .map(Category::wireName)
                    .collect(Collectors.joining(","));
        }
        return new Decision(action, duration, reported.category(), reason);
    }

    static String describe(CategoryOutcome outcome) {
        return outcome.category().wireName() + " content detected; sensitivity="
                + outcome.sensitivity().wireName() + "; severity=" + outcome.severity();
    }
}
