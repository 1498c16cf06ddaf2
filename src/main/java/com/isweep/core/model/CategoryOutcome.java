package com.isweep.core.model;

/**
 * Result of evaluating one category for one text. Lives only for the
 * duration of a single decision.
 *
 * @param category        the evaluated category
 * @param fires           whether the category crossed its threshold
 * @param action          action the category demands; {@link Action#NONE} when not firing
 * @param durationSeconds how long the action should last; 0 when not firing
 * @param sensitivity     sensitivity the category was evaluated with
 * @param severity        number of matched signals
 */
public record CategoryOutcome(
    Category category,
    boolean fires,
    Action action,
    int durationSeconds,
    Sensitivity sensitivity,
    int severity
) {

    public static CategoryOutcome quiet(Category category, Sensitivity sensitivity, int severity) {
        return new CategoryOutcome(category, false, Action.NONE, 0, sensitivity, severity);
    }

    public static CategoryOutcome firing(Category category, Action action, int durationSeconds,
                                         Sensitivity sensitivity, int severity) {
        return new CategoryOutcome(category, true, action, durationSeconds, sensitivity, severity);
    }
}
