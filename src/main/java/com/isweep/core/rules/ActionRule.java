package com.isweep.core.rules;

import com.isweep.core.model.Action;

/**
 * Action and duration a category demands at one sensitivity level.
 */
public record ActionRule(Action action, int durationSeconds) {}
