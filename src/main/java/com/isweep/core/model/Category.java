package com.isweep.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.isweep.core.rules.InvalidConfigurationException;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Content categories the engine can detect.
 * <p>
 * {@link #priority()} decides which category is reported when several fire
 * for the same text: sexual, then violence, then language.
 */
public enum Category {
    LANGUAGE("language", 1),
    SEXUAL("sexual", 3),
    VIOLENCE("violence", 2);

    /** All categories, highest priority first. */
    public static final List<Category> BY_PRIORITY = Arrays.stream(values())
            .sorted(Comparator.comparingInt(Category::priority).reversed())
            .toList();

    private final String wireName;
    private final int priority;

    Category(String wireName, int priority) {
        this.wireName = wireName;
        this.priority = priority;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int priority() {
        return priority;
    }

    public static Category fromWire(String value) {
        if (value != null) {
            for (Category category : values()) {
                if (category.wireName.equalsIgnoreCase(value.trim())) {
                    return category;
                }
            }
        }
        throw new InvalidConfigurationException("Unknown category: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
