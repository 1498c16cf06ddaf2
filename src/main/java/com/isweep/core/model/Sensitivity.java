package com.isweep.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.isweep.core.rules.InvalidConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * How eagerly a category filter reacts. Declared from least to most strict.
 */
public enum Sensitivity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    /** Comma-separated wire names, for validation messages. */
    public static final String ALLOWED_VALUES = Arrays.stream(values())
            .map(Sensitivity::wireName)
            .collect(Collectors.joining(", "));

    private final String wireName;

    Sensitivity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static boolean isValid(String value) {
        if (value == null) {
            return false;
        }
        for (Sensitivity sensitivity : values()) {
            if (sensitivity.wireName.equals(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses a stored or configured sensitivity. Unknown values are a
     * configuration fault, never silently mapped to a default.
     */
    public static Sensitivity fromWire(String value) {
        if (value != null) {
            for (Sensitivity sensitivity : values()) {
                if (sensitivity.wireName.equalsIgnoreCase(value.trim())) {
                    return sensitivity;
                }
            }
        }
        throw new InvalidConfigurationException("Unknown sensitivity: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
