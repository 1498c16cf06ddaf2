package com.isweep.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.isweep.core.rules.InvalidConfigurationException;

/**
 * Playback-control action advised to the client player.
 * Declaration order is restrictiveness order: none &lt; mute &lt; fast_forward &lt; skip.
 */
public enum Action {
    NONE("none"),
    MUTE("mute"),
    FAST_FORWARD("fast_forward"),
    SKIP("skip");

    private final String wireName;

    Action(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isMoreRestrictiveThan(Action other) {
        return compareTo(other) > 0;
    }

    public static Action fromWire(String value) {
        if (value != null) {
            for (Action action : values()) {
                if (action.wireName.equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
        }
        throw new InvalidConfigurationException("Unknown action: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
