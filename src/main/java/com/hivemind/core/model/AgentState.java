package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Runtime activity state of an agent.
 * <p>
 * {@link #SYSTEM_HALT} is entered when a loop cap is breached and is only left
 * through an explicit operator reset.
 */
public enum AgentState {
    IDLE,
    RESPONDING,
    LOOPING,
    SYSTEM_HALT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentState fromWire(String value) {
        if (value == null || value.isBlank()) {
            return IDLE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
