package com.hivemind.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of cognitive loop an agent can run.
 */
public enum LoopType {
    REFLECTIVE,
    TASK,
    PLANNING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a request value; blank means {@link #REFLECTIVE}, anything unrecognised is empty.
     */
    public static Optional<LoopType> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(REFLECTIVE);
        }
        for (LoopType type : values()) {
            if (type.wireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
