package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DelegationStatus {
    DELEGATED,
    CAPPED,
    NOT_FOUND,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
