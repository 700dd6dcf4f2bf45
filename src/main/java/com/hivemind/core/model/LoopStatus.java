package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Wire status of a loop invocation.
 */
public enum LoopStatus {
    OK,
    CAPPED,
    INCOMPLETE,
    ERROR,
    NOT_FOUND;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public TerminalReason terminalReason() {
        return switch (this) {
            case OK, INCOMPLETE -> TerminalReason.COMPLETED;
            case CAPPED -> TerminalReason.CAPPED;
            case ERROR, NOT_FOUND -> TerminalReason.ERROR;
        };
    }
}
