package com.hivemind.core.model;

public enum TerminalReason {
    COMPLETED,
    CAPPED,
    ERROR
}
