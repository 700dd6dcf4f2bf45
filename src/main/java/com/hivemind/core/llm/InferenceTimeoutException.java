package com.hivemind.core.llm;

/**
 * Thrown when an inference call does not finish within the configured timeout.
 */
public class InferenceTimeoutException extends InferenceException {

    public InferenceTimeoutException(String message) {
        super(message);
    }
}
