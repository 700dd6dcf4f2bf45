package com.hivemind.core.llm;

/**
 * Thrown when the inference backend fails or returns nothing usable.
 */
public class InferenceException extends RuntimeException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
