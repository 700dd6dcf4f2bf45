package com.hivemind.core.llm;

/**
 * Opaque text-completion backend.
 */
@FunctionalInterface
public interface InferenceProvider {

    /**
     * @param prompt full prompt text
     * @param model  backend-specific model name; "default" lets the backend choose
     * @return generated text, never null
     * @throws InferenceException if the backend fails
     */
    String infer(String prompt, String model);
}
