package com.hivemind.core.llm;

import java.util.Locale;

/**
 * Deterministic keyword-driven responder used when no model backend is configured.
 * Keeps the service usable offline and in demos; it does not reason.
 */
public class OfflineInferenceProvider implements InferenceProvider {

    @Override
    public String infer(String prompt, String model) {
        String lower = prompt.toLowerCase(Locale.ROOT);
        if (lower.contains("reflect") && lower.contains("actions")) {
            return "Recent work centres on the actions recorded in memory; the same themes keep recurring.";
        }
        if (lower.contains("plan") || lower.contains("next")) {
            return "Continue with the highest-priority open item and record the outcome in memory.";
        }
        if (lower.contains("analyze") || lower.contains("evaluate")) {
            return "Progress is steady; no blocking issues are visible in the recorded actions.";
        }
        return "Processed request: " + abbreviate(prompt, 200);
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }
}
