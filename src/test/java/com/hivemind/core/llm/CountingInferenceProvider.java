package com.hivemind.core.llm;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Deterministic {@link InferenceProvider} for tests: counts calls, records prompts
 * and answers through a configurable function.
 */
public class CountingInferenceProvider implements InferenceProvider {

    private final AtomicInteger calls = new AtomicInteger();
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private volatile UnaryOperator<String> responder = prompt -> "response #" + calls.get();
    private volatile RuntimeException failure;
    private volatile long delayMillis;

    @Override
    public String infer(String prompt, String model) {
        calls.incrementAndGet();
        prompts.add(prompt);
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InferenceException("interrupted");
            }
        }
        if (failure != null) {
            throw failure;
        }
        return responder.apply(prompt);
    }

    public CountingInferenceProvider respondingWith(UnaryOperator<String> responder) {
        this.responder = responder;
        return this;
    }

    public CountingInferenceProvider failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public CountingInferenceProvider delayedBy(long millis) {
        this.delayMillis = millis;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }

    public String lastPrompt() {
        return prompts.isEmpty() ? null : prompts.get(prompts.size() - 1);
    }
}
