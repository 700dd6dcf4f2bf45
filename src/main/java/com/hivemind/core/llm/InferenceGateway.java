package com.hivemind.core.llm;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for inference calls. Applies the configured model and a
 * hard timeout, and normalises every failure into an {@link InferenceException}.
 * <p>
 * Calls run on at most {@code hivemind.inference.max-concurrent} worker threads.
 * Further calls queue, and time spent queued counts against the timeout, so a
 * backend that ignores cancellation can pin the workers but never grows the pool.
 */
@Service
public class InferenceGateway {

    private static final Logger log = LoggerFactory.getLogger(InferenceGateway.class);

    private final InferenceProvider provider;
    private final InferenceProperties properties;
    private final ExecutorService executor;

    public InferenceGateway(InferenceProvider provider, InferenceProperties properties) {
        this.provider = provider;
        this.properties = properties;
        int workers = Math.max(1, properties.getMaxConcurrent());
        var counter = new AtomicInteger();
        var pool = new ThreadPoolExecutor(workers, workers, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r, "inference-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        pool.allowCoreThreadTimeOut(true);
        this.executor = pool;
        log.info("Inference gateway using {} with up to {} concurrent calls", providerName(), workers);
    }

    public String infer(String prompt) {
        return infer(prompt, properties.getModel());
    }

    /**
     * @throws InferenceTimeoutException if the backend exceeds the timeout
     * @throws InferenceException        for any other backend failure
     */
    public String infer(String prompt, String model) {
        long start = System.currentTimeMillis();
        Future<String> call = executor.submit(() -> provider.infer(prompt, model));
        try {
            String response = call.get(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
            if (response == null) {
                throw new InferenceException("Inference provider returned no content");
            }
            log.debug("Inference complete ({} ms, {} chars)", System.currentTimeMillis() - start, response.length());
            return response;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new InferenceTimeoutException("Inference timed out after " + properties.getTimeoutSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InferenceException ie) {
                throw ie;
            }
            throw new InferenceException("Inference failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new InferenceException("Inference interrupted", e);
        }
    }

    public String providerName() {
        return provider.getClass().getSimpleName();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
