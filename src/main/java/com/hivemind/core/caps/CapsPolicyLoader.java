package com.hivemind.core.caps;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the {@link CapsPolicy} bean from the JSON file named by {@code hivemind.caps.file}.
 * <p>
 * A missing file, malformed JSON, a missing key or an out-of-range value is
 * logged as a warning and replaced by {@link CapsPolicy#defaults()}; loading
 * never prevents startup.
 */
@Configuration
public class CapsPolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(CapsPolicyLoader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    @Bean
    public CapsPolicy capsPolicy(CapsProperties properties) {
        CapsPolicy policy = load(Path.of(properties.getFile()));
        log.info("System caps: max_loops_per_task={}, max_delegation_depth={}",
                policy.maxLoopsPerTask(), policy.maxDelegationDepth());
        return policy;
    }

    public CapsPolicy load(Path file) {
        if (!Files.exists(file)) {
            log.warn("System caps file not found at {}, using default caps", file);
            return CapsPolicy.defaults();
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                log.warn("System caps file {} is not a JSON object, using default caps", file);
                return CapsPolicy.defaults();
            }
            int maxLoops = readCap(root, "max_loops_per_task", CapsPolicy.DEFAULT_MAX_LOOPS_PER_TASK, file);
            int maxDepth = readCap(root, "max_delegation_depth", CapsPolicy.DEFAULT_MAX_DELEGATION_DEPTH, file);
            return new CapsPolicy(maxLoops, maxDepth);
        } catch (IOException e) {
            log.warn("Error loading system caps from {}: {}; using default caps", file, e.getMessage());
            return CapsPolicy.defaults();
        }
    }

    private int readCap(JsonNode root, String key, int fallback, Path file) {
        JsonNode node = root.get(key);
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            log.warn("System caps file {} has no usable {}, using {}", file, key, fallback);
            return fallback;
        }
        int value = node.asInt();
        if (value < 1) {
            log.warn("System caps file {} sets {}={} (must be >= 1), using {}", file, key, value, fallback);
            return fallback;
        }
        return value;
    }
}
