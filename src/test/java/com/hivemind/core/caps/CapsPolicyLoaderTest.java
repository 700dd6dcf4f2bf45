package com.hivemind.core.caps;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CapsPolicyLoaderTest {

    @TempDir
    Path dir;

    private final CapsPolicyLoader loader = new CapsPolicyLoader();

    private CapsPolicy loadJson(String json) throws IOException {
        Path file = dir.resolve("system_caps.json");
        Files.writeString(file, json);
        return loader.load(file);
    }

    @Test
    @DisplayName("reads both caps from a valid file")
    void validFile() throws IOException {
        CapsPolicy caps = loadJson("{\"max_loops_per_task\": 2, \"max_delegation_depth\": 7}");
        assertEquals(new CapsPolicy(2, 7), caps);
    }

    @Nested
    @DisplayName("fallback to defaults")
    class Fallbacks {

        @Test
        @DisplayName("missing file")
        void missingFile() {
            assertEquals(CapsPolicy.defaults(), loader.load(dir.resolve("absent.json")));
        }

        @Test
        @DisplayName("malformed JSON")
        void malformedJson() throws IOException {
            assertEquals(CapsPolicy.defaults(), loadJson("{ max_loops"));
        }

        @Test
        @DisplayName("JSON that is not an object")
        void notAnObject() throws IOException {
            assertEquals(CapsPolicy.defaults(), loadJson("[1, 2]"));
        }

        @Test
        @DisplayName("missing key falls back for that key only")
        void missingKey() throws IOException {
            CapsPolicy caps = loadJson("{\"max_loops_per_task\": 9}");
            assertEquals(9, caps.maxLoopsPerTask());
            assertEquals(CapsPolicy.DEFAULT_MAX_DELEGATION_DEPTH, caps.maxDelegationDepth());
        }

        @Test
        @DisplayName("non-positive or non-integral values fall back")
        void invalidValues() throws IOException {
            CapsPolicy caps = loadJson("{\"max_loops_per_task\": 0, \"max_delegation_depth\": \"deep\"}");
            assertEquals(CapsPolicy.defaults(), caps);

            caps = loadJson("{\"max_loops_per_task\": 2.5, \"max_delegation_depth\": -1}");
            assertEquals(CapsPolicy.defaults(), caps);
        }
    }

    @Test
    @DisplayName("defaults are 5 loops and depth 3")
    void defaults() {
        assertEquals(5, CapsPolicy.defaults().maxLoopsPerTask());
        assertEquals(3, CapsPolicy.defaults().maxDelegationDepth());
    }

    @Test
    @DisplayName("cap predicates trigger at the limit, not after it")
    void predicates() {
        var caps = new CapsPolicy(2, 3);
        assertFalse(caps.loopCapReached(1));
        assertTrue(caps.loopCapReached(2));
        assertFalse(caps.delegationCapReached(2));
        assertTrue(caps.delegationCapReached(3));
    }

    @Test
    @DisplayName("the record itself rejects caps below one")
    void rejectsInvalidRecord() {
        assertThrows(IllegalArgumentException.class, () -> new CapsPolicy(0, 3));
        assertThrows(IllegalArgumentException.class, () -> new CapsPolicy(3, 0));
    }

    @Test
    @DisplayName("capsPolicy bean reads the configured file")
    void beanReadsConfiguredFile() throws IOException {
        Path file = dir.resolve("caps.json");
        Files.writeString(file, "{\"max_loops_per_task\": 4, \"max_delegation_depth\": 2}");
        var properties = new CapsProperties();
        properties.setFile(file.toString());

        assertEquals(new CapsPolicy(4, 2), loader.capsPolicy(properties));
    }
}
