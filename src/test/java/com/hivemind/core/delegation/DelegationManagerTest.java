package com.hivemind.core.delegation;

import com.fasterxml.jackson.databind.JsonNode;
import com.hivemind.core.CoreFixture;
import com.hivemind.core.caps.CapsPolicy;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.model.DelegationRequest;
import com.hivemind.core.model.DelegationResult;
import com.hivemind.core.model.DelegationStatus;
import com.hivemind.core.model.MemoryEntry;
import com.hivemind.core.model.RunStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DelegationManagerTest {

    private static DelegationRequest request(int depth, boolean autoExecute) {
        return new DelegationRequest("ORCHESTRATOR", "NOVA", "Build the login form", depth, autoExecute, "p1");
    }

    @Nested
    @DisplayName("depth cap")
    class DepthCap {

        @Test
        @DisplayName("depth at the cap is refused without running anything")
        void refusedAtCap() {
            var core = new CoreFixture(new CapsPolicy(5, 3));

            DelegationResult result = core.delegationManager.delegate(request(3, true));

            assertEquals(DelegationStatus.CAPPED, result.status());
            assertEquals(3, result.details().get("max_delegation_depth"));
            assertEquals(0, core.provider.calls());
            assertTrue(core.memoryStore.query("ORCHESTRATOR", null, "delegation", 0).isEmpty());
        }

        @Test
        @DisplayName("refusal is recorded as a system_halt memory for the sender")
        void refusalRecorded() {
            var core = new CoreFixture(new CapsPolicy(5, 2));
            core.delegationManager.delegate(request(5, false));

            List<MemoryEntry> halts = core.memoryStore.query("ORCHESTRATOR", null, "system_halt", 0);
            assertEquals(1, halts.size());
            assertTrue(halts.get(0).tags().contains("delegation_limit"));
        }

        @Test
        @DisplayName("depth one below the cap is accepted")
        void acceptedBelowCap() {
            var core = new CoreFixture(new CapsPolicy(5, 3));
            assertEquals(DelegationStatus.DELEGATED, core.delegationManager.delegate(request(2, false)).status());
        }

        @Test
        @DisplayName("a chain that keeps passing next_delegation_depth stops at the cap")
        void chainStopsAtCap() {
            var core = new CoreFixture(new CapsPolicy(5, 3));
            int depth = 0;
            int accepted = 0;
            DelegationResult result;
            do {
                result = core.delegationManager.delegate(request(depth, true));
                if (result.status() == DelegationStatus.DELEGATED) {
                    accepted++;
                    depth = (int) result.details().get("next_delegation_depth");
                }
            } while (result.status() == DelegationStatus.DELEGATED && accepted < 10);

            assertEquals(3, accepted);
            assertEquals(DelegationStatus.CAPPED, result.status());
            assertEquals(3, core.provider.calls(), "only accepted delegations execute");
        }
    }

    @Nested
    @DisplayName("accepted delegation")
    class Accepted {

        @Test
        @DisplayName("writes a delegation memory linking both agents and the depth")
        void writesDelegationMemory() throws Exception {
            var core = new CoreFixture();

            DelegationResult result = core.delegationManager.delegate(request(1, false));

            assertEquals(DelegationStatus.DELEGATED, result.status());
            String memoryId = (String) result.details().get("memory_id");
            MemoryEntry entry = core.memoryStore.findById(memoryId).orElseThrow();
            assertEquals("delegation", entry.type());
            assertEquals("ORCHESTRATOR", entry.agentId());
            JsonNode link = core.objectMapper.readTree(entry.content());
            assertEquals("ORCHESTRATOR", link.get("from_agent").asText());
            assertEquals("NOVA", link.get("to_agent").asText());
            assertEquals(1, link.get("delegation_depth").asInt());
            assertEquals(0, core.provider.calls());
            assertFalse(result.details().containsKey("execution"));
        }

        @Test
        @DisplayName("auto_execute runs the task on the receiver with depth + 1")
        void autoExecute() {
            var core = new CoreFixture();
            core.provider.respondingWith(prompt -> "form built");

            DelegationResult result = core.delegationManager.delegate(request(1, true));

            assertEquals(2, result.details().get("next_delegation_depth"));
            @SuppressWarnings("unchecked")
            Map<String, Object> execution = (Map<String, Object>) result.details().get("execution");
            assertEquals(RunStatus.SUCCESS, execution.get("status"));
            assertEquals("form built", execution.get("result_text"));

            String prompt = core.provider.lastPrompt();
            assertTrue(prompt.startsWith("Build the login form"));
            assertTrue(prompt.contains("\"delegation_depth\" : 2"));
            assertEquals(1, core.memoryStore.query("NOVA", "p1", "task_execution", 0).size());
        }

        @Test
        @DisplayName("delegation outcomes are counted and published")
        void metricsAndEvents() {
            var core = new CoreFixture(new CapsPolicy(5, 1));
            core.delegationManager.delegate(request(0, false));
            core.delegationManager.delegate(request(1, false));

            var delegated = core.meterRegistry.find("hivemind.delegation.total").tag("outcome", "delegated").counter();
            var capped = core.meterRegistry.find("hivemind.delegation.total").tag("outcome", "capped").counter();
            assertEquals(1.0, delegated.count());
            assertEquals(1.0, capped.count());
            assertEquals(1, core.supervision.count(HivemindEvent.DELEGATION_ACCEPTED));
            assertEquals(1, core.supervision.count(HivemindEvent.DELEGATION_REFUSED));
        }
    }

    @Nested
    @DisplayName("invalid requests")
    class Invalid {

        @Test
        @DisplayName("unknown receiver is not_found")
        void unknownReceiver() {
            var core = new CoreFixture();
            DelegationResult result = core.delegationManager.delegate(
                    new DelegationRequest("HAL", "GHOST", "task", 0, false, null));
            assertEquals(DelegationStatus.NOT_FOUND, result.status());
            assertEquals("GHOST", result.details().get("agent_id"));
        }

        @Test
        @DisplayName("missing task is an error")
        void missingTask() {
            var core = new CoreFixture();
            DelegationResult result = core.delegationManager.delegate(
                    new DelegationRequest("HAL", "ASH", " ", null, null, null));
            assertEquals(DelegationStatus.ERROR, result.status());
        }

        @Test
        @DisplayName("negative depth is an error")
        void negativeDepth() {
            var core = new CoreFixture();
            DelegationResult result = core.delegationManager.delegate(
                    new DelegationRequest("HAL", "ASH", "task", -1, null, null));
            assertEquals(DelegationStatus.ERROR, result.status());
        }

        @Test
        @DisplayName("null depth is treated as zero")
        void nullDepth() {
            var core = new CoreFixture(new CapsPolicy(5, 1));
            DelegationResult result = core.delegationManager.delegate(
                    new DelegationRequest("HAL", "ASH", "task", null, null, null));
            assertEquals(DelegationStatus.DELEGATED, result.status());
            assertEquals(0, result.details().get("delegation_depth"));
        }
    }
}
