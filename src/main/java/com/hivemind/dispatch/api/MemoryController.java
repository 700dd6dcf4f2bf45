package com.hivemind.dispatch.api;

import com.hivemind.core.memory.MemoryStore;
import com.hivemind.core.model.MemoryEntry;
import com.hivemind.core.model.MemoryQuery;
import com.hivemind.core.model.NewMemory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * REST controller for writing and recalling agent memory.
 */
@RestController
@RequestMapping("/api/v1/memory")
public class MemoryController {

    private final MemoryStore memoryStore;

    public MemoryController(MemoryStore memoryStore) {
        this.memoryStore = memoryStore;
    }

    /**
     * POST /api/v1/memory/write: Append one entry.
     */
    @PostMapping("/write")
    public ResponseEntity<Map<String, Object>> write(@RequestBody MemoryWriteRequest request) {
        ApiRequests.requireText(request.agentId(), "agent_id");
        ApiRequests.requireText(request.type(), "type");
        MemoryEntry entry = memoryStore.append(
                NewMemory.of(request.agentId(), request.projectId(), request.type(), request.contentText())
                        .withTags(request.tags())
                        .withTrace(request.taskId(), request.memoryTraceId())
                        .withStatus(request.status()));
        return ResponseEntity.ok(Map.of("status", "success", "memory_id", entry.memoryId()));
    }

    /**
     * GET /api/v1/memory/read: Matching entries, newest first. {@code limit <= 0} returns all.
     */
    @GetMapping("/read")
    public ResponseEntity<Map<String, Object>> read(
            @RequestParam("agent_id") String agentId,
            @RequestParam(value = "project_id", required = false) String projectId,
            @RequestParam(value = "type", required = false) String type,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "since", required = false) String since,
            @RequestParam(value = "limit", defaultValue = "0") int limit) {
        ApiRequests.requireText(agentId, "agent_id");
        List<MemoryEntry> memories = memoryStore.query(
                new MemoryQuery(agentId, projectId, type, tag, parseSince(since), limit));
        return ResponseEntity.ok(Map.of("status", "success", "memories", memories));
    }

    /**
     * GET /api/v1/memory/{memoryId}: A single entry by id.
     */
    @GetMapping("/{memoryId}")
    public ResponseEntity<Map<String, Object>> byId(@PathVariable String memoryId) {
        return memoryStore.findById(memoryId)
                .<ResponseEntity<Map<String, Object>>>map(m -> ResponseEntity.ok(Map.of("status", "success", "memory", m)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                        "status", "error",
                        "message", "Memory with ID '" + memoryId + "' not found")));
    }

    private static Instant parseSince(String since) {
        if (since == null || since.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(since);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("since must be an ISO-8601 instant, got '" + since + "'");
        }
    }
}
