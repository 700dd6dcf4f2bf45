package com.hivemind.dispatch.api;

import com.hivemind.core.supervision.SupervisionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller exposing supervision counters and the active caps.
 */
@RestController
@RequestMapping("/api/v1/supervision")
public class SupervisionController {

    private final SupervisionService supervisionService;

    public SupervisionController(SupervisionService supervisionService) {
        this.supervisionService = supervisionService;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        var status = supervisionService.status();
        var body = new LinkedHashMap<String, Object>();
        body.put("status", "success");
        body.put("system_caps", status.caps());
        body.put("event_counts", status.eventCounts());
        body.put("halted_agents", status.haltedAgents());
        body.put("last_event_type", status.lastEventType());
        body.put("last_event_at", status.lastEventAt());
        return ResponseEntity.ok(body);
    }
}
