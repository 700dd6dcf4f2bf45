package com.hivemind.dispatch.api;

import com.hivemind.core.delegation.DelegationManager;
import com.hivemind.core.engine.RunEngine;
import com.hivemind.core.loop.LoopScheduler;
import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.DelegationRequest;
import com.hivemind.core.model.DelegationResult;
import com.hivemind.core.model.LoopRequest;
import com.hivemind.core.model.LoopResult;
import com.hivemind.core.model.RunRequest;
import com.hivemind.core.model.RunResult;
import com.hivemind.core.registry.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for agent invocation, looping, delegation and registry management.
 */
@RestController
@RequestMapping("/api/v1/agent")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentRegistry registry;
    private final RunEngine runEngine;
    private final LoopScheduler loopScheduler;
    private final DelegationManager delegationManager;

    public AgentController(AgentRegistry registry, RunEngine runEngine,
                           LoopScheduler loopScheduler, DelegationManager delegationManager) {
        this.registry = registry;
        this.runEngine = runEngine;
        this.loopScheduler = loopScheduler;
        this.delegationManager = delegationManager;
    }

    /**
     * POST /api/v1/agent/run: Invoke an agent once.
     */
    @PostMapping("/run")
    public ResponseEntity<RunResponse> run(@RequestBody RunRequest request) {
        ApiRequests.requireText(request.agentId(), "agent_id");
        ApiRequests.requireText(request.objective(), "objective");
        RunResult result = runEngine.run(request);
        HttpStatus status = switch (result.status()) {
            case SUCCESS -> HttpStatus.OK;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(RunResponse.from(result));
    }

    /**
     * POST /api/v1/agent/loop: Run one capped loop cycle. 429 when the agent is at its loop cap.
     */
    @PostMapping("/loop")
    public ResponseEntity<LoopResponse> loop(@RequestBody LoopRequest request) {
        ApiRequests.requireText(request.agentId(), "agent_id");
        LoopResult result = loopScheduler.loop(request);
        HttpStatus status = switch (result.status()) {
            case OK, INCOMPLETE -> HttpStatus.OK;
            case CAPPED -> HttpStatus.TOO_MANY_REQUESTS;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(LoopResponse.from(result));
    }

    /**
     * POST /api/v1/agent/delegate: Hand a task to another agent. 429 when the chain is too deep.
     */
    @PostMapping("/delegate")
    public ResponseEntity<DelegationResult> delegate(@RequestBody DelegationRequest request) {
        ApiRequests.requireText(request.fromAgent(), "from_agent");
        ApiRequests.requireText(request.toAgent(), "to_agent");
        ApiRequests.requireText(request.task(), "task");
        DelegationResult result = delegationManager.delegate(request);
        HttpStatus status = switch (result.status()) {
            case DELEGATED -> HttpStatus.OK;
            case CAPPED -> HttpStatus.TOO_MANY_REQUESTS;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(result);
    }

    /**
     * POST /api/v1/agent/create: Register a new agent. 409 if the id is taken.
     */
    @PostMapping("/create")
    public ResponseEntity<Map<String, Object>> create(@RequestBody CreateAgentRequest request) {
        String agentId = ApiRequests.requireText(request.agentId(), "agent_id");
        AgentRecord created = registry.create(agentId, request.name(), request.description(),
                request.traits(), request.modules());
        log.info("Created agent {} via API", agentId);

        var body = new LinkedHashMap<String, Object>();
        body.put("status", "success");
        body.put("agent_id", created.agentId());
        body.put("message", "Agent " + created.agentId() + " created");
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/agent/list: All registered agents.
     */
    @GetMapping("/list")
    public ResponseEntity<Map<String, Object>> list() {
        var agents = registry.list().stream().map(AgentSummary::from).toList();
        return ResponseEntity.ok(Map.of("status", "success", "agents", agents));
    }

    /**
     * GET /api/v1/agent/{agentId}: Full agent record including runtime state.
     */
    @GetMapping("/{agentId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String agentId) {
        AgentRecord agent = registry.require(agentId);
        return ResponseEntity.ok(Map.of("status", "success", "agent", agent));
    }

    /**
     * POST /api/v1/agent/{agentId}/reset: Operator reset of the loop counter; clears system_halt.
     */
    @PostMapping("/{agentId}/reset")
    public ResponseEntity<Map<String, Object>> reset(@PathVariable String agentId) {
        AgentRecord agent = registry.resetLoopCount(agentId);
        var body = new LinkedHashMap<String, Object>();
        body.put("status", "success");
        body.put("agent_id", agent.agentId());
        body.put("loop_count", agent.loopCount());
        body.put("agent_state", agent.agentState());
        return ResponseEntity.ok(body);
    }
}
