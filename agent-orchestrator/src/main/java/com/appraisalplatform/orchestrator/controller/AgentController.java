package com.appraisalplatform.orchestrator.controller;

import com.appraisalplatform.common.agent.Agent;
import com.appraisalplatform.common.event.EventLog;
import com.appraisalplatform.common.event.EventRecord;
import com.appraisalplatform.common.exception.AgentNotFoundException;
import com.appraisalplatform.common.message.AgentResponse;
import com.appraisalplatform.common.model.AgentIdentity;
import com.appraisalplatform.common.replay.ReplayStatistics;
import com.appraisalplatform.common.replay.ReplayStore;
import com.appraisalplatform.orchestrator.broker.ExecuteOptions;
import com.appraisalplatform.orchestrator.broker.MasterControlProgram;
import com.appraisalplatform.orchestrator.config.AgentSystemProperties;
import com.appraisalplatform.orchestrator.manager.AgentManager;
import com.appraisalplatform.orchestrator.manager.AgentStatus;
import com.appraisalplatform.orchestrator.workflow.AgentWorkflow;
import com.appraisalplatform.orchestrator.workflow.WorkflowException;
import com.appraisalplatform.orchestrator.workflow.WorkflowResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational view of the agent system for dashboards and manual checks.
 */
@RestController
@RequestMapping("/api/v1/agents")
@ConditionalOnProperty(prefix = "agent-system.dashboard", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);
    private static final int MAX_EVENTS = 500;

    private final AgentManager agentManager;
    private final MasterControlProgram broker;
    private final EventLog eventLog;
    private final ReplayStore replayStore;
    private final AgentSystemProperties properties;

    public AgentController(AgentManager agentManager, MasterControlProgram broker,
                           EventLog eventLog, ReplayStore replayStore, AgentSystemProperties properties) {
        this.agentManager = agentManager;
        this.broker = broker;
        this.eventLog = eventLog;
        this.replayStore = replayStore;
        this.properties = properties;
    }

    @GetMapping
    public List<AgentIdentity> agents() {
        return agentManager.getAllAgents().stream().map(Agent::identity).toList();
    }

    @GetMapping("/status")
    public List<AgentStatus> allStatus() {
        return agentManager.getAllAgentStatus();
    }

    @GetMapping("/{agentId}/status")
    public ResponseEntity<AgentStatus> status(@PathVariable String agentId) {
        return agentManager.getAgentStatus(agentId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    @GetMapping("/capabilities/{capability}")
    public List<AgentIdentity> byCapability(@PathVariable String capability) {
        return broker.getAgentsByCapability(capability).stream().map(Agent::identity).toList();
    }

    @PostMapping("/{agentId}/execute")
    public Mono<ResponseEntity<AgentResponse>> execute(@PathVariable String agentId,
                                                       @Valid @RequestBody ExecuteRequest request) {
        log.info("Execute requested. agentId={} operation={} correlationId={}",
                 agentId, request.operation(), request.correlationId());
        return broker.executeAgent(agentId, request.toAgentRequest(), request.toOptions())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/events")
    public List<EventRecord> events(@RequestParam(defaultValue = "50") int limit) {
        return eventLog.recent(Math.min(Math.max(limit, 0), MAX_EVENTS));
    }

    @GetMapping("/replay/statistics")
    public ReplayStatistics replayStatistics() {
        return replayStore.statistics();
    }

    // ── workflows ────────────────────────────────────────────────────────────

    @GetMapping("/workflows")
    public List<AgentWorkflow> workflows() {
        return broker.getWorkflows();
    }

    @PostMapping("/workflows/{workflowId}/execute")
    public Mono<WorkflowResult> executeWorkflow(@PathVariable String workflowId,
                                                @RequestBody(required = false) Map<String, Object> input) {
        log.info("Workflow execution requested. workflowId={}", workflowId);
        return broker.executeWorkflow(workflowId, input == null ? Map.of() : input, ExecuteOptions.defaults());
    }

    @GetMapping("/workflows/history")
    public List<WorkflowResult> workflowHistory(@RequestParam(defaultValue = "20") int limit) {
        return broker.getWorkflowHistory(Math.min(limit, MAX_EVENTS));
    }

    @GetMapping("/workflows/executions/{executionId}")
    public ResponseEntity<WorkflowResult> workflowExecution(@PathVariable String executionId) {
        return broker.getWorkflowExecution(executionId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        List<AgentStatus> statuses = agentManager.getAllAgentStatus();
        long healthy = statuses.stream().filter(AgentStatus::healthy).count();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy == statuses.size() ? "UP" : "DEGRADED");
        body.put("agents", statuses.size());
        body.put("healthyAgents", healthy);
        body.put("monitoring", agentManager.isMonitoring());
        body.put("settings", properties.startupSummary());
        return body;
    }

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<Map<String, String>> workflowUnavailable(WorkflowException e) {
        HttpStatus status = broker.getWorkflow(e.getWorkflowId()).isPresent() ? HttpStatus.CONFLICT : HttpStatus.NOT_FOUND;
        return ResponseEntity.status(status)
            .body(Map.of("error", "workflow_unavailable", "workflowId", e.getWorkflowId(), "message", e.getMessage()));
    }

    @ExceptionHandler(AgentNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(AgentNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "agent_not_found", "agentId", e.getAgentId(), "message", e.getMessage()));
    }
}
