package com.autonomous.gateway.controller;

import com.autonomous.gateway.model.AgentRecord;
import com.autonomous.gateway.model.SendMessageRequest;
import com.autonomous.gateway.model.TaskRecord;
import com.autonomous.gateway.service.AgentDirectory;
import com.autonomous.gateway.service.AgentRegistrationService;
import com.autonomous.gateway.service.BackgroundReconciler;
import com.autonomous.gateway.service.DispatchCoordinator;
import com.autonomous.gateway.service.QueryService;
import com.autonomous.gateway.service.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class GatewayController {

    private final AgentRegistrationService registrationService;
    private final DispatchCoordinator dispatchCoordinator;
    private final QueryService queryService;
    private final AgentDirectory agentDirectory;
    private final TaskStore taskStore;
    private final BackgroundReconciler backgroundReconciler;

    public GatewayController(AgentRegistrationService registrationService,
                             DispatchCoordinator dispatchCoordinator,
                             QueryService queryService,
                             AgentDirectory agentDirectory,
                             TaskStore taskStore,
                             BackgroundReconciler backgroundReconciler) {
        this.registrationService = registrationService;
        this.dispatchCoordinator = dispatchCoordinator;
        this.queryService = queryService;
        this.agentDirectory = agentDirectory;
        this.taskStore = taskStore;
        this.backgroundReconciler = backgroundReconciler;
    }

    @PostMapping("/agents")
    public ResponseEntity<?> registerAgent(@RequestBody Map<String, String> body) {
        AgentRecord agent = registrationService.register(body.get("url"));
        return ResponseEntity.ok(Map.of(
            "status", "success",
            "agent", describe(agent)
        ));
    }

    @GetMapping("/agents")
    public ResponseEntity<?> listAgents() {
        List<Map<String, Object>> agents = registrationService.list().stream()
            .map(this::describe)
            .toList();
        return ResponseEntity.ok(agents);
    }

    @DeleteMapping("/agents")
    public ResponseEntity<?> unregisterAgent(@RequestParam("url") String url) {
        AgentRegistrationService.Unregistration result = registrationService.unregister(url);
        return ResponseEntity.ok(Map.of(
            "status", "success",
            "unregistered_agent", result.getAgent().getName(),
            "removed_tasks", result.getRemovedTasks()
        ));
    }

    @PostMapping("/messages")
    public ResponseEntity<TaskRecord> sendMessage(@RequestBody SendMessageRequest request) {
        requireMessage(request);
        return ResponseEntity.ok(dispatchCoordinator.dispatch(
            request.getAgentUrl(), request.getMessage(), request.getSessionId()));
    }

    @PostMapping("/messages/stream")
    public ResponseEntity<TaskRecord> sendMessageStream(@RequestBody SendMessageRequest request) {
        requireMessage(request);
        return ResponseEntity.ok(dispatchCoordinator.dispatchStreaming(
            request.getAgentUrl(), request.getMessage(), request.getSessionId()));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskRecord> getTaskResult(@PathVariable String taskId,
                                                    @RequestParam(value = "history_length", required = false) Integer historyLength) {
        return ResponseEntity.ok(queryService.getResult(taskId, historyLength));
    }

    @PostMapping("/tasks/{taskId}/cancel")
    public ResponseEntity<TaskRecord> cancelTask(@PathVariable String taskId) {
        return ResponseEntity.ok(queryService.cancel(taskId));
    }

    @GetMapping("/tasks")
    public ResponseEntity<List<TaskRecord>> getTaskList(@RequestParam(value = "state", required = false) String state,
                                                        @RequestParam(value = "sort", defaultValue = "Descending") String sort,
                                                        @RequestParam(value = "number", required = false) Integer number) {
        return ResponseEntity.ok(queryService.list(state, sort, number));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "healthy",
            "agents", agentDirectory.size(),
            "tasks", taskStore.size(),
            "background_units", backgroundReconciler.outstandingCount()
        ));
    }

    private Map<String, Object> describe(AgentRecord agent) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("url", agent.getEndpoint());
        view.put("card", agent.getCard());
        return view;
    }

    private void requireMessage(SendMessageRequest request) {
        if (request.getAgentUrl() == null || request.getAgentUrl().isBlank()) {
            throw new IllegalArgumentException("agent_url is required");
        }
        if (request.getMessage() == null) {
            throw new IllegalArgumentException("message is required");
        }
    }
}
