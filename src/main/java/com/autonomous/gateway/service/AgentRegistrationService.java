package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.AgentNotRegisteredException;
import com.autonomous.gateway.model.AgentRecord;
import com.autonomous.gateway.model.TaskRecord;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class AgentRegistrationService {

    private final AgentCardResolver cardResolver;
    private final AgentDirectory agentDirectory;
    private final TaskStore taskStore;
    private final BackgroundReconciler backgroundReconciler;

    public AgentRegistrationService(AgentCardResolver cardResolver,
                                    AgentDirectory agentDirectory,
                                    TaskStore taskStore,
                                    BackgroundReconciler backgroundReconciler) {
        this.cardResolver = cardResolver;
        this.agentDirectory = agentDirectory;
        this.taskStore = taskStore;
        this.backgroundReconciler = backgroundReconciler;
    }

    // Registering a known url again refreshes its card
    public AgentRecord register(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Agent url must not be empty");
        }
        String endpoint = url.trim();
        JsonNode card = cardResolver.resolve(endpoint);
        return agentDirectory.put(endpoint, card);
    }

    public List<AgentRecord> list() {
        return agentDirectory.list();
    }

    public Unregistration unregister(String url) {
        Unregistration result = agentDirectory.removeThen(url, removed -> {
            taskStore.list(null, null, null).stream()
                .filter(t -> url.equals(t.getEndpoint()))
                .map(TaskRecord::getGatewayId)
                .forEach(backgroundReconciler::cancel);
            return new Unregistration(removed, taskStore.deleteByEndpoint(url));
        }).orElseThrow(() -> new AgentNotRegisteredException(url));

        log.info("Unregistered '{}', removed {} tasks", result.getAgent().getName(), result.getRemovedTasks());
        return result;
    }

    @Data
    @AllArgsConstructor
    public static class Unregistration {
        private AgentRecord agent;
        private int removedTasks;
    }
}
