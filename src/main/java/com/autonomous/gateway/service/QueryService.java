package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.GatewayException;
import com.autonomous.gateway.exception.TaskNotFoundException;
import com.autonomous.gateway.model.AgentRecord;
import com.autonomous.gateway.model.ClassifiedReply;
import com.autonomous.gateway.model.SortOrder;
import com.autonomous.gateway.model.TaskRecord;
import com.autonomous.gateway.model.TaskState;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

@Slf4j
@Service
public class QueryService {

    private final TaskStore taskStore;
    private final AgentDirectory agentDirectory;
    private final RemoteInvoker remoteInvoker;
    private final ReplyClassifier replyClassifier;
    private final BackgroundReconciler backgroundReconciler;

    public QueryService(TaskStore taskStore,
                        AgentDirectory agentDirectory,
                        RemoteInvoker remoteInvoker,
                        ReplyClassifier replyClassifier,
                        BackgroundReconciler backgroundReconciler) {
        this.taskStore = taskStore;
        this.agentDirectory = agentDirectory;
        this.remoteInvoker = remoteInvoker;
        this.replyClassifier = replyClassifier;
        this.backgroundReconciler = backgroundReconciler;
    }

    /**
     * Terminal tasks are answered from the store; others are refreshed from the agent once first.
     */
    public TaskRecord getResult(String gatewayId, Integer historyLength) {
        TaskRecord record = taskStore.get(gatewayId).orElseThrow(() -> new TaskNotFoundException(gatewayId));
        if (record.isTerminal()) {
            return record;
        }
        Optional<AgentRecord> agent = agentDirectory.get(record.getEndpoint());
        if (agent.isEmpty()) {
            log.warn("Agent {} for task {} not found, returning stored state", record.getEndpoint(), gatewayId);
            return record;
        }
        log.info("Retrieving result for task {}", gatewayId);
        return backgroundReconciler.refresh(record, agent.get(), historyLength);
    }

    public List<TaskRecord> list(String state, String sort, Integer limit) {
        TaskState stateFilter = state == null || state.isBlank() ? null : TaskState.fromWireName(state);
        return taskStore.list(stateFilter, SortOrder.parse(sort), limit);
    }

    /**
     * A task that already finished is returned as it is. If the agent reports the task finished in some
     * other way, that state is kept.
     */
    public TaskRecord cancel(String gatewayId) {
        TaskRecord record = taskStore.get(gatewayId).orElseThrow(() -> new TaskNotFoundException(gatewayId));
        if (record.isTerminal()) {
            return record;
        }
        Optional<AgentRecord> agent = agentDirectory.get(record.getEndpoint());
        if (agent.isEmpty()) {
            return taskStore.update(gatewayId, r -> r.fail(null, "Agent for task " + gatewayId + " not found."))
                .orElse(record);
        }

        log.info("Cancelling task {} on {}", gatewayId, agent.get().getName());
        ClassifiedReply reply;
        try {
            JsonNode raw = remoteInvoker.cancelTask(agent.get(), record.getRemoteTaskId());
            reply = replyClassifier.classify(raw);
        } catch (GatewayException e) {
            log.error("Error cancelling task {}: {}", gatewayId, e.getMessage());
            return finish(gatewayId, r -> r.fail(null, e.getMessage()), record);
        }

        if (reply.isFailure()) {
            log.warn("Agent refused to cancel task {}: {}", gatewayId, reply.getErrorMessage());
            return finish(gatewayId, reply::applyTo, record);
        }
        return finish(gatewayId, r -> {
            reply.applyTo(r);
            if (!r.isTerminal()) {
                r.setState(TaskState.CANCELLED);
            }
        }, record);
    }

    private TaskRecord finish(String gatewayId, Consumer<TaskRecord> mutation, TaskRecord fallback) {
        TaskRecord updated = taskStore.update(gatewayId, mutation).orElse(fallback);
        if (updated.isTerminal()) {
            backgroundReconciler.cancel(gatewayId);
        }
        return updated;
    }
}
