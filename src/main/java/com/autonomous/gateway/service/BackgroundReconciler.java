package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.GatewayException;
import com.autonomous.gateway.model.AgentRecord;
import com.autonomous.gateway.model.ClassifiedReply;
import com.autonomous.gateway.model.TaskRecord;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls {@code tasks/get} for every non-terminal task until it is terminal, removed, or older than
 * {@code gateway.reconciler.max-lifetime}. Between polls a unit holds no thread.
 */
@Slf4j
@Service
public class BackgroundReconciler {

    @Value("${gateway.reconciler.poll-interval:2s}")
    private Duration pollInterval = Duration.ofSeconds(2);

    @Value("${gateway.reconciler.max-lifetime:1h}")
    private Duration maxLifetime = Duration.ofHours(1);

    private final TaskStore taskStore;
    private final AgentDirectory agentDirectory;
    private final RemoteInvoker remoteInvoker;
    private final ReplyClassifier replyClassifier;
    private final ExecutorService workerPool;

    private final Map<String, CompletableFuture<Void>> outstanding = new ConcurrentHashMap<>();

    public BackgroundReconciler(TaskStore taskStore,
                                AgentDirectory agentDirectory,
                                RemoteInvoker remoteInvoker,
                                ReplyClassifier replyClassifier,
                                ExecutorService gatewayWorkerPool) {
        this.taskStore = taskStore;
        this.agentDirectory = agentDirectory;
        this.remoteInvoker = remoteInvoker;
        this.replyClassifier = replyClassifier;
        this.workerPool = gatewayWorkerPool;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public void setMaxLifetime(Duration maxLifetime) {
        this.maxLifetime = maxLifetime;
    }

    /**
     * Waits for {@code inFlight} (may be null) before the first poll. At most one unit runs per task.
     */
    public CompletableFuture<Void> track(String gatewayId, CompletableFuture<?> inFlight) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        CompletableFuture<Void> existing = outstanding.putIfAbsent(gatewayId, completion);
        if (existing != null) {
            return existing;
        }

        Unit unit = new Unit(gatewayId, completion, Instant.now().plus(maxLifetime));
        log.debug("Reconciling task {} (outstanding units: {})", gatewayId, outstanding.size());

        if (inFlight != null && !inFlight.isDone()) {
            inFlight.whenComplete((ignored, error) -> continueAfterDispatch(unit));
        } else {
            continueAfterDispatch(unit);
        }
        return completion;
    }

    public Optional<CompletableFuture<Void>> completionOf(String gatewayId) {
        return Optional.ofNullable(outstanding.get(gatewayId));
    }

    public boolean isTracking(String gatewayId) {
        return outstanding.containsKey(gatewayId);
    }

    public int outstandingCount() {
        return outstanding.size();
    }

    public boolean cancel(String gatewayId) {
        CompletableFuture<Void> completion = outstanding.remove(gatewayId);
        if (completion == null) {
            return false;
        }
        completion.cancel(false);
        log.debug("Stopped reconciling task {}", gatewayId);
        return true;
    }

    @PreDestroy
    public void shutdown() {
        List<String> ids = new ArrayList<>(outstanding.keySet());
        ids.forEach(this::cancel);
        if (!ids.isEmpty()) {
            log.info("Stopped {} background reconciler units", ids.size());
        }
    }

    /**
     * One {@code tasks/get}. "Task not found" leaves the record unchanged; any other failure ends it in error.
     */
    public TaskRecord refresh(TaskRecord record, AgentRecord agent, Integer historyLength) {
        String gatewayId = record.getGatewayId();
        ClassifiedReply reply;
        try {
            JsonNode raw = remoteInvoker.getTask(agent, record.getRemoteTaskId(), historyLength);
            reply = replyClassifier.classify(raw);
        } catch (GatewayException e) {
            log.error("Error retrieving task {} from {}: {}", gatewayId, agent.getEndpoint(), e.getMessage());
            return taskStore.update(gatewayId, r -> r.fail(null, e.getMessage())).orElse(record);
        }

        if (reply.isTaskNotFound()) {
            log.debug("Agent {} does not know task {} yet, treating it as still running",
                agent.getName(), record.getRemoteTaskId());
            return taskStore.get(gatewayId).orElse(record);
        }
        if (reply.isFailure()) {
            log.warn("Agent {} reported a failure for task {}: {}", agent.getName(), gatewayId, reply.getErrorMessage());
        }
        return taskStore.update(gatewayId, reply::applyTo).orElse(record);
    }

    private void continueAfterDispatch(Unit unit) {
        if (unit.isStopped()) {
            return;
        }
        Optional<TaskRecord> current = taskStore.get(unit.gatewayId);
        if (current.isEmpty() || current.get().isTerminal()) {
            finish(unit);
            return;
        }
        scheduleNextPoll(unit);
    }

    private void scheduleNextPoll(Unit unit) {
        if (workerPool.isShutdown()) {
            log.warn("Worker pool is shut down, no longer polling task {}", unit.gatewayId);
            finish(unit);
            return;
        }
        Executor delayed = CompletableFuture.delayedExecutor(pollInterval.toMillis(), TimeUnit.MILLISECONDS, workerPool);
        delayed.execute(() -> pollOnce(unit));
    }

    private void pollOnce(Unit unit) {
        if (unit.isStopped()) {
            return;
        }
        try {
            Optional<TaskRecord> current = taskStore.get(unit.gatewayId);
            if (current.isEmpty()) {
                log.info("Task {} was removed, stopping its reconciler", unit.gatewayId);
                finish(unit);
                return;
            }
            TaskRecord record = current.get();
            if (record.isTerminal()) {
                finish(unit);
                return;
            }
            if (Instant.now().isAfter(unit.deadline)) {
                log.warn("Task {} still {} after {}, no longer polling it", unit.gatewayId,
                    record.getState().wireName(), maxLifetime);
                finish(unit);
                return;
            }
            Optional<AgentRecord> agent = agentDirectory.get(record.getEndpoint());
            if (agent.isEmpty()) {
                log.info("Agent {} of task {} is gone, stopping its reconciler", record.getEndpoint(), unit.gatewayId);
                finish(unit);
                return;
            }

            TaskRecord after = refresh(record, agent.get(), null);
            if (after.isTerminal()) {
                log.info("Task {} reached state {}", unit.gatewayId, after.getState().wireName());
                finish(unit);
            } else {
                scheduleNextPoll(unit);
            }
        } catch (RuntimeException e) {
            log.error("Reconciler for task {} failed: {}", unit.gatewayId, e.getMessage(), e);
            taskStore.update(unit.gatewayId, r -> r.fail(null, "Background polling failed: " + e.getMessage()));
            finish(unit);
        }
    }

    private void finish(Unit unit) {
        outstanding.remove(unit.gatewayId, unit.completion);
        unit.completion.complete(null);
    }

    private static final class Unit {
        private final String gatewayId;
        private final CompletableFuture<Void> completion;
        private final Instant deadline;

        private Unit(String gatewayId, CompletableFuture<Void> completion, Instant deadline) {
            this.gatewayId = gatewayId;
            this.completion = completion;
            this.deadline = deadline;
        }

        private boolean isStopped() {
            return completion.isDone();
        }
    }
}
