package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.AgentNotRegisteredException;
import com.autonomous.gateway.model.AgentRecord;
import com.autonomous.gateway.model.ClassifiedReply;
import com.autonomous.gateway.model.TaskRecord;
import com.autonomous.gateway.model.TaskResult;
import com.autonomous.gateway.model.TaskState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Sends caller messages to agents. The caller waits at most {@code gateway.dispatch.immediate-timeout};
 * after that the still-running call is handed to the {@link BackgroundReconciler}, never cancelled.
 */
@Slf4j
@Service
public class DispatchCoordinator {

    static final String PENDING_NOTE =
        "The agent has not answered yet; the task continues in the background. Use get_task_result to check on it.";

    @Value("${gateway.dispatch.immediate-timeout:3s}")
    private Duration immediateTimeout = Duration.ofSeconds(3);

    private final AgentDirectory agentDirectory;
    private final RemoteInvoker remoteInvoker;
    private final ReplyClassifier replyClassifier;
    private final TaskStore taskStore;
    private final BackgroundReconciler backgroundReconciler;
    private final ExecutorService workerPool;

    public DispatchCoordinator(AgentDirectory agentDirectory,
                               RemoteInvoker remoteInvoker,
                               ReplyClassifier replyClassifier,
                               TaskStore taskStore,
                               BackgroundReconciler backgroundReconciler,
                               ExecutorService gatewayWorkerPool) {
        this.agentDirectory = agentDirectory;
        this.remoteInvoker = remoteInvoker;
        this.replyClassifier = replyClassifier;
        this.taskStore = taskStore;
        this.backgroundReconciler = backgroundReconciler;
        this.workerPool = gatewayWorkerPool;
    }

    public void setImmediateTimeout(Duration immediateTimeout) {
        this.immediateTimeout = immediateTimeout;
    }

    /**
     * Never throws for remote failures: they come back as a record in state {@code error}.
     */
    public TaskRecord dispatch(String endpoint, String payload, String sessionId) {
        Optional<Started> started = start(endpoint, payload, sessionId);
        if (started.isEmpty()) {
            return rejectUnregistered(endpoint, payload, sessionId);
        }

        AgentRecord agent = started.get().agent;
        TaskRecord pending = started.get().pending;
        String gatewayId = pending.getGatewayId();
        log.info("Sending message to {} as task {}", agent.getName(), gatewayId);

        CompletableFuture<TaskRecord> call = CompletableFuture
            .supplyAsync(() -> remoteInvoker.sendMessage(agent, gatewayId, payload, sessionId), workerPool)
            .thenApply(reply -> merge(gatewayId, replyClassifier.classify(reply), false, pending))
            .exceptionally(error -> recordFailure(gatewayId, error, pending));

        return awaitImmediate(gatewayId, call, pending);
    }

    public TaskRecord dispatchStreaming(String endpoint, String payload, String sessionId) {
        Optional<Started> started = start(endpoint, payload, sessionId);
        if (started.isEmpty()) {
            return rejectUnregistered(endpoint, payload, sessionId);
        }

        AgentRecord agent = started.get().agent;
        TaskRecord pending = started.get().pending;
        String gatewayId = pending.getGatewayId();
        log.info("Streaming message to {} as task {}", agent.getName(), gatewayId);

        Supplier<TaskRecord> stream = () -> {
            remoteInvoker.streamMessage(agent, gatewayId, payload, sessionId,
                event -> merge(gatewayId, replyClassifier.classify(event), true, pending));
            return taskStore.get(gatewayId).orElse(pending);
        };
        CompletableFuture<TaskRecord> call = CompletableFuture
            .supplyAsync(stream, workerPool)
            .exceptionally(error -> recordFailure(gatewayId, error, pending));

        return awaitImmediate(gatewayId, call, pending);
    }

    private TaskRecord awaitImmediate(String gatewayId, CompletableFuture<TaskRecord> call, TaskRecord pending) {
        try {
            TaskRecord record = call.get(immediateTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!record.isTerminal()) {
                backgroundReconciler.track(gatewayId, call);
            }
            return record;
        } catch (TimeoutException e) {
            log.info("Task {} not finished after {}, continuing in background", gatewayId, immediateTimeout);
            backgroundReconciler.track(gatewayId, call);
        } catch (InterruptedException e) {
            // Only the caller's wait is abandoned
            Thread.currentThread().interrupt();
            backgroundReconciler.track(gatewayId, call);
        } catch (ExecutionException e) {
            log.error("Dispatch of task {} failed unexpectedly: {}", gatewayId, e.getCause().getMessage(), e.getCause());
        }
        return taskStore.get(gatewayId).orElse(pending);
    }

    private TaskRecord merge(String gatewayId, ClassifiedReply reply, boolean streaming, TaskRecord fallback) {
        if (reply.isFailure()) {
            log.warn("Task {} failed upstream: {}", gatewayId, reply.getErrorMessage());
        }
        return taskStore.update(gatewayId, r -> reply.applyTo(r, streaming)).orElse(fallback);
    }

    private TaskRecord recordFailure(String gatewayId, Throwable error, TaskRecord fallback) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.error("Error sending message for task {}: {}", gatewayId, cause.getMessage());
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return taskStore.update(gatewayId, r -> r.fail(null, message)).orElse(fallback);
    }

    // Check and create run under the directory's membership lock; unregister waits for both
    private Optional<Started> start(String endpoint, String payload, String sessionId) {
        return agentDirectory.withRegistered(endpoint,
            agent -> new Started(agent, createPending(endpoint, payload, sessionId)));
    }

    private TaskRecord createPending(String endpoint, String payload, String sessionId) {
        TaskRecord pending = TaskRecord.builder()
            .gatewayId(UUID.randomUUID().toString())
            .endpoint(endpoint)
            .requestPayload(payload)
            .sessionId(sessionId)
            .state(TaskState.PENDING)
            .result(TaskResult.placeholder(PENDING_NOTE))
            .build();
        String gatewayId = taskStore.create(pending);
        return taskStore.get(gatewayId).orElse(pending);
    }

    private TaskRecord rejectUnregistered(String endpoint, String payload, String sessionId) {
        AgentNotRegisteredException error = new AgentNotRegisteredException(endpoint);
        log.warn(error.getMessage());
        TaskRecord record = TaskRecord.builder()
            .gatewayId(UUID.randomUUID().toString())
            .endpoint(endpoint)
            .requestPayload(payload)
            .sessionId(sessionId)
            .state(TaskState.ERROR)
            .result(TaskResult.failure(null, error.getMessage()))
            .build();
        String gatewayId = taskStore.create(record);
        return taskStore.get(gatewayId).orElse(record);
    }

    private static final class Started {
        private final AgentRecord agent;
        private final TaskRecord pending;

        private Started(AgentRecord agent, TaskRecord pending) {
            this.agent = agent;
            this.pending = pending;
        }
    }
}
