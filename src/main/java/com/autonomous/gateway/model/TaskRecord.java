package com.autonomous.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The gateway's record of one unit of delegated work.
 * <p>
 * {@code gatewayId} is the only key callers ever see. {@code agentId} is the id the remote agent
 * assigned to the same task and is used for outbound calls only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaskRecord {
    private String gatewayId;
    private String agentId;
    private String endpoint;
    private String requestPayload;
    private String sessionId;
    private TaskState state;
    private TaskResult result;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * The id to use when talking to the remote agent about this task.
     */
    @JsonIgnore
    public String getRemoteTaskId() {
        return agentId != null ? agentId : gatewayId;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    /**
     * Moves the record to {@link TaskState#ERROR}, keeping any artifacts already received.
     */
    public void fail(Integer errorCode, String errorMessage) {
        TaskResult failure = TaskResult.failure(errorCode, errorMessage);
        TaskResult current = result != null ? result : new TaskResult();
        current.setNote(null);
        current.setErrorCode(failure.getErrorCode());
        current.setErrorMessage(failure.getErrorMessage());
        current.setMessage(failure.getMessage());
        this.result = current;
        this.state = TaskState.ERROR;
    }

    public TaskRecord copy() {
        return toBuilder()
            .result(result == null ? null : result.copy())
            .build();
    }
}
