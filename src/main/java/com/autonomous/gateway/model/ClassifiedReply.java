package com.autonomous.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One remote reply, reduced to what the task record needs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifiedReply {

    /** JSON-RPC error code an A2A agent uses for an unknown task id. */
    public static final int TASK_NOT_FOUND_CODE = -32001;

    public enum Kind {
        IMMEDIATE_MESSAGE,
        TASK_HANDLE,
        UPSTREAM_ERROR,
        UNRECOGNIZED
    }

    private Kind kind;
    private TaskState state;
    private String agentId;
    private String sessionId;
    private String message;
    @Builder.Default
    private List<JsonNode> artifacts = new ArrayList<>();
    private boolean appendArtifacts;
    private Integer errorCode;
    private String errorMessage;

    public boolean isFailure() {
        return kind == Kind.UPSTREAM_ERROR || kind == Kind.UNRECOGNIZED;
    }

    public boolean isTaskNotFound() {
        return kind == Kind.UPSTREAM_ERROR && errorCode != null && errorCode == TASK_NOT_FOUND_CODE;
    }

    public void applyTo(TaskRecord record) {
        applyTo(record, false);
    }

    /**
     * Merges this reply into {@code record}. With {@code streaming} set, a non-terminal task state is
     * recorded as {@link TaskState#STREAMING}.
     */
    public void applyTo(TaskRecord record, boolean streaming) {
        if (isFailure()) {
            record.fail(errorCode, errorMessage);
            return;
        }

        TaskResult result = record.getResult() != null ? record.getResult() : new TaskResult();
        result.setNote(null);

        TaskState next = state;
        if (streaming && next != null && !next.isTerminal()) {
            next = TaskState.STREAMING;
        }
        record.setState(next);

        if (agentId != null && !agentId.equals(record.getGatewayId()) && record.getAgentId() == null) {
            record.setAgentId(agentId);
        }
        if (sessionId != null && record.getSessionId() == null) {
            record.setSessionId(sessionId);
        }
        if (message != null) {
            result.setMessage(message);
        }
        if (errorMessage != null) {
            result.setErrorCode(errorCode);
            result.setErrorMessage(errorMessage);
        }
        if (artifacts != null && !artifacts.isEmpty()) {
            List<JsonNode> merged = appendArtifacts && result.getArtifacts() != null
                ? new ArrayList<>(result.getArtifacts())
                : new ArrayList<>();
            merged.addAll(artifacts);
            result.setArtifacts(merged);
        }
        record.setResult(result);
    }
}
