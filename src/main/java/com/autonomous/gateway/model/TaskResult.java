package com.autonomous.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaskResult {
    private String message;
    @Builder.Default
    private List<JsonNode> artifacts = new ArrayList<>();
    private Integer errorCode;
    private String errorMessage;
    // Informational text of a record that has not heard from its agent yet
    private String note;

    public static TaskResult placeholder(String note) {
        return TaskResult.builder().note(note).build();
    }

    public static TaskResult failure(Integer code, String errorMessage) {
        return TaskResult.builder()
            .errorCode(code)
            .errorMessage(errorMessage)
            .message(code != null
                ? String.format("Agent Error: %s (Code: %d)", errorMessage, code)
                : errorMessage)
            .build();
    }

    public TaskResult copy() {
        List<JsonNode> copiedArtifacts = new ArrayList<>();
        if (artifacts != null) {
            artifacts.forEach(a -> copiedArtifacts.add(a == null ? null : a.deepCopy()));
        }
        return new TaskResult(message, copiedArtifacts, errorCode, errorMessage, note);
    }
}
