package com.autonomous.gateway.service;

import com.autonomous.gateway.model.ClassifiedReply;
import com.autonomous.gateway.model.ClassifiedReply.Kind;
import com.autonomous.gateway.model.TaskState;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Every input, including {@code null}, yields a classification.
 */
@Component
public class ReplyClassifier {

    public ClassifiedReply classify(JsonNode reply) {
        if (reply == null || !reply.isObject()) {
            return unrecognized("Unexpected response type: " + describe(reply));
        }

        JsonNode error = reply.get("error");
        if (error != null && !error.isNull()) {
            Integer code = error.hasNonNull("code") && error.get("code").canConvertToInt()
                ? error.get("code").asInt()
                : null;
            return ClassifiedReply.builder()
                .kind(Kind.UPSTREAM_ERROR)
                .state(TaskState.ERROR)
                .errorCode(code)
                .errorMessage(error.path("message").asText("Unknown agent error"))
                .build();
        }

        JsonNode result = reply.get("result");
        if (result == null || !result.isObject()) {
            return unrecognized("Unexpected response type: reply carries neither result nor error");
        }

        String kind = result.path("kind").asText("");
        switch (kind) {
            case "message":
                return immediateMessage(result);
            case "task":
                return task(result);
            case "status-update":
                return statusUpdate(result);
            case "artifact-update":
                return artifactUpdate(result);
            case "":
                break;
            default:
                return unrecognized("Unexpected result kind: " + kind);
        }

        // Older agents omit "kind"; fall back to the shape
        if (result.has("role") && result.has("parts")) {
            return immediateMessage(result);
        }
        if (result.has("id") && result.has("status")) {
            return task(result);
        }
        return unrecognized("Unexpected result shape with fields " + fieldNames(result));
    }

    public TaskState mapRemoteState(String remoteState) {
        if (remoteState == null) {
            return TaskState.RUNNING;
        }
        return switch (remoteState.toLowerCase(Locale.ROOT)) {
            case "completed" -> TaskState.COMPLETED;
            case "failed", "rejected" -> TaskState.ERROR;
            case "canceled", "cancelled" -> TaskState.CANCELLED;
            default -> TaskState.RUNNING;
        };
    }

    private ClassifiedReply immediateMessage(JsonNode message) {
        return ClassifiedReply.builder()
            .kind(Kind.IMMEDIATE_MESSAGE)
            .state(TaskState.COMPLETED)
            .sessionId(textOrNull(message, "contextId"))
            .message(joinText(message.get("parts")))
            .build();
    }

    private ClassifiedReply task(JsonNode task) {
        JsonNode status = task.path("status");
        TaskState state = mapRemoteState(textOrNull(status, "state"));
        ClassifiedReply.ClassifiedReplyBuilder builder = ClassifiedReply.builder()
            .kind(Kind.TASK_HANDLE)
            .state(state)
            .agentId(textOrNull(task, "id"))
            .sessionId(textOrNull(task, "contextId"))
            .message(statusMessage(status))
            .artifacts(artifacts(task.get("artifacts")));
        if (state == TaskState.ERROR) {
            builder.errorMessage(errorText(status, "Agent reported task failure"));
        }
        return builder.build();
    }

    private ClassifiedReply statusUpdate(JsonNode event) {
        JsonNode status = event.path("status");
        TaskState state = mapRemoteState(textOrNull(status, "state"));
        ClassifiedReply.ClassifiedReplyBuilder builder = ClassifiedReply.builder()
            .kind(Kind.TASK_HANDLE)
            .state(state)
            .agentId(textOrNull(event, "taskId"))
            .sessionId(textOrNull(event, "contextId"))
            .message(statusMessage(status));
        if (state == TaskState.ERROR) {
            builder.errorMessage(errorText(status, "Agent reported task failure"));
        }
        return builder.build();
    }

    private ClassifiedReply artifactUpdate(JsonNode event) {
        List<JsonNode> artifacts = new ArrayList<>();
        if (event.hasNonNull("artifact")) {
            artifacts.add(event.get("artifact").deepCopy());
        }
        return ClassifiedReply.builder()
            .kind(Kind.TASK_HANDLE)
            .state(TaskState.STREAMING)
            .agentId(textOrNull(event, "taskId"))
            .sessionId(textOrNull(event, "contextId"))
            .artifacts(artifacts)
            .appendArtifacts(true)
            .build();
    }

    private ClassifiedReply unrecognized(String note) {
        return ClassifiedReply.builder()
            .kind(Kind.UNRECOGNIZED)
            .state(TaskState.ERROR)
            .errorMessage(note)
            .build();
    }

    private String statusMessage(JsonNode status) {
        JsonNode message = status.get("message");
        if (message == null || !message.isObject()) {
            return null;
        }
        return joinText(message.get("parts"));
    }

    private String errorText(JsonNode status, String fallback) {
        String text = statusMessage(status);
        return text != null ? text : fallback;
    }

    private String joinText(JsonNode parts) {
        if (parts == null || !parts.isArray()) {
            return null;
        }
        List<String> texts = new ArrayList<>();
        for (JsonNode part : parts) {
            String partKind = part.path("kind").asText(part.path("type").asText(""));
            if ("text".equals(partKind) && part.hasNonNull("text")) {
                texts.add(part.get("text").asText());
            }
        }
        return texts.isEmpty() ? null : String.join(" ", texts);
    }

    private List<JsonNode> artifacts(JsonNode node) {
        List<JsonNode> artifacts = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(a -> artifacts.add(a.deepCopy()));
        }
        return artifacts;
    }

    private String textOrNull(JsonNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private String fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names.stream().collect(Collectors.joining(", ", "[", "]"));
    }

    private String describe(JsonNode reply) {
        return reply == null ? "null" : reply.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
