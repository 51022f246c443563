package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.TransportFailureException;
import com.autonomous.gateway.model.AgentRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * A2A client speaking JSON-RPC 2.0 over HTTP.
 */
@Slf4j
@Service
public class A2aJsonRpcInvoker implements RemoteInvoker {

    private static final String DATA_PREFIX = "data:";

    private final RestClient restClient;
    private final ObjectMapper mapper;

    public A2aJsonRpcInvoker(RestClient agentRestClient, ObjectMapper mapper) {
        this.restClient = agentRestClient;
        this.mapper = mapper;
    }

    @Override
    public JsonNode sendMessage(AgentRecord agent, String requestId, String text, String sessionId) {
        return call(agent, requestId, "message/send", messageParams(text, sessionId));
    }

    @Override
    public void streamMessage(AgentRecord agent, String requestId, String text, String sessionId,
                              Consumer<JsonNode> onEvent) {
        ObjectNode request = envelope(requestId, "message/stream", messageParams(text, sessionId));
        String url = agent.getRpcUrl();
        try {
            restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_JSON)
                .body(request)
                .exchange((req, response) -> {
                    if (response.getStatusCode().isError()) {
                        throw new TransportFailureException(
                            String.format("Stream request to %s failed with HTTP %d", url, response.getStatusCode().value()));
                    }
                    MediaType contentType = response.getHeaders().getContentType();
                    if (contentType != null && MediaType.APPLICATION_JSON.isCompatibleWith(contentType)) {
                        // Agent answered with a single reply instead of a stream
                        onEvent.accept(mapper.readTree(response.getBody()));
                        return null;
                    }
                    readEvents(response.getBody(), onEvent);
                    return null;
                });
        } catch (RestClientException e) {
            log.error("Error streaming message to {}: {}", url, e.getMessage());
            throw new TransportFailureException("Stream to " + url + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public JsonNode getTask(AgentRecord agent, String taskId, Integer historyLength) {
        ObjectNode params = mapper.createObjectNode();
        params.put("id", taskId);
        if (historyLength != null) {
            params.put("historyLength", historyLength);
        }
        return call(agent, taskId, "tasks/get", params);
    }

    @Override
    public JsonNode cancelTask(AgentRecord agent, String taskId) {
        ObjectNode params = mapper.createObjectNode();
        params.put("id", taskId);
        return call(agent, taskId, "tasks/cancel", params);
    }

    private JsonNode call(AgentRecord agent, String requestId, String method, ObjectNode params) {
        ObjectNode request = envelope(requestId, method, params);
        String url = agent.getRpcUrl();
        log.debug("[{}] {} -> {}", requestId, method, url);
        try {
            return restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            JsonNode errorReply = parseErrorReply(e.getResponseBodyAsString());
            if (errorReply != null) {
                return errorReply;
            }
            throw new TransportFailureException(
                String.format("%s to %s failed with HTTP %d", method, url, e.getStatusCode().value()), e);
        } catch (RestClientException e) {
            throw new TransportFailureException(method + " to " + url + " failed: " + e.getMessage(), e);
        }
    }

    // Some agents send JSON-RPC errors with a non-2xx status
    private JsonNode parseErrorReply(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(body);
            return node != null && node.has("error") ? node : null;
        } catch (IOException e) {
            return null;
        }
    }

    private void readEvents(InputStream body, Consumer<JsonNode> onEvent) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            StringBuilder data = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    dispatchEvent(data, onEvent);
                } else if (line.startsWith(DATA_PREFIX)) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    data.append(line.substring(DATA_PREFIX.length()).trim());
                }
            }
            dispatchEvent(data, onEvent);
        }
    }

    private void dispatchEvent(StringBuilder data, Consumer<JsonNode> onEvent) throws IOException {
        if (data.length() == 0) {
            return;
        }
        JsonNode event = mapper.readTree(data.toString());
        data.setLength(0);
        onEvent.accept(event);
    }

    private ObjectNode messageParams(String text, String sessionId) {
        ObjectNode message = mapper.createObjectNode();
        message.put("role", "user");
        message.put("kind", "message");
        message.put("messageId", UUID.randomUUID().toString());
        if (sessionId != null) {
            message.put("contextId", sessionId);
        }
        ArrayNode parts = message.putArray("parts");
        parts.addObject().put("kind", "text").put("text", text);

        ObjectNode params = mapper.createObjectNode();
        params.set("message", message);
        return params;
    }

    private ObjectNode envelope(String requestId, String method, ObjectNode params) {
        ObjectNode request = mapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", requestId);
        request.put("method", method);
        request.set("params", params);
        return request;
    }
}
