package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.TransportFailureException;
import com.autonomous.gateway.model.AgentRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Consumer;

/**
 * Outbound calls to a remote agent. Every method returns the raw JSON-RPC reply, error replies
 * included; only network-level problems are thrown, as {@link TransportFailureException}.
 */
public interface RemoteInvoker {

    JsonNode sendMessage(AgentRecord agent, String requestId, String text, String sessionId);

    // Returns when the agent closes the stream
    void streamMessage(AgentRecord agent, String requestId, String text, String sessionId, Consumer<JsonNode> onEvent);

    JsonNode getTask(AgentRecord agent, String taskId, Integer historyLength);

    JsonNode cancelTask(AgentRecord agent, String taskId);
}
