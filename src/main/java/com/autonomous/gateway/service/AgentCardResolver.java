package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.TransportFailureException;
import com.autonomous.gateway.exception.UnexpectedReplyShapeException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches the agent card an A2A agent publishes under its well-known path.
 */
@Slf4j
@Service
public class AgentCardResolver {

    @Value("${gateway.agent.card-path:/.well-known/agent.json}")
    private String cardPath = "/.well-known/agent.json";

    private final RestClient restClient;

    public AgentCardResolver(RestClient agentRestClient) {
        this.restClient = agentRestClient;
    }

    public void setCardPath(String cardPath) {
        this.cardPath = cardPath;
    }

    public JsonNode resolve(String endpoint) {
        String url = cardUrl(endpoint);
        JsonNode card;
        try {
            card = restClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            log.error("Failed to fetch agent card from {}: {}", url, e.getMessage());
            throw new TransportFailureException("Failed to fetch agent card from " + url + ": " + e.getMessage(), e);
        }

        if (card == null || !card.isObject() || !card.hasNonNull("name")) {
            throw new UnexpectedReplyShapeException("Agent card at " + url + " has no name");
        }
        return card;
    }

    String cardUrl(String endpoint) {
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        String path = cardPath.startsWith("/") ? cardPath : "/" + cardPath;
        return base + path;
    }
}
