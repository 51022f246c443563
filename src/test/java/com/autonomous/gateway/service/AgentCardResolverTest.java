package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.TransportFailureException;
import com.autonomous.gateway.exception.UnexpectedReplyShapeException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class AgentCardResolverTest {

    private MockRestServiceServer server;
    private AgentCardResolver resolver;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        resolver = new AgentCardResolver(builder.build());
    }

    @Test
    void shouldFetchCardFromWellKnownPath() {
        server.expect(requestTo("http://agent.test/.well-known/agent.json"))
            .andRespond(withSuccess(Replies.card("EchoAgent", "http://agent.test/rpc").toString(), MediaType.APPLICATION_JSON));

        JsonNode card = resolver.resolve("http://agent.test/");

        assertEquals("EchoAgent", card.path("name").asText());
        server.verify();
    }

    @Test
    void shouldUseConfiguredCardPath() {
        resolver.setCardPath(".well-known/agent-card.json");

        assertEquals("http://agent.test/.well-known/agent-card.json", resolver.cardUrl("http://agent.test"));
    }

    @Test
    void shouldRejectCardWithoutName() {
        server.expect(requestTo("http://agent.test/.well-known/agent.json"))
            .andRespond(withSuccess("{\"description\": \"nameless\"}", MediaType.APPLICATION_JSON));

        assertThrows(UnexpectedReplyShapeException.class, () -> resolver.resolve("http://agent.test"));
    }

    @Test
    void shouldRaiseTransportFailureWhenCardIsMissing() {
        server.expect(requestTo("http://agent.test/.well-known/agent.json"))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThrows(TransportFailureException.class, () -> resolver.resolve("http://agent.test"));
    }
}
