package com.autonomous.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentRecord {
    private String endpoint;
    private String name;
    private JsonNode card;
    private Instant registeredAt;

    /**
     * JSON-RPC target: the url advertised in the agent card, falling back to the registered endpoint.
     */
    @JsonIgnore
    public String getRpcUrl() {
        if (card != null && card.hasNonNull("url") && !card.get("url").asText().isBlank()) {
            return card.get("url").asText();
        }
        return endpoint;
    }
}
