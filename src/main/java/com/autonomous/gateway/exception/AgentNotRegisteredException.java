package com.autonomous.gateway.exception;

public class AgentNotRegisteredException extends GatewayException {

    public AgentNotRegisteredException(String endpoint) {
        super(String.format("Agent not registered: %s", endpoint));
    }

    @Override
    public String getKind() {
        return "agent_not_registered";
    }
}
