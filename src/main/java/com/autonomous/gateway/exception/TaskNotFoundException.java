package com.autonomous.gateway.exception;

public class TaskNotFoundException extends GatewayException {

    public TaskNotFoundException(String gatewayId) {
        super(String.format("Task ID not found: %s", gatewayId));
    }

    @Override
    public String getKind() {
        return "task_not_found";
    }
}
