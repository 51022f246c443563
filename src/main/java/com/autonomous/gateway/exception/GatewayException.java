package com.autonomous.gateway.exception;

/**
 * Base type for every task-scoped failure the gateway reports. None of them is fatal to the process.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable name of the failure, used in error responses.
     */
    public abstract String getKind();
}
