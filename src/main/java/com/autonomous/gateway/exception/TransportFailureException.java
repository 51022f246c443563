package com.autonomous.gateway.exception;

/**
 * Network-level failure talking to a remote agent. Not to be confused with the immediate-response
 * timeout, which only ends the caller's wait.
 */
public class TransportFailureException extends GatewayException {

    public TransportFailureException(String message) {
        super(message);
    }

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getKind() {
        return "transport_failure";
    }
}
