package com.autonomous.gateway.exception;

public class UnexpectedReplyShapeException extends GatewayException {

    public UnexpectedReplyShapeException(String message) {
        super(message);
    }

    @Override
    public String getKind() {
        return "unexpected_reply_shape";
    }
}
