package com.linlay.agentruntime.json;

public class JsonRecoveryException extends RuntimeException {

    public JsonRecoveryException(String message) {
        super(message);
    }

    public JsonRecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
