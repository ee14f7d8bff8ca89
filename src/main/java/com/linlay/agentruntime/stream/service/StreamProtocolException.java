package com.linlay.agentruntime.stream.service;

/**
 * A chunk could not be parsed, or it violated the content-block lifecycle.
 */
public class StreamProtocolException extends RuntimeException {

    public StreamProtocolException(String message) {
        super(message);
    }

    public StreamProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
