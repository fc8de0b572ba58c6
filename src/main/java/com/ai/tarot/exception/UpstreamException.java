package com.ai.tarot.exception;

/**
 * A collaborator the turn depends on (generation or payment backend) failed or timed out.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
