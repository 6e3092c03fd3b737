package com.scicalc.mathfrontend.symbolic;

/**
 * Failure talking to the symbolic collaborator.
 */
public class SymbolicClientException extends RuntimeException {

    public enum Reason {
        SERVICE_UNAVAILABLE,
        TIMEOUT,
        SERVER_ERROR,
        INVALID_RESPONSE
    }

    private final Reason reason;

    public SymbolicClientException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SymbolicClientException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
