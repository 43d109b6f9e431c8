package com.omegaagi.core.llm;

/**
 * Raised by a {@link TextGenerationBackend} when a call fails.
 */
public class BackendException extends RuntimeException {

    public enum Reason {
        TIMEOUT(true),
        NETWORK(true),
        RATE_LIMITED(true),
        REFUSED(false),
        FAILED(false);

        private final boolean transientFault;

        Reason(boolean transientFault) {
            this.transientFault = transientFault;
        }
    }

    private final Reason reason;

    public BackendException(String message, Reason reason) {
        super(message);
        this.reason = reason;
    }

    public BackendException(String message, Reason reason, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Transient faults are worth one retry with identical input.
     */
    public boolean isTransient() {
        return reason.transientFault;
    }

    public boolean isRefusal() {
        return reason == Reason.REFUSED;
    }
}
