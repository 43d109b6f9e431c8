package com.omegaagi.core.error;

/**
 * Root of all failures raised by the interpreter.
 * <p>
 * The message is always safe to return to a caller: it never contains prompts,
 * raw backend error bodies or credentials. Underlying causes are kept for
 * server-side logging only.
 */
public class OmegaException extends RuntimeException {

    private final ErrorKind kind;

    public OmegaException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OmegaException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
