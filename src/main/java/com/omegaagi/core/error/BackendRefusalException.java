package com.omegaagi.core.error;

/**
 * The backend explicitly refused to generate on policy grounds. Never retried.
 */
public class BackendRefusalException extends OmegaException {

    public BackendRefusalException(String message) {
        super(ErrorKind.BACKEND_REFUSAL, message);
    }

    public BackendRefusalException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_REFUSAL, message, cause);
    }
}
