package com.omegaagi.core.error;

/**
 * The backend timed out, could not be reached or rejected the call for a non-policy reason.
 */
public class BackendUnavailableException extends OmegaException {

    public BackendUnavailableException(String message) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message, cause);
    }
}
