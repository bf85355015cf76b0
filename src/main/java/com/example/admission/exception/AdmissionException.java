package com.example.admission.exception;

/**
 * Base type for errors raised by admission control.
 * <p>
 * All of them are local and recoverable: they describe a bad request or a missing
 * configuration, never a transient failure, so retrying the same call is pointless.
 */
public abstract class AdmissionException extends RuntimeException {

    protected AdmissionException(String message) {
        super(message);
    }
}
