package com.example.admission.exception;

/**
 * Raised when a limit policy has a non-positive request limit or window, or a retention
 * period that cannot hold a full window.
 */
public class InvalidPolicyException extends AdmissionException {

    public InvalidPolicyException(String message) {
        super(message);
    }
}
