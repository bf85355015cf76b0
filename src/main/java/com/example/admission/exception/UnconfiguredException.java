package com.example.admission.exception;

/**
 * Raised when a decision is requested from a controller that has never been given a policy.
 */
public class UnconfiguredException extends AdmissionException {

    private final String group;

    public UnconfiguredException(String group) {
        super("No limit policy configured for group '" + group + "'");
        this.group = group;
    }

    public String getGroup() {
        return group;
    }
}
