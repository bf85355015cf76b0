package com.example.admission.model;

/**
 * Outcome of a single admission check.
 */
public enum Decision {
    /**
     * Request fits in the client's current window and may proceed.
     */
    ALLOWED,

    /**
     * Client has used up its window; the request must be rejected with 429.
     */
    DENIED
}
