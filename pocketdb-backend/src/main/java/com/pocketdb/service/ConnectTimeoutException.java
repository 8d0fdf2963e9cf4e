package com.pocketdb.service;

import com.pocketdb.model.BackendKind;

/**
 * Thrown when a connect attempt exceeds its deadline. The registry slot is left unchanged.
 */
public class ConnectTimeoutException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param kind backend being connected
     * @param timeoutMs deadline that was exceeded
     */
    public ConnectTimeoutException(BackendKind kind, long timeoutMs) {
        super("Connecting to " + kind.path() + " timed out after " + timeoutMs + " ms");
    }
}
