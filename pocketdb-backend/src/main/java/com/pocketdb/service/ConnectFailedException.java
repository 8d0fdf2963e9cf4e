package com.pocketdb.service;

import com.pocketdb.model.BackendKind;

/**
 * Thrown when a backend connection cannot be established or verified.
 */
public class ConnectFailedException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param kind backend being connected
     * @param message driver message
     * @param cause driver error
     */
    public ConnectFailedException(BackendKind kind, String message, Throwable cause) {
        super("Failed to connect to " + kind.path() + ": " + message, cause);
    }
}
