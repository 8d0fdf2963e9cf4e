package com.pocketdb.registry;

import com.pocketdb.model.BackendKind;

/**
 * Thrown before any network call when the backend's registry slot is empty.
 */
public class NotConnectedException extends RuntimeException {
    private final BackendKind kind;

    /**
     * Create a new exception.
     *
     * @param kind backend whose slot is empty
     */
    public NotConnectedException(BackendKind kind) {
        super("Not connected: " + kind.path());
        this.kind = kind;
    }

    public BackendKind getKind() {
        return kind;
    }
}
