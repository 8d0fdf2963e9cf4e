package com.pocketdb.service;

import com.pocketdb.model.BackendKind;
import com.pocketdb.model.ConnectTarget;
import com.pocketdb.registry.BackendHandle;
import com.pocketdb.tunnel.TunnelSession;

import java.util.Set;

/**
 * Opens and verifies a live handle for one or more backend kinds.
 */
public interface BackendConnector {

    Set<BackendKind> kinds();

    /**
     * Open a handle and probe it once.
     *
     * @param kind backend kind, one of {@link #kinds()}
     * @param target endpoint to dial
     * @param tunnel tunnel the target points at, owned by the returned handle; may be null
     * @return verified handle
     * @throws ConnectFailedException when the backend cannot be reached or rejects the login
     */
    BackendHandle open(BackendKind kind, ConnectTarget target, TunnelSession tunnel);
}
