package com.pocketdb.registry;

import com.pocketdb.model.BackendKind;
import com.pocketdb.tunnel.TunnelSession;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * A live client or pool for one backend, optionally reached through a tunnel it owns.
 *
 * <p>Handles are owned by {@link ConnectionRegistry}. Adapters borrow them for one operation and
 * must not keep a reference afterwards.
 */
@Slf4j
public abstract class BackendHandle implements AutoCloseable {
    private final BackendKind kind;
    private final OffsetDateTime createdAt;
    private final TunnelSession tunnel;

    protected BackendHandle(BackendKind kind, TunnelSession tunnel) {
        this.kind = kind;
        this.tunnel = tunnel;
        this.createdAt = OffsetDateTime.now();
    }

    public BackendKind getKind() {
        return kind;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public Optional<TunnelSession> getTunnel() {
        return Optional.ofNullable(tunnel);
    }

    /**
     * Close the underlying client or pool only.
     */
    protected abstract void closeClient();

    /**
     * Close the client and the tunnel, unless the tunnel is {@code retained} by a replacement handle.
     *
     * @param retained tunnel still in use by the handle taking over, may be null
     */
    void release(TunnelSession retained) {
        try {
            closeClient();
        } catch (RuntimeException e) {
            log.warn("Closing {} client failed: {}", kind.path(), e.getMessage());
        }
        if (tunnel != null && tunnel != retained) {
            tunnel.close();
        }
    }

    @Override
    public void close() {
        release(null);
    }
}
