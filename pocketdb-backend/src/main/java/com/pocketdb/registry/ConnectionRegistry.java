package com.pocketdb.registry;

import com.pocketdb.model.BackendKind;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds at most one live handle per backend kind.
 *
 * <p>Each slot has its own lock, held only while the handle reference is swapped or read. Closing a
 * replaced handle and every network call happen outside the lock, so a long query on one handle
 * never blocks a reconnect of the same kind, and different kinds never contend.
 */
@Slf4j
@Component
public class ConnectionRegistry {
    private final Map<BackendKind, Slot> slots;

    public ConnectionRegistry() {
        Map<BackendKind, Slot> m = new EnumMap<>(BackendKind.class);
        for (BackendKind kind : BackendKind.values()) {
            m.put(kind, new Slot());
        }
        this.slots = Collections.unmodifiableMap(m);
    }

    /**
     * Store {@code handle} in its kind's slot. Last writer wins; the previous handle is closed
     * together with its tunnel unless the new handle reuses that tunnel.
     *
     * @param kind slot to occupy
     * @param handle new handle
     */
    public void set(BackendKind kind, BackendHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (handle.getKind() != kind) {
            throw new IllegalArgumentException("Handle for " + handle.getKind().path() + " cannot occupy the " + kind.path() + " slot");
        }
        BackendHandle previous = slots.get(kind).swap(handle);
        if (previous != null && previous != handle) {
            log.info("Replacing {} connection created at {}", kind.path(), previous.getCreatedAt());
            previous.release(handle.getTunnel().orElse(null));
        }
    }

    /**
     * Read the handle of {@code kind}.
     *
     * @param kind backend kind
     * @param type expected handle type
     * @param <H> handle type
     * @return the live handle
     * @throws NotConnectedException when the slot is empty
     */
    public <H extends BackendHandle> H get(BackendKind kind, Class<H> type) {
        BackendHandle handle = slots.get(kind).read();
        if (handle == null) {
            throw new NotConnectedException(kind);
        }
        return type.cast(handle);
    }

    public Optional<BackendHandle> find(BackendKind kind) {
        return Optional.ofNullable(slots.get(kind).read());
    }

    /**
     * Empty the slot and close its handle and tunnel.
     *
     * @param kind backend kind
     * @return true when a handle was removed
     */
    public boolean clear(BackendKind kind) {
        BackendHandle previous = slots.get(kind).swap(null);
        if (previous == null) {
            return false;
        }
        log.info("Closing {} connection created at {}", kind.path(), previous.getCreatedAt());
        previous.close();
        return true;
    }

    public SlotInfo describe(BackendKind kind) {
        BackendHandle handle = slots.get(kind).read();
        SlotInfo.SlotInfoBuilder info = SlotInfo.builder().kind(kind).connected(handle != null);
        if (handle != null) {
            info.createdAt(handle.getCreatedAt());
            handle.getTunnel().ifPresent(t -> info
                    .tunnelLocalPort(t.getLocalPort())
                    .tunnelRemote(t.getRemoteHost() + ":" + t.getRemotePort()));
        }
        return info.build();
    }

    @PreDestroy
    public void closeAll() {
        for (BackendKind kind : BackendKind.values()) {
            clear(kind);
        }
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private BackendHandle handle;

        private BackendHandle swap(BackendHandle next) {
            lock.lock();
            try {
                BackendHandle previous = handle;
                handle = next;
                return previous;
            } finally {
                lock.unlock();
            }
        }

        private BackendHandle read() {
            lock.lock();
            try {
                return handle;
            } finally {
                lock.unlock();
            }
        }
    }
}
