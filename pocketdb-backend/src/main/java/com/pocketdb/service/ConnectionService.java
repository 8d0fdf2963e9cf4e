package com.pocketdb.service;

import com.pocketdb.api.ConnectRequest;
import com.pocketdb.model.BackendKind;
import com.pocketdb.model.ConnectTarget;
import com.pocketdb.model.SshTarget;
import com.pocketdb.registry.BackendHandle;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.registry.SlotInfo;
import com.pocketdb.tunnel.TunnelManager;
import com.pocketdb.tunnel.TunnelSession;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connects backends, optionally through an SSH tunnel, under a deadline, and stores the result in
 * the registry.
 */
@Slf4j
@Service
public class ConnectionService {
    private static final String LOOPBACK = "127.0.0.1";

    private final ConnectionRegistry registry;
    private final TunnelManager tunnelManager;
    private final Map<BackendKind, BackendConnector> connectors = new EnumMap<>(BackendKind.class);
    private final int defaultTimeoutMs;
    private final ExecutorService connectExecutor;

    public ConnectionService(
            ConnectionRegistry registry,
            TunnelManager tunnelManager,
            List<BackendConnector> connectors,
            @Value("${pocketdb.connect.timeout-ms:5000}") int defaultTimeoutMs
    ) {
        this.registry = registry;
        this.tunnelManager = tunnelManager;
        this.defaultTimeoutMs = defaultTimeoutMs;
        for (BackendConnector connector : connectors) {
            for (BackendKind kind : connector.kinds()) {
                this.connectors.put(kind, connector);
            }
        }
        AtomicInteger counter = new AtomicInteger();
        this.connectExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "connect-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Connect {@code kind} and occupy its registry slot, replacing any previous handle.
     *
     * <p>On timeout the slot is left unchanged; a handle that completes after the deadline is closed
     * instead of registered.
     *
     * @param kind backend kind
     * @param request connect parameters
     * @return the occupied slot
     * @throws ConnectTimeoutException when the deadline passes
     * @throws ConnectFailedException when the backend cannot be reached
     */
    public SlotInfo connect(BackendKind kind, ConnectRequest request) {
        ConnectTarget target = resolveTarget(kind, request);
        SshTarget ssh = resolveSsh(kind, request.getSsh());
        int timeoutMs = target.getConnectTimeoutMs();

        AtomicBoolean claimed = new AtomicBoolean(false);
        Future<BackendHandle> attempt = connectExecutor.submit(() -> {
            BackendHandle handle = open(kind, target, ssh);
            if (!claimed.compareAndSet(false, true)) {
                log.info("Discarding {} connection that completed after its deadline", kind.path());
                handle.close();
                return null;
            }
            return handle;
        });

        BackendHandle handle;
        try {
            handle = attempt.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (claimed.compareAndSet(false, true)) {
                attempt.cancel(true);
                log.warn("Connecting to {} timed out after {} ms", kind.path(), timeoutMs);
                throw new ConnectTimeoutException(kind, timeoutMs);
            }
            // The attempt finished and claimed itself just as the deadline passed.
            handle = awaitClaimed(kind, attempt);
        } catch (ExecutionException e) {
            throw unwrap(kind, e);
        } catch (InterruptedException e) {
            claimed.set(true);
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConnectFailedException(kind, "interrupted", e);
        }

        registry.set(kind, handle);
        log.info("Connected {} to {}:{}{}", kind.path(), target.getHost(), target.getPort(),
                handle.getTunnel().map(t -> " via tunnel on local port " + t.getLocalPort()).orElse(""));
        return registry.describe(kind);
    }

    public boolean disconnect(BackendKind kind) {
        return registry.clear(kind);
    }

    public SlotInfo status(BackendKind kind) {
        return registry.describe(kind);
    }

    private BackendHandle open(BackendKind kind, ConnectTarget target, SshTarget ssh) {
        BackendConnector connector = connectors.get(kind);
        if (connector == null) {
            throw new IllegalArgumentException("No connector for " + kind.path());
        }
        TunnelSession tunnel = null;
        ConnectTarget effective = target;
        if (ssh != null) {
            tunnel = tunnelManager.openTunnel(kind.path(), ssh, target.getHost(), target.getPort(), target.getConnectTimeoutMs());
            effective = target.toBuilder().host(LOOPBACK).port(tunnel.getLocalPort()).build();
        }
        try {
            return connector.open(kind, effective, tunnel);
        } catch (RuntimeException e) {
            if (tunnel != null) {
                tunnel.close();
            }
            throw e;
        }
    }

    private BackendHandle awaitClaimed(BackendKind kind, Future<BackendHandle> attempt) {
        try {
            return attempt.get();
        } catch (ExecutionException e) {
            throw unwrap(kind, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectFailedException(kind, "interrupted", e);
        }
    }

    private RuntimeException unwrap(BackendKind kind, ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new ConnectFailedException(kind, cause.getMessage(), cause);
    }

    ConnectTarget resolveTarget(BackendKind kind, ConnectRequest request) {
        int timeoutMs = request.getConnectTimeoutMs() != null ? request.getConnectTimeoutMs() : defaultTimeoutMs;
        ConnectTarget.ConnectTargetBuilder target = ConnectTarget.builder()
                .username(blankToNull(request.getUsername()))
                .password(request.getPassword())
                .database(blankToNull(request.getDatabase()))
                .connectTimeoutMs(timeoutMs);

        if (kind == BackendKind.SQLITE) {
            if (request.getPath() == null || request.getPath().isBlank()) {
                throw new IllegalArgumentException("SQLite database path is required");
            }
            return target.path(request.getPath().trim()).build();
        }

        String host = request.getHost() != null && !request.getHost().isBlank() ? request.getHost().trim() : LOOPBACK;
        int port = request.getPort() != null && request.getPort() > 0 ? request.getPort() : kind.defaultPort();
        return target.host(host).port(port).build();
    }

    private SshTarget resolveSsh(BackendKind kind, ConnectRequest.SshOptions ssh) {
        if (ssh == null) {
            return null;
        }
        if (kind == BackendKind.SQLITE) {
            throw new IllegalArgumentException("SSH tunnels are not supported for SQLite files");
        }
        return SshTarget.builder()
                .host(ssh.getHost())
                .port(ssh.getPort())
                .username(ssh.getUsername())
                .password(ssh.getPassword())
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @PreDestroy
    public void shutdown() {
        connectExecutor.shutdownNow();
    }
}
