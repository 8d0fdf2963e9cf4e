package com.pocketdb.controller;

import com.pocketdb.api.ConnectRequest;
import com.pocketdb.api.ConnectResponse;
import com.pocketdb.model.BackendKind;
import com.pocketdb.registry.SlotInfo;
import com.pocketdb.service.ConnectionService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/v1/connections")
public class ConnectionController {

    private final ConnectionService connectionService;

    public ConnectionController(ConnectionService connectionService) {
        this.connectionService = connectionService;
    }

    /**
     * Connect a backend, replacing whatever its slot held.
     *
     * POST /v1/connections/{kind}
     *
     * @param kind backend kind or alias
     * @param request endpoint, credentials and optional tunnel
     * @return slot state after the connect
     */
    @PostMapping("/{kind}")
    public ResponseEntity<ConnectResponse> connect(@PathVariable("kind") String kind,
                                                   @Valid @RequestBody ConnectRequest request) {
        BackendKind backend = BackendKind.fromName(kind);
        log.info("Connect requested: kind={}, host={}, tunnel={}", backend.path(), request.getHost(), request.getSsh() != null);
        SlotInfo slot = connectionService.connect(backend, request);
        return ResponseEntity.ok(toResponse(slot, "Connected to " + backend.path()));
    }

    /**
     * Close the backend's handle and its tunnel.
     *
     * DELETE /v1/connections/{kind}
     */
    @DeleteMapping("/{kind}")
    public ResponseEntity<ConnectResponse> disconnect(@PathVariable("kind") String kind) {
        BackendKind backend = BackendKind.fromName(kind);
        boolean closed = connectionService.disconnect(backend);
        String message = closed ? "Disconnected from " + backend.path() : "Not connected: " + backend.path();
        return ResponseEntity.ok(toResponse(connectionService.status(backend), message));
    }

    @GetMapping("/{kind}")
    public ResponseEntity<ConnectResponse> status(@PathVariable("kind") String kind) {
        BackendKind backend = BackendKind.fromName(kind);
        SlotInfo slot = connectionService.status(backend);
        return ResponseEntity.ok(toResponse(slot, slot.isConnected() ? "Connected" : "Not connected"));
    }

    private ConnectResponse toResponse(SlotInfo slot, String message) {
        return ConnectResponse.builder()
                .kind(slot.getKind().path())
                .connected(slot.isConnected())
                .message(message)
                .createdAt(slot.getCreatedAt())
                .tunnelLocalPort(slot.getTunnelLocalPort())
                .tunnelRemote(slot.getTunnelRemote())
                .traceId(MDC.get("trace_id"))
                .build();
    }
}
