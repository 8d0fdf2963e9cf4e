package com.pocketdb.registry;

import com.pocketdb.model.BackendKind;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Snapshot of one registry slot.
 */
@Data
@Builder
public class SlotInfo {
    private BackendKind kind;
    private boolean connected;
    private OffsetDateTime createdAt;
    private Integer tunnelLocalPort;
    private String tunnelRemote;
}
