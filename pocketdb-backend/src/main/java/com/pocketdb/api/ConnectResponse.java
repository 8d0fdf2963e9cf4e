package com.pocketdb.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectResponse {
    private String kind;
    private boolean connected;
    private String message;
    private OffsetDateTime createdAt;
    private Integer tunnelLocalPort;
    private String tunnelRemote;
    private String traceId;
}
