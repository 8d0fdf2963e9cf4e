package com.pocketdb.model;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * Resolved endpoint a connector dials. When a tunnel is in use, host and port already point at the
 * tunnel's loopback listener.
 */
@Data
@Builder(toBuilder = true)
public class ConnectTarget {
    private String host;
    private int port;
    private String username;
    @ToString.Exclude
    private String password;
    private String database;
    private String path;
    private int connectTimeoutMs;
}
