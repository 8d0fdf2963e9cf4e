package com.pocketdb.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;

/**
 * Connect request shared by every backend kind. Fields a kind does not use are ignored.
 */
@Data
public class ConnectRequest {
    private String host;

    @Min(value = 0, message = "Port must be positive")
    @Max(value = 65535, message = "Port must be at most 65535")
    private Integer port;

    private String username;

    @ToString.Exclude
    private String password;

    /** MySQL schema, PostgreSQL database, Redis logical db index or Mongo auth database. */
    private String database;

    /** SQLite database file. */
    private String path;

    @Min(value = 1, message = "Connect timeout must be positive")
    private Integer connectTimeoutMs;

    @Valid
    private SshOptions ssh;

    @Data
    public static class SshOptions {
        @NotBlank(message = "SSH host is required")
        private String host;

        @Min(value = 1, message = "SSH port must be positive")
        @Max(value = 65535, message = "SSH port must be at most 65535")
        private int port = 22;

        @NotBlank(message = "SSH username is required")
        private String username;

        @ToString.Exclude
        private String password;
    }
}
