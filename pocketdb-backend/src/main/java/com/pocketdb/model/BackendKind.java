package com.pocketdb.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The store categories the gateway can hold one live connection for.
 */
public enum BackendKind {
    REDIS("redis", 6379),
    MYSQL("mysql", 3306),
    POSTGRES("postgres", 5432),
    SQLITE("sqlite", 0),
    MONGO("mongo", 27017);

    private static final Map<String, BackendKind> ALIASES = Map.ofEntries(
            Map.entry("redis", REDIS),
            Map.entry("valkey", REDIS),
            Map.entry("mysql", MYSQL),
            Map.entry("mariadb", MYSQL),
            Map.entry("postgres", POSTGRES),
            Map.entry("postgresql", POSTGRES),
            Map.entry("pg", POSTGRES),
            Map.entry("sqlite", SQLITE),
            Map.entry("sqlite3", SQLITE),
            Map.entry("mongo", MONGO),
            Map.entry("mongodb", MONGO)
    );

    private final String path;
    private final int defaultPort;

    BackendKind(String path, int defaultPort) {
        this.path = path;
        this.defaultPort = defaultPort;
    }

    public String path() {
        return path;
    }

    public int defaultPort() {
        return defaultPort;
    }

    /**
     * Whether this kind speaks SQL through a JDBC pool.
     *
     * @return true for MySQL, PostgreSQL and SQLite
     */
    public boolean isSql() {
        return this == MYSQL || this == POSTGRES || this == SQLITE;
    }

    /**
     * Resolve a kind from a path segment or alias.
     *
     * @param value incoming kind name (case-insensitive)
     * @return resolved kind
     * @throws IllegalArgumentException when the name is unknown
     */
    public static BackendKind fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Backend kind is required");
        }
        return lookup(value)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported backend kind: " + value));
    }

    public static Optional<BackendKind> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(value.trim().toLowerCase(Locale.ROOT)));
    }
}
