package com.pocketdb.service;

import com.pocketdb.model.BackendKind;
import com.pocketdb.model.ConnectTarget;
import com.pocketdb.registry.JdbcHandle;
import com.pocketdb.tunnel.TunnelSession;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Builds HikariCP pools for MySQL, PostgreSQL and SQLite.
 */
@Slf4j
@Service
public class JdbcPoolFactory implements BackendConnector {
    private static final int MIN_HIKARI_TIMEOUT_MS = 250;
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final int serverPoolSize;
    private final int sqlitePoolSize;

    public JdbcPoolFactory(
            @Value("${pocketdb.jdbc.pool-size:5}") int serverPoolSize,
            @Value("${pocketdb.sqlite.pool-size:1}") int sqlitePoolSize
    ) {
        this.serverPoolSize = serverPoolSize;
        this.sqlitePoolSize = sqlitePoolSize;
    }

    @Override
    public Set<BackendKind> kinds() {
        return EnumSet.of(BackendKind.MYSQL, BackendKind.POSTGRES, BackendKind.SQLITE);
    }

    @Override
    public JdbcHandle open(BackendKind kind, ConnectTarget target, TunnelSession tunnel) {
        HikariConfig config = buildHikariConfig(kind, target);
        log.info("Opening {} pool {} at {}", kind.path(), config.getPoolName(), config.getJdbcUrl());

        HikariDataSource ds;
        try {
            ds = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new ConnectFailedException(kind, rootMessage(e), e);
        }

        try (Connection conn = ds.getConnection()) {
            if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new SQLException("Connection is not valid");
            }
        } catch (SQLException e) {
            ds.close();
            log.error("Connection test failed: {} (SQLState: {}, Error Code: {})", e.getMessage(), e.getSQLState(), e.getErrorCode());
            throw new ConnectFailedException(kind, e.getMessage(), e);
        }
        return new JdbcHandle(kind, ds, target, tunnel);
    }

    /**
     * Open a pool on another database of the same server, over the same tunnel.
     *
     * @param current handle whose endpoint is reused
     * @param database database to open
     * @return new handle; the caller registers it
     */
    public JdbcHandle reopen(JdbcHandle current, String database) {
        ConnectTarget target = current.getTarget().toBuilder().database(database).build();
        return open(current.getKind(), target, current.getTunnel().orElse(null));
    }

    String jdbcUrl(BackendKind kind, ConnectTarget target) {
        switch (kind) {
            case MYSQL:
                return "jdbc:mysql://" + target.getHost() + ":" + target.getPort() + "/"
                        + (target.getDatabase() != null ? target.getDatabase() : "");
            case POSTGRES:
                String db = target.getDatabase() != null && !target.getDatabase().isBlank() ? target.getDatabase() : "postgres";
                return "jdbc:postgresql://" + target.getHost() + ":" + target.getPort() + "/" + db;
            case SQLITE:
                if (target.getPath() == null || target.getPath().isBlank()) {
                    throw new IllegalArgumentException("SQLite database path is required");
                }
                return "jdbc:sqlite:" + target.getPath();
            default:
                throw new IllegalArgumentException("Not a SQL backend: " + kind.path());
        }
    }

    HikariConfig buildHikariConfig(BackendKind kind, ConnectTarget target) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(jdbcUrl(kind, target));
        config.setPoolName("pocketdb-" + kind.path() + "-" + System.currentTimeMillis());
        config.setConnectionTimeout(Math.max(MIN_HIKARI_TIMEOUT_MS, target.getConnectTimeoutMs()));
        config.setValidationTimeout(Math.max(MIN_HIKARI_TIMEOUT_MS, Math.min(target.getConnectTimeoutMs(), 5000)));
        config.setMinimumIdle(1);

        if (kind == BackendKind.SQLITE) {
            config.setDriverClassName("org.sqlite.JDBC");
            config.setMaximumPoolSize(sqlitePoolSize);
            return config;
        }

        config.setUsername(target.getUsername());
        config.setPassword(target.getPassword());
        config.setMaximumPoolSize(serverPoolSize);
        config.setIdleTimeout(60000);
        if (kind == BackendKind.MYSQL) {
            config.setDriverClassName("com.mysql.cj.jdbc.Driver");
            config.addDataSourceProperty("connectTimeout", String.valueOf(target.getConnectTimeoutMs()));
            config.addDataSourceProperty("allowPublicKeyRetrieval", "true");
            // YEAR columns come back as numbers instead of java.sql.Date.
            config.addDataSourceProperty("yearIsDateType", "false");
        } else {
            config.setDriverClassName("org.postgresql.Driver");
            // Shows up as pg_stat_activity.application_name.
            config.addDataSourceProperty("ApplicationName", "pocketdb");
            config.addDataSourceProperty("connectTimeout", String.valueOf(Math.max(1, (target.getConnectTimeoutMs() + 999) / 1000)));
        }
        return config;
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : e.getMessage();
    }
}
