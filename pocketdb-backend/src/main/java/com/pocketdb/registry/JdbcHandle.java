package com.pocketdb.registry;

import com.pocketdb.model.BackendKind;
import com.pocketdb.model.ConnectTarget;
import com.pocketdb.tunnel.TunnelSession;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * HikariCP pool for one SQL backend.
 */
public class JdbcHandle extends BackendHandle {
    private final HikariDataSource dataSource;
    private final ConnectTarget target;
    private volatile String catalog;

    public JdbcHandle(BackendKind kind, HikariDataSource dataSource, ConnectTarget target, TunnelSession tunnel) {
        super(kind, tunnel);
        this.dataSource = dataSource;
        this.target = target;
    }

    public HikariDataSource getDataSource() {
        return dataSource;
    }

    /**
     * Endpoint the pool was opened against; used to reopen it on another database.
     *
     * @return connect target
     */
    public ConnectTarget getTarget() {
        return target;
    }

    public String getCatalog() {
        return catalog;
    }

    /**
     * Set the catalog applied to every connection borrowed afterwards.
     *
     * @param catalog catalog (MySQL schema) name, or null for the pool default
     */
    public void setCatalog(String catalog) {
        this.catalog = catalog;
    }

    /**
     * Borrow a pooled connection with the selected catalog applied. Hikari restores the default
     * catalog when the connection returns to the pool.
     *
     * @return connection the caller must close
     * @throws SQLException on pool or driver errors
     */
    public Connection borrow() throws SQLException {
        Connection conn = dataSource.getConnection();
        String selected = catalog;
        if (selected != null) {
            try {
                conn.setCatalog(selected);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
        }
        return conn;
    }

    @Override
    protected void closeClient() {
        dataSource.close();
    }
}
