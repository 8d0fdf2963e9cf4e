package com.pocketdb.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * Keeps pooled connections alive across statement-level errors that say nothing about the
 * connection itself.
 *
 * <p>Raw statements typed by the user fail often: unsupported features (SQLSTATE class 0A), syntax
 * errors and access rule violations (class 42), constraint violations (class 23) and bad data
 * (class 22). None of them should cost a pooled connection.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("0A") || sqlState.startsWith("42")
                || sqlState.startsWith("23") || sqlState.startsWith("22"))) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
