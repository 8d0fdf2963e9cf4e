package com.pocketdb.sql;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketdb.api.ExecuteResponse;
import com.pocketdb.model.BackendKind;
import com.pocketdb.model.TableDescriptor;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic table operations translated into one SQL dialect.
 *
 * <p>Identifiers are quoted by the dialect before interpolation but never allow-listed; callers are
 * trusted. Every operation fails with {@link com.pocketdb.registry.NotConnectedException} before
 * touching the network when the backend's slot is empty, and otherwise surfaces driver errors as-is.
 */
public interface SqlAdapter {

    BackendKind kind();

    List<String> listTables() throws SQLException;

    /**
     * Column names in declared order.
     */
    List<String> getColumns(String table) throws SQLException;

    /**
     * The table's primary key when it consists of exactly one column.
     */
    Optional<String> getPrimaryKey(String table) throws SQLException;

    TableDescriptor describeTable(String table) throws SQLException;

    long getRowCount(String table) throws SQLException;

    /**
     * One page of rows, ordered by the single-column primary key when there is one.
     *
     * @param table table name
     * @param limit maximum rows, at least 0
     * @param offset rows to skip, at least 0
     * @return canonical rows keyed by column label, in column order
     */
    List<Map<String, Object>> getRows(String table, int limit, int offset) throws SQLException;

    /**
     * Set one cell, matching the row by its key compared as text.
     *
     * @return affected rows; 0 when no row matches
     */
    int updateCell(String table, String pkCol, String pkVal, String column, String value) throws SQLException;

    /**
     * Insert one row. Strings bind as-is, JSON null as SQL NULL, anything else as its JSON text.
     *
     * @return affected rows
     */
    int insertRow(String table, Map<String, JsonNode> data) throws SQLException;

    /**
     * @return affected rows; 0 when the row is already gone
     */
    int deleteRow(String table, String pkCol, String pkVal) throws SQLException;

    void dropTable(String table) throws SQLException;

    void renameTable(String oldName, String newName) throws SQLException;

    /**
     * Run a statement typed by the user. Statements that start with one of the dialect's read-only
     * keywords return rows; anything else returns an affected-row message.
     */
    ExecuteResponse executeRaw(String sql) throws SQLException;

    boolean isQuery(String sql);
}
