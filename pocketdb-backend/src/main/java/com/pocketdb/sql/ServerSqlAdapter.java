package com.pocketdb.sql;

import com.pocketdb.model.NamedSize;

import java.sql.SQLException;
import java.util.List;

/**
 * Catalog and administrative operations of client/server SQL engines.
 */
public interface ServerSqlAdapter extends SqlAdapter {

    List<String> listViews() throws SQLException;

    List<String> listFunctions() throws SQLException;

    List<String> listProcedures() throws SQLException;

    List<NamedSize> listDatabasesWithSize() throws SQLException;

    void useDatabase(String database) throws SQLException;

    List<NamedSize> listTablesWithSize(String database) throws SQLException;
}
