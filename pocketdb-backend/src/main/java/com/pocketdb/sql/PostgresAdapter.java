package com.pocketdb.sql;

import com.pocketdb.model.BackendKind;
import com.pocketdb.model.NamedSize;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.registry.JdbcHandle;
import com.pocketdb.service.JdbcPoolFactory;
import com.pocketdb.util.BinaryEncoding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * PostgreSQL dialect. Bound text is cast to each column's declared type in the statement itself,
 * and key columns are compared as text so any key type matches a text key value.
 */
@Slf4j
@Service
public class PostgresAdapter extends AbstractSqlAdapter implements ServerSqlAdapter {
    private static final List<String> READ_ONLY_KEYWORDS = List.of("select", "with", "show", "explain", "values", "table");

    private static final Set<String> INTEGER_TYPES = Set.of(
            "int2", "int4", "int8", "smallint", "integer", "bigint",
            "smallserial", "serial", "bigserial", "serial2", "serial4", "serial8", "oid");
    private static final Set<String> FLOAT_TYPES = Set.of(
            "float4", "float8", "real", "double precision", "numeric", "decimal");
    private static final Set<String> BOOLEAN_TYPES = Set.of("bool", "boolean");

    private final JdbcPoolFactory poolFactory;

    public PostgresAdapter(ConnectionRegistry registry, JdbcPoolFactory poolFactory,
                           @Value("${pocketdb.marshal.binary-encoding:utf8}") String binaryEncoding) {
        super(BackendKind.POSTGRES, registry, BinaryEncoding.fromName(binaryEncoding), READ_ONLY_KEYWORDS);
        this.poolFactory = poolFactory;
    }

    @Override
    public String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    @Override
    public ColumnClass classify(String nativeType) {
        String t = nativeType == null ? "" : nativeType.toLowerCase(Locale.ROOT).trim();
        if (INTEGER_TYPES.contains(t)) {
            return ColumnClass.INTEGER;
        }
        if (FLOAT_TYPES.contains(t)) {
            return ColumnClass.FLOAT;
        }
        if (BOOLEAN_TYPES.contains(t)) {
            return ColumnClass.BOOLEAN;
        }
        if ("bytea".equals(t)) {
            return ColumnClass.BINARY;
        }
        return ColumnClass.TEXT;
    }

    @Override
    protected String listTablesSql() {
        return "SELECT table_name FROM information_schema.tables "
                + "WHERE table_schema = current_schema() AND table_type = 'BASE TABLE' "
                + "ORDER BY table_name";
    }

    @Override
    protected String columnsSql() {
        return "SELECT column_name FROM information_schema.columns "
                + "WHERE table_schema = current_schema() AND table_name = ? "
                + "ORDER BY ordinal_position";
    }

    @Override
    protected String primaryKeySql() {
        return "SELECT kcu.column_name FROM information_schema.table_constraints tc "
                + "JOIN information_schema.key_column_usage kcu "
                + "  ON kcu.constraint_name = tc.constraint_name AND kcu.table_schema = tc.table_schema AND kcu.table_name = tc.table_name "
                + "WHERE tc.constraint_type = 'PRIMARY KEY' AND tc.table_schema = current_schema() AND tc.table_name = ? "
                + "ORDER BY kcu.ordinal_position";
    }

    @Override
    protected Map<String, String> columnTypes(Connection conn, String table) throws SQLException {
        String sql = "SELECT a.attname, format_type(a.atttypid, a.atttypmod) "
                + "FROM pg_catalog.pg_attribute a "
                + "WHERE a.attrelid = CAST(? AS regclass) AND a.attnum > 0 AND NOT a.attisdropped";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, quoteIdentifier(table));
            try (ResultSet rs = ps.executeQuery()) {
                Map<String, String> types = new HashMap<>();
                while (rs.next()) {
                    types.put(rs.getString(1), rs.getString(2));
                }
                return types;
            }
        }
    }

    @Override
    protected String valuePlaceholder(String declaredType) {
        return declaredType == null ? "?" : "CAST(? AS " + declaredType + ")";
    }

    @Override
    protected String keyCondition(String quotedKey) {
        return "CAST(" + quotedKey + " AS TEXT) = ?";
    }

    @Override
    public List<String> listViews() throws SQLException {
        return queryStrings("SELECT table_name FROM information_schema.views "
                + "WHERE table_schema = current_schema() ORDER BY table_name");
    }

    @Override
    public List<String> listFunctions() throws SQLException {
        return queryStrings("SELECT DISTINCT routine_name FROM information_schema.routines "
                + "WHERE routine_schema = current_schema() AND routine_type = 'FUNCTION' ORDER BY routine_name");
    }

    @Override
    public List<String> listProcedures() throws SQLException {
        return queryStrings("SELECT DISTINCT routine_name FROM information_schema.routines "
                + "WHERE routine_schema = current_schema() AND routine_type = 'PROCEDURE' ORDER BY routine_name");
    }

    @Override
    public List<NamedSize> listDatabasesWithSize() throws SQLException {
        String sql = "SELECT datname, "
                + "CASE WHEN has_database_privilege(datname, 'CONNECT') THEN pg_database_size(datname) ELSE 0 END "
                + "FROM pg_catalog.pg_database "
                + "WHERE NOT datistemplate AND datallowconn "
                + "ORDER BY datname";
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return readSizes(rs);
        }
    }

    /**
     * A PostgreSQL connection is bound to one database, so switching reopens the pool on the target
     * database over the same tunnel and replaces the registry slot.
     */
    @Override
    public void useDatabase(String database) throws SQLException {
        JdbcHandle current = handle();
        if (database.equals(current.getTarget().getDatabase())) {
            return;
        }
        JdbcHandle reopened = poolFactory.reopen(current, database);
        registry.set(BackendKind.POSTGRES, reopened);
        log.info("PostgreSQL pool reopened on database {}", database);
    }

    @Override
    public List<NamedSize> listTablesWithSize(String database) throws SQLException {
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow()) {
            String connected = currentDatabase(conn);
            if (database != null && !database.equals(connected)) {
                throw new IllegalArgumentException("Connected to database " + connected
                        + "; switch to " + database + " before listing its tables");
            }
            String sql = "SELECT c.relname, pg_total_relation_size(c.oid) "
                    + "FROM pg_catalog.pg_class c "
                    + "JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace "
                    + "WHERE c.relkind IN ('r', 'p') AND n.nspname = current_schema() "
                    + "ORDER BY c.relname";
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(sql)) {
                return readSizes(rs);
            }
        }
    }

    private String currentDatabase(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT current_database()")) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    private List<NamedSize> readSizes(ResultSet rs) throws SQLException {
        List<NamedSize> out = new ArrayList<>();
        while (rs.next()) {
            out.add(new NamedSize(rs.getString(1), rs.getLong(2)));
        }
        return out;
    }
}
