package com.pocketdb.sql;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketdb.api.ExecuteResponse;
import com.pocketdb.model.BackendKind;
import com.pocketdb.model.TableDescriptor;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.registry.JdbcHandle;
import com.pocketdb.util.BinaryEncoding;
import com.pocketdb.util.ValueMarshaller;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared implementation of {@link SqlAdapter}. Subclasses supply identifier quoting, catalog
 * queries, type classification and, where the dialect supports it, inline casting.
 */
@Slf4j
public abstract class AbstractSqlAdapter implements SqlAdapter {
    private final BackendKind kind;
    private final Pattern readOnlyPrefix;
    protected final ConnectionRegistry registry;
    protected final BinaryEncoding binaryEncoding;

    protected AbstractSqlAdapter(BackendKind kind, ConnectionRegistry registry, BinaryEncoding binaryEncoding,
                                 List<String> readOnlyKeywords) {
        this.kind = kind;
        this.registry = registry;
        this.binaryEncoding = binaryEncoding;
        this.readOnlyPrefix = Pattern.compile("(?i)(" + String.join("|", readOnlyKeywords) + ")\\b");
    }

    @Override
    public BackendKind kind() {
        return kind;
    }

    /**
     * Quote an identifier for interpolation into statement text.
     *
     * @param name raw identifier
     * @return quoted identifier with embedded quote characters doubled
     */
    public abstract String quoteIdentifier(String name);

    /**
     * Fold a driver-reported column type name into a column class.
     *
     * @param nativeType type name from {@link ResultSetMetaData#getColumnTypeName(int)}
     * @return column class, TEXT for anything unrecognised
     */
    public abstract ColumnClass classify(String nativeType);

    /** Query returning base table names in column 1. */
    protected abstract String listTablesSql();

    /** Query taking the table name as its only parameter, returning column names in declared order. */
    protected abstract String columnsSql();

    /** Query taking the table name as its only parameter, returning primary key columns in key order. */
    protected abstract String primaryKeySql();

    /**
     * Declared column types used to cast bound text. Dialects without inline casting return an
     * empty map and rely on the engine's own coercion.
     */
    protected Map<String, String> columnTypes(Connection conn, String table) throws SQLException {
        return Collections.emptyMap();
    }

    /**
     * Placeholder for a value bound as text into a column of {@code declaredType}.
     *
     * @param declaredType declared type, null when unknown
     * @return placeholder expression
     */
    protected String valuePlaceholder(String declaredType) {
        return "?";
    }

    /** Condition matching {@code quotedKey} against a text parameter. */
    protected String keyCondition(String quotedKey) {
        return quotedKey + " = ?";
    }

    protected String emptyInsertSql(String quotedTable) {
        return "INSERT INTO " + quotedTable + " DEFAULT VALUES";
    }

    protected String renameTableSql(String quotedOld, String quotedNew) {
        return "ALTER TABLE " + quotedOld + " RENAME TO " + quotedNew;
    }

    protected JdbcHandle handle() {
        return registry.get(kind, JdbcHandle.class);
    }

    @Override
    public List<String> listTables() throws SQLException {
        return queryStrings(listTablesSql());
    }

    @Override
    public List<String> getColumns(String table) throws SQLException {
        return queryStrings(columnsSql(), table);
    }

    @Override
    public Optional<String> getPrimaryKey(String table) throws SQLException {
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow()) {
            return primaryKey(conn, table);
        }
    }

    @Override
    public TableDescriptor describeTable(String table) throws SQLException {
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow()) {
            return TableDescriptor.builder()
                    .name(table)
                    .primaryKey(primaryKey(conn, table).orElse(null))
                    .columns(queryStrings(conn, columnsSql(), table))
                    .build();
        }
    }

    @Override
    public long getRowCount(String table) throws SQLException {
        JdbcHandle handle = handle();
        String sql = "SELECT COUNT(*) FROM " + quoteIdentifier(table);
        try (Connection conn = handle.borrow();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    @Override
    public List<Map<String, Object>> getRows(String table, int limit, int offset) throws SQLException {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("Limit and offset must not be negative");
        }
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow()) {
            StringBuilder sql = new StringBuilder("SELECT * FROM ").append(quoteIdentifier(table));
            Optional<String> pk = primaryKey(conn, table);
            pk.ifPresent(key -> sql.append(" ORDER BY ").append(quoteIdentifier(key)).append(" ASC"));
            sql.append(" LIMIT ? OFFSET ?");
            log.debug("[{}] {}", kind.path(), sql);

            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                ps.setInt(1, limit);
                ps.setInt(2, offset);
                try (ResultSet rs = ps.executeQuery()) {
                    return readRows(rs);
                }
            }
        }
    }

    @Override
    public int updateCell(String table, String pkCol, String pkVal, String column, String value) throws SQLException {
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow()) {
            String declaredType = columnTypes(conn, table).get(column);
            String sql = "UPDATE " + quoteIdentifier(table)
                    + " SET " + quoteIdentifier(column) + " = " + valuePlaceholder(declaredType)
                    + " WHERE " + keyCondition(quoteIdentifier(pkCol));
            log.debug("[{}] {}", kind.path(), sql);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bindText(ps, 1, value);
                ps.setString(2, pkVal);
                return ps.executeUpdate();
            }
        }
    }

    @Override
    public int insertRow(String table, Map<String, JsonNode> data) throws SQLException {
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow()) {
            if (data == null || data.isEmpty()) {
                try (Statement stmt = conn.createStatement()) {
                    return stmt.executeUpdate(emptyInsertSql(quoteIdentifier(table)));
                }
            }

            Map<String, String> types = columnTypes(conn, table);
            List<String> columns = new ArrayList<>(data.keySet());
            String sql = "INSERT INTO " + quoteIdentifier(table)
                    + " (" + columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", ")) + ")"
                    + " VALUES (" + columns.stream().map(c -> valuePlaceholder(types.get(c))).collect(Collectors.joining(", ")) + ")";
            log.debug("[{}] {}", kind.path(), sql);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (int i = 0; i < columns.size(); i++) {
                    bindText(ps, i + 1, jsonToText(data.get(columns.get(i))));
                }
                return ps.executeUpdate();
            }
        }
    }

    @Override
    public int deleteRow(String table, String pkCol, String pkVal) throws SQLException {
        JdbcHandle handle = handle();
        String sql = "DELETE FROM " + quoteIdentifier(table) + " WHERE " + keyCondition(quoteIdentifier(pkCol));
        try (Connection conn = handle.borrow();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, pkVal);
            return ps.executeUpdate();
        }
    }

    @Override
    public void dropTable(String table) throws SQLException {
        executeDdl("DROP TABLE " + quoteIdentifier(table));
    }

    @Override
    public void renameTable(String oldName, String newName) throws SQLException {
        executeDdl(renameTableSql(quoteIdentifier(oldName), quoteIdentifier(newName)));
    }

    @Override
    public ExecuteResponse executeRaw(String sql) throws SQLException {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("SQL is required");
        }
        JdbcHandle handle = handle();
        long start = System.currentTimeMillis();
        try (Connection conn = handle.borrow();
             Statement stmt = conn.createStatement()) {
            boolean hasResultSet = stmt.execute(sql);
            // A read-only prefix does not guarantee rows: WITH ... DELETE, PRAGMA x = y.
            if (hasResultSet && isQuery(sql)) {
                try (ResultSet rs = stmt.getResultSet()) {
                    List<Map<String, Object>> rows = readRows(rs);
                    return ExecuteResponse.rows(rows, System.currentTimeMillis() - start);
                }
            }
            long affected = Math.max(0, stmt.getUpdateCount());
            return ExecuteResponse.affected(affected, System.currentTimeMillis() - start);
        }
    }

    @Override
    public boolean isQuery(String sql) {
        return sql != null && readOnlyPrefix.matcher(sql.stripLeading()).lookingAt();
    }

    /**
     * Marshal every remaining row of {@code rs}.
     *
     * @param rs result set
     * @return canonical rows
     * @throws SQLException when metadata or cursor movement fails
     */
    protected List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        String[] labels = new String[columnCount];
        ColumnClass[] classes = new ColumnClass[columnCount];
        for (int i = 1; i <= columnCount; i++) {
            labels[i - 1] = meta.getColumnLabel(i);
            classes[i - 1] = classify(meta.getColumnTypeName(i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(labels[i - 1], ValueMarshaller.read(rs, i, classes[i - 1], binaryEncoding));
            }
            rows.add(row);
        }
        return rows;
    }

    protected Optional<String> primaryKey(Connection conn, String table) throws SQLException {
        List<String> keys = queryStrings(conn, primaryKeySql(), table);
        return keys.size() == 1 ? Optional.of(keys.get(0)) : Optional.empty();
    }

    protected List<String> queryStrings(String sql, String... params) throws SQLException {
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow()) {
            return queryStrings(conn, sql, params);
        }
    }

    protected List<String> queryStrings(Connection conn, String sql, String... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<String> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
                return out;
            }
        }
    }

    protected void executeDdl(String sql) throws SQLException {
        JdbcHandle handle = handle();
        log.info("[{}] {}", kind.path(), sql);
        try (Connection conn = handle.borrow();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Text bound for an insert value: strings as-is, null for JSON null, JSON text otherwise.
     *
     * @param node JSON value, may be null
     * @return text to bind, null for SQL NULL
     */
    static String jsonToText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }

    private static void bindText(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }
}
