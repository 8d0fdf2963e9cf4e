package com.pocketdb.sql;

import com.pocketdb.model.BackendKind;
import com.pocketdb.model.NamedSize;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.registry.JdbcHandle;
import com.pocketdb.util.BinaryEncoding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * MySQL dialect. Relies on the server's own coercion when text is written into typed columns.
 */
@Slf4j
@Service
public class MySqlAdapter extends AbstractSqlAdapter implements ServerSqlAdapter {
    private static final List<String> READ_ONLY_KEYWORDS = List.of("select", "show", "describe", "desc", "explain", "with");

    public MySqlAdapter(ConnectionRegistry registry,
                        @Value("${pocketdb.marshal.binary-encoding:utf8}") String binaryEncoding) {
        super(BackendKind.MYSQL, registry, BinaryEncoding.fromName(binaryEncoding), READ_ONLY_KEYWORDS);
    }

    @Override
    public String quoteIdentifier(String name) {
        return "`" + name.replace("`", "``") + "`";
    }

    @Override
    public ColumnClass classify(String nativeType) {
        String t = nativeType == null ? "" : nativeType.toUpperCase(Locale.ROOT).replace(" UNSIGNED", "").trim();
        switch (t) {
            case "TINYINT":
            case "SMALLINT":
            case "MEDIUMINT":
            case "INT":
            case "INTEGER":
            case "BIGINT":
            case "YEAR":
                return ColumnClass.INTEGER;
            case "FLOAT":
            case "DOUBLE":
            case "REAL":
            case "DECIMAL":
            case "NUMERIC":
                return ColumnClass.FLOAT;
            case "BOOLEAN":
            case "BOOL":
            case "BIT":
                return ColumnClass.BOOLEAN;
            case "BINARY":
            case "VARBINARY":
            case "TINYBLOB":
            case "BLOB":
            case "MEDIUMBLOB":
            case "LONGBLOB":
                return ColumnClass.BINARY;
            default:
                return ColumnClass.TEXT;
        }
    }

    @Override
    protected String listTablesSql() {
        return "SELECT table_name FROM information_schema.tables "
                + "WHERE table_schema = DATABASE() AND table_type = 'BASE TABLE' "
                + "ORDER BY table_name";
    }

    @Override
    protected String columnsSql() {
        return "SELECT column_name FROM information_schema.columns "
                + "WHERE table_schema = DATABASE() AND table_name = ? "
                + "ORDER BY ordinal_position";
    }

    @Override
    protected String primaryKeySql() {
        return "SELECT column_name FROM information_schema.key_column_usage "
                + "WHERE table_schema = DATABASE() AND table_name = ? AND constraint_name = 'PRIMARY' "
                + "ORDER BY ordinal_position";
    }

    @Override
    protected String emptyInsertSql(String quotedTable) {
        return "INSERT INTO " + quotedTable + " () VALUES ()";
    }

    @Override
    protected String renameTableSql(String quotedOld, String quotedNew) {
        return "RENAME TABLE " + quotedOld + " TO " + quotedNew;
    }

    @Override
    public List<String> listViews() throws SQLException {
        return queryStrings("SELECT table_name FROM information_schema.views "
                + "WHERE table_schema = DATABASE() ORDER BY table_name");
    }

    @Override
    public List<String> listFunctions() throws SQLException {
        return queryStrings("SELECT routine_name FROM information_schema.routines "
                + "WHERE routine_schema = DATABASE() AND routine_type = 'FUNCTION' ORDER BY routine_name");
    }

    @Override
    public List<String> listProcedures() throws SQLException {
        return queryStrings("SELECT routine_name FROM information_schema.routines "
                + "WHERE routine_schema = DATABASE() AND routine_type = 'PROCEDURE' ORDER BY routine_name");
    }

    @Override
    public List<NamedSize> listDatabasesWithSize() throws SQLException {
        String sql = "SELECT s.schema_name, COALESCE(SUM(t.data_length + t.index_length), 0) "
                + "FROM information_schema.schemata s "
                + "LEFT JOIN information_schema.tables t ON t.table_schema = s.schema_name "
                + "GROUP BY s.schema_name ORDER BY s.schema_name";
        return querySizes(sql, null);
    }

    /**
     * Select the schema every connection borrowed afterwards works in. The schema is applied to one
     * connection first, so an unknown name fails without changing anything.
     */
    @Override
    public void useDatabase(String database) throws SQLException {
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow()) {
            conn.setCatalog(database);
        }
        handle.setCatalog(database);
        log.info("MySQL schema switched to {}", database);
    }

    @Override
    public List<NamedSize> listTablesWithSize(String database) throws SQLException {
        String sql = "SELECT table_name, COALESCE(data_length + index_length, 0) "
                + "FROM information_schema.tables "
                + "WHERE table_schema = ? AND table_type = 'BASE TABLE' "
                + "ORDER BY table_name";
        return querySizes(sql, database);
    }

    private List<NamedSize> querySizes(String sql, String param) throws SQLException {
        JdbcHandle handle = handle();
        try (Connection conn = handle.borrow();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            if (param != null) {
                ps.setString(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<NamedSize> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new NamedSize(rs.getString(1), rs.getLong(2)));
                }
                return out;
            }
        }
    }
}
