package com.pocketdb.sql;

import com.pocketdb.model.BackendKind;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.util.BinaryEncoding;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * SQLite dialect. Column classes follow SQLite's type affinity rules on the declared type.
 */
@Service
public class SqliteAdapter extends AbstractSqlAdapter {
    private static final List<String> READ_ONLY_KEYWORDS = List.of("select", "with", "pragma", "explain", "values");

    public SqliteAdapter(ConnectionRegistry registry,
                         @Value("${pocketdb.marshal.binary-encoding:utf8}") String binaryEncoding) {
        super(BackendKind.SQLITE, registry, BinaryEncoding.fromName(binaryEncoding), READ_ONLY_KEYWORDS);
    }

    @Override
    public String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    @Override
    public ColumnClass classify(String nativeType) {
        String t = nativeType == null ? "" : nativeType.toUpperCase(Locale.ROOT);
        if (t.contains("BOOL")) {
            return ColumnClass.BOOLEAN;
        }
        if (t.contains("INT")) {
            return ColumnClass.INTEGER;
        }
        if (t.contains("CHAR") || t.contains("CLOB") || t.contains("TEXT")) {
            return ColumnClass.TEXT;
        }
        if (t.contains("BLOB")) {
            return ColumnClass.BINARY;
        }
        if (t.contains("REAL") || t.contains("FLOA") || t.contains("DOUB") || t.contains("NUMERIC") || t.contains("DECIMAL")) {
            return ColumnClass.FLOAT;
        }
        return ColumnClass.TEXT;
    }

    @Override
    protected String listTablesSql() {
        return "SELECT name FROM sqlite_master "
                + "WHERE type = 'table' AND name NOT LIKE 'sqlite_%' "
                + "ORDER BY name";
    }

    @Override
    protected String columnsSql() {
        return "SELECT name FROM pragma_table_info(?) ORDER BY cid";
    }

    @Override
    protected String primaryKeySql() {
        return "SELECT name FROM pragma_table_info(?) WHERE pk > 0 ORDER BY pk";
    }
}
