package com.pocketdb.sql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.pocketdb.api.ExecuteResponse;
import com.pocketdb.model.BackendKind;
import com.pocketdb.model.NamedSize;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.registry.JdbcHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MySqlAdapterTest {

    @Mock private ConnectionRegistry registry;
    @Mock private JdbcHandle handle;
    @Mock private Connection conn;
    @Mock private PreparedStatement ps;
    @Mock private Statement stmt;
    @Mock private ResultSet rs;
    @Mock private ResultSetMetaData meta;

    private MySqlAdapter adapter;

    @BeforeEach
    void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);
        when(registry.get(BackendKind.MYSQL, JdbcHandle.class)).thenReturn(handle);
        when(handle.borrow()).thenReturn(conn);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(conn.createStatement()).thenReturn(stmt);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(meta);
        adapter = new MySqlAdapter(registry, "utf8");
    }

    @Test
    void quoteIdentifier_usesBackticksAndDoublesThem() {
        assertEquals("`orders`", adapter.quoteIdentifier("orders"));
        assertEquals("`we``ird`", adapter.quoteIdentifier("we`ird"));
    }

    @Test
    void updateCell_bindsValueAndKeyAsText() throws SQLException {
        when(ps.executeUpdate()).thenReturn(1);

        int updated = adapter.updateCell("orders", "id", "42", "status", "shipped");

        assertEquals(1, updated);
        verify(conn).prepareStatement("UPDATE `orders` SET `status` = ? WHERE `id` = ?");
        verify(ps).setString(1, "shipped");
        verify(ps).setString(2, "42");
    }

    @Test
    void updateCell_nullValueBindsSqlNull() throws SQLException {
        adapter.updateCell("orders", "id", "42", "note", null);

        verify(ps).setNull(1, Types.VARCHAR);
        verify(ps).setString(2, "42");
    }

    @Test
    void getRows_ordersBySinglePrimaryKey() throws SQLException {
        when(rs.next()).thenReturn(true, false, false);
        when(rs.getString(1)).thenReturn("id");
        when(meta.getColumnCount()).thenReturn(0);

        List<Map<String, Object>> rows = adapter.getRows("orders", 50, 100);

        assertTrue(rows.isEmpty());
        verify(conn).prepareStatement(startsWith("SELECT column_name FROM information_schema.key_column_usage"));
        verify(conn).prepareStatement("SELECT * FROM `orders` ORDER BY `id` ASC LIMIT ? OFFSET ?");
        verify(ps).setInt(1, 50);
        verify(ps).setInt(2, 100);
    }

    @Test
    void getRows_compositeKeyLeavesOrderUnspecified() throws SQLException {
        when(rs.next()).thenReturn(true, true, false, false);
        when(rs.getString(1)).thenReturn("a", "b");
        when(meta.getColumnCount()).thenReturn(0);

        adapter.getRows("pairs", 10, 0);

        verify(conn).prepareStatement("SELECT * FROM `pairs` LIMIT ? OFFSET ?");
    }

    @Test
    void insertRow_listsColumnsAndBindsText() throws SQLException {
        when(ps.executeUpdate()).thenReturn(1);
        Map<String, JsonNode> data = new LinkedHashMap<>();
        data.put("qty", IntNode.valueOf(3));
        data.put("note", NullNode.getInstance());

        assertEquals(1, adapter.insertRow("orders", data));

        verify(conn).prepareStatement("INSERT INTO `orders` (`qty`, `note`) VALUES (?, ?)");
        verify(ps).setString(1, "3");
        verify(ps).setNull(2, Types.VARCHAR);
    }

    @Test
    void insertRow_emptyDataUsesDefaults() throws SQLException {
        when(stmt.executeUpdate("INSERT INTO `orders` () VALUES ()")).thenReturn(1);

        assertEquals(1, adapter.insertRow("orders", Map.of()));
    }

    @Test
    void deleteRow_bindsKeyAsText() throws SQLException {
        when(ps.executeUpdate()).thenReturn(0);

        assertEquals(0, adapter.deleteRow("orders", "id", "7"));
        verify(conn).prepareStatement("DELETE FROM `orders` WHERE `id` = ?");
        verify(ps).setString(1, "7");
    }

    @Test
    void renameTable_usesRenameStatement() throws SQLException {
        adapter.renameTable("old", "new");

        verify(stmt).execute("RENAME TABLE `old` TO `new`");
    }

    @Test
    void executeRaw_queryMarshalsByReportedType() throws SQLException {
        String sql = "select id, price, flag from orders";
        when(stmt.execute(sql)).thenReturn(true);
        when(stmt.getResultSet()).thenReturn(rs);
        when(meta.getColumnCount()).thenReturn(3);
        when(meta.getColumnLabel(1)).thenReturn("id");
        when(meta.getColumnLabel(2)).thenReturn("price");
        when(meta.getColumnLabel(3)).thenReturn("flag");
        when(meta.getColumnTypeName(1)).thenReturn("BIGINT UNSIGNED");
        when(meta.getColumnTypeName(2)).thenReturn("DECIMAL");
        when(meta.getColumnTypeName(3)).thenReturn("BIT");
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn(BigInteger.valueOf(5));
        when(rs.getObject(2)).thenReturn(new BigDecimal("9.99"));
        when(rs.getObject(3)).thenReturn(Boolean.TRUE);

        ExecuteResponse response = adapter.executeRaw(sql);

        assertEquals(ExecuteResponse.TYPE_ROWS, response.getType());
        Map<String, Object> row = response.getRows().get(0);
        assertEquals(List.of("id", "price", "flag"), List.copyOf(row.keySet()));
        assertEquals(5L, row.get("id"));
        assertEquals(9.99d, row.get("price"));
        assertEquals(Boolean.TRUE, row.get("flag"));
    }

    @Test
    void executeRaw_statementReportsAffectedRows() throws SQLException {
        when(stmt.execute("DELETE FROM orders")).thenReturn(false);
        when(stmt.getUpdateCount()).thenReturn(3);

        ExecuteResponse response = adapter.executeRaw("DELETE FROM orders");

        assertEquals(ExecuteResponse.TYPE_TEXT, response.getType());
        assertEquals("Success: 3 rows affected", response.getMessage());
        assertEquals(3, response.getRowsAffected());
    }

    @Test
    void executeRaw_blankRejected() {
        assertThrows(IllegalArgumentException.class, () -> adapter.executeRaw("   "));
    }

    @Test
    void isQuery_matchesLeadingReadOnlyKeyword() {
        assertTrue(adapter.isQuery("SELECT 1"));
        assertTrue(adapter.isQuery("   show tables"));
        assertTrue(adapter.isQuery("DESC orders"));
        assertTrue(adapter.isQuery("describe orders"));
        assertTrue(adapter.isQuery("With x AS (SELECT 1) SELECT * FROM x"));
        assertTrue(adapter.isQuery("EXPLAIN SELECT 1"));
        assertFalse(adapter.isQuery("UPDATE orders SET a = 1"));
        assertFalse(adapter.isQuery("selection"));
        assertFalse(adapter.isQuery("INSERT INTO t SELECT 1"));
    }

    @Test
    void classify_mapsMySqlTypes() {
        assertEquals(ColumnClass.INTEGER, adapter.classify("INT UNSIGNED"));
        assertEquals(ColumnClass.INTEGER, adapter.classify("year"));
        assertEquals(ColumnClass.FLOAT, adapter.classify("DOUBLE"));
        assertEquals(ColumnClass.BOOLEAN, adapter.classify("BIT"));
        assertEquals(ColumnClass.BINARY, adapter.classify("LONGBLOB"));
        assertEquals(ColumnClass.TEXT, adapter.classify("DATETIME"));
        assertEquals(ColumnClass.TEXT, adapter.classify("JSON"));
    }

    @Test
    void useDatabase_validatesThenAppliesCatalog() throws SQLException {
        adapter.useDatabase("shop");

        verify(conn).setCatalog("shop");
        verify(handle).setCatalog("shop");
    }

    @Test
    void useDatabase_unknownSchemaLeavesHandleUnchanged() throws SQLException {
        doThrow(new SQLException("Unknown database 'nope'")).when(conn).setCatalog("nope");

        assertThrows(SQLException.class, () -> adapter.useDatabase("nope"));
        verify(handle, never()).setCatalog(anyString());
    }

    @Test
    void listDatabasesWithSize_readsNameAndBytes() throws SQLException {
        when(rs.next()).thenReturn(true, false);
        when(rs.getString(1)).thenReturn("shop");
        when(rs.getLong(2)).thenReturn(2048L);

        assertEquals(List.of(new NamedSize("shop", 2048L)), adapter.listDatabasesWithSize());
    }
}
