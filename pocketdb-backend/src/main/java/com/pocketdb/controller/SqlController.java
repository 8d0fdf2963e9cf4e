package com.pocketdb.controller;

import com.pocketdb.api.DeleteRowRequest;
import com.pocketdb.api.ExecuteRequest;
import com.pocketdb.api.ExecuteResponse;
import com.pocketdb.api.InsertRowRequest;
import com.pocketdb.api.RenameRequest;
import com.pocketdb.api.RowsAffectedResponse;
import com.pocketdb.api.TextResponse;
import com.pocketdb.api.UpdateCellRequest;
import com.pocketdb.api.UseDatabaseRequest;
import com.pocketdb.model.BackendKind;
import com.pocketdb.model.NamedSize;
import com.pocketdb.model.TableDescriptor;
import com.pocketdb.sql.SqlAdapter;
import com.pocketdb.sql.SqlAdapters;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Table and statement operations for MySQL, PostgreSQL and SQLite.
 */
@Slf4j
@RestController
@RequestMapping("/v1/sql/{kind}")
public class SqlController {

    private final SqlAdapters adapters;
    private final int maxLimit;

    public SqlController(SqlAdapters adapters, @Value("${pocketdb.rows.max-limit:1000}") int maxLimit) {
        this.adapters = adapters;
        this.maxLimit = maxLimit;
    }

    @GetMapping("/tables")
    public List<String> listTables(@PathVariable("kind") String kind) throws SQLException {
        return adapter(kind).listTables();
    }

    @GetMapping("/views")
    public List<String> listViews(@PathVariable("kind") String kind) throws SQLException {
        return adapters.server(BackendKind.fromName(kind)).listViews();
    }

    @GetMapping("/functions")
    public List<String> listFunctions(@PathVariable("kind") String kind) throws SQLException {
        return adapters.server(BackendKind.fromName(kind)).listFunctions();
    }

    @GetMapping("/procedures")
    public List<String> listProcedures(@PathVariable("kind") String kind) throws SQLException {
        return adapters.server(BackendKind.fromName(kind)).listProcedures();
    }

    @GetMapping("/tables/{table}/columns")
    public List<String> getColumns(@PathVariable("kind") String kind, @PathVariable("table") String table) throws SQLException {
        return adapter(kind).getColumns(table);
    }

    /**
     * Single-column primary key, or a null value when the table has none or a composite one.
     *
     * GET /v1/sql/{kind}/tables/{table}/primary-key
     */
    @GetMapping("/tables/{table}/primary-key")
    public TextResponse getPrimaryKey(@PathVariable("kind") String kind, @PathVariable("table") String table) throws SQLException {
        return new TextResponse(adapter(kind).getPrimaryKey(table).orElse(null));
    }

    @GetMapping("/tables/{table}/count")
    public Map<String, Long> getRowCount(@PathVariable("kind") String kind, @PathVariable("table") String table) throws SQLException {
        return Map.of("count", adapter(kind).getRowCount(table));
    }

    @GetMapping("/tables/{table}/descriptor")
    public TableDescriptor describeTable(@PathVariable("kind") String kind, @PathVariable("table") String table) throws SQLException {
        return adapter(kind).describeTable(table);
    }

    /**
     * Page of canonical rows, ordered by the primary key when the table has a single-column one.
     *
     * GET /v1/sql/{kind}/tables/{table}/rows?limit=&amp;offset=
     */
    @GetMapping("/tables/{table}/rows")
    public List<Map<String, Object>> getRows(
            @PathVariable("kind") String kind,
            @PathVariable("table") String table,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset
    ) throws SQLException {
        int effectiveLimit = limit == null ? maxLimit : Math.max(1, Math.min(limit, maxLimit));
        int effectiveOffset = offset == null ? 0 : Math.max(0, offset);
        return adapter(kind).getRows(table, effectiveLimit, effectiveOffset);
    }

    @PostMapping("/cells/update")
    public RowsAffectedResponse updateCell(@PathVariable("kind") String kind,
                                           @Valid @RequestBody UpdateCellRequest request) throws SQLException {
        int updated = adapter(kind).updateCell(request.getTableName(), request.getPkCol(), request.getPkVal(),
                request.getColumn(), request.getValue());
        return new RowsAffectedResponse(updated);
    }

    @PostMapping("/rows/insert")
    public RowsAffectedResponse insertRow(@PathVariable("kind") String kind,
                                          @Valid @RequestBody InsertRowRequest request) throws SQLException {
        return new RowsAffectedResponse(adapter(kind).insertRow(request.getTableName(), request.getData()));
    }

    @PostMapping("/rows/delete")
    public RowsAffectedResponse deleteRow(@PathVariable("kind") String kind,
                                          @Valid @RequestBody DeleteRowRequest request) throws SQLException {
        return new RowsAffectedResponse(adapter(kind).deleteRow(request.getTableName(), request.getPkCol(), request.getPkVal()));
    }

    @DeleteMapping("/tables/{table}")
    public ResponseEntity<Void> dropTable(@PathVariable("kind") String kind, @PathVariable("table") String table) throws SQLException {
        adapter(kind).dropTable(table);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/tables/rename")
    public ResponseEntity<Void> renameTable(@PathVariable("kind") String kind,
                                            @Valid @RequestBody RenameRequest request) throws SQLException {
        adapter(kind).renameTable(request.getOldName(), request.getNewName());
        return ResponseEntity.noContent().build();
    }

    /**
     * Run one statement. Statements starting with a read-only keyword return rows, anything else an
     * affected-row message.
     *
     * POST /v1/sql/{kind}/execute
     */
    @PostMapping("/execute")
    public ExecuteResponse execute(@PathVariable("kind") String kind,
                                   @Valid @RequestBody ExecuteRequest request) throws SQLException {
        return adapter(kind).executeRaw(request.getSql());
    }

    @GetMapping("/databases")
    public List<NamedSize> listDatabases(@PathVariable("kind") String kind) throws SQLException {
        return adapters.server(BackendKind.fromName(kind)).listDatabasesWithSize();
    }

    @PostMapping("/databases/use")
    public ResponseEntity<Void> useDatabase(@PathVariable("kind") String kind,
                                            @Valid @RequestBody UseDatabaseRequest request) throws SQLException {
        adapters.server(BackendKind.fromName(kind)).useDatabase(request.getDatabase());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/databases/{database}/tables")
    public List<NamedSize> listTablesWithSize(@PathVariable("kind") String kind,
                                              @PathVariable("database") String database) throws SQLException {
        return adapters.server(BackendKind.fromName(kind)).listTablesWithSize(database);
    }

    private SqlAdapter adapter(String kind) {
        return adapters.get(BackendKind.fromName(kind));
    }
}
