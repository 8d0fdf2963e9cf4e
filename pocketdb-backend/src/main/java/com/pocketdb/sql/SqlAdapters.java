package com.pocketdb.sql;

import com.pocketdb.model.BackendKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the dialect adapter for a backend kind.
 */
@Component
public class SqlAdapters {
    private final Map<BackendKind, SqlAdapter> adapters = new EnumMap<>(BackendKind.class);

    public SqlAdapters(List<SqlAdapter> adapters) {
        for (SqlAdapter adapter : adapters) {
            this.adapters.put(adapter.kind(), adapter);
        }
    }

    public SqlAdapter get(BackendKind kind) {
        SqlAdapter adapter = adapters.get(kind);
        if (adapter == null) {
            throw new IllegalArgumentException("Not a SQL backend: " + kind.path());
        }
        return adapter;
    }

    public ServerSqlAdapter server(BackendKind kind) {
        SqlAdapter adapter = get(kind);
        if (adapter instanceof ServerSqlAdapter server) {
            return server;
        }
        throw new UnsupportedOperationException("Operation not supported for " + kind.path());
    }
}
