package com.pocketdb.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a raw statement: marshalled rows for queries, an affected-row message otherwise.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecuteResponse {
    public static final String TYPE_ROWS = "rows";
    public static final String TYPE_TEXT = "text";

    private String type;
    private List<Map<String, Object>> rows;
    private String message;
    private long rowsAffected;
    private long durationMs;

    public static ExecuteResponse rows(List<Map<String, Object>> rows, long durationMs) {
        ExecuteResponse response = new ExecuteResponse();
        response.setType(TYPE_ROWS);
        response.setRows(rows);
        response.setRowsAffected(rows.size());
        response.setDurationMs(durationMs);
        return response;
    }

    public static ExecuteResponse affected(long count, long durationMs) {
        ExecuteResponse response = new ExecuteResponse();
        response.setType(TYPE_TEXT);
        response.setMessage("Success: " + count + " rows affected");
        response.setRowsAffected(count);
        response.setDurationMs(durationMs);
        return response;
    }
}
