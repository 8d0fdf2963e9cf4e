package com.pocketdb.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class InsertRowRequest {
    @NotBlank(message = "Table name is required")
    private String tableName;

    @NotNull(message = "Row data is required")
    private Map<String, JsonNode> data = new LinkedHashMap<>();
}
