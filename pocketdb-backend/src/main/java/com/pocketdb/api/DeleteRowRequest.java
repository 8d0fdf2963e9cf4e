package com.pocketdb.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DeleteRowRequest {
    @NotBlank(message = "Table name is required")
    private String tableName;

    @NotBlank(message = "Primary key column is required")
    private String pkCol;

    @NotNull(message = "Primary key value is required")
    private String pkVal;
}
