package com.pocketdb.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ExecuteRequest {
    @NotBlank(message = "SQL is required")
    private String sql;
}
