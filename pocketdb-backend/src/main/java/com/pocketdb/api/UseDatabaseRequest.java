package com.pocketdb.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class UseDatabaseRequest {
    @NotBlank(message = "Database is required")
    private String database;
}
