package com.pocketdb.api;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RedisValueRequest {
    @NotNull(message = "Value is required")
    private String value;
}
