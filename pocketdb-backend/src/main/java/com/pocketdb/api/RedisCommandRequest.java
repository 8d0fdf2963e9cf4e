package com.pocketdb.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RedisCommandRequest {
    @NotBlank(message = "Command is required")
    private String command;
}
