package com.pocketdb.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** Rename of a table or a key. */
@Data
public class RenameRequest {
    @NotBlank(message = "Old name is required")
    private String oldName;

    @NotBlank(message = "New name is required")
    private String newName;
}
