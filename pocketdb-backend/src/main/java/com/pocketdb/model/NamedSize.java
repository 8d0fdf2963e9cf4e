package com.pocketdb.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A database or table name with its size in bytes as the engine accounts for it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NamedSize {
    private String name;
    private long bytes;
}
