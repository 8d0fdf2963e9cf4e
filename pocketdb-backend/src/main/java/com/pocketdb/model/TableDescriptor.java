package com.pocketdb.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Table shape discovered on demand; never cached between calls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableDescriptor {
    private String name;
    /** Single-column primary key, or null when the table has none or a composite one. */
    private String primaryKey;
    private List<String> columns;
}
