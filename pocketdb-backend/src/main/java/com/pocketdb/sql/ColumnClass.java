package com.pocketdb.sql;

/**
 * Canonical classes a driver-reported column type is folded into before a value is marshalled.
 * Each dialect maps its native type names onto exactly one of these.
 */
public enum ColumnClass {
    INTEGER,
    FLOAT,
    BOOLEAN,
    BINARY,
    TEXT
}
