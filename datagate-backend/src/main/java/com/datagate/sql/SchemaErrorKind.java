package com.datagate.sql;

public enum SchemaErrorKind {
    COLUMN_NOT_FOUND,
    TABLE_NOT_FOUND,
    TYPE_MISMATCH
}
