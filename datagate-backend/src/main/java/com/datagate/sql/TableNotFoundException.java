package com.datagate.sql;

public class TableNotFoundException extends SchemaException {

    private final String table;

    public TableNotFoundException(String table) {
        this(table, "Table '" + table + "' not found", null);
    }

    public TableNotFoundException(String table, String message, Throwable cause) {
        super(SchemaErrorKind.TABLE_NOT_FOUND, message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
