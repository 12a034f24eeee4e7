package com.datagate.sql;

public class ColumnNotFoundException extends SchemaException {

    private final String table;
    private final String column;

    public ColumnNotFoundException(String table, String column) {
        this(table, column, "Column '" + column + "' not found in table '" + table + "'", null);
    }

    public ColumnNotFoundException(String table, String column, String message, Throwable cause) {
        super(SchemaErrorKind.COLUMN_NOT_FOUND, message, cause);
        this.table = table;
        this.column = column;
    }

    public String getTable() {
        return table;
    }

    /**
     * @return the column the database rejected, or null when the driver did not say
     */
    public String getColumn() {
        return column;
    }
}
