package com.datagate.sql;

/**
 * A query failed because it does not fit the database schema.
 *
 * <p>Only {@link ColumnNotFoundException} is recoverable by query healing; the other kinds are terminal.
 */
public abstract class SchemaException extends Exception {

    private final SchemaErrorKind kind;

    protected SchemaException(SchemaErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SchemaErrorKind getKind() {
        return kind;
    }
}
