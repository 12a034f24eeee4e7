package com.datagate.sql;

public class TypeMismatchException extends SchemaException {

    public TypeMismatchException(String message) {
        this(message, null);
    }

    public TypeMismatchException(String message, Throwable cause) {
        super(SchemaErrorKind.TYPE_MISMATCH, message, cause);
    }
}
