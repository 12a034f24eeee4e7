package com.datagate.oracle;

public class OracleUnavailableException extends Exception {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
