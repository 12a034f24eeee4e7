package com.datagate.sql;

import com.zaxxer.hikari.SQLExceptionOverride.Override;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

import static org.junit.jupiter.api.Assertions.*;

class HikariSqlExceptionOverrideTest {

    private final HikariSqlExceptionOverride override = new HikariSqlExceptionOverride();

    @Test
    void schemaAndDataErrorsKeepTheConnection() {
        assertEquals(Override.DO_NOT_EVICT, override.adjudicate(new SQLException("column missing", "42703")));
        assertEquals(Override.DO_NOT_EVICT, override.adjudicate(new SQLException("bad input", "22P02")));
        assertEquals(Override.DO_NOT_EVICT, override.adjudicate(new SQLFeatureNotSupportedException("nope")));
    }

    @Test
    void connectionErrorsFollowHikariDefault() {
        assertEquals(Override.CONTINUE_EVICT, override.adjudicate(new SQLException("connection reset", "08006")));
        assertEquals(Override.CONTINUE_EVICT, override.adjudicate(new SQLException("no state")));
    }
}
