package com.datagate.sql;

import com.zaxxer.hikari.HikariConfig;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link SqlBackend} over a JDBC {@link DataSource}, normally a HikariCP pool.
 *
 * <p>Schema errors reported by the driver are rethrown as {@link SchemaException}s; anything else stays an
 * {@link SQLException}.
 */
@Slf4j
public class JdbcSqlBackend implements SqlBackend {

    private final DataSource dataSource;
    private final int queryTimeoutMs;
    private final int maxRows;

    public JdbcSqlBackend(DataSource dataSource, int queryTimeoutMs, int maxRows) {
        this.dataSource = dataSource;
        this.queryTimeoutMs = queryTimeoutMs;
        this.maxRows = maxRows;
    }

    @Override
    public List<Map<String, Object>> execute(String query) throws SchemaException, SQLException {
        long startTime = System.currentTimeMillis();
        try (Connection conn = dataSource.getConnection()) {
            conn.setReadOnly(true);
            try (Statement stmt = conn.createStatement()) {
                if (queryTimeoutMs > 0) {
                    stmt.setQueryTimeout(Math.max(1, queryTimeoutMs / 1000));
                }
                if (maxRows > 0) {
                    stmt.setMaxRows(maxRows);
                }
                try (ResultSet rs = stmt.executeQuery(query)) {
                    List<Map<String, Object>> rows = readRows(rs);
                    log.debug("Query executed (rows={}, duration_ms={})", rows.size(), System.currentTimeMillis() - startTime);
                    return rows;
                }
            }
        } catch (SQLException e) {
            SchemaException schemaError = SqlErrorClassifier.classify(e, query).orElse(null);
            if (schemaError != null) {
                log.info("Query failed with schema error (kind={}, sql_state={}): {}",
                        schemaError.getKind(), e.getSQLState(), e.getMessage());
                throw schemaError;
            }
            throw e;
        }
    }

    private List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();
        String[] labels = new String[columnCount];
        for (int i = 1; i <= columnCount; i++) {
            labels[i - 1] = normalizeLabel(rsmd.getColumnLabel(i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(labels[i - 1], JdbcJsonSafe.read(rs, i));
            }
            rows.add(row);
        }
        return rows;
    }

    // Some databases (H2, Oracle) report unquoted identifiers in upper case.
    private static String normalizeLabel(String label) {
        if (label == null) {
            return null;
        }
        return label.equals(label.toUpperCase(Locale.ROOT)) ? label.toLowerCase(Locale.ROOT) : label;
    }

    /**
     * Build the pool configuration for the query backend.
     *
     * @param jdbcUrl jdbc url
     * @param username user name, may be blank
     * @param password password, may be blank
     * @param maximumPoolSize pool size
     * @return hikari config
     */
    public static HikariConfig buildHikariConfig(String jdbcUrl, String username, String password, int maximumPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(jdbcUrl);
        if (username != null && !username.isBlank()) {
            config.setUsername(username);
        }
        if (password != null && !password.isBlank()) {
            config.setPassword(password);
        }
        if (jdbcUrl != null && jdbcUrl.startsWith("jdbc:postgresql:")) {
            config.addDataSourceProperty("ApplicationName", "datagate");
        }
        config.setMaximumPoolSize(Math.max(1, maximumPoolSize));
        config.setMinimumIdle(0);
        // Start without a reachable database; connections are opened on first query.
        config.setInitializationFailTimeout(-1);
        config.setPoolName("DataGate-Query-Pool");
        return config;
    }
}
