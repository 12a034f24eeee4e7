package com.datagate.sql;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Converts JDBC column values into JSON-safe values, so rows can be masked, audited and serialized
 * without driver classes leaking out.
 */
final class JdbcJsonSafe {
    private static final int MAX_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcJsonSafe() {
    }

    /**
     * Read one column of the current row.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @return json-safe value
     * @throws SQLException when the value cannot be fetched
     */
    static Object read(ResultSet rs, int columnIndex) throws SQLException {
        Object v = rs.getObject(columnIndex);
        try {
            return toJsonSafe(v, 0);
        } catch (SQLException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private static Object toJsonSafe(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof Clob clob) {
            long length = clob.length();
            return length <= 0 ? "" : clob.getSubString(1, (int) Math.min(length, MAX_CHARS));
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            return length <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, (int) Math.min(length, MAX_BLOB_BYTES)));
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.util.Date || v instanceof TemporalAccessor || v instanceof java.util.UUID) {
            return v.toString();
        }
        if (v instanceof java.sql.Array arr && depth < 2) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] elements) {
                List<Object> out = new ArrayList<>(elements.length);
                for (Object element : elements) {
                    out.add(toJsonSafe(element, depth + 1));
                }
                return out;
            }
        }
        // PostgreSQL json/jsonb columns arrive as org.postgresql.util.PGobject; its toString() is the value.
        return truncate(String.valueOf(v));
    }

    private static String truncate(String s) {
        return s.length() <= MAX_CHARS ? s : s.substring(0, MAX_CHARS);
    }
}
