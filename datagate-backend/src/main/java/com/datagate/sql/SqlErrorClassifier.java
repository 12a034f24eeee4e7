package com.datagate.sql;

import java.sql.SQLException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps vendor {@link SQLException}s to {@link SchemaException}s.
 *
 * <p>SQLState and vendor codes are checked first (ANSI, PostgreSQL, H2), then the error message.
 */
public final class SqlErrorClassifier {

    private static final Set<String> COLUMN_NOT_FOUND_STATES = Set.of("42S22", "42703");
    private static final Set<String> TABLE_NOT_FOUND_STATES = Set.of("42S02", "42S04", "42P01");
    private static final Set<String> TYPE_MISMATCH_STATES = Set.of("22018", "42804", "22P02");

    // H2 vendor codes
    private static final Set<Integer> COLUMN_NOT_FOUND_CODES = Set.of(42122);
    private static final Set<Integer> TABLE_NOT_FOUND_CODES = Set.of(42102, 42104);

    private static final Pattern COLUMN_IN_MESSAGE = Pattern.compile("(?i)column\\s+[\"'`]?([A-Za-z0-9_.]+)");
    private static final Pattern TABLE_IN_MESSAGE =
            Pattern.compile("(?i)(?:table|relation|view)\\s+[\"'`]?([A-Za-z0-9_.]+)");
    private static final Pattern TABLE_IN_QUERY = Pattern.compile("(?i)\\bfrom\\s+[\"'`]?([A-Za-z0-9_.]+)");

    private SqlErrorClassifier() {
    }

    /**
     * Classify a database error raised by a query.
     *
     * @param e error raised by the driver
     * @param query query that failed
     * @return schema exception, or empty when the error is not schema related
     */
    public static Optional<SchemaException> classify(SQLException e, String query) {
        if (e == null) {
            return Optional.empty();
        }
        String state = e.getSQLState() != null ? e.getSQLState().toUpperCase(Locale.ROOT) : "";
        int code = e.getErrorCode();
        String message = e.getMessage() != null ? e.getMessage() : "";
        String lowered = message.toLowerCase(Locale.ROOT);

        if (COLUMN_NOT_FOUND_STATES.contains(state) || COLUMN_NOT_FOUND_CODES.contains(code)
                || isColumnMissingMessage(lowered)) {
            return Optional.of(new ColumnNotFoundException(tableInQuery(query), columnInMessage(message), message, e));
        }
        if (TABLE_NOT_FOUND_STATES.contains(state) || TABLE_NOT_FOUND_CODES.contains(code)
                || isTableMissingMessage(lowered)) {
            String table = tableInMessage(message);
            return Optional.of(new TableNotFoundException(table != null ? table : tableInQuery(query), message, e));
        }
        if (TYPE_MISMATCH_STATES.contains(state) || lowered.contains("type mismatch")
                || lowered.contains("data conversion error")) {
            return Optional.of(new TypeMismatchException(message, e));
        }
        return Optional.empty();
    }

    static String columnInMessage(String message) {
        return lastSegment(firstGroup(COLUMN_IN_MESSAGE, message));
    }

    static String tableInMessage(String message) {
        return lastSegment(firstGroup(TABLE_IN_MESSAGE, message));
    }

    static String tableInQuery(String query) {
        return lastSegment(firstGroup(TABLE_IN_QUERY, query));
    }

    private static boolean isColumnMissingMessage(String lowered) {
        return lowered.contains("no such column")
                || lowered.contains("unknown column")
                || lowered.contains("column") && (lowered.contains("not found") || lowered.contains("does not exist"));
    }

    private static boolean isTableMissingMessage(String lowered) {
        return lowered.contains("no such table")
                || (lowered.contains("table") || lowered.contains("relation"))
                && (lowered.contains("not found") || lowered.contains("does not exist"));
    }

    private static String firstGroup(Pattern pattern, String text) {
        if (text == null) {
            return null;
        }
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    private static String lastSegment(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 && dot < name.length() - 1 ? name.substring(dot + 1) : name;
    }
}
