package com.datagate.healing;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class QueryRewriter {

    private QueryRewriter() {
    }

    static String buildQuery(String table, String column, String filter) {
        StringBuilder sb = new StringBuilder("SELECT ").append(column).append(" FROM ").append(table);
        if (filter != null && !filter.isBlank()) {
            sb.append(" WHERE ").append(filter.trim());
        }
        return sb.toString();
    }

    /**
     * Replace every whole-word occurrence of a column, ignoring case. A token written with a leading capital
     * is replaced by the new name capitalized; any other token by the new name in lower case.
     */
    static String replaceColumn(String query, String oldColumn, String newColumn) {
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(oldColumn) + "\\b", Pattern.CASE_INSENSITIVE);
        return pattern.matcher(query).replaceAll(m -> {
            String matched = m.group();
            String replacement = Character.isUpperCase(matched.charAt(0))
                    ? capitalize(newColumn)
                    : newColumn.toLowerCase(Locale.ROOT);
            return Matcher.quoteReplacement(replacement);
        });
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) {
            return s;
        }
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
