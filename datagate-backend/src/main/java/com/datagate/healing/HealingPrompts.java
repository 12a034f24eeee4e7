package com.datagate.healing;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the oracle prompt and interprets its reply.
 */
final class HealingPrompts {

    static final String SYSTEM_PROMPT = "You are a database schema expert. Suggest the most likely correct column name.";

    private static final Pattern LEADING_FILLER =
            Pattern.compile("^(?:the|suggested|correct|column(?:\\s+name)?)\\b\\s*:?\\s*", Pattern.CASE_INSENSITIVE);
    private static final String QUOTES = "\"'`";

    private HealingPrompts() {
    }

    static String buildPrompt(String failedColumn, String table, List<String> alternatives, String errorMessage) {
        String alternativesText = alternatives == null || alternatives.isEmpty() ? "none found" : String.join(", ", alternatives);
        return "A SQL query failed because column '" + failedColumn + "' does not exist in table '" + table + "'.\n\n"
                + "Error: " + errorMessage + "\n\n"
                + "Available alternative column names (based on semantic similarity): " + alternativesText + "\n\n"
                + "Based on the error and the available alternatives, suggest the MOST LIKELY correct column name "
                + "to use instead of '" + failedColumn + "'.\n\n"
                + "Respond with ONLY the column name (no quotes, no explanation, just the column name). "
                + "If none of the alternatives seem correct, respond with \"NONE\".\n\n"
                + "Suggested column:";
    }

    /**
     * Extract the column name from an oracle reply.
     *
     * @param reply raw reply
     * @return column name, or null when the reply is empty or {@code NONE}
     */
    static String parseSuggestion(String reply) {
        if (reply == null) {
            return null;
        }
        String cleaned = stripQuotes(reply);
        String previous;
        do {
            previous = cleaned;
            cleaned = stripQuotes(LEADING_FILLER.matcher(cleaned).replaceFirst(""));
        } while (!cleaned.equals(previous));

        while (cleaned.endsWith(".")) {
            cleaned = stripQuotes(cleaned.substring(0, cleaned.length() - 1));
        }
        if (cleaned.isEmpty() || "NONE".equals(cleaned.toUpperCase(Locale.ROOT))) {
            return null;
        }
        return cleaned;
    }

    /**
     * @return the alternative equal to the suggestion ignoring case, or null
     */
    static String matchAlternative(String suggestion, List<String> alternatives) {
        if (suggestion == null) {
            return null;
        }
        for (String alternative : alternatives) {
            if (alternative.equalsIgnoreCase(suggestion)) {
                return alternative;
            }
        }
        return null;
    }

    private static String stripQuotes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (Character.isWhitespace(s.charAt(start)) || QUOTES.indexOf(s.charAt(start)) >= 0)) {
            start++;
        }
        while (end > start && (Character.isWhitespace(s.charAt(end - 1)) || QUOTES.indexOf(s.charAt(end - 1)) >= 0)) {
            end--;
        }
        return s.substring(start, end);
    }
}
