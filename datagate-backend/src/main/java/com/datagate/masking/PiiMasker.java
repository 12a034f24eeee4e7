package com.datagate.masking;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks personal data (emails, phone numbers, SSNs, credit card numbers) in arbitrary JSON-like values.
 *
 * <p>Masking is pure and idempotent: {@code mask(mask(x, s), s)} equals {@code mask(x, s)}. Maps and lists
 * are copied, never mutated. Values that are neither strings, maps nor collections pass through unchanged
 * unless they sit under a sensitive-looking key.
 */
public class PiiMasker {

    public static final String MASKED_EMAIL = "***@***.com";
    public static final String REDACTED_VALUE = "***MASKED***";

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE_PATTERN =
            Pattern.compile("(?<!\\w)\\(?(\\d{3})\\)?[-.\\s]?(\\d{3})[-.\\s]?(\\d{4})(?!\\d)");
    private static final Pattern SSN_PATTERN =
            Pattern.compile("(?<!\\d)(\\d{3})-?(\\d{2})-?(\\d{4})(?!\\d)");
    private static final Pattern CREDIT_CARD_PATTERN =
            Pattern.compile("(?<!\\d)(\\d{4})[-\\s]?(\\d{4})[-\\s]?(\\d{4})[-\\s]?(\\d{4})(?!\\d)");

    private static final Set<String> SENSITIVE_KEY_MARKERS = Set.of(
            "email",
            "phone",
            "ssn",
            "social",
            "credit",
            "card",
            "pii"
    );

    private final Set<String> redactedFieldMarkers;

    public PiiMasker() {
        this(Set.of());
    }

    /**
     * Create a masker that additionally replaces values of matching fields with {@value #REDACTED_VALUE}.
     *
     * @param redactedFieldMarkers lowercase substrings of field names whose values are redacted wholesale
     */
    public PiiMasker(Set<String> redactedFieldMarkers) {
        this.redactedFieldMarkers = redactedFieldMarkers != null ? Set.copyOf(redactedFieldMarkers) : Set.of();
    }

    /**
     * Mask a value.
     *
     * @param value map, collection, array, string or scalar
     * @param level sensitivity level
     * @return masked copy with the same shape
     */
    public Object mask(Object value, SensitivityLevel level) {
        SensitivityLevel resolved = level != null ? level : SensitivityLevel.STANDARD;
        if (value instanceof Map<?, ?> map) {
            return maskMap(map, resolved);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            for (Object item : collection) {
                out.add(mask(item, resolved));
            }
            return out;
        }
        if (value instanceof Object[] array) {
            List<Object> out = new ArrayList<>(array.length);
            for (Object item : array) {
                out.add(mask(item, resolved));
            }
            return out;
        }
        if (value instanceof String s) {
            return maskString(s, resolved);
        }
        return value;
    }

    /**
     * Mask PII patterns inside a single string.
     *
     * @param text text
     * @param level sensitivity level
     * @return masked text, or the input when nothing matched
     */
    public String maskString(String text, SensitivityLevel level) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        boolean strict = level == SensitivityLevel.STRICT;

        String masked = EMAIL_PATTERN.matcher(text).replaceAll(Matcher.quoteReplacement(MASKED_EMAIL));

        masked = PHONE_PATTERN.matcher(masked).replaceAll(m -> Matcher.quoteReplacement(
                "(***) ***-" + (strict ? "****" : m.group(3))));

        masked = SSN_PATTERN.matcher(masked).replaceAll(m -> Matcher.quoteReplacement(
                "***-**-" + (strict ? "****" : m.group(3))));

        masked = CREDIT_CARD_PATTERN.matcher(masked).replaceAll(m -> Matcher.quoteReplacement(
                "****-****-****-" + (strict ? "****" : m.group(4))));

        return masked;
    }

    /**
     * Report which kinds of PII occur in a string or in the string form of a map.
     *
     * @param value string or map
     * @return detected kinds, in the order email, phone, ssn, credit_card
     */
    public List<String> detectPii(Object value) {
        String text;
        if (value instanceof String s) {
            text = s;
        } else if (value instanceof Map<?, ?> map) {
            text = map.toString();
        } else {
            return List.of();
        }

        List<String> detected = new ArrayList<>();
        if (EMAIL_PATTERN.matcher(text).find()) {
            detected.add("email");
        }
        if (PHONE_PATTERN.matcher(text).find()) {
            detected.add("phone");
        }
        if (SSN_PATTERN.matcher(text).find()) {
            detected.add("ssn");
        }
        if (CREDIT_CARD_PATTERN.matcher(text).find()) {
            detected.add("credit_card");
        }
        return detected;
    }

    private Map<Object, Object> maskMap(Map<?, ?> map, SensitivityLevel level) {
        Map<Object, Object> masked = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = e.getKey() != null ? e.getKey().toString().toLowerCase(Locale.ROOT) : "";
            Object value = e.getValue();

            if (value != null && containsAny(key, redactedFieldMarkers)) {
                masked.put(e.getKey(), REDACTED_VALUE);
            } else if (containsAny(key, SENSITIVE_KEY_MARKERS)) {
                masked.put(e.getKey(), maskSensitiveValue(value, level));
            } else {
                masked.put(e.getKey(), mask(value, level));
            }
        }
        return masked;
    }

    private Object maskSensitiveValue(Object value, SensitivityLevel level) {
        if (value instanceof Number || value instanceof CharSequence && !(value instanceof String)) {
            String text = value.toString();
            String masked = maskString(text, level);
            return masked.equals(text) ? value : masked;
        }
        return mask(value, level);
    }

    private static boolean containsAny(String key, Set<String> markers) {
        for (String marker : markers) {
            if (key.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
