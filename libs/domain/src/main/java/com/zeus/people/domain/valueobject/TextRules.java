package com.zeus.people.domain.valueobject;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Pure validation functions shared by the string-backed value objects.
 */
final class TextRules {

    private TextRules() {
        // utility class
    }

    /**
     * Checks a string against the non-empty, maximum-length and pattern rules. Length and pattern
     * are only evaluated for non-blank input.
     *
     * @param value the raw value, may be null
     * @param label capitalised label used in messages (e.g. "Room number")
     * @param maxLength maximum number of characters
     * @param pattern allowed format, or null for none
     * @param patternMessage message reported when the pattern does not match
     */
    static List<String> check(
            String value, String label, int maxLength, Pattern pattern, String patternMessage) {
        var errors = new ArrayList<String>();
        if (value == null || value.isBlank()) {
            errors.add(label + " cannot be empty");
            return errors;
        }
        if (value.length() > maxLength) {
            errors.add(label + " cannot exceed " + maxLength + " characters");
        }
        if (pattern != null && !pattern.matcher(value).matches()) {
            errors.add(patternMessage);
        }
        return errors;
    }

    /** Checks that {@code value} is non-blank and one of {@code allowed}. */
    static List<String> oneOf(String value, String label, String allowedMessage, String... allowed) {
        var errors = new ArrayList<String>();
        if (value == null || value.isBlank()) {
            errors.add(label + " cannot be empty");
            return errors;
        }
        for (String candidate : allowed) {
            if (candidate.equals(value)) {
                return errors;
            }
        }
        errors.add(allowedMessage);
        return errors;
    }
}
