package com.labelaudit.compliance.util;

import java.util.Locale;
import java.util.Set;

/**
 * Utilities for cleaning raw label text before it is validated or compared.
 *
 * <p>Cleaning is conservative: it normalizes non-breaking spaces, collapses whitespace
 * and strips separator garbage left at either end by text recognition ("-", "|", ":").
 * The content in the middle of the string is not altered.
 */
public final class LabelTextUtils {
    private LabelTextUtils() {}

    /** Values sources emit when they looked for a field and did not find it. */
    private static final Set<String> NOT_FOUND = Set.of(
            "not found", "not found on package", "not found on label", "n/a", "na", "n.a.", "null", "none", "nil",
            "-", "--", "unknown", "not available", "not specified", "not mentioned", "not applicable"
    );

    public static String clean(String input) {
        if (input == null) return null;
        String s = input.replace('\u00A0', ' ');
        s = s.replaceAll("\\s+", " ").trim();
        for (int i = 0; i < 2; i++) {
            s = s.replaceAll("^(?:\\s*[|:;·•,]+\\s*)+", "");
            s = s.replaceAll("(?:\\s*[|:;·•,]+\\s*)+$", "");
        }
        return s.trim();
    }

    public static boolean isNotFoundSentinel(String value) {
        if (value == null) return false;
        String s = clean(value).toLowerCase(Locale.ROOT);
        if (s.endsWith(".") && !NOT_FOUND.contains(s)) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return NOT_FOUND.contains(s);
    }

    /** True when there is nothing usable in the value: null, blank, or a "not found" marker. */
    public static boolean isAbsent(String value) {
        return value == null || clean(value).isEmpty() || isNotFoundSentinel(value);
    }

    public static int countDigits(String value) {
        if (value == null) return 0;
        int n = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) n++;
        }
        return n;
    }

    public static int countLetters(String value) {
        if (value == null) return 0;
        int n = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isLetter(value.charAt(i))) n++;
        }
        return n;
    }
}
