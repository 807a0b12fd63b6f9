package com.labelaudit.compliance.service.history;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Folds a manufacturer name printed on a label into a stable identity, so that
 * "ABC Foods Pvt. Ltd." and "abc foods" land in the same history.
 */
public final class ManufacturerKeyNormalizer {
    private ManufacturerKeyNormalizer() {}

    private static final Pattern LEGAL_SUFFIX = Pattern.compile(
            "\\s(?:ltd|limited|inc|incorporated|corp|corporation|pvt|private|co|company|llc|llp|gmbh)$");
    private static final Pattern PUNCTUATION = Pattern.compile("[,.\\-()]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Company name from a printed manufacturer line, which usually continues with an
     * address after the first comma: "ABC Foods Pvt. Ltd., Plot 4, Pune" gives
     * "ABC Foods Pvt. Ltd.".
     */
    public static String companyName(String labelLine) {
        if (labelLine == null) return null;
        String line = labelLine.trim();
        int comma = line.indexOf(',');
        if (comma < 0) return line;
        String head = line.substring(0, comma).trim();
        return head.chars().filter(Character::isLetter).count() >= 2 ? head : line;
    }

    /** Normalized key, or empty when the name carries no identity. */
    public static Optional<String> normalize(String name) {
        if (name == null) return Optional.empty();
        String key = name.replace('\u00A0', ' ').toLowerCase(Locale.ROOT);
        key = PUNCTUATION.matcher(key).replaceAll(" ");
        key = WHITESPACE.matcher(key).replaceAll(" ").trim();
        // "abc foods pvt. ltd." loses both suffixes; a bare suffix stays as the key
        String stripped = key;
        while (true) {
            String next = LEGAL_SUFFIX.matcher(stripped).replaceFirst("").trim();
            if (next.equals(stripped) || next.isEmpty()) break;
            stripped = next;
        }
        return stripped.isEmpty() ? Optional.empty() : Optional.of(stripped);
    }
}
