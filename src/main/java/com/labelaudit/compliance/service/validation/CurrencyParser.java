package com.labelaudit.compliance.service.validation;

import com.labelaudit.compliance.util.LabelTextUtils;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a maximum retail price such as "MRP: ₹1,299.00 (incl. of all taxes)",
 * "Rs. 45", "INR 120" or a bare "499.00".
 */
public final class CurrencyParser {
    private CurrencyParser() {}

    // Amount may use western (1,299) or Indian (1,29,999) digit grouping
    private static final String AMOUNT = "(\\d{1,3}(?:,\\d{2,3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)";

    private static final Pattern MARKED_AMOUNT = Pattern.compile(
        "(?:m\\.?\\s*r\\.?\\s*p\\.?|price)?\\s*[:\\-]?\\s*(?:₹|rs\\.?|inr|rupees)\\s*[:\\-]?\\s*" + AMOUNT,
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern MRP_PREFIXED_AMOUNT = Pattern.compile(
        "m\\.?\\s*r\\.?\\s*p\\.?\\s*[:\\-]?\\s*" + AMOUNT,
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern BARE_AMOUNT = Pattern.compile("^" + AMOUNT + "(?:\\s*/-)?$");

    /**
     * Returns the positive amount, or empty when the text is not a price.
     */
    public static Optional<BigDecimal> parse(String text) {
        if (LabelTextUtils.isAbsent(text)) return Optional.empty();
        String s = LabelTextUtils.clean(text);
        String amount = firstGroup(MARKED_AMOUNT, s);
        if (amount == null) amount = firstGroup(MRP_PREFIXED_AMOUNT, s);
        if (amount == null) amount = firstGroup(BARE_AMOUNT, s);
        if (amount == null) return Optional.empty();
        try {
            BigDecimal value = new BigDecimal(amount.replace(",", ""));
            return value.signum() > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String firstGroup(Pattern pattern, String s) {
        Matcher m = pattern.matcher(s);
        return m.find() ? m.group(1) : null;
    }
}
