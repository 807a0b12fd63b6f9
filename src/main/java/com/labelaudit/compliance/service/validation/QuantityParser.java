package com.labelaudit.compliance.service.validation;

import com.labelaudit.compliance.model.Quantity;
import com.labelaudit.compliance.util.LabelTextUtils;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a declared net quantity ("Net Wt. 500 g", "1.5 L", "1,000 ml", "10 pcs")
 * from label text.
 */
public final class QuantityParser {
    private QuantityParser() {}

    // Thousands-grouped numbers first so "1,000 g" is not read as 1.0 g
    private static final Pattern QUANTITY_PATTERN = Pattern.compile(
        "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:[.,]\\d+)?)\\s*" +
        "(kgs?|kilograms?|grams?|gms?|gr|g|mg|ml|millilitres?|milliliters?|ltrs?|litres?|liters?|l|" +
        "pcs|pc|pieces?|packs?|units?|tablets?|capsules?|nos?)\\b\\.?",
        Pattern.CASE_INSENSITIVE
    );

    private static final Map<String, String> CANONICAL_UNITS = Map.ofEntries(
        Map.entry("kg", "kg"), Map.entry("kgs", "kg"), Map.entry("kilogram", "kg"), Map.entry("kilograms", "kg"),
        Map.entry("g", "g"), Map.entry("gm", "g"), Map.entry("gms", "g"), Map.entry("gr", "g"),
        Map.entry("gram", "g"), Map.entry("grams", "g"),
        Map.entry("mg", "mg"),
        Map.entry("ml", "ml"), Map.entry("millilitre", "ml"), Map.entry("millilitres", "ml"),
        Map.entry("milliliter", "ml"), Map.entry("milliliters", "ml"),
        Map.entry("l", "l"), Map.entry("ltr", "l"), Map.entry("ltrs", "l"), Map.entry("litre", "l"),
        Map.entry("litres", "l"), Map.entry("liter", "l"), Map.entry("liters", "l"),
        Map.entry("pcs", "pcs"), Map.entry("pc", "pcs"), Map.entry("piece", "pcs"), Map.entry("pieces", "pcs"),
        Map.entry("pack", "pcs"), Map.entry("packs", "pcs"), Map.entry("unit", "pcs"), Map.entry("units", "pcs"),
        Map.entry("tablet", "pcs"), Map.entry("tablets", "pcs"), Map.entry("capsule", "pcs"),
        Map.entry("capsules", "pcs"), Map.entry("no", "pcs"), Map.entry("nos", "pcs")
    );

    /**
     * Returns the first positive quantity found in the text.
     */
    public static Optional<Quantity> parse(String text) {
        if (LabelTextUtils.isAbsent(text)) return Optional.empty();
        Matcher matcher = QUANTITY_PATTERN.matcher(text);
        while (matcher.find()) {
            String number = matcher.group(1);
            String unit = CANONICAL_UNITS.get(matcher.group(2).toLowerCase(Locale.ROOT));
            if (unit == null) continue;
            double magnitude = Double.parseDouble(normalizeNumber(number));
            if (magnitude > 0 && Double.isFinite(magnitude)) {
                return Optional.of(new Quantity(magnitude, unit));
            }
        }
        return Optional.empty();
    }

    static String normalizeNumber(String number) {
        if (number.matches("\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?")) {
            return number.replace(",", "");
        }
        return number.replace(",", ".");
    }
}
