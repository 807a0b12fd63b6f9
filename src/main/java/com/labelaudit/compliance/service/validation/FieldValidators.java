package com.labelaudit.compliance.service.validation;

import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.Quantity;
import com.labelaudit.compliance.util.LabelTextUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registry of the validators the rule catalogue can reference by id.
 *
 * <h3>Validators</h3>
 * <ul>
 *   <li><strong>currency</strong> - positive retail price</li>
 *   <li><strong>quantity</strong> - positive magnitude with a recognized unit</li>
 *   <li><strong>text</strong> - any non-blank value</li>
 *   <li><strong>name</strong> - at least two letters</li>
 *   <li><strong>country</strong> - letters and name punctuation only</li>
 *   <li><strong>contact</strong> - e-mail address or phone number</li>
 *   <li><strong>date</strong> - calendar date, month/year or shelf life</li>
 *   <li><strong>alphanumeric</strong> - batch/lot style code</li>
 *   <li><strong>license</strong> - 14-digit licence number</li>
 *   <li><strong>gtin</strong> - barcode with a valid GS1 check digit</li>
 * </ul>
 */
public final class FieldValidators {
    private FieldValidators() {}

    public static final String CURRENCY = "currency";
    public static final String QUANTITY = "quantity";
    public static final String TEXT = "text";
    public static final String NAME = "name";
    public static final String COUNTRY = "country";
    public static final String CONTACT = "contact";
    public static final String DATE = "date";
    public static final String ALPHANUMERIC = "alphanumeric";
    public static final String LICENSE = "license";
    public static final String GTIN = "gtin";

    private static final Pattern COUNTRY_PATTERN = Pattern.compile("^[\\p{L} .&'()\\-]+$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("[\\w.+\\-]+@[\\w\\-]+(?:\\.[\\w\\-]+)+");
    private static final Pattern PHONE_PATTERN = Pattern.compile("\\+?\\d[\\d\\s\\-()]{6,}\\d");
    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9 /\\-.:#]*$");

    private static final String MONTH = "(?:jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?";
    private static final Pattern[] DATE_PATTERNS = {
        Pattern.compile("\\b\\d{4}-\\d{1,2}-\\d{1,2}\\b"),
        Pattern.compile("\\b\\d{1,2}[/\\-.]\\d{1,2}[/\\-.]\\d{2,4}\\b"),
        Pattern.compile("\\b\\d{1,2}[/\\-.]\\d{4}\\b"),
        Pattern.compile("\\b(?:\\d{1,2}\\s*)?" + MONTH + "\\s*[,'\\-]?\\s*\\d{2,4}\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b\\d+\\s*(?:months?|days?|years?|yrs?|weeks?)\\b", Pattern.CASE_INSENSITIVE)
    };

    private static final Map<String, FieldValidator> REGISTRY;

    static {
        Map<String, FieldValidator> m = new LinkedHashMap<>();
        register(m, CURRENCY, v -> CurrencyParser.parse(v).isPresent()
                ? ValidationResult.ok() : ValidationResult.fail("not a positive currency amount"));
        register(m, QUANTITY, v -> {
            Optional<Quantity> q = QuantityParser.parse(v);
            return q.map(ValidationResult::ok).orElseGet(() -> ValidationResult.fail("no magnitude with a recognized unit"));
        });
        register(m, TEXT, v -> ValidationResult.ok());
        register(m, NAME, v -> LabelTextUtils.countLetters(v) >= 2
                ? ValidationResult.ok() : ValidationResult.fail("too few letters for a name"));
        register(m, COUNTRY, v -> COUNTRY_PATTERN.matcher(v).matches() && LabelTextUtils.countLetters(v) >= 2
                ? ValidationResult.ok() : ValidationResult.fail("not a country name"));
        register(m, CONTACT, FieldValidators::validateContact);
        register(m, DATE, FieldValidators::validateDate);
        register(m, ALPHANUMERIC, v -> CODE_PATTERN.matcher(v).matches() && v.length() <= 40
                ? ValidationResult.ok() : ValidationResult.fail("not an alphanumeric code"));
        register(m, LICENSE, v -> {
            String digits = v.replaceAll("\\D", "");
            return digits.length() == 14 ? ValidationResult.ok() : ValidationResult.fail("licence number must have 14 digits");
        });
        register(m, GTIN, FieldValidators::validateGtin);
        REGISTRY = Collections.unmodifiableMap(m);
    }

    private static void register(Map<String, FieldValidator> registry, String id, Function<String, ValidationResult> check) {
        registry.put(id, new BasicValidator(id, check));
    }

    public static Optional<FieldValidator> byId(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(REGISTRY.get(id.trim().toLowerCase(Locale.ROOT)));
    }

    public static FieldValidator require(String id) {
        return byId(id).orElseThrow(() -> new IllegalArgumentException("Unknown validator: " + id));
    }

    public static Set<String> ids() {
        return REGISTRY.keySet();
    }

    /**
     * Structural check applied while merging, so a malformed value from a higher
     * priority source falls through to a well-formed one from a lower priority source.
     */
    public static FieldValidator formatCheck(FieldName field) {
        switch (field) {
            case MRP:
                return require(CURRENCY);
            case NET_QUANTITY:
                return require(QUANTITY);
            case MANUFACTURER_NAME:
                return require(NAME);
            case COUNTRY_OF_ORIGIN:
                return require(COUNTRY);
            case CONSUMER_CARE:
                return require(CONTACT);
            case MANUFACTURE_DATE:
            case BEST_BEFORE:
                return require(DATE);
            case BATCH_NUMBER:
                return require(ALPHANUMERIC);
            case LICENSE_NUMBER:
                return require(LICENSE);
            case BARCODE:
                return require(GTIN);
            default:
                return require(TEXT);
        }
    }

    private static ValidationResult validateContact(String v) {
        if (EMAIL_PATTERN.matcher(v).find()) return ValidationResult.ok();
        Matcher m = PHONE_PATTERN.matcher(v);
        while (m.find()) {
            if (LabelTextUtils.countDigits(m.group()) >= 8) return ValidationResult.ok();
        }
        return ValidationResult.fail("no e-mail address or phone number");
    }

    private static ValidationResult validateDate(String v) {
        for (Pattern p : DATE_PATTERNS) {
            if (p.matcher(v).find()) return ValidationResult.ok();
        }
        return ValidationResult.fail("no recognizable date");
    }

    static ValidationResult validateGtin(String v) {
        String digits = v.replaceAll("[\\s\\-]", "");
        if (!digits.matches("\\d{8}|\\d{12}|\\d{13}|\\d{14}")) {
            return ValidationResult.fail("barcode must have 8, 12, 13 or 14 digits");
        }
        int sum = 0;
        // GS1: weights 3,1,3,... from the rightmost digit before the check digit
        for (int i = digits.length() - 2, w = 3; i >= 0; i--, w = 4 - w) {
            sum += (digits.charAt(i) - '0') * w;
        }
        int check = (10 - (sum % 10)) % 10;
        return check == digits.charAt(digits.length() - 1) - '0'
                ? ValidationResult.ok() : ValidationResult.fail("barcode check digit mismatch");
    }

    private static final class BasicValidator implements FieldValidator {
        private final String id;
        private final Function<String, ValidationResult> check;

        BasicValidator(String id, Function<String, ValidationResult> check) {
            this.id = id;
            this.check = check;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public ValidationResult validate(String value) {
            if (value == null || LabelTextUtils.clean(value).isEmpty()) return ValidationResult.fail("empty");
            if (LabelTextUtils.isNotFoundSentinel(value)) return ValidationResult.fail("not found marker");
            return check.apply(LabelTextUtils.clean(value));
        }

        @Override
        public String toString() {
            return id;
        }
    }
}
