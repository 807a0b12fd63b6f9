package com.labelaudit.compliance.service.source;

import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.util.LabelTextUtils;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Label captions ("MRP:", "Net Wt.", "Mfg. by") that recognizers copy along with the
 * value.
 */
final class LabelPrefixes {
    private LabelPrefixes() {}

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern MANUFACTURE_DATE = Pattern.compile(
            "^\\s*(?:mfg|mfd|pkd|packed|manufactured|date\\s*of\\s*(?:mfg|manufacture|packing))\\.?\\s*(?:date|on)?\\.?\\s*[:\\-]?\\s*", FLAGS);
    private static final Pattern EXPIRY_DATE = Pattern.compile(
            "^\\s*(?:exp(?:iry)?|best\\s*before|use\\s*by)\\.?\\s*(?:date)?\\.?\\s*[:\\-]?\\s*", FLAGS);

    private static final Map<FieldName, Pattern> CAPTIONS = new EnumMap<>(FieldName.class);

    static {
        CAPTIONS.put(FieldName.MRP, Pattern.compile(
                "^\\s*(?:mrp|m\\.r\\.p\\.?|maximum\\s*retail\\s*price)\\s*(?:\\([^)]*\\))?\\s*[:\\-]?\\s*", FLAGS));
        CAPTIONS.put(FieldName.NET_QUANTITY, Pattern.compile(
                "^\\s*net\\s*(?:wt|weight|quantity|qty|content|vol(?:ume)?)\\.?\\s*[:\\-]?\\s*", FLAGS));
        CAPTIONS.put(FieldName.MANUFACTURER_NAME, Pattern.compile(
                "^\\s*(?:marketed|manufactured|mfd|mfg|packed|imported)\\.?\\s*(?:&\\s*\\w+\\.?\\s*)?by\\s*[:\\-]?\\s*", FLAGS));
        CAPTIONS.put(FieldName.CONSUMER_CARE, Pattern.compile(
                "^\\s*(?:customer\\s*care|consumer\\s*care|for\\s*feedback|helpline|e-?mail)[^:\\-]{0,20}[:\\-]\\s*", FLAGS));
        CAPTIONS.put(FieldName.COUNTRY_OF_ORIGIN, Pattern.compile(
                "^\\s*(?:country\\s*of\\s*origin|made\\s*in|product\\s*of|origin)\\s*[:\\-]?\\s*", FLAGS));
        CAPTIONS.put(FieldName.LICENSE_NUMBER, Pattern.compile(
                "^\\s*(?:fssai\\s*)?lic(?:en[cs]e)?\\.?\\s*(?:no|n0|number)?\\.?\\s*[:\\-]?\\s*", FLAGS));
        CAPTIONS.put(FieldName.BATCH_NUMBER, Pattern.compile(
                "^\\s*(?:batch|lot)\\s*(?:no|number)?\\.?\\s*[:\\-]?\\s*", FLAGS));
        CAPTIONS.put(FieldName.MANUFACTURE_DATE, MANUFACTURE_DATE);
        CAPTIONS.put(FieldName.BEST_BEFORE, EXPIRY_DATE);
    }

    /** Value without its caption; the original text when stripping would leave nothing. */
    static String strip(FieldName field, String value) {
        if (value == null) return null;
        String cleaned = LabelTextUtils.clean(value);
        Pattern caption = CAPTIONS.get(field);
        if (caption == null) return cleaned;
        String stripped = LabelTextUtils.clean(caption.matcher(cleaned).replaceFirst(""));
        return stripped.isEmpty() ? cleaned : stripped;
    }

    /** Expiry captions go to best_before; everything else is a manufacture or packing date. */
    static FieldName routeDate(String value) {
        if (value != null && EXPIRY_DATE.matcher(value).find()) return FieldName.BEST_BEFORE;
        return FieldName.MANUFACTURE_DATE;
    }
}
