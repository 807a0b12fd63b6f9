package com.labelaudit.compliance.service.source;

import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.SourceType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Adapts the AI re-reading service. Two response shapes are understood:
 * <ul>
 *   <li>short keys under {@code extracted_fields} or {@code ai_extraction}
 *   ({@code mrp}, {@code quantity}, {@code manufacturer}, {@code origin}, {@code support},
 *   {@code dates}, {@code batch}, {@code license}, {@code barcode}), with grades under
 *   {@code detailed_insights.field_confidence_scores}</li>
 *   <li>the flat structured form ({@code product_manufacturer}, {@code net_quantity},
 *   {@code expiry_date}, {@code consumer_care: {contact_email, contact_number}}, ...)</li>
 * </ul>
 * A top-level {@code confidence} map, numeric or graded, applies to either shape.
 */
@Component
public class AiEnhancementAdapter extends AbstractSourceAdapter {

    private static final Map<String, FieldName> KEYS = new LinkedHashMap<>();

    static {
        KEYS.put("mrp", FieldName.MRP);
        KEYS.put("quantity", FieldName.NET_QUANTITY);
        KEYS.put("net_quantity", FieldName.NET_QUANTITY);
        KEYS.put("manufacturer", FieldName.MANUFACTURER_NAME);
        KEYS.put("product_manufacturer", FieldName.MANUFACTURER_NAME);
        KEYS.put("manufacturer_name", FieldName.MANUFACTURER_NAME);
        KEYS.put("origin", FieldName.COUNTRY_OF_ORIGIN);
        KEYS.put("country_of_origin", FieldName.COUNTRY_OF_ORIGIN);
        KEYS.put("support", FieldName.CONSUMER_CARE);
        KEYS.put("consumer_care", FieldName.CONSUMER_CARE);
        KEYS.put("manufacture_date", FieldName.MANUFACTURE_DATE);
        KEYS.put("expiry_date", FieldName.BEST_BEFORE);
        KEYS.put("best_before", FieldName.BEST_BEFORE);
        KEYS.put("batch", FieldName.BATCH_NUMBER);
        KEYS.put("batch_number", FieldName.BATCH_NUMBER);
        KEYS.put("license", FieldName.LICENSE_NUMBER);
        KEYS.put("manufacturer_lic_number", FieldName.LICENSE_NUMBER);
        KEYS.put("license_number", FieldName.LICENSE_NUMBER);
        KEYS.put("barcode", FieldName.BARCODE);
    }

    static final String DATES_KEY = "dates";
    private static final Pattern DATE_SPLIT = Pattern.compile("\\s*[;,|]\\s*(?=[A-Za-z])");

    @Override
    public SourceType source() {
        return SourceType.AI_ENHANCEMENT;
    }

    @Override
    public List<CandidateField> adapt(Map<String, Object> payload) {
        List<CandidateField> out = new ArrayList<>();
        if (payload == null) return out;

        Map<String, Object> fields = section(payload, "extracted_fields");
        if (fields == null) fields = section(payload, "ai_extraction");
        Map<String, Object> confidences = confidences(payload);
        if (fields == null) {
            fields = new LinkedHashMap<>(payload);
            fields.remove("confidence");
        }

        for (Map.Entry<String, Object> e : fields.entrySet()) {
            String key = e.getKey();
            Double confidence = confidences == null ? null : confidence(confidences.get(key));
            Object raw = e.getValue();

            if (FieldName.CONSUMER_CARE == KEYS.get(key) && raw instanceof Map) {
                Map<?, ?> care = (Map<?, ?>) raw;
                for (Object part : new Object[]{care.get("contact_email"), care.get("contact_number")}) {
                    for (String v : values(part)) {
                        out.add(candidate(FieldName.CONSUMER_CARE, v, confidence));
                    }
                }
                continue;
            }
            if (DATES_KEY.equals(key)) {
                for (String v : values(raw)) {
                    for (String part : DATE_SPLIT.split(v)) {
                        FieldName target = LabelPrefixes.routeDate(part);
                        out.add(candidate(target, LabelPrefixes.strip(target, part), confidence));
                    }
                }
                continue;
            }
            FieldName field = KEYS.get(key);
            for (String v : values(raw)) {
                out.add(field == null
                        ? candidate(key, v, confidence)
                        : candidate(field, LabelPrefixes.strip(field, v), confidence));
            }
        }
        return out;
    }

    private static Map<String, Object> confidences(Map<String, Object> payload) {
        Map<String, Object> c = section(payload, "confidence");
        if (c != null) return c;
        Map<String, Object> insights = section(payload, "detailed_insights");
        return insights == null ? null : section(insights, "field_confidence_scores");
    }
}
