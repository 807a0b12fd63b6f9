package com.labelaudit.compliance.service.source;

import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.SourceType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adapts the pattern-based extraction run over recognized label text. Each known key
 * maps to a list of matched snippets, e.g.
 * {@code {"MRP": ["MRP: ₹ 120.00"], "Date": ["Mfg: 01/2024", "Exp: 12/2025"]}}.
 * An optional {@code confidence} map keyed the same way overrides the source default.
 */
@Component
public class TextRecognitionAdapter extends AbstractSourceAdapter {

    private static final Map<String, FieldName> KEYS = Map.of(
            "Manufacturer", FieldName.MANUFACTURER_NAME,
            "Net_Weight", FieldName.NET_QUANTITY,
            "MRP", FieldName.MRP,
            "Consumer_Care", FieldName.CONSUMER_CARE,
            "Country_Of_Origin", FieldName.COUNTRY_OF_ORIGIN,
            "FSSAI_License", FieldName.LICENSE_NUMBER,
            "Batch", FieldName.BATCH_NUMBER,
            "Barcode", FieldName.BARCODE);

    static final String DATE_KEY = "Date";
    static final String CONFIDENCE_KEY = "confidence";

    @Override
    public SourceType source() {
        return SourceType.TEXT_RECOGNITION;
    }

    @Override
    public List<CandidateField> adapt(Map<String, Object> payload) {
        List<CandidateField> out = new ArrayList<>();
        if (payload == null) return out;
        Map<String, Object> confidences = section(payload, CONFIDENCE_KEY);

        for (Map.Entry<String, Object> e : payload.entrySet()) {
            String key = e.getKey();
            if (CONFIDENCE_KEY.equals(key)) continue;
            Double confidence = confidences == null ? null : confidence(confidences.get(key));

            if (DATE_KEY.equals(key)) {
                for (String v : values(e.getValue())) {
                    FieldName target = LabelPrefixes.routeDate(v);
                    out.add(candidate(target, LabelPrefixes.strip(target, v), confidence));
                }
                continue;
            }
            FieldName field = KEYS.get(key);
            for (String v : values(e.getValue())) {
                out.add(field == null
                        ? candidate(key, v, confidence)
                        : candidate(field, LabelPrefixes.strip(field, v), confidence));
            }
        }
        return out;
    }
}
