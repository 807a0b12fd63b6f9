package com.labelaudit.compliance.service.source;

import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.SourceType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Adapts listing metadata scraped from a marketplace product page. The
 * "Net Quantity" detail row, when present, replaces the headline quantity.
 */
@Component
public class PlatformMetadataAdapter extends AbstractSourceAdapter {

    private static final Map<String, FieldName> KEYS = Map.of(
            "mrp", FieldName.MRP,
            "quantity", FieldName.NET_QUANTITY,
            "manufacturer", FieldName.MANUFACTURER_NAME,
            "origin", FieldName.COUNTRY_OF_ORIGIN,
            "country of origin", FieldName.COUNTRY_OF_ORIGIN);

    static final String NET_QUANTITY_ROW = "Net Quantity";
    /** Page metadata that is not a label disclosure */
    private static final Set<String> PAGE_KEYS = Set.of("title", "url", "images", "platform");

    @Override
    public SourceType source() {
        return SourceType.PLATFORM_METADATA;
    }

    @Override
    public List<CandidateField> adapt(Map<String, Object> payload) {
        List<CandidateField> out = new ArrayList<>();
        if (payload == null) return out;
        List<String> netQuantityRow = values(payload.get(NET_QUANTITY_ROW));
        boolean rowOverrides = netQuantityRow.stream().anyMatch(v -> !v.isBlank());

        for (Map.Entry<String, Object> e : payload.entrySet()) {
            String key = e.getKey();
            if (PAGE_KEYS.contains(key)) continue;
            FieldName field = NET_QUANTITY_ROW.equals(key)
                    ? FieldName.NET_QUANTITY
                    : KEYS.get(key.trim().toLowerCase(Locale.ROOT));
            if (field == FieldName.NET_QUANTITY && rowOverrides && !NET_QUANTITY_ROW.equals(key)) continue;
            for (String v : values(e.getValue())) {
                out.add(field == null ? candidate(key, v, null) : candidate(field, LabelPrefixes.strip(field, v), null));
            }
        }
        return out;
    }

    /** Listing title, used to categorize the product. */
    public static String title(Map<String, Object> payload) {
        if (payload == null) return null;
        Object t = payload.get("title");
        return t == null ? null : String.valueOf(t);
    }
}
