package com.labelaudit.compliance.service.source;

import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.FieldName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

abstract class AbstractSourceAdapter implements SourceAdapter {

    protected CandidateField candidate(FieldName field, String value, Double confidence) {
        return candidate(field.getKey(), value, confidence);
    }

    protected CandidateField candidate(String key, String value, Double confidence) {
        return new CandidateField(key, value, source(), confidence);
    }

    /** Flattens a string, number or list of them; nulls are skipped. */
    protected static List<String> values(Object raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        if (raw instanceof Collection) {
            for (Object o : (Collection<?>) raw) {
                out.addAll(values(o));
            }
        } else if (!(raw instanceof Map)) {
            out.add(String.valueOf(raw));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    protected static Map<String, Object> section(Map<String, Object> payload, String key) {
        Object o = payload.get(key);
        return o instanceof Map ? (Map<String, Object>) o : null;
    }

    /**
     * Reads a confidence as a number, a numeric string or a High/Medium/Low grade.
     * Anything else is null, meaning the source default applies. Out-of-range numbers
     * are kept so the merge engine can reject them.
     */
    protected static Double confidence(Object raw) {
        if (raw instanceof Number) return ((Number) raw).doubleValue();
        if (!(raw instanceof String)) return null;
        String s = ((String) raw).trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "high":
                return 0.9;
            case "medium":
                return 0.7;
            case "low":
                return 0.4;
            default:
                try {
                    return Double.valueOf(s);
                } catch (NumberFormatException e) {
                    return null;
                }
        }
    }
}
