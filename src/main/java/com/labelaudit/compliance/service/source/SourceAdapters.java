package com.labelaudit.compliance.service.source;

import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter registry keyed by {@link SourceType}. Every source must have exactly one
 * adapter.
 */
@Component
public class SourceAdapters {
    private static final Logger log = LoggerFactory.getLogger(SourceAdapters.class);

    private final Map<SourceType, SourceAdapter> adapters = new EnumMap<>(SourceType.class);

    public SourceAdapters(List<SourceAdapter> adapters) {
        for (SourceAdapter a : adapters) {
            SourceAdapter previous = this.adapters.put(a.source(), a);
            if (previous != null) {
                throw new IllegalStateException("Two adapters for " + a.source() + ": "
                        + previous.getClass().getSimpleName() + ", " + a.getClass().getSimpleName());
            }
        }
        for (SourceType t : SourceType.values()) {
            if (!this.adapters.containsKey(t)) throw new IllegalStateException("No adapter for " + t);
        }
    }

    public static SourceAdapters defaults() {
        return new SourceAdapters(List.of(new TextRecognitionAdapter(), new AiEnhancementAdapter(),
                new PlatformMetadataAdapter()));
    }

    public SourceAdapter adapter(SourceType source) {
        return adapters.get(source);
    }

    public List<CandidateField> adapt(SourceType source, Map<String, Object> payload) {
        return adapters.get(source).adapt(payload);
    }

    /** Candidates from every supplied payload, sources in priority order. */
    public List<CandidateField> adaptAll(Map<SourceType, Map<String, Object>> payloads) {
        List<CandidateField> out = new ArrayList<>();
        for (SourceType t : SourceType.values()) {
            Map<String, Object> payload = payloads.get(t);
            if (payload == null) continue;
            List<CandidateField> c = adapt(t, payload);
            log.debug("{} produced {} candidates", t, c.size());
            out.addAll(c);
        }
        return out;
    }
}
