package com.labelaudit.compliance.service.source;

import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.SourceType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TextRecognitionAdapterTest {

    private final TextRecognitionAdapter adapter = new TextRecognitionAdapter();

    private static List<String> valuesOf(List<CandidateField> candidates, String field) {
        return candidates.stream().filter(c -> field.equals(c.getField()))
                .map(CandidateField::getValue).collect(Collectors.toList());
    }

    @Test
    public void captionsAreStrippedAndKeysMapped() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("Manufacturer", List.of("Mfd. by: ABC Foods Pvt. Ltd., Pune"));
        payload.put("MRP", List.of("MRP: ₹ 120.00"));
        payload.put("Net_Weight", List.of("Net Wt. 500 g"));
        payload.put("FSSAI_License", List.of("FSSAI Lic. No. 10012345678901"));

        List<CandidateField> out = adapter.adapt(payload);

        assertEquals(List.of("ABC Foods Pvt. Ltd., Pune"), valuesOf(out, "manufacturer_name"));
        assertEquals(List.of("₹ 120.00"), valuesOf(out, "mrp"));
        assertEquals(List.of("500 g"), valuesOf(out, "net_quantity"));
        assertEquals(List.of("10012345678901"), valuesOf(out, "license_number"));
        assertTrue(out.stream().allMatch(c -> c.getSource() == SourceType.TEXT_RECOGNITION));
    }

    @Test
    public void datesAreRoutedByCaption() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("Date", List.of("Mfg: 01/2024", "Exp: 12/2025", "Best Before 9 months"));

        List<CandidateField> out = adapter.adapt(payload);

        assertEquals(List.of("01/2024"), valuesOf(out, "manufacture_date"));
        assertEquals(List.of("12/2025", "9 months"), valuesOf(out, "best_before"));
    }

    @Test
    public void confidenceMapOverridesDefault() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("MRP", List.of("₹45"));
        payload.put("Batch", List.of("B123"));
        payload.put("confidence", Map.of("MRP", 0.95, "Batch", "low"));

        List<CandidateField> out = adapter.adapt(payload);

        assertEquals(2, out.size());
        assertEquals(0.95, out.get(0).getConfidence());
        assertEquals(0.4, out.get(1).getConfidence());
    }

    @Test
    public void unknownKeysPassThroughAndEmptyPayloadIsEmpty() {
        List<CandidateField> out = adapter.adapt(Map.of("Ingredients", "sugar, salt"));
        assertEquals(1, out.size());
        assertEquals("Ingredients", out.get(0).getField());
        assertNull(out.get(0).getConfidence());

        assertTrue(adapter.adapt(null).isEmpty());
        assertTrue(adapter.adapt(Map.of()).isEmpty());
    }
}
