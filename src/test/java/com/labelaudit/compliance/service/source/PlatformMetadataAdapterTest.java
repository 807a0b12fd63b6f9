package com.labelaudit.compliance.service.source;

import com.labelaudit.compliance.model.CandidateField;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PlatformMetadataAdapterTest {

    private final PlatformMetadataAdapter adapter = new PlatformMetadataAdapter();

    private static Map<String, Object> listing() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", "ABC Masala Chips 500 g");
        payload.put("url", "https://shop.example/p/123");
        payload.put("platform", "shop");
        payload.put("mrp", "₹ 120");
        payload.put("quantity", "450 g");
        payload.put("Manufacturer", "ABC Foods");
        payload.put("Country of Origin", "India");
        payload.put("brand", "ABC");
        return payload;
    }

    private static List<String> fields(List<CandidateField> out) {
        return out.stream().map(CandidateField::getField).collect(Collectors.toList());
    }

    @Test
    public void listingKeysMapAndPageKeysAreSkipped() {
        List<CandidateField> out = adapter.adapt(listing());

        assertEquals(List.of("mrp", "net_quantity", "manufacturer_name", "country_of_origin", "brand"), fields(out));
        assertEquals("450 g", out.get(1).getValue());
        assertTrue(out.stream().allMatch(c -> c.getConfidence() == null));
    }

    @Test
    public void netQuantityRowReplacesHeadlineQuantity() {
        Map<String, Object> payload = listing();
        payload.put("Net Quantity", "500 g");

        List<CandidateField> quantities = adapter.adapt(payload).stream()
                .filter(c -> "net_quantity".equals(c.getField())).collect(Collectors.toList());
        assertEquals(1, quantities.size());
        assertEquals("500 g", quantities.get(0).getValue());
    }

    @Test
    public void blankNetQuantityRowDoesNotOverride() {
        Map<String, Object> payload = listing();
        payload.put("Net Quantity", " ");

        List<String> values = adapter.adapt(payload).stream()
                .filter(c -> "net_quantity".equals(c.getField())).map(CandidateField::getValue)
                .collect(Collectors.toList());
        assertTrue(values.contains("450 g"));
    }

    @Test
    public void titleIsReadForCategorization() {
        assertEquals("ABC Masala Chips 500 g", PlatformMetadataAdapter.title(listing()));
        assertNull(PlatformMetadataAdapter.title(Map.of()));
        assertNull(PlatformMetadataAdapter.title(null));
    }
}
