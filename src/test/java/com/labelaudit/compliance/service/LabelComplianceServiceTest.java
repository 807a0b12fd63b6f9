package com.labelaudit.compliance.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labelaudit.compliance.config.ComplianceConfig;
import com.labelaudit.compliance.dto.EvaluationDtos;
import com.labelaudit.compliance.exception.HistoryPersistenceException;
import com.labelaudit.compliance.exception.InvalidCandidateException;
import com.labelaudit.compliance.exception.RuleCatalogueException;
import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.ManufacturerHistoryEntry;
import com.labelaudit.compliance.model.ManufacturerProfile;
import com.labelaudit.compliance.model.SourceType;
import com.labelaudit.compliance.service.history.HistoryStore;
import com.labelaudit.compliance.service.history.InMemoryHistoryStore;
import com.labelaudit.compliance.service.history.ManufacturerTracker;
import com.labelaudit.compliance.service.history.TrendCalculator;
import com.labelaudit.compliance.service.merge.FieldMergeEngine;
import com.labelaudit.compliance.service.merge.MergeDiagnostic;
import com.labelaudit.compliance.service.merge.MergePolicy;
import com.labelaudit.compliance.service.rules.ComplianceRulesEngine;
import com.labelaudit.compliance.service.rules.RuleCatalogue;
import com.labelaudit.compliance.service.rules.RuleCatalogueLoader;
import com.labelaudit.compliance.service.source.SourceAdapters;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class LabelComplianceServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static RuleCatalogue catalogue;

    private final InMemoryHistoryStore store = new InMemoryHistoryStore();

    @BeforeAll
    static void loadCatalogue() {
        catalogue = new RuleCatalogueLoader(ComplianceConfig.defaultObjectMapper(), new DefaultResourceLoader())
                .load("classpath:rule-catalogue.json");
    }

    private LabelComplianceService service(HistoryStore historyStore, RuleCatalogue ruleCatalogue) {
        return new LabelComplianceService(SourceAdapters.defaults(),
                new FieldMergeEngine(MergePolicy.defaults()), new ComplianceRulesEngine(),
                ruleCatalogue, new ManufacturerTracker(historyStore, new TrendCalculator(5, 0.01)),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private LabelComplianceService service() {
        return service(store, catalogue);
    }

    private static List<CandidateField> fullLabel() {
        Map<String, Object> text = new LinkedHashMap<>();
        text.put("Manufacturer", List.of("Mfd. by: ABC Foods Pvt. Ltd., Plot 4, MIDC, Pune"));
        text.put("MRP", List.of("MRP: ₹ 120.00"));
        text.put("Net_Weight", List.of("Net Wt. 500 g"));
        text.put("Country_Of_Origin", List.of("Made in India"));
        text.put("Date", List.of("Mfg: 01/2024", "Exp: 12/2025"));
        Map<String, Object> ai = new LinkedHashMap<>();
        ai.put("mrp", "₹ 125");
        ai.put("support", "care@abcfoods.in");
        ai.put("ingredients", "potato, oil");
        Map<SourceType, Map<String, Object>> payloads = new EnumMap<>(SourceType.class);
        payloads.put(SourceType.TEXT_RECOGNITION, text);
        payloads.put(SourceType.AI_ENHANCEMENT, ai);
        return SourceAdapters.defaults().adaptAll(payloads);
    }

    @Test
    public void fullLabelIsCompliantAndTracked() {
        EvaluationDtos.EvaluationReport report = service().evaluateNow(
                new EvaluationRequest("https://shop.example/p/1", fullLabel()).title("ABC Masala Snack"));

        EvaluationDtos.ComplianceSummary summary = report.getCompliance_summary();
        assertEquals("4/4", summary.getScore());
        assertEquals("excellent", summary.getLevel());
        assertTrue(summary.getMissing_required().isEmpty());
        assertEquals("lm-2011.1", summary.getCatalogue_version());
        assertEquals("present", summary.getPer_field_status().get("consumer_care"));

        EvaluationDtos.MergedFieldView mrp = report.getMerged_fields().get("mrp");
        assertEquals("₹ 120.00", mrp.getValue());
        assertEquals("text_recognition", mrp.getSource());

        assertEquals("RECORDED", report.getHistory().getStatus());
        assertEquals("abc foods", report.getManufacturer_profile().getManufacturer_key());
        assertEquals(1, report.getManufacturer_profile().getCount());
        assertEquals("insufficient_data", report.getManufacturer_profile().getTrend());

        assertTrue(report.getDiagnostics().stream().anyMatch(d -> MergeDiagnostic.FIELD_CONFLICT.equals(d.getCode())));
        assertTrue(report.getDiagnostics().stream().anyMatch(d -> MergeDiagnostic.UNKNOWN_FIELD.equals(d.getCode())
                && "ingredients".equals(d.getField())));
    }

    @Test
    public void rawPayloadsAreAdaptedAndListingTitleCategorizes() {
        Map<SourceType, Map<String, Object>> payloads = new EnumMap<>(SourceType.class);
        payloads.put(SourceType.TEXT_RECOGNITION, Map.of(
                "Manufacturer", List.of("Mfd. by: ABC Foods Pvt. Ltd., Pune"),
                "MRP", List.of("MRP: ₹ 45")));
        payloads.put(SourceType.PLATFORM_METADATA, Map.of(
                "title", "ABC Masala Snack 200 g", "quantity", "200 g", "origin", "India"));

        EvaluationDtos.EvaluationReport report = service().evaluate("sku-20", payloads).block();

        assertNotNull(report);
        assertEquals("4/4", report.getCompliance_summary().getScore());
        assertFalse(report.getMerged_fields().containsKey("title"));
        ManufacturerHistoryEntry stored = store.readEntries("abc foods").get(0);
        assertEquals("ABC Masala Snack 200 g", stored.getProductTitle());
        assertEquals("Food & Beverages", stored.getCategory().getLabel());
    }

    @Test
    public void missingPayloadsGiveEmptyRequest() {
        EvaluationRequest request = service().requestFor("sku-21", null);
        assertTrue(request.getCandidates().isEmpty());
        assertNull(request.getProductTitle());
    }

    @Test
    public void partialLabelWithoutManufacturerSkipsHistory() {
        List<CandidateField> candidates = List.of(
                CandidateField.of(FieldName.MRP, "₹45", SourceType.TEXT_RECOGNITION),
                CandidateField.of(FieldName.NET_QUANTITY, "200 g", SourceType.PLATFORM_METADATA));

        EvaluationDtos.EvaluationReport report = service().evaluateNow(new EvaluationRequest("sku-2", candidates));

        assertEquals("2/4", report.getCompliance_summary().getScore());
        assertEquals(List.of("manufacturer_name", "country_of_origin"), report.getCompliance_summary().getMissing_required());
        assertEquals("SKIPPED", report.getHistory().getStatus());
        assertNull(report.getManufacturer_profile());
        assertTrue(store.manufacturerKeys().isEmpty());
    }

    @Test
    public void callerSuppliedManufacturerWins() {
        EvaluationDtos.EvaluationReport report = service().evaluateNow(
                new EvaluationRequest("sku-3", fullLabel()).manufacturer("XYZ Foods Limited"));

        assertEquals("xyz foods", report.getManufacturer_profile().getManufacturer_key());
        assertEquals(Set.of("xyz foods"), store.manufacturerKeys());
    }

    @Test
    public void historyFailureDoesNotLoseTheResult() {
        HistoryStore broken = new InMemoryHistoryStore() {
            @Override
            public void append(ManufacturerHistoryEntry entry) {
                throw new HistoryPersistenceException("disk full");
            }
        };

        EvaluationDtos.EvaluationReport report = service(broken, catalogue)
                .evaluateNow(new EvaluationRequest("sku-4", fullLabel()));

        assertEquals("4/4", report.getCompliance_summary().getScore());
        assertEquals("NOT_RECORDED", report.getHistory().getStatus());
        assertTrue(report.getHistory().getMessage().contains("disk full"));
        assertNull(report.getManufacturer_profile());
    }

    @Test
    public void blankProductIdentifierIsRejectedBeforeAnythingRuns() {
        assertThrows(InvalidCandidateException.class,
                () -> service().evaluateNow(new EvaluationRequest("  ", fullLabel())));
        assertThrows(InvalidCandidateException.class, () -> service().evaluateNow(null));
        assertTrue(store.manufacturerKeys().isEmpty());
    }

    @Test
    public void missingCatalogueFailsEvaluation() {
        assertThrows(RuleCatalogueException.class,
                () -> service(store, null).evaluateNow(new EvaluationRequest("sku-5", fullLabel())));
        assertTrue(store.manufacturerKeys().isEmpty());
    }

    @Test
    public void timestampDefaultsToClock() {
        Evaluation evaluation = service().run(new EvaluationRequest("sku-6", fullLabel()));

        assertEquals(NOW, evaluation.getCompliance().getEvaluatedAt());
        assertEquals(NOW, store.readEntries("abc foods").get(0).getTimestamp());
    }

    @Test
    public void resubmittingSameScanIsDuplicate() {
        LabelComplianceService service = service();
        Instant at = Instant.parse("2024-04-01T08:00:00Z");
        service.evaluateNow(new EvaluationRequest("sku-7", fullLabel()).at(at));
        EvaluationDtos.EvaluationReport again = service.evaluateNow(new EvaluationRequest("sku-7", fullLabel()).at(at));

        assertEquals("DUPLICATE", again.getHistory().getStatus());
        assertEquals(1, again.getManufacturer_profile().getCount());
        assertEquals(1, store.readEntries("abc foods").size());
    }

    @Test
    public void reactiveEvaluationEmitsReport() {
        EvaluationDtos.EvaluationReport report = service()
                .evaluate(new EvaluationRequest("sku-8", fullLabel()))
                .block();

        assertNotNull(report);
        assertEquals("sku-8", report.getProduct_identifier());
    }

    @Test
    public void reportSerializesWithSnakeCaseKeys() throws Exception {
        ObjectMapper mapper = ComplianceConfig.defaultObjectMapper();
        EvaluationDtos.EvaluationReport report = service().evaluateNow(new EvaluationRequest("sku-9", fullLabel()));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(report));
        assertEquals("sku-9", json.path("product_identifier").asText());
        assertEquals("4/4", json.path("compliance_summary").path("score").asText());
        assertTrue(json.path("compliance_summary").has("per_field_status"));
        assertEquals("abc foods", json.path("manufacturer_profile").path("manufacturer_key").asText());
        assertEquals("text_recognition", json.path("merged_fields").path("net_quantity").path("source").asText());
    }

    @Test
    public void manufacturerComesFromLabelCompanyName() {
        EvaluationRequest request = new EvaluationRequest("sku-10", List.of());
        assertNull(LabelComplianceService.manufacturerOf(request,
                new FieldMergeEngine(MergePolicy.defaults()).merge("sku-10", List.of(), NOW).getRecord()));

        List<CandidateField> label = List.of(CandidateField.of(FieldName.MANUFACTURER_NAME,
                "ABC Foods Pvt. Ltd., Plot 4, Pune", SourceType.TEXT_RECOGNITION));
        assertEquals("ABC Foods Pvt. Ltd.", LabelComplianceService.manufacturerOf(request,
                new FieldMergeEngine(MergePolicy.defaults()).merge("sku-10", label, NOW).getRecord()));
        assertEquals(Optional.of("abc foods"),
                com.labelaudit.compliance.service.history.ManufacturerKeyNormalizer.normalize("ABC Foods Pvt. Ltd."));
    }

    @Test
    public void profileAccumulatesAcrossProducts() {
        LabelComplianceService service = service();
        service.evaluateNow(new EvaluationRequest("sku-11", fullLabel()).at(NOW.minusSeconds(60)));
        EvaluationDtos.EvaluationReport second = service.evaluateNow(new EvaluationRequest("sku-12", List.of(
                CandidateField.of(FieldName.MANUFACTURER_NAME, "ABC Foods Ltd", SourceType.AI_ENHANCEMENT),
                CandidateField.of(FieldName.MRP, "₹45", SourceType.AI_ENHANCEMENT))));

        assertEquals(2, second.getManufacturer_profile().getCount());
        assertEquals(0.75, second.getManufacturer_profile().getMean_score(), 1e-9);
        ManufacturerProfile stored = store.readAggregate("abc foods").orElseThrow();
        assertEquals(2, stored.getCount());
    }
}
