package com.labelaudit.compliance.service.rules;

import com.labelaudit.compliance.config.ComplianceConfig;
import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.ComplianceLevel;
import com.labelaudit.compliance.model.ComplianceResult;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.FieldStatus;
import com.labelaudit.compliance.model.MergedField;
import com.labelaudit.compliance.model.MergedRecord;
import com.labelaudit.compliance.model.SourceType;
import com.labelaudit.compliance.service.merge.FieldMergeEngine;
import com.labelaudit.compliance.service.merge.MergePolicy;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ComplianceRulesEngineTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");

    private static RuleCatalogue catalogue;
    private final FieldMergeEngine mergeEngine = new FieldMergeEngine(MergePolicy.defaults());
    private final ComplianceRulesEngine engine = new ComplianceRulesEngine();

    @BeforeAll
    static void loadCatalogue() {
        catalogue = new RuleCatalogueLoader(ComplianceConfig.defaultObjectMapper(), new DefaultResourceLoader())
                .load("classpath:rule-catalogue.json");
    }

    private MergedRecord record(String... fieldValuePairs) {
        List<CandidateField> candidates = new ArrayList<>();
        for (int i = 0; i < fieldValuePairs.length; i += 2) {
            candidates.add(new CandidateField(fieldValuePairs[i], fieldValuePairs[i + 1], SourceType.TEXT_RECOGNITION, null));
        }
        return mergeEngine.merge("sku-7", candidates, AT).getRecord();
    }

    @Test
    public void twoOfFourRequiredFields() {
        ComplianceResult r = engine.evaluate(record("mrp", "₹45", "net_quantity", "500 g"), catalogue);

        assertEquals("2/4", r.getScoreLabel());
        assertEquals(0.5, r.getScore(), 1e-9);
        assertEquals(ComplianceLevel.FAIR, r.getLevel());
        assertEquals(List.of(FieldName.MANUFACTURER_NAME, FieldName.COUNTRY_OF_ORIGIN), new ArrayList<>(r.getMissingRequired()));
        assertEquals("lm-2011.1", r.getCatalogueVersion());
        assertEquals(AT, r.getEvaluatedAt());
    }

    @Test
    public void presentButMalformedFieldIsInvalidAndCountsAsMissing() {
        MergedRecord merged = record("mrp", "₹45", "net_quantity", "500 g", "manufacturer_name", "ABC Foods Pvt. Ltd.");
        Map<FieldName, MergedField> fields = new EnumMap<>(merged.getFields());
        fields.put(FieldName.COUNTRY_OF_ORIGIN, new MergedField(FieldName.COUNTRY_OF_ORIGIN, "12345", null,
                SourceType.PLATFORM_METADATA, 0.8, List.of()));
        ComplianceResult r = engine.evaluate(new MergedRecord("sku-7", fields, AT), catalogue);

        assertEquals("3/4", r.getScoreLabel());
        assertEquals(FieldStatus.INVALID, r.statusOf(FieldName.COUNTRY_OF_ORIGIN));
        assertTrue(r.getMissingRequired().contains(FieldName.COUNTRY_OF_ORIGIN));
        assertEquals(List.of(FieldName.COUNTRY_OF_ORIGIN), new ArrayList<>(r.getInvalidFields()));
    }

    @Test
    public void malformedValueRejectedWhileMergingIsMissing() {
        ComplianceResult r = engine.evaluate(record(
                "mrp", "₹45", "net_quantity", "500 g", "manufacturer_name", "ABC Foods Pvt. Ltd.",
                "country_of_origin", "12345"), catalogue);

        assertEquals("3/4", r.getScoreLabel());
        assertEquals(FieldStatus.MISSING, r.statusOf(FieldName.COUNTRY_OF_ORIGIN));
        assertTrue(r.getInvalidFields().isEmpty());
    }

    @Test
    public void allRequiredFieldsGiveExcellent() {
        ComplianceResult r = engine.evaluate(record(
                "mrp", "MRP Rs. 120.00", "net_quantity", "1 kg", "manufacturer_name", "ABC Foods",
                "country_of_origin", "India", "barcode", "4006381333931"), catalogue);

        assertEquals("4/4", r.getScoreLabel());
        assertEquals(ComplianceLevel.EXCELLENT, r.getLevel());
        assertTrue(r.getMissingRequired().isEmpty());
        assertEquals(FieldStatus.PRESENT, r.statusOf(FieldName.BARCODE));
        assertFalse(r.getMissingOptional().contains(FieldName.BARCODE));
        assertTrue(r.getMissingOptional().contains(FieldName.BATCH_NUMBER));
    }

    @Test
    public void emptyRecordScoresZero() {
        ComplianceResult r = engine.evaluate(record(), catalogue);
        assertEquals("0/4", r.getScoreLabel());
        assertEquals(ComplianceLevel.POOR, r.getLevel());
        assertEquals(10, r.getPerFieldStatus().size());
        assertEquals(6, r.getMissingOptional().size());
    }

    @Test
    public void statusFollowsCatalogueOrder() {
        ComplianceResult r = engine.evaluate(record("barcode", "4006381333931"), catalogue);
        List<FieldName> order = new ArrayList<>(r.getPerFieldStatus().keySet());
        assertEquals(FieldName.MRP, order.get(0));
        assertEquals(FieldName.BARCODE, order.get(order.size() - 1));
    }

    @Test
    public void evaluationIsDeterministic() {
        MergedRecord rec = record("mrp", "₹45", "country_of_origin", "India", "consumer_care", "care@abc.in");
        ComplianceResult first = engine.evaluate(rec, catalogue);
        for (int i = 0; i < 3; i++) {
            assertEquals(first, engine.evaluate(rec, catalogue));
        }
    }
}
