package com.labelaudit.compliance.service.merge;

import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.Contender;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.MergedField;
import com.labelaudit.compliance.model.MergedRecord;
import com.labelaudit.compliance.model.Quantity;
import com.labelaudit.compliance.model.SourceType;
import com.labelaudit.compliance.service.validation.FieldValidators;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.labelaudit.compliance.model.SourceType.AI_ENHANCEMENT;
import static com.labelaudit.compliance.model.SourceType.PLATFORM_METADATA;
import static com.labelaudit.compliance.model.SourceType.TEXT_RECOGNITION;
import static org.junit.jupiter.api.Assertions.*;

public class FieldMergeEngineTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");

    private final FieldMergeEngine engine = new FieldMergeEngine(MergePolicy.defaults());

    private MergeResult merge(CandidateField... candidates) {
        return engine.merge("sku-1", List.of(candidates), AT);
    }

    @Test
    public void validTextRecognitionValueBeatsMoreConfidentAiValue() {
        MergeResult r = merge(
                CandidateField.of(FieldName.MRP, "₹45", TEXT_RECOGNITION, 0.1),
                CandidateField.of(FieldName.MRP, "₹50", AI_ENHANCEMENT, 1.0));

        MergedField mrp = r.getRecord().field(FieldName.MRP).orElseThrow();
        assertEquals("₹45", mrp.getValue());
        assertEquals(TEXT_RECOGNITION, mrp.getSource());
        assertEquals(2, mrp.getContenders().size(), "losing value kept for audit");
        assertEquals(1, r.count(MergeDiagnostic.FIELD_CONFLICT));
    }

    @Test
    public void notFoundMarkerFallsBackToAiValue() {
        MergeResult r = merge(
                CandidateField.of(FieldName.COUNTRY_OF_ORIGIN, "Not Found", TEXT_RECOGNITION),
                CandidateField.of(FieldName.COUNTRY_OF_ORIGIN, "India", AI_ENHANCEMENT));

        MergedField origin = r.getRecord().field(FieldName.COUNTRY_OF_ORIGIN).orElseThrow();
        assertEquals("India", origin.getValue());
        assertEquals(AI_ENHANCEMENT, origin.getSource());
        Contender rejected = origin.getContenders().get(0);
        assertFalse(rejected.isAccepted());
        assertNotNull(rejected.getRejection());
        assertEquals(1, r.count(MergeDiagnostic.REJECTED_VALUE));
    }

    @Test
    public void unparseablePriceFallsThroughToPlatformMetadata() {
        MergeResult r = merge(
                CandidateField.of(FieldName.MRP, "MRP: abc", TEXT_RECOGNITION),
                CandidateField.of(FieldName.MRP, "not found", AI_ENHANCEMENT),
                CandidateField.of(FieldName.MRP, "₹ 120", PLATFORM_METADATA));

        MergedField mrp = r.getRecord().field(FieldName.MRP).orElseThrow();
        assertEquals("₹ 120", mrp.getValue());
        assertEquals(PLATFORM_METADATA, mrp.getSource());
    }

    @Test
    public void malformedTextFieldsFallThroughToWellFormedAiValues() {
        MergeResult r = merge(
                CandidateField.of(FieldName.COUNTRY_OF_ORIGIN, "12345", TEXT_RECOGNITION),
                CandidateField.of(FieldName.COUNTRY_OF_ORIGIN, "India", AI_ENHANCEMENT),
                CandidateField.of(FieldName.MANUFACTURER_NAME, "4 1", TEXT_RECOGNITION),
                CandidateField.of(FieldName.MANUFACTURER_NAME, "ABC Foods Pvt Ltd", AI_ENHANCEMENT),
                CandidateField.of(FieldName.BARCODE, "8901234567892", TEXT_RECOGNITION),
                CandidateField.of(FieldName.BARCODE, "8901234567890", AI_ENHANCEMENT));

        assertEquals("India", r.getRecord().value(FieldName.COUNTRY_OF_ORIGIN).orElseThrow());
        assertEquals(AI_ENHANCEMENT, r.getRecord().field(FieldName.COUNTRY_OF_ORIGIN).orElseThrow().getSource());
        assertEquals("ABC Foods Pvt Ltd", r.getRecord().value(FieldName.MANUFACTURER_NAME).orElseThrow());
        assertEquals("8901234567890", r.getRecord().value(FieldName.BARCODE).orElseThrow());
        assertEquals(3, r.count(MergeDiagnostic.REJECTED_VALUE));
    }

    @Test
    public void fieldWithoutAnyValidValueIsAbsentNotEmpty() {
        MergeResult r = merge(
                CandidateField.of(FieldName.NET_QUANTITY, "approx", TEXT_RECOGNITION),
                CandidateField.of(FieldName.NET_QUANTITY, "", AI_ENHANCEMENT),
                CandidateField.of(FieldName.MRP, "₹45", TEXT_RECOGNITION));

        assertFalse(r.getRecord().has(FieldName.NET_QUANTITY));
        assertTrue(r.getRecord().has(FieldName.MRP));
        assertEquals(1, r.count(MergeDiagnostic.NO_VALID_VALUE));
    }

    @Test
    public void higherConfidenceWinsWithinOneSource() {
        MergeResult r = merge(
                CandidateField.of(FieldName.MANUFACTURER_NAME, "ABC Foods", TEXT_RECOGNITION, 0.5),
                CandidateField.of(FieldName.MANUFACTURER_NAME, "XYZ Foods", TEXT_RECOGNITION, 0.95));

        assertEquals("XYZ Foods", r.getRecord().value(FieldName.MANUFACTURER_NAME).orElseThrow());
    }

    @Test
    public void equalConfidenceKeepsFirstEmitted() {
        MergeResult r = merge(
                CandidateField.of(FieldName.MANUFACTURER_NAME, "ABC Foods", TEXT_RECOGNITION),
                CandidateField.of(FieldName.MANUFACTURER_NAME, "XYZ Foods", TEXT_RECOGNITION, 0.9));

        assertEquals("ABC Foods", r.getRecord().value(FieldName.MANUFACTURER_NAME).orElseThrow(),
                "default text recognition confidence is 0.9, so this is a tie");
    }

    @Test
    public void identicalInputGivesIdenticalRecord() {
        List<CandidateField> input = new ArrayList<>();
        input.add(CandidateField.of(FieldName.MRP, "₹45", AI_ENHANCEMENT, 0.7));
        input.add(CandidateField.of(FieldName.MRP, "₹47", AI_ENHANCEMENT, 0.7));
        input.add(CandidateField.of(FieldName.NET_QUANTITY, "500 g", PLATFORM_METADATA));
        input.add(CandidateField.of(FieldName.COUNTRY_OF_ORIGIN, "n/a", TEXT_RECOGNITION));
        input.add(new CandidateField("ingredients", "sugar", TEXT_RECOGNITION, null));

        MergedRecord first = engine.merge("sku-1", input, AT).getRecord();
        for (int i = 0; i < 5; i++) {
            assertEquals(first, engine.merge("sku-1", input, AT).getRecord());
        }
        assertEquals("₹45", first.value(FieldName.MRP).orElseThrow());
    }

    @Test
    public void unknownFieldIsDroppedWithDiagnostic() {
        MergeResult r = merge(
                new CandidateField("ingredients", "sugar, salt", TEXT_RECOGNITION, null),
                CandidateField.of(FieldName.MRP, "₹45", TEXT_RECOGNITION));

        assertEquals(1, r.getRecord().getFields().size());
        assertEquals(1, r.count(MergeDiagnostic.UNKNOWN_FIELD));
        assertEquals("ingredients", r.getDiagnostics().get(0).getField());
    }

    @Test
    public void outOfRangeConfidenceAndMissingSourceAreDroppedNotFatal() {
        MergeResult r = merge(
                CandidateField.of(FieldName.MRP, "₹10", TEXT_RECOGNITION, 1.5),
                new CandidateField("mrp", "₹11", null, null),
                CandidateField.of(FieldName.MRP, "₹12", AI_ENHANCEMENT));

        MergedField mrp = r.getRecord().field(FieldName.MRP).orElseThrow();
        assertEquals("₹12", mrp.getValue());
        assertEquals(1, mrp.getContenders().size());
        assertEquals(2, r.count(MergeDiagnostic.MALFORMED_CANDIDATE));
    }

    @Test
    public void netQuantityCarriesParsedQuantity() {
        MergeResult r = merge(CandidateField.of(FieldName.NET_QUANTITY, "Net Wt. 500 g", TEXT_RECOGNITION));
        assertEquals(new Quantity(500, "g"), r.getRecord().field(FieldName.NET_QUANTITY).orElseThrow().getQuantity());
    }

    @Test
    public void structuredQuantityWithoutTextIsUsed() {
        CandidateField c = new CandidateField("net_quantity", null, PLATFORM_METADATA, null);
        c.setQuantity(new Quantity(1, "kg"));

        MergedField q = merge(c).getRecord().field(FieldName.NET_QUANTITY).orElseThrow();
        assertEquals("1 kg", q.getValue());
        assertEquals(new Quantity(1, "kg"), q.getQuantity());
    }

    @Test
    public void emptyOrNullInputGivesEmptyRecord() {
        assertTrue(engine.merge("sku-1", List.of(), AT).getRecord().getFields().isEmpty());
        assertTrue(engine.merge("sku-1", null, AT).getRecord().getFields().isEmpty());
    }

    @Test
    public void customPolicyOrderIsHonoured() {
        MergePolicy policy = MergePolicy.builder()
                .step(FieldName.MRP, PLATFORM_METADATA, FieldValidators.require(FieldValidators.CURRENCY))
                .step(FieldName.MRP, TEXT_RECOGNITION, FieldValidators.require(FieldValidators.CURRENCY))
                .build();
        FieldMergeEngine custom = new FieldMergeEngine(policy);

        MergeResult r = custom.merge("sku-1", List.of(
                CandidateField.of(FieldName.MRP, "₹45", TEXT_RECOGNITION),
                CandidateField.of(FieldName.MRP, "₹49", PLATFORM_METADATA),
                CandidateField.of(FieldName.COUNTRY_OF_ORIGIN, "India", TEXT_RECOGNITION)), AT);

        assertEquals(PLATFORM_METADATA, r.getRecord().field(FieldName.MRP).orElseThrow().getSource());
        assertFalse(r.getRecord().has(FieldName.COUNTRY_OF_ORIGIN), "no step declared for the field");
    }

    @Test
    public void recordKeepsTimestampAndProduct() {
        MergedRecord record = merge(CandidateField.of(FieldName.MRP, "₹45", TEXT_RECOGNITION)).getRecord();
        assertEquals(AT, record.getTimestamp());
        assertEquals("sku-1", record.getProductIdentifier());
    }
}
