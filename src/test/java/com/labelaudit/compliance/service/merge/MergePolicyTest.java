package com.labelaudit.compliance.service.merge;

import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.SourceType;
import com.labelaudit.compliance.service.validation.FieldValidators;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MergePolicyTest {

    @Test
    public void defaultsWalkSourcesInPriorityOrder() {
        MergePolicy policy = MergePolicy.defaults();
        for (FieldName field : FieldName.values()) {
            List<SourceType> order = policy.stepsFor(field).stream()
                    .map(MergeStep::getSource).collect(Collectors.toList());
            assertEquals(List.of(SourceType.TEXT_RECOGNITION, SourceType.AI_ENHANCEMENT, SourceType.PLATFORM_METADATA),
                    order, "order for " + field);
        }
    }

    @Test
    public void defaultsUseFormatChecks() {
        MergePolicy policy = MergePolicy.defaults();
        assertEquals(FieldValidators.CURRENCY, policy.stepsFor(FieldName.MRP).get(0).getValidator().getId());
        assertEquals(FieldValidators.QUANTITY,
                policy.stepFor(FieldName.NET_QUANTITY, SourceType.AI_ENHANCEMENT).orElseThrow().getValidator().getId());
    }

    @Test
    public void sourceCannotAppearTwiceForOneField() {
        MergePolicy.Builder b = MergePolicy.builder()
                .step(FieldName.MRP, SourceType.TEXT_RECOGNITION, FieldValidators.require("currency"));
        assertThrows(IllegalArgumentException.class,
                () -> b.step(FieldName.MRP, SourceType.TEXT_RECOGNITION, FieldValidators.require("text")));
    }

    @Test
    public void undeclaredFieldHasNoSteps() {
        MergePolicy policy = MergePolicy.builder().build();
        assertTrue(policy.stepsFor(FieldName.BARCODE).isEmpty());
        assertTrue(policy.stepFor(FieldName.BARCODE, SourceType.TEXT_RECOGNITION).isEmpty());
    }
}
