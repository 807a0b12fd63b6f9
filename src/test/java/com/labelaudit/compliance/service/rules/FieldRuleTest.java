package com.labelaudit.compliance.service.rules;

import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.Requirement;
import com.labelaudit.compliance.service.validation.FieldValidators;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class FieldRuleTest {

    @Test
    public void descriptionIsStableUnderTurkishLocale() {
        FieldRule rule = new FieldRule(FieldName.LICENSE_NUMBER, Requirement.OPTIONAL,
                FieldValidators.require(FieldValidators.LICENSE));
        FieldRule required = new FieldRule(FieldName.MRP, Requirement.REQUIRED,
                FieldValidators.require(FieldValidators.CURRENCY));
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertTrue(required.toString().endsWith("(required, currency)"), required.toString());
            assertTrue(rule.toString().endsWith("(optional, license)"), rule.toString());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    public void requiredFlagFollowsRequirement() {
        assertTrue(new FieldRule(FieldName.MRP, Requirement.REQUIRED,
                FieldValidators.require(FieldValidators.CURRENCY)).isRequired());
        assertFalse(new FieldRule(FieldName.BARCODE, Requirement.OPTIONAL,
                FieldValidators.require(FieldValidators.GTIN)).isRequired());
    }
}
