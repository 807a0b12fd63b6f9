package com.labelaudit.compliance.service.rules;

import com.labelaudit.compliance.model.ComplianceResult;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.FieldStatus;
import com.labelaudit.compliance.model.MergedField;
import com.labelaudit.compliance.model.MergedRecord;
import com.labelaudit.compliance.service.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Scores a merged record against a rule catalogue.
 *
 * <p>A field is {@code present} when the record has it and the catalogue validator
 * accepts it, {@code invalid} when the record has it but the validator rejects it,
 * and {@code missing} otherwise. Only present required fields count towards the
 * score; invalid required fields are listed in {@code missing_required} and
 * reported as invalid in the per-field status.
 *
 * <p>Pure: the result depends only on the record and the catalogue.
 */
@Service
public class ComplianceRulesEngine {
    private static final Logger log = LoggerFactory.getLogger(ComplianceRulesEngine.class);

    public ComplianceResult evaluate(MergedRecord record, RuleCatalogue catalogue) {
        Map<FieldName, FieldStatus> status = new LinkedHashMap<>();
        Set<FieldName> missingRequired = new LinkedHashSet<>();
        Set<FieldName> missingOptional = new LinkedHashSet<>();
        int requiredPresent = 0;

        for (FieldRule rule : catalogue.getRules()) {
            FieldStatus s = statusOf(record, rule);
            status.put(rule.getField(), s);
            if (s == FieldStatus.PRESENT) {
                if (rule.isRequired()) requiredPresent++;
            } else if (rule.isRequired()) {
                missingRequired.add(rule.getField());
            } else {
                missingOptional.add(rule.getField());
            }
        }

        ComplianceResult result = new ComplianceResult(record.getProductIdentifier(), catalogue.getVersion(),
                requiredPresent, catalogue.getRequiredCount(), missingRequired, missingOptional, status,
                record.getTimestamp());
        log.debug("{} scored {} against {} (missing {})", record.getProductIdentifier(),
                result.getScoreLabel(), catalogue.getVersion(), missingRequired);
        return result;
    }

    private static FieldStatus statusOf(MergedRecord record, FieldRule rule) {
        MergedField field = record.getFields().get(rule.getField());
        if (field == null) return FieldStatus.MISSING;
        ValidationResult v = rule.getValidator().validate(field.getValue());
        return v.isValid() ? FieldStatus.PRESENT : FieldStatus.INVALID;
    }
}
