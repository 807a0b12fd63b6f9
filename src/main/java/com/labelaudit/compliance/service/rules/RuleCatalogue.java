package com.labelaudit.compliance.service.rules;

import com.labelaudit.compliance.exception.RuleCatalogueException;
import com.labelaudit.compliance.model.FieldName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Versioned, immutable set of field rules. Rule order is the order the catalogue
 * file declares them in and is the order of every collection in a
 * {@link com.labelaudit.compliance.model.ComplianceResult}.
 *
 * <p>A catalogue without a version, without rules, or without a single required
 * field cannot be constructed: scoring against it would report perfect compliance.
 */
public final class RuleCatalogue {
    private final String version;
    private final List<FieldRule> rules;
    private final int requiredCount;

    public RuleCatalogue(String version, List<FieldRule> rules) {
        if (version == null || version.isBlank()) {
            throw new RuleCatalogueException("Rule catalogue has no version");
        }
        if (rules == null || rules.isEmpty()) {
            throw new RuleCatalogueException("Rule catalogue " + version + " declares no fields");
        }
        Set<FieldName> seen = new HashSet<>();
        int required = 0;
        for (FieldRule r : rules) {
            if (!seen.add(r.getField())) {
                throw new RuleCatalogueException("Rule catalogue " + version + " declares " + r.getField() + " twice");
            }
            if (r.isRequired()) required++;
        }
        if (required == 0) {
            throw new RuleCatalogueException("Rule catalogue " + version + " has no required fields");
        }
        this.version = version.trim();
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.requiredCount = required;
    }

    public String getVersion() { return version; }
    public List<FieldRule> getRules() { return rules; }

    /** Denominator of every score computed against this catalogue. */
    public int getRequiredCount() { return requiredCount; }

    public List<FieldName> requiredFields() {
        List<FieldName> out = new ArrayList<>();
        for (FieldRule r : rules) {
            if (r.isRequired()) out.add(r.getField());
        }
        return out;
    }

    @Override
    public String toString() {
        return "RuleCatalogue{" + version + ", " + rules + "}";
    }
}
