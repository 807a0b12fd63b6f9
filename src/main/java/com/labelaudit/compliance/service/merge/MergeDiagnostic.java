package com.labelaudit.compliance.service.merge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.labelaudit.compliance.model.SourceType;

/**
 * Something the merge engine noticed while reconciling candidates: a dropped
 * candidate, a rejected value, a disagreement between sources.
 *
 * <h3>Codes</h3>
 * <ul>
 *   <li><strong>UNKNOWN_FIELD</strong> - candidate names a field outside the catalogue; dropped</li>
 *   <li><strong>MALFORMED_CANDIDATE</strong> - missing source or out-of-range confidence; dropped</li>
 *   <li><strong>REJECTED_VALUE</strong> - value failed the field's format check</li>
 *   <li><strong>FIELD_CONFLICT</strong> - a losing source offered a different valid value</li>
 *   <li><strong>NO_VALID_VALUE</strong> - no source produced a usable value; field left absent</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MergeDiagnostic {
    public static final String UNKNOWN_FIELD = "UNKNOWN_FIELD";
    public static final String MALFORMED_CANDIDATE = "MALFORMED_CANDIDATE";
    public static final String REJECTED_VALUE = "REJECTED_VALUE";
    public static final String FIELD_CONFLICT = "FIELD_CONFLICT";
    public static final String NO_VALID_VALUE = "NO_VALID_VALUE";

    private final String productId;
    private final String code;
    private final String field;
    private final SourceType source;
    private final String message;
    private final String evidence;

    public MergeDiagnostic(String productId, String code, String field, SourceType source, String message, String evidence) {
        this.productId = productId;
        this.code = code;
        this.field = field;
        this.source = source;
        this.message = message;
        this.evidence = evidence;
    }

    public String getProductId() { return productId; }
    public String getCode() { return code; }
    public String getField() { return field; }
    public SourceType getSource() { return source; }
    public String getMessage() { return message; }
    public String getEvidence() { return evidence; }

    public static MergeDiagnostic unknownField(String productId, String field, SourceType source) {
        return new MergeDiagnostic(productId, UNKNOWN_FIELD, field, source,
                String.format("Field '%s' is not in the catalogue", field), null);
    }

    public static MergeDiagnostic malformed(String productId, String field, SourceType source, String reason) {
        return new MergeDiagnostic(productId, MALFORMED_CANDIDATE, field, source, reason, null);
    }

    public static MergeDiagnostic rejected(String productId, String field, SourceType source, String value, String reason) {
        return new MergeDiagnostic(productId, REJECTED_VALUE, field, source,
                String.format("Value rejected: %s", reason), value);
    }

    public static MergeDiagnostic conflict(String productId, String field, SourceType winner, String winningValue,
                                           SourceType loser, String losingValue) {
        return new MergeDiagnostic(productId, FIELD_CONFLICT, field, loser,
                String.format("%s value '%s' kept over %s value '%s'", winner, winningValue, loser, losingValue), losingValue);
    }

    public static MergeDiagnostic noValidValue(String productId, String field) {
        return new MergeDiagnostic(productId, NO_VALID_VALUE, field, null,
                String.format("No source produced a valid value for '%s'", field), null);
    }

    @Override
    public String toString() {
        return String.format("%s: %s", code, message);
    }
}
