package com.labelaudit.compliance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

public class EvaluationDtos {

    /** Outbound record of one evaluation */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EvaluationReport {
        private String product_identifier;
        private Map<String, MergedFieldView> merged_fields; // catalogue field -> winning value
        private ComplianceSummary compliance_summary;
        private ManufacturerProfileView manufacturer_profile; // absent when tracking produced no profile
        private HistoryView history;
        private List<DiagnosticView> diagnostics; // merge diagnostics, in emission order

        public String getProduct_identifier() { return product_identifier; }
        public void setProduct_identifier(String product_identifier) { this.product_identifier = product_identifier; }
        public Map<String, MergedFieldView> getMerged_fields() { return merged_fields; }
        public void setMerged_fields(Map<String, MergedFieldView> merged_fields) { this.merged_fields = merged_fields; }
        public ComplianceSummary getCompliance_summary() { return compliance_summary; }
        public void setCompliance_summary(ComplianceSummary compliance_summary) { this.compliance_summary = compliance_summary; }
        public ManufacturerProfileView getManufacturer_profile() { return manufacturer_profile; }
        public void setManufacturer_profile(ManufacturerProfileView manufacturer_profile) { this.manufacturer_profile = manufacturer_profile; }
        public HistoryView getHistory() { return history; }
        public void setHistory(HistoryView history) { this.history = history; }
        public List<DiagnosticView> getDiagnostics() { return diagnostics; }
        public void setDiagnostics(List<DiagnosticView> diagnostics) { this.diagnostics = diagnostics; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MergedFieldView {
        private String value;
        private String source; // text_recognition | ai_enhancement | platform_metadata
        private double confidence;

        public String getValue() { return value; }
        public void setValue(String value) { this.value = value; }
        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }
        public double getConfidence() { return confidence; }
        public void setConfidence(double confidence) { this.confidence = confidence; }
    }

    public static class ComplianceSummary {
        private String score; // "X/Y", required fields only
        private double score_fraction;
        private String level; // excellent | good | fair | poor
        private List<String> missing_required;
        private List<String> missing_optional;
        private List<String> invalid_fields; // found but rejected by the catalogue validator
        private Map<String, String> per_field_status; // present | missing | invalid
        private String catalogue_version;

        public String getScore() { return score; }
        public void setScore(String score) { this.score = score; }
        public double getScore_fraction() { return score_fraction; }
        public void setScore_fraction(double score_fraction) { this.score_fraction = score_fraction; }
        public String getLevel() { return level; }
        public void setLevel(String level) { this.level = level; }
        public List<String> getMissing_required() { return missing_required; }
        public void setMissing_required(List<String> missing_required) { this.missing_required = missing_required; }
        public List<String> getMissing_optional() { return missing_optional; }
        public void setMissing_optional(List<String> missing_optional) { this.missing_optional = missing_optional; }
        public List<String> getInvalid_fields() { return invalid_fields; }
        public void setInvalid_fields(List<String> invalid_fields) { this.invalid_fields = invalid_fields; }
        public Map<String, String> getPer_field_status() { return per_field_status; }
        public void setPer_field_status(Map<String, String> per_field_status) { this.per_field_status = per_field_status; }
        public String getCatalogue_version() { return catalogue_version; }
        public void setCatalogue_version(String catalogue_version) { this.catalogue_version = catalogue_version; }
    }

    public static class ManufacturerProfileView {
        private String manufacturer_key;
        private int count;
        private double mean_score;
        private String trend; // improving | declining | stable | insufficient_data

        public String getManufacturer_key() { return manufacturer_key; }
        public void setManufacturer_key(String manufacturer_key) { this.manufacturer_key = manufacturer_key; }
        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
        public double getMean_score() { return mean_score; }
        public void setMean_score(double mean_score) { this.mean_score = mean_score; }
        public String getTrend() { return trend; }
        public void setTrend(String trend) { this.trend = trend; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class HistoryView {
        private String status; // RECORDED | DUPLICATE | NOT_RECORDED | SKIPPED
        private String message;

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DiagnosticView {
        private String code;
        private String field;
        private String source;
        private String message;

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }
        public String getField() { return field; }
        public void setField(String field) { this.field = field; }
        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
    }
}
