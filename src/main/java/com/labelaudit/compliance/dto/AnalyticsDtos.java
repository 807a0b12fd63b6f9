package com.labelaudit.compliance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

public class AnalyticsDtos {

    /** Detailed view of one manufacturer's scan history */
    public static class ManufacturerAnalytics {
        private String manufacturer_key;
        private String manufacturer_name; // name as printed on the most recent label
        private int total_scans;
        private int compliant_scans; // score at or above the compliant threshold
        private int non_compliant_scans;
        private double average_compliance_score;
        private String compliance_level;
        private String trend;
        private String first_seen;
        private String last_seen;
        private Map<String, Integer> required_field_missing_counts; // field -> scans missing it
        private Map<String, CategoryStats> product_categories;
        private List<ScanRecord> recent_products; // newest first

        public String getManufacturer_key() { return manufacturer_key; }
        public void setManufacturer_key(String manufacturer_key) { this.manufacturer_key = manufacturer_key; }
        public String getManufacturer_name() { return manufacturer_name; }
        public void setManufacturer_name(String manufacturer_name) { this.manufacturer_name = manufacturer_name; }
        public int getTotal_scans() { return total_scans; }
        public void setTotal_scans(int total_scans) { this.total_scans = total_scans; }
        public int getCompliant_scans() { return compliant_scans; }
        public void setCompliant_scans(int compliant_scans) { this.compliant_scans = compliant_scans; }
        public int getNon_compliant_scans() { return non_compliant_scans; }
        public void setNon_compliant_scans(int non_compliant_scans) { this.non_compliant_scans = non_compliant_scans; }
        public double getAverage_compliance_score() { return average_compliance_score; }
        public void setAverage_compliance_score(double average_compliance_score) { this.average_compliance_score = average_compliance_score; }
        public String getCompliance_level() { return compliance_level; }
        public void setCompliance_level(String compliance_level) { this.compliance_level = compliance_level; }
        public String getTrend() { return trend; }
        public void setTrend(String trend) { this.trend = trend; }
        public String getFirst_seen() { return first_seen; }
        public void setFirst_seen(String first_seen) { this.first_seen = first_seen; }
        public String getLast_seen() { return last_seen; }
        public void setLast_seen(String last_seen) { this.last_seen = last_seen; }
        public Map<String, Integer> getRequired_field_missing_counts() { return required_field_missing_counts; }
        public void setRequired_field_missing_counts(Map<String, Integer> required_field_missing_counts) { this.required_field_missing_counts = required_field_missing_counts; }
        public Map<String, CategoryStats> getProduct_categories() { return product_categories; }
        public void setProduct_categories(Map<String, CategoryStats> product_categories) { this.product_categories = product_categories; }
        public List<ScanRecord> getRecent_products() { return recent_products; }
        public void setRecent_products(List<ScanRecord> recent_products) { this.recent_products = recent_products; }
    }

    public static class CategoryStats {
        private int count;
        private double average_score;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
        public double getAverage_score() { return average_score; }
        public void setAverage_score(double average_score) { this.average_score = average_score; }
    }

    /** One row of the cross-manufacturer overview */
    public static class ManufacturerSummary {
        private String manufacturer_key;
        private int total_scans;
        private double average_compliance_score;
        private String compliance_level;
        private String trend;

        public String getManufacturer_key() { return manufacturer_key; }
        public void setManufacturer_key(String manufacturer_key) { this.manufacturer_key = manufacturer_key; }
        public int getTotal_scans() { return total_scans; }
        public void setTotal_scans(int total_scans) { this.total_scans = total_scans; }
        public double getAverage_compliance_score() { return average_compliance_score; }
        public void setAverage_compliance_score(double average_compliance_score) { this.average_compliance_score = average_compliance_score; }
        public String getCompliance_level() { return compliance_level; }
        public void setCompliance_level(String compliance_level) { this.compliance_level = compliance_level; }
        public String getTrend() { return trend; }
        public void setTrend(String trend) { this.trend = trend; }
    }

    public static class ManufacturerComparison {
        private int total_manufacturers;
        private int total_products_scanned;
        private double industry_average_compliance; // mean of manufacturer means
        private Map<String, Integer> compliance_distribution; // level -> manufacturers
        private List<ManufacturerSummary> top_performers;
        private List<ManufacturerSummary> bottom_performers;
        private List<ManufacturerSummary> all_manufacturers; // most active first

        public int getTotal_manufacturers() { return total_manufacturers; }
        public void setTotal_manufacturers(int total_manufacturers) { this.total_manufacturers = total_manufacturers; }
        public int getTotal_products_scanned() { return total_products_scanned; }
        public void setTotal_products_scanned(int total_products_scanned) { this.total_products_scanned = total_products_scanned; }
        public double getIndustry_average_compliance() { return industry_average_compliance; }
        public void setIndustry_average_compliance(double industry_average_compliance) { this.industry_average_compliance = industry_average_compliance; }
        public Map<String, Integer> getCompliance_distribution() { return compliance_distribution; }
        public void setCompliance_distribution(Map<String, Integer> compliance_distribution) { this.compliance_distribution = compliance_distribution; }
        public List<ManufacturerSummary> getTop_performers() { return top_performers; }
        public void setTop_performers(List<ManufacturerSummary> top_performers) { this.top_performers = top_performers; }
        public List<ManufacturerSummary> getBottom_performers() { return bottom_performers; }
        public void setBottom_performers(List<ManufacturerSummary> bottom_performers) { this.bottom_performers = bottom_performers; }
        public List<ManufacturerSummary> getAll_manufacturers() { return all_manufacturers; }
        public void setAll_manufacturers(List<ManufacturerSummary> all_manufacturers) { this.all_manufacturers = all_manufacturers; }
    }

    /** One recorded scan */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ScanRecord {
        private String manufacturer_key;
        private String product_identifier;
        private String product_title;
        private String category;
        private double score;
        private String catalogue_version;
        private List<String> missing_required;
        private String timestamp;

        public String getManufacturer_key() { return manufacturer_key; }
        public void setManufacturer_key(String manufacturer_key) { this.manufacturer_key = manufacturer_key; }
        public String getProduct_identifier() { return product_identifier; }
        public void setProduct_identifier(String product_identifier) { this.product_identifier = product_identifier; }
        public String getProduct_title() { return product_title; }
        public void setProduct_title(String product_title) { this.product_title = product_title; }
        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public double getScore() { return score; }
        public void setScore(double score) { this.score = score; }
        public String getCatalogue_version() { return catalogue_version; }
        public void setCatalogue_version(String catalogue_version) { this.catalogue_version = catalogue_version; }
        public List<String> getMissing_required() { return missing_required; }
        public void setMissing_required(List<String> missing_required) { this.missing_required = missing_required; }
        public String getTimestamp() { return timestamp; }
        public void setTimestamp(String timestamp) { this.timestamp = timestamp; }
    }

    /** Full history dump, oldest scan first */
    public static class HistoryExport {
        private int total_scans;
        private List<ManufacturerSummary> manufacturers;
        private List<ScanRecord> scan_history;

        public int getTotal_scans() { return total_scans; }
        public void setTotal_scans(int total_scans) { this.total_scans = total_scans; }
        public List<ManufacturerSummary> getManufacturers() { return manufacturers; }
        public void setManufacturers(List<ManufacturerSummary> manufacturers) { this.manufacturers = manufacturers; }
        public List<ScanRecord> getScan_history() { return scan_history; }
        public void setScan_history(List<ScanRecord> scan_history) { this.scan_history = scan_history; }
    }

    /** One CSV row of the history export */
    @JsonPropertyOrder({"timestamp", "manufacturer_key", "manufacturer_name", "product_identifier", "product_title",
            "category", "score", "compliance_level", "catalogue_version", "missing_required_count", "missing_required"})
    public static class ExportRow {
        private String timestamp;
        private String manufacturer_key;
        private String manufacturer_name;
        private String product_identifier;
        private String product_title;
        private String category;
        private double score;
        private String compliance_level;
        private String catalogue_version;
        private int missing_required_count;
        private String missing_required; // field keys joined by ';'

        public String getTimestamp() { return timestamp; }
        public void setTimestamp(String timestamp) { this.timestamp = timestamp; }
        public String getManufacturer_key() { return manufacturer_key; }
        public void setManufacturer_key(String manufacturer_key) { this.manufacturer_key = manufacturer_key; }
        public String getManufacturer_name() { return manufacturer_name; }
        public void setManufacturer_name(String manufacturer_name) { this.manufacturer_name = manufacturer_name; }
        public String getProduct_identifier() { return product_identifier; }
        public void setProduct_identifier(String product_identifier) { this.product_identifier = product_identifier; }
        public String getProduct_title() { return product_title; }
        public void setProduct_title(String product_title) { this.product_title = product_title; }
        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public double getScore() { return score; }
        public void setScore(double score) { this.score = score; }
        public String getCompliance_level() { return compliance_level; }
        public void setCompliance_level(String compliance_level) { this.compliance_level = compliance_level; }
        public String getCatalogue_version() { return catalogue_version; }
        public void setCatalogue_version(String catalogue_version) { this.catalogue_version = catalogue_version; }
        public int getMissing_required_count() { return missing_required_count; }
        public void setMissing_required_count(int missing_required_count) { this.missing_required_count = missing_required_count; }
        public String getMissing_required() { return missing_required; }
        public void setMissing_required(String missing_required) { this.missing_required = missing_required; }
    }
}
