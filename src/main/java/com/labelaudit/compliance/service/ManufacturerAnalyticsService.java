package com.labelaudit.compliance.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.labelaudit.compliance.config.ComplianceProperties;
import com.labelaudit.compliance.dto.AnalyticsDtos;
import com.labelaudit.compliance.model.ComplianceLevel;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.ManufacturerHistoryEntry;
import com.labelaudit.compliance.model.ManufacturerProfile;
import com.labelaudit.compliance.model.ProductCategory;
import com.labelaudit.compliance.service.history.ManufacturerKeyNormalizer;
import com.labelaudit.compliance.service.history.ManufacturerTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only reporting over recorded manufacturer history: per-manufacturer
 * analytics, a cross-manufacturer comparison, a filtered scan log and a full
 * JSON or CSV export.
 */
@Service
public class ManufacturerAnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(ManufacturerAnalyticsService.class);

    static final int RECENT_PRODUCTS = 10;
    static final int PERFORMERS = 5;

    private static final CsvMapper CSV = new CsvMapper();
    private static final CsvSchema EXPORT_SCHEMA = CSV.schemaFor(AnalyticsDtos.ExportRow.class).withHeader();

    private final ManufacturerTracker tracker;
    private final double compliantThreshold;
    private final ObjectMapper objectMapper;

    @Autowired
    public ManufacturerAnalyticsService(ManufacturerTracker tracker, ComplianceProperties properties,
                                        ObjectMapper objectMapper) {
        this(tracker, properties.getCompliantThreshold(), objectMapper);
    }

    public ManufacturerAnalyticsService(ManufacturerTracker tracker, double compliantThreshold,
                                        ObjectMapper objectMapper) {
        this.tracker = tracker;
        this.compliantThreshold = compliantThreshold;
        this.objectMapper = objectMapper;
    }

    /** Empty when nothing has been recorded for the manufacturer. */
    public Optional<AnalyticsDtos.ManufacturerAnalytics> analytics(String manufacturerName) {
        List<ManufacturerHistoryEntry> entries = tracker.entries(manufacturerName);
        if (entries.isEmpty()) return Optional.empty();
        ManufacturerProfile profile = tracker.profile(manufacturerName);
        List<ManufacturerHistoryEntry> newestFirst = newestFirst(entries);

        AnalyticsDtos.ManufacturerAnalytics a = new AnalyticsDtos.ManufacturerAnalytics();
        a.setManufacturer_key(profile.getManufacturerKey());
        a.setManufacturer_name(newestFirst.get(0).getManufacturerName());
        a.setTotal_scans(profile.getCount());
        int compliant = 0;
        for (ManufacturerHistoryEntry e : entries) {
            if (e.getScore() >= compliantThreshold) compliant++;
        }
        a.setCompliant_scans(compliant);
        a.setNon_compliant_scans(entries.size() - compliant);
        a.setAverage_compliance_score(profile.getMeanScore());
        a.setCompliance_level(ComplianceLevel.of(profile.getMeanScore()).key());
        a.setTrend(profile.getTrend().key());
        a.setFirst_seen(profile.getFirstSeen() == null ? null : profile.getFirstSeen().toString());
        a.setLast_seen(profile.getLastSeen() == null ? null : profile.getLastSeen().toString());

        Map<String, Integer> missing = new LinkedHashMap<>();
        for (ManufacturerHistoryEntry e : entries) {
            for (FieldName f : e.getMissingRequired()) {
                missing.merge(f.getKey(), 1, Integer::sum);
            }
        }
        a.setRequired_field_missing_counts(missing);

        Map<String, List<ManufacturerHistoryEntry>> byCategory = new LinkedHashMap<>();
        for (ManufacturerHistoryEntry e : entries) {
            byCategory.computeIfAbsent(e.getCategory().getLabel(), k -> new ArrayList<>()).add(e);
        }
        Map<String, AnalyticsDtos.CategoryStats> categories = new LinkedHashMap<>();
        byCategory.forEach((label, list) -> {
            AnalyticsDtos.CategoryStats s = new AnalyticsDtos.CategoryStats();
            s.setCount(list.size());
            s.setAverage_score(mean(list));
            categories.put(label, s);
        });
        a.setProduct_categories(categories);

        List<AnalyticsDtos.ScanRecord> recent = new ArrayList<>();
        for (ManufacturerHistoryEntry e : newestFirst.subList(0, Math.min(RECENT_PRODUCTS, newestFirst.size()))) {
            recent.add(toScanRecord(e));
        }
        a.setRecent_products(recent);
        return Optional.of(a);
    }

    public AnalyticsDtos.ManufacturerComparison comparison() {
        List<AnalyticsDtos.ManufacturerSummary> all = new ArrayList<>();
        for (String key : tracker.manufacturerKeys()) {
            ManufacturerProfile p = tracker.profile(key);
            if (p.getCount() == 0) continue;
            AnalyticsDtos.ManufacturerSummary s = new AnalyticsDtos.ManufacturerSummary();
            s.setManufacturer_key(p.getManufacturerKey());
            s.setTotal_scans(p.getCount());
            s.setAverage_compliance_score(p.getMeanScore());
            s.setCompliance_level(ComplianceLevel.of(p.getMeanScore()).key());
            s.setTrend(p.getTrend().key());
            all.add(s);
        }

        // keys arrive sorted, so equal counts keep alphabetical order
        all.sort(Comparator.comparingInt(AnalyticsDtos.ManufacturerSummary::getTotal_scans).reversed());

        AnalyticsDtos.ManufacturerComparison c = new AnalyticsDtos.ManufacturerComparison();
        c.setTotal_manufacturers(all.size());
        c.setTotal_products_scanned(all.stream().mapToInt(AnalyticsDtos.ManufacturerSummary::getTotal_scans).sum());
        c.setIndustry_average_compliance(all.stream()
                .mapToDouble(AnalyticsDtos.ManufacturerSummary::getAverage_compliance_score).average().orElse(0.0));

        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (ComplianceLevel level : ComplianceLevel.values()) distribution.put(level.key(), 0);
        for (AnalyticsDtos.ManufacturerSummary s : all) distribution.merge(s.getCompliance_level(), 1, Integer::sum);
        c.setCompliance_distribution(distribution);

        List<AnalyticsDtos.ManufacturerSummary> byScore = new ArrayList<>(all);
        byScore.sort(Comparator.comparingDouble(AnalyticsDtos.ManufacturerSummary::getAverage_compliance_score).reversed());
        c.setTop_performers(new ArrayList<>(byScore.subList(0, Math.min(PERFORMERS, byScore.size()))));
        byScore.sort(Comparator.comparingDouble(AnalyticsDtos.ManufacturerSummary::getAverage_compliance_score));
        c.setBottom_performers(new ArrayList<>(byScore.subList(0, Math.min(PERFORMERS, byScore.size()))));
        c.setAll_manufacturers(all);

        log.debug("Compared {} manufacturers", all.size());
        return c;
    }

    /**
     * Most recent scans across manufacturers, newest first.
     *
     * @param manufacturerName restricts to one manufacturer when not blank
     * @param category         restricts to one product category label when not blank
     */
    public List<AnalyticsDtos.ScanRecord> history(int limit, String manufacturerName, String category) {
        List<ManufacturerHistoryEntry> pool = new ArrayList<>();
        Optional<String> onlyKey = ManufacturerKeyNormalizer.normalize(manufacturerName);
        if (onlyKey.isPresent()) {
            pool.addAll(tracker.entries(onlyKey.get()));
        } else {
            for (String key : tracker.manufacturerKeys()) pool.addAll(tracker.entries(key));
        }
        ProductCategory only = category == null || category.isBlank() ? null : ProductCategory.fromLabel(category);

        List<AnalyticsDtos.ScanRecord> out = new ArrayList<>();
        for (ManufacturerHistoryEntry e : newestFirst(pool)) {
            if (out.size() >= limit) break;
            if (only != null && e.getCategory() != only) continue;
            out.add(toScanRecord(e));
        }
        return out;
    }

    /**
     * Every recorded scan, oldest first.
     *
     * @param format {@code json} for the manufacturer summaries plus the scan log,
     *               {@code csv} for one row per scan with a header line
     * @throws IllegalArgumentException for any other format
     */
    public String export(String format) {
        String f = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        if (!f.equals("json") && !f.equals("csv")) {
            throw new IllegalArgumentException("Unsupported export format '" + format + "'; use json or csv");
        }
        List<ManufacturerHistoryEntry> all = new ArrayList<>();
        for (String key : tracker.manufacturerKeys()) all.addAll(tracker.entries(key));
        all.sort(Comparator.comparing(ManufacturerHistoryEntry::getTimestamp)
                .thenComparing(ManufacturerHistoryEntry::getManufacturerKey)
                .thenComparing(ManufacturerHistoryEntry::getProductIdentifier));
        try {
            String out = f.equals("json") ? exportJson(all) : exportCsv(all);
            log.info("Exported {} scans as {}", all.size(), f);
            return out;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot export history as " + f + ": " + e.getOriginalMessage(), e);
        }
    }

    private String exportJson(List<ManufacturerHistoryEntry> entries) throws JsonProcessingException {
        AnalyticsDtos.HistoryExport export = new AnalyticsDtos.HistoryExport();
        export.setTotal_scans(entries.size());
        export.setManufacturers(comparison().getAll_manufacturers());
        List<AnalyticsDtos.ScanRecord> scans = new ArrayList<>(entries.size());
        for (ManufacturerHistoryEntry e : entries) scans.add(toScanRecord(e));
        export.setScan_history(scans);
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export);
    }

    private static String exportCsv(List<ManufacturerHistoryEntry> entries) throws JsonProcessingException {
        List<AnalyticsDtos.ExportRow> rows = new ArrayList<>(entries.size());
        for (ManufacturerHistoryEntry e : entries) {
            AnalyticsDtos.ExportRow r = new AnalyticsDtos.ExportRow();
            r.setTimestamp(e.getTimestamp().toString());
            r.setManufacturer_key(e.getManufacturerKey());
            r.setManufacturer_name(e.getManufacturerName());
            r.setProduct_identifier(e.getProductIdentifier());
            r.setProduct_title(e.getProductTitle());
            r.setCategory(e.getCategory().getLabel());
            r.setScore(e.getScore());
            r.setCompliance_level(ComplianceLevel.of(e.getScore()).key());
            r.setCatalogue_version(e.getCatalogueVersion());
            r.setMissing_required_count(e.getMissingRequired().size());
            List<String> missing = new ArrayList<>();
            for (FieldName field : e.getMissingRequired()) missing.add(field.getKey());
            r.setMissing_required(String.join(";", missing));
            rows.add(r);
        }
        return CSV.writer(EXPORT_SCHEMA).writeValueAsString(rows);
    }

    private static List<ManufacturerHistoryEntry> newestFirst(List<ManufacturerHistoryEntry> entries) {
        List<ManufacturerHistoryEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(ManufacturerHistoryEntry::getTimestamp).reversed());
        return sorted;
    }

    private static double mean(List<ManufacturerHistoryEntry> entries) {
        return entries.stream().mapToDouble(ManufacturerHistoryEntry::getScore).average().orElse(0.0);
    }

    private static AnalyticsDtos.ScanRecord toScanRecord(ManufacturerHistoryEntry e) {
        AnalyticsDtos.ScanRecord r = new AnalyticsDtos.ScanRecord();
        r.setManufacturer_key(e.getManufacturerKey());
        r.setProduct_identifier(e.getProductIdentifier());
        r.setProduct_title(e.getProductTitle());
        r.setCategory(e.getCategory().getLabel());
        r.setScore(e.getScore());
        r.setCatalogue_version(e.getCatalogueVersion());
        List<String> missing = new ArrayList<>();
        for (FieldName f : e.getMissingRequired()) missing.add(f.getKey());
        r.setMissing_required(missing);
        r.setTimestamp(e.getTimestamp().toString());
        return r;
    }
}
