package com.labelaudit.compliance.service;

import com.labelaudit.compliance.dto.EvaluationDtos;
import com.labelaudit.compliance.exception.InvalidCandidateException;
import com.labelaudit.compliance.exception.RuleCatalogueException;
import com.labelaudit.compliance.model.ComplianceResult;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.FieldStatus;
import com.labelaudit.compliance.model.ManufacturerProfile;
import com.labelaudit.compliance.model.MergedField;
import com.labelaudit.compliance.model.MergedRecord;
import com.labelaudit.compliance.model.SourceType;
import com.labelaudit.compliance.service.history.ManufacturerKeyNormalizer;
import com.labelaudit.compliance.service.history.ManufacturerTracker;
import com.labelaudit.compliance.service.history.TrackingOutcome;
import com.labelaudit.compliance.service.merge.FieldMergeEngine;
import com.labelaudit.compliance.service.merge.MergeDiagnostic;
import com.labelaudit.compliance.service.merge.MergeResult;
import com.labelaudit.compliance.service.rules.ComplianceRulesEngine;
import com.labelaudit.compliance.service.rules.RuleCatalogue;
import com.labelaudit.compliance.service.source.PlatformMetadataAdapter;
import com.labelaudit.compliance.service.source.SourceAdapters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one product through merge, rule evaluation and manufacturer tracking.
 *
 * <h3>Failure handling</h3>
 * <ul>
 *   <li>Malformed candidates are dropped by the merge engine and show up as diagnostics</li>
 *   <li>A missing rule catalogue fails the whole evaluation</li>
 *   <li>History failures leave the compliance result intact; the report says the
 *   history was not recorded</li>
 * </ul>
 */
@Service
public class LabelComplianceService {
    private static final Logger log = LoggerFactory.getLogger(LabelComplianceService.class);

    private final SourceAdapters sourceAdapters;
    private final FieldMergeEngine mergeEngine;
    private final ComplianceRulesEngine rulesEngine;
    private final RuleCatalogue catalogue;
    private final ManufacturerTracker tracker;
    private final Clock clock;

    public LabelComplianceService(SourceAdapters sourceAdapters, FieldMergeEngine mergeEngine,
                                  ComplianceRulesEngine rulesEngine, RuleCatalogue catalogue,
                                  ManufacturerTracker tracker, Clock clock) {
        this.sourceAdapters = sourceAdapters;
        this.mergeEngine = mergeEngine;
        this.rulesEngine = rulesEngine;
        this.catalogue = catalogue;
        this.tracker = tracker;
        this.clock = clock;
    }

    /** Evaluates raw source payloads; the platform listing title categorizes the product. */
    public Mono<EvaluationDtos.EvaluationReport> evaluate(String productIdentifier,
                                                          Map<SourceType, Map<String, Object>> payloads) {
        return Mono.fromCallable(() -> evaluateNow(requestFor(productIdentifier, payloads)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public EvaluationRequest requestFor(String productIdentifier, Map<SourceType, Map<String, Object>> payloads) {
        Map<SourceType, Map<String, Object>> supplied = payloads == null ? Map.of() : payloads;
        return new EvaluationRequest(productIdentifier, sourceAdapters.adaptAll(supplied))
                .title(PlatformMetadataAdapter.title(supplied.get(SourceType.PLATFORM_METADATA)));
    }

    public Mono<EvaluationDtos.EvaluationReport> evaluate(EvaluationRequest request) {
        return Mono.fromCallable(() -> evaluateNow(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public EvaluationDtos.EvaluationReport evaluateNow(EvaluationRequest request) {
        return toReport(run(request));
    }

    public Evaluation run(EvaluationRequest request) {
        if (request == null || request.getProductIdentifier() == null || request.getProductIdentifier().isBlank()) {
            throw new InvalidCandidateException("Evaluation request has no product identifier");
        }
        if (catalogue == null) {
            throw new RuleCatalogueException("No rule catalogue loaded");
        }
        String productId = request.getProductIdentifier().trim();
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();

        MergeResult merge = mergeEngine.merge(productId, request.getCandidates(), timestamp);
        ComplianceResult compliance = rulesEngine.evaluate(merge.getRecord(), catalogue);
        String manufacturer = manufacturerOf(request, merge.getRecord());
        TrackingOutcome tracking = tracker.record(manufacturer, compliance, request.getProductTitle());

        log.info("Evaluated {}: score {} ({}), history {}", productId, compliance.getScoreLabel(),
                compliance.getLevel().key(), tracking.getStatus());
        return new Evaluation(merge, compliance, tracking);
    }

    /** Caller-supplied manufacturer first, then the company name read from the label. */
    static String manufacturerOf(EvaluationRequest request, MergedRecord record) {
        if (request.getManufacturerName() != null && !request.getManufacturerName().isBlank()) {
            return request.getManufacturerName();
        }
        return record.value(FieldName.MANUFACTURER_NAME).map(ManufacturerKeyNormalizer::companyName).orElse(null);
    }

    private static EvaluationDtos.EvaluationReport toReport(Evaluation evaluation) {
        MergedRecord record = evaluation.getMerge().getRecord();
        ComplianceResult compliance = evaluation.getCompliance();
        TrackingOutcome tracking = evaluation.getTracking();

        EvaluationDtos.EvaluationReport report = new EvaluationDtos.EvaluationReport();
        report.setProduct_identifier(record.getProductIdentifier());

        Map<String, EvaluationDtos.MergedFieldView> merged = new LinkedHashMap<>();
        for (MergedField f : record.getFields().values()) {
            EvaluationDtos.MergedFieldView v = new EvaluationDtos.MergedFieldView();
            v.setValue(f.getValue());
            v.setSource(f.getSource().getKey());
            v.setConfidence(f.getConfidence());
            merged.put(f.getField().getKey(), v);
        }
        report.setMerged_fields(merged);

        EvaluationDtos.ComplianceSummary summary = new EvaluationDtos.ComplianceSummary();
        summary.setScore(compliance.getScoreLabel());
        summary.setScore_fraction(compliance.getScore());
        summary.setLevel(compliance.getLevel().key());
        summary.setMissing_required(keys(compliance.getMissingRequired()));
        summary.setMissing_optional(keys(compliance.getMissingOptional()));
        summary.setInvalid_fields(keys(compliance.getInvalidFields()));
        Map<String, String> status = new LinkedHashMap<>();
        for (Map.Entry<FieldName, FieldStatus> e : compliance.getPerFieldStatus().entrySet()) {
            status.put(e.getKey().getKey(), e.getValue().key());
        }
        summary.setPer_field_status(status);
        summary.setCatalogue_version(compliance.getCatalogueVersion());
        report.setCompliance_summary(summary);

        if (tracking.hasProfile()) {
            ManufacturerProfile p = tracking.getProfile();
            EvaluationDtos.ManufacturerProfileView view = new EvaluationDtos.ManufacturerProfileView();
            view.setManufacturer_key(p.getManufacturerKey());
            view.setCount(p.getCount());
            view.setMean_score(p.getMeanScore());
            view.setTrend(p.getTrend().key());
            report.setManufacturer_profile(view);
        }

        EvaluationDtos.HistoryView history = new EvaluationDtos.HistoryView();
        history.setStatus(tracking.getStatus().name());
        history.setMessage(tracking.getMessage());
        report.setHistory(history);

        List<EvaluationDtos.DiagnosticView> diagnostics = new ArrayList<>();
        for (MergeDiagnostic d : evaluation.getMerge().getDiagnostics()) {
            EvaluationDtos.DiagnosticView v = new EvaluationDtos.DiagnosticView();
            v.setCode(d.getCode());
            v.setField(d.getField());
            v.setSource(d.getSource() == null ? null : d.getSource().getKey());
            v.setMessage(d.getMessage());
            diagnostics.add(v);
        }
        report.setDiagnostics(diagnostics);
        return report;
    }

    private static List<String> keys(Set<FieldName> fields) {
        List<String> out = new ArrayList<>(fields.size());
        for (FieldName f : fields) out.add(f.getKey());
        return out;
    }
}
