package com.labelaudit.compliance.service.merge;

import com.labelaudit.compliance.model.MergedRecord;

import java.util.List;

public final class MergeResult {
    private final MergedRecord record;
    private final List<MergeDiagnostic> diagnostics;

    public MergeResult(MergedRecord record, List<MergeDiagnostic> diagnostics) {
        this.record = record;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public MergedRecord getRecord() { return record; }
    public List<MergeDiagnostic> getDiagnostics() { return diagnostics; }

    public long count(String code) {
        return diagnostics.stream().filter(d -> code.equals(d.getCode())).count();
    }
}
