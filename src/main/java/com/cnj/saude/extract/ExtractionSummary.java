package com.cnj.saude.extract;

import java.util.List;

/**
 * Everything pipeline 1 produced in one run.
 */
public record ExtractionSummary(
    List<ExtractionMetrics> groups,
    List<RegionalExport> exports,
    ConsolidationResult consolidation
) {

    public long totalArchivesSkipped() {
        return groups.stream().mapToLong(ExtractionMetrics::getArchivesSkipped).sum();
    }

    public long totalRowsRead() {
        return groups.stream().mapToLong(ExtractionMetrics::getRowsRead).sum();
    }

    public long totalRowsRetained() {
        return groups.stream().mapToLong(ExtractionMetrics::getRowsRetained).sum();
    }

    public long totalElapsedMs() {
        return groups.stream().mapToLong(ExtractionMetrics::getElapsedTimeMs).sum();
    }
}
