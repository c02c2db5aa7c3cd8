package com.cnj.saude.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The ordered tables handed to report sinks.
 *
 * <p>Every all-records section comes first, followed by every public-defendant section, each
 * group in the order the files were analysed. The first public-defendant section is flagged so
 * sinks can mark where that part begins.
 */
public final class AnalysisReport {

    private final List<ReportSection> sections;

    private AnalysisReport(List<ReportSection> sections) {
        this.sections = Collections.unmodifiableList(sections);
    }

    public static AnalysisReport of(List<AnalysisResult> results) {
        List<ReportSection> sections = new ArrayList<>();
        for (AnalysisSubset subset : AnalysisSubset.values()) {
            boolean first = true;
            for (AnalysisResult result : results) {
                boolean startsSubset = first && subset != AnalysisSubset.ALL_RECORDS;
                sections.add(new ReportSection(result.getContext(), subset,
                    result.getRowCount(subset), result.getTables(subset), startsSubset));
                first = false;
            }
        }
        return new AnalysisReport(sections);
    }

    public List<ReportSection> getSections() {
        return sections;
    }

    public List<ReportSection> getSections(AnalysisSubset subset) {
        return sections.stream()
            .filter(section -> section.subset() == subset)
            .collect(Collectors.toList());
    }

    /**
     * @return every table in presentation order
     */
    public List<FrequencyTable> getTables() {
        return sections.stream()
            .flatMap(section -> section.tables().stream())
            .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }
}
