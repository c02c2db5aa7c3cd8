package com.cnj.saude.analysis;

import java.util.List;

/**
 * One block of the report: the tables of one analysed file for one subset.
 *
 * @param context      where the data came from, e.g. {@code Brasil Consolidado}
 * @param subset       which records were counted
 * @param rowCount     rows in the subset
 * @param tables       one table per analysed column, in column order
 * @param startsSubset true for the first section of a subset after the first one
 */
public record ReportSection(
    String context,
    AnalysisSubset subset,
    long rowCount,
    List<FrequencyTable> tables,
    boolean startsSubset
) {

    public ReportSection {
        tables = List.copyOf(tables);
    }

    public String title() {
        return context + " - " + subset.getLabel();
    }
}
