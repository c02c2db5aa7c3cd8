package com.cnj.saude.analysis;

import com.cnj.saude.tabular.TabularRow;

/**
 * A health-litigation case as seen by the analysis: its process number, its raw cells, and
 * whether the defendant is a public entity.
 *
 * @param processNumber   value of the process-number column, neutral marker when absent
 * @param row             all columns of the consolidated row
 * @param publicDefendant true if the passive party's legal nature names a public entity
 */
public record CaseRecord(String processNumber, TabularRow row, boolean publicDefendant) {

    public String value(String column, String neutralMarker) {
        return row.getOrDefault(column, neutralMarker);
    }

    public boolean belongsTo(AnalysisSubset subset) {
        return subset == AnalysisSubset.ALL_RECORDS || publicDefendant;
    }
}
