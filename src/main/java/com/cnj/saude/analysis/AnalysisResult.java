package com.cnj.saude.analysis;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Frequency tables of one analysed file, for both subsets.
 */
public final class AnalysisResult {

    private final String context;
    private final Map<AnalysisSubset, Long> rowCounts;
    private final Map<AnalysisSubset, List<FrequencyTable>> tables;

    public AnalysisResult(String context, Map<AnalysisSubset, Long> rowCounts,
                          Map<AnalysisSubset, List<FrequencyTable>> tables) {
        this.context = context;
        this.rowCounts = new EnumMap<>(AnalysisSubset.class);
        this.rowCounts.putAll(rowCounts);
        this.tables = new EnumMap<>(AnalysisSubset.class);
        tables.forEach((subset, list) -> this.tables.put(subset, List.copyOf(list)));
    }

    /**
     * @return where the data came from, e.g. {@code Brasil Consolidado} or {@code Regional NE}
     */
    public String getContext() {
        return context;
    }

    public long getRowCount(AnalysisSubset subset) {
        return rowCounts.getOrDefault(subset, 0L);
    }

    /**
     * @return the subset's tables in configured column order
     */
    public List<FrequencyTable> getTables(AnalysisSubset subset) {
        return tables.getOrDefault(subset, List.of());
    }

    public FrequencyTable getTable(AnalysisSubset subset, String column) {
        return getTables(subset).stream()
            .filter(table -> table.getColumn().equals(column))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Column not analysed: " + column));
    }
}
