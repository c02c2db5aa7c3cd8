package com.cnj.saude.analysis;

import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.tabular.CsvDialect;
import com.cnj.saude.tabular.CsvTableReader;
import com.cnj.saude.tabular.MultiValues;
import com.cnj.saude.tabular.TabularRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes value frequencies for the configured columns over all records and over the records
 * against public entities, in a single pass.
 *
 * <p>By default each cell is one category, so a table's counts add up to the subset's row count;
 * blank cells count under the neutral marker. With multi-valued counting each item of a
 * {@code {a, b}} cell counts once and percentages are relative to the item total.
 */
public class FrequencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FrequencyAnalyzer.class);

    private final List<String> columns;
    private final String processNumberColumn;
    private final String defendantNatureColumn;
    private final String neutralMarker;
    private final boolean multiValued;
    private final PublicEntityMatcher matcher;
    private final CsvDialect dialect;

    public FrequencyAnalyzer(PipelineConfig config) {
        this.columns = List.copyOf(config.getAnalysisColumns());
        this.processNumberColumn = config.getProcessNumberColumn();
        this.defendantNatureColumn = config.getDefendantNatureColumn();
        this.neutralMarker = config.getNeutralMarker();
        this.multiValued = config.isMultiValued();
        this.matcher = new PublicEntityMatcher(config);
        this.dialect = config.getCsvDialect();
    }

    public AnalysisResult analyze(String context, Path csv) throws IOException {
        log.info("Analysing frequencies in {} ({})", csv.getFileName(), context);
        try (CsvTableReader reader = CsvTableReader.open(csv, dialect)) {
            List<String> header = reader.header();
            List<String> missing = new ArrayList<>();
            for (String column : columns) {
                if (!header.contains(column)) {
                    missing.add(column);
                }
            }
            if (!missing.isEmpty()) {
                log.warn("Analysis columns not found in {}: {}. Their tables count the neutral marker only.",
                    csv.getFileName(), missing);
            }
            if (!header.contains(defendantNatureColumn)) {
                log.warn("Column '{}' not found in {}; no record will qualify as against a public entity",
                    defendantNatureColumn, csv.getFileName());
            }
            AnalysisResult result = analyze(context, reader);
            log.info("Analysis of {} complete. Rows: {}, against public entities: {}",
                csv.getFileName(), result.getRowCount(AnalysisSubset.ALL_RECORDS),
                result.getRowCount(AnalysisSubset.PUBLIC_DEFENDANT));
            return result;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public AnalysisResult analyze(String context, Iterable<TabularRow> rows) {
        Map<AnalysisSubset, SubsetCounter> counters = new EnumMap<>(AnalysisSubset.class);
        for (AnalysisSubset subset : AnalysisSubset.values()) {
            counters.put(subset, new SubsetCounter());
        }

        for (TabularRow row : rows) {
            CaseRecord record = toCaseRecord(row);
            for (AnalysisSubset subset : AnalysisSubset.values()) {
                if (record.belongsTo(subset)) {
                    count(counters.get(subset), record);
                }
            }
        }

        Map<AnalysisSubset, Long> rowCounts = new EnumMap<>(AnalysisSubset.class);
        Map<AnalysisSubset, List<FrequencyTable>> tables = new EnumMap<>(AnalysisSubset.class);
        for (AnalysisSubset subset : AnalysisSubset.values()) {
            SubsetCounter counter = counters.get(subset);
            rowCounts.put(subset, counter.rows);
            List<FrequencyTable> subsetTables = new ArrayList<>(columns.size());
            for (String column : columns) {
                long total = multiValued ? counter.items.getOrDefault(column, 0L) : counter.rows;
                subsetTables.add(FrequencyTable.of(subset, column, counter.valuesOf(column), total));
            }
            tables.put(subset, subsetTables);
        }
        return new AnalysisResult(context, rowCounts, tables);
    }

    public CaseRecord toCaseRecord(TabularRow row) {
        String processNumber = row.getOrDefault(processNumberColumn, neutralMarker);
        boolean publicDefendant = matcher.matches(row.get(defendantNatureColumn));
        return new CaseRecord(processNumber, row, publicDefendant);
    }

    private void count(SubsetCounter counter, CaseRecord record) {
        counter.rows++;
        for (String column : columns) {
            String cell = record.value(column, neutralMarker);
            Map<String, Long> values = counter.valuesOf(column);
            if (multiValued) {
                List<String> items = MultiValues.split(cell);
                for (String item : items) {
                    values.merge(item, 1L, Long::sum);
                }
                counter.items.merge(column, (long) items.size(), Long::sum);
            } else {
                String value = cell == null ? "" : cell.strip();
                values.merge(value.isEmpty() ? neutralMarker : value, 1L, Long::sum);
            }
        }
    }

    private static final class SubsetCounter {
        private long rows;
        private final Map<String, Map<String, Long>> values = new HashMap<>();
        private final Map<String, Long> items = new HashMap<>();

        Map<String, Long> valuesOf(String column) {
            return values.computeIfAbsent(column, c -> new HashMap<>());
        }
    }
}
