package com.cnj.saude.extract;

import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.tabular.CsvDialect;
import com.cnj.saude.tabular.CsvTableReader;
import com.cnj.saude.tabular.CsvTableWriter;
import com.cnj.saude.tabular.TabularRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges the regional files into the national file
 * {@code DADOS_CNJ_FILTRADOS_SAUDE_CONSOLIDADO.csv}.
 *
 * <p>Works from the persisted regional files so it can be re-run on its own. The output schema
 * is the union of the input headers in first-seen order; a row from a file lacking one of those
 * columns gets the neutral marker there.
 */
public class Consolidator {

    private static final Logger log = LoggerFactory.getLogger(Consolidator.class);

    private final PipelineConfig config;
    private final CsvDialect dialect;

    public Consolidator(PipelineConfig config) {
        this.config = config;
        this.dialect = config.getCsvDialect();
    }

    /**
     * Consolidates the given regional files in the given order.
     *
     * @throws ConsolidationException if {@code regionalFiles} is empty
     */
    public ConsolidationResult consolidate(List<Path> regionalFiles) throws IOException {
        if (regionalFiles.isEmpty()) {
            throw new ConsolidationException("No regional dataset to consolidate in "
                + config.getRegionalOutputDir().toAbsolutePath());
        }

        List<String> columns = unionSchema(regionalFiles);
        Path target = config.getConsolidatedFile();
        String neutralMarker = config.getNeutralMarker();

        log.info("Consolidating {} regional file(s) into {}", regionalFiles.size(), target);

        long total;
        try (CsvTableWriter writer = new CsvTableWriter(target, columns, dialect)) {
            for (Path file : regionalFiles) {
                long before = writer.rowsWritten();
                try (CsvTableReader reader = CsvTableReader.open(file, dialect)) {
                    for (TabularRow row : reader) {
                        writer.writeRow(row.project(columns, neutralMarker));
                    }
                } catch (UncheckedIOException e) {
                    throw e.getCause();
                }
                log.debug("Added {} row(s) from {}", writer.rowsWritten() - before, file.getFileName());
            }
            total = writer.rowsWritten();
            writer.commit();
        }

        log.info("Consolidation complete: {} row(s) written to {}", total, target.getFileName());
        return new ConsolidationResult(target, columns, List.copyOf(regionalFiles), total);
    }

    /**
     * Consolidates the persisted regional files of the configured regions, in region order.
     */
    public ConsolidationResult consolidateDirectory() throws IOException {
        return consolidate(config.listRegionalFiles());
    }

    private List<String> unionSchema(List<Path> files) throws IOException {
        List<String> columns = new ArrayList<>();
        for (Path file : files) {
            try (CsvTableReader reader = CsvTableReader.open(file, dialect)) {
                for (String column : reader.header()) {
                    if (!columns.contains(column)) {
                        columns.add(column);
                    }
                }
            }
        }
        return columns;
    }
}
