package com.cnj.saude.report;

import com.cnj.saude.analysis.AnalysisReport;
import com.cnj.saude.analysis.FrequencyEntry;
import com.cnj.saude.analysis.FrequencyTable;
import com.cnj.saude.analysis.ReportSection;
import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.tabular.CsvDialect;
import com.cnj.saude.tabular.CsvTableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes every frequency table, untruncated, to its own CSV file in the reports directory.
 */
public class CsvReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(CsvReportSink.class);

    public static final List<String> HEADER = List.of("Item", "Contagem", "Percentual");

    private final Path reportsDir;
    private final String baseName;
    private final CsvDialect dialect;
    private final List<Path> writtenFiles = new ArrayList<>();

    public CsvReportSink(PipelineConfig config) {
        this.reportsDir = config.getReportsDir();
        this.baseName = config.getReportBaseName();
        this.dialect = config.getCsvDialect();
    }

    @Override
    public void publish(AnalysisReport report) throws IOException {
        writtenFiles.clear();
        for (ReportSection section : report.getSections()) {
            for (FrequencyTable table : section.tables()) {
                writtenFiles.add(write(section, table));
            }
        }
        log.info("Wrote {} table file(s) to {}", writtenFiles.size(), reportsDir);
    }

    /**
     * {@code <base>_<subset>_<context>_<column>.csv}, every label reduced to a lower-case slug.
     */
    public Path fileFor(ReportSection section, FrequencyTable table) {
        String name = baseName
            + "_" + section.subset().getSlug()
            + "_" + ReportNames.slug(section.context())
            + "_" + ReportNames.slug(table.getColumn())
            + PipelineConfig.CSV_EXTENSION;
        return reportsDir.resolve(name);
    }

    /**
     * @return files written by the last {@link #publish} call, in report order
     */
    public List<Path> getWrittenFiles() {
        return List.copyOf(writtenFiles);
    }

    private Path write(ReportSection section, FrequencyTable table) throws IOException {
        Path target = fileFor(section, table);
        try (CsvTableWriter writer = new CsvTableWriter(target, HEADER, dialect)) {
            for (FrequencyEntry entry : table.getEntries()) {
                writer.writeRow(List.of(entry.value(), Long.toString(entry.count()),
                    entry.percentage().toPlainString()));
            }
            log.debug("{}: {} value(s)", target.getFileName(), writer.rowsWritten());
            return writer.commit();
        }
    }
}
