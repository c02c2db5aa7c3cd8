package com.cnj.saude.report;

import com.cnj.saude.analysis.AnalysisReport;
import com.cnj.saude.analysis.FrequencyTable;
import com.cnj.saude.analysis.ReportSection;
import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.extract.ConsolidationResult;
import com.cnj.saude.extract.CorruptArchiveException;
import com.cnj.saude.extract.ExtractionMetrics;
import com.cnj.saude.extract.ExtractionPipeline;
import com.cnj.saude.extract.ExtractionSummary;
import com.cnj.saude.extract.RegionalExport;
import com.cnj.saude.extract.SourceGroup;
import com.cnj.saude.report.ReportTableFormatter.ReportLine;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Console reporter for extraction and analysis results.
 */
public class ConsoleReporter implements ReportSink, ExtractionPipeline.ProgressListener {

    private static final String SEPARATOR = "=".repeat(80);
    private static final String THIN_SEPARATOR = "-".repeat(80);
    private static final DateTimeFormatter DT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final boolean quiet;
    private final ReportTableFormatter formatter;
    private final PrintStream out;

    public ConsoleReporter(boolean quiet, int topN) {
        this(quiet, topN, System.out);
    }

    public ConsoleReporter(boolean quiet, int topN, PrintStream out) {
        this.quiet = quiet;
        this.formatter = new ReportTableFormatter(topN);
        this.out = out;
    }

    public void printExtractionHeader(PipelineConfig config) {
        if (quiet) return;

        out.println();
        out.println(SEPARATOR);
        out.println("              CNJ Saude - Extracao de Processos");
        out.println(SEPARATOR);
        out.println();
        out.printf("Input:           %s%n", config.getInputRoot().toAbsolutePath());
        out.printf("Started:         %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println();
        out.println("Configuration:");
        out.printf("  Regions:         %s%n", String.join(", ", config.getRegions()));
        out.printf("  Subject codes:   %d%n", config.getSubjectCodes().size());
        out.printf("  Columns:         %d%n", config.getProjectedColumns().size());
        out.printf("  Delimiter:       '%s'%n", config.getDelimiter());
        out.printf("  Encoding:        %s%n", config.getEncoding().name());
        out.printf("  Regional output: %s%n", config.getRegionalOutputDir());
        out.printf("  Consolidated:    %s%n", config.getConsolidatedFile());
        out.println();
        out.println("Progress:");
    }

    @Override
    public void groupStarted(SourceGroup group) {
        if (!quiet) {
            out.printf("  %-6s %d archive(s)...%n", group.name(), group.archives().size());
        }
    }

    @Override
    public void archiveSkipped(Path archive, CorruptArchiveException error) {
        if (!quiet) {
            out.printf("    SKIPPED %s: %s%n", archive.getFileName(), error.getCause() == null
                ? error.getMessage() : error.getCause().getMessage());
        }
    }

    @Override
    public void groupComplete(ExtractionMetrics metrics, RegionalExport export) {
        if (!quiet) {
            out.printf("  %-6s %,12d read %,10d retained -> %s - COMPLETE%n",
                metrics.getGroupName(), metrics.getRowsRead(), metrics.getRowsRetained(),
                export.file().getFileName());
        }
    }

    public void printExtractionResults(ExtractionSummary summary) {
        if (quiet) {
            printExtractionResultsCompact(summary);
            return;
        }

        out.println();
        out.println(SEPARATOR);
        out.println("                           Results Summary");
        out.println(SEPARATOR);
        out.println();
        out.printf("%-8s %9s %8s %7s %12s %12s %12s %12s%n",
            "Group", "Archives", "Skipped", "Files", "Rows Read", "Retained", "Avg Archive", "P95 Archive");
        out.println(THIN_SEPARATOR);

        for (ExtractionMetrics m : summary.groups()) {
            out.printf("%-8s %9d %8d %7d %,12d %,12d %9.1f ms %9.1f ms%n",
                m.getGroupName(),
                m.getArchivesProcessed(),
                m.getArchivesSkipped(),
                m.getTabularFiles(),
                m.getRowsRead(),
                m.getRowsRetained(),
                m.getAvgArchiveMs(),
                m.getP95ArchiveMs());
        }

        out.println(THIN_SEPARATOR);
        out.printf("%-8s %9s %8d %7s %,12d %,12d%n",
            "TOTAL", "", summary.totalArchivesSkipped(), "", summary.totalRowsRead(), summary.totalRowsRetained());

        ConsolidationResult consolidation = summary.consolidation();
        out.println();
        if (consolidation != null) {
            printConsolidation(consolidation);
        }
        out.printf("Total Time: %s%n", formatDuration(summary.totalElapsedMs()));
        out.printf("Completed:  %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println(SEPARATOR);
    }

    private void printExtractionResultsCompact(ExtractionSummary summary) {
        out.printf("Retained %,d of %,d rows from %d group(s) in %s, %d archive(s) skipped%n",
            summary.totalRowsRetained(), summary.totalRowsRead(), summary.groups().size(),
            formatDuration(summary.totalElapsedMs()), summary.totalArchivesSkipped());
    }

    public void printConsolidation(ConsolidationResult result) {
        if (quiet) {
            out.printf("Consolidated %,d rows into %s%n", result.rows(), result.file());
            return;
        }
        out.printf("Consolidated: %s%n", result.file());
        out.printf("  Inputs:      %d regional file(s)%n", result.inputFiles().size());
        out.printf("  Columns:     %d%n", result.columns().size());
        out.printf("  Rows:        %,d%n", result.rows());
    }

    /**
     * Prints the presented tables of every section, or one line per section in quiet mode.
     */
    @Override
    public void publish(AnalysisReport report) {
        if (quiet) {
            for (ReportSection section : report.getSections()) {
                out.printf("%s: %,d processo(s)%n", section.title(), section.rowCount());
            }
            return;
        }

        for (ReportSection section : report.getSections()) {
            out.println();
            out.println(SEPARATOR);
            out.printf("  %s%n", section.title());
            out.println(SEPARATOR);
            out.printf("Processos analisados: %,d%n", section.rowCount());

            for (FrequencyTable table : section.tables()) {
                printTable(table);
            }
        }
        out.println();
    }

    private void printTable(FrequencyTable table) {
        out.println();
        out.printf("Analise: %s%n", table.getColumn());
        List<ReportLine> lines = formatter.format(table);
        if (lines.isEmpty()) {
            out.println("  Nenhum registro.");
            return;
        }
        out.printf("  %-50s %12s %11s%n", "Item", "Contagem", "Percentual");
        out.println("  " + "-".repeat(75));
        for (ReportLine line : lines) {
            out.printf("  %-50s %,12d %11s%n", truncate(line.item(), 50), line.count(), line.percentText());
        }
    }

    private static String truncate(String text, int width) {
        return text.length() <= width ? text : text.substring(0, width - 3) + "...";
    }

    private String formatDuration(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        } else if (millis < 60_000) {
            return String.format("%.1f seconds", millis / 1000.0);
        } else if (millis < 3600_000) {
            long minutes = millis / 60_000;
            long seconds = (millis % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        } else {
            long hours = millis / 3600_000;
            long minutes = (millis % 3600_000) / 60_000;
            return String.format("%d hr %d min", hours, minutes);
        }
    }
}
