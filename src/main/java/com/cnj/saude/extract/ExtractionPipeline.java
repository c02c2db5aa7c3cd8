package com.cnj.saude.extract;

import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.extract.ExtractionMetrics.ArchiveTally;
import com.cnj.saude.tabular.CsvDialect;
import com.cnj.saude.tabular.CsvTableReader;
import com.cnj.saude.tabular.MalformedTableException;
import com.cnj.saude.tabular.TabularRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs pipeline 1: locate archives, read their tabular members, keep health subjects,
 * project columns, write one file per group and consolidate.
 *
 * <p>Groups and archives are processed one at a time; each archive handle is closed before the
 * next one is opened, and the rows it retained are appended to the group's regional file before
 * the next archive is read. An unreadable archive is logged, counted and skipped, and none of its
 * rows reach the output. A member whose content cannot be parsed only loses the rows from the
 * failing record on. Configuration problems and an empty batch abort the run.
 */
public class ExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final PipelineConfig config;
    private final ProgressListener listener;
    private final CsvDialect dialect;

    private final ArchiveLocator locator;
    private final ArchiveExtractor extractor;
    private final SubjectFilter filter;
    private final ColumnProjector projector;
    private final RegionalExporter exporter;
    private final Consolidator consolidator;

    /**
     * Callbacks for console progress output.
     */
    public interface ProgressListener {

        ProgressListener NONE = new ProgressListener() {
        };

        default void groupStarted(SourceGroup group) {
        }

        default void archiveSkipped(Path archive, CorruptArchiveException error) {
        }

        default void groupComplete(ExtractionMetrics metrics, RegionalExport export) {
        }
    }

    public ExtractionPipeline(PipelineConfig config, ProgressListener listener) {
        this.config = config;
        this.listener = listener;
        this.dialect = config.getCsvDialect();
        this.locator = new ArchiveLocator(config);
        this.extractor = new ArchiveExtractor();
        this.filter = new SubjectFilter(config);
        this.projector = new ColumnProjector(config);
        this.exporter = new RegionalExporter(config);
        this.consolidator = new Consolidator(config);
    }

    /**
     * @throws com.cnj.saude.config.ConfigurationException if a configured directory is unusable
     * @throws ConsolidationException if no source group was found
     */
    public ExtractionSummary run() throws IOException {
        config.validateForExtraction();

        log.info("Starting extraction from {} - regions: {}, subject codes: {}",
            config.getInputRoot(), config.getRegions(), config.getSubjectCodes().size());

        List<ExtractionMetrics> allMetrics = new ArrayList<>();
        List<RegionalExport> exports = new ArrayList<>();

        try (Stream<SourceGroup> groups = locator.locate()) {
            Iterator<SourceGroup> iterator = groups.iterator();
            while (iterator.hasNext()) {
                SourceGroup group = iterator.next();
                ExtractionMetrics metrics = new ExtractionMetrics(group.name());
                RegionalExport export = processGroup(group, metrics);
                allMetrics.add(metrics);
                exports.add(export);
                listener.groupComplete(metrics, export);
            }
        }

        List<Path> regionalFiles = exports.stream().map(RegionalExport::file).collect(Collectors.toList());
        ConsolidationResult consolidation = consolidator.consolidate(regionalFiles);

        ExtractionSummary summary = new ExtractionSummary(allMetrics, exports, consolidation);
        log.info("Extraction complete - rows read: {}, retained: {}, archives skipped: {}",
            summary.totalRowsRead(), summary.totalRowsRetained(), summary.totalArchivesSkipped());
        return summary;
    }

    private RegionalExport processGroup(SourceGroup group, ExtractionMetrics metrics) throws IOException {
        log.info("--- Processing group {} ({} archive(s)) ---", group.name(), group.archives().size());
        listener.groupStarted(group);
        metrics.start();

        RegionalExport export;
        try (FilteredDataset dataset = exporter.open(group, projector.columns())) {
            for (Path archive : group.archives()) {
                processArchive(archive, dataset, metrics);
            }
            export = exporter.export(dataset);
        }
        metrics.complete();
        log.info("Group {} done: {}", group.name(), metrics);
        return export;
    }

    private void processArchive(Path archive, FilteredDataset dataset, ExtractionMetrics metrics) throws IOException {
        long start = System.nanoTime();
        ArchiveTally tally = new ArchiveTally();
        List<List<String>> retained = new ArrayList<>();

        try (ArchiveContents contents = extractor.open(archive)) {
            for (TabularEntry entry : contents) {
                processEntry(archive, entry, retained, tally);
            }
        } catch (CorruptArchiveException e) {
            skipArchive(archive, e, metrics);
            return;
        } catch (IOException e) {
            skipArchive(archive, new CorruptArchiveException(archive, e), metrics);
            return;
        }

        if (tally.tabularFiles() == 0) {
            log.warn("No tabular file found in archive {}", archive.getFileName());
        }
        dataset.addAll(retained);
        metrics.recordArchive(tally, (System.nanoTime() - start) / 1000);
    }

    private void processEntry(Path archive, TabularEntry entry, List<List<String>> retained, ArchiveTally tally) {
        log.info("Reading {} from {}", entry.name(), archive.getFileName());
        tally.tabularFile();
        long readBefore = tally.rowsRead();
        long retainedBefore = tally.rowsRetained();

        try (CsvTableReader reader = CsvTableReader.open(entry.openStream(), dialect)) {
            List<String> missing;
            try {
                missing = projector.checkSchema(reader.header(), entry.name());
            } catch (SchemaMismatchException e) {
                log.warn("Skipping {}: {}", entry.name(), e.getMessage());
                tally.schemaMismatch();
                tally.tabularFileSkipped();
                return;
            }
            if (!missing.isEmpty()) {
                tally.schemaMismatch();
            }

            for (TabularRow row : reader) {
                tally.rowRead();
                SubjectFilter.Verdict verdict = filter.evaluate(row);
                if (verdict == SubjectFilter.Verdict.RETAINED) {
                    retained.add(projector.project(row));
                    tally.rowRetained();
                } else if (verdict == SubjectFilter.Verdict.UNPARSABLE) {
                    tally.rowUnparsable();
                }
            }
            log.info("{}: {} row(s) read, {} retained",
                entry.name(), tally.rowsRead() - readBefore, tally.rowsRetained() - retainedBefore);
        } catch (MalformedTableException e) {
            log.warn("Stopped reading {} from {} after {} row(s): {} (expected encoding {})",
                entry.name(), archive.getFileName(), tally.rowsRead() - readBefore, e.getMessage(),
                dialect.charset().name());
            tally.rowUnparsable();
            if (tally.rowsRead() == readBefore) {
                tally.tabularFileSkipped();
            }
        } catch (IOException e) {
            throw new CorruptArchiveException(archive, e);
        } catch (UncheckedIOException e) {
            throw new CorruptArchiveException(archive, e.getCause());
        }
    }

    private void skipArchive(Path archive, CorruptArchiveException error, ExtractionMetrics metrics) {
        log.error("Skipping archive {}: {}", archive, error.getMessage());
        metrics.recordSkippedArchive();
        listener.archiveSkipped(archive, error);
    }
}
