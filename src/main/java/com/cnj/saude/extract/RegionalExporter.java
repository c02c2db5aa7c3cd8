package com.cnj.saude.extract;

import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.tabular.CsvDialect;
import com.cnj.saude.tabular.CsvTableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one file per source group, {@code dados_saude_<GROUP>.csv}, in the regional output
 * directory. Re-running replaces the file; a group without retained rows still gets a
 * header-only file. The file only appears at its final path once the group is exported.
 */
public class RegionalExporter {

    private static final Logger log = LoggerFactory.getLogger(RegionalExporter.class);

    private final PipelineConfig config;
    private final CsvDialect dialect;

    public RegionalExporter(PipelineConfig config) {
        this.config = config;
        this.dialect = config.getCsvDialect();
    }

    /**
     * Starts the regional file of {@code group}; rows added to the returned dataset are written
     * to a temporary sibling of the target.
     */
    public FilteredDataset open(SourceGroup group, List<String> columns) throws IOException {
        Path target = config.getRegionalFile(group.name());
        return new FilteredDataset(group, columns, new CsvTableWriter(target, columns, dialect));
    }

    public RegionalExport export(FilteredDataset dataset) throws IOException {
        String groupName = dataset.group().name();
        Path target = dataset.commit();

        log.info("Exported {} row(s) for {} to {}", dataset.size(), groupName, target);
        return new RegionalExport(groupName, target, dataset.size());
    }
}
