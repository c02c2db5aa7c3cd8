package com.cnj.saude.extract;

import com.cnj.saude.tabular.CsvTableWriter;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Retained and projected rows of one source group, in discovery order.
 *
 * <p>Rows are streamed to the group's pending regional file as they are added, so only the rows
 * of the archive being read are held in memory. Obtained from {@link RegionalExporter#open} and
 * published by {@link RegionalExporter#export}; closing an unexported dataset discards it.
 */
public class FilteredDataset implements Closeable {

    private final SourceGroup group;
    private final List<String> columns;
    private final CsvTableWriter writer;

    FilteredDataset(SourceGroup group, List<String> columns, CsvTableWriter writer) {
        this.group = group;
        this.columns = List.copyOf(columns);
        this.writer = writer;
    }

    public void addAll(List<List<String>> projectedRows) throws IOException {
        for (List<String> row : projectedRows) {
            writer.writeRow(row);
        }
    }

    public SourceGroup group() {
        return group;
    }

    public List<String> columns() {
        return columns;
    }

    public long size() {
        return writer.rowsWritten();
    }

    Path commit() throws IOException {
        return writer.commit();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
