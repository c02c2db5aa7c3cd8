package com.cnj.saude.tabular;

import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes a delimited file through a temporary sibling that is renamed onto the target on
 * {@link #commit()}. Readers of the target path never see a half-written file; closing without
 * committing discards the temporary file and leaves any previous target untouched.
 */
public class CsvTableWriter implements Closeable {

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path target;
    private final Path temp;
    private final CSVPrinter printer;
    private long rowsWritten;
    private boolean committed;

    public CsvTableWriter(Path target, List<String> header, CsvDialect dialect) throws IOException {
        this.target = target;
        this.temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        BufferedWriter writer = Files.newBufferedWriter(temp, dialect.charset());
        this.printer = new CSVPrinter(writer, dialect.format());
        printer.printRecord(header);
    }

    public void writeRow(List<String> cells) throws IOException {
        printer.printRecord(cells);
        rowsWritten++;
    }

    public long rowsWritten() {
        return rowsWritten;
    }

    /**
     * Flushes the file and moves it onto the target path, replacing any previous version.
     */
    public Path commit() throws IOException {
        printer.close(true);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        committed = true;
        return target;
    }

    @Override
    public void close() throws IOException {
        if (!committed) {
            try {
                printer.close();
            } finally {
                Files.deleteIfExists(temp);
            }
        }
    }
}
