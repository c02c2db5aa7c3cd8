package com.cnj.saude.tabular;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Streams the rows of a delimited file with a header line.
 *
 * <p>Header names are trimmed and a leading byte-order mark is dropped, so
 * a BOM-prefixed {@code "Tribunal "} matches {@code Tribunal}. Rows are produced lazily and can be
 * iterated once.
 *
 * <p>Bytes are decoded strictly. Content that cannot be decoded or parsed surfaces as
 * {@link MalformedTableException}; failures of the underlying stream surface as
 * {@link UncheckedIOException} while iterating and as {@link IOException} from {@code open}.
 */
public class CsvTableReader implements Closeable, Iterable<TabularRow> {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final List<String> header;
    private long rowsRead;
    private boolean iterated;

    private CsvTableReader(CSVParser parser) {
        this.parser = parser;
        this.records = parser.iterator();
        CSVRecord first = advance();
        this.header = first == null ? List.of() : normalizeHeader(first);
    }

    public static CsvTableReader open(InputStream input, CsvDialect dialect) throws IOException {
        CharsetDecoder decoder = dialect.charset().newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        BufferedReader reader = new BufferedReader(new InputStreamReader(new SourceStream(input), decoder));
        try {
            return new CsvTableReader(CSVParser.parse(reader, dialect.format()));
        } catch (UncheckedIOException e) {
            reader.close();
            throw e.getCause();
        } catch (MalformedTableException e) {
            reader.close();
            throw e;
        }
    }

    public static CsvTableReader open(Path file, CsvDialect dialect) throws IOException {
        return open(Files.newInputStream(file), dialect);
    }

    /**
     * @return normalized column names; empty for a file without any line
     */
    public List<String> header() {
        return header;
    }

    public long rowsRead() {
        return rowsRead;
    }

    @Override
    public Iterator<TabularRow> iterator() {
        if (iterated) {
            throw new IllegalStateException("Rows can only be iterated once");
        }
        iterated = true;
        return new Iterator<>() {
            private CSVRecord next = advance();

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public TabularRow next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                CSVRecord current = next;
                next = advance();
                rowsRead++;
                return toRow(current);
            }
        };
    }

    private TabularRow toRow(CSVRecord record) {
        List<String> cells = new ArrayList<>(record.size());
        for (String cell : record) {
            cells.add(cell);
        }
        return TabularRow.of(header, cells);
    }

    private CSVRecord advance() {
        try {
            return records.hasNext() ? records.next() : null;
        } catch (UncheckedIOException e) {
            throw classify(e.getCause());
        } catch (IllegalStateException e) {
            // older commons-csv releases wrap read failures this way
            if (e.getCause() instanceof IOException) {
                throw classify((IOException) e.getCause());
            }
            throw e;
        }
    }

    private RuntimeException classify(IOException error) {
        if (error instanceof SourceReadException) {
            return new UncheckedIOException((IOException) error.getCause());
        }
        return new MalformedTableException(parser.getCurrentLineNumber(), error);
    }

    private static List<String> normalizeHeader(CSVRecord record) {
        List<String> names = new ArrayList<>(record.size());
        for (String name : record) {
            String normalized = name == null ? "" : name;
            if (names.isEmpty() && !normalized.isEmpty() && normalized.charAt(0) == BYTE_ORDER_MARK) {
                normalized = normalized.substring(1);
            }
            names.add(normalized.strip());
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    /**
     * Marks failures of the wrapped stream so they can be told apart from parse and decode errors.
     */
    private static final class SourceReadException extends IOException {

        SourceReadException(IOException cause) {
            super(cause.getMessage(), cause);
        }
    }

    private static final class SourceStream extends FilterInputStream {

        SourceStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            try {
                return super.read();
            } catch (IOException e) {
                throw new SourceReadException(e);
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            try {
                return super.read(b, off, len);
            } catch (IOException e) {
                throw new SourceReadException(e);
            }
        }
    }
}
