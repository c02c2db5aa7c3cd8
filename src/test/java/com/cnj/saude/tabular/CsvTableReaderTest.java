package com.cnj.saude.tabular;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvTableReaderTest {

    private static final CsvDialect DIALECT = new CsvDialect(';', StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private static CsvTableReader open(String content) throws IOException {
        return CsvTableReader.open(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), DIALECT);
    }

    @Test
    void shouldNormalizeHeaderNames() throws IOException {
        try (CsvTableReader reader = open("\uFEFFTribunal ; Processo\nTJSP;123\n")) {
            assertThat(reader.header()).containsExactly("Tribunal", "Processo");
        }
    }

    @Test
    void shouldReadRowsByColumnName() throws IOException {
        try (CsvTableReader reader = open("Tribunal;Processo;Codigos assuntos\nTJSP;001;{12480, 10028}\nTJBA;002;12481\n")) {
            List<TabularRow> rows = new ArrayList<>();
            reader.forEach(rows::add);

            assertThat(rows).hasSize(2);
            assertThat(rows.get(0).get("Codigos assuntos")).isEqualTo("{12480, 10028}");
            assertThat(rows.get(1).get("Tribunal")).isEqualTo("TJBA");
            assertThat(reader.rowsRead()).isEqualTo(2);
        }
    }

    @Test
    void shouldPadShortRows() throws IOException {
        try (CsvTableReader reader = open("a;b;c\n1\n")) {
            TabularRow row = reader.iterator().next();

            assertThat(row.get("a")).isEqualTo("1");
            assertThat(row.get("c")).isEmpty();
            assertThat(row.get("missing")).isNull();
        }
    }

    @Test
    void shouldReturnEmptyHeaderForEmptyInput() throws IOException {
        try (CsvTableReader reader = open("")) {
            assertThat(reader.header()).isEmpty();
            assertThat(reader.iterator().hasNext()).isFalse();
        }
    }

    @Test
    void shouldIterateOnlyOnce() throws IOException {
        try (CsvTableReader reader = open("a\n1\n")) {
            reader.iterator();

            assertThatThrownBy(reader::iterator).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void shouldKeepTextAfterClosingQuoteInTheCell() throws IOException {
        List<TabularRow> rows = new ArrayList<>();
        try (CsvTableReader reader = open("a;b\n\"Hospital Santa Casa\" de Salvador;1\n2;3\n")) {
            reader.forEach(rows::add);
        }

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).get("a")).startsWith("Hospital Santa Casa").endsWith("Salvador");
        assertThat(rows.get(0).get("b")).isEqualTo("1");
    }

    @Test
    void shouldCloseQuoteLeftOpenAtEndOfInput() throws IOException {
        List<TabularRow> rows = new ArrayList<>();
        try (CsvTableReader reader = open("a;b\n1;\"unterminated\n")) {
            reader.forEach(rows::add);
        }

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.get("a")).isEqualTo("1");
            assertThat(row.get("b")).startsWith("unterminated");
        });
    }

    @Test
    void shouldReportBytesInvalidForTheEncoding() {
        byte[] latin1 = "a;b\nMunic\u00edpio;1\n".getBytes(StandardCharsets.ISO_8859_1);

        assertThatThrownBy(() -> {
            try (CsvTableReader reader = CsvTableReader.open(new ByteArrayInputStream(latin1), DIALECT)) {
                reader.forEach(row -> { });
            }
        }).isInstanceOf(MalformedTableException.class);
    }

    @Test
    void shouldSurfaceStreamFailuresAsIoErrors() {
        InputStream failing = new SequenceInputStream(
            new ByteArrayInputStream("a;b\n1;2\n".getBytes(StandardCharsets.UTF_8)),
            new InputStream() {
                @Override
                public int read() throws IOException {
                    throw new IOException("disk gone");
                }
            });

        assertThatThrownBy(() -> {
            try (CsvTableReader reader = CsvTableReader.open(failing, DIALECT)) {
                reader.forEach(row -> { });
            }
        }).isInstanceOfAny(IOException.class, UncheckedIOException.class)
            .isNotInstanceOf(MalformedTableException.class)
            .hasMessageContaining("disk gone");
    }

    @Test
    void shouldWriteThroughTemporaryFile() throws IOException {
        Path target = tempDir.resolve("out.csv");

        try (CsvTableWriter writer = new CsvTableWriter(target, List.of("Item", "Contagem"), DIALECT)) {
            writer.writeRow(List.of("Municipio", "3"));
            assertThat(target).doesNotExist();
            writer.commit();
        }

        assertThat(Files.readString(target)).isEqualTo("Item;Contagem\nMunicipio;3\n");
        assertThat(tempDir.resolve("out.csv.tmp")).doesNotExist();
    }

    @Test
    void shouldKeepPreviousFileWhenNotCommitted() throws IOException {
        Path target = tempDir.resolve("out.csv");
        Files.writeString(target, "previous\n");

        try (CsvTableWriter writer = new CsvTableWriter(target, List.of("Item"), DIALECT)) {
            writer.writeRow(List.of("partial"));
        }

        assertThat(Files.readString(target)).isEqualTo("previous\n");
        assertThat(tempDir.resolve("out.csv.tmp")).doesNotExist();
    }
}
