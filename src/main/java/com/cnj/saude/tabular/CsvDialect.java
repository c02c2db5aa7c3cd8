package com.cnj.saude.tabular;

import org.apache.commons.csv.CSVFormat;

import java.nio.charset.Charset;

/**
 * Delimiter and encoding of the CNJ exports and of every file this tool writes.
 *
 * <p>Parsing is lenient about quotes: text after a closing quote stays in the cell
 * ({@code "Hospital Santa Casa" de Salvador}) and a quote left open at the end of the file closes
 * the last cell.
 *
 * @param delimiter field separator, {@code ;} in the CNJ exports
 * @param charset   file encoding
 */
public record CsvDialect(char delimiter, Charset charset) {

    public CSVFormat format() {
        return CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setRecordSeparator("\n")
            .setTrailingData(true)
            .setLenientEof(true)
            .build();
    }
}
