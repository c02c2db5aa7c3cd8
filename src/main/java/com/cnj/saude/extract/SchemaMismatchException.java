package com.cnj.saude.extract;

import com.cnj.saude.PipelineException;

import java.util.List;

/**
 * Signals that a tabular file lacks some of the projected columns. Recovered by substituting
 * the neutral marker unless strict schema checking is enabled.
 */
public class SchemaMismatchException extends PipelineException {

    private final String source;
    private final List<String> missingColumns;

    public SchemaMismatchException(String source, List<String> missingColumns) {
        super("Columns missing in " + source + ": " + missingColumns);
        this.source = source;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String getSource() {
        return source;
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
