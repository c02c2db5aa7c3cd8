package com.cnj.saude.extract;

import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.tabular.TabularRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces rows to the fixed, ordered set of columns the analysis needs.
 */
public class ColumnProjector {

    private static final Logger log = LoggerFactory.getLogger(ColumnProjector.class);

    private final List<String> columns;
    private final String neutralMarker;
    private final boolean strict;

    public ColumnProjector(PipelineConfig config) {
        this(config.getProjectedColumns(), config.getNeutralMarker(), config.isStrictSchema());
    }

    public ColumnProjector(List<String> columns, String neutralMarker, boolean strict) {
        this.columns = List.copyOf(columns);
        this.neutralMarker = neutralMarker;
        this.strict = strict;
    }

    public List<String> columns() {
        return columns;
    }

    /**
     * Compares a source header with the projected columns.
     *
     * @param header column names of the source file
     * @param source file name used in messages
     * @return the projected columns missing from the header, in projection order
     * @throws SchemaMismatchException if columns are missing and strict checking is on
     */
    public List<String> checkSchema(List<String> header, String source) {
        List<String> missing = new ArrayList<>();
        for (String column : columns) {
            if (!header.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            SchemaMismatchException mismatch = new SchemaMismatchException(source, missing);
            if (strict) {
                throw mismatch;
            }
            log.warn("{}. Using neutral marker '{}' instead.", mismatch.getMessage(), neutralMarker);
        }
        return missing;
    }

    /**
     * @return the row's values in projection order, neutral marker for absent columns
     */
    public List<String> project(TabularRow row) {
        return row.project(columns, neutralMarker);
    }
}
