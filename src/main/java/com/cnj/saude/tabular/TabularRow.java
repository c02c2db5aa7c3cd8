package com.cnj.saude.tabular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One data row of a tabular file, keyed by column name.
 *
 * <p>Court exports drift in schema, so rows are not bound to a fixed set of columns.
 * Presence is checked when a value is asked for, and absent columns read as a caller-supplied
 * neutral marker.
 */
public final class TabularRow {

    private final Map<String, String> values;

    public TabularRow(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Builds a row from parallel column and value lists. Values beyond the column count are ignored,
     * missing trailing values are stored as empty strings, and a repeated column name keeps its
     * first value.
     */
    public static TabularRow of(List<String> columns, List<String> cells) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String cell = i < cells.size() ? cells.get(i) : "";
            values.putIfAbsent(columns.get(i), cell == null ? "" : cell);
        }
        return new TabularRow(values);
    }

    /**
     * @return the cell value, or {@code null} when the column is not part of this row
     */
    public String get(String column) {
        return values.get(column);
    }

    public String getOrDefault(String column, String neutralMarker) {
        return values.getOrDefault(column, neutralMarker);
    }

    public List<String> columns() {
        return new ArrayList<>(values.keySet());
    }

    /**
     * Re-orders this row onto {@code columns}, substituting {@code neutralMarker} for absent ones.
     */
    public List<String> project(List<String> columns, String neutralMarker) {
        List<String> projected = new ArrayList<>(columns.size());
        for (String column : columns) {
            projected.add(values.getOrDefault(column, neutralMarker));
        }
        return projected;
    }

    @Override
    public String toString() {
        return "TabularRow" + values;
    }
}
