package com.cnj.saude.report;

import com.cnj.saude.analysis.FrequencyEntry;
import com.cnj.saude.analysis.FrequencyTable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a complete frequency table into the rows shown to readers.
 *
 * <p>The layout is: the {@code topN} most frequent values, one {@code Outros (k itens)} row
 * aggregating the remaining k values, one {@code Sigiloso} row for sealed records, and a closing
 * {@code TOTAL GERAL} row at 100.00%. Percentages are relative to the table total.
 */
public class ReportTableFormatter {

    public static final String OTHERS_LABEL = "Outros (%d itens)";
    public static final String SEALED_LABEL = "Sigiloso";
    public static final String TOTAL_LABEL = "TOTAL GERAL";
    public static final String EMPTY_LABEL = "(vazio)";

    private static final String SEALED_VALUE = "SIGILOSO";
    private static final String FULL_PERCENT = "100.00%";

    private final int topN;

    public ReportTableFormatter(int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be positive: " + topN);
        }
        this.topN = topN;
    }

    /**
     * One presented row.
     *
     * @param item        value or aggregate label
     * @param count       occurrences
     * @param percentText percentage with two decimals and a trailing {@code %}
     */
    public record ReportLine(String item, long count, String percentText) {}

    /**
     * @return the presented rows, empty when the table has no entries
     */
    public List<ReportLine> format(FrequencyTable table) {
        if (table.isEmpty()) {
            return List.of();
        }

        List<FrequencyEntry> ranked = new ArrayList<>();
        long sealed = 0;
        for (FrequencyEntry entry : table.getEntries()) {
            if (SEALED_VALUE.equalsIgnoreCase(entry.value().strip())) {
                sealed += entry.count();
            } else {
                ranked.add(entry);
            }
        }

        List<ReportLine> lines = new ArrayList<>();
        int shown = Math.min(topN, ranked.size());
        for (int i = 0; i < shown; i++) {
            FrequencyEntry entry = ranked.get(i);
            lines.add(new ReportLine(displayValue(entry.value()), entry.count(), percentText(entry.percentage())));
        }

        if (ranked.size() > topN) {
            long others = 0;
            for (int i = topN; i < ranked.size(); i++) {
                others += ranked.get(i).count();
            }
            lines.add(line(String.format(OTHERS_LABEL, ranked.size() - topN), others, table.getTotal()));
        }
        if (sealed > 0) {
            lines.add(line(SEALED_LABEL, sealed, table.getTotal()));
        }
        lines.add(new ReportLine(TOTAL_LABEL, table.getTotal(), FULL_PERCENT));
        return lines;
    }

    public int getTopN() {
        return topN;
    }

    static String displayValue(String value) {
        return value == null || value.isBlank() ? EMPTY_LABEL : value;
    }

    static String percentText(BigDecimal percentage) {
        return percentage.setScale(FrequencyTable.PERCENT_SCALE).toPlainString() + "%";
    }

    private static ReportLine line(String item, long count, long total) {
        return new ReportLine(item, count, percentText(FrequencyTable.percentage(count, total)));
    }
}
