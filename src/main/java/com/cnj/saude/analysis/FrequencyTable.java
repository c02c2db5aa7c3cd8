package com.cnj.saude.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Count and percentage per distinct value of one column, over one record subset.
 *
 * <p>Entries are ordered by descending count; equal counts are ordered by value
 * ({@link String#compareTo}). Percentages are {@code 100 * count / total} rounded half-up to
 * two decimals. A table over an empty subset has no entries.
 */
public final class FrequencyTable {

    public static final int PERCENT_SCALE = 2;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final Comparator<Map.Entry<String, Long>> ORDER =
        Map.Entry.<String, Long>comparingByValue().reversed()
            .thenComparing(Map.Entry.comparingByKey());

    private final AnalysisSubset subset;
    private final String column;
    private final long total;
    private final List<FrequencyEntry> entries;

    private FrequencyTable(AnalysisSubset subset, String column, long total, List<FrequencyEntry> entries) {
        this.subset = subset;
        this.column = column;
        this.total = total;
        this.entries = List.copyOf(entries);
    }

    /**
     * @param counts occurrences per value
     * @param total  denominator for percentages; rows of the subset, or item occurrences when
     *               multi-valued cells are split
     */
    public static FrequencyTable of(AnalysisSubset subset, String column, Map<String, Long> counts, long total) {
        if (total == 0) {
            return new FrequencyTable(subset, column, 0, List.of());
        }
        List<FrequencyEntry> entries = new ArrayList<>(counts.size());
        counts.entrySet().stream()
            .sorted(ORDER)
            .forEach(e -> entries.add(new FrequencyEntry(e.getKey(), e.getValue(), percentage(e.getValue(), total))));
        return new FrequencyTable(subset, column, total, entries);
    }

    public static BigDecimal percentage(long count, long total) {
        return BigDecimal.valueOf(count)
            .multiply(HUNDRED)
            .divide(BigDecimal.valueOf(total), PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public AnalysisSubset getSubset() {
        return subset;
    }

    public String getColumn() {
        return column;
    }

    public long getTotal() {
        return total;
    }

    public List<FrequencyEntry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public long countSum() {
        return entries.stream().mapToLong(FrequencyEntry::count).sum();
    }

    public BigDecimal percentageSum() {
        return entries.stream().map(FrequencyEntry::percentage).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public String toString() {
        return "FrequencyTable{" + subset + ", column='" + column + "', total=" + total
            + ", distinct=" + entries.size() + "}";
    }
}
