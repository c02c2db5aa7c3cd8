package com.cnj.saude.extract;

import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.tabular.MultiValues;
import com.cnj.saude.tabular.TabularRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Keeps the rows whose subject-code cell names at least one code of the health allow-list.
 *
 * <p>The cell may carry one code or a list such as {@code {12480, 10028}}; every run of digits
 * counts as a candidate code.
 */
public class SubjectFilter {

    private static final Logger log = LoggerFactory.getLogger(SubjectFilter.class);

    public enum Verdict {
        RETAINED,
        REJECTED,
        // cell missing, blank, or without any digit
        UNPARSABLE
    }

    private final String subjectColumn;
    private final Set<Integer> allowedCodes;

    public SubjectFilter(PipelineConfig config) {
        this(config.getSubjectCodeColumn(), config.getSubjectCodes());
    }

    public SubjectFilter(String subjectColumn, Set<Integer> allowedCodes) {
        this.subjectColumn = subjectColumn;
        this.allowedCodes = Set.copyOf(allowedCodes);
    }

    public Verdict evaluate(TabularRow row) {
        List<Integer> codes = MultiValues.codes(row.get(subjectColumn));
        if (codes.isEmpty()) {
            return Verdict.UNPARSABLE;
        }
        for (Integer code : codes) {
            if (allowedCodes.contains(code)) {
                return Verdict.RETAINED;
            }
        }
        return Verdict.REJECTED;
    }

    public boolean accepts(TabularRow row) {
        return evaluate(row) == Verdict.RETAINED;
    }

    /**
     * Returns the retained rows in their original order.
     */
    public List<TabularRow> filter(Iterable<TabularRow> rows) {
        List<TabularRow> retained = new ArrayList<>();
        long unparsable = 0;
        for (TabularRow row : rows) {
            Verdict verdict = evaluate(row);
            if (verdict == Verdict.RETAINED) {
                retained.add(row);
            } else if (verdict == Verdict.UNPARSABLE) {
                unparsable++;
            }
        }
        if (unparsable > 0) {
            log.debug("Skipped {} row(s) without a readable '{}' value", unparsable, subjectColumn);
        }
        return retained;
    }
}
