package com.cnj.saude.extract;

import com.cnj.saude.tabular.TabularRow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SubjectFilterTest {

    private static final String COLUMN = "Codigos assuntos";

    private final SubjectFilter filter = new SubjectFilter(COLUMN, Set.of(12480, 12481));

    private static TabularRow row(String subjects) {
        return TabularRow.of(List.of("Processo", COLUMN), List.of("001", subjects));
    }

    @Test
    void shouldRetainSingleAllowedCode() {
        assertThat(filter.evaluate(row("12480"))).isEqualTo(SubjectFilter.Verdict.RETAINED);
    }

    @Test
    void shouldRetainWhenAnyCodeOfListIsAllowed() {
        assertThat(filter.accepts(row("{10028, 12481}"))).isTrue();
    }

    @Test
    void shouldRejectUnlistedCodes() {
        assertThat(filter.evaluate(row("{99999, 10028}"))).isEqualTo(SubjectFilter.Verdict.REJECTED);
    }

    @Test
    void shouldNotMatchCodePrefixes() {
        assertThat(filter.evaluate(row("124800"))).isEqualTo(SubjectFilter.Verdict.REJECTED);
    }

    @Test
    void shouldFlagCellsWithoutCodes() {
        assertThat(filter.evaluate(row(""))).isEqualTo(SubjectFilter.Verdict.UNPARSABLE);
        assertThat(filter.evaluate(row("sem assunto"))).isEqualTo(SubjectFilter.Verdict.UNPARSABLE);
        assertThat(filter.evaluate(TabularRow.of(List.of("Processo"), List.of("001"))))
            .isEqualTo(SubjectFilter.Verdict.UNPARSABLE);
    }

    @Test
    void shouldKeepRetainedRowsInOrder() {
        List<TabularRow> retained = filter.filter(List.of(row("12481"), row("1"), row("{12480}"), row("")));

        assertThat(retained).extracting(r -> r.get(COLUMN)).containsExactly("12481", "{12480}");
    }
}
