package com.cnj.saude.extract;

import com.cnj.saude.tabular.TabularRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnProjectorTest {

    private static final List<String> COLUMNS = List.of("Tribunal", "Processo", "Polo passivo");

    @Test
    void shouldProjectInConfiguredOrder() {
        ColumnProjector projector = new ColumnProjector(COLUMNS, "", false);
        TabularRow row = TabularRow.of(List.of("Polo passivo", "Classe", "Processo", "Tribunal"),
            List.of("Municipio de Recife", "Comum", "001", "TJPE"));

        assertThat(projector.project(row)).containsExactly("TJPE", "001", "Municipio de Recife");
    }

    @Test
    void shouldFillMissingColumnsWithNeutralMarker() {
        ColumnProjector projector = new ColumnProjector(COLUMNS, "N/D", false);
        TabularRow row = TabularRow.of(List.of("Tribunal"), List.of("TJBA"));

        assertThat(projector.project(row)).containsExactly("TJBA", "N/D", "N/D");
    }

    @Test
    void shouldReportMissingColumnsLeniently() {
        ColumnProjector projector = new ColumnProjector(COLUMNS, "", false);

        List<String> missing = projector.checkSchema(List.of("Tribunal"), "a.csv");

        assertThat(missing).containsExactly("Processo", "Polo passivo");
    }

    @Test
    void shouldRejectMissingColumnsWhenStrict() {
        ColumnProjector projector = new ColumnProjector(COLUMNS, "", true);

        assertThatThrownBy(() -> projector.checkSchema(List.of("Tribunal", "Processo"), "a.csv"))
            .isInstanceOf(SchemaMismatchException.class)
            .hasMessageContaining("a.csv")
            .hasMessageContaining("Polo passivo")
            .satisfies(e -> {
                SchemaMismatchException mismatch = (SchemaMismatchException) e;
                assertThat(mismatch.getSource()).isEqualTo("a.csv");
                assertThat(mismatch.getMissingColumns()).containsExactly("Polo passivo");
            });
    }

    @Test
    void shouldAcceptCompleteHeader() {
        ColumnProjector projector = new ColumnProjector(COLUMNS, "", true);

        assertThat(projector.checkSchema(List.of("Processo", "Polo passivo", "Tribunal", "Ano"), "a.csv")).isEmpty();
    }
}
