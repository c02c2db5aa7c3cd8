package com.cnj.saude.report;

import com.cnj.saude.TestArchives;
import com.cnj.saude.analysis.AnalysisReport;
import com.cnj.saude.analysis.AnalysisResult;
import com.cnj.saude.analysis.FrequencyAnalyzer;
import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.tabular.TabularRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvReportSinkTest {

    @TempDir
    Path tempDir;

    private PipelineConfig config;
    private AnalysisReport report;

    @BeforeEach
    void setUp() throws IOException {
        config = TestArchives.config(tempDir);
        config.setAnalysisColumns(List.of(PipelineConfig.COLUMN_PASSIVE_NATURE));
        Files.createDirectories(config.getReportsDir());

        List<String> columns = List.of(PipelineConfig.COLUMN_PROCESS, PipelineConfig.COLUMN_PASSIVE_NATURE);
        List<TabularRow> rows = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            rows.add(TabularRow.of(columns, List.of("p" + i, "Natureza " + (char) ('A' + i))));
        }
        rows.add(TabularRow.of(columns, List.of("p12", "Municipio")));
        rows.add(TabularRow.of(columns, List.of("p13", "Municipio")));
        AnalysisResult result = new FrequencyAnalyzer(config).analyze("Brasil Consolidado", rows);
        report = AnalysisReport.of(List.of(result));
    }

    @Test
    void shouldWriteOneFilePerTable() throws IOException {
        CsvReportSink sink = new CsvReportSink(config);

        sink.publish(report);

        assertThat(sink.getWrittenFiles()).extracting(p -> p.getFileName().toString()).containsExactly(
            "analise_saude_cnj_geral_brasil_consolidado_polo_passivo_natureza_juridica.csv",
            "analise_saude_cnj_entes_publicos_brasil_consolidado_polo_passivo_natureza_juridica.csv");
    }

    @Test
    void shouldWriteCompleteTableWithoutTopNCut() throws IOException {
        CsvReportSink sink = new CsvReportSink(config);

        sink.publish(report);

        List<String> lines = Files.readAllLines(sink.getWrittenFiles().get(0));
        assertThat(lines).hasSize(1 + 13);
        assertThat(lines.get(0)).isEqualTo("Item;Contagem;Percentual");
        assertThat(lines.get(1)).isEqualTo("Municipio;2;14.29");
        assertThat(lines.get(2)).isEqualTo("Natureza A;1;7.14");
    }

    @Test
    void shouldWriteHeaderOnlyForEmptySubset() throws IOException {
        config.setPublicEntityKeywords(List.of("NAO EXISTE"));
        AnalysisResult result = new FrequencyAnalyzer(config).analyze("Brasil Consolidado", List.of());
        CsvReportSink sink = new CsvReportSink(config);

        sink.publish(AnalysisReport.of(List.of(result)));

        assertThat(Files.readAllLines(sink.getWrittenFiles().get(1))).containsExactly("Item;Contagem;Percentual");
    }

    @Test
    void shouldBeDeterministic() throws IOException {
        CsvReportSink sink = new CsvReportSink(config);
        sink.publish(report);
        byte[] first = Files.readAllBytes(sink.getWrittenFiles().get(0));

        sink.publish(report);

        assertThat(Files.readAllBytes(sink.getWrittenFiles().get(0))).isEqualTo(first);
    }

    @Test
    void shouldSlugLabels() {
        assertThat(ReportNames.slug("Regional TRFs")).isEqualTo("regional_trfs");
        assertThat(ReportNames.slug("Códigos - assuntos")).isEqualTo("codigos_assuntos");
        assertThat(ReportNames.slug("  ")).isEqualTo("vazio");
    }
}
