package com.cnj.saude.extract;

import com.cnj.saude.TestArchives;
import com.cnj.saude.config.PipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.cnj.saude.TestArchives.cells;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsolidatorTest {

    @TempDir
    Path tempDir;

    private PipelineConfig config;

    @BeforeEach
    void setUp() throws IOException {
        config = TestArchives.config(tempDir);
        Files.createDirectories(config.getRegionalOutputDir());
        Files.createDirectories(config.getOutputDir());
    }

    @Test
    void shouldConcatenateRegionalFilesInOrder() throws IOException {
        Path ne = TestArchives.writeCsv(config.getRegionalFile("NE"), cells("Tribunal", "Processo"),
            List.of(cells("TJBA", "001"), cells("TJPE", "002")));
        Path se = TestArchives.writeCsv(config.getRegionalFile("SE"), cells("Tribunal", "Processo"),
            List.of(cells("TJSP", "003")));

        ConsolidationResult result = new Consolidator(config).consolidate(List.of(ne, se));

        assertThat(result.rows()).isEqualTo(3);
        assertThat(result.file()).isEqualTo(config.getConsolidatedFile());
        assertThat(Files.readAllLines(result.file()))
            .containsExactly("Tribunal;Processo", "TJBA;001", "TJPE;002", "TJSP;003");
    }

    @Test
    void shouldUnionSchemasInFirstSeenOrder() throws IOException {
        Path ne = TestArchives.writeCsv(config.getRegionalFile("NE"), cells("Tribunal", "Processo"),
            List.of(cells("TJBA", "001")));
        Path se = TestArchives.writeCsv(config.getRegionalFile("SE"), cells("Processo", "Ano"),
            List.of(cells("002", "2022")));
        config.setNeutralMarker("N/D");

        ConsolidationResult result = new Consolidator(config).consolidate(List.of(ne, se));

        assertThat(result.columns()).containsExactly("Tribunal", "Processo", "Ano");
        assertThat(Files.readAllLines(result.file()))
            .containsExactly("Tribunal;Processo;Ano", "TJBA;001;N/D", "N/D;002;2022");
    }

    @Test
    void shouldConsolidatePersistedDirectory() throws IOException {
        // Given
        TestArchives.writeCsv(config.getRegionalFile("CO"), cells("Tribunal"), List.of(cells("TJGO")));
        TestArchives.writeCsv(config.getRegionalFile("SE"), cells("Tribunal"), List.of(cells("TJSP")));
        TestArchives.writeCsv(config.getRegionalFile("NE"), cells("Tribunal"), List.of(cells("TJBA")));
        TestArchives.writeCsv(config.getRegionalFile("XX"), cells("Tribunal"), List.of(cells("STALE")));

        // When
        ConsolidationResult result = new Consolidator(config).consolidateDirectory();

        // Then
        assertThat(result.inputFiles()).extracting(p -> p.getFileName().toString())
            .containsExactly("dados_saude_NE.csv", "dados_saude_SE.csv", "dados_saude_CO.csv");
        assertThat(Files.readAllLines(result.file())).containsExactly("Tribunal", "TJBA", "TJSP", "TJGO");
    }

    @Test
    void shouldFailWithoutRegionalFiles() {
        assertThatThrownBy(() -> new Consolidator(config).consolidateDirectory())
            .isInstanceOf(ConsolidationException.class)
            .hasMessageContaining("No regional dataset");
        assertThat(config.getConsolidatedFile()).doesNotExist();
    }
}
