package com.cnj.saude.extract;

import com.cnj.saude.TestArchives;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveExtractorTest {

    @TempDir
    Path tempDir;

    private final ArchiveExtractor extractor = new ArchiveExtractor();

    @Test
    void shouldYieldOnlyTabularMembers() throws IOException {
        Map<String, String> members = new LinkedHashMap<>();
        members.put("dados/TJBA_2023.csv", "a;b\n1;2\n");
        members.put("LEIAME.txt", "ignore me");
        members.put("TJSE.CSV", "a;b\n3;4\n");
        Path archive = TestArchives.zip(tempDir.resolve("NE.zip"), members);

        List<String> names = new ArrayList<>();
        List<String> baseNames = new ArrayList<>();
        try (ArchiveContents contents = extractor.open(archive)) {
            for (TabularEntry entry : contents) {
                names.add(entry.name());
                baseNames.add(entry.baseName());
            }
        }

        assertThat(names).containsExactly("dados/TJBA_2023.csv", "TJSE.CSV");
        assertThat(baseNames).containsExactly("TJBA_2023", "TJSE");
    }

    @Test
    void shouldStreamMemberContent() throws IOException {
        Path archive = TestArchives.zip(tempDir.resolve("a.zip"), "x.csv", "Tribunal\nTJPE\n");

        try (ArchiveContents contents = extractor.open(archive)) {
            TabularEntry entry = contents.iterator().next();
            try (InputStream in = entry.openStream()) {
                assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("Tribunal\nTJPE\n");
            }
        }
    }

    @Test
    void shouldReportUnreadableArchive() throws IOException {
        Path archive = TestArchives.corruptArchive(tempDir.resolve("broken.zip"));

        assertThatThrownBy(() -> extractor.open(archive))
            .isInstanceOf(CorruptArchiveException.class)
            .hasMessageContaining("broken.zip")
            .satisfies(e -> assertThat(((CorruptArchiveException) e).getArchive()).isEqualTo(archive));
    }
}
