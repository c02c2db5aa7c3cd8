package com.cnj.saude.extract;

import com.cnj.saude.config.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveLocatorTest {

    @TempDir
    Path root;

    private List<SourceGroup> locate(List<String> regions) {
        try (Stream<SourceGroup> groups = new ArchiveLocator(root, regions).locate()) {
            return groups.collect(Collectors.toList());
        }
    }

    @Test
    void shouldYieldGroupsInConfiguredOrder() throws IOException {
        Files.createDirectories(root.resolve("SE"));
        Files.createDirectories(root.resolve("NE"));

        List<SourceGroup> groups = locate(List.of("NE", "SE"));

        assertThat(groups).extracting(SourceGroup::name).containsExactly("NE", "SE");
    }

    @Test
    void shouldMatchDirectoriesIgnoringCase() throws IOException {
        Files.createDirectories(root.resolve("trfs"));

        List<SourceGroup> groups = locate(List.of("TRFs"));

        assertThat(groups).singleElement().satisfies(group -> {
            assertThat(group.name()).isEqualTo("TRFs");
            assertThat(group.directory()).isEqualTo(root.resolve("trfs"));
        });
    }

    @Test
    void shouldSkipMissingRegions() throws IOException {
        Files.createDirectories(root.resolve("NE"));

        List<SourceGroup> groups = locate(List.of("NE", "NO"));

        assertThat(groups).extracting(SourceGroup::name).containsExactly("NE");
    }

    @Test
    void shouldIgnoreUnrecognizedDirectories() throws IOException {
        Files.createDirectories(root.resolve("backup"));
        Files.createDirectories(root.resolve("NE"));

        List<SourceGroup> groups = locate(List.of("NE"));

        assertThat(groups).hasSize(1);
    }

    @Test
    void shouldCollectArchivesRecursivelyInPathOrder() throws IOException {
        Path ne = Files.createDirectories(root.resolve("NE"));
        Files.createDirectories(ne.resolve("2023"));
        Files.writeString(ne.resolve("b.zip"), "");
        Files.writeString(ne.resolve("a.ZIP"), "");
        Files.writeString(ne.resolve("2023").resolve("c.zip"), "");
        Files.writeString(ne.resolve("readme.txt"), "");

        SourceGroup group = locate(List.of("NE")).get(0);

        assertThat(group.archives()).extracting(p -> root.relativize(p).toString().replace('\\', '/'))
            .containsExactly("NE/2023/c.zip", "NE/a.ZIP", "NE/b.zip");
    }

    @Test
    void shouldFailWhenRootIsMissing() {
        ArchiveLocator locator = new ArchiveLocator(root.resolve("absent"), List.of("NE"));

        assertThatThrownBy(locator::locate)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Input directory not found");
    }
}
