package com.cnj.saude.extract;

import com.cnj.saude.config.ConfigurationException;
import com.cnj.saude.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds source archives under the input root, one {@link SourceGroup} per recognized
 * region or category directory.
 */
public class ArchiveLocator {

    private static final Logger log = LoggerFactory.getLogger(ArchiveLocator.class);

    private static final String ARCHIVE_EXTENSION = ".zip";

    private final Path root;
    private final List<String> regions;

    public ArchiveLocator(PipelineConfig config) {
        this(config.getInputRoot(), config.getRegions());
    }

    public ArchiveLocator(Path root, List<String> regions) {
        this.root = root;
        this.regions = List.copyOf(regions);
    }

    /**
     * Returns the groups in configured region order. Directory names match case-insensitively;
     * archives are collected recursively when the stream reaches each group.
     *
     * @throws ConfigurationException if the root directory does not exist
     */
    public Stream<SourceGroup> locate() {
        if (!Files.isDirectory(root)) {
            throw new ConfigurationException("Input directory not found: " + root.toAbsolutePath());
        }

        Map<String, Path> subdirectories = listSubdirectories();

        return regions.stream()
            .map(region -> {
                Path dir = subdirectories.get(region.toLowerCase(Locale.ROOT));
                if (dir == null) {
                    log.warn("Directory for region {} not found under {}. Skipping.", region, root);
                    return null;
                }
                return new SourceGroup(region, dir, findArchives(dir));
            })
            .filter(Objects::nonNull);
    }

    private Map<String, Path> listSubdirectories() {
        Map<String, Path> byName = new LinkedHashMap<>();
        try (Stream<Path> children = Files.list(root)) {
            for (Path child : children.filter(Files::isDirectory).sorted().collect(Collectors.toList())) {
                String key = child.getFileName().toString().toLowerCase(Locale.ROOT);
                if (!isRecognized(key)) {
                    log.debug("Ignoring unrecognized directory {}", child);
                    continue;
                }
                byName.putIfAbsent(key, child);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list input directory: " + root.toAbsolutePath(), e);
        }
        return byName;
    }

    private boolean isRecognized(String lowerCaseName) {
        return regions.stream().anyMatch(region -> region.toLowerCase(Locale.ROOT).equals(lowerCaseName));
    }

    private List<Path> findArchives(Path dir) {
        try (Stream<Path> files = Files.walk(dir)) {
            List<Path> archives = files
                .filter(Files::isRegularFile)
                .filter(ArchiveLocator::isArchive)
                .sorted()
                .collect(Collectors.toList());
            if (archives.isEmpty()) {
                log.warn("No archive found in {}", dir);
            } else {
                log.debug("Found {} archive(s) in {}", archives.size(), dir);
            }
            return archives;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot scan directory: " + dir.toAbsolutePath(), e);
        }
    }

    static boolean isArchive(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ARCHIVE_EXTENSION);
    }
}
