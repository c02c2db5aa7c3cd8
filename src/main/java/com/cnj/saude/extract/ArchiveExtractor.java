package com.cnj.saude.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Opens source archives and exposes their tabular members.
 *
 * <p>Members are streamed straight out of the archive rather than unpacked to disk. Anything
 * that is not a {@code .csv} file is skipped.
 */
public class ArchiveExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    static final String TABULAR_EXTENSION = ".csv";

    /**
     * Opens an archive. The caller owns the returned contents and must close them.
     *
     * @throws CorruptArchiveException if the file is not a readable archive
     */
    public ArchiveContents open(Path archive) {
        log.debug("Opening archive {}", archive);
        try {
            return new ArchiveContents(archive, new ZipFile(archive.toFile()));
        } catch (IOException e) {
            throw new CorruptArchiveException(archive, e);
        }
    }

    static boolean isTabular(ZipEntry entry) {
        return !entry.isDirectory()
            && entry.getName().toLowerCase(Locale.ROOT).endsWith(TABULAR_EXTENSION);
    }
}
