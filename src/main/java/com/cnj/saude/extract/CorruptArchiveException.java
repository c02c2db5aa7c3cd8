package com.cnj.saude.extract;

import com.cnj.saude.PipelineException;

import java.nio.file.Path;

/**
 * Thrown when an archive cannot be opened or one of its members cannot be read to the end.
 * The pipeline recovers by skipping the archive.
 */
public class CorruptArchiveException extends PipelineException {

    private final Path archive;

    public CorruptArchiveException(Path archive, Throwable cause) {
        super("Cannot read archive " + archive.getFileName() + ": " + cause.getMessage(), cause);
        this.archive = archive;
    }

    public Path getArchive() {
        return archive;
    }
}
