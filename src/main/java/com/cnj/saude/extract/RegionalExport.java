package com.cnj.saude.extract;

import java.nio.file.Path;

/**
 * A regional file written by {@link RegionalExporter}.
 */
public record RegionalExport(String groupName, Path file, long rows) {}
