package com.cnj.saude.extract;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a consolidation run.
 *
 * @param file       the national file
 * @param columns    union schema, in first-seen order
 * @param inputFiles regional files read, in order
 * @param rows       rows written, equal to the sum of the regional row counts
 */
public record ConsolidationResult(Path file, List<String> columns, List<Path> inputFiles, long rows) {}
