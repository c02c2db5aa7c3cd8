package com.cnj.saude.extract;

import java.nio.file.Path;
import java.util.List;

/**
 * A region or court category with every archive found beneath its directory.
 *
 * @param name      configured group name, used in output file names
 * @param directory the matched subdirectory of the input root
 * @param archives  archive paths in sorted order, possibly empty
 */
public record SourceGroup(String name, Path directory, List<Path> archives) {

    public SourceGroup {
        archives = List.copyOf(archives);
    }
}
