package com.cnj.saude.extract;

import java.io.IOException;
import java.io.InputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * A tabular member of an open archive. The stream is only valid while the owning
 * {@link ArchiveContents} is open.
 */
public final class TabularEntry {

    private final ZipFile zip;
    private final ZipEntry entry;

    TabularEntry(ZipFile zip, ZipEntry entry) {
        this.zip = zip;
        this.entry = entry;
    }

    /**
     * @return the member name as stored in the archive, including any folder prefix
     */
    public String name() {
        return entry.getName();
    }

    /**
     * @return the member name without folders or extension
     */
    public String baseName() {
        String name = entry.getName();
        int slash = name.lastIndexOf('/');
        String file = slash >= 0 ? name.substring(slash + 1) : name;
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    public InputStream openStream() throws IOException {
        return zip.getInputStream(entry);
    }
}
