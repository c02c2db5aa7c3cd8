package com.cnj.saude.extract;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * The tabular members of one opened archive, yielded lazily in archive order.
 * Can be iterated once; closing releases the archive handle.
 */
public class ArchiveContents implements Closeable, Iterable<TabularEntry> {

    private final Path archive;
    private final ZipFile zip;
    private boolean iterated;

    ArchiveContents(Path archive, ZipFile zip) {
        this.archive = archive;
        this.zip = zip;
    }

    @Override
    public Iterator<TabularEntry> iterator() {
        if (iterated) {
            throw new IllegalStateException("Archive entries can only be iterated once: " + archive);
        }
        iterated = true;
        Enumeration<? extends ZipEntry> entries = zip.entries();
        return new Iterator<>() {
            private ZipEntry next = advance();

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public TabularEntry next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                ZipEntry current = next;
                next = advance();
                return new TabularEntry(zip, current);
            }

            private ZipEntry advance() {
                while (entries.hasMoreElements()) {
                    ZipEntry candidate = entries.nextElement();
                    if (ArchiveExtractor.isTabular(candidate)) {
                        return candidate;
                    }
                }
                return null;
            }
        };
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }
}
