package com.cnj.saude.extract;

import org.HdrHistogram.Histogram;

/**
 * Counters and archive timings for one source group.
 */
public class ExtractionMetrics {

    // 1 microsecond to 1 hour, 3 significant digits
    private static final long MAX_TRACKABLE_MICROS = 3_600_000_000L;

    private final String groupName;
    private final Histogram archiveLatencyHistogram;

    private long archivesProcessed;
    private long archivesSkipped;
    private long tabularFiles;
    private long tabularFilesSkipped;
    private long rowsRead;
    private long rowsRetained;
    private long rowsUnparsable;
    private long schemaMismatches;

    private long startTimeNanos;
    private long endTimeNanos;

    public ExtractionMetrics(String groupName) {
        this.groupName = groupName;
        this.archiveLatencyHistogram = new Histogram(1, MAX_TRACKABLE_MICROS, 3);
    }

    public void start() {
        this.startTimeNanos = System.nanoTime();
    }

    public void complete() {
        this.endTimeNanos = System.nanoTime();
    }

    /**
     * Adds the counts of an archive that was read to the end.
     */
    public void recordArchive(ArchiveTally tally, long latencyMicros) {
        archivesProcessed++;
        tabularFiles += tally.tabularFiles();
        tabularFilesSkipped += tally.tabularFilesSkipped();
        rowsRead += tally.rowsRead();
        rowsRetained += tally.rowsRetained();
        rowsUnparsable += tally.rowsUnparsable();
        schemaMismatches += tally.schemaMismatches();
        archiveLatencyHistogram.recordValue(Math.max(1, Math.min(latencyMicros, MAX_TRACKABLE_MICROS)));
    }

    public void recordSkippedArchive() {
        archivesSkipped++;
    }

    public String getGroupName() {
        return groupName;
    }

    public long getArchivesProcessed() {
        return archivesProcessed;
    }

    public long getArchivesSkipped() {
        return archivesSkipped;
    }

    public long getTabularFiles() {
        return tabularFiles;
    }

    public long getTabularFilesSkipped() {
        return tabularFilesSkipped;
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public long getRowsRetained() {
        return rowsRetained;
    }

    public long getRowsUnparsable() {
        return rowsUnparsable;
    }

    public long getSchemaMismatches() {
        return schemaMismatches;
    }

    public long getElapsedTimeMs() {
        long end = endTimeNanos > 0 ? endTimeNanos : System.nanoTime();
        return (end - startTimeNanos) / 1_000_000;
    }

    public double getAvgArchiveMs() {
        return archiveLatencyHistogram.getMean() / 1000.0;
    }

    public double getMaxArchiveMs() {
        return archiveLatencyHistogram.getMaxValue() / 1000.0;
    }

    public double getP95ArchiveMs() {
        return archiveLatencyHistogram.getValueAtPercentile(95.0) / 1000.0;
    }

    @Override
    public String toString() {
        return String.format(
            "ExtractionMetrics{group=%s, archives=%d, skipped=%d, files=%d, read=%d, retained=%d, " +
                "unparsable=%d, schemaMismatches=%d, elapsed=%dms, maxArchive=%.1fms}",
            groupName, archivesProcessed, archivesSkipped, tabularFiles, rowsRead, rowsRetained,
            rowsUnparsable, schemaMismatches, getElapsedTimeMs(), getMaxArchiveMs());
    }

    /**
     * Counts gathered while reading one archive. Only merged into the group once the archive
     * has been read completely.
     */
    public static final class ArchiveTally {
        private long tabularFiles;
        private long tabularFilesSkipped;
        private long rowsRead;
        private long rowsRetained;
        private long rowsUnparsable;
        private long schemaMismatches;

        void tabularFile() {
            tabularFiles++;
        }

        void tabularFileSkipped() {
            tabularFilesSkipped++;
        }

        void rowRead() {
            rowsRead++;
        }

        void rowRetained() {
            rowsRetained++;
        }

        void rowUnparsable() {
            rowsUnparsable++;
        }

        void schemaMismatch() {
            schemaMismatches++;
        }

        public long tabularFiles() {
            return tabularFiles;
        }

        public long tabularFilesSkipped() {
            return tabularFilesSkipped;
        }

        public long rowsRead() {
            return rowsRead;
        }

        public long rowsRetained() {
            return rowsRetained;
        }

        public long rowsUnparsable() {
            return rowsUnparsable;
        }

        public long schemaMismatches() {
            return schemaMismatches;
        }
    }
}
