package com.ganesh.store.index.wal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Write-ahead log for the record index.
 *
 * <p>Every mutation is appended here before it reaches the memtable, so a crash loses nothing that
 * a caller saw acknowledged (modulo the batched fsync, see {@link #writeEntry(LogEntry)}).
 *
 * <p>The log is split into segments named by a monotonically increasing number. A segment is
 * retired when its memtable is frozen for flushing and deleted once the flush has produced an
 * SSTable. Segments found on disk at startup are replayed and then retired together with the
 * first segment written by this process.
 *
 * @see LogEntry
 */
public class WriteAheadLog implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WriteAheadLog.class);

    public static final String WAL_FILE_EXTENSION = ".wal";

    private final Path directory;
    private final int syncInterval;

    /** Segments recovered at startup; they stay on disk until the next memtable flush covers them. */
    private final List<Path> recoveredSegments = new ArrayList<>();
    private Path currentSegment;
    private long lastSegmentNumber;
    private DataOutputStream logWriter;
    private FileOutputStream fileOutputStream;
    private int writesSinceLastSync = 0;

    /**
     * Opens a log in the given directory. Existing segments are not touched until
     * {@link #replay(Map)} is called.
     *
     * @param directory    Directory holding the {@code .wal} segments.
     * @param syncInterval Number of writes between forced disk syncs.
     */
    public WriteAheadLog(Path directory, int syncInterval) {
        this.directory = directory;
        this.syncInterval = syncInterval;
    }

    /**
     * Replays every existing segment, oldest first, into the given map and then opens a fresh
     * segment for new writes.
     *
     * @param memtable The map to populate, keyed by record key.
     * @return The number of entries replayed.
     * @throws IOException if a segment cannot be read or the new segment cannot be created.
     */
    public synchronized int replay(Map<String, LogEntry> memtable) throws IOException {
        logger.info("Starting WAL recovery in {}", directory);
        List<Path> segments = listSegments();
        int totalRecords = 0;
        for (Path segment : segments) {
            logger.info("Replaying WAL segment: {}", segment.getFileName());
            try (InputStream in = Files.newInputStream(segment);
                 DataInputStream dis = new DataInputStream(new BufferedInputStream(in))) {
                while (true) {
                    LogEntry entry;
                    try {
                        entry = LogEntry.readFrom(dis);
                    } catch (EOFException e) {
                        break;
                    }
                    memtable.put(entry.getKey(), entry);
                    totalRecords++;
                }
            } catch (IOException e) {
                // A torn tail from a crash mid-write; everything before it was applied.
                logger.warn("WAL segment {} ends with a partial entry, stopping replay of this segment", segment.getFileName(), e);
            }
            lastSegmentNumber = Math.max(lastSegmentNumber, segmentNumber(segment));
        }
        recoveredSegments.addAll(segments);
        if (segments.isEmpty()) {
            logger.info("No WAL files found. No recovery needed.");
        } else {
            logger.info("WAL recovery complete. Replayed {} records from {} segment(s).", totalRecords, segments.size());
        }
        rollNewSegment();
        return totalRecords;
    }

    /**
     * Closes the active segment and starts a new one.
     *
     * @return Every segment whose contents are now only needed until the frozen memtable is
     * flushed: the segment just closed plus any segments recovered at startup.
     * @throws IOException if the new segment cannot be created.
     */
    public synchronized List<Path> rollNewSegment() throws IOException {
        List<Path> retired = new ArrayList<>(recoveredSegments);
        recoveredSegments.clear();
        if (logWriter != null) {
            logWriter.close();
            retired.add(currentSegment);
        }

        lastSegmentNumber = Math.max(lastSegmentNumber + 1, System.currentTimeMillis());
        this.currentSegment = directory.resolve(lastSegmentNumber + WAL_FILE_EXTENSION);
        this.fileOutputStream = new FileOutputStream(currentSegment.toFile(), true);
        this.logWriter = new DataOutputStream(new BufferedOutputStream(fileOutputStream));
        this.writesSinceLastSync = 0;
        logger.info("Rolled to new WAL segment: {}", currentSegment.getFileName());
        return retired;
    }

    /**
     * Appends an entry. The data reaches the OS immediately; a physical sync is forced every
     * {@code syncInterval} writes.
     *
     * @param entry The entry to persist.
     * @throws IOException if the write fails.
     */
    public synchronized void writeEntry(LogEntry entry) throws IOException {
        if (logWriter == null) {
            throw new IllegalStateException("WAL is not open, call replay() first");
        }
        entry.writeTo(logWriter);
        logWriter.flush();
        writesSinceLastSync++;

        if (writesSinceLastSync >= syncInterval) {
            fileOutputStream.getChannel().force(true);
            writesSinceLastSync = 0;
        }
    }

    /**
     * Deletes segments whose contents have been flushed to an SSTable.
     *
     * @param segments Segments previously returned by {@link #rollNewSegment()}.
     * @throws IOException if a segment cannot be deleted.
     */
    public void deleteSegments(List<Path> segments) throws IOException {
        for (Path segment : segments) {
            Files.deleteIfExists(segment);
            logger.debug("Deleted retired WAL segment {}", segment.getFileName());
        }
    }

    private List<Path> listSegments() throws IOException {
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> p.getFileName().toString().endsWith(WAL_FILE_EXTENSION))
                    .sorted((a, b) -> Long.compare(segmentNumber(a), segmentNumber(b)))
                    .collect(Collectors.toList());
        }
    }

    private static long segmentNumber(Path segment) {
        String name = segment.getFileName().toString();
        return Long.parseLong(name.substring(0, name.length() - WAL_FILE_EXTENSION.length()));
    }

    /**
     * Syncs and closes the active segment.
     *
     * @throws IOException if the final sync or close fails.
     */
    @Override
    public synchronized void close() throws IOException {
        if (logWriter != null) {
            logWriter.flush();
            fileOutputStream.getChannel().force(true);
            logWriter.close();
            logWriter = null;
        }
    }
}
