package com.ganesh.store.index.sstable;

import com.ganesh.store.StoreMetrics;
import com.ganesh.store.index.wal.LogEntry;
import com.google.common.hash.BloomFilter;
import com.google.common.io.ByteStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Read access to a single SSTable file.
 *
 * <p>Point lookups go through {@link #find(String, StoreMetrics)}, which consults the Bloom filter
 * and the sparse index held in memory and then reads a single data block. Full ordered scans use a
 * {@link Scanner}, which reads through its own stream so that scans and lookups can run at the
 * same time.
 *
 * @see SSTableWriter
 */
public class SSTableReader implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(SSTableReader.class);

    private final RandomAccessFile raf;
    private final Path filePath;
    private final long sequence;
    private final List<IndexRecord> index = new ArrayList<>();
    private long indexOffset;
    private BloomFilter<CharSequence> bloomFilter;

    private static class IndexRecord {
        final String key;
        final long offset;
        IndexRecord(String key, long offset) { this.key = key; this.offset = offset; }
        String getKey() { return key; }
    }

    /**
     * Opens an SSTable and loads its index and Bloom filter.
     *
     * @param filePath The {@code .sst} file.
     * @throws IOException if the file cannot be opened or is malformed.
     */
    public SSTableReader(Path filePath) throws IOException {
        this.filePath = filePath;
        String fileName = filePath.getFileName().toString();
        this.sequence = Long.parseLong(fileName.substring(0, fileName.length() - SSTableWriter.SSTABLE_EXTENSION.length()));
        this.raf = new RandomAccessFile(filePath.toFile(), "r");
        try {
            if (raf.length() < SSTableWriter.FOOTER_BYTES) {
                throw new IOException("Invalid SSTable file (too small for footer): " + filePath);
            }
            loadMetadata();
        } catch (IOException e) {
            raf.close();
            throw e;
        }
    }

    private void loadMetadata() throws IOException {
        long footerOffset = raf.length() - SSTableWriter.FOOTER_BYTES;
        raf.seek(footerOffset);
        this.indexOffset = raf.readLong();
        long bloomFilterOffset = raf.readLong();
        if (indexOffset < 0 || indexOffset > bloomFilterOffset || bloomFilterOffset > footerOffset) {
            throw new IOException("Invalid SSTable footer in " + filePath);
        }

        byte[] filterBytes = new byte[(int) (footerOffset - bloomFilterOffset)];
        raf.seek(bloomFilterOffset);
        raf.readFully(filterBytes);
        this.bloomFilter = BloomFilter.readFrom(new ByteArrayInputStream(filterBytes), LogEntry.KEY_FUNNEL);

        raf.seek(indexOffset);
        while (raf.getFilePointer() < bloomFilterOffset) {
            String key = raf.readUTF();
            long offset = raf.readLong();
            index.add(new IndexRecord(key, offset));
        }
    }

    public long getSequence() {
        return sequence;
    }

    public Path getFilePath() {
        return filePath;
    }

    /**
     * Looks up a key: Bloom filter first, then a binary search of the sparse index, then a scan of
     * the one data block that can hold the key.
     *
     * @param key     The key to search for.
     * @param metrics Collector for Bloom filter statistics.
     * @return The entry (possibly a tombstone) if this table holds the key.
     * @throws IOException if the block cannot be read.
     */
    public synchronized Optional<LogEntry> find(String key, StoreMetrics metrics) throws IOException {
        metrics.bloomFilterChecks.increment();
        if (!bloomFilter.mightContain(key)) {
            metrics.bloomFilterHits.increment();
            return Optional.empty();
        }
        int blockIndex = Collections.binarySearch(index, new IndexRecord(key, 0), Comparator.comparing(IndexRecord::getKey));
        if (blockIndex < 0) {
            blockIndex = -blockIndex - 1;
        }
        if (blockIndex >= index.size()) {
            logger.debug("Key '{}' is past all block ranges in {}", key, filePath.getFileName());
            return Optional.empty();
        }

        long blockStart = index.get(blockIndex).offset;
        long blockEnd = (blockIndex + 1 < index.size()) ? index.get(blockIndex + 1).offset : indexOffset;
        byte[] blockData = new byte[(int) (blockEnd - blockStart)];
        raf.seek(blockStart);
        raf.readFully(blockData);

        try (DataInputStream blockStream = new DataInputStream(new ByteArrayInputStream(blockData))) {
            while (blockStream.available() > 0) {
                LogEntry entry = LogEntry.readFrom(blockStream);
                int comparison = entry.getKey().compareTo(key);
                if (comparison == 0) return Optional.of(entry);
                if (comparison > 0) return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Opens an ordered scan over every entry in this table, tombstones included.
     *
     * @return A new scanner that must be closed by the caller.
     * @throws IOException if the file cannot be opened.
     */
    public Scanner scan() throws IOException {
        return new Scanner(this);
    }

    @Override
    public synchronized void close() throws IOException {
        raf.close();
    }

    /**
     * Sequential iterator over the data blocks of one table, with one entry of look-ahead.
     */
    public static final class Scanner implements Iterator<LogEntry>, Closeable {
        private final SSTableReader table;
        private final DataInputStream in;
        private LogEntry nextEntry;

        private Scanner(SSTableReader table) throws IOException {
            this.table = table;
            InputStream raw = Files.newInputStream(table.filePath);
            this.in = new DataInputStream(new BufferedInputStream(ByteStreams.limit(raw, table.indexOffset)));
            advance();
        }

        private void advance() throws IOException {
            try {
                nextEntry = LogEntry.readFrom(in);
            } catch (EOFException e) {
                nextEntry = null;
            }
        }

        /**
         * @return The entry {@link #next()} would return, or {@code null} at the end.
         */
        public LogEntry peek() {
            return nextEntry;
        }

        /**
         * @return The sequence number of the table being scanned, higher is newer.
         */
        public long getSequence() {
            return table.sequence;
        }

        @Override
        public boolean hasNext() {
            return nextEntry != null;
        }

        @Override
        public LogEntry next() {
            if (!hasNext()) throw new NoSuchElementException();
            LogEntry current = nextEntry;
            try {
                advance();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read next entry from " + table.filePath, e);
            }
            return current;
        }

        @Override
        public void close() throws IOException {
            in.close();
        }
    }
}
