package com.ganesh.store.index.sstable;

import com.ganesh.store.index.IndexConfig;
import com.ganesh.store.index.wal.LogEntry;
import com.google.common.hash.BloomFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Writes a sorted set of entries to a new, immutable SSTable file.
 *
 * <p>Data goes to a {@code .tmp} file first, which is synced and then atomically renamed to its
 * final {@code .sst} name, so a crash never leaves a half-written table that looks valid.
 *
 * <p>File layout:
 * <ol>
 * <li><b>Data blocks:</b> serialized {@link LogEntry} values in key order, tombstones included.</li>
 * <li><b>Index block:</b> for every data block, its last key and its starting offset.</li>
 * <li><b>Bloom filter:</b> over all keys in the table.</li>
 * <li><b>Footer:</b> index offset and Bloom filter offset, 8 bytes each.</li>
 * </ol>
 */
public class SSTableWriter {
    private static final Logger logger = LoggerFactory.getLogger(SSTableWriter.class);

    public static final String SSTABLE_EXTENSION = ".sst";
    static final String TEMP_EXTENSION = ".tmp";
    static final int FOOTER_BYTES = 16;

    private final IndexConfig config;

    public SSTableWriter(IndexConfig config) {
        this.config = config;
    }

    private static class IndexEntry {
        final String key;
        final long offset;

        IndexEntry(String key, long offset) {
            this.key = key;
            this.offset = offset;
        }

        void writeTo(DataOutputStream out) throws IOException {
            out.writeUTF(key);
            out.writeLong(offset);
        }
    }

    /**
     * Builds the file name for a table with the given sequence number. Names sort in sequence order.
     *
     * @param sequence The table sequence number, higher is newer.
     * @return The file name.
     */
    static String fileName(long sequence) {
        return String.format("%019d", sequence) + SSTABLE_EXTENSION;
    }

    /**
     * Writes the given entries to a new SSTable.
     *
     * @param entries  Entries sorted by key.
     * @param sequence The sequence number of the new table.
     * @return The path of the new table, or {@code null} if {@code entries} is empty.
     * @throws IOException if any file I/O fails.
     */
    public Path write(SortedMap<String, LogEntry> entries, long sequence) throws IOException {
        if (entries.isEmpty()) {
            return null;
        }

        Path finalFile = config.getDirectory().resolve(fileName(sequence));
        Path tempFile = config.getDirectory().resolve(String.format("%019d", sequence) + TEMP_EXTENSION);

        logger.info("Writing {} entries to temporary SSTable file: {}", entries.size(), tempFile.getFileName());
        BloomFilter<CharSequence> bloomFilter = BloomFilter.create(
                LogEntry.KEY_FUNNEL,
                entries.size(),
                config.getBloomFilterFpp()
        );
        List<IndexEntry> index = new ArrayList<>();
        long currentOffset = 0;

        try (FileOutputStream fos = new FileOutputStream(tempFile.toFile());
             DataOutputStream out = new DataOutputStream(new BufferedOutputStream(fos))) {

            ByteArrayOutputStream blockBuffer = new ByteArrayOutputStream();
            DataOutputStream blockOut = new DataOutputStream(blockBuffer);
            String lastKeyInBlock = null;
            for (LogEntry entry : entries.values()) {
                bloomFilter.put(entry.getKey());
                entry.writeTo(blockOut);
                lastKeyInBlock = entry.getKey();

                if (blockBuffer.size() >= config.getSstableBlockSizeBytes()) {
                    index.add(new IndexEntry(lastKeyInBlock, currentOffset));
                    blockBuffer.writeTo(out);
                    currentOffset += blockBuffer.size();
                    blockBuffer.reset();
                }
            }

            if (blockBuffer.size() > 0) {
                index.add(new IndexEntry(lastKeyInBlock, currentOffset));
                blockBuffer.writeTo(out);
                currentOffset += blockBuffer.size();
            }

            long indexOffset = currentOffset;
            for (IndexEntry indexEntry : index) {
                indexEntry.writeTo(out);
            }

            long bloomFilterOffset = out.size();
            bloomFilter.writeTo(out);

            out.writeLong(indexOffset);
            out.writeLong(bloomFilterOffset);
            out.flush();
            fos.getChannel().force(true);
        }

        Files.move(tempFile, finalFile, StandardCopyOption.ATOMIC_MOVE);
        logger.info("SSTable {} written ({} blocks)", finalFile.getFileName(), index.size());
        return finalFile;
    }
}
