package com.ganesh.store.index.wal;

import com.google.common.base.MoreObjects;
import com.google.common.hash.Funnel;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * A single record mutation in the index engine: either a serialized record or a tombstone.
 * <p>
 * The same format is used for the write-ahead log and for SSTable data blocks, so a replayed
 * entry and a flushed entry are indistinguishable.
 */
public final class LogEntry {
    /** Upper bound for a serialized record. Anything larger is treated as a corrupt entry. */
    static final int MAX_RECORD_BYTES = 16 * 1024 * 1024;

    /**
     * Feeds record keys into Guava Bloom filters.
     */
    public static final Funnel<CharSequence> KEY_FUNNEL = (from, into) -> into.putString(from, StandardCharsets.UTF_8);

    private final String key;
    private final byte[] record;

    private LogEntry(String key, byte[] record) {
        this.key = key;
        this.record = record;
    }

    /**
     * Creates an entry holding the serialized form of a record.
     *
     * @param key    The record key.
     * @param record The serialized record. Must not be null.
     * @return A new live entry.
     */
    public static LogEntry of(String key, byte[] record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null, use tombstone() for deletions");
        }
        return new LogEntry(key, record);
    }

    /**
     * Creates a deletion marker for the given key.
     *
     * @param key The deleted record key.
     * @return A new tombstone entry.
     */
    public static LogEntry tombstone(String key) {
        return new LogEntry(key, null);
    }

    public String getKey() { return key; }

    /**
     * @return The serialized record, or {@code null} for a tombstone.
     */
    public byte[] getRecord() { return record; }

    public boolean isTombstone() { return record == null; }

    /**
     * Writes this entry as: key (modified UTF-8), tombstone flag, and for live entries
     * the record length followed by the record bytes.
     *
     * @param out The destination.
     * @throws IOException if the write fails.
     */
    public void writeTo(DataOutput out) throws IOException {
        out.writeUTF(key);
        out.writeBoolean(isTombstone());
        if (!isTombstone()) {
            out.writeInt(record.length);
            out.write(record);
        }
    }

    /**
     * Reads one entry written by {@link #writeTo(DataOutput)}.
     *
     * @param in The source.
     * @return The decoded entry.
     * @throws IOException if the stream is truncated or malformed.
     */
    public static LogEntry readFrom(DataInput in) throws IOException {
        String key = in.readUTF();
        if (in.readBoolean()) {
            return tombstone(key);
        }
        int length = in.readInt();
        if (length < 0 || length > MAX_RECORD_BYTES) {
            throw new IOException("Corrupt log entry for key " + key + ": record length " + length);
        }
        byte[] record = new byte[length];
        in.readFully(record);
        return new LogEntry(key, record);
    }

    /**
     * @return An estimate of the in-memory footprint, used for memtable accounting.
     */
    public long sizeInBytes() {
        return key.length() + (record == null ? 0 : record.length);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("key", key)
                .add("tombstone", isTombstone())
                .add("bytes", record == null ? 0 : record.length)
                .toString();
    }
}
