package com.ganesh.store.index.sstable;

import com.ganesh.store.index.wal.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * K-way merge of SSTable scans into a single view holding the newest version of every key.
 *
 * <p>Used both by compaction, which drops tombstones because the result replaces every table,
 * and by full index scans, which keep them so that newer memtable layers can be applied on top.
 */
public class Compactor {
    private static final Logger logger = LoggerFactory.getLogger(Compactor.class);

    /**
     * Merges the given scans.
     *
     * @param scanners       Open scanners, in any order; the table sequence decides which version wins.
     * @param keepTombstones Whether deleted keys stay in the result as tombstones.
     * @return The merged entries in key order.
     */
    public SortedMap<String, LogEntry> merge(List<SSTableReader.Scanner> scanners, boolean keepTombstones) {
        logger.debug("Merging {} SSTable scans", scanners.size());

        PriorityQueue<SSTableReader.Scanner> pq = new PriorityQueue<>(
            Comparator.comparing((SSTableReader.Scanner s) -> s.peek().getKey())
                      .thenComparing(SSTableReader.Scanner::getSequence, Comparator.reverseOrder())
        );
        for (SSTableReader.Scanner scanner : scanners) {
            if (scanner.hasNext()) {
                pq.add(scanner);
            }
        }

        SortedMap<String, LogEntry> merged = new TreeMap<>();
        String lastKey = null;
        while (!pq.isEmpty()) {
            SSTableReader.Scanner scanner = pq.poll();
            LogEntry entry = scanner.next();

            if (!entry.getKey().equals(lastKey)) {
                lastKey = entry.getKey();
                if (keepTombstones || !entry.isTombstone()) {
                    merged.put(entry.getKey(), entry);
                }
            }

            if (scanner.hasNext()) {
                pq.add(scanner);
            }
        }
        return merged;
    }
}
