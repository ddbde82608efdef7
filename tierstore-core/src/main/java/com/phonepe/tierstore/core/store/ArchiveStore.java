package com.phonepe.tierstore.core.store;

import com.phonepe.tierstore.core.model.ArchiveIndexEntry;
import com.phonepe.tierstore.core.model.MemoryRecord;
import com.phonepe.tierstore.core.utils.StoreUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Cold tier. Archived records live in write-once files grouped by time bucket, with an {@link ArchiveIndex} for
 * lookups.
 */
public interface ArchiveStore {

    /**
     * Writes the records of one bucket to a new archive file
     *
     * @param bucketKey Time bucket, see {@link StoreUtils#bucketKey}
     * @param records   Records to write
     * @return Path of the new file relative to the archive root
     */
    String append(String bucketKey, List<MemoryRecord> records);

    /**
     * Adds (or replaces) the index entry for an archived record
     */
    void index(MemoryRecord record, String filePath);

    /**
     * Candidate archive files for the given entities, see {@link ArchiveIndex#findPaths}
     */
    List<String> findByEntities(Collection<String> entities, int limit);

    /**
     * Reads one archive file
     *
     * @throws com.phonepe.tierstore.core.errors.StorageError ARCHIVE_NOT_FOUND or CORRUPT. Callers on recall paths
     *                                                        treat both as "no data".
     */
    List<MemoryRecord> load(String filePath);

    Optional<ArchiveIndexEntry> findEntry(String id);

    long count();

    /**
     * Groups records by bucket, writes one file per bucket and indexes every record against its file
     *
     * @return Bucket key to written file path
     */
    default Map<String, String> archive(final List<MemoryRecord> records) {
        final var byBucket = new TreeMap<String, List<MemoryRecord>>();
        records.forEach(record -> byBucket.computeIfAbsent(StoreUtils.bucketKey(record.getTimestamp()),
                                                           key -> new ArrayList<>())
                .add(record));
        final var written = new LinkedHashMap<String, String>();
        byBucket.forEach((bucket, bucketRecords) -> {
            final var path = append(bucket, bucketRecords);
            bucketRecords.forEach(record -> index(record, path));
            written.put(bucket, path);
        });
        return written;
    }
}
