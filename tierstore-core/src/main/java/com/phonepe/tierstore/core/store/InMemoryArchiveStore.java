package com.phonepe.tierstore.core.store;

import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.model.ArchiveIndexEntry;
import com.phonepe.tierstore.core.model.MemoryRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap backed archive tier. "Files" are immutable lists keyed by a generated path.
 */
public class InMemoryArchiveStore implements ArchiveStore {
    private final Map<String, List<MemoryRecord>> files = new ConcurrentHashMap<>();
    private final ArchiveIndex index;
    private final AtomicLong fileCounter = new AtomicLong();

    public InMemoryArchiveStore() {
        this(new InMemoryArchiveIndex());
    }

    public InMemoryArchiveStore(ArchiveIndex index) {
        this.index = index;
    }

    @Override
    public String append(String bucketKey, List<MemoryRecord> records) {
        final var path = "%s/archive_%06d.json".formatted(bucketKey, fileCounter.incrementAndGet());
        files.put(path, List.copyOf(records));
        return path;
    }

    @Override
    public void index(MemoryRecord record, String filePath) {
        index.put(ArchiveIndexEntry.of(record, filePath));
    }

    @Override
    public List<String> findByEntities(Collection<String> entities, int limit) {
        return index.findPaths(entities, limit);
    }

    @Override
    public List<MemoryRecord> load(String filePath) {
        final var records = files.get(filePath);
        if (records == null) {
            throw StorageError.error(ErrorType.ARCHIVE_NOT_FOUND, filePath);
        }
        return records;
    }

    @Override
    public Optional<ArchiveIndexEntry> findEntry(String id) {
        return index.get(id);
    }

    @Override
    public long count() {
        return index.count();
    }
}
