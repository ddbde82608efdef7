package com.phonepe.tierstore.core.store;

import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.model.MemoryRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.StampedLock;
import java.util.function.Supplier;

/**
 * Heap backed active tier. Nothing survives a restart; used for tests and for embedding without a database.
 */
public class InMemoryActiveStore implements ActiveStore {

    private record Stored(MemoryRecord record, long sequence) {
    }

    private static final Comparator<Stored> OLDEST_FIRST = Comparator
            .comparing((Stored stored) -> stored.record().getTimestamp())
            .thenComparingLong(Stored::sequence);

    private final Map<String, Stored> records = new HashMap<>();
    private final Map<String, Set<String>> entityIndex = new HashMap<>();
    private final Set<String> retired = new HashSet<>();
    private final StampedLock lock = new StampedLock();
    private long sequence = 0;

    @Override
    public void insert(MemoryRecord record) {
        write(() -> {
            if (records.containsKey(record.getId()) || retired.contains(record.getId())) {
                throw StorageError.error(ErrorType.DUPLICATE_ID, record.getId());
            }
            records.put(record.getId(), new Stored(record, sequence++));
            indexEntities(record);
            return null;
        });
    }

    @Override
    public List<MemoryRecord> queryByEntities(Collection<String> entities, int limit) {
        if (entities == null || entities.isEmpty()) {
            return List.of();
        }
        return read(() -> {
            final var ids = new HashSet<String>();
            entities.forEach(entity -> ids.addAll(entityIndex.getOrDefault(entity, Set.of())));
            return ids.stream()
                    .map(records::get)
                    .sorted(OLDEST_FIRST.reversed())
                    .limit(limit)
                    .map(Stored::record)
                    .toList();
        });
    }

    @Override
    public List<MemoryRecord> recent(int n) {
        return read(() -> records.values()
                .stream()
                .sorted(OLDEST_FIRST.reversed())
                .limit(n)
                .map(Stored::record)
                .toList());
    }

    @Override
    public List<MemoryRecord> oldest(int n) {
        return read(() -> records.values()
                .stream()
                .sorted(OLDEST_FIRST)
                .limit(n)
                .map(Stored::record)
                .toList());
    }

    @Override
    public List<MemoryRecord> all() {
        return oldest(Integer.MAX_VALUE);
    }

    @Override
    public Optional<MemoryRecord> get(String id) {
        return read(() -> Optional.ofNullable(records.get(id)).map(Stored::record));
    }

    @Override
    public void delete(Collection<String> ids) {
        write(() -> {
            ids.forEach(this::deleteUnsafe);
            return null;
        });
    }

    @Override
    public void update(MemoryRecord record) {
        write(() -> {
            updateUnsafe(record);
            return null;
        });
    }

    @Override
    public void applyMerge(Collection<MemoryRecord> updated, Collection<String> deleted) {
        write(() -> {
            // Check everything up front so that a bad merge leaves the store untouched
            updated.forEach(record -> {
                if (!records.containsKey(record.getId())) {
                    throw StorageError.error(ErrorType.NOT_FOUND, record.getId());
                }
            });
            deleted.forEach(this::deleteUnsafe);
            retired.addAll(deleted);
            updated.forEach(this::updateUnsafe);
            return null;
        });
    }

    @Override
    public boolean isRetired(String id) {
        return read(() -> retired.contains(id));
    }

    @Override
    public long count() {
        return read(records::size);
    }

    private void updateUnsafe(MemoryRecord record) {
        final var existing = records.get(record.getId());
        if (existing == null) {
            throw StorageError.error(ErrorType.NOT_FOUND, record.getId());
        }
        unindexEntities(existing.record());
        final var merged = existing.record()
                .toBuilder()
                .content(record.getContent())
                .clearEntities()
                .entities(record.getEntities())
                .clearConnections()
                .connections(record.getConnections())
                .valence(record.getValence())
                .build();
        records.put(record.getId(), new Stored(merged, existing.sequence()));
        indexEntities(merged);
    }

    private void deleteUnsafe(String id) {
        final var existing = records.remove(id);
        if (existing != null) {
            unindexEntities(existing.record());
        }
    }

    private void indexEntities(MemoryRecord record) {
        record.getEntities()
                .forEach(entity -> entityIndex.computeIfAbsent(entity, key -> new HashSet<>()).add(record.getId()));
    }

    private void unindexEntities(MemoryRecord record) {
        record.getEntities().forEach(entity -> entityIndex.computeIfPresent(entity, (key, ids) -> {
            ids.remove(record.getId());
            return ids.isEmpty() ? null : ids;
        }));
    }

    private <T> T read(Supplier<T> action) {
        final var stamp = lock.readLock();
        try {
            return action.get();
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    private <T> T write(Supplier<T> action) {
        final var stamp = lock.writeLock();
        try {
            return action.get();
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }
}
