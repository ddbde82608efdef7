package com.phonepe.tierstore.core.store;

import com.phonepe.tierstore.core.model.ArchiveIndexEntry;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap backed archive index
 */
public class InMemoryArchiveIndex implements ArchiveIndex {
    private final Map<String, ArchiveIndexEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void put(ArchiveIndexEntry entry) {
        entries.put(entry.getId(), entry);
    }

    @Override
    public List<String> findPaths(Collection<String> entities, int limit) {
        if (entities == null || entities.isEmpty()) {
            return List.of();
        }
        final var paths = new LinkedHashSet<String>();
        for (final var entity : entities) {
            entries.values()
                    .stream()
                    .filter(entry -> entry.getEntities().stream().anyMatch(stored -> stored.startsWith(entity)))
                    .sorted(Comparator.comparing(ArchiveIndexEntry::getTimestamp).reversed())
                    .map(ArchiveIndexEntry::getFilePath)
                    .filter(Objects::nonNull)
                    .distinct()
                    .limit(limit)
                    .forEach(paths::add);
        }
        return paths.stream().limit(limit).toList();
    }

    @Override
    public Optional<ArchiveIndexEntry> get(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public long count() {
        return entries.size();
    }
}
