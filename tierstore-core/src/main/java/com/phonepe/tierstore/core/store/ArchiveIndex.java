package com.phonepe.tierstore.core.store;

import com.phonepe.tierstore.core.model.ArchiveIndexEntry;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Metadata about archived records. Small and hot, so lookups never need to touch the archive files themselves.
 */
public interface ArchiveIndex {

    /**
     * Stores an entry, replacing any existing entry with the same id
     */
    void put(ArchiveIndexEntry entry);

    /**
     * Archive files containing records with an entity that starts with any of the given entities, so "Paris" also
     * finds files mentioning "Paris Agreement". For each queried entity the newest files come first. Paths are
     * de-duplicated across entities and capped at {@code limit}.
     */
    List<String> findPaths(Collection<String> entities, int limit);

    Optional<ArchiveIndexEntry> get(String id);

    long count();
}
