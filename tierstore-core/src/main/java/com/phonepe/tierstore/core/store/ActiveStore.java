package com.phonepe.tierstore.core.store;

import com.phonepe.tierstore.core.model.MemoryRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Fast, fully indexed tier holding the most recent records. Maintains a secondary index from entity to record id.
 * All listing operations order by timestamp, ties broken by insertion order.
 */
public interface ActiveStore {

    /**
     * Adds a record and indexes all of its entities
     *
     * @throws com.phonepe.tierstore.core.errors.StorageError with DUPLICATE_ID if the id is already present or was
     *                                                        retired by a merge
     */
    void insert(MemoryRecord record);

    /**
     * Records sharing at least one entity with the query, newest first. An empty query matches nothing.
     *
     * @param entities Entities to look for
     * @param limit    Maximum number of distinct records returned
     */
    List<MemoryRecord> queryByEntities(Collection<String> entities, int limit);

    /**
     * Newest {@code n} records, newest first
     */
    List<MemoryRecord> recent(int n);

    /**
     * Oldest {@code n} records, oldest first
     */
    List<MemoryRecord> oldest(int n);

    /**
     * Every record, oldest first
     */
    List<MemoryRecord> all();

    Optional<MemoryRecord> get(String id);

    /**
     * Removes records and their index entries. Unknown ids are ignored.
     */
    void delete(Collection<String> ids);

    /**
     * Replaces content, entities, connections and valence of an existing record and re-derives its index entries
     *
     * @throws com.phonepe.tierstore.core.errors.StorageError with NOT_FOUND if the id is not present
     */
    void update(MemoryRecord record);

    /**
     * Applies the outcome of a consolidation pass as one unit: either every update and delete is applied or none is.
     * Deleted ids are retired and can never be inserted again.
     *
     * @param updated Survivors in their merged form
     * @param deleted Ids of records absorbed into a survivor
     */
    void applyMerge(Collection<MemoryRecord> updated, Collection<String> deleted);

    /**
     * @return true if the id was absorbed by a merge
     */
    boolean isRetired(String id);

    long count();
}
