package com.phonepe.tierstore.core.manager;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.tierstore.core.entities.ConnectionRule;
import com.phonepe.tierstore.core.entities.EntityExtractor;
import com.phonepe.tierstore.core.entities.EntityOverlap;
import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.model.DirectExperience;
import com.phonepe.tierstore.core.model.MemoryRecord;
import com.phonepe.tierstore.core.model.RecordSourceVisitor;
import com.phonepe.tierstore.core.model.RecordType;
import com.phonepe.tierstore.core.model.Researched;
import com.phonepe.tierstore.core.store.ActiveStore;
import com.phonepe.tierstore.core.store.ArchiveStore;
import com.phonepe.tierstore.core.utils.StoreUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.StampedLock;

/**
 * Coordinates the active and archive tiers.
 * <p>
 * Records enter the active tier through {@link #add} or {@link #addWithSource}. Every insert checks the active limit and
 * moves the oldest batch to the archive when it is exceeded. {@link #consolidate()} merges near duplicate active
 * records. {@link #recall} reads across both tiers.
 * <p>
 * Inserts, eviction and consolidation are serialized through one write lock. Recalls share a read lock.
 */
@Slf4j
public class MemoryManager {
    private static final DateTimeFormatter MERGE_STAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);
    private static final int ACTIVE_ONLY_RECALL_LIMIT = 10;

    private final ActiveStore activeStore;
    private final ArchiveStore archiveStore;
    private final MemoryManagerOptions options;
    private final ConnectionRule connectionRule;
    private final Clock clock;
    private final StampedLock lock = new StampedLock();

    /**
     * Bumped on every successful insert. Consolidation only runs when this moved since the last successful pass.
     */
    private long mutations = 0;
    private long consolidatedAt = 0;

    @Builder
    public MemoryManager(@NonNull ActiveStore activeStore,
                         @NonNull ArchiveStore archiveStore,
                         MemoryManagerOptions options,
                         Clock clock) {
        this.activeStore = activeStore;
        this.archiveStore = archiveStore;
        this.options = Objects.requireNonNullElseGet(options, MemoryManagerOptions::defaults);
        this.connectionRule = this.options.connectionRule();
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    /**
     * Stores a first hand record. Entities are extracted from the content.
     *
     * @param content Payload
     * @param type    Record type
     * @param valence Emotional valence in [-1, 1]
     * @return Id of the new record
     */
    public String add(final String content, @NonNull final RecordType type, final double valence) {
        checkValence(valence);
        final var record = MemoryRecord.create(Strings.nullToEmpty(content),
                                               EntityExtractor.extract(content),
                                               type,
                                               valence,
                                               clock);
        return store(record);
    }

    /**
     * Stores a record built by the caller, typically because its provenance is already known. Missing timestamp or
     * entities are filled in, anything the caller set is kept as is.
     *
     * @param record Fully formed record
     * @return Id of the stored record
     */
    public String addWithSource(@NonNull final MemoryRecord record) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(record.getId()), "Record id is required");
        Preconditions.checkArgument(record.getRecordType() != null, "Record type is required");
        checkValence(record.getValence());
        Preconditions.checkArgument(record.getConfidence() >= 0.0 && record.getConfidence() <= 1.0,
                                    "Confidence must be within [0, 1], got %s", record.getConfidence());
        final var builder = record.toBuilder();
        if (record.getTimestamp() == null) {
            builder.timestamp(MemoryRecord.now(clock));
        }
        if (record.getEntities().isEmpty()) {
            builder.entities(EntityExtractor.extract(record.getContent()));
        }
        final var complete = builder.build();
        log.debug("Adding record {} ({})", complete.getId(), complete.getSource().accept(new ProvenanceDescriber()));
        return store(complete);
    }

    /**
     * Best effort recall across both tiers:
     * <ol>
     *     <li>active records sharing an entity with the query</li>
     *     <li>if short, the most recent active records</li>
     *     <li>if still short and the query is not empty, records from archive files the index points at</li>
     * </ol>
     * Failures in any stage only reduce what that stage contributes. Results are de-duplicated by id and ranked by
     * timestamp in seconds plus {@code |valence| * 1000}, highest first.
     *
     * @param entities Entities to look for, may be empty
     * @param n        Maximum number of records to return
     * @return Up to {@code n} records
     */
    public List<MemoryRecord> recall(final Collection<String> entities, int n) {
        if (n <= 0) {
            return List.of();
        }
        final var query = entities == null ? List.<String>of() : entities;
        final var stamp = lock.readLock();
        try {
            final var results = new LinkedHashMap<String, MemoryRecord>();
            collect(results, n, () -> activeStore.queryByEntities(query, n), "active entity query");
            if (results.size() < n) {
                collect(results, n, () -> activeStore.recent(n), "recent active records");
            }
            if (results.size() < n && !query.isEmpty()) {
                recallFromArchive(query, n, results);
            }
            return results.values()
                    .stream()
                    .sorted(Comparator.comparingDouble(MemoryManager::recallScore).reversed())
                    .limit(n)
                    .toList();
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Active tier entity lookup only
     */
    public List<MemoryRecord> recallByEntities(final Collection<String> entities) {
        final var stamp = lock.readLock();
        try {
            return activeStore.queryByEntities(entities, ACTIVE_ONLY_RECALL_LIMIT);
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Newest active records, newest first
     */
    public List<MemoryRecord> recallRecent(int n) {
        final var stamp = lock.readLock();
        try {
            return activeStore.recent(n);
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Merges active records whose entity overlap exceeds the consolidation threshold. The later record of each pair is
     * folded into the earlier one: an excerpt of its content is appended, entities and connections are unioned and the
     * valence becomes the mean of the two. The absorbed id is retired.
     * <p>
     * Does nothing if no record was added since the last successful pass. All changes of a pass are applied together;
     * if that fails nothing is applied and a CONSOLIDATION_FAILED error is raised.
     *
     * @return Number of records absorbed
     */
    public int consolidate() {
        final var stamp = lock.writeLock();
        try {
            if (mutations == consolidatedAt) {
                log.debug("No records added since last consolidation, skipping");
                return 0;
            }
            final var working = new ArrayList<>(activeStore.all());
            log.info("Starting consolidation over {} active records", working.size());
            final var absorbed = new boolean[working.size()];
            final var grown = new boolean[working.size()];
            // Highest loser index first, so survivors at lower indices stay where they are
            final var pairs = matchingPairs(working);
            pairs.sort(Comparator.comparingInt((int[] pair) -> pair[1])
                               .thenComparingInt(pair -> pair[0])
                               .reversed());
            for (final var pair : pairs) {
                final var survivor = pair[0];
                final var loser = pair[1];
                if (absorbed[loser] || absorbed[survivor]) {
                    continue;
                }
                working.set(survivor, merge(working.get(survivor), working.get(loser)));
                absorbed[loser] = true;
                grown[survivor] = true;
            }
            final var updated = new ArrayList<MemoryRecord>();
            final var deleted = new ArrayList<String>();
            for (int i = 0; i < working.size(); i++) {
                if (absorbed[i]) {
                    deleted.add(working.get(i).getId());
                }
                else if (grown[i]) {
                    updated.add(working.get(i));
                }
            }
            if (deleted.isEmpty()) {
                log.debug("No records merged during consolidation");
            }
            else {
                try {
                    activeStore.applyMerge(updated, deleted);
                }
                catch (StorageError e) {
                    log.error("Consolidation of {} records failed, active tier left unchanged", deleted.size(), e);
                    throw StorageError.error(ErrorType.CONSOLIDATION_FAILED, e, e.getMessage());
                }
                log.info("Consolidation complete: {} records merged, {} active records",
                         deleted.size(), activeStore.count());
            }
            consolidatedAt = mutations;
            return deleted.size();
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    public long count() {
        return activeStore.count();
    }

    public long archivedCount() {
        return archiveStore.count();
    }

    @VisibleForTesting
    static double recallScore(final MemoryRecord record) {
        return record.getTimestamp().toEpochMilli() / 1000.0 + Math.abs(record.getValence()) * 1000.0;
    }

    private String store(final MemoryRecord record) {
        final var stamp = lock.writeLock();
        try {
            if (archiveStore.findEntry(record.getId()).isPresent()) {
                throw StorageError.error(ErrorType.DUPLICATE_ID, record.getId());
            }
            final var connected = record.toBuilder()
                    .clearConnections()
                    .connections(connectionRule.connections(record, activeStore.all()))
                    .build();
            activeStore.insert(connected);
            mutations++;
            evictIfNeeded();
            return connected.getId();
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    private void evictIfNeeded() {
        final var activeCount = activeStore.count();
        if (activeCount <= options.getActiveLimit()) {
            return;
        }
        final var toArchive = activeStore.oldest(options.getEvictionBatchSize());
        if (toArchive.isEmpty()) {
            return;
        }
        log.info("Active tier holds {} records (limit {}), archiving {} oldest",
                 activeCount, options.getActiveLimit(), toArchive.size());
        // Files and index first: a failure past this point can leave a record in both tiers but never in neither
        final var files = archiveStore.archive(toArchive);
        activeStore.delete(toArchive.stream().map(MemoryRecord::getId).toList());
        log.info("Archived {} records into {} files: {}", toArchive.size(), files.size(), files.values());
    }

    private void recallFromArchive(final Collection<String> query,
                                   int n,
                                   final Map<String, MemoryRecord> results) {
        final List<String> paths;
        try {
            paths = archiveStore.findByEntities(query, options.getArchiveFilesPerRecall());
        }
        catch (StorageError e) {
            log.warn("Archive index lookup failed, skipping archive recall: {}", e.getMessage());
            return;
        }
        for (final var path : paths) {
            try {
                archiveStore.load(path).forEach(record -> results.putIfAbsent(record.getId(), record));
            }
            catch (StorageError e) {
                log.warn("Skipping archive file {}: {}", path, e.getMessage());
            }
            if (results.size() >= n) {
                break;
            }
        }
    }

    private static void collect(final Map<String, MemoryRecord> results,
                                int n,
                                final RecallStage stage,
                                final String stageName) {
        try {
            for (final var record : stage.fetch()) {
                if (results.size() >= n) {
                    return;
                }
                results.putIfAbsent(record.getId(), record);
            }
        }
        catch (StorageError e) {
            log.warn("Recall stage '{}' failed, continuing without it: {}", stageName, e.getMessage());
        }
    }

    private List<int[]> matchingPairs(final List<MemoryRecord> records) {
        final var pairs = new ArrayList<int[]>();
        for (int i = 0; i < records.size(); i++) {
            for (int j = i + 1; j < records.size(); j++) {
                final var overlap = EntityOverlap.ratio(records.get(i).getEntities(), records.get(j).getEntities());
                if (overlap > options.getConsolidationOverlap()) {
                    pairs.add(new int[]{i, j});
                }
            }
        }
        return pairs;
    }

    private MemoryRecord merge(final MemoryRecord survivor, final MemoryRecord absorbed) {
        final var entities = new LinkedHashSet<>(survivor.getEntities());
        entities.addAll(absorbed.getEntities());
        final var connections = new LinkedHashSet<>(survivor.getConnections());
        connections.addAll(absorbed.getConnections());
        connections.remove(survivor.getId());
        return survivor.toBuilder()
                .content("%s\n\n[Merged record from %s]: %s".formatted(
                        survivor.getContent(),
                        MERGE_STAMP_FORMAT.format(absorbed.getTimestamp()),
                        StoreUtils.prefix(absorbed.getContent(), options.getMergeExcerptLength())))
                .clearEntities()
                .entities(entities)
                .clearConnections()
                .connections(connections)
                .valence((survivor.getValence() + absorbed.getValence()) / 2.0)
                .build();
    }

    private static void checkValence(double valence) {
        Preconditions.checkArgument(valence >= -1.0 && valence <= 1.0,
                                    "Valence must be within [-1, 1], got %s", valence);
    }

    @FunctionalInterface
    private interface RecallStage {
        List<MemoryRecord> fetch();
    }

    private static final class ProvenanceDescriber implements RecordSourceVisitor<String> {
        @Override
        public String visit(DirectExperience directExperience) {
            return "direct experience";
        }

        @Override
        public String visit(Researched researched) {
            return "researched from %s for query '%s'".formatted(researched.getOrigin(),
                                                                 researched.getOriginalQuery());
        }
    }
}
