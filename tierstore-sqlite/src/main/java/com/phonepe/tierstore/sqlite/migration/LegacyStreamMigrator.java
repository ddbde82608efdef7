/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.phonepe.tierstore.sqlite.migration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.model.DirectExperience;
import com.phonepe.tierstore.core.model.MemoryRecord;
import com.phonepe.tierstore.core.model.RecordType;
import com.phonepe.tierstore.core.store.ActiveStore;
import com.phonepe.tierstore.core.store.ArchiveStore;
import com.phonepe.tierstore.core.utils.JsonUtils;
import com.phonepe.tierstore.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Moves records from the legacy single file stream ({@code {"memories": [...]}}) into the two tiers. The newest
 * records go to the active tier until it holds {@code activeLimit}, older ones are archived by month. The legacy file
 * is only read. Records already present in either tier, or retired by a merge, are skipped, so running the migration
 * twice is harmless.
 */
@Slf4j
public class LegacyStreamMigrator {

    @Data
    @NoArgsConstructor
    static class LegacyRecord {
        private String id;
        private String content;
        private Instant timestamp;
        private List<String> entities = new ArrayList<>();
        private List<String> connections = new ArrayList<>();
        @JsonProperty("memory_type")
        private String memoryType;
        @JsonProperty("emotional_valence")
        private double emotionalValence;
    }

    @Data
    @NoArgsConstructor
    static class LegacyStream {
        private List<LegacyRecord> memories = new ArrayList<>();
    }

    private final ActiveStore activeStore;
    private final ArchiveStore archiveStore;
    private final int activeLimit;
    private final ObjectMapper mapper;

    @Builder
    public LegacyStreamMigrator(@NonNull ActiveStore activeStore,
                                @NonNull ArchiveStore archiveStore,
                                int activeLimit,
                                ObjectMapper mapper) {
        this.activeStore = activeStore;
        this.archiveStore = archiveStore;
        this.activeLimit = activeLimit;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    /**
     * Every legacy record is checked before anything is written, so a malformed stream changes nothing. Repeated ids
     * keep their first occurrence. Only the room left under {@code activeLimit} in the active tier is filled.
     *
     * @param legacyFile Legacy stream file
     * @return What was moved where. Empty if the file does not exist.
     * @throws StorageError CORRUPT if the file cannot be parsed or a record has no id or timestamp
     */
    public MigrationSummary migrate(final Path legacyFile) {
        final var data = FileUtils.readIfExists(legacyFile).orElse(null);
        if (data == null) {
            log.info("No legacy stream at {}, nothing to migrate", legacyFile);
            return MigrationSummary.empty();
        }
        final var stream = JsonUtils.read(mapper, data, LegacyStream.class, legacyFile.toString());
        final var legacy = Objects.requireNonNullElseGet(stream.getMemories(), List::<LegacyRecord>of);
        log.info("Found {} records in legacy stream {}", legacy.size(), legacyFile);

        final var converted = new LinkedHashMap<String, MemoryRecord>();
        var skipped = 0;
        for (int i = 0; i < legacy.size(); i++) {
            final var old = legacy.get(i);
            if (old == null || Strings.isNullOrEmpty(old.getId()) || old.getTimestamp() == null) {
                throw StorageError.error(ErrorType.CORRUPT,
                                         legacyFile,
                                         "record #" + i + " has no id or timestamp");
            }
            if (converted.containsKey(old.getId())) {
                log.warn("Record {} repeated in legacy stream, keeping the first occurrence", old.getId());
                skipped++;
                continue;
            }
            converted.put(old.getId(), convert(old));
        }

        final var fresh = new ArrayList<MemoryRecord>();
        for (final var record : converted.values()) {
            final var id = record.getId();
            if (activeStore.get(id).isPresent() || activeStore.isRetired(id) || archiveStore.findEntry(id).isPresent()) {
                log.debug("Record {} already migrated, skipping", id);
                skipped++;
            }
            else {
                fresh.add(record);
            }
        }
        fresh.sort(Comparator.comparing(MemoryRecord::getTimestamp).reversed());
        final var room = Math.max(0, activeLimit - activeStore.count());
        final var split = (int) Math.min(room, fresh.size());
        final var toActive = fresh.subList(0, split);
        final var toArchive = fresh.subList(split, fresh.size());

        toActive.forEach(activeStore::insert);
        if (!toArchive.isEmpty()) {
            final var files = archiveStore.archive(List.copyOf(toArchive));
            log.info("Archived {} legacy records into {} files", toArchive.size(), files.size());
        }
        final var summary = new MigrationSummary(toActive.size(), toArchive.size(), legacy.size(), skipped);
        log.info("Legacy migration complete: {}", summary);
        return summary;
    }

    private static MemoryRecord convert(final LegacyRecord old) {
        return MemoryRecord.builder()
                .id(old.getId())
                .content(Strings.nullToEmpty(old.getContent()))
                .timestamp(old.getTimestamp().truncatedTo(ChronoUnit.MILLIS))
                .entities(Objects.requireNonNullElseGet(old.getEntities(), List::<String>of))
                .connections(Objects.requireNonNullElseGet(old.getConnections(), List::<String>of))
                .recordType(RecordType.fromLegacyName(old.getMemoryType()))
                .valence(Math.max(-1.0, Math.min(1.0, old.getEmotionalValence())))
                .source(new DirectExperience())
                .build();
    }
}
