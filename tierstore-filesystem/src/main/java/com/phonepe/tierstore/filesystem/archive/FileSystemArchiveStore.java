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


package com.phonepe.tierstore.filesystem.archive;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.model.ArchiveIndexEntry;
import com.phonepe.tierstore.core.model.MemoryRecord;
import com.phonepe.tierstore.core.store.ArchiveIndex;
import com.phonepe.tierstore.core.store.ArchiveStore;
import com.phonepe.tierstore.core.utils.JsonUtils;
import com.phonepe.tierstore.core.utils.StoreUtils;
import com.phonepe.tierstore.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Archive tier on the local filesystem. Every eviction batch becomes one JSON file under a directory per month:
 * <pre>
 *     root/2025-03/archive_20250301_100000_000.json
 * </pre>
 * Files are created once and never rewritten. Lookups go through the supplied {@link ArchiveIndex}.
 */
@Slf4j
public class FileSystemArchiveStore implements ArchiveStore {
    private static final TypeReference<List<MemoryRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final Path archiveRoot;
    private final ArchiveIndex index;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Builder
    public FileSystemArchiveStore(@NonNull Path archiveRoot,
                                  @NonNull ArchiveIndex index,
                                  ObjectMapper mapper,
                                  Clock clock) {
        this.archiveRoot = FileUtils.ensurePath(archiveRoot, true, true);
        this.index = index;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    @Override
    public String append(String bucketKey, List<MemoryRecord> records) {
        final var bucketDir = FileUtils.ensurePath(archiveRoot.resolve(bucketKey), true, true);
        final var data = JsonUtils.write(mapper, records);
        final var stem = "archive_" + StoreUtils.fileStamp(clock.instant());
        var file = bucketDir.resolve(stem + ".json");
        var attempt = 0;
        while (!FileUtils.writeNew(file, data)) {
            file = bucketDir.resolve("%s_%03d.json".formatted(stem, ++attempt));
        }
        final var relative = relativePath(file);
        log.debug("Wrote {} records to archive file {}", records.size(), relative);
        return relative;
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
        final var file = archiveRoot.resolve(filePath).normalize();
        if (!file.startsWith(archiveRoot)) {
            log.warn("Refusing to read {} as it is outside the archive root {}", filePath, archiveRoot);
            throw StorageError.error(ErrorType.ARCHIVE_NOT_FOUND, filePath);
        }
        final var data = FileUtils.readIfExists(file)
                .orElseThrow(() -> StorageError.error(ErrorType.ARCHIVE_NOT_FOUND, filePath));
        return JsonUtils.read(mapper, data, RECORD_LIST, filePath);
    }

    @Override
    public Optional<ArchiveIndexEntry> findEntry(String id) {
        return index.get(id);
    }

    @Override
    public long count() {
        return index.count();
    }

    private String relativePath(Path file) {
        return archiveRoot.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }
}
