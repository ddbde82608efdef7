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


package com.phonepe.tierstore.sqlite;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.tierstore.core.config.ConfigLoader;
import com.phonepe.tierstore.core.config.TierStoreConfig;
import com.phonepe.tierstore.core.manager.MemoryManager;
import com.phonepe.tierstore.core.store.ActiveStore;
import com.phonepe.tierstore.core.store.ArchiveStore;
import com.phonepe.tierstore.core.utils.JsonUtils;
import com.phonepe.tierstore.filesystem.archive.FileSystemArchiveStore;
import com.phonepe.tierstore.filesystem.utils.FileUtils;
import com.phonepe.tierstore.sqlite.store.SqliteActiveStore;
import com.phonepe.tierstore.sqlite.store.SqliteArchiveIndex;
import com.phonepe.tierstore.sqlite.utils.SqliteUtils;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Both tiers opened over one data directory, plus a manager wired on top of them:
 * <pre>
 *     dataDir/active_memory.db
 *     dataDir/archive_index.db
 *     dataDir/memory_archive/yyyy-MM/archive_*.json
 * </pre>
 */
@Value
@Slf4j
public class TierStores {
    public static final String ACTIVE_DB = "active_memory.db";
    public static final String ARCHIVE_INDEX_DB = "archive_index.db";
    public static final String ARCHIVE_DIR = "memory_archive";

    Path dataDir;
    ActiveStore activeStore;
    ArchiveStore archiveStore;
    MemoryManager manager;

    public static TierStores open(final TierStoreConfig config) {
        return open(config, Clock.systemUTC());
    }

    /**
     * Creates the data directory if needed and opens (or creates) both databases and the archive directory. Opening
     * a directory again sees everything stored in it before.
     *
     * @param config Validated before anything is touched
     * @param clock  Clock for record creation and archive file names
     * @return Ready to use stores
     */
    public static TierStores open(final TierStoreConfig config, final Clock clock) {
        ConfigLoader.validate(config);
        final var dataDir = FileUtils.ensurePath(config.getDataDir(), true, true);
        final ObjectMapper mapper = JsonUtils.createMapper();
        final var activeStore = SqliteActiveStore.builder()
                .dataSource(SqliteUtils.dataSource(dataDir.resolve(ACTIVE_DB)))
                .mapper(mapper)
                .build();
        final var archiveIndex = SqliteArchiveIndex.builder()
                .dataSource(SqliteUtils.dataSource(dataDir.resolve(ARCHIVE_INDEX_DB)))
                .mapper(mapper)
                .build();
        final var archiveStore = FileSystemArchiveStore.builder()
                .archiveRoot(dataDir.resolve(ARCHIVE_DIR))
                .index(archiveIndex)
                .mapper(mapper)
                .clock(clock)
                .build();
        final var manager = MemoryManager.builder()
                .activeStore(activeStore)
                .archiveStore(archiveStore)
                .options(config.getMemory())
                .clock(clock)
                .build();
        log.info("Opened tier stores in {}: {} active records, {} archived records",
                 dataDir, activeStore.count(), archiveStore.count());
        return new TierStores(dataDir, activeStore, archiveStore, manager);
    }
}
