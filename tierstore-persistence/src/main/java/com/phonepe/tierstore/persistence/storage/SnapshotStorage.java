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


package com.phonepe.tierstore.persistence.storage;

import com.google.common.base.Preconditions;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.utils.StoreUtils;
import com.phonepe.tierstore.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot files under one root directory:
 * <pre>
 *     root/state.json                           primary
 *     root/backup/state_backup.json             backup
 *     root/archive/state_yyyyMMdd_HHmmss_SSS.json   dated copies, newest {@code retention} kept
 * </pre>
 * Primary and backup are replaced atomically. Dated copies sort by file name in write order.
 */
@Slf4j
public class SnapshotStorage {
    public static final String PRIMARY_FILE = "state.json";
    public static final String BACKUP_DIR = "backup";
    public static final String BACKUP_FILE = "state_backup.json";
    public static final String ARCHIVE_DIR = "archive";
    public static final int DEFAULT_RETENTION = 100;

    private static final String ARCHIVE_PREFIX = "state_";
    private static final String ARCHIVE_SUFFIX = ".json";

    @Getter
    private final Path primaryPath;
    @Getter
    private final Path backupPath;
    @Getter
    private final Path archiveDir;
    private final int retention;
    private final Clock clock;

    @Builder
    public SnapshotStorage(@NonNull Path root, Integer retention, Clock clock) {
        this.retention = Objects.requireNonNullElse(retention, DEFAULT_RETENTION);
        Preconditions.checkArgument(this.retention >= 1, "Snapshot retention must be >= 1, got %s", this.retention);
        final var rootDir = FileUtils.ensurePath(root, true, true);
        this.primaryPath = rootDir.resolve(PRIMARY_FILE);
        this.backupPath = FileUtils.ensurePath(rootDir.resolve(BACKUP_DIR), true, true).resolve(BACKUP_FILE);
        this.archiveDir = FileUtils.ensurePath(rootDir.resolve(ARCHIVE_DIR), true, true);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    /**
     * Writes primary, then backup, then a new dated copy, then prunes old dated copies
     *
     * @param data Serialized snapshot
     * @return Path of the dated copy
     */
    public Path writeWithRedundancy(final byte[] data) {
        FileUtils.writeAtomically(primaryPath, data);
        FileUtils.writeAtomically(backupPath, data);
        final var stem = ARCHIVE_PREFIX + StoreUtils.fileStamp(clock.instant());
        var archived = archiveDir.resolve(stem + ARCHIVE_SUFFIX);
        var attempt = 0;
        while (!FileUtils.writeNew(archived, data)) {
            archived = archiveDir.resolve("%s_%03d%s".formatted(stem, ++attempt, ARCHIVE_SUFFIX));
        }
        prune();
        return archived;
    }

    /**
     * Recovery order: primary, backup, then dated copies newest first. Candidates may not exist. If the dated copies
     * cannot be listed only primary and backup are returned.
     */
    public List<Path> candidates() {
        final var candidates = new ArrayList<Path>();
        candidates.add(primaryPath);
        candidates.add(backupPath);
        try {
            candidates.addAll(archives());
        }
        catch (StorageError e) {
            log.warn("Could not list dated snapshots in {}: {}", archiveDir, e.getMessage());
        }
        return candidates;
    }

    /**
     * @return Dated copies, newest first. Empty if the archive directory is gone.
     */
    public List<Path> archives() {
        if (!Files.isDirectory(archiveDir)) {
            log.warn("Snapshot archive directory {} is missing", archiveDir);
            return List.of();
        }
        try (var files = Files.list(archiveDir)) {
            return files.filter(SnapshotStorage::isArchive)
                    .sorted(Comparator.comparing((Path path) -> path.getFileName().toString()).reversed())
                    .toList();
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
    }

    /**
     * @return true if any snapshot file exists at all, readable or not
     */
    public boolean hasSnapshots() {
        return Files.exists(primaryPath) || Files.exists(backupPath) || !archives().isEmpty();
    }

    /**
     * Deletes dated copies beyond the retention limit, oldest first
     */
    public void prune() {
        final var archives = archives();
        if (archives.size() <= retention) {
            return;
        }
        final var stale = archives.subList(retention, archives.size());
        stale.forEach(FileUtils::deleteIfExists);
        log.debug("Pruned {} old snapshots from {}", stale.size(), archiveDir);
    }

    private static boolean isArchive(final Path path) {
        final var name = path.getFileName().toString();
        return name.startsWith(ARCHIVE_PREFIX) && name.endsWith(ARCHIVE_SUFFIX) && Files.isRegularFile(path);
    }
}
