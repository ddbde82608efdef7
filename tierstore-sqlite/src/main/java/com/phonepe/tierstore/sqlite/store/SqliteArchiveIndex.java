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


package com.phonepe.tierstore.sqlite.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.tierstore.core.model.ArchiveIndexEntry;
import com.phonepe.tierstore.core.model.RecordType;
import com.phonepe.tierstore.core.store.ArchiveIndex;
import com.phonepe.tierstore.core.utils.JsonUtils;
import com.phonepe.tierstore.sqlite.utils.SqliteUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Archive metadata in an SQLite database. Entities are stored as a JSON array; lookups narrow candidates with
 * {@code LIKE '%"<entity>%'} and then confirm the prefix match on the decoded list, since LIKE ignores ASCII case.
 */
@Slf4j
public class SqliteArchiveIndex implements ArchiveIndex {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    @Builder
    public SqliteArchiveIndex(@NonNull DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        SqliteUtils.execute(dataSource,
                            """
                            CREATE TABLE IF NOT EXISTS archive_metadata (
                                id TEXT PRIMARY KEY,
                                file_path TEXT NOT NULL,
                                timestamp INTEGER NOT NULL,
                                entities TEXT NOT NULL,
                                valence REAL NOT NULL,
                                record_type TEXT NOT NULL,
                                content_preview TEXT,
                                connections TEXT NOT NULL
                            )""",
                            "CREATE INDEX IF NOT EXISTS idx_archive_timestamp ON archive_metadata(timestamp DESC)",
                            "CREATE INDEX IF NOT EXISTS idx_archive_entities ON archive_metadata(entities)");
    }

    @Override
    public void put(ArchiveIndexEntry entry) {
        SqliteUtils.withConnection(dataSource, connection -> {
            try (var statement = connection.prepareStatement(
                    "INSERT OR REPLACE INTO archive_metadata "
                            + "(id, file_path, timestamp, entities, valence, record_type, content_preview, connections) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
                statement.setString(1, entry.getId());
                statement.setString(2, entry.getFilePath());
                statement.setLong(3, entry.getTimestamp().toEpochMilli());
                statement.setString(4, JsonUtils.writeString(mapper, entry.getEntities()));
                statement.setDouble(5, entry.getValence());
                statement.setString(6, entry.getRecordType().name());
                statement.setString(7, entry.getContentPreview());
                statement.setString(8, JsonUtils.writeString(mapper, entry.getConnections()));
                return statement.executeUpdate();
            }
        });
        log.debug("Indexed archived record {} in {}", entry.getId(), entry.getFilePath());
    }

    @Override
    public List<String> findPaths(Collection<String> entities, int limit) {
        if (entities == null || entities.isEmpty() || limit <= 0) {
            return List.of();
        }
        final var paths = new LinkedHashSet<String>();
        for (final var entity : entities) {
            if (paths.size() >= limit) {
                break;
            }
            paths.addAll(findPaths(entity, limit));
        }
        return paths.stream().limit(limit).toList();
    }

    @Override
    public Optional<ArchiveIndexEntry> get(String id) {
        return SqliteUtils.withConnection(dataSource, connection -> {
            try (var statement = connection.prepareStatement("SELECT * FROM archive_metadata WHERE id = ?")) {
                statement.setString(1, id);
                try (var rs = statement.executeQuery()) {
                    return rs.next() ? Optional.of(toEntry(rs)) : Optional.<ArchiveIndexEntry>empty();
                }
            }
        });
    }

    @Override
    public long count() {
        return SqliteUtils.withConnection(dataSource, connection -> {
            try (var statement = connection.createStatement();
                 var rs = statement.executeQuery("SELECT COUNT(*) FROM archive_metadata")) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    /**
     * Newest files first for a single entity
     */
    private List<String> findPaths(final String entity, int limit) {
        final var encoded = JsonUtils.writeString(mapper, entity);
        // Drop the closing quote so that the pattern matches any entity starting with this one
        final var pattern = "%" + escapeLike(encoded.substring(0, encoded.length() - 1)) + "%";
        return SqliteUtils.withConnection(dataSource, connection -> {
            try (var statement = connection.prepareStatement(
                    "SELECT file_path, entities FROM archive_metadata WHERE entities LIKE ? ESCAPE '\\' "
                            + "ORDER BY timestamp DESC")) {
                statement.setString(1, pattern);
                try (var rs = statement.executeQuery()) {
                    final var paths = new LinkedHashSet<String>();
                    while (rs.next() && paths.size() < limit) {
                        final var filePath = rs.getString("file_path");
                        final var stored = JsonUtils.read(mapper, rs.getString("entities"), STRING_LIST, filePath);
                        if (stored.stream().anyMatch(candidate -> candidate.startsWith(entity))) {
                            paths.add(filePath);
                        }
                    }
                    return new ArrayList<>(paths);
                }
            }
        });
    }

    private ArchiveIndexEntry toEntry(final ResultSet rs) throws SQLException {
        final var id = rs.getString("id");
        return ArchiveIndexEntry.builder()
                .id(id)
                .filePath(rs.getString("file_path"))
                .timestamp(Instant.ofEpochMilli(rs.getLong("timestamp")))
                .entities(JsonUtils.read(mapper, rs.getString("entities"), STRING_LIST, "entities of " + id))
                .valence(rs.getDouble("valence"))
                .recordType(RecordType.valueOf(rs.getString("record_type")))
                .contentPreview(rs.getString("content_preview"))
                .connections(JsonUtils.read(mapper, rs.getString("connections"), STRING_LIST, "connections of " + id))
                .build();
    }

    private static String escapeLike(final String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
