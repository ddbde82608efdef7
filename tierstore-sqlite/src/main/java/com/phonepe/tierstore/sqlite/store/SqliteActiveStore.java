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
import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.model.MemoryRecord;
import com.phonepe.tierstore.core.model.RecordSource;
import com.phonepe.tierstore.core.model.RecordType;
import com.phonepe.tierstore.core.store.ActiveStore;
import com.phonepe.tierstore.core.utils.JsonUtils;
import com.phonepe.tierstore.sqlite.utils.SqliteUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
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
 * Active tier in an SQLite database. Entities are kept both as a JSON column on the record and in a separate
 * {@code entity_index} table used for lookups. Ties on timestamp are broken by insertion order (rowid).
 */
@Slf4j
public class SqliteActiveStore implements ActiveStore {
    private static final TypeReference<LinkedHashSet<String>> STRING_SET = new TypeReference<>() {
    };
    private static final String COLUMNS
            = "id, content, timestamp, record_type, valence, confidence, source, entities, connections";
    private static final String NEWEST_FIRST = " ORDER BY timestamp DESC, rowid DESC";
    private static final String OLDEST_FIRST = " ORDER BY timestamp ASC, rowid ASC";

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    @Builder
    public SqliteActiveStore(@NonNull DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        createSchema();
    }

    @Override
    public void insert(MemoryRecord record) {
        SqliteUtils.inTransaction(dataSource, connection -> {
            if (exists(connection, record.getId()) || retired(connection, record.getId())) {
                throw StorageError.error(ErrorType.DUPLICATE_ID, record.getId());
            }
            try (var statement = connection.prepareStatement(
                    "INSERT INTO records (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                statement.setString(1, record.getId());
                statement.setString(2, record.getContent());
                statement.setLong(3, record.getTimestamp().toEpochMilli());
                statement.setString(4, record.getRecordType().name());
                statement.setDouble(5, record.getValence());
                statement.setDouble(6, record.getConfidence());
                statement.setString(7, JsonUtils.writeString(mapper, record.getSource()));
                statement.setString(8, JsonUtils.writeString(mapper, record.getEntities()));
                statement.setString(9, JsonUtils.writeString(mapper, record.getConnections()));
                statement.executeUpdate();
            }
            indexEntities(connection, record);
            return null;
        });
    }

    @Override
    public List<MemoryRecord> queryByEntities(Collection<String> entities, int limit) {
        if (entities == null || entities.isEmpty()) {
            return List.of();
        }
        final var distinct = List.copyOf(new LinkedHashSet<>(entities));
        final var sql = "SELECT " + COLUMNS + " FROM records WHERE id IN "
                + "(SELECT record_id FROM entity_index WHERE entity IN ("
                + SqliteUtils.placeholders(distinct.size()) + "))"
                + NEWEST_FIRST + " LIMIT ?";
        return select(sql, statement -> {
            int position = 1;
            for (final var entity : distinct) {
                statement.setString(position++, entity);
            }
            statement.setInt(position, limit);
        });
    }

    @Override
    public List<MemoryRecord> recent(int n) {
        return select("SELECT " + COLUMNS + " FROM records" + NEWEST_FIRST + " LIMIT ?",
                      statement -> statement.setInt(1, n));
    }

    @Override
    public List<MemoryRecord> oldest(int n) {
        return select("SELECT " + COLUMNS + " FROM records" + OLDEST_FIRST + " LIMIT ?",
                      statement -> statement.setInt(1, n));
    }

    @Override
    public List<MemoryRecord> all() {
        return select("SELECT " + COLUMNS + " FROM records" + OLDEST_FIRST, statement -> {
        });
    }

    @Override
    public Optional<MemoryRecord> get(String id) {
        return select("SELECT " + COLUMNS + " FROM records WHERE id = ?", statement -> statement.setString(1, id))
                .stream()
                .findFirst();
    }

    @Override
    public void delete(Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        SqliteUtils.inTransaction(dataSource, connection -> {
            deleteAll(connection, ids);
            return null;
        });
    }

    @Override
    public void update(MemoryRecord record) {
        SqliteUtils.inTransaction(dataSource, connection -> {
            updateRecord(connection, record);
            return null;
        });
    }

    @Override
    public void applyMerge(Collection<MemoryRecord> updated, Collection<String> deleted) {
        SqliteUtils.inTransaction(dataSource, connection -> {
            for (final var record : updated) {
                if (!exists(connection, record.getId())) {
                    throw StorageError.error(ErrorType.NOT_FOUND, record.getId());
                }
            }
            deleteAll(connection, deleted);
            retire(connection, deleted);
            for (final var record : updated) {
                updateRecord(connection, record);
            }
            log.debug("Merge applied: {} records updated, {} deleted", updated.size(), deleted.size());
            return null;
        });
    }

    @Override
    public boolean isRetired(String id) {
        return SqliteUtils.withConnection(dataSource, connection -> retired(connection, id));
    }

    @Override
    public long count() {
        return SqliteUtils.withConnection(dataSource, connection -> {
            try (var statement = connection.createStatement();
                 var rs = statement.executeQuery("SELECT COUNT(*) FROM records")) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    private void createSchema() {
        SqliteUtils.execute(dataSource,
                            """
                            CREATE TABLE IF NOT EXISTS records (
                                id TEXT PRIMARY KEY,
                                content TEXT NOT NULL,
                                timestamp INTEGER NOT NULL,
                                record_type TEXT NOT NULL,
                                valence REAL NOT NULL,
                                confidence REAL NOT NULL,
                                source TEXT,
                                entities TEXT NOT NULL,
                                connections TEXT NOT NULL
                            )""",
                            """
                            CREATE TABLE IF NOT EXISTS entity_index (
                                entity TEXT NOT NULL,
                                record_id TEXT NOT NULL,
                                PRIMARY KEY (entity, record_id)
                            )""",
                            "CREATE TABLE IF NOT EXISTS retired_ids (id TEXT PRIMARY KEY)",
                            "CREATE INDEX IF NOT EXISTS idx_records_timestamp ON records(timestamp)",
                            "CREATE INDEX IF NOT EXISTS idx_entity_index_entity ON entity_index(entity)",
                            "CREATE INDEX IF NOT EXISTS idx_entity_index_record ON entity_index(record_id)");
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement statement) throws SQLException;
    }

    private List<MemoryRecord> select(final String sql, final Binder binder) {
        return SqliteUtils.withConnection(dataSource, connection -> {
            try (var statement = connection.prepareStatement(sql)) {
                binder.bind(statement);
                try (var rs = statement.executeQuery()) {
                    final var records = new ArrayList<MemoryRecord>();
                    while (rs.next()) {
                        records.add(toRecord(rs));
                    }
                    return records;
                }
            }
        });
    }

    private MemoryRecord toRecord(final ResultSet rs) throws SQLException {
        final var id = rs.getString("id");
        final var source = rs.getString("source");
        return MemoryRecord.builder()
                .id(id)
                .content(rs.getString("content"))
                .timestamp(Instant.ofEpochMilli(rs.getLong("timestamp")))
                .recordType(RecordType.valueOf(rs.getString("record_type")))
                .valence(rs.getDouble("valence"))
                .confidence(rs.getDouble("confidence"))
                .source(source == null ? null : JsonUtils.read(mapper, source, RecordSource.class, "source of " + id))
                .entities(JsonUtils.read(mapper, rs.getString("entities"), STRING_SET, "entities of " + id))
                .connections(JsonUtils.read(mapper, rs.getString("connections"), STRING_SET, "connections of " + id))
                .build();
    }

    private static boolean exists(final Connection connection, final String id) throws SQLException {
        try (var statement = connection.prepareStatement("SELECT 1 FROM records WHERE id = ?")) {
            statement.setString(1, id);
            try (var rs = statement.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static boolean retired(final Connection connection, final String id) throws SQLException {
        try (var statement = connection.prepareStatement("SELECT 1 FROM retired_ids WHERE id = ?")) {
            statement.setString(1, id);
            try (var rs = statement.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static void retire(final Connection connection, final Collection<String> ids) throws SQLException {
        try (var statement = connection.prepareStatement("INSERT OR IGNORE INTO retired_ids (id) VALUES (?)")) {
            for (final var id : ids) {
                statement.setString(1, id);
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    /**
     * Replaces content, entities, connections and valence. Id, timestamp, type, confidence and source are kept.
     */
    private void updateRecord(final Connection connection, final MemoryRecord record) throws SQLException {
        try (var statement = connection.prepareStatement(
                "UPDATE records SET content = ?, entities = ?, connections = ?, valence = ? WHERE id = ?")) {
            statement.setString(1, record.getContent());
            statement.setString(2, JsonUtils.writeString(mapper, record.getEntities()));
            statement.setString(3, JsonUtils.writeString(mapper, record.getConnections()));
            statement.setDouble(4, record.getValence());
            statement.setString(5, record.getId());
            if (statement.executeUpdate() == 0) {
                throw StorageError.error(ErrorType.NOT_FOUND, record.getId());
            }
        }
        unindexEntities(connection, List.of(record.getId()));
        indexEntities(connection, record);
    }

    private static void deleteAll(final Connection connection, final Collection<String> ids) throws SQLException {
        unindexEntities(connection, ids);
        try (var statement = connection.prepareStatement("DELETE FROM records WHERE id = ?")) {
            for (final var id : ids) {
                statement.setString(1, id);
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static void indexEntities(final Connection connection, final MemoryRecord record) throws SQLException {
        try (var statement = connection.prepareStatement(
                "INSERT OR IGNORE INTO entity_index (entity, record_id) VALUES (?, ?)")) {
            for (final var entity : record.getEntities()) {
                statement.setString(1, entity);
                statement.setString(2, record.getId());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static void unindexEntities(final Connection connection, final Collection<String> ids)
            throws SQLException {
        try (var statement = connection.prepareStatement("DELETE FROM entity_index WHERE record_id = ?")) {
            for (final var id : ids) {
                statement.setString(1, id);
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }
}
