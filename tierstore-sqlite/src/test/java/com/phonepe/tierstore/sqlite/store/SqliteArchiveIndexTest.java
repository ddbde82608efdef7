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

import com.phonepe.tierstore.core.model.ArchiveIndexEntry;
import com.phonepe.tierstore.core.utils.TestUtils;
import com.phonepe.tierstore.sqlite.utils.SqliteUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.phonepe.tierstore.core.utils.TestUtils.EPOCH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteArchiveIndexTest {

    @TempDir
    Path tempDir;

    private SqliteArchiveIndex index;

    @BeforeEach
    void setup() {
        index = SqliteArchiveIndex.builder()
                .dataSource(SqliteUtils.dataSource(tempDir.resolve("archive_index.db")))
                .build();
    }

    @Test
    void testPutAndGet() {
        final var record = TestUtils.record("x".repeat(500), EPOCH, -0.25, "Paris", "France");
        final var entry = ArchiveIndexEntry.of(record, "2025-03/archive_a.json");
        index.put(entry);

        final var stored = index.get(record.getId()).orElseThrow();
        assertEquals(entry, stored);
        assertEquals(ArchiveIndexEntry.PREVIEW_LENGTH, stored.getContentPreview().length());
        assertEquals(1, index.count());
        assertTrue(index.get("missing").isEmpty());
    }

    @Test
    void testPutReplacesExistingEntry() {
        final var record = TestUtils.record("moved", EPOCH, 0, "Paris");
        index.put(ArchiveIndexEntry.of(record, "2025-03/archive_a.json"));
        index.put(ArchiveIndexEntry.of(record, "2025-03/archive_b.json"));
        assertEquals(1, index.count());
        assertEquals("2025-03/archive_b.json", index.get(record.getId()).orElseThrow().getFilePath());
    }

    @Test
    void testFindPathsNewestFirstAndDeduplicated() {
        index.put(ArchiveIndexEntry.of(TestUtils.record("a", EPOCH, 0, "Paris"), "old.json"));
        index.put(ArchiveIndexEntry.of(TestUtils.record("b", EPOCH.plusSeconds(10), 0, "Paris"), "new.json"));
        index.put(ArchiveIndexEntry.of(TestUtils.record("c", EPOCH.plusSeconds(5), 0, "Paris"), "new.json"));
        index.put(ArchiveIndexEntry.of(TestUtils.record("d", EPOCH.plusSeconds(20), 0, "Rome"), "rome.json"));

        assertEquals(List.of("new.json", "old.json"), index.findPaths(List.of("Paris"), 5));
        assertEquals(List.of("new.json", "old.json", "rome.json"), index.findPaths(List.of("Paris", "Rome"), 5));
        assertEquals(List.of("new.json"), index.findPaths(List.of("Paris", "Rome"), 1));
        assertTrue(index.findPaths(List.of(), 5).isEmpty());
        assertTrue(index.findPaths(List.of("Berlin"), 5).isEmpty());
    }

    @Test
    void testPrefixMatchIsCaseSensitive() {
        index.put(ArchiveIndexEntry.of(TestUtils.record("a", EPOCH, 0, "Paris Agreement"), "treaty.json"));
        index.put(ArchiveIndexEntry.of(TestUtils.record("b", EPOCH, 0, "parish council"), "parish.json"));
        index.put(ArchiveIndexEntry.of(TestUtils.record("c", EPOCH, 0, "Old Paris"), "old.json"));

        assertEquals(List.of("treaty.json"), index.findPaths(List.of("Paris"), 5));
    }

    @Test
    void testWildcardsInEntitiesAreLiteral() {
        index.put(ArchiveIndexEntry.of(TestUtils.record("a", EPOCH, 0, "100% Pure"), "pure.json"));
        index.put(ArchiveIndexEntry.of(TestUtils.record("b", EPOCH, 0, "1000 Islands"), "islands.json"));
        index.put(ArchiveIndexEntry.of(TestUtils.record("c", EPOCH, 0, "snake_case"), "snake.json"));
        index.put(ArchiveIndexEntry.of(TestUtils.record("d", EPOCH, 0, "snakeXcase"), "other.json"));

        assertEquals(List.of("pure.json"), index.findPaths(List.of("100%"), 5));
        assertEquals(List.of("snake.json"), index.findPaths(List.of("snake_"), 5));
    }
}
