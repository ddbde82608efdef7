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

import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.model.MemoryRecord;
import com.phonepe.tierstore.core.model.Researched;
import com.phonepe.tierstore.core.store.InMemoryArchiveIndex;
import com.phonepe.tierstore.core.utils.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.phonepe.tierstore.core.utils.TestUtils.EPOCH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemArchiveStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemArchiveStore store;

    @BeforeEach
    void setup() {
        store = FileSystemArchiveStore.builder()
                .archiveRoot(tempDir.resolve("memory_archive"))
                .index(new InMemoryArchiveIndex())
                // Frozen clock so that every append in a test asks for the same file name
                .clock(TestUtils.steppingClock(EPOCH, Duration.ZERO))
                .build();
    }

    @Test
    void testAppendLayoutAndLoad() {
        final var records = List.of(TestUtils.record("one", EPOCH, 0.1, "Paris"),
                                    TestUtils.record("two", EPOCH.plusSeconds(5), -0.3, "Rome"));
        final var path = store.append("2025-03", records);
        assertEquals("2025-03/archive_20250301_100000_000.json", path);
        assertTrue(Files.exists(tempDir.resolve("memory_archive").resolve(path)));
        assertEquals(records, store.load(path));
    }

    @Test
    void testNameClashGetsSuffix() {
        final var first = store.append("2025-03", List.of(TestUtils.record("one", EPOCH, 0)));
        final var second = store.append("2025-03", List.of(TestUtils.record("two", EPOCH, 0)));
        final var third = store.append("2025-03", List.of(TestUtils.record("three", EPOCH, 0)));
        assertEquals("2025-03/archive_20250301_100000_000.json", first);
        assertEquals("2025-03/archive_20250301_100000_000_001.json", second);
        assertEquals("2025-03/archive_20250301_100000_000_002.json", third);
        assertEquals("one", store.load(first).get(0).getContent());
        assertEquals("three", store.load(third).get(0).getContent());
    }

    @Test
    void testManyClashesSortInWriteOrder() {
        final var written = new ArrayList<String>();
        for (int i = 0; i < 12; i++) {
            written.add(store.append("2025-03", List.of(TestUtils.record("r" + i, EPOCH, 0))));
        }
        assertEquals("2025-03/archive_20250301_100000_000_011.json", written.get(11));
        final var sorted = new ArrayList<>(written);
        Collections.sort(sorted);
        assertEquals(written, sorted);
    }

    @Test
    void testArchiveGroupsByMonthAndIndexes() {
        final var february = TestUtils.record("late winter", Instant.parse("2025-02-27T23:59:59Z"), 0, "Oslo");
        final var march = TestUtils.record("early spring", Instant.parse("2025-03-01T00:00:00Z"), 0, "Oslo");
        final var written = store.archive(List.of(march, february));

        assertEquals(List.of("2025-02", "2025-03"), List.copyOf(written.keySet()));
        assertEquals(2, store.count());
        assertEquals(written.get("2025-02"), store.findEntry(february.getId()).orElseThrow().getFilePath());
        assertEquals(List.of(written.get("2025-03"), written.get("2025-02")),
                     store.findByEntities(List.of("Oslo"), 5));
    }

    @Test
    void testSourceSurvivesArchiving() {
        final var researched = TestUtils.record("fact", EPOCH, 0.5, "Moon")
                .toBuilder()
                .source(new Researched("encyclopedia", "what orbits the Earth", EPOCH))
                .confidence(0.7)
                .build();
        final var path = store.append("2025-03", List.of(researched));
        final MemoryRecord loaded = store.load(path).get(0);
        assertEquals(researched.getSource(), loaded.getSource());
        assertEquals(0.7, loaded.getConfidence());
    }

    @Test
    void testMissingFile() {
        final var error = assertThrows(StorageError.class, () -> store.load("2025-03/archive_nothing.json"));
        assertEquals(ErrorType.ARCHIVE_NOT_FOUND, error.getErrorType());
    }

    @Test
    void testCorruptFile() throws Exception {
        final var path = store.append("2025-03", List.of(TestUtils.record("one", EPOCH, 0)));
        Files.writeString(tempDir.resolve("memory_archive").resolve(path), "[{\"id\": ");
        final var error = assertThrows(StorageError.class, () -> store.load(path));
        assertEquals(ErrorType.CORRUPT, error.getErrorType());
    }

    @Test
    void testPathsOutsideRootRejected() throws Exception {
        Files.writeString(tempDir.resolve("secret.json"), "[]");
        final var error = assertThrows(StorageError.class, () -> store.load("../secret.json"));
        assertEquals(ErrorType.ARCHIVE_NOT_FOUND, error.getErrorType());
        assertNotEquals(0, Files.size(tempDir.resolve("secret.json")));
    }
}
