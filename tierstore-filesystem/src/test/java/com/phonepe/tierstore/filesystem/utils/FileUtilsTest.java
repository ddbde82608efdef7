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


package com.phonepe.tierstore.filesystem.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testEnsurePathCreate() {
        final Path path = tempDir.resolve("new-dir/nested");
        final Path ensured = FileUtils.ensurePath(path, true, true);
        assertNotNull(ensured);
        assertTrue(Files.isDirectory(ensured));
        assertTrue(ensured.isAbsolute());
    }

    @Test
    void testEnsurePathExisting() {
        final Path path = tempDir.resolve("existing-dir");
        FileUtils.ensurePath(path.toString(), true, true);
        assertEquals(path.toAbsolutePath().normalize(), FileUtils.ensurePath(path.toString(), false, true));
    }

    @Test
    void testEnsurePathIsFile() throws Exception {
        final Path path = tempDir.resolve("a-file");
        Files.writeString(path, "content");
        assertThrows(IllegalArgumentException.class, () -> FileUtils.ensurePath(path, true, true));
    }

    @Test
    void testEnsurePathNotExistsNoCreate() {
        final Path path = tempDir.resolve("not-exists");
        assertThrows(IllegalArgumentException.class, () -> FileUtils.ensurePath(path, false, true));
    }

    @Test
    void testWriteNewNeverOverwrites() throws Exception {
        final Path path = tempDir.resolve("once.json");
        assertTrue(FileUtils.writeNew(path, bytes("first")));
        assertFalse(FileUtils.writeNew(path, bytes("second")));
        assertEquals("first", Files.readString(path));
    }

    @Test
    void testWriteAtomicallyReplaces() throws Exception {
        final Path path = tempDir.resolve("state.json");
        FileUtils.writeAtomically(path, bytes("old"));
        FileUtils.writeAtomically(path, bytes("new"));
        assertEquals("new", Files.readString(path));
        try (final var files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testReadIfExists() {
        final Path path = tempDir.resolve("data.bin");
        assertTrue(FileUtils.readIfExists(path).isEmpty());
        FileUtils.writeNew(path, bytes("payload"));
        assertArrayEquals(bytes("payload"), FileUtils.readIfExists(path).orElseThrow());
        FileUtils.deleteIfExists(path);
        FileUtils.deleteIfExists(path);
        assertFalse(Files.exists(path));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
