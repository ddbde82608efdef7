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


import com.phonepe.tierstore.core.errors.StorageError;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a directory with the required permissions. If the path does not
     * exist and createIfNotExists is true, it will attempt to create the directory.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @param writeCheck        Whether to check for write permissions on the directory.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is invalid or does not have the required permissions
     * @throws StorageError             If the directory could not be created
     */
    public static Path ensurePath(Path path, boolean createIfNotExists, boolean writeCheck) {
        final var absolutePath = path.toAbsolutePath().normalize();
        if (Files.exists(absolutePath)) {
            if (!Files.isDirectory(absolutePath)
                    || !Files.isReadable(absolutePath)
                    || (writeCheck && !Files.isWritable(absolutePath))) {
                throw new IllegalArgumentException(
                        "Sanity check for %s failed. Please check it is a directory with the required permissions"
                                .formatted(absolutePath));
            }
            return absolutePath;
        }
        if (!createIfNotExists) {
            throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
        }
        try {
            Files.createDirectories(absolutePath);
            log.debug("Created directory {}", absolutePath);
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
        return absolutePath;
    }

    public static Path ensurePath(String path, boolean createIfNotExists, boolean writeCheck) {
        return ensurePath(Path.of(path), createIfNotExists, writeCheck);
    }

    /**
     * Creates a file with the given content. Never touches an existing file.
     *
     * @param filePath Target file. Parent directory must exist.
     * @param data     Content
     * @return false if the file already existed, true if it was created
     */
    public static boolean writeNew(Path filePath, byte[] data) {
        try {
            Files.write(filePath, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        }
        catch (FileAlreadyExistsException e) {
            return false;
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
    }

    /**
     * Replaces the content of a file atomically. Data is written to a temporary sibling first and then moved over the
     * target, so readers see either the old or the new content, never a partial write.
     *
     * @param filePath Target file. Parent directory must exist.
     * @param data     Content
     */
    public static void writeAtomically(Path filePath, byte[] data) {
        final var temp = filePath.resolveSibling("." + filePath.getFileName() + ".tmp");
        try {
            Files.write(temp, data,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.SYNC);
            try {
                Files.move(temp, filePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
            catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to plain replace", filePath);
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
    }

    /**
     * @return File content, or empty if the file does not exist
     */
    public static Optional<byte[]> readIfExists(Path filePath) {
        try {
            return Optional.of(Files.readAllBytes(filePath));
        }
        catch (NoSuchFileException e) {
            return Optional.empty();
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
    }

    public static void deleteIfExists(Path filePath) {
        try {
            Files.deleteIfExists(filePath);
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
    }

}
