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


package com.phonepe.tierstore.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.utils.JsonUtils;
import com.phonepe.tierstore.filesystem.utils.FileUtils;
import com.phonepe.tierstore.persistence.storage.SnapshotStorage;
import com.phonepe.tierstore.persistence.validation.SnapshotValidator;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes state snapshots to every location of a {@link SnapshotStorage} and reads back the first consistent one.
 * Knows nothing about the state beyond its JSON form and the supplied validator.
 *
 * @param <T> State type
 */
@Slf4j
public class PersistenceEngine<T> {
    @Getter
    private final SnapshotStorage storage;
    private final Class<T> stateType;
    private final SnapshotValidator<T> validator;
    private final ObjectMapper mapper;
    private final AtomicLong recoveries = new AtomicLong();

    @Builder
    public PersistenceEngine(@NonNull SnapshotStorage storage,
                             @NonNull Class<T> stateType,
                             SnapshotValidator<T> validator,
                             ObjectMapper mapper) {
        this.storage = storage;
        this.stateType = stateType;
        this.validator = Objects.requireNonNullElseGet(validator, SnapshotValidator::none);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    /**
     * Serializes the state and writes it to primary, backup and a dated copy. Validation runs after the write; a
     * state that fails it stays on disk and is reported through a VALIDATION_FAILURE error.
     *
     * @param state State to write
     * @throws StorageError IO_FAILURE if a write fails, VALIDATION_FAILURE if the written state is inconsistent
     */
    public void persist(@NonNull final T state) {
        final var data = JsonUtils.write(mapper, state);
        final var archived = storage.writeWithRedundancy(data);
        log.debug("Persisted {} bytes of state, dated copy at {}", data.length, archived.getFileName());
        final var result = validator.validate(state);
        if (!result.isValid()) {
            log.error("Persisted state failed validation: {}", result.getErrors());
            throw StorageError.error(ErrorType.VALIDATION_FAILURE, result.getErrors());
        }
    }

    /**
     * Tries primary, then backup, then dated copies newest first. The first location that parses and validates wins.
     * Missing, unreadable and inconsistent locations are logged and skipped.
     *
     * @return Recovered state
     * @throws StorageError NO_CONSISTENT_STATE if no location yields a consistent state
     */
    public T recover() {
        final var candidates = storage.candidates();
        for (final var candidate : candidates) {
            final T state;
            try {
                final var data = FileUtils.readIfExists(candidate);
                if (data.isEmpty()) {
                    log.debug("No snapshot at {}", candidate);
                    continue;
                }
                state = JsonUtils.read(mapper, data.get(), stateType, candidate.toString());
            }
            catch (StorageError e) {
                log.warn("Skipping unreadable snapshot {}: {}", candidate, e.getMessage());
                continue;
            }
            final var result = validator.validate(state);
            if (!result.isValid()) {
                log.warn("Skipping inconsistent snapshot {}: {}", candidate, result.getErrors());
                continue;
            }
            final var count = recoveries.incrementAndGet();
            log.info("Recovered state from {} (recovery #{})", candidate, count);
            return state;
        }
        log.error("Could not recover state: none of {} snapshot locations is readable and consistent",
                  candidates.size());
        throw StorageError.error(ErrorType.NO_CONSISTENT_STATE, candidates.size());
    }

    /**
     * @return Number of successful recoveries by this engine
     */
    public long recoveryCount() {
        return recoveries.get();
    }
}
