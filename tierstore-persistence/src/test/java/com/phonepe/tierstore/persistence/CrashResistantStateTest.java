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

import com.phonepe.tierstore.core.config.TierStoreConfig;
import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.utils.TestUtils;
import com.phonepe.tierstore.persistence.model.PersistedState;
import com.phonepe.tierstore.persistence.storage.SnapshotStorage;
import com.phonepe.tierstore.persistence.validation.PersistedStateValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static com.phonepe.tierstore.core.utils.TestUtils.EPOCH;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CrashResistantStateTest {
    private static final Duration INTERVAL = Duration.ofMillis(50);

    @TempDir
    Path tempDir;

    private final Clock clock = TestUtils.steppingClock(EPOCH, Duration.ofMillis(1));
    private PersistenceEngine<PersistedState> engine;

    @BeforeEach
    void setup() {
        engine = PersistenceEngine.<PersistedState>builder()
                .storage(SnapshotStorage.builder().root(tempDir.resolve("state")).clock(clock).build())
                .stateType(PersistedState.class)
                .validator(new PersistedStateValidator())
                .build();
    }

    @Test
    void testLoopPersistsLatestState() {
        try (final var state = new CrashResistantState<>(PersistedState.initial(clock), engine, INTERVAL)) {
            state.update(current -> current.advance(clock));
            state.update(current -> current.toBuilder().affirmation(0.9).build());
            assertEquals(2, state.read(PersistedState::getVersion));

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> {
                        final var recovered = engine.recover();
                        assertEquals(2, recovered.getVersion());
                        assertEquals(0.9, recovered.getAffirmation());
                    });
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void testLoopSurvivesFailures() {
        final PersistenceEngine<PersistedState> failing = mock(PersistenceEngine.class);
        doThrow(StorageError.error(ErrorType.IO_FAILURE, "disk full"))
                .doThrow(new IllegalStateException("unexpected"))
                .doNothing()
                .when(failing).persist(any());

        try (final var ignored = new CrashResistantState<>(PersistedState.initial(clock), failing, INTERVAL)) {
            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> verify(failing, atLeast(4)).persist(any()));
        }
    }

    @Test
    void testPersistNowAndRecoverOrCreate() {
        try (final var first = CrashResistantState.recoverOrCreate(engine,
                                                                   () -> PersistedState.initial(clock),
                                                                   Duration.ofHours(1))) {
            assertEquals(1, first.read(PersistedState::getVersion));
            first.update(current -> current.advance(clock).advance(clock));
            first.persistNow();
        }
        try (final var second = CrashResistantState.recoverOrCreate(engine,
                                                                    () -> PersistedState.initial(clock),
                                                                    Duration.ofHours(1))) {
            assertEquals(3, second.read(PersistedState::getVersion));
        }
    }

    @Test
    void testUnrecoverableSnapshotsAreAnError() throws Exception {
        engine.persist(PersistedState.initial(clock));
        for (final var candidate : engine.getStorage().candidates()) {
            Files.writeString(candidate, "garbage");
        }
        final var error = assertThrows(StorageError.class,
                                       () -> CrashResistantState.recoverOrCreate(engine,
                                                                                 () -> PersistedState.initial(clock),
                                                                                 INTERVAL));
        assertEquals(ErrorType.NO_CONSISTENT_STATE, error.getErrorType());
    }

    @Test
    void testInvalidUpdates() {
        try (final var state = new CrashResistantState<>(PersistedState.initial(clock), engine, Duration.ofHours(1))) {
            assertThrows(IllegalArgumentException.class, () -> state.update(current -> null));
            assertEquals(1, state.read(PersistedState::getVersion));
        }
        assertThrows(IllegalArgumentException.class,
                     () -> new CrashResistantState<>(PersistedState.initial(clock), engine, Duration.ZERO));
    }

    @Test
    void testOpenFromConfig() {
        final var config = TierStoreConfig.builder()
                .snapshotDir(tempDir.resolve("configured").toString())
                .snapshotIntervalMs(20)
                .snapshotRetention(5)
                .build();
        try (final var state = StatePersistence.open(config, clock)) {
            assertEquals(1, state.read(PersistedState::getVersion));
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> Files.exists(tempDir.resolve("configured").resolve(SnapshotStorage.PRIMARY_FILE)));
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> engine(config).getStorage().archives().size() == 5);
        }
        assertTrue(Files.exists(tempDir.resolve("configured/backup/state_backup.json")));
    }

    private PersistenceEngine<PersistedState> engine(TierStoreConfig config) {
        return StatePersistence.engine(config, clock);
    }
}
