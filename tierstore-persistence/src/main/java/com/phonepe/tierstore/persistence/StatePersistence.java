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

import com.phonepe.tierstore.core.config.ConfigLoader;
import com.phonepe.tierstore.core.config.TierStoreConfig;
import com.phonepe.tierstore.persistence.model.PersistedState;
import com.phonepe.tierstore.persistence.storage.SnapshotStorage;
import com.phonepe.tierstore.persistence.validation.PersistedStateValidator;
import lombok.experimental.UtilityClass;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the persistence pieces for a {@link PersistedState} from configuration
 */
@UtilityClass
public class StatePersistence {

    public static PersistenceEngine<PersistedState> engine(final TierStoreConfig config, final Clock clock) {
        final var storage = SnapshotStorage.builder()
                .root(Path.of(config.getSnapshotDir()))
                .retention(config.getSnapshotRetention())
                .clock(clock)
                .build();
        return PersistenceEngine.<PersistedState>builder()
                .storage(storage)
                .stateType(PersistedState.class)
                .validator(new PersistedStateValidator())
                .build();
    }

    /**
     * Recovers the last consistent state (or starts a fresh one) and starts the snapshot loop with the configured
     * interval
     */
    public static CrashResistantState<PersistedState> open(final TierStoreConfig config, final Clock clock) {
        ConfigLoader.validate(config);
        return CrashResistantState.recoverOrCreate(engine(config, clock),
                                                   () -> PersistedState.initial(clock),
                                                   Duration.ofMillis(config.getSnapshotIntervalMs()));
    }
}
