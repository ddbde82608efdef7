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


package com.phonepe.tierstore.persistence.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Versioned state snapshot: a set of named numeric vectors plus two scalar gauges
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PersistedState {
    public static final int FIELD_DIMENSIONS = 64;
    public static final int TENSOR_DIMENSIONS = 64;
    public static final int EMBEDDING_DIMENSIONS = 32;

    /**
     * Starts at 1 and goes up by one on every {@link #advance}
     */
    long version;
    Instant lastUpdate;
    @Singular
    Map<String, double[]> vectors;
    double satisfaction;
    double affirmation;

    public static PersistedState initial(final Clock clock) {
        return PersistedState.builder()
                .version(1)
                .lastUpdate(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .vector("field", new double[FIELD_DIMENSIONS])
                .vector("tensor", new double[TENSOR_DIMENSIONS])
                .vector("embedding", new double[EMBEDDING_DIMENSIONS])
                .satisfaction(1.0)
                .affirmation(0.5)
                .build();
    }

    /**
     * @return Copy with the version bumped and the update time set to now
     */
    public PersistedState advance(final Clock clock) {
        return toBuilder()
                .version(version + 1)
                .lastUpdate(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .build();
    }
}
