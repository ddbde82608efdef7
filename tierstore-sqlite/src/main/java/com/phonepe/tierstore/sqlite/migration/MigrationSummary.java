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


package com.phonepe.tierstore.sqlite.migration;

import lombok.Value;

/**
 * Outcome of a legacy stream migration
 */
@Value
public class MigrationSummary {
    /**
     * Records written to the active tier
     */
    int active;
    /**
     * Records written to archive files
     */
    int archived;
    /**
     * Records found in the legacy stream
     */
    int total;
    /**
     * Records already present in either tier, left alone
     */
    int skipped;

    public static MigrationSummary empty() {
        return new MigrationSummary(0, 0, 0, 0);
    }
}
