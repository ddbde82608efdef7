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


package com.phonepe.tierstore.persistence.validation;

import com.phonepe.tierstore.persistence.model.PersistedState;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@link PersistedState} is consistent when its version is at least 1, it has an update time and it carries at
 * least one vector, none of them empty
 */
public class PersistedStateValidator implements SnapshotValidator<PersistedState> {

    @Override
    public ValidationResult validate(PersistedState state) {
        if (state == null) {
            return ValidationResult.failed(List.of("state is missing"));
        }
        final var errors = new ArrayList<String>();
        if (state.getVersion() < 1) {
            errors.add("version must be >= 1, got " + state.getVersion());
        }
        if (state.getLastUpdate() == null) {
            errors.add("lastUpdate is not set");
        }
        if (state.getVectors().isEmpty()) {
            errors.add("no vectors present");
        }
        state.getVectors().forEach((name, vector) -> {
            if (vector == null || vector.length == 0) {
                errors.add("vector '" + name + "' is empty");
            }
        });
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.failed(errors);
    }
}
