package me.golemcore.elephantasm.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.elephantasm.domain.exception.MemoryValidationException;
import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.domain.model.MemoryUpdate;

/**
 * Range checks shared by the scoring core and the persistence adapters.
 */
public final class MemoryValidation {

    private MemoryValidation() {
    }

    public static double requireUnitInterval(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new MemoryValidationException(field + " must lie in [0.0, 1.0], got " + value);
        }
        return value;
    }

    public static void requireUnitIntervalIfPresent(String field, Double value) {
        if (value != null) {
            requireUnitInterval(field, value);
        }
    }

    /**
     * Validate a memory about to be inserted.
     */
    public static void validateNew(Memory memory) {
        if (memory == null) {
            throw new MemoryValidationException("Memory is required");
        }
        if (memory.getSpiritId() == null || memory.getSpiritId().isBlank()) {
            throw new MemoryValidationException("Memory spiritId is required");
        }
        requireUnitInterval("importance", memory.getImportance());
        requireUnitInterval("confidence", memory.getConfidence());
        requireUnitIntervalIfPresent("recencyScore", memory.getRecencyScore());
        requireUnitIntervalIfPresent("decayScore", memory.getDecayScore());
    }

    public static void validateUpdate(MemoryUpdate update) {
        if (update == null) {
            throw new MemoryValidationException("Memory update is required");
        }
        requireUnitIntervalIfPresent("importance", update.getImportance());
        requireUnitIntervalIfPresent("confidence", update.getConfidence());
        requireUnitIntervalIfPresent("recencyScore", update.getRecencyScore());
        requireUnitIntervalIfPresent("decayScore", update.getDecayScore());
        if (update.getTimeStart() != null && update.getTimeEnd() != null
                && update.getTimeStart().isAfter(update.getTimeEnd())) {
            throw new MemoryValidationException("timeStart must not be after timeEnd");
        }
    }
}
