package me.golemcore.elephantasm.domain.model;

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

import java.util.Locale;

/**
 * Lifecycle states for memory recall and curation.
 *
 * <ul>
 * <li>{@code ACTIVE} - actively recalled</li>
 * <li>{@code DECAYING} - fading from active recall</li>
 * <li>{@code ARCHIVED} - preserved but excluded from recall by default</li>
 * </ul>
 */
public enum MemoryState {
    ACTIVE, DECAYING, ARCHIVED;

    /**
     * Parse a state name case-insensitively. Unknown values are rejected rather
     * than mapped to a default.
     */
    public static MemoryState fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new MemoryValidationException("Memory state is required");
        }
        try {
            return MemoryState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MemoryValidationException("Unknown memory state: " + value);
        }
    }
}
