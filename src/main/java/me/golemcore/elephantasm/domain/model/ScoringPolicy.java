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

/**
 * Tunable constants of the recency and decay formulas.
 *
 * @param maxAgeDays
 *            horizon after which recency saturates at 0.0; must be positive
 * @param baseDecayRate
 *            per-day decay rate before resistance is applied; must be
 *            non-negative
 */
public record ScoringPolicy(double maxAgeDays, double baseDecayRate) {

    public static final double DEFAULT_MAX_AGE_DAYS = 365.0;
    public static final double DEFAULT_BASE_DECAY_RATE = 0.01;

    public ScoringPolicy {
        if (!Double.isFinite(maxAgeDays) || maxAgeDays <= 0.0) {
            throw new MemoryValidationException("maxAgeDays must be a positive number, got " + maxAgeDays);
        }
        if (!Double.isFinite(baseDecayRate) || baseDecayRate < 0.0) {
            throw new MemoryValidationException("baseDecayRate must be non-negative, got " + baseDecayRate);
        }
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(DEFAULT_MAX_AGE_DAYS, DEFAULT_BASE_DECAY_RATE);
    }
}
