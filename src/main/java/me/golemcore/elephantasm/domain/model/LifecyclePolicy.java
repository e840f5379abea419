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
 * Decay-score thresholds gating the ACTIVE -> DECAYING -> ARCHIVED transitions.
 * Requires {@code 0 <= decayingThreshold <= archivedThreshold <= 1}.
 */
public record LifecyclePolicy(double decayingThreshold, double archivedThreshold) {

    public static final double DEFAULT_DECAYING_THRESHOLD = 0.5;
    public static final double DEFAULT_ARCHIVED_THRESHOLD = 0.85;

    public LifecyclePolicy {
        if (!inUnitInterval(decayingThreshold) || !inUnitInterval(archivedThreshold)) {
            throw new MemoryValidationException("Lifecycle thresholds must lie in [0.0, 1.0], got decaying="
                    + decayingThreshold + ", archived=" + archivedThreshold);
        }
        if (decayingThreshold > archivedThreshold) {
            throw new MemoryValidationException("decayingThreshold (" + decayingThreshold
                    + ") must not exceed archivedThreshold (" + archivedThreshold + ")");
        }
    }

    public static LifecyclePolicy defaults() {
        return new LifecyclePolicy(DEFAULT_DECAYING_THRESHOLD, DEFAULT_ARCHIVED_THRESHOLD);
    }

    private static boolean inUnitInterval(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
