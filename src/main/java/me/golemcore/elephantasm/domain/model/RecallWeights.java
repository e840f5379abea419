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
 * Weights of the composite recall score. The sum is whatever the caller chooses;
 * nothing is renormalised.
 */
public record RecallWeights(
        double semantic,
        double importance,
        double confidence,
        double recency,
        double decayPenalty) {

    public RecallWeights {
        requireFinite("semantic", semantic);
        requireFinite("importance", importance);
        requireFinite("confidence", confidence);
        requireFinite("recency", recency);
        requireFinite("decayPenalty", decayPenalty);
    }

    public static RecallWeights defaults() {
        return new RecallWeights(0.40, 0.25, 0.15, 0.15, 0.05);
    }

    public double sum() {
        return semantic + importance + confidence + recency + decayPenalty;
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new MemoryValidationException("Recall weight '" + name + "' must be finite, got " + value);
        }
    }
}
