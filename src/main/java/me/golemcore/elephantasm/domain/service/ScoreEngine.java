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
import me.golemcore.elephantasm.domain.model.MemoryScores;
import me.golemcore.elephantasm.domain.model.ScoreMode;
import me.golemcore.elephantasm.domain.model.ScoringPolicy;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes recency and decay of a memory at an explicit reference time.
 *
 * <p>
 * Recency is purely temporal:
 *
 * <pre>
 * recency = clamp(1 - ageDays / maxAgeDays)
 * </pre>
 *
 * <p>
 * Decay is resisted by the geometric mean of importance and confidence, which
 * slows the rate but never changes the asymptote of 1.0:
 *
 * <pre>
 * resistance = sqrt(importance * confidence)
 * decay      = 1 - exp(-baseDecayRate * ageDays * (1 - resistance))
 * </pre>
 *
 * <p>
 * Age is measured in fractional days from {@code timeEnd}, falling back to
 * {@code createdAt}. Future timestamps count as age 0. The engine holds no state
 * and never reads a clock, so it is safe to call concurrently.
 */
@Service
public class ScoreEngine {

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    public MemoryScores score(double importance, double confidence, Instant createdAt, Instant timeEnd,
            Instant now, ScoringPolicy policy) {
        MemoryValidation.requireUnitInterval("importance", importance);
        MemoryValidation.requireUnitInterval("confidence", confidence);
        requirePolicy(policy);

        Instant effectiveTime = timeEnd != null ? timeEnd : createdAt;
        double ageDays = ageDays(effectiveTime, now);
        return new MemoryScores(recencyScore(ageDays, policy), decayScore(importance, confidence, ageDays, policy));
    }

    /**
     * Score a stored memory. In {@link ScoreMode#CACHED} mode the cached pair is
     * returned when both values are present.
     */
    public MemoryScores score(Memory memory, Instant now, ScoringPolicy policy, ScoreMode mode) {
        if (memory == null) {
            throw new MemoryValidationException("Memory is required");
        }
        if (mode == ScoreMode.CACHED && memory.getRecencyScore() != null && memory.getDecayScore() != null) {
            return new MemoryScores(
                    MemoryValidation.requireUnitInterval("recencyScore", memory.getRecencyScore()),
                    MemoryValidation.requireUnitInterval("decayScore", memory.getDecayScore()));
        }
        return score(memory.getImportance(), memory.getConfidence(), memory.getCreatedAt(), memory.getTimeEnd(),
                now, policy);
    }

    public double recencyScore(double ageDays, ScoringPolicy policy) {
        return clamp(1.0 - (Math.max(0.0, ageDays) / policy.maxAgeDays()));
    }

    public double decayScore(double importance, double confidence, double ageDays, ScoringPolicy policy) {
        double resistance = resistance(importance, confidence);
        double exponent = -policy.baseDecayRate() * Math.max(0.0, ageDays) * (1.0 - resistance);
        return clamp(1.0 - Math.exp(exponent));
    }

    public double resistance(double importance, double confidence) {
        return clamp(Math.sqrt(importance * confidence));
    }

    /**
     * Timestamp that age is measured from: {@code timeEnd}, else
     * {@code createdAt}.
     */
    public static Instant resolveEffectiveTime(Memory memory) {
        if (memory == null) {
            return null;
        }
        return memory.getTimeEnd() != null ? memory.getTimeEnd() : memory.getCreatedAt();
    }

    static double ageDays(Instant effectiveTime, Instant now) {
        if (effectiveTime == null) {
            throw new MemoryValidationException("Memory has neither timeEnd nor createdAt");
        }
        if (now == null) {
            throw new MemoryValidationException("Reference time 'now' is required");
        }
        double days = Duration.between(effectiveTime, now).toMillis() / MILLIS_PER_DAY;
        return Math.max(0.0, days);
    }

    private void requirePolicy(ScoringPolicy policy) {
        if (policy == null) {
            throw new MemoryValidationException("Scoring policy is required");
        }
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        if (value > 1.0) {
            return 1.0;
        }
        return value;
    }
}
