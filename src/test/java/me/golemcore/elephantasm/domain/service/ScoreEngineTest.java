package me.golemcore.elephantasm.domain.service;

import me.golemcore.elephantasm.domain.exception.MemoryValidationException;
import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.domain.model.MemoryScores;
import me.golemcore.elephantasm.domain.model.ScoreMode;
import me.golemcore.elephantasm.domain.model.ScoringPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreEngineTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final ScoringPolicy POLICY = ScoringPolicy.defaults();
    private static final double EPSILON = 1e-9;

    private final ScoreEngine engine = new ScoreEngine();

    @Test
    void shouldNotDecayFreshMemory() {
        MemoryScores scores = engine.score(0.9, 0.9, NOW, null, NOW, POLICY);

        assertEquals(0.0, scores.decayScore(), EPSILON);
        assertEquals(1.0, scores.recencyScore(), EPSILON);
    }

    @Test
    void shouldDecayWeakMemoryAfterHundredDays() {
        MemoryScores scores = engine.score(0.1, 0.1, daysAgo(100), null, NOW, POLICY);

        assertEquals(1.0 - Math.exp(-0.9), scores.decayScore(), EPSILON);
        assertEquals(0.593, scores.decayScore(), 0.001);
        assertEquals(1.0 - 100.0 / 365.0, scores.recencyScore(), EPSILON);
    }

    @Test
    void shouldMeasureAgeFromTimeEndWhenPresent() {
        MemoryScores scores = engine.score(0.5, 0.5, daysAgo(300), daysAgo(0), NOW, POLICY);

        assertEquals(1.0, scores.recencyScore(), EPSILON);
        assertEquals(0.0, scores.decayScore(), EPSILON);
    }

    @Test
    void shouldTreatFutureTimestampsAsAgeZero() {
        MemoryScores scores = engine.score(0.2, 0.3, NOW.plus(Duration.ofDays(5)), null, NOW, POLICY);

        assertEquals(1.0, scores.recencyScore(), EPSILON);
        assertEquals(0.0, scores.decayScore(), EPSILON);
    }

    @Test
    void shouldSaturateRecencyPastMaxAge() {
        MemoryScores scores = engine.score(0.5, 0.5, daysAgo(500), null, NOW, POLICY);

        assertEquals(0.0, scores.recencyScore(), EPSILON);
    }

    @Test
    void shouldUseFractionalDays() {
        MemoryScores scores = engine.score(0.0, 0.0, NOW.minus(Duration.ofHours(12)), null, NOW, POLICY);

        assertEquals(1.0 - 0.5 / 365.0, scores.recencyScore(), EPSILON);
        assertEquals(1.0 - Math.exp(-0.005), scores.decayScore(), EPSILON);
    }

    @Test
    void shouldKeepScoresInUnitIntervalAcrossInputs() {
        double[] values = { 0.0, 0.25, 0.5, 0.99, 1.0 };
        int[] ages = { 0, 1, 30, 365, 10_000 };
        ScoringPolicy aggressive = new ScoringPolicy(1.0, 5.0);
        for (double importance : values) {
            for (double confidence : values) {
                for (int age : ages) {
                    MemoryScores scores = engine.score(importance, confidence, daysAgo(age), null, NOW, aggressive);
                    assertTrue(scores.recencyScore() >= 0.0 && scores.recencyScore() <= 1.0);
                    assertTrue(scores.decayScore() >= 0.0 && scores.decayScore() <= 1.0);
                }
            }
        }
    }

    @Test
    void shouldDecayMonotonicallyWithAge() {
        double previousDecay = -1.0;
        double previousRecency = 2.0;
        for (int age = 0; age <= 400; age += 20) {
            MemoryScores scores = engine.score(0.4, 0.6, daysAgo(age), null, NOW, POLICY);
            assertTrue(scores.decayScore() >= previousDecay);
            assertTrue(scores.recencyScore() <= previousRecency);
            previousDecay = scores.decayScore();
            previousRecency = scores.recencyScore();
        }
    }

    @Test
    void shouldDecaySlowerForImportantConfidentMemories() {
        MemoryScores strong = engine.score(0.9, 0.9, daysAgo(120), null, NOW, POLICY);
        MemoryScores weak = engine.score(0.2, 0.2, daysAgo(120), null, NOW, POLICY);

        assertTrue(strong.decayScore() < weak.decayScore());
        assertEquals(strong.recencyScore(), weak.recencyScore(), EPSILON);
    }

    @Test
    void shouldGiveNoResistanceWhenEitherFactorIsZero() {
        assertEquals(0.0, engine.resistance(0.0, 1.0), EPSILON);
        assertEquals(0.0, engine.resistance(1.0, 0.0), EPSILON);
        assertEquals(0.5, engine.resistance(0.25, 1.0), EPSILON);
    }

    @Test
    void shouldNeverDecayFullyResistantMemory() {
        MemoryScores scores = engine.score(1.0, 1.0, daysAgo(1000), null, NOW, POLICY);

        assertEquals(0.0, scores.decayScore(), EPSILON);
    }

    @Test
    void shouldRejectOutOfRangeImportance() {
        assertThrows(MemoryValidationException.class,
                () -> engine.score(1.2, 0.5, NOW, null, NOW, POLICY));
        assertThrows(MemoryValidationException.class,
                () -> engine.score(-0.1, 0.5, NOW, null, NOW, POLICY));
    }

    @Test
    void shouldRejectNaNConfidence() {
        assertThrows(MemoryValidationException.class,
                () -> engine.score(0.5, Double.NaN, NOW, null, NOW, POLICY));
    }

    @Test
    void shouldRejectMissingTimestamps() {
        assertThrows(MemoryValidationException.class,
                () -> engine.score(0.5, 0.5, null, null, NOW, POLICY));
        assertThrows(MemoryValidationException.class,
                () -> engine.score(0.5, 0.5, NOW, null, null, POLICY));
    }

    @Test
    void shouldRejectMissingPolicy() {
        assertThrows(MemoryValidationException.class,
                () -> engine.score(0.5, 0.5, NOW, null, NOW, null));
    }

    @Test
    void shouldReturnCachedScoresInCachedMode() {
        Memory memory = Memory.builder()
                .id("m1")
                .importance(0.1)
                .confidence(0.1)
                .createdAt(daysAgo(100))
                .recencyScore(0.8)
                .decayScore(0.2)
                .build();

        MemoryScores cached = engine.score(memory, NOW, POLICY, ScoreMode.CACHED);
        MemoryScores fresh = engine.score(memory, NOW, POLICY, ScoreMode.FRESH);

        assertEquals(0.8, cached.recencyScore(), EPSILON);
        assertEquals(0.2, cached.decayScore(), EPSILON);
        assertEquals(1.0 - Math.exp(-0.9), fresh.decayScore(), EPSILON);
    }

    @Test
    void shouldFallBackToFreshWhenCacheIncomplete() {
        Memory memory = Memory.builder()
                .id("m1")
                .importance(0.9)
                .confidence(0.9)
                .createdAt(NOW)
                .decayScore(0.7)
                .build();

        MemoryScores scores = engine.score(memory, NOW, POLICY, ScoreMode.CACHED);

        assertEquals(0.0, scores.decayScore(), EPSILON);
        assertEquals(1.0, scores.recencyScore(), EPSILON);
    }

    @Test
    void shouldBeIndependentOfCallOrder() {
        MemoryScores first = engine.score(0.3, 0.7, daysAgo(42), null, NOW, POLICY);
        engine.score(0.9, 0.1, daysAgo(7), null, NOW, POLICY);
        MemoryScores second = engine.score(0.3, 0.7, daysAgo(42), null, NOW, POLICY);

        assertEquals(first, second);
    }

    private static Instant daysAgo(int days) {
        return NOW.minus(Duration.ofDays(days));
    }
}
