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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.elephantasm.domain.exception.MemoryValidationException;
import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.domain.model.MemoryScores;
import me.golemcore.elephantasm.domain.model.MemoryState;
import me.golemcore.elephantasm.domain.model.RankedMemory;
import me.golemcore.elephantasm.domain.model.RecallCandidate;
import me.golemcore.elephantasm.domain.model.RecallQuery;
import me.golemcore.elephantasm.domain.model.RecallWeights;
import me.golemcore.elephantasm.domain.model.ScoreMode;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders recall candidates by a weighted composite of semantic relevance,
 * importance, confidence, recency and (inverted) decay.
 *
 * <p>
 * Ordering is total: composite descending, then later effective time
 * ({@code timeEnd}, else {@code createdAt}), then id ascending. Identical inputs
 * always produce identical output regardless of candidate order.
 *
 * <p>
 * Ranking only reads. Scores are recomputed per call unless the query opts into
 * {@link ScoreMode#CACHED}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecallRanker {

    public static final String CATEGORY_META_KEY = "category";

    private static final Comparator<RankedMemory> RANKING_ORDER = Comparator
            .comparingDouble(RankedMemory::getCompositeScore)
            .reversed()
            .thenComparing((RankedMemory ranked) -> ScoreEngine.resolveEffectiveTime(ranked.getMemory()),
                    Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing((RankedMemory ranked) -> ranked.getMemory().getId(),
                    Comparator.nullsLast(Comparator.naturalOrder()));

    private final ScoreEngine scoreEngine;

    public List<RankedMemory> rank(List<RecallCandidate> candidates, RecallQuery query, Instant now) {
        RecallQuery normalizedQuery = requireQuery(query);
        if (candidates == null || candidates.isEmpty() || normalizedQuery.getTopK() == 0) {
            return List.of();
        }

        List<RankedMemory> scored = new ArrayList<>();
        for (RecallCandidate candidate : candidates) {
            if (!isEligible(candidate, normalizedQuery)) {
                continue;
            }
            scored.add(score(candidate, normalizedQuery, now));
        }

        scored.sort(RANKING_ORDER);
        List<RankedMemory> selected = select(scored, normalizedQuery);
        log.debug("[RecallRanker] candidates={} eligible={} selected={} topK={}",
                candidates.size(), scored.size(), selected.size(), normalizedQuery.getTopK());
        return selected;
    }

    /**
     * Composite score of one memory given its relevance and scores.
     */
    public double composite(RecallWeights weights, double semanticRelevance, Memory memory, MemoryScores scores) {
        return weights.semantic() * semanticRelevance
                + weights.importance() * memory.getImportance()
                + weights.confidence() * memory.getConfidence()
                + weights.recency() * scores.recencyScore()
                + weights.decayPenalty() * (1.0 - scores.decayScore());
    }

    /**
     * Category used for per-category caps, or {@code null} when uncategorized.
     */
    public static String resolveCategory(Memory memory) {
        if (memory == null || memory.getMeta() == null) {
            return null;
        }
        Object category = memory.getMeta().get(CATEGORY_META_KEY);
        if (category instanceof String value && !value.isBlank()) {
            return value;
        }
        return null;
    }

    private RankedMemory score(RecallCandidate candidate, RecallQuery query, Instant now) {
        Memory memory = candidate.memory();
        double relevance = MemoryValidation.requireUnitInterval("semanticRelevance", candidate.semanticRelevance());
        MemoryScores scores = scoreEngine.score(memory, now, query.getScoringPolicy(), query.getScoreMode());
        return RankedMemory.builder()
                .memory(memory)
                .compositeScore(composite(query.getWeights(), relevance, memory, scores))
                .semanticRelevance(relevance)
                .recencyScore(scores.recencyScore())
                .decayScore(scores.decayScore())
                .build();
    }

    private boolean isEligible(RecallCandidate candidate, RecallQuery query) {
        if (candidate == null || candidate.memory() == null) {
            return false;
        }
        Memory memory = candidate.memory();
        if (memory.isDeleted()) {
            return false;
        }
        return memory.getState() != MemoryState.ARCHIVED || query.isIncludeArchived();
    }

    private List<RankedMemory> select(List<RankedMemory> ordered, RecallQuery query) {
        Map<String, Integer> caps = query.getPerCategoryCap() != null ? query.getPerCategoryCap() : Map.of();
        Map<String, Integer> counters = new HashMap<>();
        List<RankedMemory> selected = new ArrayList<>();

        for (RankedMemory candidate : ordered) {
            if (selected.size() >= query.getTopK()) {
                break;
            }
            String category = resolveCategory(candidate.getMemory());
            Integer cap = category != null ? caps.get(category) : null;
            if (cap != null) {
                int current = counters.getOrDefault(category, 0);
                if (current >= cap) {
                    continue;
                }
                counters.put(category, current + 1);
            }
            selected.add(candidate);
        }
        return selected;
    }

    private RecallQuery requireQuery(RecallQuery query) {
        if (query == null) {
            throw new MemoryValidationException("Recall query is required");
        }
        if (query.getWeights() == null) {
            throw new MemoryValidationException("Recall weights are required");
        }
        if (query.getScoringPolicy() == null) {
            throw new MemoryValidationException("Scoring policy is required");
        }
        if (query.getTopK() < 0) {
            throw new MemoryValidationException("topK must be non-negative, got " + query.getTopK());
        }
        if (query.getPerCategoryCap() != null) {
            for (Map.Entry<String, Integer> cap : query.getPerCategoryCap().entrySet()) {
                if (cap.getValue() == null || cap.getValue() < 0) {
                    throw new MemoryValidationException(
                            "Category cap for '" + cap.getKey() + "' must be non-negative, got " + cap.getValue());
                }
            }
        }
        if (query.getScoreMode() == null) {
            return query.toBuilder().scoreMode(ScoreMode.FRESH).build();
        }
        return query;
    }
}
