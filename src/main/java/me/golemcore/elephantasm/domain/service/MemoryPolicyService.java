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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.elephantasm.domain.exception.MemoryValidationException;
import me.golemcore.elephantasm.domain.model.LifecyclePolicy;
import me.golemcore.elephantasm.domain.model.RecallQuery;
import me.golemcore.elephantasm.domain.model.RecallWeights;
import me.golemcore.elephantasm.domain.model.ScoreMode;
import me.golemcore.elephantasm.domain.model.ScoringPolicy;
import me.golemcore.elephantasm.infrastructure.config.ElephantasmProperties;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;

/**
 * Builds the scoring, recall and lifecycle policy objects from configuration.
 * Invalid configuration fails at startup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryPolicyService {

    private final ElephantasmProperties properties;

    @PostConstruct
    public void validate() {
        ScoringPolicy scoring = getScoringPolicy();
        RecallWeights weights = getRecallWeights();
        LifecyclePolicy lifecycle = getLifecyclePolicy();
        getBatchSize();
        getDefaultRecallQuery();
        log.info("[Policy] scoring maxAgeDays={} baseDecayRate={}", scoring.maxAgeDays(), scoring.baseDecayRate());
        log.info("[Policy] recall weights={} (sum={})", weights, weights.sum());
        log.info("[Policy] lifecycle decaying={} archived={}", lifecycle.decayingThreshold(),
                lifecycle.archivedThreshold());
    }

    public ScoringPolicy getScoringPolicy() {
        ElephantasmProperties.ScoringProperties scoring = properties.getScoring();
        return new ScoringPolicy(scoring.getMaxAgeDays(), scoring.getBaseDecayRate());
    }

    public RecallWeights getRecallWeights() {
        ElephantasmProperties.WeightsProperties weights = properties.getRecall().getWeights();
        return new RecallWeights(
                weights.getSemantic(),
                weights.getImportance(),
                weights.getConfidence(),
                weights.getRecency(),
                weights.getDecayPenalty());
    }

    public LifecyclePolicy getLifecyclePolicy() {
        ElephantasmProperties.LifecycleProperties lifecycle = properties.getLifecycle();
        return new LifecyclePolicy(lifecycle.getDecayingThreshold(), lifecycle.getArchivedThreshold());
    }

    public int getBatchSize() {
        int batchSize = properties.getLifecycle().getBatchSize();
        if (batchSize <= 0) {
            throw new MemoryValidationException("Sweep batch size must be positive, got " + batchSize);
        }
        return batchSize;
    }

    /**
     * Recall query pre-filled with the configured defaults. Callers override per
     * use case via {@code toBuilder()}.
     */
    public RecallQuery getDefaultRecallQuery() {
        ElephantasmProperties.RecallProperties recall = properties.getRecall();
        if (recall.getTopK() < 0) {
            throw new MemoryValidationException("Recall topK must be non-negative, got " + recall.getTopK());
        }
        return RecallQuery.builder()
                .weights(getRecallWeights())
                .scoringPolicy(getScoringPolicy())
                .topK(recall.getTopK())
                .perCategoryCap(recall.getPerCategoryCap() != null
                        ? new LinkedHashMap<>(recall.getPerCategoryCap())
                        : new LinkedHashMap<>())
                .includeArchived(recall.isIncludeArchived())
                .scoreMode(recall.isUseCachedScores() ? ScoreMode.CACHED : ScoreMode.FRESH)
                .build();
    }
}
