package me.golemcore.elephantasm.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code elephantasm.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - local workspace and memory directory</li>
 * <li>{@link ScoringProperties} - recency horizon and decay rate</li>
 * <li>{@link RecallProperties} - composite weights and selection defaults</li>
 * <li>{@link LifecycleProperties} - state thresholds and sweep batch size</li>
 * <li>{@link SweepProperties} - background sweep scheduling</li>
 * </ul>
 *
 * <p>
 * The numeric defaults are starting points for tuning, not validated
 * constants.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "elephantasm")
@Data
public class ElephantasmProperties {

    private StorageProperties storage = new StorageProperties();
    private ScoringProperties scoring = new ScoringProperties();
    private RecallProperties recall = new RecallProperties();
    private LifecycleProperties lifecycle = new LifecycleProperties();
    private SweepProperties sweep = new SweepProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String directory = "memories";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.elephantasm/workspace";
    }

    // ==================== SCORING ====================

    @Data
    public static class ScoringProperties {
        /** Days after which recency reaches 0.0. */
        private double maxAgeDays = 365.0;

        /** Per-day decay rate before importance/confidence resistance. */
        private double baseDecayRate = 0.01;
    }

    // ==================== RECALL ====================

    @Data
    public static class RecallProperties {
        private WeightsProperties weights = new WeightsProperties();
        private int topK = 10;
        private boolean includeArchived = false;
        private boolean useCachedScores = false;
        private Map<String, Integer> perCategoryCap = new LinkedHashMap<>();
    }

    @Data
    public static class WeightsProperties {
        private double semantic = 0.40;
        private double importance = 0.25;
        private double confidence = 0.15;
        private double recency = 0.15;
        private double decayPenalty = 0.05;
    }

    // ==================== LIFECYCLE ====================

    @Data
    public static class LifecycleProperties {
        private double decayingThreshold = 0.5;
        private double archivedThreshold = 0.85;
        private int batchSize = 100;
    }

    // ==================== SWEEP SCHEDULER ====================

    @Data
    public static class SweepProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(6);
        private Duration initialDelay = Duration.ofMinutes(1);

        /**
         * Also merge near-duplicate memories after each spirit's decay sweep.
         */
        private boolean mergeNearDuplicates = false;
    }
}
