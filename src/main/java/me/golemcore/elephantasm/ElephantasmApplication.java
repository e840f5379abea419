package me.golemcore.elephantasm;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Elephantasm Recall.
 *
 * <p>
 * Elephantasm Recall is the long-term memory engine of an agent: it scores
 * stored memories by importance, confidence and age, ranks them for recall, and
 * curates them in the background.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Scoring</b> - recency and importance-resisted decay computed at an
 * explicit reference time</li>
 * <li><b>Recall</b> - deterministic weighted ranking with top-K and
 * per-category caps</li>
 * <li><b>Lifecycle</b> - resumable ACTIVE, DECAYING, ARCHIVED sweeps with
 * optimistic concurrency</li>
 * <li><b>Curation</b> - restore and near-duplicate merge with provenance</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Trigger Layer      → DecaySweepScheduler
 * Domain Layer       → ScoreEngine, RecallRanker, LifecycleManager
 * Infrastructure     → Local memory store, lexical relevance, fingerprint clustering
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code elephantasm.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ElephantasmApplication {

    public static void main(String[] args) {
        SpringApplication.run(ElephantasmApplication.class, args);
    }

}
