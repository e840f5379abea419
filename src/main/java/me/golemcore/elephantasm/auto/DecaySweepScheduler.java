package me.golemcore.elephantasm.auto;

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

import me.golemcore.elephantasm.domain.model.MergeReport;
import me.golemcore.elephantasm.domain.model.SweepReport;
import me.golemcore.elephantasm.domain.service.SweepCoordinator;
import me.golemcore.elephantasm.infrastructure.config.ElephantasmProperties;
import me.golemcore.elephantasm.port.outbound.MemoryStorePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background trigger for memory curation ("Dreamer").
 *
 * <p>
 * Each tick reads {@code now} from the injected {@link Clock} once and sweeps
 * every spirit known to the store with that same instant:
 * <ul>
 * <li>decay sweep via {@link SweepCoordinator#trySweep}</li>
 * <li>optional near-duplicate merge, when enabled in configuration</li>
 * </ul>
 *
 * <p>
 * Ticks never overlap: if a tick is still running the next one is skipped. A
 * failing spirit is logged and does not stop the remaining spirits.
 *
 * @since 1.0
 * @see SweepCoordinator
 */
@Component
@Slf4j
public class DecaySweepScheduler {

    private static final Duration DEFAULT_INTERVAL = Duration.ofHours(6);

    private final SweepCoordinator sweepCoordinator;
    private final MemoryStorePort memoryStorePort;
    private final ElephantasmProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public DecaySweepScheduler(SweepCoordinator sweepCoordinator, MemoryStorePort memoryStorePort,
            ElephantasmProperties properties, Clock clock) {
        this.sweepCoordinator = sweepCoordinator;
        this.memoryStorePort = memoryStorePort;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        ElephantasmProperties.SweepProperties sweep = properties.getSweep();
        if (!sweep.isEnabled()) {
            log.info("[DecaySweep] Background sweep disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dreamer-sweep");
            t.setDaemon(true);
            return t;
        });

        long initialDelayMillis = toMillis(sweep.getInitialDelay(), 0L);
        long intervalMillis = toMillis(sweep.getInterval(), DEFAULT_INTERVAL.toMillis());
        if (intervalMillis == 0) {
            intervalMillis = DEFAULT_INTERVAL.toMillis();
        }
        tickTask = scheduler.scheduleWithFixedDelay(
                this::tick,
                initialDelayMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS);

        log.info("[DecaySweep] Started with interval: {}, initial delay: {}",
                Duration.ofMillis(intervalMillis), Duration.ofMillis(initialDelayMillis));
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[DecaySweep] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[DecaySweep] Tick skipped: previous sweep still in progress");
            return;
        }
        try {
            Instant now = clock.instant();
            List<String> spiritIds = memoryStorePort.listSpiritIds();
            if (spiritIds.isEmpty()) {
                return;
            }
            log.info("[DecaySweep] Tick: {} spirits at {}", spiritIds.size(), now);
            for (String spiritId : spiritIds) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("[DecaySweep] Interrupted, remaining spirits deferred to the next tick");
                    return;
                }
                curate(spiritId, now);
            }
        } catch (RuntimeException e) {
            log.error("[DecaySweep] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    private void curate(String spiritId, Instant now) {
        try {
            Optional<SweepReport> report = sweepCoordinator.trySweep(spiritId, now);
            if (report.isPresent() && !report.get().isCompleted()) {
                log.warn("[DecaySweep] Sweep of spirit {} stopped at {}", spiritId,
                        report.get().getLastProcessedId());
            }
            if (properties.getSweep().isMergeNearDuplicates()) {
                Optional<MergeReport> merge = sweepCoordinator.tryMerge(spiritId, now);
                merge.ifPresent(result -> log.debug("[DecaySweep] Spirit {} merged {} clusters",
                        spiritId, result.getMerged()));
            }
        } catch (RuntimeException e) {
            log.error("[DecaySweep] Curation of spirit {} failed: {}", spiritId, e.getMessage(), e);
        }
    }

    private static long toMillis(Duration duration, long fallback) {
        if (duration == null || duration.isNegative()) {
            return fallback;
        }
        return duration.toMillis();
    }
}
