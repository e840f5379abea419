package me.golemcore.elephantasm.domain.service;

import me.golemcore.elephantasm.domain.exception.MemoryValidationException;
import me.golemcore.elephantasm.domain.model.MergeReport;
import me.golemcore.elephantasm.domain.model.SweepReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SweepCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private LifecycleManager lifecycleManager;
    private SweepCoordinator coordinator;

    @BeforeEach
    void setUp() {
        lifecycleManager = mock(LifecycleManager.class);
        MemoryPolicyService policyService = mock(MemoryPolicyService.class);
        when(policyService.getBatchSize()).thenReturn(50);
        coordinator = new SweepCoordinator(lifecycleManager, policyService);
    }

    @Test
    void shouldSweepWithConfiguredBatchSize() {
        SweepReport report = SweepReport.empty("spirit-1");
        when(lifecycleManager.sweep("spirit-1", NOW, 50)).thenReturn(report);

        Optional<SweepReport> result = coordinator.trySweep("spirit-1", NOW);

        assertTrue(result.isPresent());
        assertEquals(report, result.get());
        assertFalse(coordinator.isRunning("spirit-1"));
    }

    @Test
    void shouldRejectOverlappingSweepOfSameSpirit() {
        AtomicReference<Optional<SweepReport>> nested = new AtomicReference<>();
        AtomicReference<Optional<SweepReport>> other = new AtomicReference<>();
        when(lifecycleManager.sweep("spirit-1", NOW, 50)).thenAnswer(invocation -> {
            nested.set(coordinator.trySweep("spirit-1", NOW));
            other.set(coordinator.trySweep("spirit-2", NOW));
            return SweepReport.empty("spirit-1");
        });
        when(lifecycleManager.sweep("spirit-2", NOW, 50)).thenReturn(SweepReport.empty("spirit-2"));

        Optional<SweepReport> outer = coordinator.trySweep("spirit-1", NOW);

        assertTrue(outer.isPresent());
        assertTrue(nested.get().isEmpty());
        assertTrue(other.get().isPresent());
        verify(lifecycleManager, times(1)).sweep("spirit-1", NOW, 50);
    }

    @Test
    void shouldReleaseSpiritWhenSweepFails() {
        when(lifecycleManager.sweep("spirit-1", NOW, 50)).thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> coordinator.trySweep("spirit-1", NOW));

        assertFalse(coordinator.isRunning("spirit-1"));
    }

    @Test
    void shouldNotMergeWhileSpiritIsBeingSwept() {
        AtomicReference<Optional<MergeReport>> merge = new AtomicReference<>();
        when(lifecycleManager.sweep("spirit-1", NOW, 50)).thenAnswer(invocation -> {
            merge.set(coordinator.tryMerge("spirit-1", NOW));
            return SweepReport.empty("spirit-1");
        });

        coordinator.trySweep("spirit-1", NOW);

        assertTrue(merge.get().isEmpty());
        verify(lifecycleManager, never()).mergeNearDuplicates("spirit-1", NOW);
    }

    @Test
    void shouldRejectMissingSpiritIdBeforeTakingGuard() {
        assertThrows(MemoryValidationException.class, () -> coordinator.trySweep(null, NOW));
        assertThrows(MemoryValidationException.class, () -> coordinator.tryMerge(" ", NOW));

        assertFalse(coordinator.isRunning(null));
        verify(lifecycleManager, never()).sweep(null, NOW, 50);
    }
}
