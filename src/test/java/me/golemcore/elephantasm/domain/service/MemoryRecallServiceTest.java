package me.golemcore.elephantasm.domain.service;

import me.golemcore.elephantasm.domain.exception.MemoryValidationException;
import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.domain.model.MemoryState;
import me.golemcore.elephantasm.domain.model.RankedMemory;
import me.golemcore.elephantasm.domain.model.RecallQuery;
import me.golemcore.elephantasm.port.outbound.MemoryStorePort;
import me.golemcore.elephantasm.port.outbound.SemanticRelevancePort;
import me.golemcore.elephantasm.testsupport.InMemoryMemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryRecallServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String SPIRIT = "spirit-1";

    private InMemoryMemoryStore store;
    private SemanticRelevancePort relevancePort;
    private MemoryPolicyService policyService;
    private MemoryRecallService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryMemoryStore();
        relevancePort = mock(SemanticRelevancePort.class);
        policyService = mock(MemoryPolicyService.class);
        when(policyService.getDefaultRecallQuery()).thenReturn(RecallQuery.builder().topK(5).build());
        when(policyService.getBatchSize()).thenReturn(2);
        when(relevancePort.relevance(anyString(), any(Memory.class))).thenReturn(0.5);
        service = new MemoryRecallService(store, relevancePort, new RecallRanker(new ScoreEngine()), policyService);
    }

    @Test
    void shouldRankSpiritMemoriesByRelevance() {
        store.put(memory("a", MemoryState.ACTIVE));
        store.put(memory("b", MemoryState.ACTIVE));
        store.put(memory("c", MemoryState.DECAYING));
        when(relevancePort.relevance(eq("coffee"), argThat(m -> m != null && "c".equals(m.getId()))))
                .thenReturn(1.0);

        List<RankedMemory> result = service.recall(SPIRIT, "coffee", NOW);

        assertEquals(List.of("c", "a", "b"), ids(result));
        assertEquals(1.0, result.get(0).getSemanticRelevance(), 1e-9);
    }

    @Test
    void shouldOnlyFetchArchivedMemoriesWhenRequested() {
        store.put(memory("a", MemoryState.ACTIVE));
        store.put(memory("z", MemoryState.ARCHIVED));

        List<RankedMemory> defaults = service.recall(SPIRIT, "coffee", NOW);
        List<RankedMemory> withArchived = service.recall(SPIRIT,
                RecallQuery.builder().queryText("coffee").includeArchived(true).build(), NOW);

        assertEquals(List.of("a"), ids(defaults));
        assertEquals(List.of("a", "z"), ids(withArchived));
    }

    @Test
    void shouldSkipCandidateWhenRelevanceLookupFails() {
        store.put(memory("a", MemoryState.ACTIVE));
        store.put(memory("b", MemoryState.ACTIVE));
        when(relevancePort.relevance(anyString(), argThat(m -> m != null && "a".equals(m.getId()))))
                .thenThrow(new IllegalStateException("embedding service down"));

        List<RankedMemory> result = service.recall(SPIRIT, "coffee", NOW);

        assertEquals(List.of("b"), ids(result));
    }

    @Test
    void shouldLoadAllPagesOfCandidates() {
        for (int i = 1; i <= 5; i++) {
            store.put(memory("m" + i, MemoryState.ACTIVE));
        }

        List<RankedMemory> result = service.recall(SPIRIT, "coffee", NOW);

        assertEquals(5, result.size());
        assertEquals(3, store.getListCalls().size());
    }

    @Test
    void shouldStopPagingWhenStoreRepeatsPage() {
        MemoryStorePort repeatingStore = mock(MemoryStorePort.class);
        when(repeatingStore.listMemories(eq(SPIRIT), any(), any(), anyInt()))
                .thenReturn(List.of(memory("a", MemoryState.ACTIVE), memory("b", MemoryState.ACTIVE)));
        service = new MemoryRecallService(repeatingStore, relevancePort, new RecallRanker(new ScoreEngine()),
                policyService);

        service.recall(SPIRIT, "coffee", NOW);

        verify(repeatingStore, times(2)).listMemories(eq(SPIRIT), any(), any(), anyInt());
    }

    @Test
    void shouldReturnEmptyWithoutLookupsForTopKZero() {
        store.put(memory("a", MemoryState.ACTIVE));

        List<RankedMemory> result = service.recall(SPIRIT, RecallQuery.builder().topK(0).build(), NOW);

        assertTrue(result.isEmpty());
        verify(relevancePort, never()).relevance(any(), any());
    }

    @Test
    void shouldRejectMissingSpirit() {
        assertThrows(MemoryValidationException.class, () -> service.recall(" ", "coffee", NOW));
    }

    private static Memory memory(String id, MemoryState state) {
        return Memory.builder()
                .id(id)
                .spiritId(SPIRIT)
                .summary("memory " + id)
                .importance(0.5)
                .confidence(0.5)
                .createdAt(NOW)
                .state(state)
                .build();
    }

    private static List<String> ids(List<RankedMemory> ranked) {
        return ranked.stream().map(item -> item.getMemory().getId()).toList();
    }
}
