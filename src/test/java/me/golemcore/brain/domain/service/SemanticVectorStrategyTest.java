package me.golemcore.brain.domain.service;

import me.golemcore.brain.domain.model.BrainConfig;
import me.golemcore.brain.domain.model.VectorBackendUnavailableException;
import me.golemcore.brain.domain.model.VectorHit;
import me.golemcore.brain.domain.model.VectorPayload;
import me.golemcore.brain.port.outbound.EmbeddingPort;
import me.golemcore.brain.port.outbound.VectorStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SemanticVectorStrategyTest {

    private EmbeddingPort embeddingPort;
    private VectorStorePort vectorStorePort;
    private SemanticVectorStrategy strategy;

    @BeforeEach
    void setUp() {
        embeddingPort = mock(EmbeddingPort.class);
        vectorStorePort = mock(VectorStorePort.class);
        BrainConfigService configService = mock(BrainConfigService.class);
        when(configService.getConfig()).thenReturn(BrainConfig.builder().build());
        when(configService.getVectorTimeoutSeconds()).thenReturn(2);
        when(embeddingPort.embed(anyString())).thenReturn(CompletableFuture.completedFuture(new float[] { 1f, 0f }));
        when(vectorStorePort.querySimilar(anyString(), any(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        strategy = new SemanticVectorStrategy(embeddingPort, vectorStorePort, configService);
    }

    @Test
    void shouldMergeCollectionsByDescendingScoreAndApplyLimit() {
        stub("mem_user", scored(0.7, "user memory"), scored(0.4, "weak user memory"));
        stub("mem_projects", scored(0.95, "project memory"));
        stub("mem_business", scored(0.8, "business memory"));

        List<VectorHit> hits = strategy.search("memory", 3);

        assertEquals(3, hits.size());
        assertEquals("project memory", hits.get(0).getContent());
        assertEquals("mem_projects", hits.get(0).getCollection());
        assertEquals("business memory", hits.get(1).getContent());
        assertEquals("user memory", hits.get(2).getContent());
    }

    @Test
    void shouldKeepOnlyHitsScoringAboveLexicalFallback() {
        stub("mem_user", scored(0.12, "weak but related"), scored(0.0, "orthogonal"),
                scored(-0.3, "opposite"));

        List<VectorHit> hits = strategy.search("memory", 5);

        assertEquals(1, hits.size());
        assertEquals("weak but related", hits.get(0).getContent());
        assertTrue(hits.get(0).getScore() > VectorHit.LEXICAL_SCORE);
    }

    @Test
    void shouldIsolateFailingCollections() {
        when(vectorStorePort.querySimilar(eq("mem_agents"), any(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new VectorBackendUnavailableException("boom")));
        when(vectorStorePort.querySimilar(eq("mem_business"), any(), anyInt()))
                .thenThrow(new IllegalStateException("client closed"));
        stub("mem_user", scored(0.6, "still here"));

        List<VectorHit> hits = strategy.search("memory", 5);

        assertEquals(1, hits.size());
        assertEquals("still here", hits.get(0).getContent());
    }

    @Test
    void shouldFailWhenEveryCollectionFails() {
        when(vectorStorePort.querySimilar(anyString(), any(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new VectorBackendUnavailableException("down")));

        assertThrows(VectorBackendUnavailableException.class, () -> strategy.search("memory", 5));
    }

    @Test
    void shouldFailWhenEmbeddingFails() {
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("model missing")));

        VectorBackendUnavailableException error = assertThrows(VectorBackendUnavailableException.class,
                () -> strategy.search("memory", 5));

        assertEquals("Embedding failed: model missing", error.getMessage());
    }

    @Test
    void shouldTruncateLongContent() {
        stub("mem_user", scored(0.6, "z".repeat(450)));

        List<VectorHit> hits = strategy.search("memory", 5);

        assertEquals(200, hits.get(0).getContent().length());
    }

    private void stub(String collection, VectorStorePort.ScoredPayload... payloads) {
        when(vectorStorePort.querySimilar(eq(collection), any(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of(payloads)));
    }

    private static VectorStorePort.ScoredPayload scored(double score, String content) {
        return new VectorStorePort.ScoredPayload(score, VectorPayload.builder()
                .content(content)
                .sourceFile("memory/2026-02-10.md")
                .build());
    }
}
