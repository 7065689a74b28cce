package me.golemcore.brain.domain.service;

import me.golemcore.brain.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.brain.domain.model.BrainConfig;
import me.golemcore.brain.domain.model.ResultSource;
import me.golemcore.brain.domain.model.RetrievalQuery;
import me.golemcore.brain.domain.model.RetrievalResult;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.domain.model.VectorBackendUnavailableException;
import me.golemcore.brain.domain.model.VectorHit;
import me.golemcore.brain.domain.model.VectorPayload;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.EmbeddingPort;
import me.golemcore.brain.port.outbound.VectorStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetrievalRouterTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-02-11T10:00:00Z");

    @TempDir
    Path tempDir;

    private EmbeddingPort embeddingPort;
    private VectorStorePort vectorStorePort;
    private TrackingLedger ledger;
    private RetrievalRouter router;

    @BeforeEach
    void setUp() throws IOException {
        BrainProperties properties = new BrainProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        Clock clock = Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC);

        BrainConfigService configService = mock(BrainConfigService.class);
        when(configService.getConfig()).thenReturn(BrainConfig.builder().build());
        when(configService.getVectorTimeoutSeconds()).thenReturn(2);
        when(configService.getRetentionDays()).thenReturn(7);

        embeddingPort = mock(EmbeddingPort.class);
        vectorStorePort = mock(VectorStorePort.class);

        TieredMemoryStore store = new TieredMemoryStore(storage, properties, configService,
                new ConsolidationBucketClassifier(), clock);
        router = new RetrievalRouter(new SemanticVectorStrategy(embeddingPort, vectorStorePort, configService),
                new LexicalFallbackStrategy(store), store, clock);
        ledger = TrackingLedger.builder().build();

        Files.writeString(tempDir.resolve("memory/2026-02-10.md"),
                "# Daily Memory - 2026-02-10\n\n**USER**: We use conda for the data science stack\n");
        Files.writeString(tempDir.resolve("distilled/Week_2026-02-02.md"),
                "## Preferences\n- conda for data science\n");
    }

    @Test
    void shouldFallBackToFilesWhenBackendIsDown() {
        when(embeddingPort.embed(anyString())).thenReturn(CompletableFuture.completedFuture(new float[] { 0.1f }));
        when(vectorStorePort.querySimilar(anyString(), any(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new VectorBackendUnavailableException("refused")));

        RetrievalResult result = router.query(ledger, RetrievalQuery.builder().text("conda").build());

        assertEquals(ResultSource.FILES, result.getSource());
        assertEquals(1, result.getDaily().size());
        assertEquals(1, result.getWeekly().size());
        assertEquals(1, result.getVectors().size());
        VectorHit hit = result.getVectors().get(0);
        assertEquals(VectorHit.FILE_COLLECTION, hit.getCollection());
        assertEquals("**USER**: We use conda for the data science stack", hit.getContent());
        assertEquals(VectorHit.LEXICAL_SCORE, hit.getScore());
    }

    @Test
    void shouldFallBackWhenEmbeddingFails() {
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new VectorBackendUnavailableException("no model")));

        RetrievalResult result = router.query(ledger, RetrievalQuery.builder().text("conda").build());

        assertEquals(ResultSource.FILES, result.getSource());
        verify(vectorStorePort, never()).querySimilar(anyString(), any(), anyInt());
    }

    @Test
    void shouldReturnSemanticHitsWhenBackendIsUp() {
        when(embeddingPort.embed(anyString())).thenReturn(CompletableFuture.completedFuture(new float[] { 0.1f }));
        when(vectorStorePort.querySimilar(anyString(), any(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        when(vectorStorePort.querySimilar(eq("mem_user"), any(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of(new VectorStorePort.ScoredPayload(0.9,
                        VectorPayload.builder().content("Prefers conda").sourceFile("memory/2026-02-10.md")
                                .build()))));

        RetrievalResult result = router.query(ledger, RetrievalQuery.builder().text("conda").build());

        assertEquals(ResultSource.VECTORS, result.getSource());
        assertEquals(1, result.getVectors().size());
        assertEquals("mem_user", result.getVectors().get(0).getCollection());
        assertEquals(0.9, result.getVectors().get(0).getScore());
        assertEquals(3, result.totalHits());
    }

    @Test
    void shouldSkipSemanticTierWhenLexicalIsForced() {
        RetrievalResult result = router.query(ledger, RetrievalQuery.builder()
                .text("conda")
                .includeDaily(false)
                .includeWeekly(false)
                .forceLexical(true)
                .build());

        assertEquals(ResultSource.FILES, result.getSource());
        assertTrue(result.getDaily().isEmpty());
        assertTrue(result.getWeekly().isEmpty());
        assertEquals(1, result.getVectors().size());
        verify(embeddingPort, never()).embed(anyString());
    }

    @Test
    void shouldRecordBoundedAccessLog() {
        for (int i = 0; i < RetrievalRouter.MAX_ACCESS_LOGS + 5; i++) {
            router.query(ledger, RetrievalQuery.builder().text("query " + i).forceLexical(true).build());
        }

        List<TrackingLedger.AccessLogEntry> logs = ledger.getAccessLogs();
        assertEquals(RetrievalRouter.MAX_ACCESS_LOGS, logs.size());
        assertEquals("query 5", logs.get(0).getQuery());
        TrackingLedger.AccessLogEntry last = logs.get(logs.size() - 1);
        assertEquals("query 504", last.getQuery());
        assertEquals(ResultSource.FILES, last.getSource());
        assertEquals(FIXED_INSTANT, last.getTimestamp());
    }
}
