package me.golemcore.brain.domain.service;

import me.golemcore.brain.domain.model.ConflictReport;
import me.golemcore.brain.domain.model.MemoryConflict;
import me.golemcore.brain.domain.model.ResultSource;
import me.golemcore.brain.domain.model.RetrievalQuery;
import me.golemcore.brain.domain.model.RetrievalResult;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.domain.model.VectorHit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConflictDetectorTest {

    private static final String CONDA = "User prefers conda for Python environments";
    private static final String VENV = "User uses venv for Python environments";

    private RetrievalRouter retrievalRouter;
    private ConflictDetector detector;

    @BeforeEach
    void setUp() {
        retrievalRouter = mock(RetrievalRouter.class);
        detector = new ConflictDetector(retrievalRouter, new ContradictionIndicatorClassifier());
    }

    @Test
    void shouldFlagPreferencePairAsAskUserConflict() {
        List<MemoryConflict> conflicts = detector.findConflicts(List.of(
                hit(CONDA, "mem_user", 0.91),
                hit(VENV, "mem_projects", 0.87)));

        assertEquals(1, conflicts.size());
        MemoryConflict conflict = conflicts.get(0);
        assertEquals(CONDA, conflict.getMemory1());
        assertEquals(VENV, conflict.getMemory2());
        assertEquals("mem_user", conflict.getCollection1());
        assertEquals("mem_projects", conflict.getCollection2());
        assertEquals(0.91, conflict.getScore1());
        assertEquals("contradiction", conflict.getConflictType());
        assertEquals("ASK_USER", conflict.getResolution());
    }

    @Test
    void shouldIgnoreIdenticalTexts() {
        List<MemoryConflict> conflicts = detector.findConflicts(List.of(
                hit(CONDA, "mem_user", 0.9),
                hit(CONDA.toUpperCase(), "mem_sessions", 0.8)));

        assertTrue(conflicts.isEmpty());
    }

    @Test
    void shouldNeedAtLeastTwoMemories() {
        assertTrue(detector.findConflicts(List.of()).isEmpty());
        assertTrue(detector.findConflicts(List.of(hit(CONDA, "mem_user", 0.9))).isEmpty());
    }

    @Test
    void shouldIgnorePairsWithoutSharedIndicator() {
        List<MemoryConflict> conflicts = detector.findConflicts(List.of(
                hit("I prefer tabs over spaces", "mem_user", 0.9),
                hit("Actually the meeting moved to Tuesday", "mem_business", 0.8)));

        assertTrue(conflicts.isEmpty());
    }

    @Test
    void shouldQuoteShortestConflictInQuestion() {
        String longText = "We should use Kubernetes for every deployment " + "x".repeat(120);
        List<MemoryConflict> conflicts = detector.findConflicts(List.of(
                hit(longText, "mem_projects", 0.95),
                hit(CONDA, "mem_user", 0.9),
                hit(VENV, "mem_user", 0.85)));

        Optional<String> question = detector.clarifyingQuestion(conflicts);

        assertEquals(3, conflicts.size());
        assertTrue(question.isPresent());
        assertTrue(question.get().contains("**Memory A**: \"" + CONDA + "\""));
        assertTrue(question.get().contains("**Memory B**: \"" + VENV + "\""));
    }

    @Test
    void shouldTruncateQuotedMemories() {
        String longText = "I prefer " + "y".repeat(150);
        List<MemoryConflict> conflicts = detector.findConflicts(List.of(
                hit(longText, "mem_user", 0.9),
                hit("I prefer short answers", "mem_user", 0.8)));

        String question = detector.clarifyingQuestion(conflicts).orElseThrow();

        assertTrue(question.contains("\"" + longText.substring(0, 100) + "...\""));
    }

    @Test
    void shouldRunRetrievalWithoutKeywordTiers() {
        TrackingLedger ledger = TrackingLedger.builder().build();
        when(retrievalRouter.query(any(), any())).thenReturn(RetrievalResult.builder()
                .vectors(List.of(hit(CONDA, "mem_user", 0.9), hit(VENV, "mem_user", 0.8)))
                .source(ResultSource.VECTORS)
                .build());

        ConflictReport report = detector.detect(ledger, "python environment", 10);

        ArgumentCaptor<RetrievalQuery> captor = ArgumentCaptor.forClass(RetrievalQuery.class);
        verify(retrievalRouter).query(any(), captor.capture());
        assertFalse(captor.getValue().isIncludeDaily());
        assertFalse(captor.getValue().isIncludeWeekly());
        assertEquals(10, captor.getValue().getLimit());
        assertTrue(report.hasConflicts());
        assertEquals(ResultSource.VECTORS, report.getSource());
        assertTrue(report.getClarifyingQuestion().startsWith("Memory Conflict Detected"));
    }

    @Test
    void shouldReturnEmptyReportWithoutConflicts() {
        when(retrievalRouter.query(any(), any())).thenReturn(RetrievalResult.builder()
                .source(ResultSource.FILES)
                .build());

        ConflictReport report = detector.detect(TrackingLedger.builder().build(), "anything", 5);

        assertFalse(report.hasConflicts());
        assertNull(report.getClarifyingQuestion());
    }

    private static VectorHit hit(String content, String collection, double score) {
        return VectorHit.builder()
                .content(content)
                .collection(collection)
                .score(score)
                .build();
    }
}
