package me.golemcore.brain.domain.service;

import me.golemcore.brain.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.brain.domain.model.KeywordHit;
import me.golemcore.brain.domain.model.MemoryEntry;
import me.golemcore.brain.domain.model.PruneResult;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.domain.model.VectorHit;
import me.golemcore.brain.domain.model.WeeklySummary;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TieredMemoryStoreTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-02-11T10:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 2, 11);
    private static final LocalDate WEEK_START = LocalDate.of(2026, 2, 9);

    @TempDir
    Path tempDir;

    private TrackingLedger ledger;
    private TieredMemoryStore store;

    @BeforeEach
    void setUp() {
        BrainProperties properties = new BrainProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        BrainConfigService configService = mock(BrainConfigService.class);
        when(configService.getRetentionDays()).thenReturn(7);

        ledger = TrackingLedger.builder().build();
        store = new TieredMemoryStore(storage, properties, configService, new ConsolidationBucketClassifier(),
                Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC));
    }

    @Test
    void shouldAppendEntriesForSameDateToOneFileInOrder() throws IOException {
        List<MemoryEntry> entries = List.of(
                entry("first entry about the deployment pipeline", "2026-02-10T09:00:00Z"),
                entry("second entry about the deployment pipeline", "2026-02-10T11:30:00Z"),
                entry("third entry about the deployment pipeline", "2026-02-10T08:15:00Z"));

        int written = store.appendAll(ledger, entries);

        assertEquals(3, written);
        List<String> files = listFiles("memory");
        assertEquals(List.of("2026-02-10.md"), files);
        String content = Files.readString(tempDir.resolve("memory/2026-02-10.md"));
        int first = content.indexOf("first entry");
        int second = content.indexOf("second entry");
        int third = content.indexOf("third entry");
        assertTrue(first >= 0 && first < second && second < third);
        assertTrue(content.contains("## 09:00 - CONVERSATION [normal]"));
        assertEquals(3, ledger.getDailyFiles().get("2026-02-10").size());
        assertEquals(3, ledger.getMemoryMetrics().get("2026-02-10"));
    }

    @Test
    void shouldFileEntryUnderItsOwnCalendarDate() {
        store.append(ledger, entry("late night note written in New York time zone", "2026-02-10T23:30:00-05:00"));

        assertTrue(Files.exists(tempDir.resolve("memory/2026-02-10.md")));
        assertFalse(Files.exists(tempDir.resolve("memory/2026-02-11.md")));
    }

    @Test
    void shouldNotConsolidateEmptyWeek() {
        Optional<WeeklySummary> summary = store.consolidate(ledger, LocalDate.of(2026, 1, 5));

        assertTrue(summary.isEmpty());
        assertTrue(listFiles("distilled").isEmpty());
        assertTrue(ledger.getWeeklySummaries().isEmpty());
    }

    @Test
    void shouldCapBucketsAndOverwriteOnReconsolidation() throws IOException {
        for (int day = 0; day < 7; day++) {
            LocalDate date = WEEK_START.plusDays(day);
            store.append(ledger, entry("On day " + day + " we decided to keep the monolith for now",
                    date + "T12:00:00Z"));
        }

        WeeklySummary first = store.consolidate(ledger, WEEK_START).orElseThrow();
        WeeklySummary second = store.consolidate(ledger, WEEK_START).orElseThrow();

        assertEquals(WeeklySummary.MAX_ITEMS_PER_BUCKET, first.getDecisions().size());
        assertEquals(7, first.getDailyFilesConsolidated());
        assertEquals(first.getDecisions(), second.getDecisions());
        assertEquals(List.of("Week_2026-02-09.md"), listFiles("distilled"));
        assertEquals(1, ledger.getWeeklySummaries().size());
        assertTrue(ledger.getWeeklySummaries().containsKey("2026-02-09_to_2026-02-15"));
        assertEquals(FIXED_INSTANT, ledger.getLastConsolidation());

        String weekly = Files.readString(tempDir.resolve("distilled/Week_2026-02-09.md"));
        assertTrue(weekly.startsWith("# Weekly Memory Summary - 2026-02-09 to 2026-02-15"));
        assertTrue(weekly.contains("## Decisions"));
        assertFalse(weekly.contains("## Preferences"));
        assertEquals(1, countOccurrences(weekly, "## Decisions"));
    }

    @Test
    void shouldFileEachDailyTextUnderFirstMatchingBucket() {
        store.append(ledger, entry("I prefer dark mode, and we decided to adopt it everywhere", "2026-02-09T09:00:00Z"));
        store.append(ledger, entry("I really like short standups in the morning", "2026-02-10T09:00:00Z"));
        store.append(ledger, entry("Make sure the backups are verified before Friday", "2026-02-11T09:00:00Z"));

        WeeklySummary summary = store.consolidate(ledger, null).orElseThrow();

        assertEquals(WEEK_START, summary.getWeekStart());
        assertEquals(1, summary.getDecisions().size());
        assertEquals(1, summary.getPreferences().size());
        assertEquals(1, summary.getActions().size());
        assertTrue(summary.getPreferences().get(0).contains("short standups"));
    }

    @Test
    void shouldArchiveOnlyFilesOlderThanRetention() throws IOException {
        writeDaily(TODAY, "today");
        writeDaily(TODAY.minusDays(3), "three days ago");
        writeDaily(TODAY.minusDays(10), "ten days ago");
        Files.writeString(tempDir.resolve("memory/notes.md"), "not a dated file");

        PruneResult result = store.prune(ledger, 7);

        assertEquals(List.of("2026-02-01.md"), result.getPruned());
        assertEquals(3, result.getKept().size());
        assertTrue(result.getKept().contains("notes.md"));
        assertFalse(Files.exists(tempDir.resolve("memory/2026-02-01.md")));
        assertEquals("ten days ago", Files.readString(tempDir.resolve("archive/2026-02-01.md")));
        assertTrue(Files.exists(tempDir.resolve("memory/2026-02-08.md")));
    }

    @Test
    void shouldKeepEarlierArchiveWhenSameDateIsPrunedAgain() throws IOException {
        store.append(ledger, entry("FIRST BATCH of notes about the billing migration", "2026-01-20T10:00:00Z"));
        store.prune(ledger, 7);
        store.append(ledger, entry("SECOND BATCH of notes from a late transcript import", "2026-01-20T11:00:00Z"));

        PruneResult result = store.prune(ledger, 7);

        assertEquals(List.of("2026-01-20.md"), result.getPruned());
        assertFalse(Files.exists(tempDir.resolve("memory/2026-01-20.md")));
        String archived = Files.readString(tempDir.resolve("archive/2026-01-20.md"));
        assertTrue(archived.contains("FIRST BATCH"));
        assertTrue(archived.contains("SECOND BATCH"));
        assertTrue(archived.indexOf("FIRST BATCH") < archived.indexOf("SECOND BATCH"));
    }

    @Test
    void shouldUseConfiguredRetentionByDefault() throws IOException {
        writeDaily(TODAY.minusDays(8), "eight days ago");
        writeDaily(TODAY.minusDays(7), "exactly a week ago");

        PruneResult result = store.prune(ledger, null);

        assertEquals(List.of("2026-02-03.md"), result.getPruned());
        assertEquals(List.of("2026-02-04.md"), result.getKept());
    }

    @Test
    void shouldQueryDailyFilesWithinWindow() throws IOException {
        writeDaily(TODAY.minusDays(2), "Discussed Kubernetes upgrade plan");
        writeDaily(TODAY.minusDays(20), "Old Kubernetes discussion");
        writeDaily(TODAY.minusDays(1), "Nothing relevant here");

        List<KeywordHit> hits = store.queryByKeyword("kubernetes", 7);

        assertEquals(1, hits.size());
        assertEquals("2026-02-09", hits.get(0).getLabel());
        assertEquals("Discussed Kubernetes upgrade plan", hits.get(0).getSnippet());
    }

    @Test
    void shouldTruncateDailySnippet() throws IOException {
        writeDaily(TODAY, "kubernetes " + "x".repeat(800));

        KeywordHit hit = store.queryByKeyword("kubernetes", 7).get(0);

        assertEquals(500, hit.getSnippet().length());
    }

    @Test
    void shouldQueryWeeklySummaries() throws IOException {
        Files.writeString(tempDir.resolve("distilled/Week_2026-02-02.md"), "## Decisions\n- Use Postgres");
        Files.writeString(tempDir.resolve("distilled/Week_2026-01-26.md"), "## Decisions\n- Use Redis");

        List<KeywordHit> hits = store.queryWeekly("postgres");

        assertEquals(1, hits.size());
        assertEquals("Week_2026-02-02", hits.get(0).getLabel());
    }

    @Test
    void shouldLimitLexicalMatchesPerFileAndUseFixedScore() throws IOException {
        writeDaily(TODAY, "conda one\nconda two\nconda three\nconda four\nother line");
        writeDaily(TODAY.minusDays(1), "We use CONDA for data science");
        Files.writeString(tempDir.resolve("distilled/Week_2026-02-09.md"), "conda in weekly summary");

        List<VectorHit> hits = store.lexicalSearch("conda");

        assertEquals(4, hits.size());
        assertTrue(hits.stream().allMatch(hit -> hit.getScore() == VectorHit.LEXICAL_SCORE));
        assertTrue(hits.stream().allMatch(hit -> VectorHit.FILE_COLLECTION.equals(hit.getCollection())));
        assertTrue(hits.stream().noneMatch(hit -> hit.getContent().contains("weekly")));
        assertTrue(hits.stream().noneMatch(hit -> hit.getContent().contains("four")));
    }

    @Test
    void shouldSaveManualNoteWithCurrentTime() throws IOException {
        MemoryEntry entry = store.save(ledger, "Vendor contract renews in June", MemoryEntry.Importance.HIGH,
                "business");

        assertEquals(OffsetDateTime.ofInstant(FIXED_INSTANT, ZoneOffset.UTC), entry.getTimestamp());
        String content = Files.readString(tempDir.resolve("memory/2026-02-11.md"));
        assertTrue(content.contains("## 10:00 - BUSINESS [high]"));
        assertTrue(content.contains("Vendor contract renews in June"));
    }

    private void writeDaily(LocalDate date, String content) throws IOException {
        Files.writeString(tempDir.resolve("memory").resolve(date + ".md"), content);
    }

    private List<String> listFiles(String directory) {
        try (var files = Files.list(tempDir.resolve(directory))) {
            return files.map(path -> path.getFileName().toString()).sorted().toList();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }

    private static MemoryEntry entry(String content, String timestamp) {
        return MemoryEntry.builder()
                .content(content)
                .role(MemoryEntry.Role.USER)
                .category("conversation")
                .timestamp(OffsetDateTime.parse(timestamp))
                .build();
    }
}
