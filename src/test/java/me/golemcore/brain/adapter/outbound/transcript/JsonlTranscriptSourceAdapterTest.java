package me.golemcore.brain.adapter.outbound.transcript;

import me.golemcore.brain.domain.model.ConversationTurn;
import me.golemcore.brain.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonlTranscriptSourceAdapterTest {

    @TempDir
    Path tempDir;

    private JsonlTranscriptSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-11T10:00:00Z"), ZoneOffset.ofHours(2));
        adapter = new JsonlTranscriptSourceAdapter(AutoConfiguration.objectMapper(), clock);
    }

    @Test
    void shouldReadTurnsInFileOrder() throws IOException {
        Path transcript = tempDir.resolve("session.jsonl");
        Files.writeString(transcript, String.join("\n",
                "{\"role\": \"user\", \"text\": \"First question\", \"timestamp\": \"2026-02-10T23:30:00-05:00\"}",
                "",
                "{\"role\": \"assistant\", \"text\": \"First answer\", \"timestamp\": \"2026-02-10T09:00:00\"}",
                "{\"role\": \"user\", \"text\": \"Epoch turn\", \"timestamp\": 1770800400}"));

        List<ConversationTurn> turns = adapter.read(transcript);

        assertEquals(3, turns.size());
        assertEquals("user", turns.get(0).getRole());
        assertEquals(OffsetDateTime.parse("2026-02-10T23:30:00-05:00"), turns.get(0).getTimestamp());
        assertEquals(LocalDate.of(2026, 2, 10), turns.get(0).getTimestamp().toLocalDate());
        assertEquals(ZoneOffset.ofHours(2), turns.get(1).getTimestamp().getOffset());
        assertEquals(Instant.ofEpochSecond(1770800400L), turns.get(2).getTimestamp().toInstant());
    }

    @Test
    void shouldSkipMalformedRecords() throws IOException {
        Path transcript = tempDir.resolve("session.jsonl");
        Files.writeString(transcript, String.join("\n",
                "not json at all",
                "[1, 2, 3]",
                "{\"role\": \"user\"}",
                "{\"role\": \"user\", \"text\": \"no time\"}",
                "{\"role\": \"user\", \"text\": \"bad time\", \"timestamp\": \"yesterday\"}",
                "{\"role\": \"user\", \"text\": \"Kept\", \"timestamp\": \"2026-02-10T09:00:00Z\"}"));

        List<ConversationTurn> turns = adapter.read(transcript);

        assertEquals(1, turns.size());
        assertEquals("Kept", turns.get(0).getText());
    }

    @Test
    void shouldFailForMissingFile() {
        Path missing = tempDir.resolve("missing.jsonl");

        assertThrows(UncheckedIOException.class, () -> adapter.read(missing));
    }

    @Test
    void shouldListJsonlFilesOfDirectorySorted() throws IOException {
        Files.writeString(tempDir.resolve("b.jsonl"), "");
        Files.writeString(tempDir.resolve("a.jsonl"), "");
        Files.writeString(tempDir.resolve("notes.txt"), "");

        List<Path> transcripts = adapter.listTranscripts(tempDir);

        assertEquals(List.of(tempDir.resolve("a.jsonl"), tempDir.resolve("b.jsonl")), transcripts);
    }

    @Test
    void shouldResolveFileToItself() {
        Path file = tempDir.resolve("single.jsonl");

        assertEquals(List.of(file), adapter.listTranscripts(file));
    }
}
