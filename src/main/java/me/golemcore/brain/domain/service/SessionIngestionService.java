package me.golemcore.brain.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.ConversationTurn;
import me.golemcore.brain.domain.model.IngestionSummary;
import me.golemcore.brain.domain.model.MemoryEntry;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.port.outbound.TranscriptSourcePort;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transcript ingestion: filter turns for significance and append the kept ones
 * to the daily file of their own date. A date whose batch fails to write is
 * counted and skipped; the other dates are still written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionIngestionService {

    private final SignificanceFilter significanceFilter;
    private final TieredMemoryStore tieredMemoryStore;
    private final TranscriptSourcePort transcriptSourcePort;
    private final Clock clock;

    /**
     * Ingest every transcript at a location.
     *
     * @param since
     *            only turns newer than {@code now - since} are considered, or
     *            null for all turns
     */
    public IngestionSummary ingest(TrackingLedger ledger, Path location, Duration since) {
        List<ConversationTurn> turns = new ArrayList<>();
        int unreadable = 0;
        for (Path transcript : transcriptSourcePort.listTranscripts(location)) {
            try {
                turns.addAll(transcriptSourcePort.read(transcript));
            } catch (UncheckedIOException e) {
                unreadable++;
                log.warn("[Ingest] Skipping unreadable transcript {}: {}", transcript, e.getMessage());
            }
        }
        if (since != null) {
            OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(since);
            turns.removeIf(turn -> turn.getTimestamp() == null || turn.getTimestamp().isBefore(cutoff));
        }
        if (unreadable > 0) {
            log.warn("[Ingest] {} transcripts could not be read", unreadable);
        }
        return ingest(ledger, turns).toBuilder().unreadableTranscripts(unreadable).build();
    }

    public IngestionSummary ingest(TrackingLedger ledger, List<ConversationTurn> turns) {
        List<MemoryEntry> entries = significanceFilter.filter(turns);

        Map<LocalDate, List<MemoryEntry>> byDate = new LinkedHashMap<>();
        for (MemoryEntry entry : entries) {
            byDate.computeIfAbsent(entry.getTimestamp().toLocalDate(), date -> new ArrayList<>()).add(entry);
        }

        int written = 0;
        int failedDates = 0;
        for (Map.Entry<LocalDate, List<MemoryEntry>> batch : byDate.entrySet()) {
            try {
                written += tieredMemoryStore.appendAll(ledger, batch.getValue());
            } catch (RuntimeException e) {
                failedDates++;
                log.warn("[Ingest] Failed to write entries for {}: {}", batch.getKey(), e.getMessage());
            }
        }

        IngestionSummary summary = IngestionSummary.builder()
                .turnsSeen(turns.size())
                .kept(entries.size())
                .discarded(turns.size() - entries.size())
                .entriesWritten(written)
                .failedDates(failedDates)
                .build();
        log.info("[Ingest] {} turns, {} kept, {} written across {} dates", summary.getTurnsSeen(),
                summary.getKept(), summary.getEntriesWritten(), byDate.size());
        return summary;
    }
}
