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
import me.golemcore.brain.domain.model.KeywordHit;
import me.golemcore.brain.domain.model.MemoryEntry;
import me.golemcore.brain.domain.model.PruneResult;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.domain.model.VectorHit;
import me.golemcore.brain.domain.model.WeeklySummary;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * File-backed daily, weekly and archive tiers.
 *
 * <p>
 * Daily files are named {@code yyyy-MM-dd.md} and only ever appended to.
 * Weekly summaries are {@code Week_<week start>.md} and are rewritten whole.
 * Every age decision is taken from the date in the filename, never from file
 * modification times.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TieredMemoryStore {

    public static final String WEEKLY_PREFIX = "Week_";
    public static final String EXTENSION = ".md";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter GENERATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final int DAILY_PREVIEW = 500;
    private static final int WEEKLY_PREVIEW = 300;
    private static final int LINE_PREVIEW = 200;
    private static final int LEDGER_PREVIEW = 100;
    private static final int MAX_LINE_MATCHES = 3;

    private final StoragePort storagePort;
    private final BrainProperties properties;
    private final BrainConfigService configService;
    private final ConsolidationBucketClassifier bucketClassifier;
    private final Clock clock;

    /**
     * Append one entry to the daily file of its own calendar date.
     *
     * @return number of entries written (always 1)
     */
    public int append(TrackingLedger ledger, MemoryEntry entry) {
        LocalDate date = entry.getTimestamp().toLocalDate();
        String file = date + EXTENSION;
        String directory = dailyDirectory();

        boolean exists = storagePort.exists(directory, file).join();
        StringBuilder block = new StringBuilder();
        if (!exists) {
            block.append("# Daily Memory - ").append(date).append('\n');
        }
        block.append(formatEntry(entry));
        storagePort.appendText(directory, file, block.toString()).join();

        ledger.getDailyFiles().computeIfAbsent(date.toString(), key -> new ArrayList<>())
                .add(TrackingLedger.DailyEntrySummary.builder()
                        .content(truncate(entry.getContent(), LEDGER_PREVIEW))
                        .category(entry.getCategory())
                        .importance(entry.getImportance().getCode())
                        .timestamp(entry.getTimestamp().toInstant())
                        .build());
        ledger.getMemoryMetrics().merge(date.toString(), 1, Integer::sum);
        log.debug("[TieredStore] Appended {} entry to {}", entry.getCategory(), file);
        return 1;
    }

    /**
     * Append entries in order.
     *
     * @return number of entries written
     */
    public int appendAll(TrackingLedger ledger, List<MemoryEntry> entries) {
        int written = 0;
        for (MemoryEntry entry : entries) {
            written += append(ledger, entry);
        }
        return written;
    }

    /**
     * Save a manual note stamped with the current time.
     */
    public MemoryEntry save(TrackingLedger ledger, String content, MemoryEntry.Importance importance,
            String category) {
        MemoryEntry entry = MemoryEntry.builder()
                .content(content)
                .role(MemoryEntry.Role.USER)
                .category(category != null && !category.isBlank() ? category : "general")
                .importance(importance != null ? importance : MemoryEntry.Importance.NORMAL)
                .timestamp(OffsetDateTime.now(clock))
                .build();
        append(ledger, entry);
        return entry;
    }

    /**
     * Consolidate the seven daily files starting at {@code weekStart} into a
     * weekly summary. Re-running for the same week overwrites the summary.
     *
     * @param weekStart
     *            first day of the window, or null for the Monday of the current
     *            week
     * @return the summary, or empty when the window holds no daily file
     */
    public Optional<WeeklySummary> consolidate(TrackingLedger ledger, LocalDate weekStart) {
        LocalDate start = weekStart != null ? weekStart
                : LocalDate.now(clock).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate end = start.plusDays(6);

        List<String> dailyTexts = new ArrayList<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            readDaily(day + EXTENSION).ifPresent(dailyTexts::add);
        }
        if (dailyTexts.isEmpty()) {
            log.info("[TieredStore] No daily files for week {}, nothing to consolidate", start);
            return Optional.empty();
        }

        String file = WEEKLY_PREFIX + start + EXTENSION;
        WeeklySummary.WeeklySummaryBuilder builder = WeeklySummary.builder()
                .weekStart(start)
                .weekEnd(end)
                .dailyFilesConsolidated(dailyTexts.size())
                .generatedAt(clock.instant())
                .file(weeklyDirectory() + "/" + file);
        int decisions = 0;
        int preferences = 0;
        int actions = 0;
        for (String text : dailyTexts) {
            Set<String> labels = bucketClassifier.classify(text);
            if (labels.isEmpty()) {
                log.debug("[TieredStore] No {} label for a daily file of week {}", bucketClassifier.getComponentType(),
                        start);
                continue;
            }
            String item = text.strip();
            switch (labels.iterator().next()) {
            case ConsolidationBucketClassifier.DECISION:
                if (decisions++ < WeeklySummary.MAX_ITEMS_PER_BUCKET) {
                    builder.decision(item);
                }
                break;
            case ConsolidationBucketClassifier.PREFERENCE:
                if (preferences++ < WeeklySummary.MAX_ITEMS_PER_BUCKET) {
                    builder.preference(item);
                }
                break;
            default:
                if (actions++ < WeeklySummary.MAX_ITEMS_PER_BUCKET) {
                    builder.action(item);
                }
                break;
            }
        }
        WeeklySummary summary = builder.build();

        storagePort.putTextAtomic(weeklyDirectory(), file, renderWeekly(summary), false).join();
        ledger.getWeeklySummaries().put(summary.getLabel(), TrackingLedger.WeeklySummaryRecord.builder()
                .file(summary.getFile())
                .entriesConsolidated(summary.getDailyFilesConsolidated())
                .timestamp(summary.getGeneratedAt())
                .build());
        ledger.setLastConsolidation(summary.getGeneratedAt());
        log.info("[TieredStore] Consolidated {} daily files into {}", dailyTexts.size(), file);
        return Optional.of(summary);
    }

    /**
     * Move daily files older than {@code today - retentionDays} to the archive.
     * Files whose name is not a date are kept.
     *
     * @param retentionDays
     *            retention window, or null for the configured one
     */
    public PruneResult prune(TrackingLedger ledger, Integer retentionDays) {
        int days = retentionDays != null ? retentionDays : configService.getRetentionDays();
        LocalDate cutoff = LocalDate.now(clock).minusDays(days);
        PruneResult.PruneResultBuilder result = PruneResult.builder();

        for (String name : listDailyFileNames()) {
            if (name.startsWith(WEEKLY_PREFIX)) {
                continue;
            }
            Optional<LocalDate> date = parseDate(name);
            if (date.isEmpty() || !date.get().isBefore(cutoff)) {
                result.keptFile(name);
                continue;
            }
            try {
                archive(name);
                result.prunedFile(name);
                log.debug("[TieredStore] Archived {}", name);
            } catch (RuntimeException e) {
                log.warn("[TieredStore] Failed to archive {}: {}", name, e.getMessage());
                result.keptFile(name);
            }
        }
        PruneResult pruneResult = result.build();
        log.info("[TieredStore] Pruned {} daily files older than {}, kept {}", pruneResult.getPruned().size(),
                cutoff, pruneResult.getKept().size());
        return pruneResult;
    }

    /**
     * Move a daily file to the archive. A file for a date that is already
     * archived (a late ingest of older transcripts) is appended to the
     * archived copy, never replacing it.
     */
    private void archive(String name) {
        boolean archived = Boolean.TRUE.equals(storagePort.exists(archiveDirectory(), name).join());
        if (!archived) {
            storagePort.moveObject(dailyDirectory(), name, archiveDirectory(), name).join();
            return;
        }
        String text = storagePort.getText(dailyDirectory(), name).join();
        if (text != null && !text.isEmpty()) {
            storagePort.appendText(archiveDirectory(), name, "\n" + text).join();
        }
        storagePort.deleteObject(dailyDirectory(), name).join();
        log.debug("[TieredStore] Merged {} into its existing archive copy", name);
    }

    /**
     * Daily files dated within the last {@code windowDays} days that mention
     * the term, one hit per file.
     */
    public List<KeywordHit> queryByKeyword(String term, int windowDays) {
        List<KeywordHit> hits = new ArrayList<>();
        if (term == null || term.isBlank()) {
            return hits;
        }
        LocalDate cutoff = LocalDate.now(clock).minusDays(windowDays);
        String needle = term.toLowerCase(Locale.ROOT);
        for (String name : listDailyFileNames()) {
            Optional<LocalDate> date = parseDate(name);
            if (date.isEmpty() || date.get().isBefore(cutoff)) {
                continue;
            }
            readDaily(name)
                    .filter(text -> text.toLowerCase(Locale.ROOT).contains(needle))
                    .ifPresent(text -> hits.add(KeywordHit.builder()
                            .label(date.get().toString())
                            .file(dailyDirectory() + "/" + name)
                            .snippet(truncate(text, DAILY_PREVIEW))
                            .build()));
        }
        return hits;
    }

    /**
     * Weekly summaries that mention the term.
     */
    public List<KeywordHit> queryWeekly(String term) {
        List<KeywordHit> hits = new ArrayList<>();
        if (term == null || term.isBlank()) {
            return hits;
        }
        String needle = term.toLowerCase(Locale.ROOT);
        for (String name : listWeeklyFileNames()) {
            String text = readQuietly(weeklyDirectory(), name);
            if (text != null && text.toLowerCase(Locale.ROOT).contains(needle)) {
                hits.add(KeywordHit.builder()
                        .label(stem(name))
                        .file(weeklyDirectory() + "/" + name)
                        .snippet(truncate(text, WEEKLY_PREVIEW))
                        .build());
            }
        }
        return hits;
    }

    /**
     * Case-insensitive line search over the daily files, at most three lines
     * per file, each scored {@link VectorHit#LEXICAL_SCORE}. Weekly summaries
     * are not searched.
     */
    public List<VectorHit> lexicalSearch(String term) {
        List<VectorHit> hits = new ArrayList<>();
        if (term == null || term.isBlank()) {
            return hits;
        }
        String needle = term.toLowerCase(Locale.ROOT);
        for (String name : listDailyFileNames()) {
            if (name.startsWith(WEEKLY_PREFIX)) {
                continue;
            }
            Optional<String> text = readDaily(name);
            if (text.isEmpty()) {
                continue;
            }
            text.get().lines()
                    .filter(line -> line.toLowerCase(Locale.ROOT).contains(needle))
                    .limit(MAX_LINE_MATCHES)
                    .forEach(line -> hits.add(VectorHit.builder()
                            .collection(VectorHit.FILE_COLLECTION)
                            .content(truncate(line.strip(), LINE_PREVIEW))
                            .score(VectorHit.LEXICAL_SCORE)
                            .sourceFile(dailyDirectory() + "/" + name)
                            .build()));
        }
        return hits;
    }

    public int countWeeklySummaries() {
        return listWeeklyFileNames().size();
    }

    /**
     * Top-level markdown files of the daily tier, sorted by name.
     */
    public List<String> listDailyFileNames() {
        return listMarkdown(dailyDirectory(), "");
    }

    /**
     * Weekly summary files, sorted by name.
     */
    public List<String> listWeeklyFileNames() {
        return listMarkdown(weeklyDirectory(), WEEKLY_PREFIX);
    }

    public Optional<String> readDaily(String name) {
        return Optional.ofNullable(readQuietly(dailyDirectory(), name));
    }

    public Optional<String> readWeekly(String name) {
        return Optional.ofNullable(readQuietly(weeklyDirectory(), name));
    }

    public String dailyDirectory() {
        return properties.getMemory().getDirectory();
    }

    public String weeklyDirectory() {
        return properties.getMemory().getWeeklyDirectory();
    }

    public String archiveDirectory() {
        return properties.getMemory().getArchiveDirectory();
    }

    /**
     * Date encoded in a daily file name, if any.
     */
    public static Optional<LocalDate> parseDate(String name) {
        try {
            return Optional.of(LocalDate.parse(stem(name)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static String stem(String name) {
        return name.endsWith(EXTENSION) ? name.substring(0, name.length() - EXTENSION.length()) : name;
    }

    private String formatEntry(MemoryEntry entry) {
        return "\n## " + entry.getTimestamp().format(TIME_FORMAT)
                + " - " + entry.getCategory().toUpperCase(Locale.ROOT)
                + " [" + entry.getImportance().getCode() + "]\n\n"
                + "**" + entry.getRole().getCode().toUpperCase(Locale.ROOT) + "**: " + entry.getContent()
                + "\n\n---\n";
    }

    private String renderWeekly(WeeklySummary summary) {
        StringBuilder content = new StringBuilder();
        content.append("# Weekly Memory Summary - ").append(summary.getWeekStart())
                .append(" to ").append(summary.getWeekEnd()).append("\n\n");
        content.append("*Generated: ")
                .append(LocalDateTime.ofInstant(summary.getGeneratedAt(), clock.getZone()).format(GENERATED_FORMAT))
                .append("*\n\n");
        content.append("## Consolidated from ").append(summary.getDailyFilesConsolidated())
                .append(" daily entries\n\n");
        appendSection(content, "Decisions", summary.getDecisions());
        appendSection(content, "Preferences", summary.getPreferences());
        appendSection(content, "Action Items", summary.getActions());
        content.append("---\n*This is a weekly distilled summary. See daily files for full detail.*\n");
        return content.toString();
    }

    private void appendSection(StringBuilder content, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        content.append("## ").append(title).append('\n');
        for (String item : items) {
            content.append("- ").append(item).append('\n');
        }
        content.append('\n');
    }

    private List<String> listMarkdown(String directory, String prefix) {
        try {
            return storagePort.listObjects(directory, "").join().stream()
                    .filter(name -> !name.contains("/"))
                    .filter(name -> name.startsWith(prefix) && name.endsWith(EXTENSION))
                    .sorted()
                    .toList();
        } catch (RuntimeException e) {
            log.warn("[TieredStore] Failed to list {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private String readQuietly(String directory, String name) {
        try {
            return storagePort.getText(directory, name).join();
        } catch (RuntimeException e) {
            log.warn("[TieredStore] Skipping unreadable file {}/{}: {}", directory, name, e.getMessage());
            return null;
        }
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
