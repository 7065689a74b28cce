package me.golemcore.brain.adapter.inbound.command;

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
import me.golemcore.brain.domain.model.BrainStatus;
import me.golemcore.brain.domain.model.ConflictReport;
import me.golemcore.brain.domain.model.EntityNotFoundException;
import me.golemcore.brain.domain.model.EntityRecord;
import me.golemcore.brain.domain.model.IndexingSummary;
import me.golemcore.brain.domain.model.IngestionSummary;
import me.golemcore.brain.domain.model.KeywordHit;
import me.golemcore.brain.domain.model.MaintenanceReport;
import me.golemcore.brain.domain.model.MemoryConflict;
import me.golemcore.brain.domain.model.MemoryEntry;
import me.golemcore.brain.domain.model.MemoryTrigger;
import me.golemcore.brain.domain.model.PruneResult;
import me.golemcore.brain.domain.model.QuarantineRecord;
import me.golemcore.brain.domain.model.RetrievalQuery;
import me.golemcore.brain.domain.model.RetrievalResult;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.domain.model.VectorHit;
import me.golemcore.brain.domain.model.WeeklySummary;
import me.golemcore.brain.domain.service.BrainStatusService;
import me.golemcore.brain.domain.service.ConflictDetector;
import me.golemcore.brain.domain.service.EntityQuarantineService;
import me.golemcore.brain.domain.service.MemoryIndexingService;
import me.golemcore.brain.domain.service.MemoryMaintenanceService;
import me.golemcore.brain.domain.service.MemoryTriggerDetector;
import me.golemcore.brain.domain.service.RetrievalRouter;
import me.golemcore.brain.domain.service.SessionIngestionService;
import me.golemcore.brain.domain.service.TieredMemoryStore;
import me.golemcore.brain.domain.service.TrackingLedgerService;
import me.golemcore.brain.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routes memory commands to the domain services.
 *
 * <p>
 * Each call is one invocation: the tracking ledger is loaded once, handed to
 * the service, and written back atomically when the command changed it.
 * Failures come back as {@link CommandResult#failure(String)}; only a ledger
 * that cannot be persisted is reported as fatal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandRouter implements CommandPort {

    static final String CMD_HELP = "help";
    static final String CMD_QUERY = "query";
    static final String CMD_STATUS = "status";

    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final int DEFAULT_QUERY_LIMIT = 5;
    private static final int DEFAULT_CONFLICT_LIMIT = 10;
    private static final int SNIPPET_PREVIEW = 120;

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition("save", "Save a note to today's daily memory",
                    "save <text> [--category c] [--importance normal|high|action|decision|long-term]"),
            new CommandDefinition("remember", "Save text when it contains a memory trigger phrase",
                    "remember <text>"),
            new CommandDefinition("ingest", "Ingest JSONL transcripts (file or directory)",
                    "ingest <path> [--since-hours n]"),
            new CommandDefinition("consolidate", "Consolidate a week of daily files",
                    "consolidate [yyyy-MM-dd]"),
            new CommandDefinition("prune", "Archive daily files past retention", "prune [days]"),
            new CommandDefinition("maintenance", "Consolidate the current week, prune when enabled",
                    "maintenance"),
            new CommandDefinition("discover", "Find candidate entities in text",
                    "discover <text> [--quarantine]"),
            new CommandDefinition("quarantine", "Quarantine an entity for validation",
                    "quarantine <name> [context]"),
            new CommandDefinition("quarantine-list", "List pending and validated entities", "quarantine-list"),
            new CommandDefinition("validate", "Promote a quarantined entity",
                    "validate <name> [collection] [keyword,keyword]"),
            new CommandDefinition("reject", "Drop a quarantined entity", "reject <name>"),
            new CommandDefinition(CMD_QUERY, "Query all memory tiers",
                    "query <text> [--limit n] [--no-daily] [--no-weekly] [--files-only]"),
            new CommandDefinition("conflicts", "Detect conflicting memories", "conflicts <text> [--limit n]"),
            new CommandDefinition("index", "Index tier files into the vector backend", "index"),
            new CommandDefinition(CMD_STATUS, "Show memory status", CMD_STATUS),
            new CommandDefinition(CMD_HELP, "Show available commands", CMD_HELP));

    private static final Set<String> KNOWN_COMMANDS = Set.copyOf(COMMANDS.stream()
            .map(CommandDefinition::name)
            .toList());

    private final TrackingLedgerService ledgerService;
    private final TieredMemoryStore tieredMemoryStore;
    private final MemoryTriggerDetector triggerDetector;
    private final SessionIngestionService ingestionService;
    private final MemoryMaintenanceService maintenanceService;
    private final EntityQuarantineService quarantineService;
    private final RetrievalRouter retrievalRouter;
    private final ConflictDetector conflictDetector;
    private final MemoryIndexingService indexingService;
    private final BrainStatusService statusService;

    @Override
    public CommandResult execute(String command, List<String> args) {
        log.debug("Executing command: {} {}", command, args);
        if (!hasCommand(command)) {
            return CommandResult.failure("Unknown command: " + command + ". Try 'help'.");
        }
        if (CMD_HELP.equals(command)) {
            return handleHelp();
        }

        TrackingLedger ledger;
        try {
            ledger = ledgerService.load();
        } catch (RuntimeException e) {
            log.error("[Ledger] Failed to load tracking ledger", e);
            return CommandResult.failure("Failed to load tracking ledger: " + e.getMessage());
        }

        Outcome outcome;
        try {
            Arguments arguments = Arguments.parse(args);
            outcome = switch (command) {
            case "save" -> handleSave(ledger, arguments);
            case "remember" -> handleRemember(ledger, arguments);
            case "ingest" -> handleIngest(ledger, arguments);
            case "consolidate" -> handleConsolidate(ledger, arguments);
            case "prune" -> handlePrune(ledger, arguments);
            case "maintenance" -> handleMaintenance(ledger);
            case "discover" -> handleDiscover(ledger, arguments);
            case "quarantine" -> handleQuarantine(ledger, arguments);
            case "quarantine-list" -> handleQuarantineList(ledger);
            case "validate" -> handleValidate(ledger, arguments);
            case "reject" -> handleReject(ledger, arguments);
            case CMD_QUERY -> handleQuery(ledger, arguments);
            case "conflicts" -> handleConflicts(ledger, arguments);
            case "index" -> handleIndex();
            case CMD_STATUS -> handleStatus(ledger);
            default -> Outcome.readOnly(CommandResult.failure("Unknown command: " + command));
            };
        } catch (EntityNotFoundException e) {
            return CommandResult.failure(e.getMessage());
        } catch (IllegalArgumentException | DateTimeException e) {
            return CommandResult.failure("Invalid arguments: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Command {} failed", command, e);
            return CommandResult.failure("Command " + command + " failed: " + rootMessage(e));
        }

        if (outcome.mutated() && outcome.result().success()) {
            try {
                ledgerService.save(ledger);
            } catch (IllegalStateException e) {
                log.error("[Ledger] {}", e.getMessage(), e);
                return CommandResult.failure("FATAL: " + e.getMessage() + " (" + rootMessage(e) + ")");
            }
        }
        return outcome.result();
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return COMMANDS;
    }

    private Outcome handleSave(TrackingLedger ledger, Arguments args) {
        String text = args.requireText("text");
        MemoryEntry entry = tieredMemoryStore.save(ledger, text,
                MemoryEntry.Importance.fromCode(args.option("importance").orElse(null)),
                args.option("category").orElse(null));
        return Outcome.mutated(CommandResult.success(
                "Saved to daily memory " + entry.getTimestamp().toLocalDate()
                        + " [" + entry.getImportance().getCode() + "]",
                entry));
    }

    private Outcome handleRemember(TrackingLedger ledger, Arguments args) {
        String text = args.requireText("text");
        Optional<MemoryTrigger> trigger = triggerDetector.detect(text);
        if (trigger.isEmpty()) {
            return Outcome.readOnly(CommandResult.success("No memory trigger found, nothing saved"));
        }
        MemoryTrigger found = trigger.get();
        MemoryEntry entry = tieredMemoryStore.save(ledger, found.getContent(), found.getImportance(),
                found.getCategory());
        return Outcome.mutated(CommandResult.success(
                "Remembered [" + found.getImportance().getCode() + "]: " + found.getContent(), entry));
    }

    private Outcome handleIngest(TrackingLedger ledger, Arguments args) {
        Path location = Path.of(args.requirePositional(0, "path"));
        Duration since = args.option("since-hours")
                .map(hours -> Duration.ofHours(parsePositive(hours, "since-hours")))
                .orElse(null);
        IngestionSummary summary = ingestionService.ingest(ledger, location, since);
        String output = "Ingested " + summary.getTurnsSeen() + " turns: "
                + summary.getKept() + " kept, " + summary.getDiscarded() + " discarded, "
                + summary.getEntriesWritten() + " written"
                + (summary.getFailedDates() > 0 ? ", " + summary.getFailedDates() + " dates failed" : "")
                + (summary.getUnreadableTranscripts() > 0
                        ? ", " + summary.getUnreadableTranscripts() + " transcripts unreadable"
                        : "");
        return Outcome.mutated(CommandResult.success(output, summary));
    }

    private Outcome handleConsolidate(TrackingLedger ledger, Arguments args) {
        LocalDate weekStart = args.positional(0).map(LocalDate::parse).orElse(null);
        Optional<WeeklySummary> summary = tieredMemoryStore.consolidate(ledger, weekStart);
        if (summary.isEmpty()) {
            return Outcome.readOnly(CommandResult.success("No daily files in that week, nothing consolidated"));
        }
        WeeklySummary weekly = summary.get();
        return Outcome.mutated(CommandResult.success("Consolidated " + weekly.getDailyFilesConsolidated()
                + " daily files into " + weekly.getFile() + " (" + weekly.getDecisions().size() + " decisions, "
                + weekly.getPreferences().size() + " preferences, " + weekly.getActions().size() + " actions)",
                weekly));
    }

    private Outcome handlePrune(TrackingLedger ledger, Arguments args) {
        Integer days = args.positional(0).map(value -> parsePositive(value, "days")).orElse(null);
        PruneResult result = tieredMemoryStore.prune(ledger, days);
        return Outcome.mutated(CommandResult.success("Pruned " + result.getPruned().size() + " files, kept "
                + result.getKept().size(), result));
    }

    private Outcome handleMaintenance(TrackingLedger ledger) {
        MaintenanceReport report = maintenanceService.runMaintenance(ledger);
        StringBuilder sb = new StringBuilder("Maintenance complete\n");
        sb.append("- Consolidation: ").append(report.getWeeklySummary() != null
                ? report.getWeeklySummary().getFile()
                : "nothing to consolidate").append('\n');
        sb.append("- Prune: ").append(report.getPrune() != null
                ? report.getPrune().getPruned().size() + " archived"
                : "disabled");
        return Outcome.mutated(CommandResult.success(sb.toString(), report));
    }

    private Outcome handleDiscover(TrackingLedger ledger, Arguments args) {
        String text = args.requireText("text");
        if (args.flag("quarantine")) {
            List<QuarantineRecord> records = quarantineService.discoverAndQuarantine(ledger, text);
            List<String> names = records.stream().map(QuarantineRecord::getName).toList();
            return Outcome.mutated(CommandResult.success(names.isEmpty()
                    ? "No new entities found"
                    : "Quarantined: " + String.join(", ", names), records));
        }
        List<String> candidates = new ArrayList<>(quarantineService.discover(ledger, text));
        return Outcome.readOnly(CommandResult.success(candidates.isEmpty()
                ? "No new entities found"
                : "Candidates: " + String.join(", ", candidates), candidates));
    }

    private Outcome handleQuarantine(TrackingLedger ledger, Arguments args) {
        String name = args.requirePositional(0, "name");
        String context = args.positionalFrom(1);
        QuarantineRecord record = quarantineService.quarantine(ledger, name, context);
        return Outcome.mutated(CommandResult.success("Quarantined " + record.getName() + " -> " + record.getFile(),
                record));
    }

    private Outcome handleQuarantineList(TrackingLedger ledger) {
        List<QuarantineRecord> pending = quarantineService.listPending(ledger);
        List<EntityRecord> validated = quarantineService.listValidated(ledger);
        StringBuilder sb = new StringBuilder();
        sb.append("**Pending (").append(pending.size()).append(")**\n");
        for (QuarantineRecord record : pending) {
            sb.append("- ").append(record.getName()).append(" (").append(record.getDiscoveredAt()).append(")\n");
        }
        sb.append("\n**Validated (").append(validated.size()).append(")**\n");
        for (EntityRecord entity : validated) {
            sb.append("- ").append(entity.getName()).append(" -> ").append(entity.getTargetCollection())
                    .append('\n');
        }
        return Outcome.readOnly(CommandResult.success(sb.toString(), Map.of("pending", pending,
                "validated", validated)));
    }

    private Outcome handleValidate(TrackingLedger ledger, Arguments args) {
        String name = args.requirePositional(0, "name");
        String collection = args.positional(1).orElse(null);
        List<String> keywords = args.positional(2)
                .map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(keyword -> !keyword.isEmpty())
                        .toList())
                .orElse(null);
        EntityRecord entity = quarantineService.validate(ledger, name, collection, keywords);
        return Outcome.mutated(CommandResult.success("Validated " + entity.getName() + " into "
                + entity.getTargetCollection(), entity));
    }

    private Outcome handleReject(TrackingLedger ledger, Arguments args) {
        QuarantineRecord record = quarantineService.reject(ledger, args.requirePositional(0, "name"));
        return Outcome.mutated(CommandResult.success("Rejected " + record.getName(), record));
    }

    private Outcome handleQuery(TrackingLedger ledger, Arguments args) {
        RetrievalQuery query = RetrievalQuery.builder()
                .text(args.requireText("text"))
                .limit(args.option("limit").map(value -> parsePositive(value, "limit")).orElse(DEFAULT_QUERY_LIMIT))
                .includeDaily(!args.flag("no-daily"))
                .includeWeekly(!args.flag("no-weekly"))
                .forceLexical(args.flag("files-only"))
                .build();
        RetrievalResult result = retrievalRouter.query(ledger, query);

        StringBuilder sb = new StringBuilder();
        sb.append("Source: ").append(result.getSource().getCode()).append(DOUBLE_NEWLINE);
        appendKeywordHits(sb, "Daily", result.getDaily());
        appendKeywordHits(sb, "Weekly", result.getWeekly());
        sb.append("**Memories (").append(result.getVectors().size()).append(")**\n");
        for (VectorHit hit : result.getVectors()) {
            sb.append(String.format(Locale.ROOT, "- [%s %.2f] %s%n", hit.getCollection(), hit.getScore(),
                    preview(hit.getContent())));
        }
        return Outcome.mutated(CommandResult.success(sb.toString(), result));
    }

    private Outcome handleConflicts(TrackingLedger ledger, Arguments args) {
        String text = args.requireText("text");
        int limit = args.option("limit").map(value -> parsePositive(value, "limit")).orElse(DEFAULT_CONFLICT_LIMIT);
        ConflictReport report = conflictDetector.detect(ledger, text, limit);
        if (!report.hasConflicts()) {
            return Outcome.mutated(CommandResult.success("No conflicts found (source: "
                    + report.getSource().getCode() + ")", report));
        }
        StringBuilder sb = new StringBuilder();
        sb.append(report.getConflicts().size()).append(" conflicts found").append(DOUBLE_NEWLINE);
        for (MemoryConflict conflict : report.getConflicts()) {
            sb.append("- ").append(preview(conflict.getMemory1())).append("\n  vs ")
                    .append(preview(conflict.getMemory2())).append('\n');
        }
        sb.append('\n').append(report.getClarifyingQuestion());
        return Outcome.mutated(CommandResult.success(sb.toString(), report));
    }

    private Outcome handleIndex() {
        IndexingSummary summary = indexingService.indexTierFiles();
        return Outcome.readOnly(CommandResult.success("Indexed " + summary.getFilesIndexed() + " files ("
                + summary.getChunksIndexed() + " chunks), " + summary.getFailedFiles() + " failed", summary));
    }

    private Outcome handleStatus(TrackingLedger ledger) {
        BrainStatus status = statusService.status(ledger);
        StringBuilder sb = new StringBuilder("**Memory Status**").append(DOUBLE_NEWLINE);
        sb.append("Daily files: ").append(status.getDailyFiles()).append('\n');
        sb.append("Weekly summaries: ").append(status.getWeeklySummaries()).append('\n');
        sb.append("Pending entities: ").append(status.getPendingEntities()).append('\n');
        sb.append("Validated entities: ").append(status.getValidatedEntities()).append('\n');
        sb.append("Last consolidation: ").append(status.getLastConsolidation() != null
                ? status.getLastConsolidation()
                : "never").append('\n');
        sb.append("Embedding model: ").append(status.getEmbeddingModel())
                .append(status.isEmbeddingAvailable() ? "" : " (unavailable)").append(DOUBLE_NEWLINE);
        sb.append("**Collections**\n");
        status.getCollectionPoints().forEach((collection, points) -> sb.append("- ").append(collection)
                .append(": ").append(points >= 0 ? points + " points" : "unavailable").append('\n'));
        return Outcome.readOnly(CommandResult.success(sb.toString(), status));
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("**Available commands**").append(DOUBLE_NEWLINE);
        for (CommandDefinition definition : COMMANDS) {
            sb.append(String.format(Locale.ROOT, "  %-60s %s%n", definition.usage(), definition.description()));
        }
        return CommandResult.success(sb.toString());
    }

    private void appendKeywordHits(StringBuilder sb, String title, List<KeywordHit> hits) {
        if (hits.isEmpty()) {
            return;
        }
        sb.append("**").append(title).append(" (").append(hits.size()).append(")**\n");
        for (KeywordHit hit : hits) {
            sb.append("- ").append(hit.getLabel()).append(": ").append(preview(hit.getSnippet())).append('\n');
        }
        sb.append('\n');
    }

    private static String preview(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() > SNIPPET_PREVIEW ? flat.substring(0, SNIPPET_PREVIEW) + "..." : flat;
    }

    private static int parsePositive(String value, String name) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + value, e);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return String.valueOf(current.getMessage());
    }

    private record Outcome(CommandResult result, boolean mutated) {

        static Outcome mutated(CommandResult result) {
            return new Outcome(result, true);
        }

        static Outcome readOnly(CommandResult result) {
            return new Outcome(result, false);
        }
    }
}
