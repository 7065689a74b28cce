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
import me.golemcore.brain.domain.model.EntityNotFoundException;
import me.golemcore.brain.domain.model.EntityRecord;
import me.golemcore.brain.domain.model.QuarantineRecord;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.EmbeddingPort;
import me.golemcore.brain.port.outbound.StoragePort;
import me.golemcore.brain.port.outbound.VectorStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Entity lifecycle: {@code absent -> pending -> validated}, with
 * {@code pending -> absent} on rejection.
 *
 * <p>
 * Discovered names are only ever quarantined; promotion always needs an
 * explicit {@link #validate}. Ledger changes happen in memory in a single step
 * and are persisted by the caller. The file move and the ledger write are not
 * transactional: a crash in between can leave an orphaned record file.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityQuarantineService {

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String PENDING_TITLE = "(IN QUARANTINE)";
    private static final String VALIDATED_TITLE = "(VALIDATED)";
    private static final String PENDING_STATUS = "Status: PENDING VALIDATION";
    private static final String VALIDATED_STATUS = "Status: VALIDATED";
    private static final int CONTEXT_PREVIEW = 200;

    private final StoragePort storagePort;
    private final BrainProperties properties;
    private final BrainConfigService configService;
    private final CapitalizedPhraseClassifier candidateClassifier;
    private final VectorStorePort vectorStorePort;
    private final EmbeddingPort embeddingPort;
    private final Clock clock;

    /**
     * Candidate entity names in the text that are neither pending nor
     * validated, in order of first appearance.
     */
    public Set<String> discover(TrackingLedger ledger, String text) {
        Set<String> candidates = new LinkedHashSet<>();
        for (String name : candidateClassifier.classify(text)) {
            if (!ledger.isPending(name) && !ledger.isValidated(name)) {
                candidates.add(name);
            }
        }
        log.debug("[Quarantine] {} found {} new candidates", candidateClassifier.getComponentType(),
                candidates.size());
        return candidates;
    }

    /**
     * Put a name into quarantine. Quarantining a pending name again returns the
     * existing record.
     *
     * @throws IllegalArgumentException
     *             if the name is blank or already validated
     */
    public QuarantineRecord quarantine(TrackingLedger ledger, String name, String context) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name is required");
        }
        String entityName = name.trim();
        if (slug(entityName).isEmpty()) {
            throw new IllegalArgumentException("Entity name has no usable characters: " + entityName);
        }
        if (ledger.isPending(entityName)) {
            log.debug("[Quarantine] {} is already pending", entityName);
            return ledger.findPending(entityName).orElseThrow();
        }
        if (ledger.isValidated(entityName)) {
            throw new IllegalArgumentException("Entity already validated: " + entityName);
        }

        Instant now = clock.instant();
        String file = slug(entityName) + TieredMemoryStore.EXTENSION;
        String discoveryContext = context == null || context.isBlank()
                ? "Discovered during conversation."
                : context;
        storagePort.putText(quarantineDirectory(), file, renderQuarantine(entityName, discoveryContext, now))
                .join();

        QuarantineRecord record = QuarantineRecord.builder()
                .name(entityName)
                .file(quarantineDirectory() + "/" + file)
                .discoveryContext(discoveryContext)
                .discoveredAt(now)
                .status(QuarantineRecord.Status.PENDING)
                .build();
        ledger.getQuarantine().add(record);
        log.info("[Quarantine] Quarantined entity: {}", entityName);
        return record;
    }

    /**
     * Discover candidates in the text and quarantine each of them, using the
     * text as discovery context.
     */
    public List<QuarantineRecord> discoverAndQuarantine(TrackingLedger ledger, String text) {
        List<QuarantineRecord> records = new ArrayList<>();
        String context = text.length() > CONTEXT_PREVIEW ? text.substring(0, CONTEXT_PREVIEW) : text;
        for (String name : discover(ledger, text)) {
            records.add(quarantine(ledger, name, context));
        }
        return records;
    }

    /**
     * Promote a pending entity to the durable entity area.
     *
     * @param targetCollection
     *            collection the entity belongs to, or null for the first
     *            configured collection
     * @param keywords
     *            optional keywords recorded with the validation
     * @throws EntityNotFoundException
     *             if the name is not pending
     */
    public EntityRecord validate(TrackingLedger ledger, String name, String targetCollection,
            List<String> keywords) {
        QuarantineRecord pending = ledger.findPending(name)
                .orElseThrow(() -> new EntityNotFoundException(name));
        String entityName = pending.getName();
        Instant now = clock.instant();
        String collection = targetCollection != null && !targetCollection.isBlank()
                ? targetCollection
                : configService.getConfig().getDefaultCollection();
        List<String> keywordList = keywords != null ? List.copyOf(keywords) : List.of();
        String file = slug(entityName) + TieredMemoryStore.EXTENSION;

        String content = storagePort.getText(quarantineDirectory(), file).join();
        if (content == null) {
            log.warn("[Quarantine] Record file for {} is missing, regenerating it", entityName);
            content = renderQuarantine(entityName, pending.getDiscoveryContext(), pending.getDiscoveredAt());
        }
        StringBuilder validated = new StringBuilder(content
                .replace(PENDING_TITLE, VALIDATED_TITLE)
                .replace(PENDING_STATUS, VALIDATED_STATUS));
        validated.append("\n## Validation Details\n");
        validated.append("- Validated: ").append(now).append('\n');
        validated.append("- Target Collection: ").append(collection).append('\n');
        if (!keywordList.isEmpty()) {
            validated.append("- Keywords: ").append(String.join(", ", keywordList)).append('\n');
        }

        storagePort.putText(entitiesDirectory(), file, validated.toString()).join();
        storagePort.deleteObject(quarantineDirectory(), file).join();

        EntityRecord entity = EntityRecord.builder()
                .name(entityName)
                .file(entitiesDirectory() + "/" + file)
                .targetCollection(collection)
                .keywords(new ArrayList<>(keywordList))
                .discoveredAt(pending.getDiscoveredAt())
                .validatedAt(now)
                .build();
        ledger.getQuarantine().remove(pending);
        ledger.getValidatedEntities().add(entity);
        log.info("[Quarantine] Validated entity {} into {}", entityName, collection);

        if (targetCollection != null && !targetCollection.isBlank()) {
            ensureCollectionQuietly(targetCollection);
        }
        return entity;
    }

    /**
     * Drop a pending entity.
     *
     * @throws EntityNotFoundException
     *             if the name is not pending
     */
    public QuarantineRecord reject(TrackingLedger ledger, String name) {
        QuarantineRecord pending = ledger.findPending(name)
                .orElseThrow(() -> new EntityNotFoundException(name));
        storagePort.deleteObject(quarantineDirectory(), slug(pending.getName()) + TieredMemoryStore.EXTENSION)
                .join();
        ledger.getQuarantine().remove(pending);
        log.info("[Quarantine] Rejected entity: {}", pending.getName());
        return pending;
    }

    public List<QuarantineRecord> listPending(TrackingLedger ledger) {
        return List.copyOf(ledger.getQuarantine());
    }

    public List<EntityRecord> listValidated(TrackingLedger ledger) {
        return List.copyOf(ledger.getValidatedEntities());
    }

    static String slug(String name) {
        return EntityRecord.slug(name);
    }

    private void ensureCollectionQuietly(String collection) {
        try {
            vectorStorePort.ensureCollection(collection, embeddingPort.getDimension())
                    .orTimeout(configService.getVectorTimeoutSeconds(), TimeUnit.SECONDS)
                    .join();
        } catch (RuntimeException e) {
            log.warn("[Quarantine] Could not create collection {}: {}", collection, e.getMessage());
        }
    }

    private String renderQuarantine(String name, String context, Instant discoveredAt) {
        String slug = slug(name);
        return "# " + name + " " + PENDING_TITLE + "\n\n"
                + "*Discovered: " + LocalDateTime.ofInstant(discoveredAt, clock.getZone()).format(DISPLAY_FORMAT)
                + "*\n"
                + "*" + PENDING_STATUS + "*\n\n"
                + "## Context\n\n"
                + context + "\n\n"
                + "## Keywords\n\n"
                + "- " + name + "\n"
                + "- " + slug + "\n\n"
                + "## Validation\n\n"
                + "- [ ] Confirm entity exists\n"
                + "- [ ] Determine entity type (person, project, topic)\n"
                + "- [ ] Add to appropriate collection\n\n"
                + "---\n\n"
                + "*Must be validated before promotion.*\n";
    }

    private String quarantineDirectory() {
        return properties.getMemory().getQuarantineDirectory();
    }

    private String entitiesDirectory() {
        return properties.getMemory().getEntitiesDirectory();
    }
}
