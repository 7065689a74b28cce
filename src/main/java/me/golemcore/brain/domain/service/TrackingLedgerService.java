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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Loads and persists the tracking ledger
 * ({@code .memory_brain/access_tracking.json}).
 *
 * <p>
 * The ledger is loaded once per invocation and passed explicitly to each
 * lifecycle operation. Saving goes through an atomic temp-then-rename write so
 * that a crash never leaves a truncated ledger. Failure to save is the one
 * fatal error of the engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingLedgerService {

    static final String LEDGER_FILE = "access_tracking.json";
    static final String CORRUPT_SUFFIX = ".corrupt";

    private final StoragePort storagePort;
    private final BrainProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Read the ledger, or start a fresh one when none exists. An unreadable
     * ledger is set aside as {@code access_tracking.json.corrupt}.
     */
    public TrackingLedger load() {
        String directory = properties.getMemory().getTrackingDirectory();
        String json = storagePort.getText(directory, LEDGER_FILE).join();
        if (json == null || json.isBlank()) {
            log.debug("[Ledger] No ledger found, starting fresh");
            return TrackingLedger.builder().build();
        }
        try {
            TrackingLedger ledger = objectMapper.readValue(json, TrackingLedger.class);
            normalize(ledger);
            return ledger;
        } catch (IOException e) {
            log.warn("[Ledger] Corrupt ledger, moving it to {}{}: {}", LEDGER_FILE, CORRUPT_SUFFIX,
                    e.getMessage());
            storagePort.moveObject(directory, LEDGER_FILE, directory, LEDGER_FILE + CORRUPT_SUFFIX).join();
            return TrackingLedger.builder().build();
        }
    }

    /**
     * Persist the ledger atomically.
     *
     * @throws IllegalStateException
     *             when the ledger cannot be written
     */
    public void save(TrackingLedger ledger) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(ledger);
            storagePort.putTextAtomic(properties.getMemory().getTrackingDirectory(), LEDGER_FILE, json, true)
                    .join();
            log.debug("[Ledger] Persisted tracking ledger");
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Failed to persist tracking ledger", e);
        }
    }

    private void normalize(TrackingLedger ledger) {
        if (ledger.getAccessLogs() == null) {
            ledger.setAccessLogs(new ArrayList<>());
        }
        if (ledger.getMemoryMetrics() == null) {
            ledger.setMemoryMetrics(new LinkedHashMap<>());
        }
        if (ledger.getDailyFiles() == null) {
            ledger.setDailyFiles(new LinkedHashMap<>());
        }
        if (ledger.getWeeklySummaries() == null) {
            ledger.setWeeklySummaries(new LinkedHashMap<>());
        }
        if (ledger.getQuarantine() == null) {
            ledger.setQuarantine(new ArrayList<>());
        }
        if (ledger.getValidatedEntities() == null) {
            ledger.setValidatedEntities(new ArrayList<>());
        }
        int before = ledger.getQuarantine().size() + ledger.getValidatedEntities().size();
        ledger.getQuarantine().removeIf(record -> record == null || record.getName() == null);
        ledger.getValidatedEntities().removeIf(entity -> entity == null || entity.getName() == null);
        int dropped = before - ledger.getQuarantine().size() - ledger.getValidatedEntities().size();
        if (dropped > 0) {
            log.warn("[Ledger] Skipped {} malformed entity records", dropped);
        }
    }
}
