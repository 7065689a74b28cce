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
import me.golemcore.brain.domain.model.BrainConfig;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the runtime config ({@code config/user_config.json}) once and caches
 * it. A missing file is created with defaults. A malformed file is reported
 * and left untouched while defaults are used for this run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BrainConfigService {

    static final String CONFIG_FILE = "user_config.json";

    private final StoragePort storagePort;
    private final BrainProperties properties;
    private final ObjectMapper objectMapper;

    private final AtomicReference<BrainConfig> configRef = new AtomicReference<>();

    public BrainConfig getConfig() {
        BrainConfig current = configRef.get();
        if (current == null) {
            synchronized (this) {
                current = configRef.get();
                if (current == null) {
                    current = loadOrCreate();
                    normalize(current);
                    configRef.set(current);
                }
            }
        }
        return current;
    }

    public int getRetentionDays() {
        return getConfig().getPruning().getDailyFileRetentionDays();
    }

    public int getShortTermVectorDays() {
        return getConfig().getPruning().getShortTermVectorDays();
    }

    public boolean isAutoPruneEnabled() {
        return Boolean.TRUE.equals(getConfig().getPruning().getAutoPruneEnabled());
    }

    public int getVectorTimeoutSeconds() {
        return getConfig().getVector().getTimeoutSeconds();
    }

    private BrainConfig loadOrCreate() {
        String configDir = properties.getMemory().getConfigDirectory();
        String json;
        try {
            json = storagePort.getText(configDir, CONFIG_FILE).join();
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[BrainConfig] Cannot read {}, using defaults: {}", CONFIG_FILE, e.getMessage());
            return BrainConfig.builder().build();
        }

        if (json != null && !json.isBlank()) {
            try {
                BrainConfig loaded = objectMapper.readValue(json, BrainConfig.class);
                log.info("[BrainConfig] Loaded runtime config from storage");
                return loaded;
            } catch (IOException e) {
                log.warn("[BrainConfig] Malformed {}, using defaults for this run: {}", CONFIG_FILE,
                        e.getMessage());
                return BrainConfig.builder().build();
            }
        }

        BrainConfig defaultConfig = BrainConfig.builder().build();
        persist(defaultConfig);
        log.info("[BrainConfig] Created default runtime config");
        return defaultConfig;
    }

    private void persist(BrainConfig config) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
            storagePort.putText(properties.getMemory().getConfigDirectory(), CONFIG_FILE, json).join();
            log.debug("[BrainConfig] Persisted runtime config");
        } catch (Exception e) {
            log.error("[BrainConfig] Failed to persist runtime config", e);
        }
    }

    private void normalize(BrainConfig config) {
        BrainConfig defaults = BrainConfig.builder().build();
        if (config.getPruning() == null) {
            config.setPruning(defaults.getPruning());
        }
        BrainConfig.PruningConfig pruning = config.getPruning();
        if (pruning.getDailyFileRetentionDays() == null || pruning.getDailyFileRetentionDays() <= 0) {
            log.warn("[BrainConfig] Invalid daily_file_retention_days {}, using {}",
                    pruning.getDailyFileRetentionDays(), defaults.getPruning().getDailyFileRetentionDays());
            pruning.setDailyFileRetentionDays(defaults.getPruning().getDailyFileRetentionDays());
        }
        if (pruning.getShortTermVectorDays() == null || pruning.getShortTermVectorDays() <= 0) {
            pruning.setShortTermVectorDays(defaults.getPruning().getShortTermVectorDays());
        }
        if (pruning.getAutoPruneEnabled() == null) {
            pruning.setAutoPruneEnabled(false);
        }

        if (config.getCollections() == null || config.getCollections().isEmpty()) {
            log.warn("[BrainConfig] No collections configured, using defaults");
            config.setCollections(BrainConfig.defaultCollections());
        } else {
            config.setCollections(new LinkedHashMap<>(config.getCollections()));
            config.getCollections().replaceAll((name, collection) -> {
                if (collection == null) {
                    return new BrainConfig.CollectionConfig(name, new ArrayList<>());
                }
                if (collection.getKeywords() == null) {
                    collection.setKeywords(new ArrayList<>());
                }
                return collection;
            });
        }

        if (config.getVector() == null) {
            config.setVector(defaults.getVector());
        }
        if (config.getVector().getUrl() == null || config.getVector().getUrl().isBlank()) {
            config.getVector().setUrl(defaults.getVector().getUrl());
        }
        if (config.getVector().getTimeoutSeconds() == null || config.getVector().getTimeoutSeconds() <= 0) {
            config.getVector().setTimeoutSeconds(defaults.getVector().getTimeoutSeconds());
        }
        if (config.getEmbedding() == null) {
            config.setEmbedding(defaults.getEmbedding());
        }
        if (config.getEmbedding().getProvider() == null || config.getEmbedding().getProvider().isBlank()) {
            config.getEmbedding().setProvider(defaults.getEmbedding().getProvider());
        }
    }
}
