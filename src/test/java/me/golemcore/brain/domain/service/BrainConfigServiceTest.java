package me.golemcore.brain.domain.service;

import me.golemcore.brain.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.brain.domain.model.BrainConfig;
import me.golemcore.brain.infrastructure.config.AutoConfiguration;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrainConfigServiceTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private BrainConfigService service;

    @BeforeEach
    void setUp() {
        BrainProperties properties = new BrainProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        configFile = tempDir.resolve("config/user_config.json");
        service = new BrainConfigService(storage, properties, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldCreateDefaultConfigWhenMissing() throws IOException {
        BrainConfig config = service.getConfig();

        assertEquals(7, service.getRetentionDays());
        assertEquals(30, service.getShortTermVectorDays());
        assertFalse(service.isAutoPruneEnabled());
        assertEquals(5, service.getVectorTimeoutSeconds());
        assertEquals("mem_user", config.getDefaultCollection());
        assertEquals(6, config.getCollections().size());
        assertTrue(Files.readString(configFile).contains("\"daily_file_retention_days\" : 7"));
        assertSame(config, service.getConfig());
    }

    @Test
    void shouldLoadConfiguredValuesInDeclaredOrder() throws IOException {
        Files.writeString(configFile, """
                {
                  "pruning": {"daily_file_retention_days": 14, "auto_prune_enabled": true},
                  "collections": {
                    "mem_clients": {"description": "Clients", "keywords": ["client"]},
                    "mem_sessions": {"description": "Sessions"}
                  },
                  "vector": {"url": "http://qdrant:6333", "timeout_seconds": 2}
                }
                """);

        BrainConfig config = service.getConfig();

        assertEquals(14, service.getRetentionDays());
        assertTrue(service.isAutoPruneEnabled());
        assertEquals(30, service.getShortTermVectorDays());
        assertEquals(2, service.getVectorTimeoutSeconds());
        assertEquals(List.of("mem_clients", "mem_sessions"), List.copyOf(config.getCollections().keySet()));
        assertEquals("mem_clients", config.getDefaultCollection());
        assertTrue(config.getCollections().get("mem_sessions").getKeywords().isEmpty());
        assertEquals("local", config.getEmbedding().getProvider());
    }

    @Test
    void shouldRepairInvalidValues() throws IOException {
        Files.writeString(configFile, """
                {"pruning": {"daily_file_retention_days": -3}, "collections": {}, "vector": {"timeout_seconds": 0}}
                """);

        BrainConfig config = service.getConfig();

        assertEquals(7, service.getRetentionDays());
        assertEquals(5, service.getVectorTimeoutSeconds());
        assertEquals("http://127.0.0.1:6333", config.getVector().getUrl());
        assertEquals(6, config.getCollections().size());
    }

    @Test
    void shouldUseDefaultsWithoutOverwritingMalformedFile() throws IOException {
        Files.writeString(configFile, "{ broken");

        assertEquals(7, service.getRetentionDays());
        assertEquals("{ broken", Files.readString(configFile));
    }
}
