package me.golemcore.brain.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Static configuration properties bound from application.properties.
 *
 * <p>
 * Everything here is deployment wiring under the {@code brain.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link MemoryProperties} - tier directory layout</li>
 * <li>{@link HttpProperties} - shared HTTP client defaults</li>
 * </ul>
 *
 * <p>
 * Operator-tunable behaviour (retention, collections, vector endpoint) lives in
 * the runtime config file instead, see
 * {@link me.golemcore.brain.domain.service.BrainConfigService}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "brain")
@Data
public class BrainProperties {

    private StorageProperties storage = new StorageProperties();
    private MemoryProperties memory = new MemoryProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/brain";
    }

    @Data
    public static class MemoryProperties {
        private String directory = "memory";
        private String weeklyDirectory = "distilled";
        private String archiveDirectory = "archive";
        private String entitiesDirectory = "entities";
        private String quarantineDirectory = "entities/_quarantine";
        private String trackingDirectory = ".memory_brain";
        private String configDirectory = "config";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 5000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
