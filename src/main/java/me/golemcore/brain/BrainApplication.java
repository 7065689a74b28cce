package me.golemcore.brain;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Brain.
 *
 * <p>
 * GolemCore Brain keeps a personal knowledge base built from assistant
 * conversation transcripts. Every invocation runs exactly one command and
 * exits, so it can be driven by cron or an external supervisor.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Significance filtering</b> - only memory-worthy turns are kept</li>
 * <li><b>Tiered store</b> - daily files consolidated into weekly summaries,
 * then archived</li>
 * <li><b>Entity quarantine</b> - discovered entities wait for explicit
 * validation before promotion</li>
 * <li><b>Degrading retrieval</b> - semantic search against Qdrant with a
 * lexical fallback over tier files</li>
 * <li><b>Conflict detection</b> - contradictory memories are surfaced, never
 * auto-resolved</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → BrainCommandLineRunner, CommandRouter
 * Domain Layer       → TieredMemoryStore, EntityQuarantineService, RetrievalRouter, ...
 * Infrastructure     → Storage/Embedding/Vector/Transcript adapters
 * </pre>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BrainApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(BrainApplication.class, args)));
    }

}
