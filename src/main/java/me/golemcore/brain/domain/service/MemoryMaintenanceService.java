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
import me.golemcore.brain.domain.model.MaintenanceReport;
import me.golemcore.brain.domain.model.PruneResult;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.domain.model.WeeklySummary;
import org.springframework.stereotype.Service;

/**
 * Entry point for an external scheduler: consolidate the current week, then
 * prune when automatic pruning is enabled. Safe to run repeatedly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryMaintenanceService {

    private final TieredMemoryStore tieredMemoryStore;
    private final BrainConfigService configService;

    public MaintenanceReport runMaintenance(TrackingLedger ledger) {
        WeeklySummary summary = tieredMemoryStore.consolidate(ledger, null).orElse(null);
        PruneResult prune = null;
        if (configService.isAutoPruneEnabled()) {
            prune = tieredMemoryStore.prune(ledger, null);
        } else {
            log.debug("[Maintenance] Auto prune disabled");
        }
        return MaintenanceReport.builder()
                .weeklySummary(summary)
                .prune(prune)
                .build();
    }
}
