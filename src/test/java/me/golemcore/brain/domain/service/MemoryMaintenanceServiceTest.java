package me.golemcore.brain.domain.service;

import me.golemcore.brain.domain.model.MaintenanceReport;
import me.golemcore.brain.domain.model.PruneResult;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.domain.model.WeeklySummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryMaintenanceServiceTest {

    private TieredMemoryStore store;
    private BrainConfigService configService;
    private MemoryMaintenanceService service;
    private TrackingLedger ledger;

    @BeforeEach
    void setUp() {
        store = mock(TieredMemoryStore.class);
        configService = mock(BrainConfigService.class);
        service = new MemoryMaintenanceService(store, configService);
        ledger = TrackingLedger.builder().build();
    }

    @Test
    void shouldConsolidateCurrentWeekWithoutPruningByDefault() {
        WeeklySummary summary = WeeklySummary.builder()
                .weekStart(LocalDate.of(2026, 2, 9))
                .weekEnd(LocalDate.of(2026, 2, 15))
                .build();
        when(store.consolidate(ledger, null)).thenReturn(Optional.of(summary));

        MaintenanceReport report = service.runMaintenance(ledger);

        assertSame(summary, report.getWeeklySummary());
        assertNull(report.getPrune());
        verify(store, never()).prune(any(), any());
    }

    @Test
    void shouldPruneWhenAutoPruneIsEnabled() {
        PruneResult prune = PruneResult.builder().prunedFile("2026-02-01.md").build();
        when(store.consolidate(ledger, null)).thenReturn(Optional.empty());
        when(configService.isAutoPruneEnabled()).thenReturn(true);
        when(store.prune(ledger, null)).thenReturn(prune);

        MaintenanceReport report = service.runMaintenance(ledger);

        assertNull(report.getWeeklySummary());
        assertSame(prune, report.getPrune());
        verify(store).prune(eq(ledger), isNull());
    }
}
