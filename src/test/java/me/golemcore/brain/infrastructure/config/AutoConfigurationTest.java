package me.golemcore.brain.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.brain.domain.model.TrackingLedger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Test
    void shouldInitWithoutBuildProperties() {
        @SuppressWarnings("unchecked")
        ObjectProvider<BuildProperties> buildPropertiesProvider = mock(ObjectProvider.class);
        when(buildPropertiesProvider.getIfAvailable()).thenReturn(null);

        AutoConfiguration autoConfiguration = new AutoConfiguration(new BrainProperties(), buildPropertiesProvider);

        assertDoesNotThrow(autoConfiguration::init);
    }

    @Test
    void shouldWriteInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        TrackingLedger ledger = TrackingLedger.builder()
                .lastConsolidation(Instant.parse("2026-02-09T08:00:00Z"))
                .build();

        String json = mapper.writeValueAsString(ledger);

        assertTrue(json.contains("\"last_consolidation\":\"2026-02-09T08:00:00Z\""));
    }

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        TrackingLedger ledger = AutoConfiguration.objectMapper()
                .readValue("{\"future_field\": 1, \"memory_metrics\": {\"2026-02-10\": 2}}", TrackingLedger.class);

        assertEquals(2, ledger.getMemoryMetrics().get("2026-02-10"));
    }

    @Test
    void shouldProvideClock() {
        assertNotNull(AutoConfiguration.clock());
    }
}
