package com.fintech.pricehistory.sync;

import com.fintech.pricehistory.config.PriceHistoryProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.Mockito.*;

@DisplayName("HistoricalSyncJob Tests")
class HistoricalSyncJobTest {

    @Test
    @DisplayName("Should sync every configured instrument")
    void testRunSyncsConfiguredInstruments() {
        HistoricalSyncService syncService = mock(HistoricalSyncService.class);
        PriceHistoryProperties properties = new PriceHistoryProperties();
        properties.getSync().setInstruments(List.of("US0378331005", "DE0007164600"));

        new HistoricalSyncJob(syncService, properties).run();

        verify(syncService).syncAll(List.of("US0378331005", "DE0007164600"));
    }

    @Test
    @DisplayName("Should skip when no instruments are configured")
    void testRunWithoutInstruments() {
        HistoricalSyncService syncService = mock(HistoricalSyncService.class);

        new HistoricalSyncJob(syncService, new PriceHistoryProperties()).run();

        verifyNoInteractions(syncService);
    }
}
