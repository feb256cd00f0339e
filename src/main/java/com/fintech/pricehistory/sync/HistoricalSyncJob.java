package com.fintech.pricehistory.sync;

import com.fintech.pricehistory.config.PriceHistoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Nightly sync of the configured instruments. Off unless {@code history.sync.job-enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "history.sync.job-enabled", havingValue = "true")
public class HistoricalSyncJob {

    private static final Logger log = LoggerFactory.getLogger(HistoricalSyncJob.class);

    private final HistoricalSyncService syncService;
    private final PriceHistoryProperties properties;

    public HistoricalSyncJob(HistoricalSyncService syncService, PriceHistoryProperties properties) {
        this.syncService = syncService;
        this.properties = properties;
    }

    @Scheduled(cron = "${history.sync.cron:0 30 22 * * MON-FRI}")
    public void run() {
        List<String> instruments = properties.getSync().getInstruments();
        if (instruments.isEmpty()) {
            log.info("Historical sync job skipped: no instruments configured");
            return;
        }
        log.info("Historical sync job started: instruments={}", instruments.size());
        List<HistoricalSyncService.SyncOutcome> outcomes = syncService.syncAll(instruments);
        log.info("Historical sync job finished: succeeded={}, failed={}",
            outcomes.size(), instruments.size() - outcomes.size());
    }
}
