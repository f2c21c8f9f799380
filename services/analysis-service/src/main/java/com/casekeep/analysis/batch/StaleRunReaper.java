package com.casekeep.analysis.batch;

import com.casekeep.analysis.config.AnalysisProperties;
import com.casekeep.analysis.ledger.RunLedger;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class StaleRunReaper {

    private static final Logger LOGGER = LoggerFactory.getLogger(StaleRunReaper.class);

    private final AnalysisProperties properties;
    private final RunLedger runLedger;

    public StaleRunReaper(AnalysisProperties properties, RunLedger runLedger) {
        this.properties = properties;
        this.runLedger = runLedger;
    }

    @Scheduled(fixedDelayString = "${analysis.reaper-fixed-delay-ms:60000}")
    public void reapStaleRuns() {
        if (!properties.isReaperEnabled()) {
            return;
        }
        Instant cutoff = Instant.now().minus(properties.getStaleRunTimeout());
        int reaped = runLedger.failStaleRuns(cutoff);
        if (reaped > 0) {
            LOGGER.warn("Marked {} stale analysis runs as failed (idle since before {})", reaped, cutoff);
        }
    }
}
