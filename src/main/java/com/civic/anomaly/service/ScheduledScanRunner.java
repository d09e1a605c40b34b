package com.civic.anomaly.service;

import com.civic.anomaly.exception.ScanInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the periodic full scan. A cron of "-" disables it.
 */
@Component
public class ScheduledScanRunner {

    private static final Logger log = LoggerFactory.getLogger(ScheduledScanRunner.class);

    private final AnomalyScanService scanService;

    public ScheduledScanRunner(AnomalyScanService scanService) {
        this.scanService = scanService;
    }

    @Scheduled(cron = "${anomaly.scan.cron:0 0 2 * * *}", zone = "${anomaly.scan.zone:UTC}")
    public void runScheduledScan() {
        try {
            scanService.runFullScan();
        } catch (ScanInProgressException e) {
            log.warn("Scheduled scan skipped: {}", e.getMessage());
        }
    }
}
