package com.cred.freestyle.lottery.infrastructure.scheduler;

import com.cred.freestyle.lottery.infrastructure.metrics.LotteryMetricsService;
import com.cred.freestyle.lottery.service.importing.LotteryImportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job deleting pending imports whose validation token expired uncommitted.
 *
 * Expired imports are already unusable (commit checks expiry), so the sweep only
 * reclaims storage. Runs every 10 minutes by default with a fixed delay.
 *
 * @author Lottery Back Office Team
 */
@Service
public class PendingImportCleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(PendingImportCleanupScheduler.class);

    private final LotteryImportService lotteryImportService;
    private final LotteryMetricsService metricsService;

    @Value("${lottery.import.cleanup.enabled:true}")
    private boolean schedulerEnabled = true;

    public PendingImportCleanupScheduler(
            LotteryImportService lotteryImportService,
            LotteryMetricsService metricsService
    ) {
        this.lotteryImportService = lotteryImportService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${lottery.import.cleanup.interval-ms:600000}")
    public void cleanupExpiredImports() {
        if (!schedulerEnabled) {
            logger.debug("Pending import cleanup scheduler is disabled");
            return;
        }

        long startTime = System.currentTimeMillis();
        try {
            int deleted = lotteryImportService.cleanupExpiredImports();
            logger.debug("Pending import cleanup completed: {} deleted, duration: {}ms",
                    deleted, System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            logger.error("Error in pending import cleanup scheduler", e);
            metricsService.recordError("IMPORT_CLEANUP_SCHEDULER_ERROR", "cleanupExpiredImports");
        }
    }

    /**
     * Manual trigger for cleanup, ignoring the enabled flag.
     *
     * @return Number of imports deleted
     */
    public int triggerCleanupNow() {
        logger.info("Manual pending import cleanup triggered");
        int deleted = lotteryImportService.cleanupExpiredImports();
        logger.info("Manual pending import cleanup completed: {} imports deleted", deleted);
        return deleted;
    }
}
