package com.cred.freestyle.lottery.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Back office metrics published to CloudWatch via Micrometer.
 *
 * Key Metrics:
 * - Import validations and commits by outcome
 * - Rows created, updated and failed per commit
 * - UPCs generated and POS exports by outcome
 * - Pack sync latency
 * - Pending import cleanup
 *
 * @author Lottery Back Office Team
 */
@Service
public class LotteryMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(LotteryMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "lottery.";
    private static final String IMPORT_PREFIX = METRIC_PREFIX + "import.";
    private static final String PACK_PREFIX = METRIC_PREFIX + "pack.";
    private static final String POS_PREFIX = METRIC_PREFIX + "pos.";

    public LotteryMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record an import validation.
     *
     * @param stateId State the file was validated for
     * @param accepted Whether a validation token was issued
     */
    public void recordImportValidated(String stateId, boolean accepted) {
        Counter.builder(IMPORT_PREFIX + "validated")
                .tag("state_id", stateId)
                .tag("outcome", accepted ? "accepted" : "rejected")
                .description("Import files validated")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded import validation for state: {}, accepted: {}", stateId, accepted);
    }

    /**
     * Record a committed import and its row counts.
     */
    public void recordImportCommitted(String stateId, int created, int updated, int failed) {
        Counter.builder(IMPORT_PREFIX + "committed")
                .tag("state_id", stateId)
                .description("Imports committed")
                .register(meterRegistry)
                .increment();
        Counter.builder(IMPORT_PREFIX + "rows.created")
                .tag("state_id", stateId)
                .register(meterRegistry)
                .increment(created);
        Counter.builder(IMPORT_PREFIX + "rows.updated")
                .tag("state_id", stateId)
                .register(meterRegistry)
                .increment(updated);
        Counter.builder(IMPORT_PREFIX + "rows.failed")
                .tag("state_id", stateId)
                .register(meterRegistry)
                .increment(failed);
    }

    /**
     * Record a commit rejected before any change.
     *
     * @param reason Error code, e.g. EXPIRED_TOKEN
     */
    public void recordImportRejected(String reason) {
        Counter.builder(IMPORT_PREFIX + "rejected")
                .tag("reason", reason)
                .description("Import commits rejected")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded import rejection, reason: {}", reason);
    }

    public void recordUpcsGenerated(String gameCode, int count) {
        Counter.builder(PACK_PREFIX + "upcs.generated")
                .tag("game_code", gameCode)
                .description("Ticket UPCs generated")
                .register(meterRegistry)
                .increment(count);
    }

    public void recordCacheWriteFailure() {
        Counter.builder(PACK_PREFIX + "cache.write.failure")
                .description("Pack UPC cache writes that failed")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a POS price book export.
     *
     * @param action AddUpdate or Delete
     * @param success Export outcome
     */
    public void recordPosExport(String action, boolean success) {
        Counter.builder(POS_PREFIX + "export")
                .tag("action", action)
                .tag("outcome", success ? "success" : "failure")
                .description("POS price book exports")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record pack sync latency.
     *
     * @param operation activation or deactivation
     * @param durationMs Duration in milliseconds
     */
    public void recordPackSyncLatency(String operation, long durationMs) {
        Timer.builder(PACK_PREFIX + "sync.latency")
                .tag("operation", operation)
                .description("Pack POS sync latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordImportsCleanedUp(int count) {
        Counter.builder(IMPORT_PREFIX + "cleanup.deleted")
                .description("Expired pending imports deleted")
                .register(meterRegistry)
                .increment(count);
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "DATABASE_ERROR", "POS_EXPORT_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
