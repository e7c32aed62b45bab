package com.cred.freestyle.warranty.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * CloudWatch metrics service for monitoring and observability.
 * Publishes custom metrics to AWS CloudWatch via Micrometer.
 *
 * Key Metrics:
 * - Registration success/failure rates (by failure reason)
 * - Disassociations and bulk import volume
 * - Ledger retries and audit entries dropped
 * - Inventory cache hit/miss rates
 *
 * @author Warranty Platform Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "warranty.";
    private static final String REGISTRATION_PREFIX = METRIC_PREFIX + "registration.";
    private static final String IMPORT_PREFIX = METRIC_PREFIX + "import.";
    private static final String LEDGER_PREFIX = METRIC_PREFIX + "ledger.";
    private static final String AUDIT_PREFIX = METRIC_PREFIX + "audit.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record successful serial registration.
     *
     * @param productId Product the serial belongs to
     */
    public void recordRegistrationSuccess(Long productId) {
        Counter.builder(REGISTRATION_PREFIX + "success")
                .tag("product_id", String.valueOf(productId))
                .description("Successful serial registrations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded registration success for product: {}", productId);
    }

    /**
     * Record failed registration attempt.
     *
     * @param reason Failure reason (e.g., "ALREADY_CLAIMED", "NOT_FOUND", "NOT_ELIGIBLE")
     */
    public void recordRegistrationFailure(String reason) {
        Counter.builder(REGISTRATION_PREFIX + "failure")
                .tag("reason", reason)
                .description("Failed registration attempts")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded registration failure, reason: {}", reason);
    }

    /**
     * Record registration latency (evidence upload + claim).
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordRegistrationLatency(long durationMs) {
        Timer.builder(REGISTRATION_PREFIX + "latency")
                .description("Serial registration latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a registration released back to AVAILABLE.
     *
     * @param productId Product the serial belongs to
     */
    public void recordDisassociation(Long productId) {
        Counter.builder(METRIC_PREFIX + "disassociation")
                .tag("product_id", String.valueOf(productId))
                .description("Registrations released by administrators")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a stored bill that could not be removed after a failed registration.
     */
    public void recordOrphanedEvidence() {
        Counter.builder(REGISTRATION_PREFIX + "evidence.orphaned")
                .description("Evidence files left behind by failed compensation")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record bulk import outcome.
     *
     * @param productId Product imported into
     * @param added Number of serials inserted
     * @param duplicates Number of serials skipped as already existing
     * @param errors Number of per-entry errors
     */
    public void recordImport(Long productId, int added, int duplicates, int errors) {
        String product = String.valueOf(productId);
        Counter.builder(IMPORT_PREFIX + "added")
                .tag("product_id", product)
                .description("Serial numbers imported")
                .register(meterRegistry)
                .increment(added);
        Counter.builder(IMPORT_PREFIX + "duplicates")
                .tag("product_id", product)
                .description("Serial numbers skipped as duplicates")
                .register(meterRegistry)
                .increment(duplicates);
        Counter.builder(IMPORT_PREFIX + "errors")
                .tag("product_id", product)
                .description("Import entries rejected")
                .register(meterRegistry)
                .increment(errors);
        logger.debug("Recorded import for product {}: added={}, duplicates={}, errors={}",
                productId, added, duplicates, errors);
    }

    /**
     * Record a retried ledger operation after a transient storage error.
     *
     * @param operation Ledger operation (e.g., "claim", "release")
     */
    public void recordLedgerRetry(String operation) {
        Counter.builder(LEDGER_PREFIX + "retry")
                .tag("operation", operation)
                .description("Ledger operations retried after transient failures")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an audit entry that could not be persisted and was discarded.
     *
     * @param action Audit action
     */
    public void recordAuditDropped(String action) {
        Counter.builder(AUDIT_PREFIX + "dropped")
                .tag("action", action)
                .description("Audit entries discarded after failed writes")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record cache hit.
     *
     * @param cacheType Type of cache (e.g., "inventory")
     */
    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .description("Cache hits")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record cache miss.
     *
     * @param cacheType Type of cache
     */
    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .description("Cache misses")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "DATABASE_ERROR", "STORAGE_ERROR")
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
