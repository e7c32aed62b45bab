package com.cred.freestyle.warranty.infrastructure.audit;

import com.cred.freestyle.warranty.domain.model.AuditEntry;
import com.cred.freestyle.warranty.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.warranty.repository.AuditEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * Durable, non-blocking audit trail writer.
 *
 * Each entry is written in its own transaction, independent of the caller's.
 * A transient storage failure is retried exactly once after a short pause;
 * any other failure, or a second failure, is logged and the entry is
 * discarded. {@link #record} never throws, so auditing cannot change the
 * outcome of the operation being audited.
 *
 * @author Warranty Platform Team
 */
@Service
public class AuditLogSink {

    private static final Logger logger = LoggerFactory.getLogger(AuditLogSink.class);

    private final AuditEntryRepository auditEntryRepository;
    private final ObjectMapper objectMapper;
    private final CloudWatchMetricsService metricsService;
    private final TransactionTemplate requiresNewTransaction;
    private final long retryBackoffMs;

    public AuditLogSink(
            AuditEntryRepository auditEntryRepository,
            ObjectMapper objectMapper,
            CloudWatchMetricsService metricsService,
            PlatformTransactionManager transactionManager,
            @Value("${warranty.audit.retry-backoff-ms:500}") long retryBackoffMs
    ) {
        this.auditEntryRepository = auditEntryRepository;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.requiresNewTransaction = new TransactionTemplate(transactionManager);
        this.requiresNewTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.retryBackoffMs = retryBackoffMs;
    }

    /**
     * Record an audit entry. Best-effort: never throws.
     *
     * @param actor Who performed the action
     * @param action Action name (see {@link AuditActions})
     * @param targetType Target type
     * @param targetId Target identifier
     * @param details Structured details (serialized as JSON)
     */
    public void record(String actor, String action, String targetType, String targetId,
                       Map<String, Object> details) {
        Instant occurredAt = Instant.now();
        String payload = serializeDetails(action, details);

        try {
            persist(actor, action, targetType, targetId, payload, occurredAt);
            return;
        } catch (TransientDataAccessException e) {
            logger.warn("Transient failure writing audit entry {} on {}/{}, retrying once in {}ms: {}",
                    action, targetType, targetId, retryBackoffMs, e.getMessage());
        } catch (RuntimeException e) {
            drop(action, targetType, targetId, e);
            return;
        }

        if (!pauseBeforeRetry()) {
            drop(action, targetType, targetId, null);
            return;
        }

        try {
            persist(actor, action, targetType, targetId, payload, occurredAt);
        } catch (RuntimeException e) {
            drop(action, targetType, targetId, e);
        }
    }

    private void persist(String actor, String action, String targetType, String targetId,
                         String payload, Instant occurredAt) {
        AuditEntry entry = AuditEntry.builder()
                .actor(actor)
                .action(action)
                .targetType(targetType)
                .targetId(targetId)
                .details(payload)
                .occurredAt(occurredAt)
                .build();
        requiresNewTransaction.executeWithoutResult(status -> auditEntryRepository.save(entry));
        logger.debug("Audit entry written: action={}, target={}/{}, actor={}", action, targetType, targetId, actor);
    }

    private boolean pauseBeforeRetry() {
        if (retryBackoffMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(retryBackoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting to retry audit write");
            return false;
        }
    }

    private void drop(String action, String targetType, String targetId, Exception cause) {
        logger.error("Discarding audit entry: action={}, target={}/{}", action, targetType, targetId, cause);
        metricsService.recordAuditDropped(action);
    }

    private String serializeDetails(String action, Map<String, Object> details) {
        Map<String, Object> safeDetails = details == null ? Collections.emptyMap() : details;
        try {
            return objectMapper.writeValueAsString(safeDetails);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize details for audit action {}, storing text form", action, e);
            return String.valueOf(safeDetails);
        }
    }
}
