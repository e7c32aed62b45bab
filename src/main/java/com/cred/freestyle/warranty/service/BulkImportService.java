package com.cred.freestyle.warranty.service;

import com.cred.freestyle.warranty.domain.model.BulkImportResult;
import com.cred.freestyle.warranty.domain.model.SerialNumbers;
import com.cred.freestyle.warranty.exception.DuplicateSerialException;
import com.cred.freestyle.warranty.exception.LedgerUnavailableException;
import com.cred.freestyle.warranty.exception.ResourceNotFoundException;
import com.cred.freestyle.warranty.infrastructure.audit.AuditActions;
import com.cred.freestyle.warranty.infrastructure.audit.AuditLogSink;
import com.cred.freestyle.warranty.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.warranty.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.warranty.infrastructure.messaging.events.SerialLedgerEvent;
import com.cred.freestyle.warranty.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles an administrator's batch of serial numbers against the ledger.
 *
 * Steps:
 * 1. Trim, upper-case and de-duplicate the batch (first occurrence wins);
 *    blank entries are skipped, malformed ones become per-entry errors
 * 2. Look up which serials already exist in any product (batched queries)
 * 3. Insert the remainder as AVAILABLE in one atomic batch
 * 4. Write one summary audit entry for the batch
 *
 * Re-importing the same batch adds nothing and reports every serial as a
 * duplicate. Duplicates are reported using the entry as submitted (trimmed),
 * so "abc" colliding with an existing "ABC" is reported as "abc".
 *
 * If the insert itself fails (a concurrent import won a uniqueness race, or
 * the ledger is unavailable) nothing from the batch is written and every
 * attempted serial is reported in errors; the caller may retry the batch.
 *
 * @author Warranty Platform Team
 */
@Service
public class BulkImportService {

    private static final Logger logger = LoggerFactory.getLogger(BulkImportService.class);

    private final SerialLedgerStore ledgerStore;
    private final ProductService productService;
    private final AuditLogSink auditLogSink;
    private final RedisCacheService cacheService;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    public BulkImportService(
            SerialLedgerStore ledgerStore,
            ProductService productService,
            AuditLogSink auditLogSink,
            RedisCacheService cacheService,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.ledgerStore = ledgerStore;
        this.productService = productService;
        this.auditLogSink = auditLogSink;
        this.cacheService = cacheService;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Import a batch of serial numbers into a product.
     *
     * @param productId Target product
     * @param candidates Raw serial numbers (may contain blanks, repeats, mixed case)
     * @param actor Administrator performing the import
     * @return Import result
     * @throws ResourceNotFoundException if the product does not exist
     */
    public BulkImportResult importSerials(Long productId, List<String> candidates, String actor) {
        if (!productService.exists(productId)) {
            throw new ResourceNotFoundException("Product", String.valueOf(productId));
        }

        // normalized serial -> entry as submitted (trimmed), first occurrence wins
        Map<String, String> unique = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();

        for (String candidate : candidates) {
            String trimmed = candidate == null ? "" : candidate.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String normalized = SerialNumbers.normalize(trimmed).orElse("");
            if (!SerialNumbers.isWellFormed(normalized)) {
                errors.add(trimmed + ": malformed serial number");
                continue;
            }
            unique.putIfAbsent(normalized, trimmed);
        }

        if (unique.isEmpty()) {
            logger.info("Import into product {} by {}: no valid serial numbers ({} error(s))",
                    productId, actor, errors.size());
            metricsService.recordImport(productId, 0, 0, errors.size());
            return new BulkImportResult(productId, 0, List.of(), errors);
        }

        Set<String> existing = ledgerStore.findExisting(unique.keySet());

        List<String> duplicates = new ArrayList<>();
        List<String> fresh = new ArrayList<>();
        for (Map.Entry<String, String> entry : unique.entrySet()) {
            if (existing.contains(entry.getKey())) {
                duplicates.add(entry.getValue());
            } else {
                fresh.add(entry.getKey());
            }
        }

        int added = 0;
        if (!fresh.isEmpty()) {
            try {
                ledgerStore.insertAllAvailable(fresh, productId);
                added = fresh.size();
            } catch (DuplicateSerialException e) {
                logger.warn("Import into product {} lost a uniqueness race, {} serial(s) not inserted",
                        productId, fresh.size());
                for (String serialNumber : fresh) {
                    errors.add(unique.get(serialNumber) + ": not inserted, batch conflicted with a concurrent import");
                }
            } catch (LedgerUnavailableException e) {
                logger.error("Import into product {} failed, ledger unavailable", productId, e);
                for (String serialNumber : fresh) {
                    errors.add(unique.get(serialNumber) + ": not inserted, ledger temporarily unavailable");
                }
            }
        }

        if (added > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("added_count", added);
            details.put("duplicates_count", duplicates.size());
            details.put("errors_count", errors.size());
            auditLogSink.record(actor, AuditActions.BULK_ADD_SERIALS, AuditActions.TARGET_PRODUCT,
                    String.valueOf(productId), details);

            kafkaProducerService.publishLedgerEvent(SerialLedgerEvent.imported(productId, added, actor));
            cacheService.evictInventory(productId);
        }

        metricsService.recordImport(productId, added, duplicates.size(), errors.size());
        logger.info("Import into product {} by {}: added={}, duplicates={}, errors={}",
                productId, actor, added, duplicates.size(), errors.size());

        return new BulkImportResult(productId, added, duplicates, errors);
    }
}
