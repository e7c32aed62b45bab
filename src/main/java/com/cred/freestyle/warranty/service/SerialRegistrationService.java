package com.cred.freestyle.warranty.service;

import com.cred.freestyle.warranty.domain.model.EvidenceFile;
import com.cred.freestyle.warranty.domain.model.ReleasedSerial;
import com.cred.freestyle.warranty.domain.model.SerialNumbers;
import com.cred.freestyle.warranty.domain.model.SerialRecord;
import com.cred.freestyle.warranty.exception.EvidenceStorageException;
import com.cred.freestyle.warranty.exception.InvalidEvidenceException;
import com.cred.freestyle.warranty.exception.InvalidSerialNumberException;
import com.cred.freestyle.warranty.exception.LedgerUnavailableException;
import com.cred.freestyle.warranty.exception.ResourceNotFoundException;
import com.cred.freestyle.warranty.exception.SerialAlreadyClaimedException;
import com.cred.freestyle.warranty.exception.SerialNotFoundException;
import com.cred.freestyle.warranty.exception.UserNotEligibleException;
import com.cred.freestyle.warranty.infrastructure.audit.AuditActions;
import com.cred.freestyle.warranty.infrastructure.audit.AuditLogSink;
import com.cred.freestyle.warranty.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.warranty.infrastructure.directory.UserDirectory;
import com.cred.freestyle.warranty.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.warranty.infrastructure.messaging.events.SerialLedgerEvent;
import com.cred.freestyle.warranty.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.warranty.infrastructure.storage.EvidenceStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Customer-facing registration workflow.
 *
 * Registering a serial:
 * 1. Validate the serial number and the bill (no storage access on failure)
 * 2. Check that the user may register serials
 * 3. Store the bill
 * 4. Claim the serial in the ledger (the single point of decision)
 * 5. Audit, publish the ledger event and evict cached inventory
 *
 * If anything after step 3 fails before the claim commits, including an
 * interruption, the stored bill is deleted again so no file is left without a
 * ledger entry pointing at it. A failed deletion is logged and counted but
 * never replaces the original error.
 *
 * Not transactional: the claim commits on its own and nothing
 * after it may roll it back.
 *
 * @author Warranty Platform Team
 */
@Service
public class SerialRegistrationService {

    private static final Logger logger = LoggerFactory.getLogger(SerialRegistrationService.class);

    private static final String BILL_PREFIX = "bill_";

    private final SerialLedgerStore ledgerStore;
    private final UserDirectory userDirectory;
    private final EvidenceStorage evidenceStorage;
    private final AuditLogSink auditLogSink;
    private final RedisCacheService cacheService;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;
    private final long maxEvidenceBytes;
    private final Set<String> allowedExtensions;
    private final boolean deleteEvidenceOnDisassociate;

    public SerialRegistrationService(
            SerialLedgerStore ledgerStore,
            UserDirectory userDirectory,
            EvidenceStorage evidenceStorage,
            AuditLogSink auditLogSink,
            RedisCacheService cacheService,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService,
            @Value("${warranty.evidence.max-size-bytes:5242880}") long maxEvidenceBytes,
            @Value("${warranty.evidence.allowed-extensions:pdf,jpg,jpeg,png}") String allowedExtensions,
            @Value("${warranty.evidence.delete-on-disassociate:false}") boolean deleteEvidenceOnDisassociate
    ) {
        this.ledgerStore = ledgerStore;
        this.userDirectory = userDirectory;
        this.evidenceStorage = evidenceStorage;
        this.auditLogSink = auditLogSink;
        this.cacheService = cacheService;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
        this.maxEvidenceBytes = maxEvidenceBytes;
        this.allowedExtensions = Arrays.stream(allowedExtensions.split(","))
                .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                .filter(ext -> !ext.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.deleteEvidenceOnDisassociate = deleteEvidenceOnDisassociate;
    }

    /**
     * Register a serial number to a customer.
     *
     * @param userId Customer user ID
     * @param rawSerialNumber Serial number as entered
     * @param evidence Uploaded bill
     * @return The registered record
     * @throws InvalidSerialNumberException if the serial number is blank or malformed
     * @throws InvalidEvidenceException if the bill is missing, empty, too large or of the wrong type
     * @throws UserNotEligibleException if the user may not register serials
     * @throws EvidenceStorageException if the bill could not be stored
     * @throws SerialNotFoundException if the serial is not in the ledger
     * @throws SerialAlreadyClaimedException if the serial is already registered
     * @throws LedgerUnavailableException if the ledger stays unavailable after retries
     */
    public SerialRecord registerSerial(String userId, String rawSerialNumber, EvidenceFile evidence) {
        long startTime = System.currentTimeMillis();

        String serialNumber = SerialNumbers.normalize(rawSerialNumber)
                .filter(SerialNumbers::isWellFormed)
                .orElseThrow(() -> {
                    metricsService.recordRegistrationFailure("INVALID_SERIAL");
                    return new InvalidSerialNumberException(rawSerialNumber);
                });
        validateEvidence(evidence);

        if (!userDirectory.isEligibleToRegister(userId)) {
            logger.warn("User {} is not eligible to register serial {}", userId, serialNumber);
            metricsService.recordRegistrationFailure("NOT_ELIGIBLE");
            throw new UserNotEligibleException(userId);
        }

        String evidenceReference;
        try {
            evidenceReference = evidenceStorage.store(BILL_PREFIX + userId + "_", evidence.getExtension(),
                    evidence.getContent());
        } catch (EvidenceStorageException e) {
            logger.error("Failed to store bill for user {} and serial {}", userId, serialNumber, e);
            metricsService.recordRegistrationFailure("EVIDENCE_STORAGE");
            throw e;
        }

        boolean claimed = false;
        try {
            SerialRecord record = ledgerStore.claim(serialNumber, userId, evidenceReference);
            claimed = true;

            logger.info("Serial {} registered to user {} (product {})", serialNumber, userId, record.getProductId());
            onRegistered(record, userId, evidenceReference);
            metricsService.recordRegistrationSuccess(record.getProductId());
            metricsService.recordRegistrationLatency(System.currentTimeMillis() - startTime);
            return record;
        } catch (SerialAlreadyClaimedException e) {
            metricsService.recordRegistrationFailure("ALREADY_CLAIMED");
            throw e;
        } catch (SerialNotFoundException e) {
            metricsService.recordRegistrationFailure("NOT_FOUND");
            throw e;
        } catch (LedgerUnavailableException e) {
            metricsService.recordRegistrationFailure("LEDGER_UNAVAILABLE");
            throw e;
        } finally {
            if (!claimed) {
                discardEvidence(evidenceReference, serialNumber);
            }
        }
    }

    /**
     * Release a registration back to AVAILABLE.
     *
     * @param rawSerialNumber Serial number
     * @param actor Who is performing the release
     * @return The released registration
     */
    public ReleasedSerial disassociateSerial(String rawSerialNumber, String actor) {
        return disassociateSerial(rawSerialNumber, null, actor);
    }

    /**
     * Release a registration back to AVAILABLE, requiring that it currently
     * belongs to the given user.
     *
     * @param rawSerialNumber Serial number
     * @param expectedOwnerId Required current owner, or null for any owner
     * @param actor Who is performing the release
     * @return The released registration
     */
    public ReleasedSerial disassociateSerial(String rawSerialNumber, String expectedOwnerId, String actor) {
        String serialNumber = SerialNumbers.normalize(rawSerialNumber)
                .filter(SerialNumbers::isWellFormed)
                .orElseThrow(() -> new InvalidSerialNumberException(rawSerialNumber));

        ReleasedSerial released = ledgerStore.release(serialNumber, expectedOwnerId);
        Long productId = released.getRecord().getProductId();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("serial_number", serialNumber);
        details.put("disassociated_from_user", released.getPreviousOwnerId());
        details.put("product_id", productId);
        details.put("evidence_reference", released.getPreviousEvidenceReference());
        details.put("evidence_deleted", deleteEvidenceOnDisassociate);
        auditLogSink.record(actor, AuditActions.DISASSOCIATE_SERIAL, AuditActions.TARGET_SERIAL, serialNumber, details);

        if (deleteEvidenceOnDisassociate && released.getPreviousEvidenceReference() != null) {
            discardEvidence(released.getPreviousEvidenceReference(), serialNumber);
        }

        kafkaProducerService.publishLedgerEvent(
                SerialLedgerEvent.disassociated(serialNumber, productId, released.getPreviousOwnerId(), actor));
        cacheService.evictInventory(productId);
        metricsService.recordDisassociation(productId);

        logger.info("Serial {} disassociated from user {} by {}", serialNumber, released.getPreviousOwnerId(), actor);
        return released;
    }

    /**
     * Look up a serial number.
     *
     * @throws InvalidSerialNumberException if the serial number is malformed
     * @throws SerialNotFoundException if the serial is not in the ledger
     */
    public SerialRecord lookupSerial(String rawSerialNumber) {
        String serialNumber = SerialNumbers.normalize(rawSerialNumber)
                .filter(SerialNumbers::isWellFormed)
                .orElseThrow(() -> new InvalidSerialNumberException(rawSerialNumber));
        return ledgerStore.lookupBySerial(serialNumber)
                .orElseThrow(() -> new SerialNotFoundException(serialNumber));
    }

    /**
     * Load the bill attached to a registered serial.
     *
     * @throws SerialNotFoundException if the serial is not in the ledger
     * @throws ResourceNotFoundException if the serial has no bill on file
     */
    public EvidenceFile loadEvidence(String rawSerialNumber) {
        SerialRecord record = lookupSerial(rawSerialNumber);
        String reference = record.getEvidenceReference();
        if (reference == null) {
            throw new ResourceNotFoundException("Bill", record.getSerialNumber());
        }
        return new EvidenceFile(reference, contentTypeFor(reference), evidenceStorage.load(reference));
    }

    /**
     * Serials currently registered to a user, newest first.
     */
    public List<SerialRecord> findRegisteredSerials(String userId) {
        return ledgerStore.findByOwner(userId);
    }

    private void onRegistered(SerialRecord record, String userId, String evidenceReference) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("serial_number", record.getSerialNumber());
        details.put("product_id", record.getProductId());
        details.put("evidence_reference", evidenceReference);
        auditLogSink.record(userId, AuditActions.REGISTER_SERIAL, AuditActions.TARGET_SERIAL,
                record.getSerialNumber(), details);

        kafkaProducerService.publishLedgerEvent(
                SerialLedgerEvent.registered(record.getSerialNumber(), record.getProductId(), userId));
        cacheService.evictInventory(record.getProductId());
    }

    private void validateEvidence(EvidenceFile evidence) {
        String problem = null;
        if (evidence == null || evidence.isEmpty()) {
            problem = "A bill file is required";
        } else if (evidence.getSize() > maxEvidenceBytes) {
            problem = String.format("Bill file exceeds the maximum size of %d bytes", maxEvidenceBytes);
        } else if (!allowedExtensions.contains(evidence.getExtension())) {
            problem = String.format("Bill file type '%s' is not allowed. Allowed types: %s",
                    evidence.getExtension(), String.join(", ", allowedExtensions));
        }
        if (problem != null) {
            metricsService.recordRegistrationFailure("INVALID_EVIDENCE");
            throw new InvalidEvidenceException(problem);
        }
    }

    private static String contentTypeFor(String reference) {
        String lower = reference.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) {
            return "application/pdf";
        }
        if (lower.endsWith(".png")) {
            return "image/png";
        }
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return "image/jpeg";
        }
        return "application/octet-stream";
    }

    private void discardEvidence(String evidenceReference, String serialNumber) {
        try {
            evidenceStorage.delete(evidenceReference);
            logger.info("Removed bill {} for serial {}", evidenceReference, serialNumber);
        } catch (RuntimeException e) {
            logger.error("Failed to remove bill {} for serial {}, file is orphaned",
                    evidenceReference, serialNumber, e);
            metricsService.recordOrphanedEvidence();
        }
    }
}
