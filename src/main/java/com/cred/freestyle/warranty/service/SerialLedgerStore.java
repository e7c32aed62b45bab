package com.cred.freestyle.warranty.service;

import com.cred.freestyle.warranty.domain.model.LedgerCounts;
import com.cred.freestyle.warranty.domain.model.ReleasedSerial;
import com.cred.freestyle.warranty.domain.model.SerialRecord;
import com.cred.freestyle.warranty.domain.model.SerialRecord.SerialStatus;
import com.cred.freestyle.warranty.exception.DuplicateSerialException;
import com.cred.freestyle.warranty.exception.LedgerUnavailableException;
import com.cred.freestyle.warranty.exception.NotCurrentlyRegisteredException;
import com.cred.freestyle.warranty.exception.SerialAlreadyClaimedException;
import com.cred.freestyle.warranty.exception.SerialNotFoundException;
import com.cred.freestyle.warranty.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.warranty.repository.SerialRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Durable mapping from serial number to ledger entry, and the only component
 * that changes a serial's state.
 *
 * Claims and releases are single conditional updates whose row count decides
 * the outcome; there is no read-then-write window and no in-process lock.
 * Every storage call is retried a bounded number of times on transient
 * errors (lock timeouts, deadlocks, busy database) and then surfaces as
 * {@link LedgerUnavailableException}. Business outcomes are never retried.
 *
 * @author Warranty Platform Team
 */
@Service
public class SerialLedgerStore {

    private static final Logger logger = LoggerFactory.getLogger(SerialLedgerStore.class);

    private static final int MAX_RELEASE_ATTEMPTS = 3;

    private final SerialRecordRepository serialRecordRepository;
    private final CloudWatchMetricsService metricsService;
    private final Clock clock;
    private final int maxAttempts;
    private final long backoffMs;
    private final int existenceCheckChunkSize;

    public SerialLedgerStore(
            SerialRecordRepository serialRecordRepository,
            CloudWatchMetricsService metricsService,
            Clock clock,
            @Value("${warranty.ledger.retry.max-attempts:3}") int maxAttempts,
            @Value("${warranty.ledger.retry.backoff-ms:50}") long backoffMs,
            @Value("${warranty.ledger.import.existence-check-chunk-size:1000}") int existenceCheckChunkSize
    ) {
        this.serialRecordRepository = serialRecordRepository;
        this.metricsService = metricsService;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = backoffMs;
        this.existenceCheckChunkSize = Math.max(1, existenceCheckChunkSize);
    }

    /**
     * Atomically move an AVAILABLE serial to REGISTERED for the given owner.
     *
     * @param serialNumber Normalized serial number
     * @param ownerId Claiming user
     * @param evidenceReference Reference to the already stored bill
     * @return The registered record
     * @throws SerialNotFoundException if the serial does not exist
     * @throws SerialAlreadyClaimedException if the serial is not AVAILABLE
     * @throws LedgerUnavailableException if transient errors persist
     */
    public SerialRecord claim(String serialNumber, String ownerId, String evidenceReference) {
        // Identity and product never change, so reading them first does not decide the claim
        SerialRecord existing = withRetry("lookup", () -> serialRecordRepository.findBySerialNumber(serialNumber))
                .orElseThrow(() -> {
                    logger.warn("Claim rejected, serial {} not found", serialNumber);
                    return new SerialNotFoundException(serialNumber);
                });

        Instant registeredAt = now();
        int updated = withRetry("claim", () -> serialRecordRepository.claimIfAvailable(
                serialNumber, ownerId, evidenceReference, registeredAt,
                SerialStatus.AVAILABLE, SerialStatus.REGISTERED));

        if (updated == 0) {
            // Serial rows are never deleted, so zero rows means another owner holds it
            logger.warn("Claim rejected, serial {} is not available", serialNumber);
            throw new SerialAlreadyClaimedException(serialNumber);
        }

        // Committed; built from known values only
        logger.info("Serial {} claimed by user {}", serialNumber, ownerId);
        return SerialRecord.builder()
                .recordId(existing.getRecordId())
                .serialNumber(serialNumber)
                .productId(existing.getProductId())
                .ownerId(ownerId)
                .status(SerialStatus.REGISTERED)
                .registeredAt(registeredAt)
                .evidenceReference(evidenceReference)
                .createdAt(existing.getCreatedAt())
                .updatedAt(registeredAt)
                .build();
    }

    /**
     * Move a REGISTERED serial back to AVAILABLE.
     *
     * The current registration is read, then released with a conditional
     * update on that exact registration (owner and registration time). If a
     * concurrent release and re-claim slipped in between, the update matches
     * nothing and the registration is re-read, so a newer claim is never
     * released by mistake.
     *
     * @param serialNumber Normalized serial number
     * @param expectedOwnerId If non-null, the serial must be registered to this user
     * @return The released record and the registration it replaced
     * @throws SerialNotFoundException if the serial does not exist
     * @throws NotCurrentlyRegisteredException if the serial is not registered (to the expected owner)
     */
    public ReleasedSerial release(String serialNumber, String expectedOwnerId) {
        for (int attempt = 1; attempt <= MAX_RELEASE_ATTEMPTS; attempt++) {
            SerialRecord current = withRetry("lookup", () -> serialRecordRepository.findBySerialNumber(serialNumber))
                    .orElseThrow(() -> new SerialNotFoundException(serialNumber));

            if (!current.isRegistered()) {
                throw new NotCurrentlyRegisteredException(serialNumber);
            }
            if (expectedOwnerId != null && !expectedOwnerId.equals(current.getOwnerId())) {
                throw new NotCurrentlyRegisteredException(serialNumber, expectedOwnerId);
            }

            String previousOwner = current.getOwnerId();
            String previousEvidence = current.getEvidenceReference();
            Instant previousRegisteredAt = current.getRegisteredAt();

            Instant releasedAt = now();
            int updated = withRetry("release", () -> serialRecordRepository.releaseIfRegistered(
                    serialNumber, previousOwner, previousRegisteredAt, releasedAt,
                    SerialStatus.AVAILABLE, SerialStatus.REGISTERED));

            if (updated == 1) {
                logger.info("Serial {} released from user {}", serialNumber, previousOwner);
                SerialRecord released = SerialRecord.builder()
                        .recordId(current.getRecordId())
                        .serialNumber(serialNumber)
                        .productId(current.getProductId())
                        .status(SerialStatus.AVAILABLE)
                        .createdAt(current.getCreatedAt())
                        .updatedAt(releasedAt)
                        .build();
                return new ReleasedSerial(released, previousOwner, previousEvidence, previousRegisteredAt);
            }

            logger.warn("Registration of serial {} changed during release (attempt {}), re-reading",
                    serialNumber, attempt);
        }
        throw new NotCurrentlyRegisteredException(serialNumber);
    }

    /**
     * Insert one AVAILABLE serial.
     *
     * @throws DuplicateSerialException if the serial already exists (any product)
     */
    public SerialRecord insertAvailable(String serialNumber, Long productId) {
        try {
            return withRetry("insert", () -> serialRecordRepository.saveAndFlush(
                    SerialRecord.available(serialNumber, productId)));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateSerialException(List.of(serialNumber), e);
        }
    }

    /**
     * Insert a batch of AVAILABLE serials atomically: either every row is
     * written or none is.
     *
     * @throws DuplicateSerialException if any serial violates uniqueness (nothing is written)
     */
    public List<SerialRecord> insertAllAvailable(List<String> serialNumbers, Long productId) {
        try {
            // saveAllAndFlush runs in a single transaction
            return withRetry("insert_batch", () -> serialRecordRepository.saveAllAndFlush(
                    availableRecords(serialNumbers, productId)));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateSerialException(serialNumbers, e);
        }
    }

    public Optional<SerialRecord> lookupBySerial(String serialNumber) {
        return withRetry("lookup", () -> serialRecordRepository.findBySerialNumber(serialNumber));
    }

    /**
     * Which of the given serials already exist in the ledger (any product).
     * Queried in bounded chunks to keep IN lists within database limits.
     */
    public Set<String> findExisting(Collection<String> serialNumbers) {
        Set<String> existing = new HashSet<>();
        List<String> chunk = new ArrayList<>(Math.min(existenceCheckChunkSize, serialNumbers.size()));
        for (String serialNumber : serialNumbers) {
            chunk.add(serialNumber);
            if (chunk.size() == existenceCheckChunkSize) {
                existing.addAll(findExistingChunk(chunk));
                chunk = new ArrayList<>(existenceCheckChunkSize);
            }
        }
        if (!chunk.isEmpty()) {
            existing.addAll(findExistingChunk(chunk));
        }
        return existing;
    }

    public LedgerCounts countsByProduct(Long productId) {
        return withRetry("counts", () -> serialRecordRepository.countsByProduct(productId, SerialStatus.REGISTERED));
    }

    public LedgerCounts countsOverall() {
        return withRetry("counts", () -> serialRecordRepository.countsOverall(SerialStatus.REGISTERED));
    }

    public long countByProduct(Long productId) {
        return withRetry("count", () -> serialRecordRepository.countByProductId(productId));
    }

    public List<SerialRecord> findByOwner(String ownerId) {
        return withRetry("find_by_owner", () -> serialRecordRepository.findByOwnerIdOrderByRegisteredAtDesc(ownerId));
    }

    public Page<SerialRecord> findByProduct(Long productId, Pageable pageable) {
        return withRetry("find_by_product", () -> serialRecordRepository.findByProductId(productId, pageable));
    }

    private List<String> findExistingChunk(List<String> chunk) {
        return withRetry("exists", () -> serialRecordRepository.findExistingSerialNumbers(chunk));
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        TransientDataAccessException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (TransientDataAccessException e) {
                lastFailure = e;
                if (attempt == maxAttempts) {
                    break;
                }
                logger.warn("Transient failure on ledger {} (attempt {}/{}): {}",
                        operation, attempt, maxAttempts, e.getMessage());
                metricsService.recordLedgerRetry(operation);
                if (!pause(attempt)) {
                    break;
                }
            }
        }
        logger.error("Ledger {} failed after {} attempt(s)", operation, maxAttempts, lastFailure);
        metricsService.recordError("LEDGER_UNAVAILABLE", operation);
        throw new LedgerUnavailableException(operation, maxAttempts, lastFailure);
    }

    private boolean pause(int attempt) {
        if (backoffMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(backoffMs * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while backing off ledger retry");
            return false;
        }
    }

    private Instant now() {
        // Stored timestamps have microsecond precision
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static List<SerialRecord> availableRecords(List<String> serialNumbers, Long productId) {
        List<SerialRecord> records = new ArrayList<>(serialNumbers.size());
        for (String serialNumber : serialNumbers) {
            records.add(SerialRecord.available(serialNumber, productId));
        }
        return records;
    }
}
