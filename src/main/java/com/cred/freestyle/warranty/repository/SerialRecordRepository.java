package com.cred.freestyle.warranty.repository;

import com.cred.freestyle.warranty.domain.model.LedgerCounts;
import com.cred.freestyle.warranty.domain.model.SerialRecord;
import com.cred.freestyle.warranty.domain.model.SerialRecord.SerialStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for SerialRecord entity.
 *
 * State transitions are single conditional UPDATE statements: the WHERE
 * clause carries the expected current state and the affected row count
 * (0 or 1) decides whether the transition happened. Concurrent claims on
 * the same serial are serialized by the database row lock, so at most one
 * of them observes a row count of 1.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface SerialRecordRepository extends JpaRepository<SerialRecord, String> {

    /**
     * Find a ledger entry by its normalized serial number.
     *
     * @param serialNumber Normalized serial number
     * @return Optional containing the record if it exists
     */
    Optional<SerialRecord> findBySerialNumber(String serialNumber);

    /**
     * Find all serials registered to a user, most recent first.
     *
     * @param ownerId Owner user ID
     * @return Registered serials
     */
    List<SerialRecord> findByOwnerIdOrderByRegisteredAtDesc(String ownerId);

    /**
     * Page through the serials imported for a product.
     *
     * @param productId Product ID
     * @param pageable Page request
     * @return Page of records
     */
    Page<SerialRecord> findByProductId(Long productId, Pageable pageable);

    long countByProductId(Long productId);

    /**
     * Return which of the given serial numbers already exist, regardless of product.
     *
     * @param serialNumbers Normalized serial numbers (caller bounds the list size)
     * @return Existing serial numbers
     */
    @Query("SELECT s.serialNumber FROM SerialRecord s WHERE s.serialNumber IN :serialNumbers")
    List<String> findExistingSerialNumbers(@Param("serialNumbers") Collection<String> serialNumbers);

    /**
     * Uploaded and assigned totals for one product, read in a single statement.
     */
    @Query("SELECT new com.cred.freestyle.warranty.domain.model.LedgerCounts(" +
           "COUNT(s), SUM(CASE WHEN s.status = :registered THEN 1 ELSE 0 END)) " +
           "FROM SerialRecord s WHERE s.productId = :productId")
    LedgerCounts countsByProduct(@Param("productId") Long productId,
                                 @Param("registered") SerialStatus registered);

    /**
     * Uploaded and assigned totals across the whole ledger.
     */
    @Query("SELECT new com.cred.freestyle.warranty.domain.model.LedgerCounts(" +
           "COUNT(s), SUM(CASE WHEN s.status = :registered THEN 1 ELSE 0 END)) " +
           "FROM SerialRecord s")
    LedgerCounts countsOverall(@Param("registered") SerialStatus registered);

    /**
     * Claim an AVAILABLE serial for a user.
     * Returns 1 only if the row was AVAILABLE at the moment of the update.
     *
     * @return Number of rows updated (0 or 1)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SerialRecord s SET s.status = :registered, s.ownerId = :ownerId, " +
           "s.registeredAt = :registeredAt, s.evidenceReference = :evidenceReference, " +
           "s.updatedAt = :registeredAt " +
           "WHERE s.serialNumber = :serialNumber AND s.status = :available")
    int claimIfAvailable(@Param("serialNumber") String serialNumber,
                         @Param("ownerId") String ownerId,
                         @Param("evidenceReference") String evidenceReference,
                         @Param("registeredAt") Instant registeredAt,
                         @Param("available") SerialStatus available,
                         @Param("registered") SerialStatus registered);

    /**
     * Release a registration, but only if it is still exactly the registration
     * the caller observed (same owner, same registration time).
     *
     * @return Number of rows updated (0 or 1)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SerialRecord s SET s.status = :available, s.ownerId = NULL, " +
           "s.registeredAt = NULL, s.evidenceReference = NULL, s.updatedAt = :releasedAt " +
           "WHERE s.serialNumber = :serialNumber AND s.status = :registered " +
           "AND s.ownerId = :ownerId AND s.registeredAt = :registeredAt")
    int releaseIfRegistered(@Param("serialNumber") String serialNumber,
                            @Param("ownerId") String ownerId,
                            @Param("registeredAt") Instant registeredAt,
                            @Param("releasedAt") Instant releasedAt,
                            @Param("available") SerialStatus available,
                            @Param("registered") SerialStatus registered);
}
