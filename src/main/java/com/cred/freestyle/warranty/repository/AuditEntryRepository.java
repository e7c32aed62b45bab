package com.cred.freestyle.warranty.repository;

import com.cred.freestyle.warranty.domain.model.AuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for AuditEntry entity. Entries are only ever inserted and read.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntry, String>,
        JpaSpecificationExecutor<AuditEntry> {

    /**
     * Full history of one target, newest first.
     *
     * @param targetType Target type (e.g. "SerialNumber", "Product")
     * @param targetId Target identifier
     * @return Audit entries
     */
    List<AuditEntry> findByTargetTypeAndTargetIdOrderByOccurredAtDesc(String targetType, String targetId);
}
