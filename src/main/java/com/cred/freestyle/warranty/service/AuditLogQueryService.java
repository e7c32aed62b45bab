package com.cred.freestyle.warranty.service;

import com.cred.freestyle.warranty.domain.model.AuditEntry;
import com.cred.freestyle.warranty.repository.AuditEntryRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Read side of the audit trail for administrators.
 *
 * @author Warranty Platform Team
 */
@Service
public class AuditLogQueryService {

    public static final int MAX_PAGE_SIZE = 100;

    private final AuditEntryRepository auditEntryRepository;

    public AuditLogQueryService(AuditEntryRepository auditEntryRepository) {
        this.auditEntryRepository = auditEntryRepository;
    }

    /**
     * Search audit entries, newest first. Filters are case-insensitive
     * substring matches and are ignored when blank.
     *
     * @param action Action filter
     * @param targetType Target type filter
     * @param actor Actor filter
     * @param page Zero-based page
     * @param size Page size (capped at {@value #MAX_PAGE_SIZE})
     * @return Page of entries
     */
    @Transactional(readOnly = true)
    public Page<AuditEntry> search(String action, String targetType, String actor, int page, int size) {
        int pageSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        PageRequest pageRequest = PageRequest.of(Math.max(page, 0), pageSize, Sort.by(Sort.Direction.DESC, "occurredAt"));

        Specification<AuditEntry> criteria = Specification.where(contains("action", action))
                .and(contains("targetType", targetType))
                .and(contains("actor", actor));

        return auditEntryRepository.findAll(criteria, pageRequest);
    }

    private static Specification<AuditEntry> contains(String attribute, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String pattern = "%" + value.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.get(attribute)), pattern);
    }
}
