package com.cred.freestyle.warranty.api.controller;

import com.cred.freestyle.warranty.api.dto.AuditEntryResponse;
import com.cred.freestyle.warranty.api.dto.PageResponse;
import com.cred.freestyle.warranty.service.AuditLogQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin audit log listing, newest first.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1/admin/audit-logs")
@PreAuthorize("hasRole('ADMIN')")
public class AuditLogController {

    private final AuditLogQueryService auditLogQueryService;

    public AuditLogController(AuditLogQueryService auditLogQueryService) {
        this.auditLogQueryService = auditLogQueryService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<AuditEntryResponse>> getAuditLogs(
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String targetType,
            @RequestParam(required = false) String actor,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PageResponse.fromPage(
                auditLogQueryService.search(action, targetType, actor, page, size), AuditEntryResponse::fromEntity));
    }
}
