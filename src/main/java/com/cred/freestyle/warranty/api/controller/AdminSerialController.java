package com.cred.freestyle.warranty.api.controller;

import com.cred.freestyle.warranty.api.dto.BulkImportRequest;
import com.cred.freestyle.warranty.api.dto.BulkImportResponse;
import com.cred.freestyle.warranty.api.dto.DisassociationResponse;
import com.cred.freestyle.warranty.api.dto.PageResponse;
import com.cred.freestyle.warranty.api.dto.SerialRecordResponse;
import com.cred.freestyle.warranty.domain.model.BulkImportResult;
import com.cred.freestyle.warranty.domain.model.EvidenceFile;
import com.cred.freestyle.warranty.domain.model.ReleasedSerial;
import com.cred.freestyle.warranty.exception.InvalidImportFileException;
import com.cred.freestyle.warranty.security.SecurityUtils;
import com.cred.freestyle.warranty.service.BulkImportService;
import com.cred.freestyle.warranty.service.ProductService;
import com.cred.freestyle.warranty.service.SerialCsvParser;
import com.cred.freestyle.warranty.service.SerialRegistrationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * Admin REST controller for the serial ledger.
 * Handles bulk imports, listings, disassociation and bill downloads.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminSerialController {

    private static final Logger logger = LoggerFactory.getLogger(AdminSerialController.class);

    private final BulkImportService bulkImportService;
    private final SerialCsvParser csvParser;
    private final SerialRegistrationService registrationService;
    private final ProductService productService;

    public AdminSerialController(
            BulkImportService bulkImportService,
            SerialCsvParser csvParser,
            SerialRegistrationService registrationService,
            ProductService productService
    ) {
        this.bulkImportService = bulkImportService;
        this.csvParser = csvParser;
        this.registrationService = registrationService;
        this.productService = productService;
    }

    /**
     * Import serial numbers from a CSV file. The first column of each line is
     * read and the first non-empty line is treated as a header.
     *
     * @param productId Target product
     * @param file CSV file
     * @return Import result (201 all added, 207 partial, 409 nothing added, 200 empty)
     */
    @PostMapping(value = "/products/{productId}/serials/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BulkImportResponse> uploadSerials(
            @PathVariable Long productId,
            @RequestPart("file") MultipartFile file
    ) {
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new InvalidImportFileException("Only .csv files are accepted");
        }

        List<String> candidates;
        try (InputStream input = file.getInputStream()) {
            candidates = csvParser.parse(input);
        } catch (IOException e) {
            throw new InvalidImportFileException("The uploaded file could not be read", e);
        }

        logger.info("CSV import of {} candidate(s) for product {} from {}", candidates.size(), productId, filename);
        return toResponse(bulkImportService.importSerials(productId, candidates, SecurityUtils.currentActor()));
    }

    /**
     * Import serial numbers from a JSON list.
     */
    @PostMapping(value = "/products/{productId}/serials", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BulkImportResponse> importSerials(
            @PathVariable Long productId,
            @Valid @RequestBody BulkImportRequest request
    ) {
        logger.info("JSON import of {} candidate(s) for product {}", request.getSerialNumbers().size(), productId);
        return toResponse(bulkImportService.importSerials(
                productId, request.getSerialNumbers(), SecurityUtils.currentActor()));
    }

    @GetMapping("/products/{productId}/serials")
    public ResponseEntity<PageResponse<SerialRecordResponse>> listSerials(
            @PathVariable Long productId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size
    ) {
        return ResponseEntity.ok(PageResponse.fromPage(
                productService.listSerials(productId, page, size), SerialRecordResponse::fromEntity));
    }

    /**
     * Release a serial from the named user back to AVAILABLE.
     *
     * @param userId User the serial is expected to be registered to
     * @param serialNumber Serial number
     * @return Who the serial was released from
     */
    @DeleteMapping("/users/{userId}/serials/{serialNumber}")
    public ResponseEntity<DisassociationResponse> disassociateSerial(
            @PathVariable String userId,
            @PathVariable String serialNumber
    ) {
        String actor = SecurityUtils.currentActor();
        logger.info("Admin {} disassociating serial {} from user {}", actor, serialNumber, userId);

        ReleasedSerial released = registrationService.disassociateSerial(serialNumber, userId, actor);
        return ResponseEntity.ok(DisassociationResponse.fromReleased(released));
    }

    /**
     * Download the bill attached to a registered serial.
     */
    @GetMapping("/serials/{serialNumber}/bill")
    public ResponseEntity<byte[]> downloadBill(@PathVariable String serialNumber) {
        EvidenceFile bill = registrationService.loadEvidence(serialNumber);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(bill.getContentType()));
        headers.setContentDisposition(ContentDisposition.attachment().filename(bill.getOriginalFilename()).build());
        headers.setContentLength(bill.getSize());

        return new ResponseEntity<>(bill.getContent(), headers, HttpStatus.OK);
    }

    private static ResponseEntity<BulkImportResponse> toResponse(BulkImportResult result) {
        HttpStatus status;
        if (result.isEmpty()) {
            status = HttpStatus.OK;
        } else if (!result.hasProblems()) {
            status = HttpStatus.CREATED;
        } else if (result.getAddedCount() > 0) {
            status = HttpStatus.MULTI_STATUS;
        } else {
            status = HttpStatus.CONFLICT;
        }
        return ResponseEntity.status(status).body(BulkImportResponse.fromResult(result));
    }
}
